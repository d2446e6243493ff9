package com.fluforecast.sample;

import com.fluforecast.exception.InvalidArgumentException;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;

/**
 * (year, week) label of a weekly observation. Rollover follows ISO week-based years, so
 * a year has 52 or 53 weeks.
 */
public record WeekLabel(int year, int week) {

    public WeekLabel {
        if (week < 1 || week > weeksIn(year)) {
            throw new InvalidArgumentException("week " + week + " is out of range for year " + year);
        }
    }

    public WeekLabel next() {
        return week < weeksIn(year) ? new WeekLabel(year, week + 1) : new WeekLabel(year + 1, 1);
    }

    public List<WeekLabel> following(int count) {
        List<WeekLabel> labels = new ArrayList<>(count);
        WeekLabel current = this;
        for (int i = 0; i < count; i++) {
            current = current.next();
            labels.add(current);
        }
        return labels;
    }

    static int weeksIn(int year) {
        return (int) IsoFields.WEEK_OF_WEEK_BASED_YEAR
            .rangeRefinedBy(LocalDate.of(year, 6, 1))
            .getMaximum();
    }
}
