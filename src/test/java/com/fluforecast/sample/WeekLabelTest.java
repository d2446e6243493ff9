package com.fluforecast.sample;

import com.fluforecast.exception.InvalidArgumentException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WeekLabelTest {

    @Test
    void next_withinYear() {
        assertThat(new WeekLabel(2024, 10).next()).isEqualTo(new WeekLabel(2024, 11));
    }

    @Test
    void next_rollsOverAfterWeek52() {
        assertThat(new WeekLabel(2025, 52).next()).isEqualTo(new WeekLabel(2026, 1));
    }

    @Test
    void next_isoYearWith53Weeks() {
        assertThat(new WeekLabel(2020, 52).next()).isEqualTo(new WeekLabel(2020, 53));
        assertThat(new WeekLabel(2020, 53).next()).isEqualTo(new WeekLabel(2021, 1));
    }

    @Test
    void following_returnsConsecutiveLabels() {
        assertThat(new WeekLabel(2025, 51).following(3))
            .containsExactly(new WeekLabel(2025, 52), new WeekLabel(2026, 1), new WeekLabel(2026, 2));
    }

    @Test
    void constructor_rejectsWeekOutsideIsoYear() {
        assertThatThrownBy(() -> new WeekLabel(2025, 53)).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> new WeekLabel(2025, 0)).isInstanceOf(InvalidArgumentException.class);
    }
}
