package com.fluforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fluforecast.exception.InvalidArgumentException;

public enum ModelType {
    ARIMA("ARIMA"),
    MOVING_AVERAGE("MovingAverage");

    private final String label;

    ModelType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ModelType fromLabel(String label) {
        for (ModelType type : values()) {
            if (type.label.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new InvalidArgumentException("Unknown model type: " + label);
    }
}
