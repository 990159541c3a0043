package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Region {
    USA("usa"),
    INDIA("india"),
    WORLD("world");

    private final String value;

    Region(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Region fromValue(String value) {
        return Arrays.stream(values())
                .filter(region -> region.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown region: " + value));
    }
}
