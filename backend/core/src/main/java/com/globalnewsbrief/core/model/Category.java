package com.globalnewsbrief.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public enum Category {
    POLITICS("politics"),
    ECONOMY("economy"),
    BUSINESS("business"),
    TECHNOLOGY("technology"),
    SCIENCE("science"),
    HEALTH("health"),
    SPORTS("sports"),
    ENTERTAINMENT("entertainment"),
    ENVIRONMENT("environment"),
    WORLD("world");

    public static final Category DEFAULT = WORLD;

    private static final Map<String, Category> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Category::value, Function.identity()));

    private final String value;

    Category(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Case-sensitive lookup by wire value.
     */
    public static Optional<Category> lookup(String value) {
        return value == null ? Optional.empty() : Optional.ofNullable(BY_VALUE.get(value));
    }

    @JsonCreator
    public static Category fromValue(String value) {
        return lookup(value).orElseThrow(() -> new IllegalArgumentException("Unknown category: " + value));
    }
}
