package com.shinobi.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Task priority. Serialized by label, stored by level.
 */
public enum TaskPriority {
    LOW(1, "low"),
    MEDIUM(2, "medium"),
    HIGH(3, "high");

    private static final String LEVEL_MESSAGE = "Input should be 1, 2 or 3";

    private final int level;
    private final String label;

    TaskPriority(int level, String label) {
        this.level = level;
        this.label = label;
    }

    public int getLevel() {
        return level;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static TaskPriority fromLevel(int level) {
        return Arrays.stream(values())
                .filter(priority -> priority.level == level)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(LEVEL_MESSAGE));
    }

    /**
     * Accepts either the label ({@code "high"}) or the level ({@code 3}).
     */
    @JsonCreator
    public static TaskPriority from(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Number number) {
            double level = number.doubleValue();
            if (level != Math.rint(level) || level < LOW.level || level > HIGH.level) {
                throw new IllegalArgumentException(LEVEL_MESSAGE);
            }
            return fromLevel(number.intValue());
        }
        String value = raw.toString().trim().toLowerCase();
        if (!value.isEmpty() && value.chars().allMatch(java.lang.Character::isDigit)) {
            if (value.length() != 1) {
                throw new IllegalArgumentException(LEVEL_MESSAGE);
            }
            return fromLevel(value.charAt(0) - '0');
        }
        return Arrays.stream(values())
                .filter(priority -> priority.label.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Input should be 'low', 'medium' or 'high'"));
    }
}
