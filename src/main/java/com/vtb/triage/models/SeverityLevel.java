package com.vtb.triage.models;

import java.util.Locale;

/**
 * Уровни критичности находок (порядок констант = порядок отображения)
 */
public enum SeverityLevel {
    CRITICAL("Critical"),
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low"),
    NONE("None");

    private final String label;

    SeverityLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Уровни, для которых считается подсчет находок с известным эксплойтом
     */
    public boolean isExploitTracked() {
        return this == CRITICAL || this == HIGH;
    }

    /**
     * Точное совпадение с каноническим названием (без учета регистра), иначе null
     */
    public static SeverityLevel fromLabel(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SeverityLevel level : values()) {
            if (level.label.toLowerCase(Locale.ROOT).equals(normalized)) {
                return level;
            }
        }
        return null;
    }
}
