package com.vtb.triage.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Одна строка исходной таблицы находок.
 * Значения хранятся как есть: нормализация выполняется только для сопоставления и подсчета.
 */
public final class FindingRecord {

    private final int rowNumber;
    private final Map<String, String> values;

    public FindingRecord(int rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }

    public int getRowNumber() {
        return rowNumber;
    }

    /**
     * Сырые значения строки в порядке колонок исходной таблицы
     */
    public Map<String, String> getValues() {
        return values;
    }

    /**
     * Значение колонки или null, если колонки нет либо значение отсутствует
     */
    public String get(String column) {
        if (column == null) {
            return null;
        }
        return values.get(column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FindingRecord other)) {
            return false;
        }
        return rowNumber == other.rowNumber && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, values);
    }

    @Override
    public String toString() {
        return "FindingRecord{row=" + rowNumber + ", values=" + values + "}";
    }
}
