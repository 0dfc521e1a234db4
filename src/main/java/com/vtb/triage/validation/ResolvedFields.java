package com.vtb.triage.validation;

import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.FindingRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Соответствие логических полей фактическим колонкам конкретной таблицы
 */
public final class ResolvedFields {

    private final Map<FindingField, String> columns;

    ResolvedFields(Map<FindingField, String> columns) {
        this.columns = Collections.unmodifiableMap(new EnumMap<>(columns));
    }

    public static ResolvedFields of(Map<FindingField, String> columns) {
        EnumMap<FindingField, String> copy = new EnumMap<>(FindingField.class);
        copy.putAll(columns);
        return new ResolvedFields(copy);
    }

    /**
     * Имя колонки или null, если необязательное поле в таблице отсутствует
     */
    public String column(FindingField field) {
        return columns.get(field);
    }

    public boolean has(FindingField field) {
        return columns.containsKey(field);
    }

    public String valueOf(FindingRecord record, FindingField field) {
        String column = columns.get(field);
        return column == null ? null : record.get(column);
    }

    @Override
    public String toString() {
        return "ResolvedFields" + columns;
    }
}
