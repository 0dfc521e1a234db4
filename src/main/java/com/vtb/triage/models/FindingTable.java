package com.vtb.triage.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Полностью загруженная в память таблица находок.
 * Загрузку с диска выполняет внешний компонент, сюда приходит уже готовая схема и строки.
 */
public final class FindingTable {

    private final List<String> columns;
    private final List<FindingRecord> records;

    private FindingTable(List<String> columns, List<FindingRecord> records) {
        this.columns = Collections.unmodifiableList(columns);
        this.records = Collections.unmodifiableList(records);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<FindingRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<String> columns = new LinkedHashSet<>();
        private final List<Map<String, String>> rows = new ArrayList<>();

        public Builder columns(String... names) {
            for (String name : names) {
                columns.add(Objects.requireNonNull(name, "column"));
            }
            return this;
        }

        public Builder columns(List<String> names) {
            return columns(names.toArray(new String[0]));
        }

        /**
         * Добавить строку. Колонки, которых нет в схеме, добавляются в конец схемы.
         */
        public Builder row(Map<String, String> values) {
            Objects.requireNonNull(values, "values");
            columns.addAll(values.keySet());
            rows.add(values);
            return this;
        }

        public FindingTable build() {
            List<String> schema = new ArrayList<>(columns);
            List<FindingRecord> records = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                records.add(new FindingRecord(i + 1, rows.get(i)));
            }
            return new FindingTable(schema, records);
        }
    }
}
