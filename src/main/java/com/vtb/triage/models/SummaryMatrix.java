package com.vtb.triage.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Итоговая матрица для внешнего рендера/экспорта:
 * строки = уровни критичности + Total, колонки = Total + группы профиля.
 */
@Data
@Builder
public class SummaryMatrix {

    private String profileName;

    @Builder.Default
    private List<Column> columns = new ArrayList<>();

    @Builder.Default
    private List<Row> rows = new ArrayList<>();

    public List<String> columnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.name());
        }
        return names;
    }

    public Optional<Row> row(String label) {
        return rows.stream().filter(r -> r.getLabel().equals(label)).findFirst();
    }

    public long cell(String rowLabel, String column) {
        return row(rowLabel)
            .map(r -> r.getCells().getOrDefault(column, 0L))
            .orElseThrow(() -> new IllegalArgumentException("Нет строки в матрице: " + rowLabel));
    }

    /**
     * Подсчет эксплойтов в ячейке; пусто, если для этой строки/колонки подколонка не ведется
     */
    public Optional<Long> exploitCell(String rowLabel, String column) {
        return row(rowLabel).map(r -> r.getExploitCells().get(column));
    }

    /**
     * @param exploitSubColumn есть ли у колонки подколонка эксплойтов (строки Critical/High)
     */
    public record Column(String name, boolean exploitSubColumn) {}

    public enum RowKind {
        SEVERITY,
        PASS_THROUGH,
        TOTAL
    }

    @Data
    @Builder
    public static class Row {
        private String label;
        private RowKind kind;
        /** Уровень таксономии, null для сквозных категорий и строки Total */
        private SeverityLevel level;
        @Builder.Default
        private Map<String, Long> cells = new LinkedHashMap<>();
        @Builder.Default
        private Map<String, Long> exploitCells = new LinkedHashMap<>();
    }
}
