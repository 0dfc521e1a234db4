package com.vtb.triage.reports;

import com.vtb.triage.classification.Profile;
import com.vtb.triage.models.GroupSummary;
import com.vtb.triage.models.SeverityBreakdown;
import com.vtb.triage.models.SeverityLevel;
import com.vtb.triage.models.SummaryMatrix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сборка сводной матрицы фиксированной формы.
 * Строки: Critical, High, Medium, Low, None, нераспознанные категории, Total.
 * Колонки: Total, затем группы в порядке отображения профиля.
 * Рендер и сохранение выполняются снаружи.
 */
public class ReportComposer {

    public SummaryMatrix compose(SeverityBreakdown breakdown, Profile profile) {
        if (breakdown == null || profile == null) {
            throw new IllegalArgumentException("breakdown и profile обязательны");
        }
        if (breakdown.getTotal() == null) {
            throw new IllegalArgumentException("В сводке нет итоговой строки Total");
        }

        List<SummaryMatrix.Column> columns = new ArrayList<>();
        columns.add(new SummaryMatrix.Column(GroupSummary.TOTAL, false));
        for (String group : profile.getDisplayOrder()) {
            columns.add(new SummaryMatrix.Column(group, profile.tracksExploits(group)));
        }

        List<SummaryMatrix.Row> rows = new ArrayList<>();
        for (SeverityLevel level : SeverityLevel.values()) {
            rows.add(severityRow(level, breakdown, columns));
        }
        for (String label : passThroughLabels(breakdown)) {
            rows.add(passThroughRow(label, breakdown, columns));
        }
        rows.add(totalRow(breakdown, columns));

        return SummaryMatrix.builder()
            .profileName(profile.getName())
            .columns(columns)
            .rows(rows)
            .build();
    }

    private SummaryMatrix.Row severityRow(SeverityLevel level, SeverityBreakdown breakdown,
                                          List<SummaryMatrix.Column> columns) {
        Map<String, Long> cells = new LinkedHashMap<>();
        Map<String, Long> exploitCells = new LinkedHashMap<>();
        for (SummaryMatrix.Column column : columns) {
            GroupSummary summary = summaryFor(column.name(), breakdown);
            cells.put(column.name(), summary.count(level));
            if (column.exploitSubColumn() && level.isExploitTracked()) {
                exploitCells.put(column.name(), summary.exploitCount(level));
            }
        }
        return SummaryMatrix.Row.builder()
            .label(level.getLabel())
            .kind(SummaryMatrix.RowKind.SEVERITY)
            .level(level)
            .cells(cells)
            .exploitCells(exploitCells)
            .build();
    }

    private SummaryMatrix.Row passThroughRow(String label, SeverityBreakdown breakdown,
                                             List<SummaryMatrix.Column> columns) {
        Map<String, Long> cells = new LinkedHashMap<>();
        for (SummaryMatrix.Column column : columns) {
            cells.put(column.name(), summaryFor(column.name(), breakdown).passThroughCount(label));
        }
        return SummaryMatrix.Row.builder()
            .label(label)
            .kind(SummaryMatrix.RowKind.PASS_THROUGH)
            .cells(cells)
            .build();
    }

    private SummaryMatrix.Row totalRow(SeverityBreakdown breakdown, List<SummaryMatrix.Column> columns) {
        Map<String, Long> cells = new LinkedHashMap<>();
        for (SummaryMatrix.Column column : columns) {
            cells.put(column.name(), summaryFor(column.name(), breakdown).getTotal());
        }
        return SummaryMatrix.Row.builder()
            .label(GroupSummary.TOTAL)
            .kind(SummaryMatrix.RowKind.TOTAL)
            .cells(cells)
            .build();
    }

    private static GroupSummary summaryFor(String column, SeverityBreakdown breakdown) {
        if (GroupSummary.TOTAL.equals(column)) {
            return breakdown.getTotal();
        }
        return breakdown.group(column);
    }

    private static Set<String> passThroughLabels(SeverityBreakdown breakdown) {
        return new LinkedHashSet<>(breakdown.getTotal().getPassThroughCounts().keySet());
    }
}
