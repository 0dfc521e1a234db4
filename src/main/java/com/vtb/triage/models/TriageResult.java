package com.vtb.triage.models;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Результат прогона: разбиение, сводки и матрица для внешних писателей
 */
@Data
@Builder
public class TriageResult {

    private String profileName;
    private LocalDateTime generatedAt;
    private int totalRecords;

    /** Нормализованные записи по группам (все группы профиля, включая пустые) */
    @Builder.Default
    private Map<String, List<NormalizedRecord>> groups = new LinkedHashMap<>();

    private SeverityBreakdown breakdown;
    private SummaryMatrix matrix;

    @Builder.Default
    private List<TriageDiagnostic> diagnostics = new ArrayList<>();

    /**
     * Исходные строки группы в исходной схеме, без изменений
     */
    public List<FindingRecord> recordsOf(String group) {
        List<NormalizedRecord> normalized = groups.get(group);
        if (normalized == null) {
            throw new IllegalArgumentException("Группа не входит в профиль " + profileName + ": " + group);
        }
        List<FindingRecord> raw = new ArrayList<>(normalized.size());
        for (NormalizedRecord record : normalized) {
            raw.add(record.getSource());
        }
        return raw;
    }

    public int groupSize(String group) {
        List<NormalizedRecord> normalized = groups.get(group);
        return normalized == null ? 0 : normalized.size();
    }
}
