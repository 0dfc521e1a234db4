package com.vtb.triage.models;

import lombok.Builder;
import lombok.Data;

/**
 * Находка после нормализации: поля для сопоставления в нижнем регистре,
 * отсутствующие значения заменены пустой строкой, критичность приведена к таксономии.
 */
@Data
@Builder
public class NormalizedRecord {

    /** Исходная строка (для экспорта в исходной схеме) */
    private FindingRecord source;

    @Builder.Default
    private String assetName = "";
    @Builder.Default
    private String locationPath = "";
    @Builder.Default
    private String subscription = "";

    /** Уровень таксономии; null только для сквозной (нераспознанной) категории */
    private SeverityLevel severity;
    /** Метка для отчета: каноническое название уровня либо Title Case нераспознанного значения */
    private String severityLabel;
    /** Значение критичности из исходной строки (обрезанное), null если отсутствует */
    private String rawSeverity;
    /** false, если значение не распознано (в т.ч. свернуто в None политикой профиля) */
    @Builder.Default
    private boolean severityRecognized = true;

    private boolean exploitKnown;

    /** Возраст находки в днях, null если дата обнаружения неизвестна */
    private Long ageDays;

    public boolean isPassThrough() {
        return severity == null;
    }
}
