package com.vtb.triage.normalize;

import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.FindingRecord;
import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.validation.ResolvedFields;

import java.util.Locale;
import java.util.Set;

/**
 * Нормализация строки таблицы для сопоставления и подсчета. Исходная строка не изменяется.
 */
public class RecordNormalizer {

    private static final Set<String> EXPLOIT_TRUE_VALUES = Set.of("yes", "true");

    private final SeverityNormalizer severityNormalizer;
    private final AgeCalculator ageCalculator;

    public RecordNormalizer(SeverityNormalizer severityNormalizer, AgeCalculator ageCalculator) {
        this.severityNormalizer = severityNormalizer;
        this.ageCalculator = ageCalculator;
    }

    public NormalizedRecord normalize(FindingRecord record, ResolvedFields fields) {
        String rawSeverity = fields.valueOf(record, FindingField.SEVERITY);
        SeverityResolution severity = severityNormalizer.normalize(rawSeverity);

        Long age = null;
        if (ageCalculator != null && fields.has(FindingField.FIRST_DETECTED)) {
            age = ageCalculator.ageInDays(
                fields.valueOf(record, FindingField.FIRST_DETECTED),
                fields.valueOf(record, FindingField.RESOLVED_AT),
                fields.valueOf(record, FindingField.FINDING_STATUS));
        }

        return NormalizedRecord.builder()
            .source(record)
            .assetName(matchable(fields.valueOf(record, FindingField.ASSET_NAME)))
            .locationPath(matchable(fields.valueOf(record, FindingField.LOCATION_PATH)))
            .subscription(matchable(fields.valueOf(record, FindingField.SUBSCRIPTION)))
            .severity(severity.level())
            .severityLabel(severity.label())
            .rawSeverity(rawSeverity == null ? null : rawSeverity.trim())
            .severityRecognized(severity.recognized())
            .exploitKnown(isExploitKnown(fields.valueOf(record, FindingField.EXPLOIT_FLAG)))
            .ageDays(age)
            .build();
    }

    /**
     * Текст для сопоставления: обрезан, в нижнем регистре, отсутствие = ""
     */
    static String matchable(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    static boolean isExploitKnown(String value) {
        return value != null && EXPLOIT_TRUE_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
