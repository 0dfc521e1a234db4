package com.vtb.triage.core;

import com.vtb.triage.aggregation.SeverityAggregator;
import com.vtb.triage.classification.ClassificationEngine;
import com.vtb.triage.classification.Profile;
import com.vtb.triage.classification.ProfileFactory;
import com.vtb.triage.classification.RecordField;
import com.vtb.triage.classification.RuleOverlapDetector;
import com.vtb.triage.config.TriageConfig;
import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.FindingRecord;
import com.vtb.triage.models.FindingTable;
import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.models.SeverityBreakdown;
import com.vtb.triage.models.SummaryMatrix;
import com.vtb.triage.models.TriageDiagnostic;
import com.vtb.triage.models.TriageResult;
import com.vtb.triage.normalize.AgeCalculator;
import com.vtb.triage.normalize.RecordNormalizer;
import com.vtb.triage.normalize.SeverityNormalizer;
import com.vtb.triage.reports.ReportComposer;
import com.vtb.triage.validation.ResolvedFields;
import com.vtb.triage.validation.SchemaValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Главный движок триажа.
 * Проверка схемы -> нормализация -> классификация -> подсчет -> сводная матрица.
 * Ошибки не перехватываются: сообщение и код выхода - забота вызывающего слоя.
 */
@Slf4j
public class TriageEngine {

    private final TriageConfig config;
    private final Clock clock;

    private final SchemaValidator validator;
    private final ClassificationEngine classifier = new ClassificationEngine();
    private final RuleOverlapDetector overlapDetector = new RuleOverlapDetector();
    private final SeverityAggregator aggregator = new SeverityAggregator();
    private final ReportComposer composer = new ReportComposer();

    public TriageEngine() {
        this(TriageConfig.load(), Clock.systemUTC());
    }

    public TriageEngine(TriageConfig config) {
        this(config, Clock.systemUTC());
    }

    public TriageEngine(TriageConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("TriageConfig не может быть null");
        }
        this.config = config;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.validator = new SchemaValidator(config.getFields());
    }

    /**
     * Прогон с профилем из конфигурации
     */
    public TriageResult run(FindingTable table, String profileName) {
        return run(table, ProfileFactory.fromConfig(config, profileName));
    }

    public TriageResult run(FindingTable table, Profile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("Profile не может быть null");
        }
        log.info("=== Начало триажа: профиль {} ===", profile.getName());

        ResolvedFields fields = validator.validate(table, requiredBy(profile));
        log.info("Записей: {}, колонок: {}", table.size(), table.getColumns().size());

        List<NormalizedRecord> normalized = normalize(table, fields, profile);
        List<TriageDiagnostic> diagnostics = new ArrayList<>(unrecognizedSeverities(normalized));

        if (config.overlapDetectionEnabled()) {
            diagnostics.addAll(overlapDetector.detect(profile, normalized));
        }

        Map<String, List<NormalizedRecord>> groups = classifier.partition(normalized, profile);
        SeverityBreakdown breakdown = aggregator.aggregate(groups, table.size());
        SummaryMatrix matrix = composer.compose(breakdown, profile);

        groups.forEach((group, records) -> log.info("Группа {}: {} записей", group, records.size()));
        log.info("=== Триаж завершен: {} записей, замечаний: {} ===", table.size(), diagnostics.size());

        return TriageResult.builder()
            .profileName(profile.getName())
            .generatedAt(LocalDateTime.now(clock))
            .totalRecords(table.size())
            .groups(groups)
            .breakdown(breakdown)
            .matrix(matrix)
            .diagnostics(diagnostics)
            .build();
    }

    private static Set<FindingField> requiredBy(Profile profile) {
        Set<FindingField> required = EnumSet.noneOf(FindingField.class);
        for (RecordField field : profile.getReferencedFields()) {
            required.add(field.getSource());
        }
        return required;
    }

    private List<NormalizedRecord> normalize(FindingTable table, ResolvedFields fields, Profile profile) {
        SeverityNormalizer severityNormalizer = new SeverityNormalizer(
            config.getSeverity().getNoneSynonyms(), profile.getUnrecognizedSeverityPolicy());
        RecordNormalizer normalizer = new RecordNormalizer(severityNormalizer, new AgeCalculator(clock));

        List<NormalizedRecord> normalized = new ArrayList<>(table.size());
        for (FindingRecord record : table.getRecords()) {
            normalized.add(normalizer.normalize(record, fields));
        }
        return normalized;
    }

    private List<TriageDiagnostic> unrecognizedSeverities(List<NormalizedRecord> records) {
        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, String> labels = new LinkedHashMap<>();
        for (NormalizedRecord record : records) {
            if (!record.isSeverityRecognized()) {
                counts.merge(record.getRawSeverity(), 1L, Long::sum);
                labels.putIfAbsent(record.getRawSeverity(), record.getSeverityLabel());
            }
        }

        List<TriageDiagnostic> diagnostics = new ArrayList<>(counts.size());
        counts.forEach((raw, count) -> {
            String message = "Нераспознанная критичность '" + raw + "' учтена как " + labels.get(raw);
            log.warn("{} ({} записей)", message, count);
            diagnostics.add(new TriageDiagnostic(TriageDiagnostic.Kind.UNRECOGNIZED_SEVERITY, raw, count, message));
        });
        return diagnostics;
    }

    public TriageConfig getConfig() {
        return config;
    }
}
