package com.vtb.triage.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.triage.models.FindingField;
import lombok.Data;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Конфигурация триажа из YAML файла.
 * Ключевые слова, группы и порядок правил задаются здесь, а не в коде.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TriageConfig {

    public static final String DEFAULT_RESOURCE = "triage-config.yaml";

    private FieldMapping fields;
    private SeverityMapping severity;
    private Map<String, ProfileDefinition> profiles;
    private Boolean detectRuleOverlaps;

    private static TriageConfig instance;

    /**
     * Загрузить конфигурацию из classpath (кэшируется)
     */
    public static synchronized TriageConfig load() {
        if (instance == null) {
            try (InputStream is = TriageConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
                }
                instance = load(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из произвольного потока (поток не закрывается)
     */
    public static TriageConfig load(InputStream yaml) {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            TriageConfig config = mapper.readValue(yaml, TriageConfig.class);
            if (config == null) {
                config = new TriageConfig();
            }
            config.ensureDefaults();
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    private void ensureDefaults() {
        if (fields == null) {
            fields = new FieldMapping();
        }
        fields.ensureDefaults();
        if (severity == null) {
            severity = new SeverityMapping();
        }
        severity.ensureDefaults();
        if (profiles == null) {
            profiles = new LinkedHashMap<>();
        }
        profiles.forEach((key, profile) -> {
            if (profile != null && (profile.getName() == null || profile.getName().isBlank())) {
                profile.setName(key);
            }
        });
        if (detectRuleOverlaps == null) {
            detectRuleOverlaps = Boolean.TRUE;
        }
    }

    public boolean overlapDetectionEnabled() {
        return detectRuleOverlaps == null || detectRuleOverlaps;
    }

    /**
     * Найти профиль по имени (сначала точное совпадение, затем без учета регистра)
     */
    public ProfileDefinition getProfile(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Имя профиля не задано");
        }
        ProfileDefinition exact = profiles.get(name);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, ProfileDefinition> entry : profiles.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        throw new IllegalArgumentException("Профиль не найден: " + name + ". Доступны: " + profiles.keySet());
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldMapping {
        private List<String> assetName;
        private List<String> locationPath;
        private List<String> severity;
        private List<String> subscription;
        private List<String> exploitFlag;
        private List<String> firstDetected;
        private List<String> resolvedAt;
        private List<String> findingStatus;

        void ensureDefaults() {
            assetName = orDefault(assetName, "AssetName", "Asset Name", "Asset");
            locationPath = orDefault(locationPath, "LocationPath", "Location Path", "Location");
            severity = orDefault(severity, "VendorSeverity", "Severity", "Vendor Severity");
            subscription = orDefault(subscription, "SubscriptionName", "Subscription Name", "Subscription");
            exploitFlag = orDefault(exploitFlag, "HasExploit", "Has Exploit", "ExploitAvailable");
            firstDetected = orDefault(firstDetected, "FirstDetected", "First Detected");
            resolvedAt = orDefault(resolvedAt, "ResolvedAt", "Resolved At");
            findingStatus = orDefault(findingStatus, "FindingStatus", "Finding Status", "Status");
        }

        /**
         * Алиасы колонки для логического поля в порядке приоритета
         */
        public List<String> aliasesFor(FindingField field) {
            switch (field) {
                case ASSET_NAME: return assetName;
                case LOCATION_PATH: return locationPath;
                case SEVERITY: return severity;
                case SUBSCRIPTION: return subscription;
                case EXPLOIT_FLAG: return exploitFlag;
                case FIRST_DETECTED: return firstDetected;
                case RESOLVED_AT: return resolvedAt;
                case FINDING_STATUS: return findingStatus;
                default: throw new IllegalArgumentException("Неизвестное поле: " + field);
            }
        }

        private static List<String> orDefault(List<String> configured, String... defaults) {
            if (configured == null || configured.isEmpty()) {
                return new ArrayList<>(List.of(defaults));
            }
            return new ArrayList<>(configured);
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeverityMapping {
        private static final List<String> DEFAULT_NONE_SYNONYMS = List.of("none", "info", "informational", "na", "n/a");

        /** Значения, которые считаются уровнем None (без учета регистра) */
        private List<String> noneSynonyms;

        void ensureDefaults() {
            if (noneSynonyms == null || noneSynonyms.isEmpty()) {
                noneSynonyms = new ArrayList<>(DEFAULT_NONE_SYNONYMS);
            } else {
                List<String> lowered = new ArrayList<>(noneSynonyms.size());
                for (String synonym : noneSynonyms) {
                    if (synonym != null && !synonym.isBlank()) {
                        lowered.add(synonym.trim().toLowerCase(Locale.ROOT));
                    }
                }
                noneSynonyms = lowered;
            }
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileDefinition {
        private String name;
        private String description;
        private List<String> groups;
        private String defaultGroup;
        /** Порядок колонок групп в сводке; по умолчанию = groups */
        private List<String> displayOrder;
        /** Группы, для которых в сводке показываются эксплойты Critical/High */
        private List<String> exploitGroups;
        private String unrecognizedSeverity;
        private List<RuleDefinition> rules;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleDefinition {
        private String group;
        private String description;
        /** Все условия должны выполниться */
        private List<ConditionDefinition> when;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConditionDefinition {
        /** assetName | locationPath | subscription */
        private String field;
        private List<String> containsAny;
        private Boolean negate;

        public boolean isNegated() {
            return Boolean.TRUE.equals(negate);
        }
    }
}
