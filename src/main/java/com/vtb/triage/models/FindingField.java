package com.vtb.triage.models;

/**
 * Логические поля находки. Фактические имена колонок задаются алиасами в конфигурации.
 */
public enum FindingField {
    ASSET_NAME("assetName", true),
    LOCATION_PATH("locationPath", true),
    SEVERITY("severity", true),
    SUBSCRIPTION("subscription", false),
    EXPLOIT_FLAG("exploitFlag", false),
    FIRST_DETECTED("firstDetected", false),
    RESOLVED_AT("resolvedAt", false),
    FINDING_STATUS("findingStatus", false);

    private final String configKey;
    private final boolean required;

    FindingField(String configKey, boolean required) {
        this.configKey = configKey;
        this.required = required;
    }

    public String getConfigKey() {
        return configKey;
    }

    public boolean isRequired() {
        return required;
    }
}
