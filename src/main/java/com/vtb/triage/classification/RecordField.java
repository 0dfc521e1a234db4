package com.vtb.triage.classification;

import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.NormalizedRecord;

import java.util.function.Function;

/**
 * Нормализованные поля, по которым могут сопоставлять правила
 */
public enum RecordField {
    ASSET_NAME("assetName", FindingField.ASSET_NAME, NormalizedRecord::getAssetName),
    LOCATION_PATH("locationPath", FindingField.LOCATION_PATH, NormalizedRecord::getLocationPath),
    SUBSCRIPTION("subscription", FindingField.SUBSCRIPTION, NormalizedRecord::getSubscription);

    private final String configKey;
    private final FindingField source;
    private final Function<NormalizedRecord, String> extractor;

    RecordField(String configKey, FindingField source, Function<NormalizedRecord, String> extractor) {
        this.configKey = configKey;
        this.source = source;
        this.extractor = extractor;
    }

    public String getConfigKey() {
        return configKey;
    }

    /**
     * Колонка входной таблицы, из которой берется значение
     */
    public FindingField getSource() {
        return source;
    }

    public String extract(NormalizedRecord record) {
        String value = extractor.apply(record);
        return value == null ? "" : value;
    }

    /**
     * По ключу из YAML (assetName) или имени константы (ASSET_NAME), без учета регистра
     */
    public static RecordField fromKey(String key) {
        if (key != null) {
            String trimmed = key.trim();
            for (RecordField field : values()) {
                if (field.configKey.equalsIgnoreCase(trimmed) || field.name().equalsIgnoreCase(trimmed)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Неизвестное поле правила: " + key);
    }
}
