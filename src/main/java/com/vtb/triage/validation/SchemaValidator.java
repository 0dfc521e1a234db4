package com.vtb.triage.validation;

import com.vtb.triage.config.TriageConfig;
import com.vtb.triage.exceptions.EmptyInputException;
import com.vtb.triage.exceptions.MissingRequiredFieldException;
import com.vtb.triage.models.FindingField;
import com.vtb.triage.models.FindingTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Проверка схемы входной таблицы до начала обработки записей
 */
@Slf4j
public class SchemaValidator {

    private final TriageConfig.FieldMapping mapping;

    public SchemaValidator(TriageConfig.FieldMapping mapping) {
        if (mapping == null) {
            throw new IllegalArgumentException("FieldMapping не может быть null");
        }
        this.mapping = mapping;
    }

    public ResolvedFields validate(FindingTable table) {
        return validate(table, Collections.emptySet());
    }

    /**
     * Сопоставить логические поля с колонками таблицы.
     *
     * @param alsoRequired необязательные поля, которые нужны правилам профиля
     * @throws MissingRequiredFieldException если нет хотя бы одного обязательного поля
     * @throws EmptyInputException если в таблице нет строк
     */
    public ResolvedFields validate(FindingTable table, Set<FindingField> alsoRequired) {
        if (table == null) {
            throw new IllegalArgumentException("FindingTable не может быть null");
        }

        Map<FindingField, String> resolved = new EnumMap<>(FindingField.class);
        List<String> missing = new ArrayList<>();

        for (FindingField field : FindingField.values()) {
            List<String> aliases = mapping.aliasesFor(field);
            String column = findColumn(table.getColumns(), aliases);
            if (column != null) {
                resolved.put(field, column);
            } else if (field.isRequired() || (alsoRequired != null && alsoRequired.contains(field))) {
                missing.add(field.getConfigKey() + " " + aliases);
            } else {
                log.debug("Необязательное поле {} отсутствует в таблице", field.getConfigKey());
            }
        }

        if (!missing.isEmpty()) {
            throw new MissingRequiredFieldException(missing, table.getColumns());
        }
        if (table.isEmpty()) {
            throw new EmptyInputException();
        }

        log.debug("Поля сопоставлены: {}", resolved);
        return new ResolvedFields(resolved);
    }

    /**
     * Сначала точное совпадение по алиасам в порядке приоритета, затем без учета регистра и крайних пробелов
     */
    static String findColumn(List<String> columns, List<String> aliases) {
        if (aliases == null) {
            return null;
        }
        for (String alias : aliases) {
            if (columns.contains(alias)) {
                return alias;
            }
        }
        for (String alias : aliases) {
            String wanted = alias.trim().toLowerCase(Locale.ROOT);
            for (String column : columns) {
                if (column != null && column.trim().toLowerCase(Locale.ROOT).equals(wanted)) {
                    return column;
                }
            }
        }
        return null;
    }
}
