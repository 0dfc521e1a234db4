package com.vtb.triage.exceptions;

import java.util.List;

/**
 * В схеме входной таблицы нет обязательных полей. Бросается до начала классификации.
 */
public class MissingRequiredFieldException extends TriageException {

    private final List<String> missingFields;

    public MissingRequiredFieldException(List<String> missingFields, List<String> availableColumns) {
        super("Отсутствуют обязательные поля: " + String.join(", ", missingFields)
            + " (колонки таблицы: " + availableColumns + ")");
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
