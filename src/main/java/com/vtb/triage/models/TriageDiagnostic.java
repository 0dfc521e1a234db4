package com.vtb.triage.models;

/**
 * Нефатальное замечание, собранное во время прогона
 */
public record TriageDiagnostic(Kind kind, String subject, long occurrences, String message) {

    public enum Kind {
        /** Значение критичности вне словаря синонимов */
        UNRECOGNIZED_SEVERITY,
        /** Два правила профиля с разными группами срабатывают на одних и тех же записях */
        RULE_OVERLAP
    }
}
