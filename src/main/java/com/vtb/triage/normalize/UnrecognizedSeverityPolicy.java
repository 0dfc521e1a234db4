package com.vtb.triage.normalize;

/**
 * Что делать со значением критичности вне таксономии
 */
public enum UnrecognizedSeverityPolicy {
    /** Отдельная сквозная категория с меткой в Title Case */
    PASS_THROUGH,
    /** Считать как None (строгий отчет из 5 уровней) */
    FOLD_INTO_NONE
}
