package com.vtb.triage.classification;

import com.vtb.triage.models.NormalizedRecord;

/**
 * Правило профиля: предикат -> группа
 */
public record ClassificationRule(String group, RecordPredicate predicate, String description) {

    public ClassificationRule {
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("Группа правила не задана");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("Предикат правила не задан для группы " + group);
        }
        if (description == null) {
            description = "-> " + group;
        }
    }

    public ClassificationRule(String group, RecordPredicate predicate) {
        this(group, predicate, null);
    }

    public boolean matches(NormalizedRecord record) {
        return predicate.test(record);
    }
}
