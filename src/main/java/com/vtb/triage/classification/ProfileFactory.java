package com.vtb.triage.classification;

import com.vtb.triage.config.TriageConfig;
import com.vtb.triage.exceptions.InvalidProfileException;
import com.vtb.triage.normalize.UnrecognizedSeverityPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Сборка профиля из описания в конфигурации
 */
public final class ProfileFactory {

    private ProfileFactory() {
    }

    public static Profile fromConfig(TriageConfig config, String profileName) {
        return fromDefinition(config.getProfile(profileName));
    }

    public static Profile fromDefinition(TriageConfig.ProfileDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("ProfileDefinition не может быть null");
        }
        String name = definition.getName();

        Profile.Builder builder = Profile.builder(name)
            .groups(nonNull(definition.getGroups()))
            .defaultGroup(definition.getDefaultGroup())
            .displayOrder(nonNull(definition.getDisplayOrder()))
            .exploitGroups(nonNull(definition.getExploitGroups()))
            .unrecognizedSeverityPolicy(parsePolicy(name, definition.getUnrecognizedSeverity()));

        List<TriageConfig.RuleDefinition> rules = nonNull(definition.getRules());
        for (int i = 0; i < rules.size(); i++) {
            TriageConfig.RuleDefinition rule = rules.get(i);
            if (rule == null) {
                throw new InvalidProfileException(name, "пустое правило #" + (i + 1));
            }
            if (rule.getGroup() == null || rule.getGroup().isBlank()) {
                throw new InvalidProfileException(name, "у правила #" + (i + 1) + " не указана группа");
            }
            builder.rule(new ClassificationRule(rule.getGroup(), buildPredicate(name, i, rule), describe(i, rule)));
        }
        return builder.build();
    }

    private static RecordPredicate buildPredicate(String profileName, int index, TriageConfig.RuleDefinition rule) {
        List<TriageConfig.ConditionDefinition> conditions = nonNull(rule.getWhen());
        if (conditions.isEmpty()) {
            throw new InvalidProfileException(profileName, "правило #" + (index + 1) + " без условий");
        }
        List<RecordPredicate> predicates = new ArrayList<>(conditions.size());
        for (TriageConfig.ConditionDefinition condition : conditions) {
            try {
                RecordPredicate predicate = new KeywordPredicate(
                    RecordField.fromKey(condition.getField()), condition.getContainsAny());
                predicates.add(condition.isNegated() ? predicate.negate() : predicate);
            } catch (IllegalArgumentException e) {
                throw new InvalidProfileException(profileName, "правило #" + (index + 1) + ": " + e.getMessage());
            }
        }
        return RecordPredicate.allOf(predicates);
    }

    private static String describe(int index, TriageConfig.RuleDefinition rule) {
        if (rule.getDescription() != null && !rule.getDescription().isBlank()) {
            return rule.getDescription();
        }
        return "#" + (index + 1) + " -> " + rule.getGroup();
    }

    private static UnrecognizedSeverityPolicy parsePolicy(String profileName, String value) {
        if (value == null || value.isBlank()) {
            return UnrecognizedSeverityPolicy.PASS_THROUGH;
        }
        try {
            return UnrecognizedSeverityPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidProfileException(profileName, "неизвестная политика критичности: " + value);
        }
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
