package com.vtb.triage.classification;

import com.vtb.triage.models.NormalizedRecord;
import com.vtb.triage.models.TriageDiagnostic;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Поиск пар правил с разными группами, которые срабатывают на одних и тех же записях.
 * Такое пересечение делает результат зависимым от порядка правил. Не фатально.
 */
@Slf4j
public class RuleOverlapDetector {

    public List<TriageDiagnostic> detect(Profile profile, List<NormalizedRecord> records) {
        List<ClassificationRule> rules = profile.getRules();
        List<TriageDiagnostic> diagnostics = new ArrayList<>();
        if (rules.size() < 2 || records.isEmpty()) {
            return diagnostics;
        }

        long[][] overlaps = new long[rules.size()][rules.size()];
        boolean[] matched = new boolean[rules.size()];
        for (NormalizedRecord record : records) {
            for (int i = 0; i < rules.size(); i++) {
                matched[i] = rules.get(i).matches(record);
            }
            for (int i = 0; i < rules.size(); i++) {
                if (!matched[i]) {
                    continue;
                }
                for (int j = i + 1; j < rules.size(); j++) {
                    if (matched[j] && !rules.get(i).group().equals(rules.get(j).group())) {
                        overlaps[i][j]++;
                    }
                }
            }
        }

        for (int i = 0; i < rules.size(); i++) {
            for (int j = i + 1; j < rules.size(); j++) {
                if (overlaps[i][j] == 0) {
                    continue;
                }
                ClassificationRule first = rules.get(i);
                ClassificationRule second = rules.get(j);
                String message = String.format(
                    "Правило '%s' (%s) перекрывает правило '%s' (%s) на %d записях, побеждает первое",
                    first.description(), first.group(), second.description(), second.group(), overlaps[i][j]);
                log.warn("Профиль {}: {}", profile.getName(), message);
                diagnostics.add(new TriageDiagnostic(TriageDiagnostic.Kind.RULE_OVERLAP,
                    first.group() + "/" + second.group(), overlaps[i][j], message));
            }
        }
        return diagnostics;
    }
}
