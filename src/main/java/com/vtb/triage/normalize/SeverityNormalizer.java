package com.vtb.triage.normalize;

import com.vtb.triage.models.GroupSummary;
import com.vtb.triage.models.SeverityLevel;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Приведение значений критичности к таксономии Critical/High/Medium/Low/None.
 * Порядок: пусто -> None, точное название уровня, синонимы None, подстрока (самая длинная), иначе нераспознано.
 */
public class SeverityNormalizer {

    private static final SeverityLevel[] SUBSTRING_LEVELS = {
        SeverityLevel.CRITICAL, SeverityLevel.HIGH, SeverityLevel.MEDIUM, SeverityLevel.LOW
    };

    static final String RESERVED_LABEL_SUFFIX = " (severity)";

    private final Set<String> noneSynonyms;
    private final UnrecognizedSeverityPolicy policy;

    public SeverityNormalizer(List<String> noneSynonyms, UnrecognizedSeverityPolicy policy) {
        this.noneSynonyms = new HashSet<>();
        if (noneSynonyms != null) {
            for (String synonym : noneSynonyms) {
                if (synonym != null && !synonym.isBlank()) {
                    this.noneSynonyms.add(synonym.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.policy = policy == null ? UnrecognizedSeverityPolicy.PASS_THROUGH : policy;
    }

    public SeverityResolution normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return SeverityResolution.of(SeverityLevel.NONE);
        }

        String value = raw.trim().toLowerCase(Locale.ROOT);

        SeverityLevel exact = SeverityLevel.fromLabel(value);
        if (exact != null) {
            return SeverityResolution.of(exact);
        }
        if (noneSynonyms.contains(value)) {
            return SeverityResolution.of(SeverityLevel.NONE);
        }

        SeverityLevel best = null;
        for (SeverityLevel level : SUBSTRING_LEVELS) {
            String label = level.getLabel().toLowerCase(Locale.ROOT);
            if (value.contains(label) && (best == null || label.length() > best.getLabel().length())) {
                best = level;
            }
        }
        if (best != null) {
            return SeverityResolution.of(best);
        }

        if (policy == UnrecognizedSeverityPolicy.FOLD_INTO_NONE) {
            return new SeverityResolution(SeverityLevel.NONE, SeverityLevel.NONE.getLabel(), false);
        }
        return new SeverityResolution(null, passThroughLabel(raw.trim()), false);
    }

    public UnrecognizedSeverityPolicy getPolicy() {
        return policy;
    }

    /**
     * Метка сквозной категории. Метка итоговой строки зарезервирована и получает уточнение.
     */
    static String passThroughLabel(String raw) {
        String label = titleCase(raw);
        if (label.equalsIgnoreCase(GroupSummary.TOTAL)) {
            return label + RESERVED_LABEL_SUFFIX;
        }
        return label;
    }

    /**
     * "very BAD-value" -> "Very Bad-Value": заглавная буква после любого небуквенного символа
     */
    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean upperNext = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(upperNext ? Character.toUpperCase(c) : Character.toLowerCase(c));
                upperNext = false;
            } else {
                sb.append(c);
                upperNext = true;
            }
        }
        return sb.toString();
    }
}
