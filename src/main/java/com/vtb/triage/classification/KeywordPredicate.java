package com.vtb.triage.classification;

import com.vtb.triage.models.NormalizedRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Поле содержит хотя бы одно из ключевых слов (без учета регистра и крайних пробелов ключевого слова)
 */
public final class KeywordPredicate implements RecordPredicate {

    private final RecordField field;
    private final List<String> keywords;

    public KeywordPredicate(RecordField field, List<String> keywords) {
        if (field == null) {
            throw new IllegalArgumentException("Поле правила не задано");
        }
        if (keywords == null || keywords.isEmpty()) {
            throw new IllegalArgumentException("Список ключевых слов для " + field.getConfigKey() + " пуст");
        }
        List<String> lowered = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                throw new IllegalArgumentException("Пустое ключевое слово для " + field.getConfigKey());
            }
            lowered.add(keyword.trim().toLowerCase(Locale.ROOT));
        }
        this.field = field;
        this.keywords = Collections.unmodifiableList(lowered);
    }

    public static KeywordPredicate containsAny(RecordField field, String... keywords) {
        return new KeywordPredicate(field, List.of(keywords));
    }

    @Override
    public boolean test(NormalizedRecord record) {
        String value = field.extract(record).toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return false;
        }
        for (String keyword : keywords) {
            if (value.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Set<RecordField> fields() {
        return Set.of(field);
    }

    @Override
    public String toString() {
        return field.getConfigKey() + " contains any of " + keywords;
    }
}
