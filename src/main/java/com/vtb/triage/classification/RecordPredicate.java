package com.vtb.triage.classification;

import com.vtb.triage.models.NormalizedRecord;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Чистая проверка нормализованной записи (без состояния)
 */
@FunctionalInterface
public interface RecordPredicate {

    boolean test(NormalizedRecord record);

    /**
     * Поля записи, которые читает проверка. Профиль требует их наличия во входной таблице.
     */
    default Set<RecordField> fields() {
        return Collections.emptySet();
    }

    default RecordPredicate negate() {
        RecordPredicate self = this;
        return new RecordPredicate() {
            @Override
            public boolean test(NormalizedRecord record) {
                return !self.test(record);
            }

            @Override
            public Set<RecordField> fields() {
                return self.fields();
            }

            @Override
            public String toString() {
                return "NOT " + self;
            }
        };
    }

    static RecordPredicate always() {
        return record -> true;
    }

    /**
     * Конъюнкция; пустой список = всегда истина
     */
    static RecordPredicate allOf(List<? extends RecordPredicate> predicates) {
        List<RecordPredicate> copy = List.copyOf(predicates);
        if (copy.isEmpty()) {
            return always();
        }
        if (copy.size() == 1) {
            return copy.get(0);
        }
        Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
        for (RecordPredicate predicate : copy) {
            fields.addAll(predicate.fields());
        }
        Set<RecordField> referenced = Collections.unmodifiableSet(fields);
        return new RecordPredicate() {
            @Override
            public boolean test(NormalizedRecord record) {
                for (RecordPredicate predicate : copy) {
                    if (!predicate.test(record)) {
                        return false;
                    }
                }
                return true;
            }

            @Override
            public Set<RecordField> fields() {
                return referenced;
            }

            @Override
            public String toString() {
                return copy.toString();
            }
        };
    }
}
