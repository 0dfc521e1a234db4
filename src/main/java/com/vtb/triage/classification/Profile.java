package com.vtb.triage.classification;

import com.vtb.triage.exceptions.InvalidProfileException;
import com.vtb.triage.models.GroupSummary;
import com.vtb.triage.normalize.UnrecognizedSeverityPolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Профиль классификации для одного контекста отчетности:
 * упорядоченные правила, набор групп и группа по умолчанию.
 * Первое сработавшее правило определяет группу.
 */
public final class Profile {

    private final String name;
    private final List<ClassificationRule> rules;
    private final List<String> groups;
    private final String defaultGroup;
    private final List<String> displayOrder;
    private final Set<String> exploitGroups;
    private final UnrecognizedSeverityPolicy unrecognizedSeverityPolicy;
    private final Set<RecordField> referencedFields;

    private Profile(Builder b) {
        this.name = b.name;
        this.rules = Collections.unmodifiableList(new ArrayList<>(b.rules));
        this.groups = Collections.unmodifiableList(new ArrayList<>(b.groups));
        this.defaultGroup = b.defaultGroup;
        this.displayOrder = Collections.unmodifiableList(
            b.displayOrder.isEmpty() ? new ArrayList<>(b.groups) : new ArrayList<>(b.displayOrder));
        this.exploitGroups = Collections.unmodifiableSet(new LinkedHashSet<>(b.exploitGroups));
        this.unrecognizedSeverityPolicy = b.unrecognizedSeverityPolicy;

        Set<RecordField> fields = EnumSet.noneOf(RecordField.class);
        for (ClassificationRule rule : rules) {
            fields.addAll(rule.predicate().fields());
        }
        this.referencedFields = Collections.unmodifiableSet(fields);
    }

    public String getName() { return name; }
    public List<ClassificationRule> getRules() { return rules; }
    public List<String> getGroups() { return groups; }
    public String getDefaultGroup() { return defaultGroup; }
    public List<String> getDisplayOrder() { return displayOrder; }
    public Set<String> getExploitGroups() { return exploitGroups; }
    public UnrecognizedSeverityPolicy getUnrecognizedSeverityPolicy() { return unrecognizedSeverityPolicy; }

    /**
     * Поля, которые читают правила профиля. Они обязаны быть во входной таблице.
     */
    public Set<RecordField> getReferencedFields() {
        return referencedFields;
    }

    public boolean tracksExploits(String group) {
        return exploitGroups.contains(group);
    }

    @Override
    public String toString() {
        return "Profile{" + name + ", groups=" + groups + ", rules=" + rules.size() + ", default=" + defaultGroup + "}";
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private final List<ClassificationRule> rules = new ArrayList<>();
        private final List<String> groups = new ArrayList<>();
        private String defaultGroup;
        private final List<String> displayOrder = new ArrayList<>();
        private final List<String> exploitGroups = new ArrayList<>();
        private UnrecognizedSeverityPolicy unrecognizedSeverityPolicy = UnrecognizedSeverityPolicy.PASS_THROUGH;

        private Builder(String name) {
            this.name = name;
        }

        public Builder groups(String... names) { return groups(List.of(names)); }
        public Builder groups(List<String> names) { groups.addAll(names); return this; }
        public Builder defaultGroup(String group) { this.defaultGroup = group; return this; }
        public Builder rule(ClassificationRule rule) { rules.add(rule); return this; }
        public Builder rule(String group, RecordPredicate predicate) { return rule(new ClassificationRule(group, predicate)); }
        public Builder displayOrder(List<String> order) { displayOrder.addAll(order); return this; }
        public Builder displayOrder(String... order) { return displayOrder(List.of(order)); }
        public Builder exploitGroups(List<String> names) { exploitGroups.addAll(names); return this; }
        public Builder exploitGroups(String... names) { return exploitGroups(List.of(names)); }

        public Builder unrecognizedSeverityPolicy(UnrecognizedSeverityPolicy policy) {
            if (policy != null) {
                this.unrecognizedSeverityPolicy = policy;
            }
            return this;
        }

        public Profile build() {
            String profileName = name == null || name.isBlank() ? "<без имени>" : name;
            if (groups.isEmpty()) {
                throw new InvalidProfileException(profileName, "не задан набор групп");
            }
            Set<String> universe = new LinkedHashSet<>(groups);
            if (universe.size() != groups.size()) {
                throw new InvalidProfileException(profileName, "группы повторяются: " + groups);
            }
            if (universe.contains(GroupSummary.TOTAL)) {
                throw new InvalidProfileException(profileName, "имя группы '" + GroupSummary.TOTAL + "' зарезервировано");
            }
            if (defaultGroup == null || !universe.contains(defaultGroup)) {
                throw new InvalidProfileException(profileName,
                    "группа по умолчанию '" + defaultGroup + "' не входит в " + groups);
            }
            for (ClassificationRule rule : rules) {
                if (!universe.contains(rule.group())) {
                    throw new InvalidProfileException(profileName,
                        "правило '" + rule.description() + "' ссылается на неизвестную группу " + rule.group());
                }
            }
            if (!displayOrder.isEmpty()
                && (displayOrder.size() != groups.size() || !universe.equals(new LinkedHashSet<>(displayOrder)))) {
                throw new InvalidProfileException(profileName,
                    "порядок колонок " + displayOrder + " должен содержать ровно группы " + groups);
            }
            for (String group : exploitGroups) {
                if (!universe.contains(group)) {
                    throw new InvalidProfileException(profileName, "неизвестная группа для эксплойтов: " + group);
                }
            }
            return new Profile(this);
        }
    }
}
