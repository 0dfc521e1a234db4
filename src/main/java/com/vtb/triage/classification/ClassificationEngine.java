package com.vtb.triage.classification;

import com.vtb.triage.models.NormalizedRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Разбиение записей на непересекающиеся группы по правилам профиля.
 * Каждая запись попадает ровно в одну группу: первое сработавшее правило или группа по умолчанию.
 */
@Slf4j
public class ClassificationEngine {

    /**
     * Определить группу одной записи
     */
    public String classify(NormalizedRecord record, Profile profile) {
        if (record == null || profile == null) {
            throw new IllegalArgumentException("record и profile обязательны");
        }
        for (ClassificationRule rule : profile.getRules()) {
            if (rule.matches(record)) {
                return rule.group();
            }
        }
        return profile.getDefaultGroup();
    }

    /**
     * Разбить записи по группам. В результате есть все группы профиля (в объявленном порядке),
     * порядок записей внутри группы совпадает с исходным.
     */
    public Map<String, List<NormalizedRecord>> partition(List<NormalizedRecord> records, Profile profile) {
        if (records == null || profile == null) {
            throw new IllegalArgumentException("records и profile обязательны");
        }
        Map<String, List<NormalizedRecord>> groups = new LinkedHashMap<>();
        for (String group : profile.getGroups()) {
            groups.put(group, new ArrayList<>());
        }

        for (NormalizedRecord record : records) {
            groups.get(classify(record, profile)).add(record);
        }

        if (log.isDebugEnabled()) {
            groups.forEach((group, members) -> log.debug("Профиль {}: группа {} = {} записей",
                profile.getName(), group, members.size()));
        }
        return groups;
    }
}
