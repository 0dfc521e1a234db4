package com.vtb.triage.models;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Сводки по всем группам профиля плюс итог
 */
@Data
@Builder
public class SeverityBreakdown {

    /** Сводка по группе, в порядке групп профиля */
    @Builder.Default
    private Map<String, GroupSummary> groups = new LinkedHashMap<>();

    private GroupSummary total;

    public GroupSummary group(String name) {
        GroupSummary summary = groups.get(name);
        return summary != null ? summary : GroupSummary.empty(name);
    }
}
