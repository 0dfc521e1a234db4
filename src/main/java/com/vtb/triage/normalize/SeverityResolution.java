package com.vtb.triage.normalize;

import com.vtb.triage.models.SeverityLevel;

/**
 * Результат приведения сырого значения критичности.
 *
 * @param level уровень таксономии; null для сквозной категории
 * @param label метка для подсчета и отчета
 * @param recognized false, если значение не распознано (даже если было свернуто в None)
 */
public record SeverityResolution(SeverityLevel level, String label, boolean recognized) {

    static SeverityResolution of(SeverityLevel level) {
        return new SeverityResolution(level, level.getLabel(), true);
    }
}
