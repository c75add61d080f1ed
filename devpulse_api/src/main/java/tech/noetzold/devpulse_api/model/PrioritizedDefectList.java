package tech.noetzold.devpulse_api.model;

import java.util.List;
import java.util.Map;

public record PrioritizedDefectList(
        int totalErrors,
        Map<PriorityLevel, Integer> priorityDistribution,
        List<DefectAssessment> errors,
        List<String> recommendations,
        List<String> nextActions
) {}
