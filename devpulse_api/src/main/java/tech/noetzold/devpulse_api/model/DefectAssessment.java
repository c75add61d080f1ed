package tech.noetzold.devpulse_api.model;

import java.util.List;

public record DefectAssessment(
        String errorId,
        String title,
        ErrorPriority priority,
        UserImpact impact,
        String estimatedFixTime,
        List<String> dependencies,
        ReproductionComplexity reproductionComplexity
) {}
