package tech.noetzold.devpulse_api.model;

import java.util.List;

public record DefectReport(
        String id,
        String message,
        Severity severity,
        ErrorCategory category,
        String userRole,          // manager, team-lead, developer; anything else weighs as default
        String url,
        List<String> reproductionSteps
) {
    public DefectReport {
        reproductionSteps = reproductionSteps == null ? List.of() : List.copyOf(reproductionSteps);
    }

    public PageArea pageArea() {
        return PageArea.fromUrl(url);
    }
}
