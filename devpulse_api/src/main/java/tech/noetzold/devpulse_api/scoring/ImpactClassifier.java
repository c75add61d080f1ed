package tech.noetzold.devpulse_api.scoring;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.DefectReport;
import tech.noetzold.devpulse_api.model.ErrorCategory;
import tech.noetzold.devpulse_api.model.ImpactSeverity;
import tech.noetzold.devpulse_api.model.Severity;
import tech.noetzold.devpulse_api.model.UserImpact;

import java.util.ArrayList;
import java.util.List;

/**
 * Impact tier from the severity/category combination. Independent of the weighted priority score,
 * so the two may disagree for the same defect.
 */
@Component
public class ImpactClassifier {

    public ImpactSeverity classify(Severity severity, ErrorCategory category) {
        if (severity == Severity.CRITICAL && category == ErrorCategory.RUNTIME) {
            return ImpactSeverity.BLOCKER;
        }
        if (severity == Severity.CRITICAL || (severity == Severity.HIGH && category == ErrorCategory.NETWORK)) {
            return ImpactSeverity.CRITICAL;
        }
        if (severity == Severity.HIGH || category == ErrorCategory.RUNTIME) {
            return ImpactSeverity.MAJOR;
        }
        if (severity == Severity.MEDIUM) {
            return ImpactSeverity.MINOR;
        }
        return ImpactSeverity.TRIVIAL;
    }

    public UserImpact assess(DefectReport defect) {
        ImpactSeverity severity = classify(defect.severity(), defect.category());
        List<String> roles = defect.userRole() == null ? List.of() : List.of(defect.userRole());
        return new UserImpact(
                severity,
                roles,
                affectedFeatures(defect.url()),
                severity.businessImpact(),
                severity.userExperienceImpact(),
                severity.estimatedAffectedUsers()
        );
    }

    List<String> affectedFeatures(String url) {
        List<String> features = new ArrayList<>();
        String u = url == null ? "" : url.toLowerCase();

        if (u.contains("/dashboard")) features.add("Dashboard");
        if (u.contains("/analytics")) features.add("Analytics");
        if (u.contains("/team")) features.add("Team Management");
        if (u.contains("/settings")) features.add("Settings");
        if (u.contains("/profile")) features.add("User Profile");
        if (u.contains("/auth")) features.add("Authentication");

        if (features.isEmpty()) {
            features.add("Core Application");
        }
        return List.copyOf(features);
    }
}
