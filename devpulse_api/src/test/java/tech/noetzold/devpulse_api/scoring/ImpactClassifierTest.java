package tech.noetzold.devpulse_api.scoring;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import tech.noetzold.devpulse_api.model.DefectReport;
import tech.noetzold.devpulse_api.model.ErrorCategory;
import tech.noetzold.devpulse_api.model.ImpactSeverity;
import tech.noetzold.devpulse_api.model.PriorityLevel;
import tech.noetzold.devpulse_api.model.Severity;
import tech.noetzold.devpulse_api.model.UserImpact;

import static org.assertj.core.api.Assertions.assertThat;
import static tech.noetzold.devpulse_api.Defects.defect;

class ImpactClassifierTest {

    private final ImpactClassifier classifier = new ImpactClassifier();

    @ParameterizedTest
    @CsvSource({
            "CRITICAL, RUNTIME, BLOCKER",
            "CRITICAL, NETWORK, CRITICAL",
            "CRITICAL, NAVIGATION, CRITICAL",
            "HIGH, NETWORK, CRITICAL",
            "HIGH, RENDERING, MAJOR",
            "MEDIUM, RUNTIME, MAJOR",
            "LOW, RUNTIME, MAJOR",
            "MEDIUM, NETWORK, MINOR",
            "LOW, NETWORK, TRIVIAL",
            "LOW, NAVIGATION, TRIVIAL"
    })
    void classify_followsSeverityCategoryCombination(Severity severity, ErrorCategory category,
                                                     ImpactSeverity expected) {
        assertThat(classifier.classify(severity, category)).isEqualTo(expected);
    }

    @Test
    void assess_blocker_estimatesEveryUserAffected() {
        DefectReport d = defect("e1", Severity.CRITICAL, ErrorCategory.RUNTIME, "manager", "/dashboard/team");

        UserImpact impact = classifier.assess(d);

        assertThat(impact.severity()).isEqualTo(ImpactSeverity.BLOCKER);
        assertThat(impact.estimatedAffectedUsers()).isEqualTo(100);
        assertThat(impact.businessImpact()).isEqualTo("Prevents users from completing core tasks");
        assertThat(impact.affectedUserRoles()).containsExactly("manager");
        assertThat(impact.affectedFeatures()).containsExactly("Dashboard", "Team Management");
    }

    @Test
    void assess_unrecognisedUrl_affectsCoreApplication() {
        UserImpact impact = classifier.assess(defect("e2", Severity.LOW, ErrorCategory.NAVIGATION, "developer", "/home"));

        assertThat(impact.affectedFeatures()).containsExactly("Core Application");
        assertThat(impact.estimatedAffectedUsers()).isEqualTo(10);
    }

    @Test
    void impactAndPriority_mayDisagree() {
        DefectReport d = defect("e3", Severity.MEDIUM, ErrorCategory.NETWORK, "guest", "/home");

        assertThat(new DefectPriorityScorer().prioritize(d).level()).isEqualTo(PriorityLevel.P2);
        assertThat(classifier.assess(d).severity()).isEqualTo(ImpactSeverity.MINOR);
    }
}
