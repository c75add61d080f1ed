package tech.noetzold.devpulse_api.scoring;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.DefectReport;
import tech.noetzold.devpulse_api.model.ErrorCategory;
import tech.noetzold.devpulse_api.model.ErrorPriority;
import tech.noetzold.devpulse_api.model.PageArea;
import tech.noetzold.devpulse_api.model.PriorityLevel;
import tech.noetzold.devpulse_api.model.Severity;

import java.util.List;

@Component
public class DefectPriorityScorer {

    private static final List<WeightedFactor<DefectReport, ?>> FACTORS = List.of(
            WeightedFactor.<DefectReport, Severity>of(ScoringTables.SEVERITY_WEIGHTS, DefectReport::severity,
                    s -> "Error severity is " + (s == null ? "unknown" : s.value())),
            WeightedFactor.<DefectReport, ErrorCategory>of(ScoringTables.CATEGORY_WEIGHTS, DefectReport::category,
                    c -> (c == null ? "unknown" : c.value()) + " errors affect core functionality"),
            WeightedFactor.<DefectReport, String>of(ScoringTables.ROLE_WEIGHTS, DefectPriorityScorer::roleOf,
                    r -> "Affects " + (r == null ? "unknown" : r) + " role functionality"),
            WeightedFactor.<DefectReport, PageArea>of(ScoringTables.PAGE_AREA_WEIGHTS, DefectReport::pageArea,
                    a -> "Error occurs on " + a.label() + " page")
    );

    private final FactorScorer<DefectReport> scorer = new FactorScorer<>(FACTORS);

    public FactorScore score(DefectReport defect) {
        return scorer.score(defect);
    }

    public ErrorPriority prioritize(DefectReport defect) {
        FactorScore score = score(defect);
        PriorityLevel level = TierClassifier.classify(score.totalScore(), ScoringTables.PRIORITY_THRESHOLDS);
        return new ErrorPriority(level, level.reasoning(), score.totalScore(), score.breakdown());
    }

    private static String roleOf(DefectReport defect) {
        String role = defect.userRole();
        return role == null || role.isBlank() ? null : role;
    }
}
