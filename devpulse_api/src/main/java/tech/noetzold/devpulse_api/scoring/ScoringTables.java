package tech.noetzold.devpulse_api.scoring;

import tech.noetzold.devpulse_api.model.ErrorCategory;
import tech.noetzold.devpulse_api.model.PageArea;
import tech.noetzold.devpulse_api.model.PriorityLevel;
import tech.noetzold.devpulse_api.model.RiskLevel;
import tech.noetzold.devpulse_api.model.Severity;

import java.util.Map;

/**
 * Hand-tuned weights and thresholds. Loaded once, never changed at runtime.
 */
public final class ScoringTables {

    private ScoringTables() {
    }

    public static final FactorWeightTable<Severity> SEVERITY_WEIGHTS = FactorWeightTable.of("Severity", Map.of(
            Severity.CRITICAL, 40,
            Severity.HIGH, 30,
            Severity.MEDIUM, 20,
            Severity.LOW, 10
    ), 10);

    public static final FactorWeightTable<ErrorCategory> CATEGORY_WEIGHTS = FactorWeightTable.of("Error Type", Map.of(
            ErrorCategory.RUNTIME, 30,
            ErrorCategory.NETWORK, 25,
            ErrorCategory.RENDERING, 15,
            ErrorCategory.NAVIGATION, 10
    ), 10);

    public static final FactorWeightTable<String> ROLE_WEIGHTS = FactorWeightTable.of("User Role Impact", Map.of(
            "manager", 25,
            "team-lead", 20,
            "developer", 15
    ), 10);

    public static final FactorWeightTable<PageArea> PAGE_AREA_WEIGHTS = FactorWeightTable.of("URL Criticality", Map.of(
            PageArea.DASHBOARD, 25,
            PageArea.AUTH, 30,
            PageArea.API, 20
    ), 10);

    public static final ThresholdTable<PriorityLevel> PRIORITY_THRESHOLDS = ThresholdTable.<PriorityLevel>builder()
            .atLeast(90, PriorityLevel.P0)
            .atLeast(70, PriorityLevel.P1)
            .atLeast(50, PriorityLevel.P2)
            .atLeast(30, PriorityLevel.P3)
            .otherwise(PriorityLevel.P4);

    public static final ThresholdTable<RiskLevel> RISK_THRESHOLDS = ThresholdTable.<RiskLevel>builder()
            .atLeast(70, RiskLevel.HIGH)
            .atLeast(30, RiskLevel.MODERATE)
            .otherwise(RiskLevel.LOW);
}
