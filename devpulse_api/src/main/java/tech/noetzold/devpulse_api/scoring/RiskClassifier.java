package tech.noetzold.devpulse_api.scoring;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.RiskLevel;

/**
 * Risk scores come pre-computed from the burnout assessment; they pass straight into the threshold table.
 */
@Component
public class RiskClassifier {

    public RiskLevel classify(double riskScore) {
        return TierClassifier.classify(riskScore, ScoringTables.RISK_THRESHOLDS);
    }
}
