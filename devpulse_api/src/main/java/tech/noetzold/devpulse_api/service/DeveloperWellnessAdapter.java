package tech.noetzold.devpulse_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;
import tech.noetzold.devpulse_api.model.BurnoutAssessment.KeyFactor;
import tech.noetzold.devpulse_api.model.BurnoutAssessment.TrendPoint;
import tech.noetzold.devpulse_api.model.DeveloperProfile;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.ProductivityReport;
import tech.noetzold.devpulse_api.model.WellnessMetrics;
import tech.noetzold.devpulse_api.scoring.RiskClassifier;

import java.util.List;
import java.util.Optional;

/**
 * Derives one developer's profile and wellness metrics from the burnout and productivity sources. Each value falls
 * back to the {@link DefaultCohortProvider} on its own when the source it needs is missing.
 */
@Component
public class DeveloperWellnessAdapter {

    static final double AFTER_HOURS_PERCENTAGE = 20;
    static final double DEFAULT_WEEKEND_PERCENTAGE = 15;

    private final RiskClassifier riskClassifier;
    private final DefaultCohortProvider defaults;

    public DeveloperWellnessAdapter(RiskClassifier riskClassifier, DefaultCohortProvider defaults) {
        this.riskClassifier = riskClassifier;
        this.defaults = defaults;
    }

    public DeveloperProfile toProfile(String developerName,
                                      Optional<BurnoutAssessment> burnout,
                                      Optional<ProductivityReport> productivity) {
        DeveloperProfile fallback = defaults.defaultDeveloperProfile();
        Optional<Double> risk = burnout.map(BurnoutAssessment::riskScore);

        int streak = productivity.map(ProductivityReport::metrics)
                .map(ProductivityReport.Metrics::commitFrequency)
                .filter(days -> !days.isEmpty())
                .map(List::size)
                .orElse(fallback.currentStreak());

        return new DeveloperProfile(
                developerName != null && !developerName.isBlank() ? developerName : fallback.name(),
                streak,
                risk.map(r -> (int) Math.round(Math.max(0, 100 - r))).orElse(fallback.wellnessScore()),
                risk.map(riskClassifier::classify).orElse(fallback.riskLevel())
        );
    }

    public WellnessMetrics toMetrics(Optional<BurnoutAssessment> burnout, Optional<ProductivityReport> productivity) {
        WellnessMetrics fallback = defaults.defaultWellnessMetrics();
        return new WellnessMetrics(
                productivity.map(this::workLifeBalance).orElse(fallback.workLifeBalance()),
                productivity.map(ProductivityReport::metrics).map(this::codeQuality).orElse(fallback.codeQuality()),
                burnout.flatMap(this::collaborationHealth).orElse(fallback.collaborationHealth()),
                burnout.map(BurnoutAssessment::riskScore).orElse(fallback.stressLevel()),
                burnout.map(this::productivityTrend).orElse(fallback.productivityTrend())
        );
    }

    int workLifeBalance(ProductivityReport report) {
        double weekend = Optional.ofNullable(report.workPatterns())
                .map(ProductivityReport.WorkPatterns::weekendWorkPercentage)
                .orElse(DEFAULT_WEEKEND_PERCENTAGE);
        return (int) Math.round(Math.max(0, 100 - (weekend + AFTER_HOURS_PERCENTAGE)));
    }

    int codeQuality(ProductivityReport.Metrics metrics) {
        int commits = metrics.commitCount() != null ? metrics.commitCount() : 0;
        int prs = metrics.prCount() != null ? metrics.prCount() : 0;
        return (int) Math.round(Math.min(100, (double) commits / Math.max(1, prs) * 20));
    }

    Optional<Integer> collaborationHealth(BurnoutAssessment assessment) {
        return assessment.keyFactors().stream()
                .filter(f -> f != null && f.name() != null && f.name().contains("Collaboration"))
                .findFirst()
                .map(KeyFactor::impact)
                .map(impact -> (int) Math.round(Math.max(0, 100 - impact * 100)));
    }

    MemberTrend productivityTrend(BurnoutAssessment assessment) {
        List<TrendPoint> trend = assessment.historicalTrend();
        if (trend.size() < 2 || trend.get(0) == null || trend.get(trend.size() - 1) == null) {
            return MemberTrend.STABLE;
        }
        Double first = trend.get(0).value();
        Double last = trend.get(trend.size() - 1).value();
        if (first == null || last == null) {
            return MemberTrend.STABLE;
        }
        // the trend tracks risk, so a rising series means productivity is declining
        return last > first ? MemberTrend.DECLINING : MemberTrend.IMPROVING;
    }
}
