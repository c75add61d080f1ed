package tech.noetzold.devpulse_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.devpulse_api.model.DefectAssessment;
import tech.noetzold.devpulse_api.model.DefectReport;
import tech.noetzold.devpulse_api.model.ErrorCategory;
import tech.noetzold.devpulse_api.model.ErrorPriority;
import tech.noetzold.devpulse_api.model.PrioritizedDefectList;
import tech.noetzold.devpulse_api.model.PriorityLevel;
import tech.noetzold.devpulse_api.model.ReproductionComplexity;
import tech.noetzold.devpulse_api.model.Severity;
import tech.noetzold.devpulse_api.model.UserImpact;
import tech.noetzold.devpulse_api.scoring.DefectPriorityScorer;
import tech.noetzold.devpulse_api.scoring.ImpactClassifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class DefectTriageService {

    static final Comparator<DefectAssessment> TRIAGE_ORDER =
            Comparator.<DefectAssessment>comparingInt(a -> a.priority().level().rank())
                    .thenComparingInt(a -> a.impact().severity().rank());

    private final DefectPriorityScorer priorityScorer;
    private final ImpactClassifier impactClassifier;

    public DefectTriageService(DefectPriorityScorer priorityScorer, ImpactClassifier impactClassifier) {
        this.priorityScorer = priorityScorer;
        this.impactClassifier = impactClassifier;
    }

    public DefectAssessment assess(DefectReport defect) {
        ErrorPriority priority = priorityScorer.prioritize(defect);
        UserImpact impact = impactClassifier.assess(defect);
        return new DefectAssessment(
                defect.id(),
                title(defect),
                priority,
                impact,
                estimateFixTime(defect, priority.level()),
                dependencies(defect),
                reproductionComplexity(defect)
        );
    }

    public PrioritizedDefectList prioritize(List<DefectReport> defects) {
        List<DefectReport> input = defects == null ? List.of() : defects;

        Map<PriorityLevel, Integer> distribution = new EnumMap<>(PriorityLevel.class);
        for (PriorityLevel level : PriorityLevel.values()) {
            distribution.put(level, 0);
        }

        List<DefectAssessment> assessed = new ArrayList<>(input.size());
        for (DefectReport defect : input) {
            DefectAssessment a = assess(defect);
            distribution.merge(a.priority().level(), 1, Integer::sum);
            assessed.add(a);
        }

        // List.sort is a stable merge sort
        assessed.sort(TRIAGE_ORDER);

        log.debug("Prioritized {} defects: {}", assessed.size(), distribution);

        return new PrioritizedDefectList(
                input.size(),
                Collections.unmodifiableMap(distribution),
                List.copyOf(assessed),
                recommendations(assessed),
                nextActions(assessed)
        );
    }

    String title(DefectReport defect) {
        String severity = defect.severity() != null ? defect.severity().value().toUpperCase() : "UNKNOWN";
        String category = defect.category() != null ? capitalize(defect.category().value()) : "Unknown";
        String message = defect.message() != null ? defect.message() : "";
        if (message.length() > 50) {
            message = message.substring(0, 50) + "...";
        }
        return "[" + severity + "] " + category + ": " + message;
    }

    String estimateFixTime(DefectReport defect, PriorityLevel level) {
        double baseHours = 2;
        if (defect.category() == ErrorCategory.RUNTIME) baseHours = 4;
        else if (defect.category() == ErrorCategory.NETWORK) baseHours = 6;
        else if (defect.category() == ErrorCategory.RENDERING) baseHours = 3;

        if (defect.severity() == Severity.CRITICAL) baseHours *= 1.5;
        else if (defect.severity() == Severity.LOW) baseHours *= 0.5;

        if (level == PriorityLevel.P0) baseHours *= 2;
        else if (level == PriorityLevel.P4) baseHours *= 0.5;

        if (baseHours <= 4) return (int) Math.ceil(baseHours) + " hours";
        if (baseHours <= 16) return (int) Math.ceil(baseHours / 8) + " days";
        return (int) Math.ceil(baseHours / 40) + " weeks";
    }

    List<String> dependencies(DefectReport defect) {
        List<String> deps = new ArrayList<>();
        if (defect.category() == ErrorCategory.NETWORK) {
            deps.add("Backend API fixes");
            deps.add("Database schema updates");
        }
        if (defect.category() == ErrorCategory.RENDERING) {
            deps.add("Design system updates");
            deps.add("CSS framework changes");
        }
        if (defect.severity() == Severity.CRITICAL) {
            deps.add("Code review approval");
            deps.add("QA testing");
        }
        return List.copyOf(deps);
    }

    ReproductionComplexity reproductionComplexity(DefectReport defect) {
        int steps = defect.reproductionSteps().size();
        if (steps <= 3 && defect.category() != ErrorCategory.NETWORK) {
            return ReproductionComplexity.SIMPLE;
        }
        if (steps <= 6 || defect.category() == ErrorCategory.RENDERING) {
            return ReproductionComplexity.MODERATE;
        }
        return ReproductionComplexity.COMPLEX;
    }

    List<String> recommendations(List<DefectAssessment> sorted) {
        List<String> recs = new ArrayList<>();

        long p0 = countAt(sorted, PriorityLevel.P0);
        long p1 = countAt(sorted, PriorityLevel.P1);
        if (p0 > 0) {
            recs.add("Address " + p0 + " P0 blocker issues immediately before any other work");
        }
        if (p1 > 3) {
            recs.add("High volume of P1 issues (" + p1 + ") indicates systemic problems requiring architectural review");
        }

        long complex = sorted.stream()
                .filter(a -> a.reproductionComplexity() == ReproductionComplexity.COMPLEX)
                .count();
        if (complex > 2) {
            recs.add(complex + " complex errors may require additional investigation time");
        }

        recs.add("Focus on errors affecting multiple user roles first");
        recs.add("Consider grouping related errors for batch fixing");
        return List.copyOf(recs);
    }

    List<String> nextActions(List<DefectAssessment> sorted) {
        List<String> actions = new ArrayList<>();
        actions.add("Review and assign top 5 priority errors to appropriate team members");
        actions.add("Set up daily standup to track progress on critical errors");
        actions.add("Create error monitoring dashboard for ongoing tracking");

        boolean p0InTopFive = sorted.stream()
                .limit(5)
                .anyMatch(a -> a.priority().level() == PriorityLevel.P0);
        if (p0InTopFive) {
            actions.add("Establish war room for P0 blocker resolution");
        }

        actions.add("Schedule retrospective to identify root causes and prevention strategies");
        return List.copyOf(actions);
    }

    private static long countAt(List<DefectAssessment> assessed, PriorityLevel level) {
        return assessed.stream().filter(a -> a.priority().level() == level).count();
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
