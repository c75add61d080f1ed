package tech.noetzold.devpulse_api.service;

import org.springframework.stereotype.Component;
import tech.noetzold.devpulse_api.model.CapacityBand;
import tech.noetzold.devpulse_api.model.CapacityBucket;
import tech.noetzold.devpulse_api.model.RiskLevel;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.model.TeamOverview;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Team-level statistics, recomputed from the members on every call.
 */
@Component
public class TeamCohortAggregator {

    static final int NEUTRAL_MORALE = 50;
    static final int BURNOUT_PREVENTED = 3;

    public TeamOverview summarize(List<TeamMember> members) {
        if (members == null || members.isEmpty()) {
            return new TeamOverview(0, 0, 0, 0, 0, NEUTRAL_MORALE, 0, 0);
        }

        int size = members.size();
        long capacitySum = 0;
        int highRisk = 0;
        int optimal = 0;
        int needsSupport = 0;
        int totalVelocity = 0;
        double moraleSum = 0;

        for (TeamMember m : members) {
            capacitySum += m.capacity();
            boolean isHighRisk = m.burnoutRisk() == RiskLevel.HIGH;
            if (isHighRisk) highRisk++;
            if (m.capacity() >= 60 && m.capacity() <= 80) optimal++;
            if (isHighRisk || m.capacity() > 90) needsSupport++;
            totalVelocity += m.velocity();
            moraleSum += m.wellnessFactor() * 100;
        }

        int averageCapacity = (int) Math.round((double) capacitySum / size);
        int teamMorale = (int) Math.round(moraleSum / size);
        int interventions = highRisk + (int) Math.floor(size * 0.3);

        return new TeamOverview(
                averageCapacity,
                highRisk,
                optimal,
                needsSupport,
                totalVelocity,
                teamMorale,
                BURNOUT_PREVENTED,
                interventions
        );
    }

    public List<CapacityBucket> capacityDistribution(List<TeamMember> members) {
        Map<CapacityBand, Integer> counts = new EnumMap<>(CapacityBand.class);
        for (CapacityBand band : CapacityBand.values()) {
            counts.put(band, 0);
        }
        if (members != null) {
            for (TeamMember m : members) {
                counts.merge(CapacityBand.of(m.capacity()), 1, Integer::sum);
            }
        }

        List<CapacityBucket> buckets = new ArrayList<>(counts.size());
        for (CapacityBand band : CapacityBand.values()) {
            buckets.add(new CapacityBucket(band.range(), counts.get(band), band.color(), band.label()));
        }
        return buckets;
    }
}
