package tech.noetzold.devpulse_api.service;

import org.junit.jupiter.api.Test;
import tech.noetzold.devpulse_api.model.AlertType;
import tech.noetzold.devpulse_api.model.MemberAlert;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.RiskLevel;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.scoring.RiskClassifier;
import tech.noetzold.devpulse_api.service.TeamMemberFactory.MemberSeed;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TeamMemberFactoryTest {

    private final TeamMemberFactory factory = new TeamMemberFactory(new RiskClassifier());

    private static MemberSeed seed(double risk, Double wellness) {
        return new MemberSeed("7", "Dana", "QA Engineer", 70, risk, null, 80, wellness, 90);
    }

    @Test
    void create_highRisk_derivesStressAlertsAndRecommendations() {
        TeamMember m = factory.create(seed(85, null), List.of());

        assertThat(m.burnoutRisk()).isEqualTo(RiskLevel.HIGH);
        assertThat(m.wellnessFactor()).isEqualTo(0.7);
        assertThat(m.stressMultiplier()).isEqualTo(1.3);
        assertThat(m.trend()).isEqualTo(MemberTrend.STABLE);
        assertThat(m.alerts()).extracting(MemberAlert::type)
                .containsExactly(AlertType.CRITICAL, AlertType.WARNING);
        assertThat(m.recommendations()).first().isEqualTo("Redistribute 2-3 tasks from backlog");
    }

    @Test
    void create_lowRisk_getsInfoAlert() {
        TeamMember m = factory.create(seed(20, null), List.of());

        assertThat(m.burnoutRisk()).isEqualTo(RiskLevel.LOW);
        assertThat(m.wellnessFactor()).isEqualTo(0.95);
        assertThat(m.stressMultiplier()).isEqualTo(0.9);
        assertThat(m.alerts()).extracting(MemberAlert::type).containsExactly(AlertType.INFO);
    }

    @Test
    void create_upstreamRecommendations_takeFirstThree() {
        TeamMember m = factory.create(seed(50, 0.6), List.of("a", "b", "c", "d"));

        assertThat(m.recommendations()).containsExactly("a", "b", "c");
        assertThat(m.wellnessFactor()).isEqualTo(0.6);
        assertThat(m.burnoutRisk()).isEqualTo(RiskLevel.MODERATE);
        assertThat(m.alerts()).isEmpty();
    }
}
