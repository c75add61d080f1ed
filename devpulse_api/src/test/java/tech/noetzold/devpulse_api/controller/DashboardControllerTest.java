package tech.noetzold.devpulse_api.controller;

import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import tech.noetzold.devpulse_api.model.CapacityDashboard;
import tech.noetzold.devpulse_api.model.DeveloperProfile;
import tech.noetzold.devpulse_api.model.HealthStatus;
import tech.noetzold.devpulse_api.model.MemberTrend;
import tech.noetzold.devpulse_api.model.RiskLevel;
import tech.noetzold.devpulse_api.model.ServiceResponse;
import tech.noetzold.devpulse_api.model.TeamAnalytics;
import tech.noetzold.devpulse_api.model.TeamOverview;
import tech.noetzold.devpulse_api.model.WellnessDashboard;
import tech.noetzold.devpulse_api.model.WellnessMetrics;
import tech.noetzold.devpulse_api.service.DashboardDataService;

import java.util.List;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DashboardController.class)
class DashboardControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DashboardDataService service;

    private static CapacityDashboard dashboard() {
        return new CapacityDashboard(
                List.of(),
                new TeamOverview(81, 1, 2, 1, 323, 81, 3, 2),
                new TeamAnalytics("platform",
                        new TeamAnalytics.VelocityMetrics(8.5, "increasing", 12.3),
                        new TeamAnalytics.CollaborationMetrics(0.75, List.of())),
                List.of());
    }

    @Test
    void capacity_returnsServiceResponse() throws Exception {
        when(service.fetchCapacityDashboard("platform", "viewer-1"))
                .thenReturn(ServiceResponse.success(dashboard()));

        mockMvc.perform(get("/dashboard/capacity")
                        .param("team_id", "platform")
                        .param("viewer_id", "viewer-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isLoading").value(false))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(jsonPath("$.data.teamOverview.averageCapacity").value(81))
                .andExpect(jsonPath("$.data.teamAnalytics.teamId").value("platform"));
    }

    @Test
    void capacity_defaultsTeamAndViewer() throws Exception {
        when(service.fetchCapacityDashboard("default", "anonymous"))
                .thenReturn(ServiceResponse.failure("Failed to load capacity dashboard data"));

        mockMvc.perform(get("/dashboard/capacity"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").doesNotExist())
                .andExpect(jsonPath("$.error").value("Failed to load capacity dashboard data"));
    }

    @Test
    void refresh_clearsEntryBeforeReloading() throws Exception {
        when(service.fetchCapacityDashboard("platform", "anonymous"))
                .thenReturn(ServiceResponse.success(dashboard()));

        mockMvc.perform(post("/dashboard/capacity/refresh").param("team_id", "platform"))
                .andExpect(status().isOk());

        InOrder order = inOrder(service);
        order.verify(service).refresh("platform", "anonymous");
        order.verify(service).fetchCapacityDashboard("platform", "anonymous");
    }

    @Test
    void wellness_defaultsRepositoryAndViewer() throws Exception {
        when(service.fetchWellnessDashboard("default", "anonymous"))
                .thenReturn(ServiceResponse.success(new WellnessDashboard(null,
                        new DeveloperProfile("Developer", 12, 78, RiskLevel.MODERATE),
                        new WellnessMetrics(72, 88, 81, 34, MemberTrend.STABLE))));

        mockMvc.perform(get("/dashboard/wellness"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.developerProfile.wellnessScore").value(78))
                .andExpect(jsonPath("$.data.developerProfile.riskLevel").value("moderate"))
                .andExpect(jsonPath("$.data.wellnessMetrics.codeQuality").value(88));
    }

    @Test
    void wellnessRefresh_clearsEntryBeforeReloading() throws Exception {
        when(service.fetchWellnessDashboard("repo-7", "dana"))
                .thenReturn(ServiceResponse.failure("Failed to load wellness dashboard data"));

        mockMvc.perform(post("/dashboard/wellness/refresh")
                        .param("repository_id", "repo-7")
                        .param("viewer_id", "dana"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("Failed to load wellness dashboard data"));

        InOrder order = inOrder(service);
        order.verify(service).refreshWellness("repo-7", "dana");
        order.verify(service).fetchWellnessDashboard("repo-7", "dana");
    }

    @Test
    void clearCache_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/dashboard/cache").param("key", "capacity-platform-anonymous"))
                .andExpect(status().isNoContent());

        verify(service).clearCache("capacity-platform-anonymous");
    }

    @Test
    void health_allUp_isOk() throws Exception {
        when(service.healthCheck()).thenReturn(new HealthStatus(true, true, true));

        mockMvc.perform(get("/dashboard/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall").value(true));
    }

    @Test
    void health_sourceDown_isServiceUnavailable() throws Exception {
        when(service.healthCheck()).thenReturn(new HealthStatus(true, false, false));

        mockMvc.perform(get("/dashboard/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.burnout").value(false));
    }
}
