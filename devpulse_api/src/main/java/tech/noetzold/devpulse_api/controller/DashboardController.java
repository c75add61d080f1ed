package tech.noetzold.devpulse_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.devpulse_api.model.CapacityDashboard;
import tech.noetzold.devpulse_api.model.HealthStatus;
import tech.noetzold.devpulse_api.model.ServiceResponse;
import tech.noetzold.devpulse_api.model.WellnessDashboard;
import tech.noetzold.devpulse_api.service.DashboardDataService;

@RestController
@RequestMapping("/dashboard")
@Tag(name = "Dashboard")
public class DashboardController {

    private final DashboardDataService service;

    public DashboardController(DashboardDataService service) {
        this.service = service;
    }

    @GetMapping("/capacity")
    public ServiceResponse<CapacityDashboard> capacity(
            @RequestParam(name = "team_id", defaultValue = DashboardDataService.DEFAULT_TEAM_ID) String teamId,
            @RequestParam(name = "viewer_id", defaultValue = DashboardDataService.DEFAULT_VIEWER_ID) String viewerId) {
        return service.fetchCapacityDashboard(teamId, viewerId);
    }

    @PostMapping("/capacity/refresh")
    public ServiceResponse<CapacityDashboard> refresh(
            @RequestParam(name = "team_id", defaultValue = DashboardDataService.DEFAULT_TEAM_ID) String teamId,
            @RequestParam(name = "viewer_id", defaultValue = DashboardDataService.DEFAULT_VIEWER_ID) String viewerId) {
        service.refresh(teamId, viewerId);
        return service.fetchCapacityDashboard(teamId, viewerId);
    }

    @GetMapping("/wellness")
    public ServiceResponse<WellnessDashboard> wellness(
            @RequestParam(name = "repository_id", defaultValue = DashboardDataService.DEFAULT_REPOSITORY_ID) String repositoryId,
            @RequestParam(name = "viewer_id", defaultValue = DashboardDataService.DEFAULT_VIEWER_ID) String viewerId) {
        return service.fetchWellnessDashboard(repositoryId, viewerId);
    }

    @PostMapping("/wellness/refresh")
    public ServiceResponse<WellnessDashboard> refreshWellness(
            @RequestParam(name = "repository_id", defaultValue = DashboardDataService.DEFAULT_REPOSITORY_ID) String repositoryId,
            @RequestParam(name = "viewer_id", defaultValue = DashboardDataService.DEFAULT_VIEWER_ID) String viewerId) {
        service.refreshWellness(repositoryId, viewerId);
        return service.fetchWellnessDashboard(repositoryId, viewerId);
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Void> clearCache(@RequestParam(name = "key", required = false) String key) {
        service.clearCache(key);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus status = service.healthCheck();
        return status.overall()
                ? ResponseEntity.ok(status)
                : ResponseEntity.status(503).body(status);
    }
}
