package tech.noetzold.devpulse_api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import tech.noetzold.devpulse_api.client.BurnoutAssessmentClient;
import tech.noetzold.devpulse_api.client.ProductivityClient;
import tech.noetzold.devpulse_api.client.TeamAnalyticsClient;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;
import tech.noetzold.devpulse_api.model.CapacityDashboard;
import tech.noetzold.devpulse_api.model.HealthStatus;
import tech.noetzold.devpulse_api.model.ProductivityReport;
import tech.noetzold.devpulse_api.model.ServiceResponse;
import tech.noetzold.devpulse_api.model.TeamAnalyticsPayload;
import tech.noetzold.devpulse_api.model.TeamMember;
import tech.noetzold.devpulse_api.model.UpstreamErrorCode;
import tech.noetzold.devpulse_api.model.WellnessDashboard;
import tech.noetzold.devpulse_api.repository.TtlCache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Read paths for the capacity (team) and wellness (single developer) dashboards. Serves from the TTL cache when it
 * can, otherwise fans out to the upstream sources, substitutes defaults for whichever source came back empty or
 * failed, and aggregates. Never throws: a total failure comes back as a {@link ServiceResponse} carrying an error.
 */
@Slf4j
@Service
public class DashboardDataService {

    public static final String DEFAULT_TEAM_ID = "default";
    public static final String DEFAULT_VIEWER_ID = "anonymous";
    public static final String DEFAULT_REPOSITORY_ID = "default";
    static final String LOAD_FAILED = "Failed to load capacity dashboard data";
    static final String WELLNESS_LOAD_FAILED = "Failed to load wellness dashboard data";

    private final TeamAnalyticsClient teamClient;
    private final BurnoutAssessmentClient burnoutClient;
    private final ProductivityClient productivityClient;
    private final TeamCohortAdapter adapter;
    private final DeveloperWellnessAdapter wellnessAdapter;
    private final TeamCohortAggregator aggregator;
    private final TtlCache cache;
    private final RetryExecutor retryExecutor;
    private final Executor fanOutExecutor;
    private final Duration defaultTtl;
    private final int maxRetries;
    private final Duration retryDelay;

    public DashboardDataService(TeamAnalyticsClient teamClient,
                                BurnoutAssessmentClient burnoutClient,
                                ProductivityClient productivityClient,
                                TeamCohortAdapter adapter,
                                DeveloperWellnessAdapter wellnessAdapter,
                                TeamCohortAggregator aggregator,
                                TtlCache cache,
                                RetryExecutor retryExecutor,
                                @Qualifier("dashboardFanOutExecutor") Executor fanOutExecutor,
                                @Value("${devpulse.cache.ttl-ms:300000}") long ttlMs,
                                @Value("${devpulse.retry.max-attempts:3}") int maxRetries,
                                @Value("${devpulse.retry.base-delay-ms:1000}") long retryDelayMs) {
        this.teamClient = teamClient;
        this.burnoutClient = burnoutClient;
        this.productivityClient = productivityClient;
        this.adapter = adapter;
        this.wellnessAdapter = wellnessAdapter;
        this.aggregator = aggregator;
        this.cache = cache;
        this.retryExecutor = retryExecutor;
        this.fanOutExecutor = fanOutExecutor;
        this.defaultTtl = Duration.ofMillis(ttlMs);
        this.maxRetries = maxRetries;
        this.retryDelay = Duration.ofMillis(retryDelayMs);
    }

    public ServiceResponse<CapacityDashboard> fetchCapacityDashboard(String teamId, String viewerId) {
        return fetchCapacityDashboard(teamId, viewerId, defaultTtl);
    }

    public ServiceResponse<CapacityDashboard> fetchCapacityDashboard(String teamId, String viewerId, Duration ttl) {
        String team = orDefault(teamId, DEFAULT_TEAM_ID);
        String key = cacheKey(team, orDefault(viewerId, DEFAULT_VIEWER_ID));

        Optional<CapacityDashboard> cached = cache.get(key, CapacityDashboard.class);
        if (cached.isPresent()) {
            log.debug("Serving capacity dashboard {} from cache", key);
            return ServiceResponse.success(cached.get());
        }

        ServiceResponse<CapacityDashboard> result = loadCapacityDashboard(team);
        if (result.data() != null && result.error() == null) {
            cache.put(key, result.data(), ttl);
        }
        return result;
    }

    ServiceResponse<CapacityDashboard> loadCapacityDashboard(String teamId) {
        try {
            CompletableFuture<SourceResult<TeamAnalyticsPayload>> teamFuture = CompletableFuture.supplyAsync(
                    () -> attempt("team-analytics", () -> teamClient.fetchTeamAnalytics(teamId)), fanOutExecutor);
            CompletableFuture<SourceResult<BurnoutAssessment>> burnoutFuture = CompletableFuture.supplyAsync(
                    () -> attempt("burnout-assessment", burnoutClient::fetchAssessment), fanOutExecutor);

            SourceResult<TeamAnalyticsPayload> team = teamFuture.join();
            SourceResult<BurnoutAssessment> burnout = burnoutFuture.join();

            if (team.failure() != null && burnout.failure() != null) {
                UpstreamUnavailableException all = new UpstreamUnavailableException("all analytics sources", team.failure());
                all.addSuppressed(burnout.failure());
                throw all;
            }

            List<TeamMember> members = adapter.toMembers(team.value(), burnout.value());
            CapacityDashboard dashboard = new CapacityDashboard(
                    members,
                    aggregator.summarize(members),
                    adapter.toAnalytics(team.value(), teamId),
                    aggregator.capacityDistribution(members)
            );
            return ServiceResponse.success(dashboard);
        } catch (Exception e) {
            log.error("Error fetching capacity dashboard data for team {}: {}", teamId, e.getMessage(), e);
            return ServiceResponse.failure(LOAD_FAILED);
        }
    }

    public ServiceResponse<WellnessDashboard> fetchWellnessDashboard(String repositoryId, String viewerId) {
        return fetchWellnessDashboard(repositoryId, viewerId, defaultTtl);
    }

    public ServiceResponse<WellnessDashboard> fetchWellnessDashboard(String repositoryId, String viewerId,
                                                                     Duration ttl) {
        String repository = orDefault(repositoryId, DEFAULT_REPOSITORY_ID);
        String viewer = orDefault(viewerId, DEFAULT_VIEWER_ID);
        String key = wellnessCacheKey(repository, viewer);

        Optional<WellnessDashboard> cached = cache.get(key, WellnessDashboard.class);
        if (cached.isPresent()) {
            log.debug("Serving wellness dashboard {} from cache", key);
            return ServiceResponse.success(cached.get());
        }

        ServiceResponse<WellnessDashboard> result = loadWellnessDashboard(repository, viewer);
        if (result.data() != null && result.error() == null) {
            cache.put(key, result.data(), ttl);
        }
        return result;
    }

    ServiceResponse<WellnessDashboard> loadWellnessDashboard(String repositoryId, String viewerId) {
        try {
            CompletableFuture<SourceResult<BurnoutAssessment>> burnoutFuture = CompletableFuture.supplyAsync(
                    () -> attempt("burnout-assessment", () -> burnoutClient.fetchAssessment(repositoryId)),
                    fanOutExecutor);
            CompletableFuture<SourceResult<ProductivityReport>> productivityFuture = CompletableFuture.supplyAsync(
                    () -> attempt("productivity", productivityClient::fetchProductivity), fanOutExecutor);

            SourceResult<BurnoutAssessment> burnout = burnoutFuture.join();
            SourceResult<ProductivityReport> productivity = productivityFuture.join();

            if (burnout.failure() != null && productivity.failure() != null) {
                UpstreamUnavailableException all =
                        new UpstreamUnavailableException("all wellness sources", burnout.failure());
                all.addSuppressed(productivity.failure());
                throw all;
            }

            String developer = DEFAULT_VIEWER_ID.equals(viewerId) ? null : viewerId;
            WellnessDashboard dashboard = new WellnessDashboard(
                    burnout.value().orElse(null),
                    wellnessAdapter.toProfile(developer, burnout.value(), productivity.value()),
                    wellnessAdapter.toMetrics(burnout.value(), productivity.value())
            );
            return ServiceResponse.success(dashboard);
        } catch (Exception e) {
            log.error("Error fetching wellness dashboard data for repository {}: {}", repositoryId, e.getMessage(), e);
            return ServiceResponse.failure(WELLNESS_LOAD_FAILED);
        }
    }

    private <T> SourceResult<T> attempt(String source, Callable<Optional<T>> call) {
        try {
            Optional<T> value = retryExecutor.withRetry(call, maxRetries, retryDelay);
            if (value.isEmpty()) {
                log.debug("{} had no usable data, substituting defaults", source);
            }
            return new SourceResult<>(value, null);
        } catch (Exception e) {
            log.debug("{} failed, substituting defaults: {}", source, e.getMessage());
            return new SourceResult<>(Optional.empty(), e);
        }
    }

    public ServiceResponse<CapacityDashboard> loadingState() {
        return ServiceResponse.loading();
    }

    public void clearCache(String key) {
        if (key == null || key.isBlank()) {
            cache.invalidateAll();
        } else {
            cache.invalidate(key);
        }
    }

    public void clearCache() {
        cache.invalidateAll();
    }

    public void refresh(String teamId, String viewerId) {
        clearCache(cacheKey(orDefault(teamId, DEFAULT_TEAM_ID), orDefault(viewerId, DEFAULT_VIEWER_ID)));
    }

    public void refreshWellness(String repositoryId, String viewerId) {
        clearCache(wellnessCacheKey(orDefault(repositoryId, DEFAULT_REPOSITORY_ID),
                orDefault(viewerId, DEFAULT_VIEWER_ID)));
    }

    public HealthStatus healthCheck() {
        try {
            CompletableFuture<Boolean> team = CompletableFuture.supplyAsync(teamClient::isHealthy, fanOutExecutor);
            CompletableFuture<Boolean> burnout = CompletableFuture.supplyAsync(burnoutClient::isHealthy, fanOutExecutor);
            boolean teamOk = team.join();
            boolean burnoutOk = burnout.join();
            return new HealthStatus(teamOk, burnoutOk, teamOk && burnoutOk);
        } catch (Exception e) {
            log.warn("Dashboard health check failed: {}", e.getMessage());
            return HealthStatus.down();
        }
    }

    public static String describeError(String code, String message) {
        if (code != null) {
            UpstreamErrorCode known = UpstreamErrorCode.fromCode(code);
            return known != null ? known.userMessage() : "An unexpected error occurred. Please try again.";
        }
        if (message != null && !message.isBlank()) {
            return message;
        }
        return "An unknown error occurred while loading dashboard data.";
    }

    public static String cacheKey(String teamId, String viewerId) {
        return "capacity-" + teamId + "-" + viewerId;
    }

    public static String wellnessCacheKey(String repositoryId, String viewerId) {
        return "wellness-" + repositoryId + "-" + viewerId;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private record SourceResult<T>(Optional<T> value, Exception failure) {}
}
