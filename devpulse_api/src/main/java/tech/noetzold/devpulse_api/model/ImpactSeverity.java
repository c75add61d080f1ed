package tech.noetzold.devpulse_api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * User impact tiers. Declaration order is the rank, most severe first.
 */
public enum ImpactSeverity {
    BLOCKER("blocker", 100,
            "Prevents users from completing core tasks",
            "Application becomes unusable"),
    CRITICAL("critical", 75,
            "Significantly impacts user productivity",
            "Major disruption to user workflow"),
    MAJOR("major", 50,
            "Reduces user efficiency",
            "Noticeable impact on user experience"),
    MINOR("minor", 25,
            "Minor impact on user tasks",
            "Slight inconvenience to users"),
    TRIVIAL("trivial", 10,
            "Minimal business impact",
            "Barely noticeable to users");

    private final String value;
    private final int estimatedAffectedUsers;
    private final String businessImpact;
    private final String userExperienceImpact;

    ImpactSeverity(String value, int estimatedAffectedUsers, String businessImpact, String userExperienceImpact) {
        this.value = value;
        this.estimatedAffectedUsers = estimatedAffectedUsers;
        this.businessImpact = businessImpact;
        this.userExperienceImpact = userExperienceImpact;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int estimatedAffectedUsers() {
        return estimatedAffectedUsers;
    }

    public String businessImpact() {
        return businessImpact;
    }

    public String userExperienceImpact() {
        return userExperienceImpact;
    }

    public int rank() {
        return ordinal();
    }
}
