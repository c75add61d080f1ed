package tech.noetzold.devpulse_api.model;

/**
 * Defect priority tiers. Declaration order is the rank, most severe first.
 */
public enum PriorityLevel {
    P0("Critical blocker requiring immediate attention"),
    P1("High priority issue affecting core functionality"),
    P2("Medium priority issue requiring timely resolution"),
    P3("Low priority issue for future resolution"),
    P4("Minor issue with minimal impact");

    private final String reasoning;

    PriorityLevel(String reasoning) {
        this.reasoning = reasoning;
    }

    public String reasoning() {
        return reasoning;
    }

    public int rank() {
        return ordinal();
    }
}
