package tech.noetzold.devpulse_api.model;

/**
 * Fixed capacity buckets. Lower bound inclusive, upper bound exclusive; the last band is open-ended.
 */
public enum CapacityBand {
    UNDERUTILIZED(Integer.MIN_VALUE, 60, "0-60%", "bg-green-500", "Underutilized"),
    OPTIMAL(60, 80, "60-80%", "bg-blue-500", "Optimal"),
    HIGH(80, 90, "80-90%", "bg-yellow-500", "High"),
    CRITICAL(90, Integer.MAX_VALUE, "90-100%", "bg-red-500", "Critical");

    private final int lowerInclusive;
    private final int upperExclusive;
    private final String range;
    private final String color;
    private final String label;

    CapacityBand(int lowerInclusive, int upperExclusive, String range, String color, String label) {
        this.lowerInclusive = lowerInclusive;
        this.upperExclusive = upperExclusive;
        this.range = range;
        this.color = color;
        this.label = label;
    }

    public boolean contains(int capacity) {
        return capacity >= lowerInclusive && capacity < upperExclusive;
    }

    public String range() {
        return range;
    }

    public String color() {
        return color;
    }

    public String label() {
        return label;
    }

    public static CapacityBand of(int capacity) {
        for (CapacityBand band : values()) {
            if (band.contains(capacity)) return band;
        }
        return CRITICAL;
    }
}
