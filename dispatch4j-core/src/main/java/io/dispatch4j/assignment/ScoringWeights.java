package io.dispatch4j.assignment;

/**
 * Multipliers, thresholds and raw bonus/penalty values for robot scoring.
 * Every factor's raw value is multiplied by its weight before it is added to the base score.
 */
public final class ScoringWeights {
    private final double cpuLoadWeight;
    private final double memoryLoadWeight;
    private final double tagMatchWeight;
    private final double stateAffinityWeight;
    private final double networkProximityWeight;
    private final double jobCountWeight;

    private final double cpuHighThreshold;
    private final double cpuMediumThreshold;
    private final double memoryHighThreshold;
    private final double memoryMediumThreshold;

    private final double highLoadPenalty;
    private final double mediumLoadPenalty;
    private final double tagMatchBonus;
    private final double stateAffinityBonus;
    private final double sameZoneBonus;

    private ScoringWeights(Builder b) {
        this.cpuLoadWeight = b.cpuLoadWeight;
        this.memoryLoadWeight = b.memoryLoadWeight;
        this.tagMatchWeight = b.tagMatchWeight;
        this.stateAffinityWeight = b.stateAffinityWeight;
        this.networkProximityWeight = b.networkProximityWeight;
        this.jobCountWeight = b.jobCountWeight;
        this.cpuHighThreshold = b.cpuHighThreshold;
        this.cpuMediumThreshold = b.cpuMediumThreshold;
        this.memoryHighThreshold = b.memoryHighThreshold;
        this.memoryMediumThreshold = b.memoryMediumThreshold;
        this.highLoadPenalty = b.highLoadPenalty;
        this.mediumLoadPenalty = b.mediumLoadPenalty;
        this.tagMatchBonus = b.tagMatchBonus;
        this.stateAffinityBonus = b.stateAffinityBonus;
        this.sameZoneBonus = b.sameZoneBonus;
    }

    public static ScoringWeights defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double cpuLoadWeight() {
        return cpuLoadWeight;
    }

    public double memoryLoadWeight() {
        return memoryLoadWeight;
    }

    public double tagMatchWeight() {
        return tagMatchWeight;
    }

    public double stateAffinityWeight() {
        return stateAffinityWeight;
    }

    public double networkProximityWeight() {
        return networkProximityWeight;
    }

    public double jobCountWeight() {
        return jobCountWeight;
    }

    public double cpuHighThreshold() {
        return cpuHighThreshold;
    }

    public double cpuMediumThreshold() {
        return cpuMediumThreshold;
    }

    public double memoryHighThreshold() {
        return memoryHighThreshold;
    }

    public double memoryMediumThreshold() {
        return memoryMediumThreshold;
    }

    public double highLoadPenalty() {
        return highLoadPenalty;
    }

    public double mediumLoadPenalty() {
        return mediumLoadPenalty;
    }

    public double tagMatchBonus() {
        return tagMatchBonus;
    }

    public double stateAffinityBonus() {
        return stateAffinityBonus;
    }

    public double sameZoneBonus() {
        return sameZoneBonus;
    }

    public static final class Builder {
        private double cpuLoadWeight = 1.0;
        private double memoryLoadWeight = 0.8;
        private double tagMatchWeight = 1.5;
        private double stateAffinityWeight = 2.0;
        private double networkProximityWeight = 0.5;
        private double jobCountWeight = 1.2;

        private double cpuHighThreshold = 80.0;
        private double cpuMediumThreshold = 60.0;
        private double memoryHighThreshold = 85.0;
        private double memoryMediumThreshold = 70.0;

        private double highLoadPenalty = 50.0;
        private double mediumLoadPenalty = 25.0;
        private double tagMatchBonus = 20.0;
        private double stateAffinityBonus = 100.0;
        private double sameZoneBonus = 15.0;

        private Builder() {
        }

        public Builder cpuLoadWeight(double v) {
            this.cpuLoadWeight = nonNegative(v, "cpuLoadWeight");
            return this;
        }

        public Builder memoryLoadWeight(double v) {
            this.memoryLoadWeight = nonNegative(v, "memoryLoadWeight");
            return this;
        }

        public Builder tagMatchWeight(double v) {
            this.tagMatchWeight = nonNegative(v, "tagMatchWeight");
            return this;
        }

        public Builder stateAffinityWeight(double v) {
            this.stateAffinityWeight = nonNegative(v, "stateAffinityWeight");
            return this;
        }

        public Builder networkProximityWeight(double v) {
            this.networkProximityWeight = nonNegative(v, "networkProximityWeight");
            return this;
        }

        public Builder jobCountWeight(double v) {
            this.jobCountWeight = nonNegative(v, "jobCountWeight");
            return this;
        }

        public Builder cpuThresholds(double medium, double high) {
            checkThresholds(medium, high, "cpu");
            this.cpuMediumThreshold = medium;
            this.cpuHighThreshold = high;
            return this;
        }

        public Builder memoryThresholds(double medium, double high) {
            checkThresholds(medium, high, "memory");
            this.memoryMediumThreshold = medium;
            this.memoryHighThreshold = high;
            return this;
        }

        public Builder loadPenalties(double medium, double high) {
            this.mediumLoadPenalty = nonNegative(medium, "mediumLoadPenalty");
            this.highLoadPenalty = nonNegative(high, "highLoadPenalty");
            return this;
        }

        public Builder tagMatchBonus(double v) {
            this.tagMatchBonus = nonNegative(v, "tagMatchBonus");
            return this;
        }

        public Builder stateAffinityBonus(double v) {
            this.stateAffinityBonus = nonNegative(v, "stateAffinityBonus");
            return this;
        }

        public Builder sameZoneBonus(double v) {
            this.sameZoneBonus = nonNegative(v, "sameZoneBonus");
            return this;
        }

        public ScoringWeights build() {
            return new ScoringWeights(this);
        }

        private static double nonNegative(double v, String name) {
            if (v < 0 || Double.isNaN(v)) {
                throw new IllegalArgumentException(name + " must be a non-negative number");
            }
            return v;
        }

        private static void checkThresholds(double medium, double high, String kind) {
            if (medium < 0 || high > 100 || medium > high) {
                throw new IllegalArgumentException(kind + " thresholds must satisfy 0 <= medium <= high <= 100");
            }
        }
    }
}
