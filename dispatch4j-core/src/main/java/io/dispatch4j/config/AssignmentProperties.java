package io.dispatch4j.config;

import io.dispatch4j.assignment.ScoringWeights;

import java.time.Duration;

/**
 * Runtime configuration for the job assignment engine. Unset weights keep the
 * {@link ScoringWeights#defaults()} values.
 */
public class AssignmentProperties {
    private String networkZone = "default";
    private Duration stateTtl = Duration.ofHours(1);
    private Double cpuLoadWeight;
    private Double memoryLoadWeight;
    private Double tagMatchWeight;
    private Double stateAffinityWeight;
    private Double networkProximityWeight;
    private Double jobCountWeight;

    public ScoringWeights toWeights() {
        ScoringWeights.Builder b = ScoringWeights.builder();
        if (cpuLoadWeight != null) b.cpuLoadWeight(cpuLoadWeight);
        if (memoryLoadWeight != null) b.memoryLoadWeight(memoryLoadWeight);
        if (tagMatchWeight != null) b.tagMatchWeight(tagMatchWeight);
        if (stateAffinityWeight != null) b.stateAffinityWeight(stateAffinityWeight);
        if (networkProximityWeight != null) b.networkProximityWeight(networkProximityWeight);
        if (jobCountWeight != null) b.jobCountWeight(jobCountWeight);
        return b.build();
    }

    public String getNetworkZone() {
        return networkZone;
    }

    public void setNetworkZone(String networkZone) {
        this.networkZone = networkZone;
    }

    public Duration getStateTtl() {
        return stateTtl;
    }

    public void setStateTtl(Duration stateTtl) {
        this.stateTtl = stateTtl;
    }

    public Double getCpuLoadWeight() {
        return cpuLoadWeight;
    }

    public void setCpuLoadWeight(Double cpuLoadWeight) {
        this.cpuLoadWeight = cpuLoadWeight;
    }

    public Double getMemoryLoadWeight() {
        return memoryLoadWeight;
    }

    public void setMemoryLoadWeight(Double memoryLoadWeight) {
        this.memoryLoadWeight = memoryLoadWeight;
    }

    public Double getTagMatchWeight() {
        return tagMatchWeight;
    }

    public void setTagMatchWeight(Double tagMatchWeight) {
        this.tagMatchWeight = tagMatchWeight;
    }

    public Double getStateAffinityWeight() {
        return stateAffinityWeight;
    }

    public void setStateAffinityWeight(Double stateAffinityWeight) {
        this.stateAffinityWeight = stateAffinityWeight;
    }

    public Double getNetworkProximityWeight() {
        return networkProximityWeight;
    }

    public void setNetworkProximityWeight(Double networkProximityWeight) {
        this.networkProximityWeight = networkProximityWeight;
    }

    public Double getJobCountWeight() {
        return jobCountWeight;
    }

    public void setJobCountWeight(Double jobCountWeight) {
        this.jobCountWeight = jobCountWeight;
    }
}
