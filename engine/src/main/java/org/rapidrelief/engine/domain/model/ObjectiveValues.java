package org.rapidrelief.engine.domain.model;

/**
 * Raw objective values of an allocation solution.
 */
public final class ObjectiveValues {

    private final double responseTime;
    private final double coverageRate;
    private final double cost;
    private final double risk;

    public ObjectiveValues(double responseTime, double coverageRate, double cost, double risk) {
        this.responseTime = responseTime;
        this.coverageRate = coverageRate;
        this.cost = cost;
        this.risk = risk;
    }

    /**
     * Minutes until the slowest selected resource arrives.
     */
    public double getResponseTime() {
        return responseTime;
    }

    public double getCoverageRate() {
        return coverageRate;
    }

    public double getCost() {
        return cost;
    }

    public double getRisk() {
        return risk;
    }

    @Override
    public String toString() {
        return String.format("{responseTime=%.1f, coverage=%.2f, cost=%.1f, risk=%.3f}",
                responseTime, coverageRate, cost, risk);
    }
}
