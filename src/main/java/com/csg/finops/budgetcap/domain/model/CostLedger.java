package com.csg.finops.budgetcap.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-project mapping of cost interval start to the last known accrued cost for that interval.
 * Instances are immutable; {@link #withCost(String, double)} returns an updated copy.
 */
public final class CostLedger {

    private static final CostLedger EMPTY = new CostLedger(Map.of());

    private final Map<String, Double> costsPerIntervalStart;

    private CostLedger(Map<String, Double> costsPerIntervalStart) {
        this.costsPerIntervalStart = Collections.unmodifiableMap(new LinkedHashMap<>(costsPerIntervalStart));
    }

    public static CostLedger empty() {
        return EMPTY;
    }

    public static CostLedger of(Map<String, Double> costsPerIntervalStart) {
        return new CostLedger(costsPerIntervalStart);
    }

    /**
     * Last write wins per interval start: a later cost for the same interval replaces the stored one.
     */
    public CostLedger withCost(String costIntervalStart, double costAmount) {
        Map<String, Double> updated = new LinkedHashMap<>(costsPerIntervalStart);
        updated.put(costIntervalStart, costAmount);
        return new CostLedger(updated);
    }

    /**
     * Sum over every interval ever recorded for the project, not only the current one.
     */
    public double total() {
        return costsPerIntervalStart.values().stream()
                .mapToDouble(Double::doubleValue)
                .sum();
    }

    public Double costFor(String costIntervalStart) {
        return costsPerIntervalStart.get(costIntervalStart);
    }

    public int size() {
        return costsPerIntervalStart.size();
    }

    public boolean isEmpty() {
        return costsPerIntervalStart.isEmpty();
    }

    public Map<String, Double> asMap() {
        return costsPerIntervalStart;
    }

    public Map<String, Object> toDocument() {
        return new LinkedHashMap<>(costsPerIntervalStart);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CostLedger)) return false;
        return costsPerIntervalStart.equals(((CostLedger) o).costsPerIntervalStart);
    }

    @Override
    public int hashCode() {
        return costsPerIntervalStart.hashCode();
    }

    @Override
    public String toString() {
        return "CostLedger" + costsPerIntervalStart;
    }
}
