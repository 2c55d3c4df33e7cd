package com.example.groceryopt.model;

import java.util.*;

/**
 * Outcome of one optimization request. Only an {@link SolveStatus#OPTIMAL} plan carries lines;
 * every other status yields an empty plan so callers never act on a partial solution.
 */
public final class PurchasePlan {
    public final SolveStatus status;
    public final double objectiveValue;
    public final List<PlanLine> lines;
    public final List<StoreGroup> stores;
    public final double totalCost;
    public final int totalPackages;
    public final double totalWeightLb;
    public final AggregateRequirement requirement;
    public final List<DataQualityWarning> warnings;

    public PurchasePlan(SolveStatus status, double objectiveValue, List<PlanLine> lines,
                        AggregateRequirement requirement, List<DataQualityWarning> warnings) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.lines = List.copyOf(lines);
        this.requirement = requirement;
        this.warnings = List.copyOf(warnings);

        Map<String, List<PlanLine>> byStore = new TreeMap<>();
        double c = 0, w = 0; int n = 0;
        for (PlanLine l : this.lines) {
            byStore.computeIfAbsent(l.store, k -> new ArrayList<>()).add(l);
            c += l.cost; w += l.totalWeightLb; n += l.quantity;
        }
        List<StoreGroup> groups = new ArrayList<>();
        for (var e : byStore.entrySet()) groups.add(new StoreGroup(e.getKey(), e.getValue()));
        this.stores = List.copyOf(groups);
        this.totalCost = PlanLine.round2(c);
        this.totalPackages = n;
        this.totalWeightLb = PlanLine.round2(w);
    }

    public static PurchasePlan empty(SolveStatus status, AggregateRequirement requirement, List<DataQualityWarning> warnings) {
        return new PurchasePlan(status, Double.NaN, List.of(), requirement, warnings);
    }

    public boolean isOptimal() { return status == SolveStatus.OPTIMAL; }

    public int storeCount() { return stores.size(); }

    public Optional<PlanLine> line(String packageDescription) {
        return lines.stream().filter(l -> l.packageDescription.equals(packageDescription)).findFirst();
    }
}
