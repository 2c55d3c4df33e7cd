package com.example.groceryopt.model;

import java.util.List;

/** The plan lines to buy at one store, with subtotals. */
public final class StoreGroup {
    public final String store;
    public final List<PlanLine> lines;
    public final double cost;
    public final int packages;
    public final double weightLb;

    public StoreGroup(String store, List<PlanLine> lines) {
        this.store = store;
        this.lines = List.copyOf(lines);
        double c = 0, w = 0; int n = 0;
        for (PlanLine l : this.lines) { c += l.cost; w += l.totalWeightLb; n += l.quantity; }
        this.cost = PlanLine.round2(c);
        this.packages = n;
        this.weightLb = PlanLine.round2(w);
    }
}
