package com.example.groceryopt.services;

import com.example.groceryopt.model.*;
import com.example.groceryopt.solver.MilpSolution;
import com.example.groceryopt.solver.MilpVariable;

import java.util.ArrayList;
import java.util.List;

/** Turns solved purchase variables into a {@link PurchasePlan}. */
public class ResultExtractor {
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final double tolerance;

    public ResultExtractor() { this(DEFAULT_TOLERANCE); }

    public ResultExtractor(double tolerance) {
        if (!(tolerance > 0)) throw new IllegalArgumentException("Tolerance must be positive: " + tolerance);
        this.tolerance = tolerance;
    }

    public PurchasePlan extract(ShoppingModel shopping, MilpSolution solution, JoinedCatalog catalog,
                                AggregateRequirement requirement, List<DataQualityWarning> warnings) {
        if (solution.status != SolveStatus.OPTIMAL) {
            return PurchasePlan.empty(solution.status, requirement, warnings);
        }
        List<PlanLine> lines = new ArrayList<>();
        for (var e : shopping.purchases().entrySet()) {
            MilpVariable x = e.getValue();
            double value = solution.value(x);
            if (Double.isNaN(value) || value <= tolerance) continue;
            FoodPackage p = catalog.find(e.getKey()).orElseThrow(() -> new InternalInconsistencyException(
                    "Solved variable " + x.name + " refers to package '" + e.getKey() + "' missing from the catalog"));
            int qty = (int) Math.round(value);
            if (qty <= 0) continue;
            lines.add(new PlanLine(p, qty));
        }
        return new PurchasePlan(solution.status, solution.objectiveValue, lines, requirement, warnings);
    }

    public double tolerance() { return tolerance; }
}
