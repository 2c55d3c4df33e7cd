package com.example.groceryopt.solver;

import com.example.groceryopt.model.SolveStatus;

import java.util.Arrays;

public final class MilpSolution {
    public final SolveStatus status;
    public final double objectiveValue;
    public final long wallTimeMillis;
    public final long nodes;
    private final double[] values; // empty unless OPTIMAL

    public MilpSolution(SolveStatus status, double objectiveValue, double[] values, long wallTimeMillis, long nodes) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.values = status == SolveStatus.OPTIMAL && values != null ? values.clone() : new double[0];
        this.wallTimeMillis = wallTimeMillis;
        this.nodes = nodes;
    }

    public static MilpSolution withoutValues(SolveStatus status, long wallTimeMillis) {
        return new MilpSolution(status, Double.NaN, null, wallTimeMillis, 0);
    }

    /** Solved value, or NaN when the variable has none (non-optimal status or foreign variable). */
    public double value(MilpVariable v) {
        return v.index < values.length ? values[v.index] : Double.NaN;
    }

    @Override public String toString() {
        return status.label + " objective=" + objectiveValue + " values=" + Arrays.toString(values);
    }
}
