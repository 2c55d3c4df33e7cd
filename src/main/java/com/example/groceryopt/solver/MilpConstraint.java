package com.example.groceryopt.solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code lowerBound <= sum(coefficient * variable) <= upperBound}. */
public final class MilpConstraint {
    public final String name;
    public final double lowerBound;
    public final double upperBound;
    private final MilpModel owner;
    private final Map<MilpVariable, Double> coefficients = new LinkedHashMap<>();

    MilpConstraint(MilpModel owner, String name, double lowerBound, double upperBound) {
        this.owner = owner; this.name = name; this.lowerBound = lowerBound; this.upperBound = upperBound;
    }

    public MilpConstraint setCoefficient(MilpVariable v, double coefficient) {
        owner.checkMutable();
        owner.checkOwned(v);
        coefficients.put(v, coefficient);
        return this;
    }

    public double getCoefficient(MilpVariable v) { return coefficients.getOrDefault(v, 0.0); }

    /** Terms in insertion order. */
    public Map<MilpVariable, Double> terms() { return Collections.unmodifiableMap(coefficients); }

    @Override public String toString() { return name + ": " + lowerBound + " <= " + coefficients.size() + " terms <= " + upperBound; }
}
