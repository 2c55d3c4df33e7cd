package com.example.groceryopt.solver;

import java.util.*;

/**
 * Solver-neutral mixed-integer linear program. Variables and constraints keep their
 * creation order so the same inputs always produce the same model. Once sealed the
 * model is read-only and can be handed to any {@link MilpSolver}. The objective is
 * always minimised.
 */
public final class MilpModel {
    public static final double INFINITY = Double.POSITIVE_INFINITY;

    public final String name;
    private final List<MilpVariable> variables = new ArrayList<>();
    private final List<MilpConstraint> constraints = new ArrayList<>();
    private final Set<String> names = new HashSet<>();
    private final Map<MilpVariable, Double> objective = new LinkedHashMap<>();
    private boolean sealed;

    public MilpModel(String name) { this.name = name; }

    public MilpVariable intVar(double lb, double ub, String varName) { return addVar(lb, ub, true, varName); }

    public MilpVariable boolVar(String varName) { return addVar(0, 1, true, varName); }

    private MilpVariable addVar(double lb, double ub, boolean integer, String varName) {
        checkMutable();
        if (lb > ub) throw new IllegalArgumentException("Variable " + varName + " has lower bound above upper bound");
        claim(varName);
        MilpVariable v = new MilpVariable(variables.size(), varName, lb, ub, integer);
        variables.add(v);
        return v;
    }

    public MilpConstraint constraint(double lb, double ub, String constraintName) {
        checkMutable();
        claim(constraintName);
        MilpConstraint c = new MilpConstraint(this, constraintName, lb, ub);
        constraints.add(c);
        return c;
    }

    public void setObjectiveCoefficient(MilpVariable v, double coefficient) {
        checkMutable();
        checkOwned(v);
        objective.put(v, coefficient);
    }

    public double getObjectiveCoefficient(MilpVariable v) { return objective.getOrDefault(v, 0.0); }


    public List<MilpVariable> variables() { return Collections.unmodifiableList(variables); }
    public List<MilpConstraint> constraints() { return Collections.unmodifiableList(constraints); }
    public Optional<MilpConstraint> constraint(String constraintName) {
        return constraints.stream().filter(c -> c.name.equals(constraintName)).findFirst();
    }

    public int numVariables() { return variables.size(); }
    public int numConstraints() { return constraints.size(); }

    public double objectiveValue(double[] values) {
        double total = 0;
        for (var e : objective.entrySet()) total += e.getValue() * values[e.getKey().index];
        return total;
    }

    public MilpModel seal() { sealed = true; return this; }
    public boolean isSealed() { return sealed; }

    void checkMutable() {
        if (sealed) throw new IllegalStateException("Model " + name + " is sealed");
    }

    void checkOwned(MilpVariable v) {
        if (v == null || v.index >= variables.size() || variables.get(v.index) != v) {
            throw new IllegalArgumentException("Variable does not belong to model " + name + ": " + v);
        }
    }

    private void claim(String n) {
        if (n == null || n.isBlank()) throw new IllegalArgumentException("Names must be non-blank");
        if (!names.add(n)) throw new IllegalArgumentException("Duplicate name in model " + name + ": " + n);
    }
}
