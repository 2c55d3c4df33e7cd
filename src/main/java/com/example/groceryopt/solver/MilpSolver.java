package com.example.groceryopt.solver;

/**
 * A MILP backend. Implementations solve the given model once, never modify it, and
 * report a non-optimal outcome through the solution status rather than by throwing.
 */
public interface MilpSolver {
    MilpSolution solve(MilpModel model);
}
