package com.example.groceryopt.model;

public enum SolveStatus {
    OPTIMAL("Optimal"),
    INFEASIBLE("Infeasible"),
    UNBOUNDED("Unbounded"),
    NOT_SOLVED("Not Solved"),
    UNDEFINED("Undefined");

    public final String label;

    SolveStatus(String label) { this.label = label; }
}
