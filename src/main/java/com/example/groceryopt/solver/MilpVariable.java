package com.example.groceryopt.solver;

public final class MilpVariable {
    public final int index;
    public final String name;
    public final double lowerBound;
    public final double upperBound;
    public final boolean integer;

    MilpVariable(int index, String name, double lowerBound, double upperBound, boolean integer) {
        this.index = index; this.name = name;
        this.lowerBound = lowerBound; this.upperBound = upperBound; this.integer = integer;
    }

    public boolean isBinary() { return integer && lowerBound >= 0 && upperBound <= 1; }

    @Override public String toString() {
        return name + (integer ? " int " : " num ") + "[" + lowerBound + ", " + upperBound + "]";
    }
}
