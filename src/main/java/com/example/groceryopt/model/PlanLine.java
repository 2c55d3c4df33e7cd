package com.example.groceryopt.model;

public final class PlanLine {
    public final String store;
    public final String food;
    public final String packageDescription;
    public final double lbPerPackage;
    public final double pricePerPackage;
    public final int quantity;
    public final double totalWeightLb;
    public final double cost;

    public PlanLine(FoodPackage p, int quantity) {
        this.store = p.store; this.food = p.food; this.packageDescription = p.packageDescription;
        this.lbPerPackage = p.weightLb; this.pricePerPackage = p.price;
        this.quantity = quantity;
        this.totalWeightLb = round2(p.weightLb * quantity);
        this.cost = round2(p.price * quantity);
    }

    static double round2(double v) { return Math.round(v * 100.0) / 100.0; }

    @Override public String toString() {
        return store + "," + food + "," + packageDescription + "," + quantity + "," + cost;
    }
}
