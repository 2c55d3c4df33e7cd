package com.example.groceryopt.model;

/** A purchasable package after cost, nutrition and stock have been joined. */
public final class FoodPackage {
    public final String food;
    public final String packageDescription;
    public final String store;
    public final double price;
    public final double weightLb;
    public final NutrientProfile nutrients; // per package
    public final String basket;
    public final int maxQuantity;
    public final double stockLb;

    public FoodPackage(String food, String packageDescription, String store, double price, double weightLb,
                       NutrientProfile nutrients, String basket, int maxQuantity, double stockLb) {
        this.food = food; this.packageDescription = packageDescription; this.store = store;
        this.price = price; this.weightLb = weightLb; this.nutrients = nutrients;
        this.basket = basket; this.maxQuantity = maxQuantity; this.stockLb = stockLb;
    }

    public boolean inStock() { return stockLb > 0; }

    /** Nutrient amount already on hand: per-package content weighted by the stocked pounds. */
    public double stockContribution(Nutrient n) { return nutrients.get(n) * stockLb; }

    @Override public String toString() { return packageDescription + " @ " + store; }
}
