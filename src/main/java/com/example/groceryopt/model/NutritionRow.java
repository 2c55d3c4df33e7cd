package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Per-package nutrient content of a food, its basket category and purchase cap. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NutritionRow {
    @JsonProperty("Food") public String food;
    @JsonProperty("kcal") public double kcal;
    @JsonProperty("Protein (g)") public double protein;
    @JsonProperty("Carbs (g)") public double carbs;
    @JsonProperty("Fat (g)") public double fat;
    @JsonProperty("Food Basket") public String basket;
    @JsonProperty("Max_quantity") public int maxQuantity;

    public NutritionRow() {}
    public NutritionRow(String food, double kcal, double protein, double carbs, double fat,
                        String basket, int maxQuantity) {
        this.food = food; this.kcal = kcal; this.protein = protein; this.carbs = carbs; this.fat = fat;
        this.basket = basket; this.maxQuantity = maxQuantity;
    }

    public NutrientProfile nutrients() { return new NutrientProfile(kcal, protein, carbs, fat); }
}
