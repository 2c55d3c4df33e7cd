package com.example.groceryopt.model;

public enum Nutrient {
    CALORIES("Min_Calorie"),
    PROTEIN("Min_Protein"),
    CARBOHYDRATE("Min_Carbohydrate"),
    FAT("Min_Fat");

    /** Requirement column label, also used to name the model's nutrient constraints. */
    public final String requirementLabel;

    Nutrient(String requirementLabel) { this.requirementLabel = requirementLabel; }
}
