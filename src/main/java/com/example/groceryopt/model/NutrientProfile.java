package com.example.groceryopt.model;

import java.util.Locale;

/** Immutable amounts of the four tracked nutrients (kcal, then grams). */
public final class NutrientProfile {
    public static final NutrientProfile ZERO = new NutrientProfile(0, 0, 0, 0);

    public final double calories;
    public final double protein;
    public final double carbohydrate;
    public final double fat;

    public NutrientProfile(double calories, double protein, double carbohydrate, double fat) {
        this.calories = calories; this.protein = protein; this.carbohydrate = carbohydrate; this.fat = fat;
    }

    public double get(Nutrient n) {
        switch (n) {
            case CALORIES: return calories;
            case PROTEIN: return protein;
            case CARBOHYDRATE: return carbohydrate;
            case FAT: return fat;
            default: throw new IllegalArgumentException("Unknown nutrient " + n);
        }
    }

    public NutrientProfile plus(NutrientProfile o) {
        return new NutrientProfile(calories + o.calories, protein + o.protein,
                carbohydrate + o.carbohydrate, fat + o.fat);
    }

    public NutrientProfile times(double k) {
        return new NutrientProfile(calories * k, protein * k, carbohydrate * k, fat * k);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NutrientProfile)) return false;
        NutrientProfile p = (NutrientProfile) o;
        return Double.compare(calories, p.calories) == 0 && Double.compare(protein, p.protein) == 0
            && Double.compare(carbohydrate, p.carbohydrate) == 0 && Double.compare(fat, p.fat) == 0;
    }
    @Override public int hashCode() {
        return java.util.Objects.hash(calories, protein, carbohydrate, fat);
    }
    @Override public String toString() {
        return String.format(Locale.ROOT, "%.0f kcal | %.0fg protein | %.0fg carbs | %.0fg fat", calories, protein, carbohydrate, fat);
    }
}
