package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** One row of the age/gender requirement table. Amounts are daily minimums. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NutrientRequirementRow {
    @JsonProperty("Age_Sex_Group") public String group;
    @JsonProperty("Min_Age") public int minAge;
    @JsonProperty("Max_Age") public int maxAge;
    @JsonProperty("Min_Calorie") public double minCalorie;
    @JsonProperty("min_Protein") public double minProtein;
    @JsonProperty("min_Carbohydrate") public double minCarbohydrate;
    @JsonProperty("min_Fat") public double minFat;

    public NutrientRequirementRow() {}
    public NutrientRequirementRow(String group, int minAge, int maxAge,
                                  double minCalorie, double minProtein, double minCarbohydrate, double minFat) {
        this.group = group; this.minAge = minAge; this.maxAge = maxAge;
        this.minCalorie = minCalorie; this.minProtein = minProtein;
        this.minCarbohydrate = minCarbohydrate; this.minFat = minFat;
    }

    public boolean covers(int age) { return minAge <= age && age <= maxAge; }

    public NutrientProfile daily() {
        return new NutrientProfile(minCalorie, minProtein, minCarbohydrate, minFat);
    }

    @Override public String toString() { return group + " " + minAge + "-" + maxAge; }
}
