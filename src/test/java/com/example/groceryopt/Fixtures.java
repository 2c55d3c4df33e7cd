package com.example.groceryopt;

import com.example.groceryopt.engine.OptimizationRequest;
import com.example.groceryopt.model.*;

import java.util.*;

/** Small hand-built tables shared by the tests. */
final class Fixtures {
    private Fixtures() {}

    static List<NutrientRequirementRow> requirements() {
        return List.of(
            new NutrientRequirementRow("Male", 1, 18, 1800, 40, 130, 50),
            new NutrientRequirementRow("Male", 19, 50, 2400, 56, 130, 67),
            new NutrientRequirementRow("Female", 1, 18, 1600, 34, 130, 44),
            new NutrientRequirementRow("Female", 19, 50, 2000, 46, 130, 56)
        );
    }

    static List<CostRow> costs() {
        return List.of(
            new CostRow("Chicken", "Chicken 3 lb", "Costco", 12.0, 3.0),
            new CostRow("Rice", "Rice 5 lb", "Kroger", 4.5, 5.0),
            new CostRow("Broccoli", "Broccoli 1 lb", "Kroger", 2.0, 1.0),
            new CostRow("Bananas", "Bananas 3 lb", "Meijer", 1.75, 3.0),
            new CostRow("Peanut Butter", "Peanut Butter 40 oz", "Costco", 7.0, 2.5)
        );
    }

    static List<NutritionRow> nutrition() {
        return List.of(
            new NutritionRow("Chicken", 2040, 408, 0, 45, "Protein", 3),
            new NutritionRow("Rice", 8200, 150, 1800, 15, "Grains", 2),
            new NutritionRow("Broccoli", 155, 13, 30, 2, "Vegetables", 4),
            new NutritionRow("Bananas", 1200, 15, 310, 4, "Fruits", 3),
            new NutritionRow("Peanut Butter", 6600, 280, 220, 560, "Fats", 2)
        );
    }

    static List<StockEntry> stock() {
        return List.of(new StockEntry("Rice 5 lb", 1.0));
    }

    static List<HouseholdMember> couple() {
        return List.of(new HouseholdMember(30, Gender.MALE), new HouseholdMember(28, Gender.FEMALE));
    }

    static OptimizationRequest request(List<HouseholdMember> household) {
        return new OptimizationRequest(household, requirements(), costs(), nutrition(), stock());
    }
}
