package com.example.groceryopt.engine;

import com.example.groceryopt.model.*;
import com.example.groceryopt.services.ConfigurationException;

import java.util.List;

/** Immutable snapshot of everything one optimization run reads. */
public final class OptimizationRequest {
    public final List<HouseholdMember> household;
    public final List<NutrientRequirementRow> requirements;
    public final List<CostRow> costs;
    public final List<NutritionRow> nutrition;
    public final List<StockEntry> stock;

    public OptimizationRequest(List<HouseholdMember> household, List<NutrientRequirementRow> requirements,
                               List<CostRow> costs, List<NutritionRow> nutrition, List<StockEntry> stock) {
        this.household = household == null ? List.of() : copy(household, "Household");
        this.requirements = copy(requirements, "Requirement");
        this.costs = copy(costs, "Cost");
        this.nutrition = copy(nutrition, "Nutrition");
        this.stock = stock == null ? List.of() : copy(stock, "Stock");
    }

    private static <T> List<T> copy(List<T> table, String label) {
        if (table == null) throw new ConfigurationException(label + " table is missing.");
        try {
            return List.copyOf(table);
        } catch (NullPointerException ex) {
            throw new ConfigurationException(label + " table contains an empty row.", ex);
        }
    }
}
