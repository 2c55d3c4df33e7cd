package com.example.groceryopt.services;

import com.example.groceryopt.model.AggregateRequirement;
import com.example.groceryopt.model.FoodPackage;
import com.example.groceryopt.model.Nutrient;
import com.example.groceryopt.solver.MilpConstraint;
import com.example.groceryopt.solver.MilpModel;
import com.example.groceryopt.solver.MilpVariable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the weekly purchase MILP:
 * <pre>
 *   minimize   sum(price[p] * buy[p])
 *   subject to sum(n[p] * buy[p]) + sum(n[p] * stockLb[p]) >= weeklyFloor[n]   for every nutrient n
 *              sum(buy[p] for p in c) + |stocked packages in c| >= has[c]       for every basket c
 *              buy[p] integer in [0, maxQuantity[p]], has[c] binary
 * </pre>
 * In {@link DiversityMode#REQUIRED} each {@code has[c]} is additionally fixed to 1.
 */
public class ShoppingModelBuilder {
    public static final String MODEL_NAME = "Weekly_Shopping_Optimization";

    // Constraint order: protein, carbohydrate, fat, calories.
    static final List<Nutrient> NUTRIENT_ORDER =
            List.of(Nutrient.PROTEIN, Nutrient.CARBOHYDRATE, Nutrient.FAT, Nutrient.CALORIES);

    private final DiversityMode diversity;

    public ShoppingModelBuilder() { this(DiversityMode.REQUIRED); }

    public ShoppingModelBuilder(DiversityMode diversity) { this.diversity = diversity; }

    public ShoppingModel build(JoinedCatalog catalog, AggregateRequirement requirement) {
        MilpModel model = new MilpModel(MODEL_NAME);
        List<FoodPackage> packages = catalog.packages();

        Map<String, MilpVariable> buy = new LinkedHashMap<>();
        for (int i = 0; i < packages.size(); i++) {
            FoodPackage p = packages.get(i);
            MilpVariable x = model.intVar(0, p.maxQuantity, "buy_" + i);
            buy.put(p.packageDescription, x);
            model.setObjectiveCoefficient(x, p.price);
        }

        for (Nutrient n : NUTRIENT_ORDER) {
            double onHand = 0;
            for (FoodPackage p : packages) onHand += p.stockContribution(n);
            MilpConstraint c = model.constraint(requirement.weeklyFloor(n) - onHand, MilpModel.INFINITY,
                    n.requirementLabel + "_requirement");
            for (FoodPackage p : packages) c.setCoefficient(buy.get(p.packageDescription), p.nutrients.get(n));
        }

        Map<String, MilpVariable> has = new LinkedHashMap<>();
        int j = 0;
        for (var e : catalog.byBasket().entrySet()) {
            String basket = e.getKey();
            long stocked = e.getValue().stream().filter(FoodPackage::inStock).count();
            MilpVariable y = model.boolVar("has_" + j++);
            has.put(basket, y);
            // sum(buy) - has >= -stocked
            MilpConstraint presence = model.constraint(-stocked, MilpModel.INFINITY, basket + "_presence");
            for (FoodPackage p : e.getValue()) presence.setCoefficient(buy.get(p.packageDescription), 1.0);
            presence.setCoefficient(y, -1.0);
            if (diversity == DiversityMode.REQUIRED) {
                model.constraint(1.0, 1.0, "Must_have_" + basket).setCoefficient(y, 1.0);
            }
        }

        return new ShoppingModel(model.seal(), buy, has);
    }

    public DiversityMode diversity() { return diversity; }
}
