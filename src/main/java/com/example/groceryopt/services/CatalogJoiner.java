package com.example.groceryopt.services;

import com.example.groceryopt.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Joins the cost table to nutrition on Food (inner) and the result to stock on
 * Package Description (left, missing stock counts as zero).
 */
public class CatalogJoiner {
    private static final Logger log = LoggerFactory.getLogger(CatalogJoiner.class);

    public JoinedCatalog join(List<CostRow> costs, List<NutritionRow> nutrition, List<StockEntry> stock) {
        if (costs == null) throw new ConfigurationException("Cost table is missing.");
        if (nutrition == null) throw new ConfigurationException("Nutrition table is missing.");
        if (stock == null) stock = List.of();

        Map<String, NutritionRow> nutritionByFood = new HashMap<>();
        for (NutritionRow n : nutrition) {
            if (n == null || n.food == null) throw new ConfigurationException("Nutrition row without Food.");
            if (n.maxQuantity < 0) {
                throw new ConfigurationException("Negative Max_quantity for food: " + n.food);
            }
            if (n.basket == null || n.basket.isBlank()) {
                throw new ConfigurationException("Missing Food Basket for food: " + n.food);
            }
            if (nutritionByFood.put(n.food, n) != null) {
                throw new ConfigurationException("Duplicate Food in nutrition table: " + n.food);
            }
        }

        Map<String, Double> stockByPackage = new LinkedHashMap<>();
        for (StockEntry s : stock) {
            if (s == null || s.packageDescription == null) throw new ConfigurationException("Stock entry without Package Description.");
            if (s.quantityLb < 0) {
                throw new ConfigurationException("Negative stock for package: " + s.packageDescription);
            }
            if (stockByPackage.put(s.packageDescription, s.quantityLb) != null) {
                throw new ConfigurationException("Duplicate Package Description in stock table: " + s.packageDescription);
            }
        }

        Set<String> seen = new HashSet<>();
        List<FoodPackage> out = new ArrayList<>();
        List<DataQualityWarning> warnings = new ArrayList<>();
        for (CostRow c : costs) {
            if (c == null || c.packageDescription == null) throw new ConfigurationException("Cost row without Package Description.");
            if (!seen.add(c.packageDescription)) {
                throw new ConfigurationException("Duplicate Package Description in cost table: " + c.packageDescription);
            }
            if (c.price < 0) throw new ConfigurationException("Negative price for package: " + c.packageDescription);
            if (c.lb <= 0) throw new ConfigurationException("Package weight must be positive: " + c.packageDescription);

            NutritionRow n = nutritionByFood.get(c.food);
            if (n == null) {
                log.warn("Dropping package '{}': no nutrition row for food '{}'", c.packageDescription, c.food);
                warnings.add(new DataQualityWarning(DataQualityWarning.Kind.UNMATCHED_COST_ROW, c.packageDescription,
                        "No nutrition row for food '" + c.food + "'; package dropped."));
                continue;
            }
            double stockLb = stockByPackage.getOrDefault(c.packageDescription, 0.0);
            out.add(new FoodPackage(c.food, c.packageDescription, c.store, c.price, c.lb,
                    n.nutrients(), n.basket, n.maxQuantity, stockLb));
        }

        for (String key : stockByPackage.keySet()) {
            if (!seen.contains(key)) {
                log.warn("Stock entry '{}' matches no catalog package; ignored", key);
                warnings.add(new DataQualityWarning(DataQualityWarning.Kind.UNKNOWN_STOCK_ENTRY, key,
                        "Stock entry matches no catalog package; ignored."));
            }
        }
        log.debug("Joined catalog: {} packages from {} cost rows, {} warnings", out.size(), costs.size(), warnings.size());
        return new JoinedCatalog(out, warnings);
    }
}
