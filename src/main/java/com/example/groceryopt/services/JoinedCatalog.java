package com.example.groceryopt.services;

import com.example.groceryopt.model.DataQualityWarning;
import com.example.groceryopt.model.FoodPackage;

import java.util.*;

/** Immutable per-request snapshot of the joined catalog, in cost-table order. */
public final class JoinedCatalog {
    private final List<FoodPackage> packages;
    private final Map<String, FoodPackage> byDescription;
    private final List<DataQualityWarning> warnings;

    JoinedCatalog(List<FoodPackage> packages, List<DataQualityWarning> warnings) {
        this.packages = List.copyOf(packages);
        Map<String, FoodPackage> idx = new LinkedHashMap<>();
        for (FoodPackage p : this.packages) idx.put(p.packageDescription, p);
        this.byDescription = Collections.unmodifiableMap(idx);
        this.warnings = List.copyOf(warnings);
    }

    public List<FoodPackage> packages() { return packages; }

    public Optional<FoodPackage> find(String packageDescription) {
        return Optional.ofNullable(byDescription.get(packageDescription));
    }

    /** Packages with stock on hand. */
    public List<FoodPackage> inStock() {
        return packages.stream().filter(FoodPackage::inStock).toList();
    }

    /** Basket categories with at least one package, in first-seen order. */
    public Map<String, List<FoodPackage>> byBasket() {
        Map<String, List<FoodPackage>> out = new LinkedHashMap<>();
        for (FoodPackage p : packages) out.computeIfAbsent(p.basket, k -> new ArrayList<>()).add(p);
        return out;
    }

    public List<DataQualityWarning> warnings() { return warnings; }

    public int size() { return packages.size(); }

    public boolean isEmpty() { return packages.isEmpty(); }
}
