package com.example.groceryopt.services;

import com.example.groceryopt.solver.MilpModel;
import com.example.groceryopt.solver.MilpVariable;

import java.util.Collections;
import java.util.Map;

/** A built purchase model plus the index from catalog keys to its variables. */
public final class ShoppingModel {
    public final MilpModel model;
    private final Map<String, MilpVariable> purchases;
    private final Map<String, MilpVariable> presence;

    ShoppingModel(MilpModel model, Map<String, MilpVariable> purchases, Map<String, MilpVariable> presence) {
        this.model = model;
        this.purchases = Collections.unmodifiableMap(purchases);
        this.presence = Collections.unmodifiableMap(presence);
    }

    /** Purchase variable per package description, in catalog order. */
    public Map<String, MilpVariable> purchases() { return purchases; }

    /** Presence indicator per basket category. */
    public Map<String, MilpVariable> presence() { return presence; }
}
