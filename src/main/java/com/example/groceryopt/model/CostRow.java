package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class CostRow {
    @JsonProperty("Food") public String food;
    @JsonProperty("Package Description") public String packageDescription;
    @JsonProperty("Store") public String store;
    @JsonProperty("price") public double price;
    @JsonProperty("lb") public double lb;

    public CostRow() {}
    public CostRow(String food, String packageDescription, String store, double price, double lb) {
        this.food = food; this.packageDescription = packageDescription; this.store = store;
        this.price = price; this.lb = lb;
    }
}
