package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StockEntry {
    @JsonProperty("Package Description") public String packageDescription;
    @JsonProperty("Quantity_in_Stock_lb") public double quantityLb;

    public StockEntry() {}
    public StockEntry(String packageDescription, double quantityLb) {
        this.packageDescription = packageDescription; this.quantityLb = quantityLb;
    }
}
