package com.example.groceryopt.services;

import com.example.groceryopt.model.HouseholdMember;
import com.example.groceryopt.model.NutrientRequirementRow;

import java.util.*;

/**
 * Age-range index over the requirement rows, one range map per gender group.
 * Ranges within a group may not overlap, so each member matches at most one row.
 */
public class RequirementTable {
    private final Map<String, TreeMap<Integer, NutrientRequirementRow>> byGroup = new HashMap<>();
    private final int size;

    public RequirementTable(List<NutrientRequirementRow> rows) {
        if (rows == null) throw new ConfigurationException("Requirement table is missing.");
        for (NutrientRequirementRow r : rows) {
            if (r == null || r.group == null || r.group.isBlank()) {
                throw new ConfigurationException("Requirement row without Age_Sex_Group: " + r);
            }
            if (r.minAge > r.maxAge) {
                throw new ConfigurationException("Requirement row " + r + " has Min_Age above Max_Age.");
            }
            var ranges = byGroup.computeIfAbsent(key(r.group), k -> new TreeMap<>());
            var below = ranges.floorEntry(r.maxAge);
            if (below != null && below.getValue().maxAge >= r.minAge) {
                throw new ConfigurationException("Requirement rows overlap: " + below.getValue() + " and " + r);
            }
            ranges.put(r.minAge, r);
        }
        this.size = rows.size();
    }

    public Optional<NutrientRequirementRow> lookup(HouseholdMember member) {
        var ranges = byGroup.get(member.gender.label());
        if (ranges == null) return Optional.empty();
        var e = ranges.floorEntry(member.age);
        if (e == null || !e.getValue().covers(member.age)) return Optional.empty();
        return Optional.of(e.getValue());
    }

    public int size() { return size; }

    private static String key(String group) { return group.trim().toLowerCase(Locale.ROOT); }
}
