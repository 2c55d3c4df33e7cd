package com.example.groceryopt.model;

import java.util.List;

/** Household nutrient floors derived for one optimization request. */
public final class AggregateRequirement {
    public static final int DAYS_PER_WEEK = 7;

    public final NutrientProfile daily;
    public final NutrientProfile weekly;
    public final int matchedMembers;
    public final List<HouseholdMember> unmatchedMembers;

    public AggregateRequirement(NutrientProfile daily, int matchedMembers, List<HouseholdMember> unmatchedMembers) {
        this.daily = daily;
        this.weekly = daily.times(DAYS_PER_WEEK);
        this.matchedMembers = matchedMembers;
        this.unmatchedMembers = List.copyOf(unmatchedMembers);
    }

    public double weeklyFloor(Nutrient n) { return weekly.get(n); }

    public boolean isZero() { return NutrientProfile.ZERO.equals(daily); }
}
