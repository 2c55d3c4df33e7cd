package com.example.groceryopt.services;

import com.example.groceryopt.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class RequirementResolver {
    private static final Logger log = LoggerFactory.getLogger(RequirementResolver.class);

    /**
     * Sums the matched daily minimums over the household; weekly floors are seven times that.
     * A member with no matching row contributes nothing and is listed as unmatched.
     */
    public AggregateRequirement resolve(List<HouseholdMember> members, RequirementTable table) {
        NutrientProfile daily = NutrientProfile.ZERO;
        int matched = 0;
        List<HouseholdMember> unmatched = new ArrayList<>();
        for (HouseholdMember m : members) {
            var row = table.lookup(m);
            if (row.isPresent()) {
                daily = daily.plus(row.get().daily());
                matched++;
            } else {
                log.warn("No requirement row for household member ({}); counting zero", m);
                unmatched.add(m);
            }
        }
        return new AggregateRequirement(daily, matched, unmatched);
    }

    public static List<DataQualityWarning> warnings(AggregateRequirement req) {
        List<DataQualityWarning> out = new ArrayList<>();
        for (HouseholdMember m : req.unmatchedMembers) {
            out.add(new DataQualityWarning(DataQualityWarning.Kind.UNMATCHED_MEMBER, m.toString(),
                    "No requirement row matches this member; it contributes nothing to the floors."));
        }
        return out;
    }
}
