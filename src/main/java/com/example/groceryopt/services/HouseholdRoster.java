package com.example.groceryopt.services;

import com.example.groceryopt.model.Gender;
import com.example.groceryopt.model.HouseholdMember;

import java.util.ArrayList;
import java.util.List;

/** Editable household list; the optimizer only ever sees {@link #snapshot()} copies. */
public class HouseholdRoster {
    private final List<HouseholdMember> members = new ArrayList<>();

    public HouseholdMember add(int age, Gender gender) {
        HouseholdMember m = new HouseholdMember(age, gender);
        members.add(m);
        return m;
    }

    /** @param position zero-based */
    public HouseholdMember remove(int position) {
        if (position < 0 || position >= members.size()) {
            throw new IndexOutOfBoundsException("No household member at position " + position);
        }
        return members.remove(position);
    }

    public void clear() { members.clear(); }

    public int size() { return members.size(); }

    public boolean isEmpty() { return members.isEmpty(); }

    public List<HouseholdMember> snapshot() { return List.copyOf(members); }
}
