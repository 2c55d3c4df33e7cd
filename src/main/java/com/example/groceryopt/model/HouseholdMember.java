package com.example.groceryopt.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class HouseholdMember {
    public final int age;
    public final Gender gender;

    @JsonCreator
    public HouseholdMember(@JsonProperty("age") int age, @JsonProperty("gender") Gender gender) {
        if (age <= 0) throw new IllegalArgumentException("Age must be a positive integer, got " + age);
        if (gender == null) throw new IllegalArgumentException("Gender is required.");
        this.age = age; this.gender = gender;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HouseholdMember)) return false;
        HouseholdMember m = (HouseholdMember) o;
        return age == m.age && gender == m.gender;
    }
    @Override public int hashCode() { return 31 * age + gender.hashCode(); }
    @Override public String toString() { return gender.label() + ", age " + age; }
}
