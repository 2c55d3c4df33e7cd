package com.example.groceryopt;

import com.example.groceryopt.model.Gender;
import com.example.groceryopt.model.HouseholdMember;
import com.example.groceryopt.services.HouseholdRoster;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class HouseholdRosterTests {
    @Test
    void snapshotsAreDetachedFromLaterEdits() {
        HouseholdRoster roster = new HouseholdRoster();
        roster.add(30, Gender.MALE);
        roster.add(6, Gender.FEMALE);
        var snap = roster.snapshot();

        assertEquals(new HouseholdMember(30, Gender.MALE), roster.remove(0));
        roster.add(60, Gender.FEMALE);
        assertEquals(2, snap.size());
        assertEquals(30, snap.get(0).age);
        assertThrows(UnsupportedOperationException.class, () -> snap.add(new HouseholdMember(1, Gender.MALE)));

        roster.clear();
        assertTrue(roster.isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> roster.remove(0));
    }

    @Test
    void removeKeepsOrderAndRejectsPositionsOutOfRange() {
        HouseholdRoster roster = new HouseholdRoster();
        roster.add(40, Gender.MALE);
        roster.add(38, Gender.FEMALE);
        roster.add(9, Gender.MALE);

        assertThrows(IndexOutOfBoundsException.class, () -> roster.remove(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> roster.remove(3));
        assertEquals(3, roster.size());

        assertEquals(new HouseholdMember(38, Gender.FEMALE), roster.remove(1));
        assertEquals(java.util.List.of(new HouseholdMember(40, Gender.MALE), new HouseholdMember(9, Gender.MALE)),
                roster.snapshot());
    }

    @Test
    void clearingAnEmptyRosterLeavesItUsable() {
        HouseholdRoster roster = new HouseholdRoster();
        roster.clear();
        assertTrue(roster.isEmpty());
        assertTrue(roster.snapshot().isEmpty());
        roster.add(70, Gender.FEMALE);
        assertEquals(1, roster.size());
        assertThrows(IllegalArgumentException.class, () -> roster.add(0, Gender.MALE));
        assertEquals(1, roster.size());
    }
}
