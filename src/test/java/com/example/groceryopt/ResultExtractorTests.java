package com.example.groceryopt;

import com.example.groceryopt.model.*;
import com.example.groceryopt.services.*;
import com.example.groceryopt.solver.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class ResultExtractorTests {
    private final JoinedCatalog catalog = new CatalogJoiner().join(Fixtures.costs(), Fixtures.nutrition(), Fixtures.stock());
    private final AggregateRequirement requirement =
            new RequirementResolver().resolve(Fixtures.couple(), new RequirementTable(Fixtures.requirements()));
    private final ShoppingModel sm = new ShoppingModelBuilder().build(catalog, requirement);
    private final ResultExtractor extractor = new ResultExtractor();

    private MilpSolution optimal(double... purchases) {
        double[] values = new double[sm.model.numVariables()];
        System.arraycopy(purchases, 0, values, 0, purchases.length);
        return new MilpSolution(SolveStatus.OPTIMAL, sm.model.objectiveValue(values), values, 5, 1);
    }

    @Test
    void roundsAndDropsNearZeroValues() {
        // chicken, rice, broccoli, bananas, peanut butter
        PurchasePlan plan = extractor.extract(sm, optimal(2.0000001, 1e-9, 2.9999999, 0, 1), catalog, requirement, List.of());
        assertEquals(3, plan.lines.size());
        assertTrue(plan.line("Rice 5 lb").isEmpty());
        PlanLine broccoli = plan.line("Broccoli 1 lb").orElseThrow();
        assertEquals(3, broccoli.quantity);
        assertEquals(6.0, broccoli.cost, 1e-9);
        assertEquals(3.0, broccoli.totalWeightLb, 1e-9);
        assertEquals(2 * 12.0 + 3 * 2.0 + 7.0, plan.totalCost, 1e-9);
        assertEquals(6, plan.totalPackages);
        assertEquals(6.0 + 3.0 + 2.5, plan.totalWeightLb, 1e-9);
    }

    @Test
    void groupsByStoreSortedWithSubtotalsMatchingTotals() {
        PurchasePlan plan = extractor.extract(sm, optimal(1, 1, 2, 3, 1), catalog, requirement, List.of());
        assertEquals(List.of("Costco", "Kroger", "Meijer"), plan.stores.stream().map(g -> g.store).toList());
        StoreGroup kroger = plan.stores.get(1);
        assertEquals(2, kroger.lines.size());
        assertEquals(3, kroger.packages);
        assertEquals(8.5, kroger.cost, 1e-9);

        double cost = plan.stores.stream().mapToDouble(g -> g.cost).sum();
        int packages = plan.stores.stream().mapToInt(g -> g.packages).sum();
        assertEquals(plan.totalCost, cost, 1e-9);
        assertEquals(plan.totalPackages, packages);
        assertEquals(3, plan.storeCount());
    }

    @Test
    void nonOptimalStatusYieldsEmptyPlanWithStatus() {
        PurchasePlan plan = extractor.extract(sm, MilpSolution.withoutValues(SolveStatus.INFEASIBLE, 3),
                catalog, requirement, List.of());
        assertFalse(plan.isOptimal());
        assertEquals(SolveStatus.INFEASIBLE, plan.status);
        assertTrue(plan.lines.isEmpty());
        assertTrue(plan.stores.isEmpty());
        assertEquals(0.0, plan.totalCost, 1e-12);
    }

    @Test
    void variableForUnknownPackageIsAnInternalInconsistency() {
        JoinedCatalog smaller = new CatalogJoiner().join(Fixtures.costs().subList(0, 2), Fixtures.nutrition(), List.of());
        assertThrows(InternalInconsistencyException.class,
                () -> extractor.extract(sm, optimal(0, 0, 1, 0, 0), smaller, requirement, List.of()));
    }

    @Test
    void toleranceMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ResultExtractor(0));
    }
}
