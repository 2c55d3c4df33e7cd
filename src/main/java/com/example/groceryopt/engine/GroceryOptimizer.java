package com.example.groceryopt.engine;

import com.example.groceryopt.model.*;
import com.example.groceryopt.services.*;
import com.example.groceryopt.solver.MilpSolution;
import com.example.groceryopt.solver.MilpSolver;
import com.example.groceryopt.solver.OrToolsMilpSolver;
import com.example.groceryopt.storage.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one request end to end: requirements and catalog join, model build, solve, extraction.
 * Holds no per-request state, so one instance may serve concurrent requests.
 */
public class GroceryOptimizer {
    private static final Logger log = LoggerFactory.getLogger(GroceryOptimizer.class);

    private final RequirementResolver resolver = new RequirementResolver();
    private final CatalogJoiner joiner = new CatalogJoiner();
    private final ShoppingModelBuilder builder;
    private final MilpSolver solver;
    private final ResultExtractor extractor;

    public GroceryOptimizer(Settings settings) {
        this(settings, new OrToolsMilpSolver(settings.solverId, settings.timeLimitMillis()));
    }

    public GroceryOptimizer(Settings settings, MilpSolver solver) {
        this(new ShoppingModelBuilder(settings.diversity()), solver, new ResultExtractor(settings.tolerance()));
    }

    public GroceryOptimizer(ShoppingModelBuilder builder, MilpSolver solver, ResultExtractor extractor) {
        this.builder = builder; this.solver = solver; this.extractor = extractor;
    }

    public PurchasePlan optimize(OptimizationRequest request) {
        if (request.household.isEmpty()) {
            throw new ConfigurationException("Household is empty; add members before optimizing.");
        }
        RequirementTable table = new RequirementTable(request.requirements);
        AggregateRequirement requirement = resolver.resolve(request.household, table);
        JoinedCatalog catalog = joiner.join(request.costs, request.nutrition, request.stock);

        List<DataQualityWarning> warnings = new ArrayList<>(catalog.warnings());
        warnings.addAll(RequirementResolver.warnings(requirement));
        log.info("Optimizing for {} members ({} matched) over {} packages; weekly floor {}",
                request.household.size(), requirement.matchedMembers, catalog.size(), requirement.weekly);

        ShoppingModel shopping = builder.build(catalog, requirement);
        MilpSolution solution = solver.solve(shopping.model);
        if (solution.status != SolveStatus.OPTIMAL) {
            log.warn("Optimization failed with status: {}", solution.status.label);
        }
        PurchasePlan plan = extractor.extract(shopping, solution, catalog, requirement, warnings);
        if (plan.isOptimal()) {
            log.info("Plan: {} packages from {} stores, total cost {}", plan.totalPackages, plan.storeCount(), plan.totalCost);
        }
        return plan;
    }
}
