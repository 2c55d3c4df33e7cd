package com.example.groceryopt;

import com.example.groceryopt.engine.GroceryOptimizer;
import com.example.groceryopt.engine.OptimizationRequest;
import com.example.groceryopt.model.*;
import com.example.groceryopt.services.HouseholdRoster;
import com.example.groceryopt.services.PlanExporter;
import com.example.groceryopt.storage.JsonStorage;
import com.example.groceryopt.storage.Settings;
import com.example.groceryopt.storage.SettingsStorage;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;

/**
 * Command-line run of the weekly planner.
 * <pre>
 *   CliDemo [--data DIR] [--csv FILE] [AGE:GENDER ...]
 * </pre>
 * Without a data directory the bundled grocery database and stock are used; without
 * members a two-adult, one-child household is planned for.
 */
public class CliDemo {
    public static void main(String[] args) throws Exception {
        File dataDir = null;
        File csv = null;
        HouseholdRoster roster = new HouseholdRoster();
        for (int i = 0; i < args.length; i++) {
            if ("--data".equals(args[i]) && i + 1 < args.length) dataDir = new File(args[++i]);
            else if ("--csv".equals(args[i]) && i + 1 < args.length) csv = new File(args[++i]);
            else {
                String[] parts = args[i].split(":");
                if (parts.length != 2) throw new IllegalArgumentException("Expected AGE:GENDER, got " + args[i]);
                roster.add(Integer.parseInt(parts[0].trim()), Gender.parse(parts[1]));
            }
        }
        if (roster.isEmpty()) {
            roster.add(35, Gender.MALE);
            roster.add(33, Gender.FEMALE);
            roster.add(6, Gender.FEMALE);
        }

        Settings settings = new SettingsStorage().load();
        JsonStorage storage = new JsonStorage();
        JsonStorage.Tables tables = dataDir != null ? storage.loadTables(dataDir) : storage.loadSampleTables();

        OptimizationRequest request = new OptimizationRequest(roster.snapshot(), tables.requirements,
                tables.costs, tables.nutrition, tables.stock);
        PurchasePlan plan = new GroceryOptimizer(settings).optimize(request);

        AggregateRequirement req = plan.requirement;
        System.out.println("Household: " + roster.snapshot());
        System.out.println("Daily requirements:  " + req.daily);
        System.out.println("Weekly requirements: " + req.weekly);
        for (DataQualityWarning w : plan.warnings) System.out.println("Warning: " + w);

        if (!plan.isOptimal()) {
            System.out.println("Optimization failed with status: " + plan.status.label);
            return;
        }
        System.out.printf("%nTotal weekly cost: $%.2f | Packages: %d | Weight: %.1f lbs%n",
                plan.totalCost, plan.totalPackages, plan.totalWeightLb);
        for (StoreGroup g : plan.stores) {
            System.out.printf("%n%s: %d packages | $%.2f%n", g.store, g.packages, g.cost);
            for (PlanLine l : g.lines) {
                System.out.printf("  %2d x %-28s $%6.2f  %6.2f lb%n", l.quantity, l.packageDescription, l.cost, l.totalWeightLb);
            }
        }
        if (csv != null) {
            try (OutputStream out = new FileOutputStream(csv)) {
                new PlanExporter().writeCsv(plan, out);
            }
            System.out.println("\nShopping list written to " + csv.getAbsolutePath());
        }
    }
}
