package com.example.groceryopt.storage;

import com.example.groceryopt.model.*;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.*;
import java.time.Instant;
import java.util.List;

/** Reads the input tables as JSON arrays keyed by their spreadsheet column names. */
public class JsonStorage {
    static final String SAMPLE_DIR = "/sample-data/";

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .registerModule(new JavaTimeModule());

    public List<CostRow> loadCosts(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<CostRow>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse cost table JSON. Expect an array of {Food, Package Description, Store, price, lb}.", ex);
        }
    }

    public List<NutritionRow> loadNutrition(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<NutritionRow>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse nutrition table JSON. Expect an array of {Food, kcal, Protein (g), Carbs (g), Fat (g), Food Basket, Max_quantity}.", ex);
        }
    }

    public List<NutrientRequirementRow> loadRequirements(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<NutrientRequirementRow>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse requirement table JSON. Expect an array of {Age_Sex_Group, Min_Age, Max_Age, Min_Calorie, min_Protein, min_Carbohydrate, min_Fat}.", ex);
        }
    }

    public List<StockEntry> loadStock(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<StockEntry>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse stock JSON. Expect an array of {Package Description, Quantity_in_Stock_lb}.", ex);
        }
    }

    public List<HouseholdMember> loadHousehold(InputStream in) throws IOException {
        try {
            return mapper.readValue(in, new TypeReference<List<HouseholdMember>>() {});
        } catch (IOException ex) {
            throw new IOException("Failed to parse household JSON. Expect an array of {age, gender}.", ex);
        }
    }

    /** The four tables the planner consumes. */
    public static class Tables {
        public List<CostRow> costs;
        public List<NutritionRow> nutrition;
        public List<NutrientRequirementRow> requirements;
        public List<StockEntry> stock;
    }

    /** Loads {@code cost.json}, {@code nutrition.json}, {@code requirements.json} and {@code stock.json} from a directory. */
    public Tables loadTables(File dir) throws IOException {
        Tables t = new Tables();
        try (InputStream in = new FileInputStream(new File(dir, "cost.json"))) { t.costs = loadCosts(in); }
        try (InputStream in = new FileInputStream(new File(dir, "nutrition.json"))) { t.nutrition = loadNutrition(in); }
        try (InputStream in = new FileInputStream(new File(dir, "requirements.json"))) { t.requirements = loadRequirements(in); }
        File stock = new File(dir, "stock.json");
        if (stock.exists()) {
            try (InputStream in = new FileInputStream(stock)) { t.stock = loadStock(in); }
        } else {
            t.stock = List.of();
        }
        return t;
    }

    /** The default grocery database and stock bundled on the classpath. */
    public Tables loadSampleTables() throws IOException {
        Tables t = new Tables();
        try (InputStream in = resource("cost.json")) { t.costs = loadCosts(in); }
        try (InputStream in = resource("nutrition.json")) { t.nutrition = loadNutrition(in); }
        try (InputStream in = resource("requirements.json")) { t.requirements = loadRequirements(in); }
        try (InputStream in = resource("stock.json")) { t.stock = loadStock(in); }
        return t;
    }

    private InputStream resource(String name) throws IOException {
        InputStream in = getClass().getResourceAsStream(SAMPLE_DIR + name);
        if (in == null) throw new FileNotFoundException("Missing bundled resource " + SAMPLE_DIR + name);
        return in;
    }

    public static class PlanExport {
        public Instant createdAt;
        public PurchasePlan plan;
        public PlanExport() {}
        public PlanExport(Instant createdAt, PurchasePlan plan) { this.createdAt = createdAt; this.plan = plan; }
    }

    public void savePlan(PurchasePlan plan, File f) throws IOException {
        mapper.writeValue(f, new PlanExport(Instant.now(), plan));
    }

    public void savePlan(PurchasePlan plan, OutputStream out) throws IOException {
        mapper.writeValue(out, new PlanExport(Instant.now(), plan));
    }
}
