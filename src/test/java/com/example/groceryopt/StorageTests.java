package com.example.groceryopt;

import com.example.groceryopt.model.*;
import com.example.groceryopt.services.ConfigurationException;
import com.example.groceryopt.services.DiversityMode;
import com.example.groceryopt.storage.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;

public class StorageTests {
    @TempDir Path tmp;

    @Test
    void loadsBundledTablesWithSpreadsheetColumnNames() throws Exception {
        JsonStorage.Tables t = new JsonStorage().loadSampleTables();
        assertEquals(15, t.costs.size());
        assertEquals(14, t.nutrition.size());
        assertEquals(14, t.requirements.size());
        CostRow first = t.costs.get(0);
        assertEquals("Chicken Breast 3 lb Pack", first.packageDescription);
        assertEquals("Costco", first.store);
        NutritionRow pb = t.nutrition.stream().filter(n -> n.food.equals("Peanut Butter")).findFirst().orElseThrow();
        assertEquals("Fats, Nuts & Seeds", pb.basket);
        assertEquals(560, pb.fat, 1e-9);
        assertEquals(2, pb.maxQuantity);
        assertEquals("Male", t.requirements.get(0).group);
        assertEquals(2.0, t.stock.stream().filter(s -> s.packageDescription.startsWith("White Rice"))
                .findFirst().orElseThrow().quantityLb, 1e-9);
    }

    @Test
    void loadsTablesFromDirectoryWithOptionalStock() throws Exception {
        write("cost.json", "[{\"Food\":\"Rice\",\"Package Description\":\"Rice 5 lb\",\"Store\":\"Kroger\",\"price\":4.5,\"lb\":5}]");
        write("nutrition.json", "[{\"Food\":\"Rice\",\"kcal\":8200,\"Protein (g)\":150,\"Carbs (g)\":1800,\"Fat (g)\":15,\"Food Basket\":\"Grains\",\"Max_quantity\":2}]");
        write("requirements.json", "[{\"Age_Sex_Group\":\"male\",\"Min_Age\":19,\"Max_Age\":30,\"Min_Calorie\":2400,\"min_Protein\":56,\"min_Carbohydrate\":130,\"min_Fat\":67}]");
        JsonStorage.Tables t = new JsonStorage().loadTables(tmp.toFile());
        assertEquals(1, t.costs.size());
        assertEquals(1800, t.nutrition.get(0).carbs, 1e-9);
        assertTrue(t.stock.isEmpty());
    }

    @Test
    void malformedTableGivesDescriptiveIOException() {
        var in = new ByteArrayInputStream("{\"not\":\"an array\"}".getBytes(StandardCharsets.UTF_8));
        var ex = assertThrows(IOException.class, () -> new JsonStorage().loadCosts(in));
        assertTrue(ex.getMessage().contains("cost table"));
    }

    @Test
    void readsHouseholdJson() throws Exception {
        var in = new ByteArrayInputStream("[{\"age\":30,\"gender\":\"Male\"},{\"age\":4,\"gender\":\"female\"}]"
                .getBytes(StandardCharsets.UTF_8));
        List<HouseholdMember> members = new JsonStorage().loadHousehold(in);
        assertEquals(List.of(new HouseholdMember(30, Gender.MALE), new HouseholdMember(4, Gender.FEMALE)), members);
    }

    @Test
    void savesPlanWithTimestamp() throws Exception {
        PurchasePlan plan = PurchasePlan.empty(SolveStatus.INFEASIBLE,
                new AggregateRequirement(NutrientProfile.ZERO, 0, List.of()), List.of());
        File out = tmp.resolve("plan.json").toFile();
        new JsonStorage().savePlan(plan, out);
        String json = Files.readString(out.toPath());
        assertTrue(json.contains("\"createdAt\""));
        assertTrue(json.contains("\"INFEASIBLE\""));
    }

    @Test
    void settingsUseBundledDefaultsThenUserOverrides() throws Exception {
        SettingsStorage storage = new SettingsStorage(tmp.resolve("cfg"));
        Settings defaults = storage.load();
        assertEquals("SCIP", defaults.solverId);
        assertEquals(DiversityMode.REQUIRED, defaults.diversity());
        assertEquals(0, defaults.timeLimitMillis());

        Settings mine = new Settings();
        mine.diversityMode = "LENIENT";
        mine.timeLimitSeconds = 30;
        storage.save(mine);
        Settings loaded = storage.load();
        assertEquals(DiversityMode.LENIENT, loaded.diversity());
        assertEquals(30_000, loaded.timeLimitMillis());
        assertEquals("SCIP", loaded.solverId);
    }

    @Test
    void savedSettingsHoldOnlySolverKeysAndOldKeysAreIgnored() throws Exception {
        Path dir = tmp.resolve("old");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("settings.json"),
                "{ \"diversityMode\": \"lenient\", \"lastCatalogDir\": \"/data/groceries\" }");
        SettingsStorage storage = new SettingsStorage(dir);
        Settings loaded = storage.load();
        assertEquals(DiversityMode.LENIENT, loaded.diversity());

        storage.save(loaded);
        String saved = Files.readString(dir.resolve("settings.json"));
        assertFalse(saved.contains("lastCatalogDir"));
        assertTrue(saved.contains("\"zeroTolerance\""));
    }

    @Test
    void invalidSettingsAreConfigurationErrors() throws Exception {
        Settings s = new Settings();
        s.diversityMode = "sometimes";
        assertThrows(ConfigurationException.class, s::diversity);
        s.zeroTolerance = 0.0;
        assertThrows(ConfigurationException.class, s::tolerance);

        Path dir = tmp.resolve("broken");
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("settings.json"), "{ not json");
        assertThrows(ConfigurationException.class, () -> new SettingsStorage(dir).load());
    }

    private void write(String name, String json) throws IOException {
        Files.writeString(tmp.resolve(name), json);
    }
}
