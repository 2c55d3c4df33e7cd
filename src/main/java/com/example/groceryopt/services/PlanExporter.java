package com.example.groceryopt.services;

import com.example.groceryopt.model.PlanLine;
import com.example.groceryopt.model.PurchasePlan;
import com.example.groceryopt.model.StoreGroup;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/** CSV renditions of a plan: the full list, one store's list, and the summary metrics. */
public class PlanExporter {
    static final String HEADER =
        "Store,Food,Package Description,lb_per_package,price_per_package,Qty_to_Buy,Total_Weight_lb,Weekly_Cost\n";

    public void writeCsv(PurchasePlan plan, OutputStream out) throws IOException {
        writeLines(plan.lines, out);
    }

    public void writeStoreCsv(StoreGroup group, OutputStream out) throws IOException {
        writeLines(group.lines, out);
    }

    public void writeSummaryCsv(PurchasePlan plan, OutputStream out) throws IOException {
        Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        w.write("Metric,Value\n");
        w.write("Status," + plan.status.label + "\n");
        w.write("Total Cost," + money(plan.totalCost) + "\n");
        w.write("Total Packages," + plan.totalPackages + "\n");
        w.write("Total Weight (lbs)," + String.format(Locale.ROOT, "%.1f", plan.totalWeightLb) + "\n");
        w.write("Number of Stores," + plan.storeCount() + "\n");
        w.flush();
    }

    private void writeLines(List<PlanLine> lines, OutputStream out) throws IOException {
        Writer w = new OutputStreamWriter(out, StandardCharsets.UTF_8);
        w.write(HEADER);
        for (PlanLine l : lines) {
            w.write(escapeCsv(l.store)); w.write(",");
            w.write(escapeCsv(l.food)); w.write(",");
            w.write(escapeCsv(l.packageDescription)); w.write(",");
            w.write(num(l.lbPerPackage)); w.write(",");
            w.write(money(l.pricePerPackage)); w.write(",");
            w.write(String.valueOf(l.quantity)); w.write(",");
            w.write(num(l.totalWeightLb)); w.write(",");
            w.write(money(l.cost)); w.write("\n");
        }
        w.flush();
    }

    private static String num(double v) { return String.format(Locale.ROOT, "%.2f", v); }

    private static String money(double v) { return String.format(Locale.ROOT, "$%.2f", v); }

    static String escapeCsv(String s) {
        if (s == null) return "";
        if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
            return "\"" + s.replace("\"", "\"\"") + "\"";
        }
        return s;
    }
}
