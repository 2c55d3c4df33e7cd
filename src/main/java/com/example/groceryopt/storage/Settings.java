package com.example.groceryopt.storage;

import com.example.groceryopt.services.ConfigurationException;
import com.example.groceryopt.services.DiversityMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public class Settings {
    // OR-Tools backend id, e.g. SCIP or CBC
    public String solverId = "SCIP";
    // 0 = no limit
    public Integer timeLimitSeconds = 0;
    public String diversityMode = "REQUIRED";
    public Double zeroTolerance = 1e-6;

    public DiversityMode diversity() {
        if (diversityMode == null) return DiversityMode.REQUIRED;
        try {
            return DiversityMode.valueOf(diversityMode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unknown diversityMode: " + diversityMode, ex);
        }
    }

    public long timeLimitMillis() {
        if (timeLimitSeconds == null) return 0;
        if (timeLimitSeconds < 0) throw new ConfigurationException("timeLimitSeconds must not be negative.");
        return timeLimitSeconds * 1000L;
    }

    public double tolerance() {
        if (zeroTolerance == null) return 1e-6;
        if (!(zeroTolerance > 0)) throw new ConfigurationException("zeroTolerance must be positive.");
        return zeroTolerance;
    }
}
