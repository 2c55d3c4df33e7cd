package com.example.groceryopt.services;

public enum DiversityMode {
    /** Every basket category must be bought from or already stocked. */
    REQUIRED,
    /** Presence indicators are modelled but never forced to 1, so categories may be skipped. */
    LENIENT
}
