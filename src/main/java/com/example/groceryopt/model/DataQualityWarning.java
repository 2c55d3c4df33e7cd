package com.example.groceryopt.model;

/** A recoverable input problem; the request proceeds with the offending data ignored. */
public final class DataQualityWarning {
    public enum Kind { UNMATCHED_COST_ROW, UNMATCHED_MEMBER, UNKNOWN_STOCK_ENTRY }

    public final Kind kind;
    public final String subject;
    public final String message;

    public DataQualityWarning(Kind kind, String subject, String message) {
        this.kind = kind; this.subject = subject; this.message = message;
    }

    @Override public String toString() { return kind + " [" + subject + "]: " + message; }
}
