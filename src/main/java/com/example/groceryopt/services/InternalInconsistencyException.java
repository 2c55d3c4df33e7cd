package com.example.groceryopt.services;

/** The solved model and the catalog it was built from disagree. Always a defect. */
public class InternalInconsistencyException extends IllegalStateException {
    public InternalInconsistencyException(String message) { super(message); }
}
