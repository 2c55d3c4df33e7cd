package com.example.groceryopt.services;

/** Input or setup that makes a request impossible to run; aborts with no partial result. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
