package org.areaflow.engine.catalog;

/**
 * One entry of an action or reaction config schema.
 *
 * @param type one of {@code string}, {@code email}, {@code number}, {@code boolean}
 */
public record ConfigField(String name, String type, boolean required, String label, String placeholder) {

    public static final String STRING = "string";
    public static final String EMAIL = "email";
    public static final String NUMBER = "number";
    public static final String BOOLEAN = "boolean";

    public static ConfigField required(String name, String type, String label, String placeholder) {
        return new ConfigField(name, type, true, label, placeholder);
    }

    public static ConfigField optional(String name, String type, String label, String placeholder) {
        return new ConfigField(name, type, false, label, placeholder);
    }
}
