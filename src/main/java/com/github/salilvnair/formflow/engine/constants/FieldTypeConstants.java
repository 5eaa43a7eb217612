package com.github.salilvnair.formflow.engine.constants;

import java.util.Locale;
import java.util.Set;

public final class FieldTypeConstants {

    private FieldTypeConstants() {
    }

    public static final String TEXT = "text";
    public static final String EMAIL = "email";
    public static final String TEL = "tel";
    public static final String DATE = "date";
    public static final String NUMBER = "number";
    public static final String SELECT = "select";
    public static final String RADIO = "radio";
    public static final String CHECKBOX = "checkbox";
    public static final String PASSWORD = "password";
    public static final String TEXTAREA = "textarea";
    public static final String URL = "url";

    /** Input types that never take a spoken answer. */
    public static final Set<String> NON_ASKABLE = Set.of("hidden", "submit", "button", "reset", "image");

    /** Types that may share a batched question with their neighbours. */
    public static final Set<String> BATCHABLE = Set.of(TEXT, EMAIL, TEL, NUMBER, DATE, URL);

    public static final Set<String> ENUMERABLE = Set.of(SELECT, RADIO);

    public static String normalize(String rawType) {
        if (rawType == null || rawType.isBlank()) {
            return TEXT;
        }
        String type = rawType.trim().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "phone", "mobile", "telephone" -> TEL;
            case "select-one", "dropdown" -> SELECT;
            case "datetime-local", "dob" -> DATE;
            default -> type;
        };
    }
}
