package com.github.salilvnair.formflow.support;

import com.github.salilvnair.formflow.engine.model.FieldDescriptor;

import java.util.List;

import static com.github.salilvnair.formflow.support.TestConstants.*;

public final class TestForms {

    private TestForms() {
    }

    public static FieldDescriptor field(String name, String type, boolean required) {
        return FieldDescriptor.builder()
                .name(name)
                .type(type)
                .required(required)
                .build();
    }

    public static FieldDescriptor name() {
        return field(FIELD_NAME, TYPE_TEXT, true);
    }

    public static FieldDescriptor email() {
        return field(FIELD_EMAIL, TYPE_EMAIL, true);
    }

    public static FieldDescriptor phone() {
        return field(FIELD_PHONE, TYPE_TEL, false);
    }

    public static FieldDescriptor address() {
        return field(FIELD_ADDRESS, TYPE_TEXT, false);
    }

    public static FieldDescriptor country() {
        return FieldDescriptor.builder()
                .name(FIELD_COUNTRY)
                .type(TYPE_SELECT)
                .required(true)
                .options(List.of("United States", "Canada", "Mexico"))
                .build();
    }

    public static FieldDescriptor password() {
        return field(FIELD_PASSWORD, TYPE_PASSWORD, true);
    }

    /** name, email, phone */
    public static List<FieldDescriptor> contactForm() {
        return List.of(name(), email(), phone());
    }
}
