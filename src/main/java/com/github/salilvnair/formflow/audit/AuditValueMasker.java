package com.github.salilvnair.formflow.audit;

import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;

public final class AuditValueMasker {

    private static final String MASK = "******";

    private AuditValueMasker() {
    }

    public static String mask(FieldDescriptor field, String value) {
        if (value == null) {
            return null;
        }
        if (field != null && FieldTypeConstants.PASSWORD.equals(field.normalizedType())) {
            return MASK;
        }
        return value;
    }
}
