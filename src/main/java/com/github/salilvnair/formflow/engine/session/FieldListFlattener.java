package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.engine.model.FieldDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens fieldsets into one ordered list of askable fields. Names are trimmed, and the first
 * descriptor wins when a name repeats.
 */
final class FieldListFlattener {

    private FieldListFlattener() {
    }

    static List<FieldDescriptor> flatten(List<FieldDescriptor> schema) {
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        collect(schema, byName);
        return new ArrayList<>(byName.values());
    }

    private static void collect(List<FieldDescriptor> fields, Map<String, FieldDescriptor> byName) {
        if (fields == null) {
            return;
        }
        for (FieldDescriptor field : fields) {
            if (field == null) {
                continue;
            }
            if (field.getFields() != null && !field.getFields().isEmpty()) {
                collect(field.getFields(), byName);
                continue;
            }
            if (field.isAskable()) {
                String name = field.getName().trim();
                byName.putIfAbsent(name, name.equals(field.getName()) ? field : field.toBuilder().name(name).build());
            }
        }
    }
}
