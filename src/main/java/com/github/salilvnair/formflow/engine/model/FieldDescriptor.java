package com.github.salilvnair.formflow.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Static metadata describing one fillable form input, as scraped by the client.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FieldDescriptor {

    private String name;
    private String label;
    private String type;
    private boolean required;
    private String question;
    private String smartPrompt;
    private List<String> options;
    private String validationPattern;
    private boolean hidden;

    /** Nested fields of a fieldset or sub-form; flattened at session start. */
    private List<FieldDescriptor> fields;

    /**
     * Scrapers send options either as plain strings or as {value, label} objects.
     */
    @JsonSetter("options")
    public void setOptions(List<Object> rawOptions) {
        if (rawOptions == null) {
            this.options = null;
            return;
        }
        List<String> resolved = new ArrayList<>();
        for (Object raw : rawOptions) {
            if (raw instanceof Map<?, ?> map) {
                Object value = map.get("value") != null ? map.get("value") : map.get("label");
                if (value != null && !String.valueOf(value).isBlank()) {
                    resolved.add(String.valueOf(value));
                }
            } else if (raw != null && !String.valueOf(raw).isBlank()) {
                resolved.add(String.valueOf(raw));
            }
        }
        this.options = resolved;
    }

    @JsonIgnore
    public String normalizedType() {
        return FieldTypeConstants.normalize(type);
    }

    @JsonIgnore
    public String displayLabel() {
        if (label != null && !label.isBlank()) {
            return label.trim();
        }
        if (name == null) {
            return "this field";
        }
        return name.replaceAll("([a-z])([A-Z])", "$1 $2").replace('_', ' ').replace('-', ' ').trim();
    }

    @JsonIgnore
    public boolean isAskable() {
        return name != null && !name.isBlank()
                && !hidden
                && !FieldTypeConstants.NON_ASKABLE.contains(normalizedType());
    }

    @JsonIgnore
    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }
}
