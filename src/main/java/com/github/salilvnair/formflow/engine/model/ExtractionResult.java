package com.github.salilvnair.formflow.engine.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of extracting one transcript: a control command, values for several fields, or a
 * value for the active field.
 */
public sealed interface ExtractionResult
        permits ExtractionResult.Command, ExtractionResult.Batch, ExtractionResult.Single {

    enum Kind {
        COMMAND,
        BATCH,
        SINGLE
    }

    Kind kind();

    record Command(CommandAction action, Map<String, String> params) implements ExtractionResult {
        public Command {
            params = params == null ? Map.of() : Map.copyOf(params);
        }

        @Override
        public Kind kind() {
            return Kind.COMMAND;
        }
    }

    record Batch(List<ExtractedEntity> entities) implements ExtractionResult {
        public Batch {
            entities = entities == null ? List.of() : List.copyOf(entities);
        }

        @Override
        public Kind kind() {
            return Kind.BATCH;
        }
    }

    record Single(
            String field,
            String value,
            double confidence,
            List<String> issues,
            List<String> suggestions,
            String detectedLanguage
    ) implements ExtractionResult {
        public Single {
            issues = issues == null ? List.of() : List.copyOf(issues);
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }

        public Single withConfidence(double adjusted) {
            return new Single(field, value, adjusted, issues, suggestions, detectedLanguage);
        }

        @Override
        public Kind kind() {
            return Kind.SINGLE;
        }
    }
}
