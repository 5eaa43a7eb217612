package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Local extraction used when no intelligent provider is configured or it fails.
 */
@Component
@RequiredArgsConstructor
public class HeuristicExtractionProvider implements ExtractionProvider {

    private final EntityRecognizer entityRecognizer;
    private final FieldValueExtractor fieldValueExtractor;

    @Override
    public ExtractionResult extract(ExtractionRequest request) {
        List<ExtractedEntity> entities = entityRecognizer.recognize(request.transcript(), request.remainingFields());
        if (entities.size() >= 2) {
            return new ExtractionResult.Batch(entities);
        }
        return fieldValueExtractor.extract(request.transcript(), request.targetField());
    }

    @Override
    public String name() {
        return "heuristic";
    }
}
