package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.config.FormFlowAsyncConfiguration;
import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command detection first, then the intelligent provider under a timeout, then the local heuristic
 * extractor when the provider is missing, slow or failing.
 */
@Slf4j
@Component
public class ExtractionPipeline {

    private final CommandDetector commandDetector;
    private final ExtractionProvider intelligentProvider;
    private final ExtractionProvider fallbackProvider;
    private final FieldValueExtractor fieldValueExtractor;
    private final LanguageDetector languageDetector;
    private final ProviderHealthTracker healthTracker;
    private final AsyncTaskExecutor executor;
    private final FormFlowProperties properties;
    private final AuditService audit;

    @Autowired
    public ExtractionPipeline(CommandDetector commandDetector,
                              LlmExtractionProvider llmExtractionProvider,
                              HeuristicExtractionProvider heuristicExtractionProvider,
                              FieldValueExtractor fieldValueExtractor,
                              LanguageDetector languageDetector,
                              ProviderHealthTracker healthTracker,
                              @Qualifier(FormFlowAsyncConfiguration.EXTRACTION_EXECUTOR) AsyncTaskExecutor executor,
                              FormFlowProperties properties,
                              AuditService audit) {
        this(commandDetector, (ExtractionProvider) llmExtractionProvider, heuristicExtractionProvider,
                fieldValueExtractor, languageDetector, healthTracker, executor, properties, audit);
    }

    public ExtractionPipeline(CommandDetector commandDetector,
                              ExtractionProvider intelligentProvider,
                              ExtractionProvider fallbackProvider,
                              FieldValueExtractor fieldValueExtractor,
                              LanguageDetector languageDetector,
                              ProviderHealthTracker healthTracker,
                              AsyncTaskExecutor executor,
                              FormFlowProperties properties,
                              AuditService audit) {
        this.commandDetector = commandDetector;
        this.intelligentProvider = intelligentProvider;
        this.fallbackProvider = fallbackProvider;
        this.fieldValueExtractor = fieldValueExtractor;
        this.languageDetector = languageDetector;
        this.healthTracker = healthTracker;
        this.executor = executor;
        this.properties = properties;
        this.audit = audit;
    }

    public Optional<ExtractionResult.Command> detectCommand(String transcript) {
        return commandDetector.detect(transcript);
    }

    public ExtractionResult extract(String sessionId, ExtractionRequest request) {
        Objects.requireNonNull(request.targetField(), "targetField");
        Optional<ExtractionResult.Command> command = commandDetector.detect(request.transcript());
        if (command.isPresent()) {
            return command.get();
        }
        ExtractionResult result = null;
        if (intelligentProvider != null && intelligentProvider.isAvailable()) {
            result = callIntelligent(sessionId, request);
        }
        if (result != null) {
            result = checkFormat(result, request);
        } else {
            result = fallbackProvider.extract(request);
        }
        return calibrate(result, request);
    }

    private ExtractionResult callIntelligent(String sessionId, ExtractionRequest request) {
        long timeoutMs = properties.getExtraction().getTimeoutMs();
        Future<ExtractionResult> future = null;
        try {
            future = executor.submit(() -> intelligentProvider.extract(request));
            ExtractionResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new FormFlowException(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE);
            }
            healthTracker.recordSuccess();
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            onProviderFailure(sessionId, FormFlowErrorCode.EXTRACTION_TIMEOUT,
                    "Extraction provider timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            FormFlowErrorCode code = cause instanceof FormFlowException ffe
                    ? ffe.getCode()
                    : FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE;
            onProviderFailure(sessionId, code, cause.getMessage());
        } catch (FormFlowException e) {
            onProviderFailure(sessionId, e.getCode(), e.getMessage());
        } catch (RejectedExecutionException e) {
            onProviderFailure(sessionId, FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE,
                    "Extraction executor rejected the call");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            onProviderFailure(sessionId, FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE,
                    "Interrupted while waiting for the extraction provider");
        }
        return null;
    }

    private void onProviderFailure(String sessionId, FormFlowErrorCode code, String message) {
        healthTracker.recordFailure(code, message);
        log.warn("Extraction provider {} failed for session {} ({}): {}. Falling back to {}",
                intelligentProvider.name(), sessionId, code, message, fallbackProvider.name());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("provider", intelligentProvider.name());
        payload.put("errorCode", code.name());
        payload.put("message", String.valueOf(message));
        payload.put("fallback", fallbackProvider.name());
        audit.audit(DialogueAuditStage.EXTRACTION_PROVIDER_FAILED, sessionId, payload);
    }

    /**
     * Runs provider values through the per-type validators. Their issues and suggestions are merged
     * in, and a value that fails its format check is capped at the validator's score.
     */
    ExtractionResult checkFormat(ExtractionResult result, ExtractionRequest request) {
        switch (result.kind()) {
            case SINGLE -> {
                ExtractionResult.Single single = (ExtractionResult.Single) result;
                FieldDescriptor field = single.field() == null
                        ? request.targetField()
                        : descriptorFor(single.field(), request);
                if (field == null) {
                    return single;
                }
                ExtractionResult.Single format = fieldValueExtractor.extract(single.value(), field);
                if (format.issues().isEmpty()) {
                    return single;
                }
                return new ExtractionResult.Single(
                        single.field(),
                        single.value(),
                        Math.min(single.confidence(), format.confidence()),
                        merge(single.issues(), format.issues()),
                        merge(single.suggestions(), format.suggestions()),
                        single.detectedLanguage()
                );
            }
            case BATCH -> {
                ExtractionResult.Batch batch = (ExtractionResult.Batch) result;
                List<ExtractedEntity> checked = new ArrayList<>(batch.entities().size());
                for (ExtractedEntity entity : batch.entities()) {
                    FieldDescriptor field = descriptorFor(entity.field(), request);
                    ExtractionResult.Single format = field == null ? null : fieldValueExtractor.extract(entity.value(), field);
                    if (format == null || format.issues().isEmpty()) {
                        checked.add(entity);
                    } else {
                        checked.add(new ExtractedEntity(
                                entity.field(),
                                entity.value(),
                                Math.min(entity.confidence(), format.confidence()),
                                merge(entity.issues(), format.issues())));
                    }
                }
                return new ExtractionResult.Batch(checked);
            }
            default -> {
                return result;
            }
        }
    }

    private static FieldDescriptor descriptorFor(String fieldName, ExtractionRequest request) {
        if (fieldName == null) {
            return null;
        }
        if (fieldName.equals(request.targetField().getName())) {
            return request.targetField();
        }
        for (FieldDescriptor candidate : request.remainingFields()) {
            if (fieldName.equals(candidate.getName())) {
                return candidate;
            }
        }
        return null;
    }

    private static List<String> merge(List<String> first, List<String> second) {
        LinkedHashSet<String> merged = new LinkedHashSet<>(first);
        merged.addAll(second);
        return new ArrayList<>(merged);
    }

    /**
     * Folds upstream ASR confidence into provider confidence and tags the language.
     */
    ExtractionResult calibrate(ExtractionResult result, ExtractionRequest request) {
        Double asr = request.asrConfidence();
        switch (result.kind()) {
            case SINGLE -> {
                ExtractionResult.Single single = (ExtractionResult.Single) result;
                String field = single.field() == null ? request.targetField().getName() : single.field();
                String language = single.detectedLanguage() != null
                        ? single.detectedLanguage()
                        : languageDetector.detect(request.transcript());
                return new ExtractionResult.Single(
                        field,
                        single.value(),
                        applyAsr(single.confidence(), asr),
                        single.issues(),
                        single.suggestions(),
                        language
                );
            }
            case BATCH -> {
                ExtractionResult.Batch batch = (ExtractionResult.Batch) result;
                List<ExtractedEntity> adjusted = new ArrayList<>(batch.entities().size());
                for (ExtractedEntity entity : batch.entities()) {
                    adjusted.add(entity.withConfidence(applyAsr(entity.confidence(), asr)));
                }
                return new ExtractionResult.Batch(adjusted);
            }
            default -> {
                return result;
            }
        }
    }

    static double applyAsr(double confidence, Double asrConfidence) {
        double bounded = Math.max(0.0d, Math.min(1.0d, confidence));
        if (asrConfidence == null) {
            return bounded;
        }
        double asr = Math.max(0.0d, Math.min(1.0d, asrConfidence));
        return Math.max(0.0d, Math.min(1.0d, bounded * (0.7d + 0.3d * asr)));
    }
}
