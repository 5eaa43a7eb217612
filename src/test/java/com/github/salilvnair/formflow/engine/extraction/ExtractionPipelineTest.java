package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.audit.AuditService;
import com.github.salilvnair.formflow.audit.DialogueAuditStage;
import com.github.salilvnair.formflow.config.FormFlowAsyncConfiguration;
import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.exception.FormFlowErrorCode;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.CommandAction;
import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.support.ScriptedExtractionProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.formflow.support.TestConstants.*;
import static com.github.salilvnair.formflow.support.TestForms.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ExtractionPipelineTest {

    private static final String SESSION = "s-1";

    private final ScriptedExtractionProvider intelligent = new ScriptedExtractionProvider();
    private final ExtractionProvider fallback = mock(ExtractionProvider.class);
    private final ProviderHealthTracker healthTracker = new ProviderHealthTracker();
    private final AuditService audit = mock(AuditService.class);
    private final FieldValueExtractor fieldValueExtractor = new FieldValueExtractor(new SpokenInputNormalizer());
    private final FormFlowProperties properties = new FormFlowProperties();
    private ExtractionPipeline pipeline;

    @BeforeEach
    void setUp() {
        properties.getExtraction().setTimeoutMs(2_000L);
        when(fallback.name()).thenReturn("heuristic");
        pipeline = new ExtractionPipeline(new CommandDetector(), intelligent, fallback, fieldValueExtractor,
                new LanguageDetector(), healthTracker, new SimpleAsyncTaskExecutor("extraction-test-"), properties, audit);
    }

    @Test
    void asrConfidenceScalesProviderConfidence() {
        assertEquals(0.9d, ExtractionPipeline.applyAsr(0.9d, null), 1e-9);
        assertEquals(0.9d, ExtractionPipeline.applyAsr(0.9d, 1.0d), 1e-9);
        assertEquals(0.63d, ExtractionPipeline.applyAsr(0.9d, 0.0d), 1e-9);
        assertEquals(0.68d, ExtractionPipeline.applyAsr(0.8d, 0.5d), 1e-9);
        assertEquals(1.0d, ExtractionPipeline.applyAsr(1.5d, null), 1e-9);
    }

    @Test
    void commandsNeverReachAProvider() {
        intelligent.answerTarget("skip", 0.99d, List.of());

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_SKIP, null));

        ExtractionResult.Command command = assertInstanceOf(ExtractionResult.Command.class, result);
        assertEquals(CommandAction.SKIP, command.action());
        assertTrue(intelligent.requests().isEmpty());
        verify(fallback, never()).extract(any());
    }

    @Test
    void intelligentAnswerIsCalibratedAndTagged() {
        intelligent.answerTarget(SAID_JOHN_SMITH, 0.9d, List.of());

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_JOHN_SMITH, 0.5d));

        ExtractionResult.Single single = assertInstanceOf(ExtractionResult.Single.class, result);
        assertEquals(0.765d, single.confidence(), 1e-9);
        assertEquals(LanguageDetector.ENGLISH_US, single.detectedLanguage());
        assertTrue(healthTracker.isLastCallSuccessful());
        verify(fallback, never()).extract(any());
    }

    @Test
    void unavailableProviderGoesStraightToFallback() {
        intelligent.available(false);
        when(fallback.extract(any())).thenReturn(
                new ExtractionResult.Single(FIELD_NAME, SAID_JOHN_SMITH, 0.75d, List.of(), List.of(), null));

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_JOHN_SMITH, null));

        assertEquals(0.75d, ((ExtractionResult.Single) result).confidence(), 1e-9);
        assertTrue(intelligent.requests().isEmpty());
        assertNull(healthTracker.lastOutcome());
    }

    @Test
    void providerFailureIsRecordedAndFallsBack() {
        intelligent.answer(request -> {
            throw new FormFlowException(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE);
        });
        when(fallback.extract(any())).thenReturn(
                new ExtractionResult.Single(FIELD_NAME, SAID_JOHN_SMITH, 0.75d, List.of(), List.of(), null));

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_JOHN_SMITH, null));

        assertEquals(SAID_JOHN_SMITH, ((ExtractionResult.Single) result).value());
        assertFalse(healthTracker.isLastCallSuccessful());
        assertEquals(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE, healthTracker.lastOutcome().errorCode());
        verify(audit).audit(eq(DialogueAuditStage.EXTRACTION_PROVIDER_FAILED), eq(SESSION), anyMap());
    }

    @Test
    void nullAnswerCountsAsInvalidResponse() {
        intelligent.answer(request -> null);
        when(fallback.extract(any())).thenReturn(
                new ExtractionResult.Single(FIELD_NAME, SAID_JOHN_SMITH, 0.75d, List.of(), List.of(), null));

        pipeline.extract(SESSION, request(SAID_JOHN_SMITH, null));

        assertEquals(FormFlowErrorCode.EXTRACTION_INVALID_RESPONSE, healthTracker.lastOutcome().errorCode());
    }

    @Test
    void batchEntitiesAreEachScaled() {
        intelligent.answer(request -> new ExtractionResult.Batch(List.of(
                new ExtractedEntity(FIELD_NAME, "Jane", 1.0d, List.of()),
                new ExtractedEntity(FIELD_EMAIL, EMAIL_JANE, 0.8d, List.of()))));

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_NAME_AND_EMAIL, 0.0d));

        ExtractionResult.Batch batch = assertInstanceOf(ExtractionResult.Batch.class, result);
        assertEquals(0.7d, batch.entities().get(0).confidence(), 1e-9);
        assertEquals(0.56d, batch.entities().get(1).confidence(), 1e-9);
    }

    @Test
    void malformedEmailFromProviderIsCappedAndReportsIssue() {
        intelligent.answerTarget("jane at x", 0.95d, List.of());

        ExtractionResult result = pipeline.extract(SESSION, emailRequest("jane at x"));

        ExtractionResult.Single single = assertInstanceOf(ExtractionResult.Single.class, result);
        assertEquals("jane at x", single.value());
        assertTrue(single.confidence() < 0.6d);
        assertFalse(single.issues().isEmpty());
        assertTrue(single.suggestions().contains(EMAIL_JANE));
    }

    @Test
    void wellFormedEmailFromProviderKeepsItsConfidence() {
        intelligent.answerTarget(EMAIL_JANE, 0.95d, List.of());

        ExtractionResult.Single single = (ExtractionResult.Single) pipeline.extract(SESSION, emailRequest(EMAIL_JANE));

        assertEquals(0.95d, single.confidence(), 1e-9);
        assertTrue(single.issues().isEmpty());
    }

    @Test
    void malformedBatchEntryIsCappedAndOthersAreKept() {
        intelligent.answer(request -> new ExtractionResult.Batch(List.of(
                new ExtractedEntity(FIELD_NAME, "Jane", 0.95d, List.of()),
                new ExtractedEntity(FIELD_PHONE, "555", 0.95d, List.of()))));

        ExtractionResult result = pipeline.extract(SESSION, request(SAID_NAME_AND_EMAIL, null));

        ExtractionResult.Batch batch = assertInstanceOf(ExtractionResult.Batch.class, result);
        assertEquals(0.95d, batch.entities().get(0).confidence(), 1e-9);
        assertTrue(batch.entities().get(0).issues().isEmpty());
        assertEquals(0.4d, batch.entities().get(1).confidence(), 1e-9);
        assertFalse(batch.entities().get(1).issues().isEmpty());
    }

    @Test
    void saturatedExecutorFallsBackWithinTimeout() throws Exception {
        properties.getExtraction().setPoolSize(1);
        properties.getExtraction().setTimeoutMs(200L);
        ThreadPoolTaskExecutor executor = new FormFlowAsyncConfiguration().formFlowExtractionExecutor(properties);
        CountDownLatch release = new CountDownLatch(1);
        try {
            // one running and four queued fill the pool
            for (int i = 0; i < 5; i++) {
                executor.submit(() -> {
                    release.await();
                    return null;
                });
            }
            ExtractionPipeline saturated = new ExtractionPipeline(new CommandDetector(), intelligent, fallback,
                    fieldValueExtractor, new LanguageDetector(), healthTracker, executor, properties, audit);
            intelligent.answer(request -> {
                try {
                    Thread.sleep(3_000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new ExtractionResult.Single(FIELD_NAME, "late", 0.99d, List.of(), List.of(), null);
            });
            when(fallback.extract(any())).thenReturn(
                    new ExtractionResult.Single(FIELD_NAME, SAID_JOHN_SMITH, 0.75d, List.of(), List.of(), null));

            long startedAt = System.nanoTime();
            ExtractionResult result = saturated.extract(SESSION, request(SAID_JOHN_SMITH, null));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

            assertTrue(elapsedMs < 1_000L, "extract took " + elapsedMs + " ms");
            assertEquals(SAID_JOHN_SMITH, ((ExtractionResult.Single) result).value());
            assertEquals(FormFlowErrorCode.EXTRACTION_PROVIDER_UNAVAILABLE, healthTracker.lastOutcome().errorCode());
            assertTrue(intelligent.requests().isEmpty());
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    private static ExtractionRequest emailRequest(String transcript) {
        return new ExtractionRequest(transcript, email(), contactForm(), null, null, null);
    }

    private static ExtractionRequest request(String transcript, Double asr) {
        return new ExtractionRequest(transcript, name(), contactForm(), null, null, asr);
    }
}
