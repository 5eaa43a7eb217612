package com.github.salilvnair.formflow.service;

import com.github.salilvnair.formflow.config.FormFlowAsyncConfiguration;
import com.github.salilvnair.formflow.entity.FfAutofillHistory;
import com.github.salilvnair.formflow.repo.AutofillHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;

/**
 * Records committed values into the autofill history off the request thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AsyncAutofillPersistenceService {

    private final AutofillHistoryRepository autofillHistoryRepository;
    private final AutofillHistoryCacheService autofillHistoryCacheService;

    @Async(FormFlowAsyncConfiguration.AUTOFILL_EXECUTOR)
    public void recordAsync(String userId, String fieldName, String fieldType, String value, double confidence) {
        try {
            upsert(userId, fieldName, fieldType, value, confidence);
            autofillHistoryCacheService.evict(userId, fieldName, fieldType);
        } catch (Exception e) {
            log.error("Async autofill persistence failed for user {} field {}", userId, fieldName, e);
        }
    }

    /**
     * One row per (user, field, type, value). A concurrent writer that inserted or bumped the same row
     * first makes the save fail; the retry then finds that row and bumps it.
     */
    FfAutofillHistory upsert(String userId, String fieldName, String fieldType, String value, double confidence) {
        try {
            return saveOrBump(userId, fieldName, fieldType, value, confidence);
        } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
            log.debug("Concurrent autofill write for user {} field {}, retrying: {}", userId, fieldName, e.getMessage());
            return saveOrBump(userId, fieldName, fieldType, value, confidence);
        }
    }

    private FfAutofillHistory saveOrBump(String userId, String fieldName, String fieldType, String value, double confidence) {
        OffsetDateTime now = OffsetDateTime.now();
        FfAutofillHistory history = autofillHistoryRepository
                .findFirstByUserIdAndFieldNameAndFieldTypeAndValue(userId, fieldName, fieldType, value)
                .orElse(null);
        if (history == null) {
            history = FfAutofillHistory.builder()
                    .userId(userId)
                    .fieldName(fieldName)
                    .fieldType(fieldType)
                    .value(value)
                    .confidence(confidence)
                    .usageCount(1)
                    .lastUsedAt(now)
                    .createdAt(now)
                    .build();
        } else {
            history.setUsageCount(history.getUsageCount() + 1);
            history.setLastUsedAt(now);
            history.setConfidence(Math.max(history.getConfidence(), confidence));
        }
        return autofillHistoryRepository.save(history);
    }
}
