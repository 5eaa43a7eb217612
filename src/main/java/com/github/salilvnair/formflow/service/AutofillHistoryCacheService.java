package com.github.salilvnair.formflow.service;

import com.github.salilvnair.formflow.config.FormFlowCacheConfiguration;
import com.github.salilvnair.formflow.engine.model.AutofillEntry;
import com.github.salilvnair.formflow.entity.FfAutofillHistory;
import com.github.salilvnair.formflow.repo.AutofillHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class AutofillHistoryCacheService {

    private final AutofillHistoryRepository autofillHistoryRepository;

    @Cacheable(
            value = FormFlowCacheConfiguration.AUTOFILL_CACHE,
            key = "#p0 + ':' + #p1 + ':' + #p2"
    )
    public List<AutofillEntry> getHistory(String userId, String fieldName, String fieldType) {
        return autofillHistoryRepository.findByUserIdAndFieldNameAndFieldType(userId, fieldName, fieldType)
                .stream()
                .map(AutofillHistoryCacheService::toEntry)
                .toList();
    }

    @CacheEvict(
            value = FormFlowCacheConfiguration.AUTOFILL_CACHE,
            key = "#p0 + ':' + #p1 + ':' + #p2"
    )
    public void evict(String userId, String fieldName, String fieldType) {
        // eviction only
    }

    static AutofillEntry toEntry(FfAutofillHistory history) {
        int uses = history.getUsageCount();
        String label = history.getValue() + " (used " + uses + (uses == 1 ? " time)" : " times)");
        return new AutofillEntry(history.getValue(), label, history.getConfidence(), uses, history.getLastUsedAt());
    }
}
