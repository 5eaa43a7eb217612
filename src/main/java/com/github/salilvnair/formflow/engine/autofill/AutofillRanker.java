package com.github.salilvnair.formflow.engine.autofill;

import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.AutofillEntry;
import com.github.salilvnair.formflow.service.AutofillHistoryCacheService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class AutofillRanker {

    static final Comparator<AutofillEntry> RANKING = Comparator
            .comparingDouble(AutofillEntry::confidence).reversed()
            .thenComparing(Comparator.comparingInt(AutofillEntry::usageCount).reversed())
            .thenComparing(AutofillEntry::lastUsedAt, Comparator.nullsLast(Comparator.<OffsetDateTime>reverseOrder()));

    private final AutofillHistoryCacheService historyService;
    private final FormFlowProperties properties;

    /**
     * Top-K past values for a field, best first. Anonymous users get nothing.
     */
    public List<AutofillEntry> suggest(String userId, String fieldName, String fieldType) {
        if (userId == null || userId.isBlank() || fieldName == null || fieldName.isBlank()) {
            return List.of();
        }
        String type = FieldTypeConstants.normalize(fieldType);
        if (FieldTypeConstants.PASSWORD.equals(type)) {
            return List.of();
        }
        try {
            return rank(historyService.getHistory(userId.trim(), fieldName.trim(), type), properties.getAutofill().getTopK());
        } catch (DataAccessException e) {
            log.warn("Autofill history unavailable for user {} field {}: {}", userId, fieldName, e.getMessage());
            return List.of();
        }
    }

    public static List<AutofillEntry> rank(List<AutofillEntry> history, int topK) {
        if (history == null || history.isEmpty() || topK <= 0) {
            return List.of();
        }
        // best-ranked row wins when the same value was stored more than once
        Map<String, AutofillEntry> byValue = new LinkedHashMap<>();
        history.stream()
                .sorted(RANKING)
                .forEach(entry -> byValue.putIfAbsent(valueKey(entry.value()), entry));
        return byValue.values().stream()
                .limit(topK)
                .toList();
    }

    private static String valueKey(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
