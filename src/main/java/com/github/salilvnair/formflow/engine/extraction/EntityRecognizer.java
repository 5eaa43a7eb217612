package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.ExtractedEntity;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds values for several fields in one utterance, e.g.
 * {@code "my name is Jane and my email is jane@x.com"}.
 */
@Component
@RequiredArgsConstructor
public class EntityRecognizer {

    private static final Pattern CLAUSE_SPLIT = Pattern.compile("\\s*(?:[,;]|\\band\\b|\\balso\\b)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern KEYED_CLAUSE = Pattern.compile(
            "^(?:(?:oh|so|well)\\s+)?(?:my|the|our)\\s+(.+?)\\s+(?:is|are|would be|=|:)\\s+(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL_FIND = Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}");
    private static final Set<String> EMAIL_WORDS = Set.of("email", "e-mail", "mail");
    private static final Set<String> PHONE_WORDS = Set.of("phone", "mobile", "cell", "telephone", "contact");
    private static final Set<String> NOISE_WORDS = Set.of("full", "address", "number", "your");

    private final FieldValueExtractor extractor;
    private final SpokenInputNormalizer normalizer;

    public List<ExtractedEntity> recognize(String transcript, List<FieldDescriptor> candidates) {
        if (transcript == null || transcript.isBlank() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        Map<String, ExtractedEntity> found = new LinkedHashMap<>();
        for (String clause : CLAUSE_SPLIT.split(transcript.trim())) {
            String trimmed = clause.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Matcher keyed = KEYED_CLAUSE.matcher(trimmed);
            if (keyed.matches()) {
                FieldDescriptor field = matchField(keyed.group(1), candidates, found.keySet());
                if (field != null) {
                    found.put(field.getName(), toEntity(keyed.group(2), field));
                    continue;
                }
            }
            FieldDescriptor typed = matchByShape(trimmed, candidates, found.keySet());
            if (typed != null) {
                found.put(typed.getName(), toEntity(trimmed, typed));
            }
        }
        return new ArrayList<>(found.values());
    }

    private ExtractedEntity toEntity(String value, FieldDescriptor field) {
        ExtractionResult.Single single = extractor.extract(value, field);
        return new ExtractedEntity(field.getName(), single.value(), single.confidence(), single.issues());
    }

    FieldDescriptor matchField(String keyPhrase, List<FieldDescriptor> candidates, Set<String> taken) {
        List<String> keyTokens = tokens(keyPhrase);
        FieldDescriptor best = null;
        int bestScore = 0;
        for (FieldDescriptor field : candidates) {
            if (taken.contains(field.getName())) {
                continue;
            }
            Set<String> fieldTokens = new HashSet<>(tokens(field.getName()));
            fieldTokens.addAll(tokens(field.getLabel()));
            int score = 0;
            for (String token : keyTokens) {
                if (fieldTokens.contains(token) && !NOISE_WORDS.contains(token)) {
                    score++;
                }
            }
            String type = field.normalizedType();
            if (FieldTypeConstants.EMAIL.equals(type) && keyTokens.stream().anyMatch(EMAIL_WORDS::contains)) {
                score += 2;
            }
            if (FieldTypeConstants.TEL.equals(type) && keyTokens.stream().anyMatch(PHONE_WORDS::contains)) {
                score += 2;
            }
            if (score > bestScore) {
                best = field;
                bestScore = score;
            }
        }
        return best;
    }

    private FieldDescriptor matchByShape(String clause, List<FieldDescriptor> candidates, Set<String> taken) {
        String asEmail = normalizer.normalize(clause, FieldTypeConstants.EMAIL).text();
        boolean looksLikeEmail = EMAIL_FIND.matcher(asEmail).find();
        boolean looksLikePhone = !looksLikeEmail
                && SpokenInputNormalizer.countDigits(normalizer.normalize(clause, FieldTypeConstants.TEL).text()) >= 10;
        for (FieldDescriptor field : candidates) {
            if (taken.contains(field.getName())) {
                continue;
            }
            String type = field.normalizedType();
            if (looksLikeEmail && FieldTypeConstants.EMAIL.equals(type)) {
                return field;
            }
            if (looksLikePhone && FieldTypeConstants.TEL.equals(type)) {
                return field;
            }
        }
        return null;
    }

    static List<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        String spaced = text.replaceAll("([a-z])([A-Z])", "$1 $2").toLowerCase(Locale.ROOT);
        List<String> out = new ArrayList<>();
        for (String token : spaced.split("[^a-z0-9-]+")) {
            if (!token.isBlank()) {
                out.add(token);
            }
        }
        return out;
    }
}
