package com.github.salilvnair.formflow.engine.clarification;

import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.extraction.SpokenInputNormalizer;
import com.github.salilvnair.formflow.engine.extraction.TextSimilarity;
import com.github.salilvnair.formflow.engine.model.Disposition;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Maps extraction confidence to a disposition and writes the prompts for the two non-accepting
 * bands. Thresholds come from {@code formflow.clarification.*}.
 */
@Component
@RequiredArgsConstructor
public class ClarificationResolver {

    private static final Pattern EMAIL = Pattern.compile("^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAME = Pattern.compile("^[\\p{L}][\\p{L}'.-]*(?:\\s+[\\p{L}][\\p{L}'.-]*){0,3}$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    private final FormFlowProperties properties;

    public Disposition classify(double confidence) {
        FormFlowProperties.Clarification bands = properties.getClarification();
        if (confidence >= bands.getAutoAcceptAt()) {
            return Disposition.AUTO_ACCEPT;
        }
        if (confidence >= bands.getClarifyBelow()) {
            return Disposition.CONFIRM;
        }
        return Disposition.CLARIFY;
    }

    /**
     * Deduplicated candidates ranked by how well they fit the field format, capped at
     * {@code max-suggestions}. The heard value stays in the list when it is not blank.
     */
    public List<String> rankSuggestions(FieldDescriptor field, String heardValue, Collection<String> candidates) {
        Map<String, String> unique = new LinkedHashMap<>();
        addCandidate(unique, heardValue);
        if (candidates != null) {
            candidates.forEach(candidate -> addCandidate(unique, candidate));
        }
        List<String> ranked = new ArrayList<>(unique.values());
        ranked.sort(Comparator.comparingDouble((String candidate) -> formatScore(field, candidate)).reversed());

        int limit = Math.max(1, properties.getClarification().getMaxSuggestions());
        List<String> top = new ArrayList<>(ranked.subList(0, Math.min(limit, ranked.size())));
        String heard = heardValue == null ? null : unique.get(key(heardValue));
        if (heard != null && !top.contains(heard)) {
            top.set(top.size() - 1, heard);
        }
        return top;
    }

    public String confirmationPrompt(FieldDescriptor field, String value, double confidence) {
        String label = spokenLabel(field);
        if (FieldTypeConstants.PASSWORD.equals(field.normalizedType())) {
            return "I heard your " + label + ". Should I use it?";
        }
        if (confidence >= 0.70d) {
            return "Let me confirm - your " + label + " is '" + value + "'?";
        }
        return "I want to make sure I got this right. Did you say your " + label + " is '" + value + "'? "
                + "Say 'yes' to confirm or 'no' to correct.";
    }

    /**
     * Each repeated attempt on the same field gives different help: rephrase, format example,
     * break down, then offer to skip.
     */
    public String clarificationQuestion(FieldDescriptor field, String transcript, int attempt, List<String> suggestions) {
        StringBuilder question = new StringBuilder();
        if (transcript != null && !transcript.isBlank()) {
            question.append("I heard \"").append(transcript.trim()).append("\". ");
        }
        question.append(escalation(field, Math.max(1, attempt)));
        if (suggestions != null && !suggestions.isEmpty() && !FieldTypeConstants.PASSWORD.equals(field.normalizedType())) {
            question.append(" Did you mean ").append(joinAlternatives(suggestions)).append('?');
        }
        return question.toString();
    }

    String escalation(FieldDescriptor field, int attempt) {
        String label = spokenLabel(field);
        String type = field.normalizedType();
        boolean nameField = label.contains("name");
        switch (Math.min(attempt, 4)) {
            case 1:
                if (nameField) {
                    return "I didn't catch your name. Could you say it again clearly?";
                }
                if (FieldTypeConstants.EMAIL.equals(type)) {
                    return "Let me try that again. What's your email address?";
                }
                if (FieldTypeConstants.TEL.equals(type)) {
                    return "Sorry, I didn't catch your phone number. Could you say it again?";
                }
                return "Could you repeat your " + label + "?";
            case 2:
                if (nameField) {
                    return "Try saying your name like: 'First name is John. Last name is Smith.'";
                }
                if (FieldTypeConstants.EMAIL.equals(type)) {
                    return "Try saying it like 'john underscore doe at gmail dot com', or spell it out letter by letter.";
                }
                if (FieldTypeConstants.TEL.equals(type)) {
                    return "Try saying the digits with short pauses, like 'five five five, one two three, four five six seven'.";
                }
                if (FieldTypeConstants.DATE.equals(type)) {
                    return "Try saying the date like 'March fifth, nineteen ninety'.";
                }
                if (field.hasOptions()) {
                    return "Please pick one of: " + joinAlternatives(field.getOptions()) + ".";
                }
                return "Can you tell me your " + label + " slowly and clearly?";
            case 3:
                if (nameField) {
                    return "Let's start simple - what's just your first name?";
                }
                if (FieldTypeConstants.EMAIL.equals(type)) {
                    return "Let's break it down. First, what comes before the @ sign in your email?";
                }
                if (FieldTypeConstants.TEL.equals(type)) {
                    return "Let's go step by step. What's your area code - the first 3 digits?";
                }
                return "Can you spell out your " + label + " letter by letter?";
            default:
                return "Having trouble with " + label + " over voice. You can say 'skip' to skip this field, "
                        + "or type it instead if that's easier.";
        }
    }

    double formatScore(FieldDescriptor field, String candidate) {
        double score = switch (field.normalizedType()) {
            case FieldTypeConstants.EMAIL -> EMAIL.matcher(candidate).matches() ? 1.0d : candidate.contains("@") ? 0.5d : 0.0d;
            case FieldTypeConstants.TEL -> {
                int digits = SpokenInputNormalizer.countDigits(candidate);
                yield digits >= 10 && digits <= 15 ? 1.0d : digits >= 7 ? 0.6d : 0.2d;
            }
            case FieldTypeConstants.DATE -> isIsoDate(candidate) ? 1.0d : 0.3d;
            case FieldTypeConstants.NUMBER -> NUMBER.matcher(candidate).matches() ? 1.0d : 0.2d;
            case FieldTypeConstants.SELECT, FieldTypeConstants.RADIO, FieldTypeConstants.CHECKBOX -> bestOptionSimilarity(field, candidate);
            default -> NAME.matcher(candidate).matches() ? 0.8d : 0.5d;
        };
        if (matchesValidationPattern(field, candidate)) {
            score += 0.5d;
        }
        return score;
    }

    private static double bestOptionSimilarity(FieldDescriptor field, String candidate) {
        if (!field.hasOptions()) {
            return 0.5d;
        }
        String key = key(candidate);
        double best = 0.0d;
        for (String option : field.getOptions()) {
            best = Math.max(best, TextSimilarity.ratio(key, key(option)));
        }
        return best;
    }

    private static boolean matchesValidationPattern(FieldDescriptor field, String candidate) {
        String pattern = field.getValidationPattern();
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        try {
            return Pattern.compile(pattern).matcher(candidate).matches();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    private static boolean isIsoDate(String candidate) {
        try {
            LocalDate.parse(candidate);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static void addCandidate(Map<String, String> unique, String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return;
        }
        unique.putIfAbsent(key(candidate), candidate.trim());
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    static String spokenLabel(FieldDescriptor field) {
        return field.displayLabel().toLowerCase(Locale.ROOT);
    }

    static String joinAlternatives(List<String> values) {
        if (values.size() == 1) {
            return "'" + values.get(0) + "'";
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                out.append(i == values.size() - 1 ? " or " : ", ");
            }
            out.append('\'').append(values.get(i)).append('\'');
        }
        return out.toString();
    }
}
