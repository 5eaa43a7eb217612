package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Deterministic single-field extraction. Confidence reflects how well the utterance fits the
 * field's format, minus penalties for hesitation, homophones and competing parses.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldValueExtractor {

    static final double HESITATION_PENALTY = 0.10d;
    static final double HOMOPHONE_PENALTY = 0.05d;
    static final double AMBIGUITY_PENALTY = 0.15d;

    private static final Pattern LEAD_IN = Pattern.compile(
            "^(?:(?:well|so|okay|ok|yeah|yes|sure|alright)[,.!]?\\s+)?"
                    + "(?:(?:my|the|our|his|her)\\s+[\\w\\s-]{1,30}?\\s+(?:is|are|would be|will be|should be)\\s+"
                    + "|it'?s\\s+|it\\s+is\\s+|that'?s\\s+|that\\s+is\\s+|i\\s+am\\s+|i'?m\\s+|call\\s+me\\s+"
                    + "|this\\s+is\\s+|i\\s+live\\s+(?:at|in)\\s+|i\\s+was\\s+born\\s+on\\s+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FILLERS = Pattern.compile("\\b(?:uh+|um+|uhm|erm|hmm+)\\b[,.]?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HESITATION = Pattern.compile(
            "\\b(?:uh+|um+|uhm|erm|hmm+|let me think|wait|hold on|i'?m not sure|what was it)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> HOMOPHONES = Set.of(
            "male", "their", "there", "hear", "write", "weight", "cent", "buy", "sea", "week");
    private static final Pattern EMAIL_FIND = Pattern.compile("[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}");
    private static final Pattern NUMBER_FIND = Pattern.compile("-?\\d+(?:\\.\\d+)?");
    private static final Pattern URL_SHAPE = Pattern.compile("^(?:https?://)?[\\w.-]+\\.[a-z]{2,}(?:/\\S*)?$");
    private static final Pattern NAME_SHAPE = Pattern.compile("^[\\p{L}][\\p{L}'.-]*(?:\\s+[\\p{L}][\\p{L}'.-]*){0,3}$");
    private static final Pattern ORDINAL = Pattern.compile("(\\d{1,2})(?:st|nd|rd|th)\\b");
    private static final Set<String> AFFIRMATIVE = Set.of("yes", "yeah", "yep", "true", "check", "checked", "agree", "i agree", "sure", "ok", "okay");
    private static final Set<String> NEGATIVE = Set.of("no", "nope", "false", "uncheck", "unchecked", "disagree", "i disagree");
    private static final List<String> COMMON_DOMAINS = List.of("gmail.com", "yahoo.com", "outlook.com", "hotmail.com");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("uuuu-M-d"),
            formatter("uuuu/M/d"),
            formatter("MMMM d uuuu"),
            formatter("MMM d uuuu"),
            formatter("d MMMM uuuu"),
            formatter("d MMM uuuu")
    );
    private static final DateTimeFormatter MONTH_FIRST = formatter("M/d/uuuu");
    private static final DateTimeFormatter DAY_FIRST = formatter("d/M/uuuu");

    private final SpokenInputNormalizer normalizer;

    public ExtractionResult.Single extract(String transcript, FieldDescriptor field) {
        String raw = transcript == null ? "" : transcript.trim();
        String cleaned = clean(raw);
        String type = field.normalizedType();
        if (cleaned.isEmpty()) {
            return new ExtractionResult.Single(field.getName(), "", 0.0d,
                    List.of("Nothing was heard for " + field.displayLabel()), List.of(), null);
        }

        Scored scored = switch (type) {
            case FieldTypeConstants.EMAIL -> email(cleaned);
            case FieldTypeConstants.TEL -> phone(cleaned);
            case FieldTypeConstants.DATE -> date(cleaned);
            case FieldTypeConstants.NUMBER -> number(cleaned);
            case FieldTypeConstants.URL -> url(cleaned);
            case FieldTypeConstants.SELECT, FieldTypeConstants.RADIO ->
                    field.hasOptions() ? option(cleaned, field.getOptions()) : text(cleaned, 0.86d);
            case FieldTypeConstants.CHECKBOX ->
                    field.hasOptions() && field.getOptions().size() > 1 ? option(cleaned, field.getOptions()) : bool(cleaned);
            case FieldTypeConstants.PASSWORD -> new Scored(cleaned, 0.9d);
            case FieldTypeConstants.TEXTAREA -> text(cleaned, 0.9d);
            default -> isNameField(field) ? name(cleaned) : text(cleaned, 0.86d);
        };

        double confidence = scored.confidence;
        if (HESITATION.matcher(raw).find()) {
            confidence -= HESITATION_PENALTY;
        }
        if (isFreeText(type) && containsHomophone(cleaned)) {
            confidence -= HOMOPHONE_PENALTY;
        }
        checkValidationPattern(field, scored);
        return new ExtractionResult.Single(
                field.getName(),
                scored.value,
                clamp(confidence),
                scored.issues,
                scored.suggestions,
                null
        );
    }

    static String clean(String raw) {
        String withoutFillers = FILLERS.matcher(raw).replaceAll(" ").replaceAll("\\s+", " ").trim();
        String stripped = LEAD_IN.matcher(withoutFillers).replaceFirst("").trim();
        stripped = stripped.replaceAll("[.!?]+$", "").trim();
        return stripped.isEmpty() ? withoutFillers.replaceAll("[.!?]+$", "").trim() : stripped;
    }

    private Scored email(String cleaned) {
        SpokenInputNormalizer.NormalizedInput normalized = normalizer.normalize(cleaned, FieldTypeConstants.EMAIL);
        String text = normalized.text();
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = EMAIL_FIND.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        if (!found.isEmpty()) {
            String value = found.iterator().next();
            double confidence = normalized.spokenFormDetected() ? 0.88d : 0.95d;
            Scored scored = new Scored(value, confidence);
            if (found.size() > 1) {
                scored.confidence -= AMBIGUITY_PENALTY;
                scored.issues.add("Heard more than one email address");
                scored.suggestions.addAll(found);
            }
            return scored;
        }
        String candidate = text.replace(" ", "");
        if (candidate.contains("@")) {
            Scored scored = new Scored(candidate, 0.5d);
            scored.issues.add("Email address looks incomplete");
            String local = candidate.substring(0, candidate.indexOf('@'));
            String domain = candidate.substring(candidate.indexOf('@') + 1);
            if (!local.isEmpty()) {
                if (!domain.isEmpty() && !domain.contains(".")) {
                    scored.suggestions.add(local + "@" + domain + ".com");
                }
                for (String common : COMMON_DOMAINS) {
                    if (!domain.isEmpty() && common.startsWith(domain)) {
                        scored.suggestions.add(local + "@" + common);
                    }
                }
            }
            return scored;
        }
        Scored scored = new Scored(text, 0.3d);
        scored.issues.add("No email address recognized");
        if (!candidate.isEmpty() && candidate.matches("[a-z0-9._%+-]+")) {
            scored.suggestions.add(candidate + "@" + COMMON_DOMAINS.get(0));
        }
        return scored;
    }

    private Scored phone(String cleaned) {
        String value = normalizer.normalize(cleaned, FieldTypeConstants.TEL).text();
        int digits = SpokenInputNormalizer.countDigits(value);
        if (digits >= 10 && digits <= 15) {
            return new Scored(value, 0.92d);
        }
        if (digits >= 7 && digits <= 9) {
            Scored scored = new Scored(value, 0.7d);
            scored.issues.add("Phone number seems short (" + digits + " digits)");
            return scored;
        }
        if (digits == 0) {
            Scored scored = new Scored(cleaned, 0.2d);
            scored.issues.add("No phone number recognized");
            return scored;
        }
        Scored scored = new Scored(value, 0.4d);
        scored.issues.add("Expected 10 digits, heard " + digits);
        return scored;
    }

    private Scored date(String cleaned) {
        String text = ORDINAL.matcher(cleaned.toLowerCase(Locale.ROOT)).replaceAll("$1")
                .replaceAll("\\bof\\b", " ")
                .replace(",", " ")
                .replaceAll("\\s+", " ")
                .trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            LocalDate parsed = tryParse(text, format);
            if (parsed != null) {
                return new Scored(parsed.toString(), 0.9d);
            }
        }
        String slashed = text.replace('-', '/').replace('.', '/');
        LocalDate monthFirst = tryParse(slashed, MONTH_FIRST);
        LocalDate dayFirst = tryParse(slashed, DAY_FIRST);
        if (monthFirst != null && dayFirst != null && !monthFirst.equals(dayFirst)) {
            Scored scored = new Scored(monthFirst.toString(), 0.9d - AMBIGUITY_PENALTY);
            scored.issues.add("Date could be read as month/day or day/month");
            scored.suggestions.add(monthFirst.toString());
            scored.suggestions.add(dayFirst.toString());
            return scored;
        }
        LocalDate either = monthFirst != null ? monthFirst : dayFirst;
        if (either != null) {
            return new Scored(either.toString(), 0.9d);
        }
        Scored scored = new Scored(cleaned, 0.45d);
        scored.issues.add("Could not understand the date");
        return scored;
    }

    private Scored number(String cleaned) {
        String text = normalizer.normalize(cleaned, FieldTypeConstants.NUMBER).text().replace(",", "");
        List<String> found = new ArrayList<>();
        Matcher matcher = NUMBER_FIND.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        if (found.size() == 1) {
            return new Scored(found.get(0), 0.9d);
        }
        if (found.size() > 1) {
            Scored scored = new Scored(found.get(0), 0.9d - AMBIGUITY_PENALTY);
            scored.issues.add("Heard more than one number");
            scored.suggestions.addAll(found);
            return scored;
        }
        Scored scored = new Scored(cleaned, 0.4d);
        scored.issues.add("No number recognized");
        return scored;
    }

    private Scored url(String cleaned) {
        String text = normalizer.normalize(cleaned, FieldTypeConstants.URL).text();
        if (URL_SHAPE.matcher(text).matches()) {
            return new Scored(text, 0.9d);
        }
        Scored scored = new Scored(text, 0.5d);
        scored.issues.add("That does not look like a web address");
        return scored;
    }

    private Scored option(String cleaned, List<String> options) {
        String key = comparable(cleaned);
        for (String option : options) {
            if (comparable(option).equals(key)) {
                return new Scored(option, 0.95d);
            }
        }
        List<String> containing = new ArrayList<>();
        for (String option : options) {
            String candidate = comparable(option);
            if (!key.isEmpty() && !candidate.isEmpty() && (key.contains(candidate) || candidate.contains(key))) {
                containing.add(option);
            }
        }
        if (containing.size() == 1) {
            return new Scored(containing.get(0), 0.85d);
        }
        if (containing.size() > 1) {
            Scored scored = new Scored(containing.get(0), 0.85d - AMBIGUITY_PENALTY);
            scored.issues.add("More than one option matches");
            scored.suggestions.addAll(containing);
            return scored;
        }
        List<String> ranked = new ArrayList<>(options);
        ranked.sort(Comparator.comparingDouble((String o) -> TextSimilarity.ratio(key, comparable(o))).reversed());
        String best = ranked.get(0);
        if (TextSimilarity.ratio(key, comparable(best)) >= 0.75d) {
            Scored scored = new Scored(best, 0.7d);
            scored.suggestions.add(best);
            return scored;
        }
        Scored scored = new Scored(cleaned, 0.35d);
        scored.issues.add("Not one of the available options");
        scored.suggestions.addAll(ranked.subList(0, Math.min(3, ranked.size())));
        return scored;
    }

    private Scored bool(String cleaned) {
        String key = cleaned.toLowerCase(Locale.ROOT).replaceAll("[^a-z ]", "").trim();
        if (AFFIRMATIVE.contains(key)) {
            return new Scored("true", 0.9d);
        }
        if (NEGATIVE.contains(key)) {
            return new Scored("false", 0.9d);
        }
        Scored scored = new Scored(cleaned, 0.4d);
        scored.issues.add("Expected yes or no");
        scored.suggestions.add("true");
        scored.suggestions.add("false");
        return scored;
    }

    private Scored name(String cleaned) {
        String text = normalizer.normalize(cleaned, FieldTypeConstants.TEXT).text();
        if (NAME_SHAPE.matcher(text).matches()) {
            return new Scored(titleCase(text), 0.9d);
        }
        Scored scored = new Scored(text, 0.6d);
        scored.issues.add("That does not sound like a name");
        return scored;
    }

    private Scored text(String cleaned, double confidence) {
        return new Scored(normalizer.normalize(cleaned, FieldTypeConstants.TEXT).text(), confidence);
    }

    private void checkValidationPattern(FieldDescriptor field, Scored scored) {
        String pattern = field.getValidationPattern();
        if (pattern == null || pattern.isBlank() || scored.value == null) {
            return;
        }
        try {
            if (!Pattern.compile(pattern).matcher(scored.value).matches()) {
                scored.issues.add("Value does not match the expected format for " + field.displayLabel());
            }
        } catch (PatternSyntaxException e) {
            log.debug("Ignoring invalid validation pattern on field {}: {}", field.getName(), e.getDescription());
        }
    }

    static boolean isNameField(FieldDescriptor field) {
        String name = field.getName() == null ? "" : field.getName().toLowerCase(Locale.ROOT);
        String label = field.getLabel() == null ? "" : field.getLabel().toLowerCase(Locale.ROOT);
        boolean mentionsName = name.contains("name") || label.contains("name");
        boolean notAName = name.contains("user") || name.contains("company") || name.contains("business")
                || label.contains("user") || label.contains("company");
        return mentionsName && !notAName;
    }

    private static boolean isFreeText(String type) {
        return FieldTypeConstants.TEXT.equals(type) || FieldTypeConstants.TEXTAREA.equals(type);
    }

    private static boolean containsHomophone(String text) {
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z']+")) {
            if (HOMOPHONES.contains(token)) {
                return true;
            }
        }
        return false;
    }

    static String comparable(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    static String titleCase(String text) {
        StringBuilder out = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Character.toUpperCase(word.charAt(0)));
            out.append(word.substring(1));
        }
        return out.toString();
    }

    private static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    private static LocalDate tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDate.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }

    private static final class Scored {
        private final String value;
        private double confidence;
        private final List<String> issues = new ArrayList<>();
        private final List<String> suggestions = new ArrayList<>();

        private Scored(String value, double confidence) {
            this.value = value;
            this.confidence = confidence;
        }
    }
}
