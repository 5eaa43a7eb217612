package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites spoken articulations into the written form a field expects:
 * {@code "john at gmail dot com" -> "john@gmail.com"}, {@code "five five five ..." -> digits},
 * {@code "j o h n" -> "john"}.
 */
@Component
public class SpokenInputNormalizer {

    public record NormalizedInput(String text, boolean spokenFormDetected) {
    }

    private static final Map<Pattern, String> DOMAIN_CORRECTIONS = new LinkedHashMap<>();
    private static final Map<Pattern, String> SYMBOL_WORDS = new LinkedHashMap<>();
    private static final Map<String, String> NUMBER_WORDS = new LinkedHashMap<>();
    private static final Pattern REPEATED_DIGIT = Pattern.compile("\\b(double|triple)\\s+(\\d)\\b");

    static {
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bg\\s*mail\\b"), "gmail");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bgee\\s*mail\\b"), "gmail");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bgmale\\b"), "gmail");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bgmal\\b"), "gmail");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\byaho\\b"), "yahoo");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bhot\\s*mail\\b"), "hotmail");
        DOMAIN_CORRECTIONS.put(Pattern.compile("\\bout\\s*look\\b"), "outlook");

        // longest phrases first
        SYMBOL_WORDS.put(Pattern.compile("\\bat the rate of\\b"), "@");
        SYMBOL_WORDS.put(Pattern.compile("\\bat the rate\\b"), "@");
        SYMBOL_WORDS.put(Pattern.compile("\\bat (?:sign|symbol)\\b"), "@");
        SYMBOL_WORDS.put(Pattern.compile("\\bunder ?score\\b"), "_");
        SYMBOL_WORDS.put(Pattern.compile("\\bfull stop\\b"), ".");
        SYMBOL_WORDS.put(Pattern.compile("\\bdotcom\\b"), ".com");
        SYMBOL_WORDS.put(Pattern.compile("\\b(?:dot|period|point)\\b"), ".");
        SYMBOL_WORDS.put(Pattern.compile("\\b(?:hyphen|dash|minus)\\b"), "-");
        SYMBOL_WORDS.put(Pattern.compile("\\bslash\\b"), "/");
        SYMBOL_WORDS.put(Pattern.compile("\\bcolon\\b"), ":");
        SYMBOL_WORDS.put(Pattern.compile("\\bplus\\b"), "+");
        SYMBOL_WORDS.put(Pattern.compile("\\bat\\b"), "@");

        NUMBER_WORDS.put("zero", "0");
        NUMBER_WORDS.put("oh", "0");
        NUMBER_WORDS.put("o", "0");
        NUMBER_WORDS.put("nought", "0");
        NUMBER_WORDS.put("one", "1");
        NUMBER_WORDS.put("won", "1");
        NUMBER_WORDS.put("two", "2");
        NUMBER_WORDS.put("to", "2");
        NUMBER_WORDS.put("too", "2");
        NUMBER_WORDS.put("three", "3");
        NUMBER_WORDS.put("four", "4");
        NUMBER_WORDS.put("for", "4");
        NUMBER_WORDS.put("fore", "4");
        NUMBER_WORDS.put("five", "5");
        NUMBER_WORDS.put("six", "6");
        NUMBER_WORDS.put("seven", "7");
        NUMBER_WORDS.put("eight", "8");
        NUMBER_WORDS.put("ate", "8");
        NUMBER_WORDS.put("nine", "9");
        NUMBER_WORDS.put("ten", "10");
    }

    public NormalizedInput normalize(String raw, String fieldType) {
        if (raw == null || raw.isBlank()) {
            return new NormalizedInput("", false);
        }
        String type = FieldTypeConstants.normalize(fieldType);
        String baseline = raw.trim().replaceAll("\\s+", " ");
        String text = baseline.toLowerCase(Locale.ROOT);

        String normalized = switch (type) {
            case FieldTypeConstants.EMAIL -> normalizeEmail(text);
            case FieldTypeConstants.URL -> normalizeUrl(text);
            case FieldTypeConstants.TEL -> normalizePhone(text);
            case FieldTypeConstants.NUMBER -> normalizeNumber(text);
            default -> isSpelledOut(text) ? joinSpelledLetters(text) : baseline;
        };
        boolean spoken = !normalized.equalsIgnoreCase(baseline);
        return new NormalizedInput(normalized.trim(), spoken);
    }

    String normalizeEmail(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> entry : DOMAIN_CORRECTIONS.entrySet()) {
            result = entry.getKey().matcher(result).replaceAll(entry.getValue());
        }
        result = applySymbolWords(result);
        if (isSpelledOut(result)) {
            result = joinSpelledLetters(result);
        }
        result = result.replaceAll("\\s*@\\s*", "@");
        result = result.replaceAll("\\s*\\.\\s*", ".");
        result = result.replaceAll("\\s*_\\s*", "_");
        if (result.indexOf('@') > 0) {
            result = result.replace(" ", "");
        }
        return result;
    }

    String normalizeUrl(String text) {
        String result = applySymbolWords(text.replaceAll("\\bw w w\\b", "www"));
        result = result.replaceAll("\\s*([./:])\\s*", "$1");
        return result.contains(" ") && result.contains(".") ? result.replace(" ", "") : result;
    }

    String normalizePhone(String text) {
        String result = replaceNumberWords(text);
        String digits = result.replaceAll("[^\\d+]", "");
        boolean international = digits.startsWith("+");
        digits = digits.replace("+", "");
        if (digits.isEmpty()) {
            return result;
        }
        if (digits.length() == 10 && !international) {
            return digits.substring(0, 3) + "-" + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            return "+1-" + digits.substring(1, 4) + "-" + digits.substring(4, 7) + "-" + digits.substring(7);
        }
        return international ? "+" + digits : digits;
    }

    String normalizeNumber(String text) {
        return replaceNumberWords(text).replaceAll("(?<=\\d) (?=\\d)", "");
    }

    public static int countDigits(String value) {
        if (value == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    private String applySymbolWords(String text) {
        String result = text;
        for (Map.Entry<Pattern, String> entry : SYMBOL_WORDS.entrySet()) {
            result = entry.getKey().matcher(result).replaceAll(Matcher.quoteReplacement(entry.getValue()));
        }
        return result;
    }

    private String replaceNumberWords(String text) {
        String result = text;
        for (Map.Entry<String, String> entry : NUMBER_WORDS.entrySet()) {
            result = result.replaceAll("\\b" + entry.getKey() + "\\b", entry.getValue());
        }
        Matcher repeated = REPEATED_DIGIT.matcher(result);
        StringBuilder expanded = new StringBuilder();
        while (repeated.find()) {
            int times = "double".equals(repeated.group(1)) ? 2 : 3;
            repeated.appendReplacement(expanded, repeated.group(2).repeat(times));
        }
        repeated.appendTail(expanded);
        return expanded.toString();
    }

    /** More than three words with over 40% single letters. */
    static boolean isSpelledOut(String text) {
        String[] words = text.trim().split("\\s+");
        if (words.length <= 3) {
            return false;
        }
        int singles = 0;
        for (String word : words) {
            if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
                singles++;
            }
        }
        return (double) singles / words.length > 0.4d;
    }

    static String joinSpelledLetters(String text) {
        List<String> out = new ArrayList<>();
        StringBuilder run = new StringBuilder();
        for (String word : text.trim().split("\\s+")) {
            if (word.length() == 1 && Character.isLetter(word.charAt(0))) {
                run.append(word);
                continue;
            }
            if (run.length() > 0) {
                out.add(run.toString());
                run.setLength(0);
            }
            out.add(word);
        }
        if (run.length() > 0) {
            out.add(run.toString());
        }
        return String.join(" ", out);
    }
}
