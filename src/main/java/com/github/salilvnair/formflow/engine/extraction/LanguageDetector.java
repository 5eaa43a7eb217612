package com.github.salilvnair.formflow.engine.extraction;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tags a transcript with a language code from script and indicator words. Tagging only; nothing is
 * translated.
 */
@Component
public class LanguageDetector {

    public static final String ENGLISH_US = "en-US";
    public static final String ENGLISH_UK = "en-GB";
    public static final String ENGLISH_IN = "en-IN";
    public static final String HINDI = "hi";
    public static final String SPANISH = "es";
    public static final String FRENCH = "fr";

    private static final Pattern DEVANAGARI = Pattern.compile("[\\u0900-\\u097F]");

    private record LanguageProfile(String tag, Pattern indicators, List<String> greetings, int minHits) {
    }

    private static final List<LanguageProfile> PROFILES = List.of(
            new LanguageProfile(HINDI,
                    Pattern.compile("\\b(mera|meri|hai|hain|kya|aur|aap|naam|ghar|nahin|haan)\\b"),
                    List.of("namaste", "namaskar"), 2),
            new LanguageProfile(SPANISH,
                    Pattern.compile("\\b(mi|tu|es|el|los|las|que|con|para|por|nombre|correo|tel[eé]fono|direcci[oó]n|soy)\\b"),
                    List.of("hola", "buenos"), 2),
            new LanguageProfile(FRENCH,
                    Pattern.compile("\\b(je|il|elle|nous|vous|est|sont|et|les|du|nom|t[eé]l[eé]phone|adresse|suis)\\b"),
                    List.of("bonjour", "salut"), 2),
            new LanguageProfile(ENGLISH_IN,
                    Pattern.compile("\\b(kindly|prepone|revert back|do the needful|lakh|crore|pincode)\\b"),
                    List.of(), 1),
            new LanguageProfile(ENGLISH_UK,
                    Pattern.compile("\\b(postcode|flat|lift|colour|favour|nought|nil)\\b"),
                    List.of(), 1)
    );

    public String detect(String text) {
        if (text == null || text.isBlank()) {
            return ENGLISH_US;
        }
        if (DEVANAGARI.matcher(text).find()) {
            return HINDI;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (LanguageProfile profile : PROFILES) {
            for (String greeting : profile.greetings()) {
                if (lower.contains(greeting)) {
                    return profile.tag();
                }
            }
        }
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (LanguageProfile profile : PROFILES) {
            int hits = distinctHits(profile.indicators(), lower);
            if (hits >= profile.minHits()) {
                scores.put(profile.tag(), hits);
            }
        }
        return scores.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(ENGLISH_US);
    }

    private static int distinctHits(Pattern indicators, String text) {
        Matcher matcher = indicators.matcher(text);
        Set<String> seen = new HashSet<>();
        while (matcher.find()) {
            seen.add(matcher.group(1));
        }
        return seen.size();
    }
}
