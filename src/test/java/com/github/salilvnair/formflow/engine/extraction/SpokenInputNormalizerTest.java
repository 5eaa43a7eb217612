package com.github.salilvnair.formflow.engine.extraction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpokenInputNormalizerTest {

    private final SpokenInputNormalizer normalizer = new SpokenInputNormalizer();

    @ParameterizedTest
    @CsvSource({
            "john at gmail dot com, john@gmail.com",
            "john underscore doe at g mail dot com, john_doe@gmail.com",
            "jane at the rate yahoo dot com, jane@yahoo.com",
            "j o h n at outlook dot com, john@outlook.com"
    })
    void rewritesSpokenEmail(String spoken, String expected) {
        SpokenInputNormalizer.NormalizedInput result = normalizer.normalize(spoken, "email");

        assertEquals(expected, result.text());
        assertTrue(result.spokenFormDetected());
    }

    @ParameterizedTest
    @CsvSource({
            "five five five one two three four five six seven, 555-123-4567",
            "double five five one two three four five six seven, 555-123-4567",
            "1 555 123 4567, +1-555-123-4567"
    })
    void rewritesSpokenPhone(String spoken, String expected) {
        assertEquals(expected, normalizer.normalize(spoken, "phone").text());
    }

    @Test
    void symbolWordsOnlyApplyToEmailAndUrlFields() {
        assertEquals("look at me", normalizer.normalize("look at me", "text").text());
        assertFalse(normalizer.normalize("look at me", "text").spokenFormDetected());
    }

    @Test
    void rewritesSpokenUrl() {
        assertEquals("www.example.com/signup", normalizer.normalize("w w w dot example dot com slash signup", "url").text());
    }

    @Test
    void joinsSpelledOutLettersInTextFields() {
        assertEquals("smith", normalizer.normalize("s m i t h", "text").text());
        assertTrue(SpokenInputNormalizer.isSpelledOut("s m i t h"));
        assertFalse(SpokenInputNormalizer.isSpelledOut("a big house"));
    }

    @Test
    void countsDigits() {
        assertEquals(10, SpokenInputNormalizer.countDigits("(555) 123-4567"));
        assertEquals(0, SpokenInputNormalizer.countDigits(null));
    }
}
