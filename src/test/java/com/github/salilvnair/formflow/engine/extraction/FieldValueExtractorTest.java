package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.formflow.support.TestConstants.*;
import static com.github.salilvnair.formflow.support.TestForms.*;
import static org.junit.jupiter.api.Assertions.*;

class FieldValueExtractorTest {

    private final FieldValueExtractor extractor = new FieldValueExtractor(new SpokenInputNormalizer());

    @Test
    void spokenEmailIsSlightlyLessCertainThanTypedEmail() {
        ExtractionResult.Single spoken = extractor.extract(SAID_SPOKEN_EMAIL, email());
        ExtractionResult.Single typed = extractor.extract("my email is jane@x.com", email());

        assertEquals(EMAIL_JOHN, spoken.value());
        assertEquals(0.88d, spoken.confidence(), 1e-9);
        assertEquals(EMAIL_JANE, typed.value());
        assertEquals(0.95d, typed.confidence(), 1e-9);
        assertEquals(FIELD_EMAIL, typed.field());
    }

    @Test
    void incompleteEmailOffersCompletions() {
        ExtractionResult.Single result = extractor.extract("john at gmail", email());

        assertEquals("john@gmail", result.value());
        assertEquals(0.5d, result.confidence(), 1e-9);
        assertTrue(result.suggestions().contains(EMAIL_JOHN));
        assertFalse(result.issues().isEmpty());
    }

    @Test
    void phoneConfidenceFollowsDigitCount() {
        ExtractionResult.Single full = extractor.extract(SAID_FULL_PHONE, phone());
        ExtractionResult.Single seven = extractor.extract("five five five one two three four", phone());
        ExtractionResult.Single three = extractor.extract(SAID_SHORT_PHONE, phone());

        assertEquals(PHONE_FORMATTED, full.value());
        assertEquals(0.92d, full.confidence(), 1e-9);
        assertEquals("5551234", seven.value());
        assertEquals(0.7d, seven.confidence(), 1e-9);
        assertEquals(0.4d, three.confidence(), 1e-9);
        assertTrue(three.confidence() < 0.60d);
    }

    @Test
    void spokenDateBecomesIsoDate() {
        ExtractionResult.Single result = extractor.extract("March 5th, 1990", field("dob", "date", true));

        assertEquals("1990-03-05", result.value());
        assertEquals(0.9d, result.confidence(), 1e-9);
    }

    @Test
    void ambiguousNumericDateOffersBothReadings() {
        ExtractionResult.Single ambiguous = extractor.extract("03/05/1990", field("dob", "date", true));
        ExtractionResult.Single clear = extractor.extract("12/25/1990", field("dob", "date", true));

        assertEquals("1990-03-05", ambiguous.value());
        assertEquals(0.75d, ambiguous.confidence(), 1e-9);
        assertEquals(List.of("1990-03-05", "1990-05-03"), ambiguous.suggestions());
        assertEquals("1990-12-25", clear.value());
        assertEquals(0.9d, clear.confidence(), 1e-9);
    }

    @Test
    void selectMatchesOptionsExactlyOrFuzzily() {
        FieldDescriptor country = country();

        ExtractionResult.Single exact = extractor.extract("I live in Mexico", country);
        ExtractionResult.Single fuzzy = extractor.extract("Kanada", country);
        ExtractionResult.Single unknown = extractor.extract("Brazil", country);

        assertEquals("Mexico", exact.value());
        assertEquals(0.95d, exact.confidence(), 1e-9);
        assertEquals("Canada", fuzzy.value());
        assertEquals(0.7d, fuzzy.confidence(), 1e-9);
        assertEquals(0.35d, unknown.confidence(), 1e-9);
        assertEquals(3, unknown.suggestions().size());
    }

    @Test
    void checkboxUnderstandsYesAndNo() {
        FieldDescriptor terms = field("terms", "checkbox", true);

        assertEquals("true", extractor.extract("yes", terms).value());
        assertEquals("false", extractor.extract("nope", terms).value());
        assertEquals(0.4d, extractor.extract("maybe later", terms).confidence(), 1e-9);
    }

    @Test
    void hesitationLowersConfidence() {
        ExtractionResult.Single result = extractor.extract("um my name is John Smith", name());

        assertEquals(SAID_JOHN_SMITH, result.value());
        assertEquals(0.8d, result.confidence(), 1e-9);
    }

    @Test
    void homophonesLowerFreeTextConfidence() {
        ExtractionResult.Single result = extractor.extract("I would like to write more", field("comment", "textarea", false));

        assertEquals(0.85d, result.confidence(), 1e-9);
    }

    @Test
    void validationPatternMismatchIsAnIssueNotAnError() {
        FieldDescriptor zip = FieldDescriptor.builder().name("zip").type("text").validationPattern("^\\d{5}$").build();

        ExtractionResult.Single result = extractor.extract("abc", zip);

        assertEquals("abc", result.value());
        assertTrue(result.issues().contains("Value does not match the expected format for zip"));
    }

    @Test
    void fillerOnlyUtteranceHasNoValue() {
        ExtractionResult.Single result = extractor.extract("um", name());

        assertEquals("", result.value());
        assertEquals(0.0d, result.confidence(), 1e-9);
    }

    @Test
    void nameFieldDetectionIgnoresUsernames() {
        assertTrue(FieldValueExtractor.isNameField(name()));
        assertFalse(FieldValueExtractor.isNameField(field("username", "text", true)));
        assertEquals("John Smith", FieldValueExtractor.titleCase("john smith"));
    }
}
