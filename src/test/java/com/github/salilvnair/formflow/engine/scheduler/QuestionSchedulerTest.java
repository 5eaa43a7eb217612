package com.github.salilvnair.formflow.engine.scheduler;

import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.session.FormSession;
import com.github.salilvnair.formflow.engine.session.InMemorySessionStore;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.formflow.support.TestConstants.*;
import static com.github.salilvnair.formflow.support.TestForms.*;
import static org.junit.jupiter.api.Assertions.*;

class QuestionSchedulerTest {

    private final FormFlowProperties properties = new FormFlowProperties();
    private final QuestionScheduler scheduler = new QuestionScheduler(properties);

    @Test
    void authoredQuestionWinsOverSmartPromptAndGeneratedText() {
        FieldDescriptor field = name();
        field.setSmartPrompt("And who am I speaking with?");
        assertEquals("And who am I speaking with?", scheduler.questionFor(field));

        field.setQuestion("  What should we call you?  ");
        assertEquals("What should we call you?", scheduler.questionFor(field));
    }

    @Test
    void generatedQuestionsFollowFieldType() {
        FieldDescriptor terms = field("acceptTerms", "checkbox", true);
        terms.setLabel("Accept terms");
        FieldDescriptor workEmail = field("work", "email", true);

        assertEquals("What's your name?", scheduler.questionFor(name()));
        assertEquals("What's your email?", scheduler.questionFor(email()));
        assertEquals("What's your email address?", scheduler.questionFor(workEmail));
        assertEquals("What's your phone? You can say skip if you'd rather not answer.", scheduler.questionFor(phone()));
        assertEquals("What's your country? The options are United States, Canada, Mexico.", scheduler.questionFor(country()));
        assertEquals("Should I check 'Accept terms'? Yes or no?", scheduler.questionFor(terms));
        assertEquals("Please say the password you'd like to use.", scheduler.questionFor(password()));
    }

    @Test
    void consecutiveSimpleFieldsAreBatched() {
        FormSession session = session(List.of(name(), email(), phone(), address(), country()));

        List<String> questions = scheduler.nextQuestions(session);

        assertEquals(3, questions.size());
        assertEquals("What's your name?", questions.get(0));
    }

    @Test
    void batchStopsAtFieldWithOptions() {
        properties.getQuestions().setMaxBatchSize(5);
        FormSession session = session(List.of(name(), email(), country(), address()));

        assertEquals(2, scheduler.nextQuestions(session).size());

        session.getRemainingFields().removeFirst();
        session.getRemainingFields().removeFirst();
        assertEquals(List.of("What's your country? The options are United States, Canada, Mexico."),
                scheduler.nextQuestions(session));
    }

    @Test
    void greetingCountsFieldsAndAsksFirstQuestion() {
        assertEquals("Hi! I'll help you fill out this form. There are 3 fields to go. "
                        + "You can say skip, repeat, or go back at any time. What's your name?",
                scheduler.greeting(session(contactForm())));
        assertTrue(scheduler.greeting(session(List.of(email()))).contains("There is 1 field to go."));
    }

    @Test
    void skipMovesActiveFieldAside() {
        FormSession session = session(contactForm());
        session.incrementClarificationAttempts(FIELD_NAME);

        assertEquals(FIELD_NAME, scheduler.skip(session));

        assertTrue(session.getSkippedFields().contains(FIELD_NAME));
        assertEquals(FIELD_EMAIL, session.activeField().getName());
        assertFalse(session.getClarificationAttempts().containsKey(FIELD_NAME));
    }

    @Test
    void skippedFieldIsReofferedOnlyOnce() {
        FormSession session = session(List.of(name(), email()));
        scheduler.skip(session);
        assertFalse(scheduler.settle(session));

        session.getRemainingFields().remove(FIELD_EMAIL);
        assertFalse(scheduler.settle(session));
        assertEquals(FIELD_NAME, session.activeField().getName());
        assertTrue(session.getSkippedFields().isEmpty());

        scheduler.skip(session);
        assertTrue(scheduler.settle(session));
        assertTrue(session.getSkippedFields().contains(FIELD_NAME));
        assertNull(session.activeField());
    }

    private static FormSession session(List<FieldDescriptor> fields) {
        return new InMemorySessionStore().create(fields, FORM_URL, null);
    }
}
