package com.github.salilvnair.formflow.engine.scheduler;

import com.github.salilvnair.formflow.config.FormFlowProperties;
import com.github.salilvnair.formflow.engine.constants.FieldTypeConstants;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.session.FormSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * Owns the remaining and skipped queues of a session and words the next questions. Callers hold
 * the session lease.
 */
@Component
@RequiredArgsConstructor
public class QuestionScheduler {

    private final FormFlowProperties properties;

    public String questionFor(FieldDescriptor field) {
        if (field.getQuestion() != null && !field.getQuestion().isBlank()) {
            return field.getQuestion().trim();
        }
        if (field.getSmartPrompt() != null && !field.getSmartPrompt().isBlank()) {
            return field.getSmartPrompt().trim();
        }
        return generatedQuestion(field);
    }

    String generatedQuestion(FieldDescriptor field) {
        String label = field.displayLabel().toLowerCase(Locale.ROOT);
        String question = switch (field.normalizedType()) {
            case FieldTypeConstants.EMAIL -> label.contains("email") ? "What's your " + label + "?" : "What's your email address?";
            case FieldTypeConstants.TEL -> label.contains("phone") || label.contains("mobile") ? "What's your " + label + "?" : "What's your phone number?";
            case FieldTypeConstants.SELECT, FieldTypeConstants.RADIO -> field.hasOptions()
                    ? "What's your " + label + "? The options are " + String.join(", ", field.getOptions()) + "."
                    : "What's your " + label + "?";
            case FieldTypeConstants.CHECKBOX -> "Should I check '" + field.displayLabel() + "'? Yes or no?";
            case FieldTypeConstants.PASSWORD -> "Please say the " + label + " you'd like to use.";
            default -> "What's your " + label + "?";
        };
        return field.isRequired() ? question : question + " You can say skip if you'd rather not answer.";
    }

    /**
     * Questions for the head of the queue. Consecutive simple fields are surfaced together, up to
     * {@code formflow.questions.max-batch-size}.
     */
    public List<String> nextQuestions(FormSession session) {
        List<FieldDescriptor> remaining = session.remainingDescriptors();
        if (remaining.isEmpty()) {
            return List.of();
        }
        List<String> questions = new ArrayList<>();
        FieldDescriptor head = remaining.get(0);
        questions.add(questionFor(head));
        if (!isBatchable(head)) {
            return questions;
        }
        int maxBatch = Math.max(1, properties.getQuestions().getMaxBatchSize());
        for (int i = 1; i < remaining.size() && questions.size() < maxBatch; i++) {
            FieldDescriptor next = remaining.get(i);
            if (!isBatchable(next)) {
                break;
            }
            questions.add(questionFor(next));
        }
        return questions;
    }

    public String greeting(FormSession session) {
        int count = session.getFieldList().size();
        String opening = "Hi! I'll help you fill out this form. There "
                + (count == 1 ? "is 1 field" : "are " + count + " fields")
                + " to go. You can say skip, repeat, or go back at any time.";
        FieldDescriptor first = session.activeField();
        return first == null ? opening : opening + " " + questionFor(first);
    }

    /** Moves the active field to the skipped set. */
    public String skip(FormSession session) {
        String field = session.getRemainingFields().pollFirst();
        if (field != null) {
            session.getSkippedFields().add(field);
            session.resetClarificationAttempts(field);
        }
        return field;
    }

    /**
     * Re-offers skipped fields once the queue runs dry. A field is re-offered at most once.
     *
     * @return {@code true} when nothing is left to ask
     */
    public boolean settle(FormSession session) {
        if (!session.getRemainingFields().isEmpty()) {
            return false;
        }
        Iterator<String> skipped = session.getSkippedFields().iterator();
        while (skipped.hasNext()) {
            String field = skipped.next();
            if (session.getReofferedFields().add(field)) {
                skipped.remove();
                session.getRemainingFields().addLast(field);
            }
        }
        return session.getRemainingFields().isEmpty();
    }

    private static boolean isBatchable(FieldDescriptor field) {
        return FieldTypeConstants.BATCHABLE.contains(field.normalizedType()) && !field.hasOptions();
    }
}
