package com.github.salilvnair.formflow.engine.session;

import com.github.salilvnair.formflow.engine.model.DialogueState;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.PendingValue;
import com.github.salilvnair.formflow.engine.model.QaHistoryEntry;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one form-filling dialogue. Every mutation happens while the caller holds the
 * session's lock through a {@link SessionLease}.
 */
@Getter
public class FormSession {

    private final String id;
    private final String formUrl;
    private final String userId;
    private final List<FieldDescriptor> fieldList;
    private final Map<String, FieldDescriptor> fieldsByName;
    private final Instant createdAt;

    private final LinkedList<String> remainingFields;
    private final LinkedHashSet<String> skippedFields = new LinkedHashSet<>();
    private final Set<String> reofferedFields = new LinkedHashSet<>();
    private final Map<String, String> extractedValues = new LinkedHashMap<>();
    private final Map<String, Double> confidenceScores = new LinkedHashMap<>();
    private final Deque<String> commitHistory = new ArrayDeque<>();
    private final List<QaHistoryEntry> qaHistory = new ArrayList<>();
    private final Map<String, Integer> clarificationAttempts = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    private volatile Instant lastActivityAt;
    @Setter
    private volatile DialogueState state = DialogueState.AWAITING_INPUT;
    @Setter
    private PendingValue pending;
    @Setter
    private String lastPrompt;
    private int turnCount;

    FormSession(String id, String formUrl, String userId, List<FieldDescriptor> fieldList, Instant now) {
        this.id = id;
        this.formUrl = formUrl;
        this.userId = userId;
        this.fieldList = List.copyOf(fieldList);
        Map<String, FieldDescriptor> byName = new LinkedHashMap<>();
        for (FieldDescriptor field : this.fieldList) {
            byName.put(field.getName(), field);
        }
        this.fieldsByName = Collections.unmodifiableMap(byName);
        this.remainingFields = new LinkedList<>(byName.keySet());
        this.createdAt = now;
        this.lastActivityAt = now;
    }

    public FieldDescriptor field(String name) {
        return name == null ? null : fieldsByName.get(name);
    }

    /** Field the dialogue is currently asking about, or {@code null} when nothing is left. */
    public FieldDescriptor activeField() {
        String head = remainingFields.peekFirst();
        return head == null ? null : fieldsByName.get(head);
    }

    public List<FieldDescriptor> remainingDescriptors() {
        List<FieldDescriptor> out = new ArrayList<>(remainingFields.size());
        for (String name : remainingFields) {
            out.add(fieldsByName.get(name));
        }
        return out;
    }

    /** Fields without a committed value; skipped fields still count. */
    public int remainingFieldsCount() {
        return fieldList.size() - extractedValues.size();
    }

    public boolean isCommitted(String field) {
        return extractedValues.containsKey(field);
    }

    public boolean isTerminated() {
        return state == DialogueState.TERMINATED;
    }

    public int incrementClarificationAttempts(String field) {
        return clarificationAttempts.merge(field, 1, Integer::sum);
    }

    public void resetClarificationAttempts(String field) {
        clarificationAttempts.remove(field);
    }

    public void recordAnswer(String question, String answer) {
        qaHistory.add(new QaHistoryEntry(question, answer));
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public void nextTurn() {
        turnCount++;
    }

    boolean tryLock() {
        return lock.tryLock();
    }

    void unlock() {
        lock.unlock();
    }
}
