package com.github.salilvnair.formflow.engine.core;

import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import com.github.salilvnair.formflow.engine.model.SessionSnapshot;
import com.github.salilvnair.formflow.engine.model.SessionStart;

import java.util.List;

/**
 * Entry point of the form-filling dialogue: one session per form, one message at a time.
 */
public interface DialogueController {

    SessionStart startSession(List<FieldDescriptor> formSchema, String formUrl, String userId);

    /**
     * Runs one turn. Fails with {@code SESSION_BUSY} while another message for the same session
     * is in flight and with {@code SESSION_NOT_FOUND} for unknown or deleted sessions.
     */
    DialogueResult handleMessage(String sessionId, DialogueInput input);

    SessionSnapshot endSession(String sessionId);
}
