package com.github.salilvnair.formflow.api.controller;

import com.github.salilvnair.formflow.api.dto.EndSessionResponse;
import com.github.salilvnair.formflow.api.dto.MessageRequest;
import com.github.salilvnair.formflow.api.dto.MessageResponse;
import com.github.salilvnair.formflow.api.dto.StartSessionRequest;
import com.github.salilvnair.formflow.api.dto.StartSessionResponse;
import com.github.salilvnair.formflow.engine.core.DialogueController;
import com.github.salilvnair.formflow.engine.exception.FormFlowException;
import com.github.salilvnair.formflow.engine.model.DialogueInput;
import com.github.salilvnair.formflow.engine.model.DialogueResult;
import com.github.salilvnair.formflow.engine.model.SessionSnapshot;
import com.github.salilvnair.formflow.engine.model.TurnAction;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/conversation")
@RequiredArgsConstructor
public class ConversationController {

    private final DialogueController dialogueController;

    @PostMapping("/session")
    public StartSessionResponse startSession(@RequestBody StartSessionRequest request) {
        return StartSessionResponse.from(
                dialogueController.startSession(request.getFormSchema(), request.getFormUrl(), request.getUserId())
        );
    }

    @PostMapping("/message")
    public MessageResponse message(@RequestBody MessageRequest request) {
        if (request.getSessionId() == null || request.getSessionId().isBlank()) {
            throw FormFlowException.malformed("session_id is required");
        }
        TurnAction action = null;
        if (request.getAction() != null && !request.getAction().isBlank()) {
            action = TurnAction.from(request.getAction());
            if (action == null) {
                throw FormFlowException.malformed("Unknown action: " + request.getAction());
            }
        }
        Double asr = request.getAsrConfidence();
        if (asr != null && (asr.isNaN() || asr < 0.0 || asr > 1.0)) {
            throw FormFlowException.malformed("asr_confidence must be between 0 and 1");
        }
        DialogueInput input = new DialogueInput(request.getMessage(), action, request.getValue(), asr);
        DialogueResult result = dialogueController.handleMessage(request.getSessionId().trim(), input);
        return MessageResponse.from(result);
    }

    @DeleteMapping("/session/{sessionId}")
    public EndSessionResponse endSession(@PathVariable("sessionId") String sessionId) {
        SessionSnapshot snapshot = dialogueController.endSession(sessionId);
        EndSessionResponse res = new EndSessionResponse();
        res.setFinalData(snapshot.finalData());
        res.setFieldsCollected(snapshot.fieldsCollected());
        return res;
    }
}
