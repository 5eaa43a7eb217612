package com.github.salilvnair.formflow.engine.extraction;

import com.github.salilvnair.formflow.engine.model.CommandAction;
import com.github.salilvnair.formflow.engine.model.ExtractionResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Local control-intent vocabulary. Only whole utterances count, so "skip to the end of the street"
 * stays an answer.
 */
@Component
public class CommandDetector {

    private static final String POLITE_PREFIX = "(?:(?:please|ok|okay|can you|could you|just|let's|lets)\\s+)*";
    private static final String POLITE_SUFFIX = "(?:\\s+(?:please|for now|thanks|thank you))*";

    private static final Map<CommandAction, Pattern> VOCABULARY = new LinkedHashMap<>();

    static {
        VOCABULARY.put(CommandAction.SKIP, wholeUtterance(
                "skip(?: (?:this|that|it))?(?: (?:one|field|question))?|next(?: (?:one|question|field))?|pass"
                        + "|move on|not applicable|n ?a|i don't have (?:one|it)|leave (?:it|this) blank|prefer not to say"));
        VOCABULARY.put(CommandAction.REPEAT, wholeUtterance(
                "repeat(?: (?:that|it|the question))?|say (?:that|it) again|come again|pardon(?: me)?"
                        + "|what was the question|what did you say|sorry what"));
        VOCABULARY.put(CommandAction.BACK, wholeUtterance(
                "(?:go )?back|previous(?: (?:one|question|field))?|undo(?: that)?|go to the previous (?:one|question|field)"
                        + "|wait go back|change (?:the )?(?:last|previous) (?:one|answer)"));
        VOCABULARY.put(CommandAction.STOP, wholeUtterance(
                "stop(?: (?:listening|talking|here))?|pause|quit|exit|cancel|that's all|i'm done for now"));
    }

    private static Pattern wholeUtterance(String alternatives) {
        return Pattern.compile("^" + POLITE_PREFIX + "(?:" + alternatives + ")" + POLITE_SUFFIX + "$");
    }

    public Optional<ExtractionResult.Command> detect(String transcript) {
        if (transcript == null) {
            return Optional.empty();
        }
        String normalized = normalize(transcript);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (Map.Entry<CommandAction, Pattern> entry : VOCABULARY.entrySet()) {
            if (entry.getValue().matcher(normalized).matches()) {
                return Optional.of(new ExtractionResult.Command(entry.getKey(), Map.of("utterance", transcript.trim())));
            }
        }
        return Optional.empty();
    }

    static String normalize(String transcript) {
        return transcript.toLowerCase(Locale.ROOT)
                .replace('\u2019', '\'')
                .replaceAll("[^a-z' ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
