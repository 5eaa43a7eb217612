package com.github.salilvnair.formflow.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.salilvnair.formflow.engine.model.QaHistoryEntry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonUtilTest {

    @Test
    void parseOrNullReturnsNullNodeForInvalidJson() {
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull("{bad json"));
        assertEquals(NullNode.getInstance(), JsonUtil.parseOrNull(" "));
    }

    @Test
    void parseOrNullStripsMarkdownFence() {
        JsonNode node = JsonUtil.parseOrNull("```json\n{\"value\":\"Jane\"}\n```");

        assertEquals("Jane", node.path("value").asText());
    }

    @Test
    void textTreatsBlankAsMissing() {
        JsonNode node = JsonUtil.parseOrNull("{\"value\":\"  \",\"field\":\"email\"}");

        assertNull(JsonUtil.text(node, "value"));
        assertNull(JsonUtil.text(node, "confidence"));
        assertEquals("email", JsonUtil.text(node, "field"));
    }

    @Test
    void toJsonWritesRecordsByComponentName() {
        assertEquals("{\"question\":\"What's your name?\",\"answer\":\"Jane\"}",
                JsonUtil.toJson(new QaHistoryEntry("What's your name?", "Jane")));
    }

    @Test
    void fromJsonWrapsFailures() {
        assertThrows(IllegalStateException.class, () -> JsonUtil.fromJson("[1,2", Map.class));
    }
}
