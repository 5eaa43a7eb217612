package com.github.salilvnair.formflow.api.controller;

import com.github.salilvnair.formflow.engine.autofill.AutofillRanker;
import com.github.salilvnair.formflow.engine.model.AutofillEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.OffsetDateTime;
import java.util.List;

import static com.github.salilvnair.formflow.support.TestConstants.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AutofillControllerTest {

    private final AutofillRanker ranker = mock(AutofillRanker.class);
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AutofillController(ranker))
                .setControllerAdvice(new FormFlowExceptionHandler())
                .build();
    }

    @Test
    void returnsRankedSuggestions() throws Exception {
        when(ranker.suggest(USER_ID, FIELD_EMAIL, TYPE_EMAIL)).thenReturn(List.of(
                new AutofillEntry(EMAIL_JOHN, "john@gmail.com (used 3 times)", 0.97d, 3, OffsetDateTime.now())));

        mockMvc.perform(get("/autofill-suggestions")
                        .param("user_id", USER_ID)
                        .param("field_name", FIELD_EMAIL)
                        .param("field_type", TYPE_EMAIL))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.suggestions[0].value").value(EMAIL_JOHN))
                .andExpect(jsonPath("$.suggestions[0].label").value("john@gmail.com (used 3 times)"))
                .andExpect(jsonPath("$.suggestions[0].confidence").value(0.97d))
                .andExpect(jsonPath("$.suggestions[0].usage_count").value(3));
    }

    @Test
    void fieldTypeIsOptional() throws Exception {
        when(ranker.suggest(USER_ID, FIELD_NAME, null)).thenReturn(List.of());

        mockMvc.perform(get("/autofill-suggestions").param("user_id", USER_ID).param("field_name", FIELD_NAME))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.suggestions").isEmpty());
    }

    @Test
    void missingParameterIsMalformed() throws Exception {
        mockMvc.perform(get("/autofill-suggestions").param("user_id", USER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("MALFORMED_REQUEST"));
    }
}
