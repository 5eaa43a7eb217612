package com.github.salilvnair.formflow.api.controller;

import com.github.salilvnair.formflow.api.dto.AutofillSuggestionsResponse;
import com.github.salilvnair.formflow.engine.autofill.AutofillRanker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AutofillController {

    private final AutofillRanker autofillRanker;

    @GetMapping("/autofill-suggestions")
    public AutofillSuggestionsResponse suggestions(@RequestParam("user_id") String userId,
                                                   @RequestParam("field_name") String fieldName,
                                                   @RequestParam(value = "field_type", required = false) String fieldType) {
        AutofillSuggestionsResponse res = new AutofillSuggestionsResponse();
        res.setSuccess(true);
        res.setSuggestions(autofillRanker.suggest(userId, fieldName, fieldType).stream()
                .map(AutofillSuggestionsResponse.Suggestion::from)
                .toList());
        return res;
    }
}
