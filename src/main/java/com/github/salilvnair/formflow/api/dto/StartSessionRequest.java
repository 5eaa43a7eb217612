package com.github.salilvnair.formflow.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.salilvnair.formflow.engine.model.FieldDescriptor;
import lombok.Data;

import java.util.List;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StartSessionRequest {
    private List<FieldDescriptor> formSchema;
    private String formUrl;
    private String userId;
}
