package org.xcos.csp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExplanationRequest {
    @JsonProperty("model_id")
    private String modelId;
    @JsonProperty("explanation_type")
    private String explanationType = "mus";
}
