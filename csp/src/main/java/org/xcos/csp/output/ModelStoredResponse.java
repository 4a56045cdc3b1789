package org.xcos.csp.output;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ModelStoredResponse {
    private String status;
    @JsonProperty("model_id")
    private String modelId;
    private String message;
}
