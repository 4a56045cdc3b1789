package org.xcos.csp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SolveRequest {
    @JsonProperty("model_id")
    private String modelId;
    // Seconds; null falls back to the configured default
    private Integer timeout;
    @JsonProperty("find_all")
    private boolean findAll;
}
