package org.xcos.csp.output;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExplanationResult {
    @JsonProperty("explanation_type")
    private String explanationType;
    @JsonProperty("constraint_ids")
    private List<String> constraintIds;
    private String description;
}
