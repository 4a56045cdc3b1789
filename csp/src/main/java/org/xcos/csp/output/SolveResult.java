package org.xcos.csp.output;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolveResult {
    private SolveStatus status;
    private Map<String, Object> solution;
    @JsonProperty("objective_value")
    private Double objectiveValue;
    @JsonProperty("solve_time_ms")
    private double solveTimeMs;
    private String message;

    public static SolveResult error(String message) {
        return SolveResult.builder()
            .status(SolveStatus.ERROR)
            .solveTimeMs(0.0)
            .message(message)
            .build();
    }
}
