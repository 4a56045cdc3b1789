package org.xcos.csp.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CSPModel {
    private String id;
    private String name;
    @Builder.Default
    private List<Variable> variables = new ArrayList<>();
    @Builder.Default
    private List<Constraint> constraints = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Objective objective;
}
