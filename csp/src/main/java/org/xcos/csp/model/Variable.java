package org.xcos.csp.model;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A decision variable. The domain keeps the values exactly as the client sent them
 * (integers, strings, reals...), in their declared order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Variable {
    private String name;
    private List<Object> domain;
    private Object value;

    public static Variable of(String name, Object... domain) {
        return Variable.builder().name(name).domain(List.of(domain)).build();
    }
}
