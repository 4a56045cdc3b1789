package org.xcos.csp.encoding;

import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.xcos.csp.exceptions.DomainException;
import org.xcos.csp.model.Variable;

/**
 * Maps declared variable domains onto solver-native integer variables.
 * <p>
 * A domain whose elements are all integral numbers is used as is. Any other domain
 * (names, reals, booleans, mixed) becomes an index range with a lookup table kept in
 * declared order, so index {@code i} always denotes element {@code i}.
 * <p>
 * Booleans are not numbers here. A domain {@code [true, false]} is indexed like any other
 * named domain, so {@code b == 0} selects {@code true} and {@code b == 1} selects
 * {@code false}. Declare {@code [false, true]} to have the index read as 0/1 truth values.
 */
@Component
public class DomainEncoder {

    /**
     * Encodes every variable of a model, keyed by name in declaration order.
     */
    public Map<String, EncodedVariable> encodeAll(List<Variable> variables) {
        Map<String, EncodedVariable> encoded = new LinkedHashMap<>();
        for (Variable variable : variables) {
            EncodedVariable ev = encode(variable);
            if (encoded.putIfAbsent(ev.getName(), ev) != null) {
                throw new DomainException(ev.getName(), "duplicate variable name");
            }
        }
        return encoded;
    }

    public EncodedVariable encode(Variable variable) {
        String name = variable.getName();
        if (name == null || name.isBlank()) {
            throw new DomainException(String.valueOf(name), "variable name is missing");
        }
        List<Object> domain = variable.getDomain();
        if (domain == null || domain.isEmpty()) {
            throw new DomainException(name, "empty domain");
        }
        for (Object value : domain) {
            if (value == null || value instanceof Collection || value instanceof Map) {
                throw new DomainException(name, "malformed domain, values must be scalars but got " + value);
            }
        }

        if (domain.stream().allMatch(DomainEncoder::isIntegral)) {
            int[] values = new int[domain.size()];
            boolean longValued = false;
            for (int i = 0; i < values.length; i++) {
                Number n = (Number) domain.get(i);
                values[i] = toSolverInt(name, n);
                longValued |= !(n instanceof Integer || n instanceof Short || n instanceof Byte);
            }
            return EncodedVariable.integer(name, values, longValued);
        }
        return EncodedVariable.indexed(name, domain);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    private static int toSolverInt(String name, Number n) {
        BigInteger big = n instanceof BigInteger b ? b : BigInteger.valueOf(n.longValue());
        if (big.bitLength() >= Integer.SIZE) {
            throw new DomainException(name, "value " + n + " exceeds the solver's 32-bit integer range");
        }
        return big.intValue();
    }
}
