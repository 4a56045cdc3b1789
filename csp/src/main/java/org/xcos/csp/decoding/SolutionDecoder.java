package org.xcos.csp.decoding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.xcos.csp.assembly.AssembledModel;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.DecodeException;

/**
 * Maps raw solver assignments back to the values the client declared.
 */
@Component
public class SolutionDecoder {

    /**
     * @param model       the model that was solved
     * @param assignments solver value per encoded variable; variables without a value are left out of the result
     * @return variable name to original domain value, in declaration order
     */
    public Map<String, Object> decode(AssembledModel model, Map<EncodedVariable, Integer> assignments) {
        Map<String, Object> solution = new LinkedHashMap<>();
        for (EncodedVariable variable : model.getVariables().values()) {
            Integer assigned = assignments.get(variable);
            if (assigned == null) {
                continue;
            }
            solution.put(variable.getName(), decodeValue(variable, assigned));
        }
        return solution;
    }

    public Object decodeValue(EncodedVariable variable, int assigned) {
        if (!variable.isIndexed()) {
            return variable.isLongValued() ? Long.valueOf(assigned) : Integer.valueOf(assigned);
        }
        List<Object> table = variable.getIndexTable();
        if (assigned < 0 || assigned >= table.size()) {
            throw new DecodeException("Solver assigned index " + assigned + " to '" + variable.getName()
                + "' but its domain has " + table.size() + " values");
        }
        return table.get(assigned);
    }
}
