package org.xcos.csp.expression;

import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.ExpressionException;
import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.expression.ir.ValueType;

import lombok.extern.slf4j.Slf4j;

/**
 * Compiles constraint expression strings into constraint IR.
 * <p>
 * Supported language:
 * <ul>
 *   <li>Comparisons: {@code == != < > <= >=}</li>
 *   <li>Arithmetic: {@code + - * /} (integer division) and unary minus</li>
 *   <li>Logical: {@code &} or {@code and}, {@code |} or {@code or}, {@code ~}, {@code !} or {@code not}</li>
 *   <li>Globals: {@code AllDifferent}, {@code AllEqual}, {@code Sum}, {@code Min}, {@code Max}
 *       over a list {@code [a, b]} or an argument sequence, and {@code Abs(x)}</li>
 *   <li>Integer literals, and real literals with an integral value</li>
 *   <li>Identifiers naming declared variables; an indexed variable denotes its domain index</li>
 * </ul>
 * Precedence: {@code or} &lt; {@code and} &lt; {@code not} &lt; comparison &lt; additive &lt;
 * multiplicative &lt; unary. Nothing is ever evaluated; the result is a data structure.
 */
@Slf4j
@Component
public class ExpressionCompiler {

    /**
     * Compiles a constraint; the expression must denote a boolean condition.
     *
     * @param constraintId id reported in failures, may be null outside a model
     * @param expression   the expression text
     * @param variables    declared variables by name
     * @return the IR tree, with leaves bound to the given encoded variables
     */
    public IrNode compile(String constraintId, String expression, Map<String, EncodedVariable> variables) {
        IrNode node = parse(constraintId, expression, variables);
        if (node.getType() != ValueType.BOOLEAN) {
            throw new ExpressionException(constraintId, expression,
                "expression does not denote a constraint, it evaluates to "
                    + (node.getType() == ValueType.LIST ? "a list" : "an integer"));
        }
        return node;
    }

    /**
     * Compiles an objective; the expression must denote an integer (booleans count as 0/1).
     */
    public IrNode compileObjective(String expression, Map<String, EncodedVariable> variables) {
        IrNode node = parse("objective", expression, variables);
        if (!node.getType().isScalar()) {
            throw new ExpressionException("objective", expression, "objective must be an integer expression, not a list");
        }
        return node;
    }

    private IrNode parse(String constraintId, String expression, Map<String, EncodedVariable> variables) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException(constraintId, String.valueOf(expression), "expression is empty");
        }
        List<Token> tokens = new ExpressionTokenizer(constraintId, expression).tokenize();
        IrNode node = new ExpressionParser(constraintId, expression, tokens, variables).parse();
        log.debug("Compiled {} '{}' into {}", constraintId, expression, node);
        return node;
    }
}
