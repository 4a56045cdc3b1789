package org.xcos.csp.expression.ir;

import java.util.List;

import lombok.Value;

/**
 * Conjunction or disjunction over two or more boolean operands, or negation of exactly one.
 */
@Value
public class Logical implements IrNode {
    LogicalOperator operator;
    List<IrNode> operands;

    public Logical(LogicalOperator operator, List<IrNode> operands) {
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLogical(this);
    }
}
