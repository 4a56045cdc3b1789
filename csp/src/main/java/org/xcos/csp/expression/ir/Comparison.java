package org.xcos.csp.expression.ir;

import lombok.Value;

@Value
public class Comparison implements IrNode {
    ComparisonOperator operator;
    IrNode left;
    IrNode right;

    @Override
    public ValueType getType() {
        return ValueType.BOOLEAN;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
