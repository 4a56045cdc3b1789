package org.xcos.csp.expression.ir;

import lombok.Value;

@Value
public class Arithmetic implements IrNode {
    ArithmeticOperator operator;
    IrNode left;
    IrNode right;

    @Override
    public ValueType getType() {
        return ValueType.INTEGER;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitArithmetic(this);
    }
}
