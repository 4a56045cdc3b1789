package org.xcos.csp.expression.ir;

import lombok.Value;

@Value
public class Literal implements IrNode {
    int value;

    @Override
    public ValueType getType() {
        return ValueType.INTEGER;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
