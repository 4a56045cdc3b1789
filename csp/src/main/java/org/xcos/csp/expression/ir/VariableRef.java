package org.xcos.csp.expression.ir;

import org.xcos.csp.encoding.EncodedVariable;

import lombok.Value;

/**
 * Leaf bound to an encoded variable. For indexed domains the value it denotes is the index.
 */
@Value
public class VariableRef implements IrNode {
    EncodedVariable variable;

    @Override
    public ValueType getType() {
        return ValueType.INTEGER;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
