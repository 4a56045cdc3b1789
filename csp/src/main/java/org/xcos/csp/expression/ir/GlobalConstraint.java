package org.xcos.csp.expression.ir;

import java.util.List;

import lombok.Value;

/**
 * Call of a whitelisted global function. Arguments are scalar nodes; a list argument
 * written in the expression is flattened into them by the compiler.
 */
@Value
public class GlobalConstraint implements IrNode {
    GlobalFunction function;
    List<IrNode> arguments;

    public GlobalConstraint(GlobalFunction function, List<IrNode> arguments) {
        this.function = function;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    public ValueType getType() {
        return function.getResultType();
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitGlobal(this);
    }
}
