package org.xcos.csp.expression.ir;

/**
 * A node of the constraint IR produced by the expression compiler.
 */
public interface IrNode {

    ValueType getType();

    <R> R accept(IrVisitor<R> visitor);
}
