package org.xcos.csp.expression.ir;

public interface IrVisitor<R> {

    R visitLiteral(Literal literal);

    R visitVariable(VariableRef variable);

    R visitArithmetic(Arithmetic arithmetic);

    R visitComparison(Comparison comparison);

    R visitLogical(Logical logical);

    R visitGlobal(GlobalConstraint global);

    R visitList(ListNode list);
}
