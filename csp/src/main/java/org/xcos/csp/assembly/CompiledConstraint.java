package org.xcos.csp.assembly;

import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.model.ConstraintType;

import lombok.Value;

@Value
public class CompiledConstraint {
    String id;
    String expression;
    ConstraintType type;
    IrNode node;
}
