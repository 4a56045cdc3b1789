package org.xcos.csp.expression.ir;

import java.util.List;

import lombok.Value;

@Value
public class ListNode implements IrNode {
    List<IrNode> elements;

    public ListNode(List<IrNode> elements) {
        this.elements = List.copyOf(elements);
    }

    @Override
    public ValueType getType() {
        return ValueType.LIST;
    }

    @Override
    public <R> R accept(IrVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
