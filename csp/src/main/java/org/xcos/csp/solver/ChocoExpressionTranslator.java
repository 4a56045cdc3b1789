package org.xcos.csp.solver;

import java.util.List;
import java.util.Map;

import org.chocosolver.solver.Model;
import org.chocosolver.solver.constraints.Constraint;
import org.chocosolver.solver.expression.discrete.arithmetic.ArExpression;
import org.chocosolver.solver.expression.discrete.relational.ReExpression;
import org.chocosolver.solver.variables.IntVar;
import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.SolverException;
import org.xcos.csp.expression.ir.Arithmetic;
import org.xcos.csp.expression.ir.Comparison;
import org.xcos.csp.expression.ir.GlobalConstraint;
import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.expression.ir.IrVisitor;
import org.xcos.csp.expression.ir.ListNode;
import org.xcos.csp.expression.ir.Literal;
import org.xcos.csp.expression.ir.Logical;
import org.xcos.csp.expression.ir.ValueType;
import org.xcos.csp.expression.ir.VariableRef;

/**
 * Builds Choco expressions and constraints from constraint IR, for one Choco model.
 * Boolean IR nodes become {@link ReExpression}s, integer nodes {@link ArExpression}s.
 */
class ChocoExpressionTranslator implements IrVisitor<ArExpression> {

    private final Model model;
    private final Map<EncodedVariable, IntVar> intVars;

    ChocoExpressionTranslator(Model model, Map<EncodedVariable, IntVar> intVars) {
        this.model = model;
        this.intVars = intVars;
    }

    /**
     * Constraint for a top-level boolean node. Global constraints are posted as themselves
     * rather than through reification.
     */
    Constraint toConstraint(IrNode node) {
        if (node instanceof GlobalConstraint global && global.getType() == ValueType.BOOLEAN) {
            return globalConstraint(global);
        }
        return relational(node).decompose();
    }

    IntVar toIntVar(IrNode node) {
        return node.accept(this).intVar();
    }

    @Override
    public ArExpression visitLiteral(Literal literal) {
        return model.intVar(literal.getValue());
    }

    @Override
    public ArExpression visitVariable(VariableRef variable) {
        IntVar var = intVars.get(variable.getVariable());
        if (var == null) {
            throw new SolverException("Variable '" + variable.getVariable().getName() + "' is not part of the solver model");
        }
        return var;
    }

    @Override
    public ArExpression visitArithmetic(Arithmetic arithmetic) {
        ArExpression left = arithmetic.getLeft().accept(this);
        ArExpression right = arithmetic.getRight().accept(this);
        switch (arithmetic.getOperator()) {
            case ADD:
                return left.add(right);
            case SUB:
                return left.sub(right);
            case MUL:
                return left.mul(right);
            case DIV:
                return left.div(right);
            default:
                throw new SolverException("Unsupported arithmetic operator " + arithmetic.getOperator());
        }
    }

    @Override
    public ArExpression visitComparison(Comparison comparison) {
        ArExpression left = comparison.getLeft().accept(this);
        ArExpression right = comparison.getRight().accept(this);
        switch (comparison.getOperator()) {
            case EQ:
                return left.eq(right);
            case NE:
                return left.ne(right);
            case LT:
                return left.lt(right);
            case GT:
                return left.gt(right);
            case LE:
                return left.le(right);
            case GE:
                return left.ge(right);
            default:
                throw new SolverException("Unsupported comparison operator " + comparison.getOperator());
        }
    }

    @Override
    public ArExpression visitLogical(Logical logical) {
        List<IrNode> operands = logical.getOperands();
        ReExpression first = relational(operands.get(0));
        switch (logical.getOperator()) {
            case NOT:
                return first.not();
            case AND:
                return first.and(rest(operands));
            case OR:
                return first.or(rest(operands));
            default:
                throw new SolverException("Unsupported logical operator " + logical.getOperator());
        }
    }

    @Override
    public ArExpression visitGlobal(GlobalConstraint global) {
        List<IrNode> arguments = global.getArguments();
        switch (global.getFunction()) {
            case ALL_DIFFERENT:
            case ALL_EQUAL:
                return globalConstraint(global).reify();
            case SUM:
                return arguments.size() == 1 ? arguments.get(0).accept(this) : arguments.get(0).accept(this).add(tail(arguments));
            case MIN:
                return arguments.size() == 1 ? arguments.get(0).accept(this) : arguments.get(0).accept(this).min(tail(arguments));
            case MAX:
                return arguments.size() == 1 ? arguments.get(0).accept(this) : arguments.get(0).accept(this).max(tail(arguments));
            case ABS:
                return arguments.get(0).accept(this).abs();
            default:
                throw new SolverException("Unsupported global function " + global.getFunction());
        }
    }

    @Override
    public ArExpression visitList(ListNode list) {
        throw new SolverException("A list can only appear as the argument of a global constraint");
    }

    private Constraint globalConstraint(GlobalConstraint global) {
        IntVar[] vars = global.getArguments().stream().map(this::toIntVar).toArray(IntVar[]::new);
        switch (global.getFunction()) {
            case ALL_DIFFERENT:
                return model.allDifferent(vars);
            case ALL_EQUAL:
                return model.allEqual(vars);
            default:
                throw new SolverException(global.getFunction().getKeyword() + " is not a constraint");
        }
    }

    private ReExpression relational(IrNode node) {
        ArExpression expression = node.accept(this);
        if (!(expression instanceof ReExpression)) {
            throw new SolverException("Expected a boolean expression but got " + node);
        }
        return (ReExpression) expression;
    }

    private ReExpression[] rest(List<IrNode> operands) {
        return operands.subList(1, operands.size()).stream().map(this::relational).toArray(ReExpression[]::new);
    }

    private ArExpression[] tail(List<IrNode> arguments) {
        return arguments.subList(1, arguments.size()).stream().map(a -> a.accept(this)).toArray(ArExpression[]::new);
    }
}
