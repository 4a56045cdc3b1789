package org.xcos.csp.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.xcos.csp.encoding.EncodedVariable;
import org.xcos.csp.exceptions.ExpressionException;
import org.xcos.csp.exceptions.UnknownVariableException;
import org.xcos.csp.expression.ir.Arithmetic;
import org.xcos.csp.expression.ir.ArithmeticOperator;
import org.xcos.csp.expression.ir.Comparison;
import org.xcos.csp.expression.ir.ComparisonOperator;
import org.xcos.csp.expression.ir.GlobalConstraint;
import org.xcos.csp.expression.ir.GlobalFunction;
import org.xcos.csp.expression.ir.IrNode;
import org.xcos.csp.expression.ir.ListNode;
import org.xcos.csp.expression.ir.Literal;
import org.xcos.csp.expression.ir.Logical;
import org.xcos.csp.expression.ir.LogicalOperator;
import org.xcos.csp.expression.ir.ValueType;
import org.xcos.csp.expression.ir.VariableRef;

/**
 * Recursive-descent parser from tokens to typed IR.
 * <p>
 * Grammar, loosest binding first:
 * <pre>
 * expression  := or
 * or          := and ( ('|' | 'or') and )*
 * and         := not ( ('&amp;' | 'and') not )*
 * not         := ('~' | '!' | 'not') not | comparison
 * comparison  := additive ( ('==' | '!=' | '&lt;' | '&gt;' | '&lt;=' | '&gt;=') additive )?
 * additive    := term ( ('+' | '-') term )*
 * term        := unary ( ('*' | '/') unary )*
 * unary       := '-' unary | primary
 * primary     := NUMBER | IDENT | call | list | '(' expression ')'
 * call        := GLOBAL '(' arguments? ')'
 * list        := '[' arguments? ']'
 * </pre>
 * Identifiers resolve against the declared variables only; calls against {@link GlobalFunction}.
 * Type rules are checked while the tree is built.
 * <p>
 * Expressions are limited to {@value #MAX_TOKENS} tokens and {@value #MAX_DEPTH} levels of
 * nesting, which bounds the height of the resulting tree.
 */
class ExpressionParser {

    private static final Set<TokenType> COMPARISON_TOKENS = EnumSet.of(
        TokenType.EQ, TokenType.NE, TokenType.LT, TokenType.GT, TokenType.LE, TokenType.GE);

    static final int MAX_DEPTH = 64;
    static final int MAX_TOKENS = 1000;

    private final String constraintId;
    private final String expression;
    private final List<Token> tokens;
    private final Map<String, EncodedVariable> variables;
    private int current;
    private int depth;

    ExpressionParser(String constraintId, String expression, List<Token> tokens,
                     Map<String, EncodedVariable> variables) {
        this.constraintId = constraintId;
        this.expression = expression;
        this.tokens = tokens;
        this.variables = variables;
    }

    IrNode parse() {
        if (peek().is(TokenType.EOF)) {
            throw error("expression is empty");
        }
        // the trailing EOF token is not counted
        if (tokens.size() - 1 > MAX_TOKENS) {
            throw error("expression is too long, at most " + MAX_TOKENS + " tokens are allowed");
        }
        IrNode node = parseNested();
        if (!peek().is(TokenType.EOF)) {
            throw error("unexpected '" + peek().getText() + "' at column " + peek().getColumn());
        }
        return node;
    }

    private IrNode parseOr() {
        IrNode first = parseAnd();
        if (!peek().is(TokenType.OR)) {
            return first;
        }
        List<IrNode> operands = new ArrayList<>();
        operands.add(requireBoolean(first, "or"));
        while (match(TokenType.OR)) {
            operands.add(requireBoolean(parseAnd(), "or"));
        }
        return new Logical(LogicalOperator.OR, operands);
    }

    private IrNode parseAnd() {
        IrNode first = parseNot();
        if (!peek().is(TokenType.AND)) {
            return first;
        }
        List<IrNode> operands = new ArrayList<>();
        operands.add(requireBoolean(first, "and"));
        while (match(TokenType.AND)) {
            operands.add(requireBoolean(parseNot(), "and"));
        }
        return new Logical(LogicalOperator.AND, operands);
    }

    private IrNode parseNot() {
        if (match(TokenType.NOT)) {
            enter();
            IrNode operand = requireBoolean(parseNot(), "not");
            depth--;
            return new Logical(LogicalOperator.NOT, List.of(operand));
        }
        return parseComparison();
    }

    private IrNode parseComparison() {
        IrNode left = parseAdditive();
        if (!COMPARISON_TOKENS.contains(peek().getType())) {
            return left;
        }
        Token op = advance();
        IrNode right = parseAdditive();
        if (COMPARISON_TOKENS.contains(peek().getType())) {
            throw error("chained comparisons are not supported, combine them with '&' at column " + peek().getColumn());
        }
        String symbol = op.getText();
        return new Comparison(comparisonOperator(op), requireScalar(left, symbol), requireScalar(right, symbol));
    }

    private IrNode parseAdditive() {
        IrNode left = parseTerm();
        while (peek().is(TokenType.PLUS) || peek().is(TokenType.MINUS)) {
            Token op = advance();
            IrNode right = parseTerm();
            ArithmeticOperator operator = op.is(TokenType.PLUS) ? ArithmeticOperator.ADD : ArithmeticOperator.SUB;
            left = new Arithmetic(operator, requireScalar(left, op.getText()), requireScalar(right, op.getText()));
        }
        return left;
    }

    private IrNode parseTerm() {
        IrNode left = parseUnary();
        while (peek().is(TokenType.STAR) || peek().is(TokenType.SLASH)) {
            Token op = advance();
            IrNode right = parseUnary();
            if (op.is(TokenType.SLASH) && right instanceof Literal literal && literal.getValue() == 0) {
                throw error("division by zero at column " + op.getColumn());
            }
            ArithmeticOperator operator = op.is(TokenType.STAR) ? ArithmeticOperator.MUL : ArithmeticOperator.DIV;
            left = new Arithmetic(operator, requireScalar(left, op.getText()), requireScalar(right, op.getText()));
        }
        return left;
    }

    private IrNode parseUnary() {
        if (match(TokenType.MINUS)) {
            enter();
            IrNode operand = requireScalar(parseUnary(), "-");
            depth--;
            if (operand instanceof Literal literal) {
                return new Literal(Math.negateExact(literal.getValue()));
            }
            return new Arithmetic(ArithmeticOperator.SUB, new Literal(0), operand);
        }
        return parsePrimary();
    }

    private IrNode parsePrimary() {
        Token token = advance();
        switch (token.getType()) {
            case NUMBER:
                return parseNumber(token);
            case IDENTIFIER:
                if (peek().is(TokenType.LPAREN)) {
                    return parseCall(token);
                }
                return resolve(token);
            case LBRACKET:
                return new ListNode(parseArguments(TokenType.RBRACKET));
            case LPAREN:
                IrNode inner = parseNested();
                expect(TokenType.RPAREN, "')'");
                return inner;
            case EOF:
                throw error("unexpected end of expression");
            default:
                throw error("unexpected '" + token.getText() + "' at column " + token.getColumn());
        }
    }

    private IrNode parseNumber(Token token) {
        BigDecimal value = new BigDecimal(token.getText());
        try {
            return new Literal(value.intValueExact());
        } catch (ArithmeticException e) {
            if (value.stripTrailingZeros().scale() > 0) {
                throw error("non-integral literal " + token.getText() + " cannot be used in an integer model");
            }
            throw error("literal " + token.getText() + " exceeds the solver's 32-bit integer range");
        }
    }

    private IrNode resolve(Token identifier) {
        EncodedVariable variable = variables.get(identifier.getText());
        if (variable == null) {
            throw new UnknownVariableException(constraintId, expression, identifier.getText());
        }
        return new VariableRef(variable);
    }

    private IrNode parseCall(Token name) {
        Optional<GlobalFunction> function = GlobalFunction.byKeyword(name.getText());
        if (function.isEmpty()) {
            String allowed = Arrays.stream(GlobalFunction.values())
                .map(GlobalFunction::getKeyword)
                .collect(Collectors.joining(", "));
            throw error("call to '" + name.getText() + "' is not allowed, permitted functions are " + allowed);
        }
        expect(TokenType.LPAREN, "'('");
        List<IrNode> arguments = parseArguments(TokenType.RPAREN);
        return buildGlobal(function.get(), arguments);
    }

    private List<IrNode> parseArguments(TokenType closing) {
        List<IrNode> arguments = new ArrayList<>();
        if (match(closing)) {
            return arguments;
        }
        do {
            arguments.add(parseNested());
        } while (match(TokenType.COMMA));
        expect(closing, closing == TokenType.RPAREN ? "')'" : "']'");
        return arguments;
    }

    private IrNode parseNested() {
        enter();
        IrNode node = parseOr();
        depth--;
        return node;
    }

    // Errors abort the whole parse, so depth is only restored on success
    private void enter() {
        if (++depth > MAX_DEPTH) {
            throw error("expression nests deeper than " + MAX_DEPTH + " levels at column " + peek().getColumn());
        }
    }

    private IrNode buildGlobal(GlobalFunction function, List<IrNode> arguments) {
        String keyword = function.getKeyword();
        List<IrNode> flattened;
        if (arguments.size() == 1 && arguments.get(0) instanceof ListNode list) {
            flattened = list.getElements();
        } else {
            flattened = arguments;
        }
        for (IrNode argument : flattened) {
            requireScalar(argument, keyword);
        }
        if (function.isUnary()) {
            if (flattened.size() != 1 || arguments.get(0) instanceof ListNode) {
                throw error(keyword + " takes exactly one scalar argument");
            }
        } else if (flattened.isEmpty()) {
            throw error(keyword + " requires at least one argument");
        }
        return new GlobalConstraint(function, flattened);
    }

    private IrNode requireBoolean(IrNode node, String operator) {
        if (node.getType() != ValueType.BOOLEAN) {
            throw error("type mismatch, operand of '" + operator + "' must be a constraint but is "
                + describe(node.getType()));
        }
        return node;
    }

    private IrNode requireScalar(IrNode node, String operator) {
        if (!node.getType().isScalar()) {
            throw error("type mismatch, operand of '" + operator + "' must be a scalar but is a list");
        }
        return node;
    }

    private static String describe(ValueType type) {
        return type == ValueType.LIST ? "a list" : "an integer expression";
    }

    private static ComparisonOperator comparisonOperator(Token op) {
        switch (op.getType()) {
            case EQ:
                return ComparisonOperator.EQ;
            case NE:
                return ComparisonOperator.NE;
            case LT:
                return ComparisonOperator.LT;
            case GT:
                return ComparisonOperator.GT;
            case LE:
                return ComparisonOperator.LE;
            default:
                return ComparisonOperator.GE;
        }
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (peek().is(type)) {
            current++;
            return true;
        }
        return false;
    }

    private void expect(TokenType type, String description) {
        if (!match(type)) {
            Token found = peek();
            String text = found.is(TokenType.EOF) ? "end of expression" : "'" + found.getText() + "'";
            throw error("expected " + description + " but found " + text + " at column " + found.getColumn());
        }
    }

    private ExpressionException error(String reason) {
        return new ExpressionException(constraintId, expression, reason);
    }
}
