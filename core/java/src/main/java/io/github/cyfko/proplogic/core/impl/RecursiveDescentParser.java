package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.Expression;
import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.cache.BoundedLRUCache;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.LogicSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;
import io.github.cyfko.proplogic.core.parsing.Token;
import io.github.cyfko.proplogic.core.parsing.TokenType;
import io.github.cyfko.proplogic.core.parsing.Tokenizer;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.logging.Logger;

/**
 * Recursive-descent implementation of {@link ExpressionParser}.
 * <p>
 * One method per precedence level, lowest first:
 * </p>
 * <ol>
 *   <li>{@code parseBiconditional}: {@code implication (BICONDITIONAL implication)*}, right-folded</li>
 *   <li>{@code parseImplies}: {@code disjunction (IMPLIES disjunction)*}, right-folded</li>
 *   <li>{@code parseOr}: {@code conjunction (OR conjunction)*}, left-folded</li>
 *   <li>{@code parseAnd}: {@code negation (AND negation)*}, left-folded</li>
 *   <li>{@code parseNot}: {@code NOT negation | atom}</li>
 *   <li>{@code parseAtom}: {@code VARIABLE | '(' expression ')'}</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * When the {@link CachePolicy} enables it, parsed trees are kept in a {@link BoundedLRUCache} keyed by
 * the exact expression text. Trees are immutable, so a cached tree is returned as is to every caller.
 * Failed parses are never cached.
 * </p>
 *
 * <h2>DoS Protection</h2>
 * <p>
 * The {@link ParserPolicy} bounds the expression length (checked before tokenizing), the nesting
 * depth of parentheses and negations (checked while descending) and the height of the built tree
 * (checked as each connective node is created, so long operator chains count too). All three are
 * reported as {@link SyntaxErrorKind#EXPRESSION_TOO_COMPLEX}.
 * </p>
 *
 * <pre>{@code
 * ExpressionParser parser = new RecursiveDescentParser();
 * Expression ast = parser.parse("P IMPLIES Q IMPLIES R"); // (P IMPLIES (Q IMPLIES R))
 *
 * ExpressionParser strict = new RecursiveDescentParser(ParserPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecursiveDescentParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(RecursiveDescentParser.class.getName());

    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, Expression> cache;

    public RecursiveDescentParser() {
        this(ParserPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param parserPolicy complexity limits
     * @param cachePolicy  cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public RecursiveDescentParser(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }
        this.parserPolicy = parserPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
                ? new BoundedLRUCache<>(cachePolicy.cacheSize())
                : null;
    }

    @Override
    public Expression parse(String expression) throws LogicSyntaxException {
        if (expression == null || expression.isBlank()) {
            throw new LogicSyntaxException(SyntaxErrorKind.EMPTY_EXPRESSION, "Expression cannot be null or empty");
        }

        int length = expression.trim().length();
        if (length > parserPolicy.maxExpressionLength()) {
            throw new LogicSyntaxException(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    length, parserPolicy.maxExpressionLength(), parserPolicy.policyName()));
        }

        if (cache == null) {
            return doParse(expression);
        }
        return cache.computeIfAbsent(expression, this::doParse);
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * @return cache statistics, or only {@code enabled=false} when caching is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }
        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cachePolicy.cacheSize(),
                "hits", cache.getHits(),
                "misses", cache.getMisses()
        );
    }

    private Expression doParse(String expression) {
        Expression ast = new Cursor(Tokenizer.tokenize(expression)).parseExpression();
        log.fine(() -> String.format("Parsed '%s' as %s", expression, ast));
        return ast;
    }

    /**
     * Per-call parsing state; the enclosing parser stays stateless apart from its cache.
     */
    private final class Cursor {
        private final List<Token> tokens;
        private int position;
        private int depth;
        private int openGroups;
        // height of every non-leaf node built so far; variables are height 0
        private final Map<Expression, Integer> heights = new IdentityHashMap<>();

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Expression parseExpression() {
            Expression root = parseBiconditional();
            Token next = peek();
            if (next.is(TokenType.RPAREN)) {
                throw new LogicSyntaxException(SyntaxErrorKind.UNBALANCED_PARENS,
                        String.format("Unbalanced parentheses: unmatched ')' at column %d", next.column()),
                        next.text(), next.column());
            }
            if (!next.is(TokenType.END)) {
                throw new LogicSyntaxException(SyntaxErrorKind.TRAILING_INPUT,
                        String.format("Unexpected trailing input %s at column %d", next.describe(), next.column()),
                        next.text(), next.column());
            }
            return root;
        }

        private Expression parseBiconditional() {
            List<Expression> operands = new ArrayList<>();
            List<Token> operators = new ArrayList<>();
            operands.add(parseImplies());
            while (peek().is(TokenType.BICONDITIONAL)) {
                operators.add(next());
                operands.add(parseImplies());
            }
            return foldRight(operands, operators, Expression.Iff::new);
        }

        private Expression parseImplies() {
            List<Expression> operands = new ArrayList<>();
            List<Token> operators = new ArrayList<>();
            operands.add(parseOr());
            while (peek().is(TokenType.IMPLIES)) {
                operators.add(next());
                operands.add(parseOr());
            }
            return foldRight(operands, operators, Expression.Implies::new);
        }

        private Expression parseOr() {
            Expression left = parseAnd();
            while (peek().is(TokenType.OR)) {
                Token operator = next();
                left = binary(operator, left, parseAnd(), Expression.Or::new);
            }
            return left;
        }

        private Expression parseAnd() {
            Expression left = parseNot();
            while (peek().is(TokenType.AND)) {
                Token operator = next();
                left = binary(operator, left, parseNot(), Expression.And::new);
            }
            return left;
        }

        private Expression parseNot() {
            Token token = peek();
            if (accept(TokenType.NOT)) {
                enter(token);
                Expression operand = parseNot();
                depth--;
                return built(token, new Expression.Not(operand), height(operand) + 1);
            }
            return parseAtom();
        }

        private Expression parseAtom() {
            Token token = peek();
            switch (token.type()) {
                case VARIABLE -> {
                    position++;
                    return new Expression.Var(token.text());
                }
                case LPAREN -> {
                    position++;
                    enter(token);
                    openGroups++;
                    Expression inner = parseBiconditional();
                    openGroups--;
                    depth--;
                    Token closing = peek();
                    if (closing.is(TokenType.RPAREN)) {
                        position++;
                        return inner;
                    }
                    if (closing.is(TokenType.END)) {
                        throw new LogicSyntaxException(SyntaxErrorKind.UNBALANCED_PARENS,
                                String.format("Unbalanced parentheses: '(' at column %d is never closed", token.column()),
                                token.text(), token.column());
                    }
                    throw unexpected(closing, "')'");
                }
                default -> {
                    if (token.is(TokenType.RPAREN) && openGroups == 0) {
                        throw new LogicSyntaxException(SyntaxErrorKind.UNBALANCED_PARENS,
                                String.format("Unbalanced parentheses: unmatched ')' at column %d", token.column()),
                                token.text(), token.column());
                    }
                    throw unexpected(token, "a variable or '('");
                }
            }
        }

        private void enter(Token token) {
            if (++depth > parserPolicy.maxNestingDepth()) {
                throw new LogicSyntaxException(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, String.format(
                        "Expression nested too deeply at column %d (max depth: %d). Policy applied: %s",
                        token.column(), parserPolicy.maxNestingDepth(), parserPolicy.policyName()),
                        token.text(), token.column());
            }
        }

        private LogicSyntaxException unexpected(Token token, String expected) {
            return new LogicSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    String.format("Unexpected token %s at column %d, expected %s", token.describe(), token.column(), expected),
                    token.text(), token.column());
        }

        private Token peek() {
            return tokens.get(position);
        }

        private Token next() {
            return tokens.get(position++);
        }

        private boolean accept(TokenType type) {
            if (peek().is(type)) {
                position++;
                return true;
            }
            return false;
        }

        private Expression foldRight(List<Expression> operands,
                                     List<Token> operators,
                                     BinaryOperator<Expression> combiner) {
            Expression result = operands.get(operands.size() - 1);
            for (int i = operands.size() - 2; i >= 0; i--) {
                result = binary(operators.get(i), operands.get(i), result, combiner);
            }
            return result;
        }

        private Expression binary(Token operator, Expression left, Expression right, BinaryOperator<Expression> combiner) {
            return built(operator, combiner.apply(left, right), Math.max(height(left), height(right)) + 1);
        }

        private Expression built(Token token, Expression node, int height) {
            if (height > parserPolicy.maxNestingDepth()) {
                throw new LogicSyntaxException(SyntaxErrorKind.EXPRESSION_TOO_COMPLEX, String.format(
                        "Expression tree too deep at column %d (height %d, max depth: %d). Policy applied: %s",
                        token.column(), height, parserPolicy.maxNestingDepth(), parserPolicy.policyName()),
                        token.text(), token.column());
            }
            heights.put(node, height);
            return node;
        }

        private int height(Expression node) {
            return heights.getOrDefault(node, 0);
        }
    }
}
