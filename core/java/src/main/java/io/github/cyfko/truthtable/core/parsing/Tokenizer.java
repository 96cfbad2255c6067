package io.github.cyfko.truthtable.core.parsing;

import io.github.cyfko.truthtable.core.api.Operator;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.Variable;
import io.github.cyfko.truthtable.core.config.OperatorAliases;
import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits raw expression text into {@link Token}s.
 * <p>
 * Recognized lexical classes, tried in this order at every position:
 * </p>
 * <ol>
 *   <li>Parentheses</li>
 *   <li>Operator aliases from {@link OperatorAliases}, longest first</li>
 *   <li>The variables P, Q, R</li>
 *   <li>The constants TRUE and FALSE</li>
 *   <li>Whitespace, which is skipped</li>
 * </ol>
 * <p>
 * Matching is case-insensitive and every token is emitted in canonical uppercase form. Only
 * lexical legality is checked here; well-formedness is the converter's and evaluator's concern.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Tokenizer.tokenize("~p <-> (q or TRUE)");
 * // [NOT, P, IFF, (, Q, OR, TRUE, )]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Tokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "(?<LPAREN>\\()"
                    + "|(?<RPAREN>\\))"
                    + "|(?<OPERATOR>" + OperatorAliases.ALTERNATION + ")"
                    + "|(?<VARIABLE>[PQR])"
                    + "|(?<CONSTANT>TRUE|FALSE)"
                    + "|(?<WHITESPACE>\\s+)"
                    + "|(?<UNKNOWN>.)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL
    );

    private Tokenizer() {}

    /**
     * Tokenizes an expression after checking it against a {@link TablePolicy}.
     *
     * @param expression the raw expression
     * @param policy     the policy whose length limit applies
     * @return the tokens in input order, empty for blank input
     * @throws ExpressionSyntaxException if the expression is too long
     * @throws LexicalException          if the expression contains an illegal character
     * @throws NullPointerException      if either argument is null
     */
    public static List<Token> tokenize(String expression, TablePolicy policy) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(policy, "policy cannot be null");

        String trimmed = expression.trim();
        if (trimmed.length() > policy.maxExpressionLength()) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmed.length(), policy.maxExpressionLength(), policy.policyName()
            ));
        }

        return tokenize(expression);
    }

    /**
     * Tokenizes an expression.
     *
     * @param expression the raw expression
     * @return the tokens in input order, empty for blank input
     * @throws LexicalException     if the expression contains an illegal character
     * @throws NullPointerException if {@code expression} is null
     */
    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(expression);

        while (matcher.find()) {
            String value = matcher.group();

            if (matcher.group("LPAREN") != null) {
                tokens.add(Token.leftParen());
            } else if (matcher.group("RPAREN") != null) {
                tokens.add(Token.rightParen());
            } else if (matcher.group("OPERATOR") != null) {
                Operator operator = OperatorAliases.lookup(value)
                        .orElseThrow(() -> new IllegalStateException("Operator alias without mapping: " + value));
                tokens.add(Token.operator(operator));
            } else if (matcher.group("VARIABLE") != null) {
                tokens.add(Token.variable(Variable.valueOf(value.toUpperCase(Locale.ROOT))));
            } else if (matcher.group("CONSTANT") != null) {
                tokens.add(Token.constant(Token.TRUE.equalsIgnoreCase(value)));
            } else if (matcher.group("UNKNOWN") != null) {
                throw new LexicalException(value.charAt(0), matcher.start());
            }
            // whitespace is skipped
        }

        return tokens;
    }
}
