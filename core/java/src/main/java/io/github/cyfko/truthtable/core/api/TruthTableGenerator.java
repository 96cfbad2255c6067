package io.github.cyfko.truthtable.core.api;

import io.github.cyfko.truthtable.core.exception.EvaluationException;
import io.github.cyfko.truthtable.core.exception.ExpressionException;
import io.github.cyfko.truthtable.core.exception.ExpressionSyntaxException;
import io.github.cyfko.truthtable.core.exception.LexicalException;

/**
 * Builds truth tables for propositional expressions over the variables P, Q and R.
 *
 * <h2>Expression Grammar</h2>
 * <table border="1">
 * <caption>Expression Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Aliases</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(P ^ Q)</td></tr>
 * <tr><td>NOT</td><td>~, NOT</td><td>3</td><td>Right</td><td>~P</td></tr>
 * <tr><td>AND</td><td>^, AND</td><td>2</td><td>Left</td><td>P ^ Q</td></tr>
 * <tr><td>OR</td><td>or, OR</td><td>2</td><td>Left</td><td>P or Q</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;, IMPLIES</td><td>1</td><td>Left</td><td>P -&gt; Q</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;, IFF</td><td>1</td><td>Left</td><td>P &lt;-&gt; Q</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Operands are the variables P, Q, R and the constants TRUE and FALSE. Matching is
 * case-insensitive and whitespace is ignored. AND and OR share a precedence level, so
 * {@code P or Q ^ R} reads as {@code (P or Q) ^ R}.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * TruthTableGenerator generator = new BasicTruthTableGenerator();
 *
 * TruthTableOutcome outcome = generator.buildTable("P or ~P");
 * outcome.table().ifPresent(table -> {
 *     table.headers();    // [P, ~P, P v ~P]
 *     table.tautology();  // true
 * });
 *
 * generator.buildTable("P & Q").status();  // LEX_ERROR
 * generator.buildTable("(P ^ Q").status(); // SYNTAX_ERROR
 * generator.buildTable("P ^").status();    // EVAL_ERROR
 * generator.buildTable("TRUE").status();   // NO_VARIABLES
 * }</pre>
 *
 * @see TruthTableOutcome
 * @see ExpressionException
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface TruthTableGenerator {

    /**
     * Builds the truth table of an expression.
     * <p>
     * Never throws for malformed expressions: lexical, syntax and evaluation failures are
     * reported through the returned outcome, as is an expression without variables.
     * </p>
     *
     * @param expression the expression to tabulate
     * @return the table, or the reason no table was produced
     * @throws NullPointerException if {@code expression} is null
     */
    TruthTableOutcome buildTable(String expression);

    /**
     * Evaluates an expression under a single assignment.
     *
     * @param expression the expression to evaluate
     * @param assignment values for every variable the expression references
     * @return the final value and the evaluation trace
     * @throws LexicalException          if the expression contains an illegal character
     * @throws ExpressionSyntaxException if the parentheses are unbalanced
     * @throws EvaluationException       if the expression is malformed or references an unbound variable
     * @throws NullPointerException      if any argument is null
     */
    EvaluationResult evaluate(String expression, Assignment assignment) throws ExpressionException;
}
