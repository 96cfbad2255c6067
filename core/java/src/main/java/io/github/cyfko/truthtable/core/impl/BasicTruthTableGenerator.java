package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.Assignment;
import io.github.cyfko.truthtable.core.api.EvaluationResult;
import io.github.cyfko.truthtable.core.api.Token;
import io.github.cyfko.truthtable.core.api.TokenType;
import io.github.cyfko.truthtable.core.api.TruthTable;
import io.github.cyfko.truthtable.core.api.TruthTableGenerator;
import io.github.cyfko.truthtable.core.api.TruthTableOutcome;
import io.github.cyfko.truthtable.core.api.Variable;
import io.github.cyfko.truthtable.core.cache.BoundedLRUCache;
import io.github.cyfko.truthtable.core.config.CachePolicy;
import io.github.cyfko.truthtable.core.config.TablePolicy;
import io.github.cyfko.truthtable.core.exception.ExpressionException;
import io.github.cyfko.truthtable.core.parsing.InfixToPostfixConverter;
import io.github.cyfko.truthtable.core.parsing.PostfixEvaluator;
import io.github.cyfko.truthtable.core.parsing.Tokenizer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Default {@link TruthTableGenerator}: tokenizes, converts to postfix and evaluates the
 * expression once per assignment.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link Tokenizer#tokenize(String, TablePolicy)}: lexical check and length limit</li>
 *   <li>Variable discovery: the referenced variables in alphabetical order; none means
 *       {@link TruthTableOutcome.Status#NO_VARIABLES}</li>
 *   <li>{@link InfixToPostfixConverter#toPostfix(List)}: once per expression, or once per row
 *       when {@link TablePolicy#reconvertPerRow()} is set</li>
 *   <li>{@link PostfixEvaluator#evaluate(List, Assignment)}: once per assignment, the first
 *       evaluation fixing the sub-expression columns</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * When {@link CachePolicy#cacheEnabled()} is set, postfix sequences are cached by the canonical
 * text of their tokens, so {@code "p and q"} and {@code "P ^ Q"} share one entry. Failed
 * conversions are never cached.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * TruthTableGenerator generator = new BasicTruthTableGenerator();
 * TruthTableOutcome outcome = generator.buildTable("(P -> Q) <-> (~Q -> ~P)");
 * outcome.table().map(TruthTable::tautology); // Optional[true]
 *
 * TruthTableGenerator strict = new BasicTruthTableGenerator(TablePolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicTruthTableGenerator implements TruthTableGenerator {

    private static final Logger log = Logger.getLogger(BasicTruthTableGenerator.class.getName());

    private final TablePolicy tablePolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, List<Token>> cache;

    /**
     * Default constructor using {@link TablePolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicTruthTableGenerator() {
        this(TablePolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * Constructor with a custom table policy and the default cache policy.
     *
     * @param tablePolicy the table policy
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicTruthTableGenerator(TablePolicy tablePolicy) {
        this(tablePolicy, CachePolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param tablePolicy the table policy
     * @param cachePolicy the postfix cache settings
     * @throws IllegalArgumentException if either policy is null
     */
    public BasicTruthTableGenerator(TablePolicy tablePolicy, CachePolicy cachePolicy) {
        if (tablePolicy == null) {
            throw new IllegalArgumentException("Table policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.tablePolicy = tablePolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    /**
     * Clears the postfix cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize()
        );
    }

    @Override
    public TruthTableOutcome buildTable(String expression) {
        Objects.requireNonNull(expression, "expression cannot be null");

        try {
            List<Token> tokens = Tokenizer.tokenize(expression, tablePolicy);
            List<Variable> variables = referencedVariables(tokens);
            if (variables.isEmpty()) {
                log.fine(() -> String.format("No variables referenced by '%s'", expression));
                return TruthTableOutcome.noVariables();
            }

            TruthTable table = tabulate(expression, tokens, variables);
            log.info(() -> String.format(
                    "Truth table built for '%s': %d rows, %d columns, tautology=%s",
                    expression, table.rowCount(), table.headers().size(), table.tautology()
            ));
            return TruthTableOutcome.table(table);

        } catch (ExpressionException e) {
            log.warning(() -> String.format("Rejected expression '%s' (%s): %s", expression, e.status(), e.getMessage()));
            return TruthTableOutcome.failure(e.status(), e.getMessage());
        }
    }

    @Override
    public EvaluationResult evaluate(String expression, Assignment assignment) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(assignment, "assignment cannot be null");

        List<Token> tokens = Tokenizer.tokenize(expression, tablePolicy);
        return PostfixEvaluator.evaluate(postfixOf(tokens), assignment);
    }

    private TruthTable tabulate(String expression, List<Token> tokens, List<Variable> variables) {
        List<Token> postfix = postfixOf(tokens);
        log.fine(() -> String.format("Postfix of '%s': %s", expression, postfix));

        List<Assignment> assignments = Assignment.enumerate(variables);

        // The first assignment fixes the sub-expression columns
        List<String> labels = new ArrayList<>(
                PostfixEvaluator.evaluate(postfix, assignments.get(0)).reductions().keySet());

        List<String> headers = new ArrayList<>(variables.size() + labels.size());
        variables.forEach(variable -> headers.add(variable.name()));
        headers.addAll(labels);

        List<List<Boolean>> rows = new ArrayList<>(assignments.size());
        boolean tautology = true;

        for (Assignment assignment : assignments) {
            List<Token> rowPostfix = tablePolicy.reconvertPerRow()
                    ? InfixToPostfixConverter.toPostfix(tokens)
                    : postfix;
            EvaluationResult result = PostfixEvaluator.evaluate(rowPostfix, assignment);
            Map<String, Boolean> reductions = result.reductions();

            List<Boolean> row = new ArrayList<>(headers.size());
            for (Variable variable : variables) {
                row.add(assignment.valueOf(variable).orElse(false));
            }
            for (String label : labels) {
                row.add(reductions.getOrDefault(label, false));
            }
            rows.add(row);

            if (!result.value()) {
                tautology = false;
            }
        }

        return new TruthTable(expression, variables, headers, rows, tautology);
    }

    private List<Token> postfixOf(List<Token> tokens) {
        if (cache == null) {
            return InfixToPostfixConverter.toPostfix(tokens);
        }

        String cacheKey = tokens.stream().map(Token::text).collect(Collectors.joining(" "));
        return cache.computeIfAbsent(cacheKey, key -> List.copyOf(InfixToPostfixConverter.toPostfix(tokens)));
    }

    private static List<Variable> referencedVariables(List<Token> tokens) {
        EnumSet<Variable> variables = EnumSet.noneOf(Variable.class);
        for (Token token : tokens) {
            if (token.type() == TokenType.VARIABLE) {
                variables.add(token.variable());
            }
        }
        return List.copyOf(variables);
    }
}
