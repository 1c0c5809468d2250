package de.prgrm.cypher.ogm.runtime.query;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.jboss.logging.Logger;

import de.prgrm.cypher.ogm.runtime.client.DatabaseClient;
import de.prgrm.cypher.ogm.runtime.enums.Direction;
import de.prgrm.cypher.ogm.runtime.enums.Operator;
import de.prgrm.cypher.ogm.runtime.errors.ClauseOrderException;
import de.prgrm.cypher.ogm.runtime.errors.InvalidMatchChainException;
import de.prgrm.cypher.ogm.runtime.errors.NoVariablesMatchedException;
import de.prgrm.cypher.ogm.runtime.errors.UsageException;
import de.prgrm.cypher.ogm.runtime.literal.CypherLiterals;
import de.prgrm.cypher.ogm.runtime.literal.CypherVariable;
import de.prgrm.cypher.ogm.runtime.mapping.Node;
import de.prgrm.cypher.ogm.runtime.mapping.Relationship;
import de.prgrm.cypher.ogm.runtime.query.clause.*;

/**
 * Fluent accumulator of Cypher clauses.
 * <p>
 * Every chain method appends one clause and returns this builder. Chain legality (pattern order,
 * undeclared variables, modifier placement) is checked while appending, so misuse fails before
 * anything is sent to the database. A builder is single-use: once executed no clause can be added.
 * Builders are not thread-safe.
 *
 * @param <B> the concrete builder type returned by the chain methods
 */
public abstract class AbstractQueryBuilder<B extends AbstractQueryBuilder<B>> {

    private static final Logger LOG = Logger.getLogger(AbstractQueryBuilder.class);

    private static final Pattern FUNCTION_CALL = Pattern.compile("^\\s*[A-Za-z_][\\w.]*\\s*\\((.*)\\)\\s*$");
    private static final Pattern VARIABLE_ACCESS = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*(?:[.:\\[].*)?$",
            Pattern.DOTALL);
    private static final Set<String> KEYWORD_LITERALS = Set.of("true", "false", "null");

    private final DatabaseClient database;
    private final List<Clause> clauses = new ArrayList<>();
    private final Set<String> scope = new LinkedHashSet<>();
    private final Map<String, Object> parameters = new LinkedHashMap<>();

    private boolean matchContext;
    private boolean opaque;
    private boolean pendingCall;
    private boolean consumed;

    protected AbstractQueryBuilder(DatabaseClient database) {
        this.database = database;
    }

    protected abstract B self();

    // ========================= Reading clauses =========================

    public B match() {
        return match(false);
    }

    public B match(boolean optional) {
        return append(new MatchClause(optional));
    }

    public B merge() {
        return append(new MergeClause());
    }

    public B create() {
        return append(new CreateClause());
    }

    // ========================= Patterns =========================

    public B node() {
        return node((Collection<String>) null, null, null);
    }

    /**
     * @param labels a single label or several joined by {@code :}
     */
    public B node(String labels) {
        return node(labels, null, null);
    }

    public B node(String labels, String variable) {
        return node(labels, variable, null);
    }

    public B node(String labels, Map<String, Object> properties) {
        return node(labels, null, properties);
    }

    public B node(String labels, String variable, Map<String, Object> properties) {
        return node(splitLabels(labels), variable, properties);
    }

    public B node(Collection<String> labels, String variable, Map<String, Object> properties) {
        if (last() instanceof NodePattern) {
            throw new InvalidMatchChainException(
                    "Can't create a node pattern directly after another node pattern, "
                            + "connect them with a relationship first");
        }
        matchContext = true;
        return append(new NodePattern(blankToNull(variable), labels == null ? null : List.copyOf(labels), properties));
    }

    /**
     * Pattern for an entity instance: its labels and its non-null graph properties.
     */
    public B node(Node entity, String variable) {
        return node(entity.labels(), variable, entity.graphProperties());
    }

    public B to() {
        return relationship(null, null, null, Direction.OUTGOING);
    }

    public B to(String type) {
        return relationship(type, null, null, Direction.OUTGOING);
    }

    public B to(String type, String variable) {
        return relationship(type, variable, null, Direction.OUTGOING);
    }

    public B to(String type, String variable, Map<String, Object> properties) {
        return relationship(type, variable, properties, Direction.OUTGOING);
    }

    public B to(Relationship relationship, String variable) {
        return relationship(relationship.type(), variable, relationship.graphProperties(), Direction.OUTGOING);
    }

    public B from() {
        return relationship(null, null, null, Direction.INCOMING);
    }

    public B from(String type) {
        return relationship(type, null, null, Direction.INCOMING);
    }

    public B from(String type, String variable) {
        return relationship(type, variable, null, Direction.INCOMING);
    }

    public B from(String type, String variable, Map<String, Object> properties) {
        return relationship(type, variable, properties, Direction.INCOMING);
    }

    public B related(String type, String variable) {
        return relationship(type, variable, null, Direction.UNDIRECTED);
    }

    public B related(String type, String variable, Map<String, Object> properties) {
        return relationship(type, variable, properties, Direction.UNDIRECTED);
    }

    private B relationship(String type, String variable, Map<String, Object> properties, Direction direction) {
        return relationship(type, variable, properties, direction, null);
    }

    protected B relationship(String type, String variable, Map<String, Object> properties, Direction direction,
            PathAlgorithm algorithm) {
        if (last() instanceof RelationshipPattern) {
            throw new InvalidMatchChainException(
                    "Can't create a relationship pattern directly after another relationship pattern, "
                            + "add a node in between");
        }
        matchContext = true;
        return append(new RelationshipPattern(blankToNull(variable), blankToNull(type), properties, direction,
                algorithm));
    }

    // ========================= Conditions =========================

    public B where(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.WHERE, false, item, operator, value);
    }

    public B where(String item, Operator operator) {
        return condition(WhereClause.Keyword.WHERE, false, item, operator, null);
    }

    public B whereNot(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.WHERE, true, item, operator, value);
    }

    public B whereNot(String item, Operator operator) {
        return condition(WhereClause.Keyword.WHERE, true, item, operator, null);
    }

    public B andWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.AND, false, item, operator, value);
    }

    public B andWhere(String item, Operator operator) {
        return condition(WhereClause.Keyword.AND, false, item, operator, null);
    }

    public B andNotWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.AND, true, item, operator, value);
    }

    public B orWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.OR, false, item, operator, value);
    }

    public B orWhere(String item, Operator operator) {
        return condition(WhereClause.Keyword.OR, false, item, operator, null);
    }

    public B orNotWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.OR, true, item, operator, value);
    }

    public B xorWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.XOR, false, item, operator, value);
    }

    public B xorNotWhere(String item, Operator operator, Object value) {
        return condition(WhereClause.Keyword.XOR, true, item, operator, value);
    }

    private B condition(WhereClause.Keyword keyword, boolean negated, String item, Operator operator, Object value) {
        if (keyword == WhereClause.Keyword.WHERE) {
            if (!matchContext) {
                throw new InvalidMatchChainException(
                        "Can't use WHERE before a MATCH, MERGE or CREATE pattern or another clause declaring variables");
            }
        } else if (!(last() instanceof WhereClause)) {
            throw new ClauseOrderException(keyword + " must follow a WHERE condition");
        }
        if (operator == Operator.ASSIGNMENT || operator == Operator.INCREMENT) {
            throw new UsageException("Operator " + operator.symbol() + " can't be used in a condition");
        }
        checkDeclared(item);
        if (value instanceof CypherVariable variable) {
            checkDeclared(variable.name());
        }
        return append(new WhereClause(keyword, negated, item, operator, renderOperand(operator, value)));
    }

    // ========================= Projections =========================

    public B returning() {
        return projection(ProjectionClause.Keyword.RETURN, List.of());
    }

    public B returning(String... expressions) {
        return projection(ProjectionClause.Keyword.RETURN, toProjections(expressions));
    }

    public B returning(Projection... projections) {
        return projection(ProjectionClause.Keyword.RETURN, List.of(projections));
    }

    /**
     * @param aliases expression to alias, in iteration order
     */
    public B returning(Map<String, String> aliases) {
        return projection(ProjectionClause.Keyword.RETURN, toProjections(aliases));
    }

    public B with() {
        return projection(ProjectionClause.Keyword.WITH, List.of());
    }

    public B with(String... expressions) {
        return projection(ProjectionClause.Keyword.WITH, toProjections(expressions));
    }

    public B with(Projection... projections) {
        return projection(ProjectionClause.Keyword.WITH, List.of(projections));
    }

    public B with(Map<String, String> aliases) {
        return projection(ProjectionClause.Keyword.WITH, toProjections(aliases));
    }

    public B yielding() {
        return projection(ProjectionClause.Keyword.YIELD, List.of());
    }

    public B yielding(String... expressions) {
        return projection(ProjectionClause.Keyword.YIELD, toProjections(expressions));
    }

    public B yielding(Projection... projections) {
        return projection(ProjectionClause.Keyword.YIELD, List.of(projections));
    }

    public B yielding(Map<String, String> aliases) {
        return projection(ProjectionClause.Keyword.YIELD, toProjections(aliases));
    }

    private B projection(ProjectionClause.Keyword keyword, List<Projection> projections) {
        ProjectionClause clause = new ProjectionClause(keyword, projections);
        if (keyword == ProjectionClause.Keyword.YIELD) {
            pendingCall = false;
            if (clause.isStar()) {
                // columns of YIELD * are unknown until the next WITH or UNION
                opaque = true;
            }
            scope.addAll(clause.declaredVariables());
            matchContext = true;
            return append(clause);
        }

        if (clause.isStar() && scope.isEmpty() && !isOpaque()) {
            throw new NoVariablesMatchedException(
                    keyword + " * is not allowed when there are no variables in scope");
        }
        for (Projection projection : projections) {
            checkDeclared(projection.expression());
        }
        if (keyword == ProjectionClause.Keyword.WITH) {
            if (!clause.isStar()) {
                scope.clear();
                scope.addAll(clause.declaredVariables());
                opaque = false;
            }
            // WITH ends the previous part, variables are whatever it projects
            pendingCall = false;
            matchContext = true;
        }
        return append(clause);
    }

    // ========================= Other clauses =========================

    public B call(String procedure) {
        return call(procedure, (String) null);
    }

    /**
     * @param arguments rendered verbatim between the parentheses
     */
    public B call(String procedure, String arguments) {
        pendingCall = true;
        return append(new CallClause(procedure, arguments));
    }

    /**
     * String arguments are double-quoted, anything else is rendered with {@link String#valueOf}.
     */
    public B call(String procedure, List<?> arguments) {
        String rendered = arguments.stream()
                .map(arg -> arg instanceof String s ? '"' + s + '"' : String.valueOf(arg))
                .collect(Collectors.joining(", "));
        return call(procedure, rendered);
    }

    public B unwind(String listExpression, String variable) {
        scope.add(variable);
        matchContext = true;
        return append(new UnwindClause(listExpression, variable));
    }

    public B foreach(String variable, String expression, String... updateClauses) {
        return foreach(variable, expression, List.of(updateClauses));
    }

    public B foreach(String variable, String expression, List<String> updateClauses) {
        if (updateClauses.isEmpty()) {
            throw new UsageException("FOREACH needs at least one update clause");
        }
        List<String> trimmed = updateClauses.stream().map(String::strip).collect(Collectors.toList());
        return append(new ForeachClause(variable, expression, trimmed));
    }

    public B delete(String... variables) {
        return delete(List.of(variables), false);
    }

    public B detachDelete(String... variables) {
        return delete(List.of(variables), true);
    }

    public B delete(List<String> variables, boolean detach) {
        requireNotEmpty(variables, "DELETE");
        return append(new DeleteClause(variables, detach));
    }

    public B remove(String... items) {
        return remove(List.of(items));
    }

    public B remove(List<String> items) {
        requireNotEmpty(items, "REMOVE");
        return append(new RemoveClause(items));
    }

    public B set(String item, Operator operator, Object value) {
        if (operator != Operator.ASSIGNMENT && operator != Operator.EQUAL
                && operator != Operator.INCREMENT && operator != Operator.LABEL_FILTER) {
            throw new UsageException("Operator " + operator.symbol() + " can't be used in SET");
        }
        return append(new SetClause(item, operator, renderOperand(operator, value)));
    }

    public B union() {
        return union(false);
    }

    public B unionAll() {
        return union(true);
    }

    public B union(boolean includeDuplicates) {
        B result = append(new UnionClause(includeDuplicates));
        scope.clear();
        matchContext = false;
        opaque = false;
        pendingCall = false;
        return result;
    }

    /**
     * Appends text verbatim. Variables it declares are unknown, so checks for undeclared variables
     * are switched off for the rest of this query part.
     */
    public B addCustomCypher(String cypher) {
        opaque = true;
        matchContext = true;
        return append(new CustomCypherClause(cypher));
    }

    // ========================= Modifiers =========================

    public B orderBy(String... expressions) {
        return orderBy(Arrays.stream(expressions).map(Sort::by).toArray(Sort[]::new));
    }

    public B orderBy(Sort... sorts) {
        if (sorts.length == 0) {
            throw new UsageException("ORDER BY needs at least one expression");
        }
        requireAfter("ORDER BY", ProjectionClause.class);
        return append(new OrderByClause(List.of(sorts)));
    }

    public B skip(int skip) {
        return skip(String.valueOf(skip));
    }

    public B skip(String expression) {
        requireAfter("SKIP", ProjectionClause.class, OrderByClause.class);
        return append(new SkipClause(expression));
    }

    public B limit(int limit) {
        return limit(String.valueOf(limit));
    }

    public B limit(String expression) {
        requireAfter("LIMIT", ProjectionClause.class, OrderByClause.class, SkipClause.class);
        return append(new LimitClause(expression));
    }

    /**
     * Registers a query parameter, referenced in clauses as {@code CypherVariable.of("$name")}.
     */
    public B parameter(String name, Object value) {
        parameters.put(name, value);
        return self();
    }

    // ========================= Rendering & execution =========================

    /**
     * Renders the accumulated clauses. Calling it does not consume the builder.
     */
    public String construct() {
        StringBuilder sb = new StringBuilder();
        for (Clause clause : clauses) {
            sb.append(clause.render());
        }
        return collapseWhitespace(sb.toString());
    }

    public void execute() {
        String query = consume();
        requireDatabase().execute(query, parameters);
    }

    /**
     * Runs the query and streams the rows. Every call sends the query again; the returned stream
     * holds a database session and must be closed.
     */
    public Stream<Map<String, Object>> executeAndFetch() {
        String query = consume();
        return requireDatabase().executeAndFetch(query, parameters);
    }

    /**
     * @return the value of {@code column} in the first row, or {@code null} without rows
     */
    public Object getSingle(String column) {
        try (Stream<Map<String, Object>> rows = executeAndFetch()) {
            return rows.findFirst().map(row -> row.get(column)).orElse(null);
        }
    }

    protected List<Clause> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    protected B append(Clause clause) {
        if (consumed) {
            throw new UsageException("Query was already executed, start a new query builder");
        }
        clauses.add(clause);
        if (!(clause instanceof ProjectionClause)) {
            scope.addAll(clause.declaredVariables());
        }
        return self();
    }

    protected void declare(String variable) {
        scope.add(variable);
        matchContext = true;
    }

    private String consume() {
        if (clauses.isEmpty()) {
            throw new UsageException("Query is empty");
        }
        consumed = true;
        String query = construct();
        LOG.debugf("Executing query: %s", query);
        return query;
    }

    private DatabaseClient requireDatabase() {
        if (database == null) {
            throw new UsageException("Query builder has no database client, it can only be constructed");
        }
        return database;
    }

    private boolean isOpaque() {
        return opaque || pendingCall;
    }

    private Clause last() {
        return clauses.isEmpty() ? null : clauses.get(clauses.size() - 1);
    }

    @SafeVarargs
    private void requireAfter(String modifier, Class<? extends Clause>... allowed) {
        Clause last = last();
        boolean ok = last != null && Arrays.stream(allowed).anyMatch(type -> type.isInstance(last));
        if (ok && last instanceof ProjectionClause projection
                && projection.keyword() == ProjectionClause.Keyword.YIELD) {
            ok = false;
        }
        if (!ok) {
            throw new ClauseOrderException(modifier + " can only follow RETURN or WITH");
        }
    }

    private void checkDeclared(String expression) {
        if (isOpaque()) {
            return;
        }
        referencedVariable(expression).ifPresent(variable -> {
            if (!scope.contains(variable)) {
                throw new InvalidMatchChainException("Variable '" + variable + "' is not declared in this query");
            }
        });
    }

    private static String renderOperand(Operator operator, Object value) {
        if (operator.isUnary()) {
            return null;
        }
        if (value == null) {
            throw new UsageException("Operator " + operator.symbol()
                    + " needs a literal or an expression, use IS NULL to compare with null");
        }
        if (operator == Operator.LABEL_FILTER) {
            if (value instanceof Collection<?> labels) {
                return labels.stream().map(l -> CypherLiterals.identifier(String.valueOf(l)))
                        .collect(Collectors.joining(":"));
            }
            return String.valueOf(value);
        }
        return CypherLiterals.serialize(value);
    }

    /**
     * The variable an expression starts from: {@code n} for {@code n.name}, {@code id(n)} or
     * {@code toLower(n.name)}. Empty for literals and anything not starting with a variable.
     */
    static Optional<String> referencedVariable(String expression) {
        Matcher call = FUNCTION_CALL.matcher(expression);
        if (call.matches()) {
            return referencedVariable(call.group(1));
        }
        Matcher access = VARIABLE_ACCESS.matcher(expression);
        if (access.matches() && !KEYWORD_LITERALS.contains(access.group(1).toLowerCase(Locale.ROOT))) {
            return Optional.of(access.group(1));
        }
        return Optional.empty();
    }

    static String collapseWhitespace(String query) {
        StringBuilder sb = new StringBuilder(query.length());
        char quote = 0;
        int i = 0;
        while (i < query.length()) {
            char c = query.charAt(i);
            if (quote != 0) {
                sb.append(c);
                if (c == '\\' && i + 1 < query.length()) {
                    sb.append(query.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
            } else if (Character.isWhitespace(c)) {
                int end = i;
                while (end < query.length() && Character.isWhitespace(query.charAt(end))) {
                    end++;
                }
                sb.append(end - i > 1 ? " " : String.valueOf(c));
                i = end;
            } else {
                if (c == '\'' || c == '"' || c == '`') {
                    quote = c;
                }
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    private static List<String> splitLabels(String labels) {
        if (labels == null || labels.isBlank()) {
            return List.of();
        }
        return Arrays.stream(labels.split(":"))
                .map(String::strip)
                .filter(l -> !l.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<Projection> toProjections(String... expressions) {
        return Arrays.stream(expressions).map(Projection::of).collect(Collectors.toList());
    }

    private static List<Projection> toProjections(Map<String, String> aliases) {
        return aliases.entrySet().stream()
                .map(e -> Projection.of(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    private static void requireNotEmpty(List<String> items, String clause) {
        if (items.isEmpty()) {
            throw new UsageException(clause + " needs at least one item");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
