package com.tdtl.query;

import com.tdtl.value.Node;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parse tree of a {@code SELECT fields FROM topic WHERE filter GROUP BY dimensions WINDOW(...)}
 * statement.
 *
 * <p>Trees are built once by a parser and then only read. Every child is owned by exactly one
 * parent, required children are never {@code null} and lists are unmodifiable, so a tree can
 * be shared between evaluator threads without locking.
 */
public sealed interface Expr {

    <R> R accept(ExprVisitor<R> visitor);

    /** Direct children in source order. */
    default List<Expr> children() {
        return List.of();
    }

    /** This node followed by all of its descendants, depth first, in source order. */
    default Stream<Expr> stream() {
        return Stream.concat(Stream.of(this), children().stream().flatMap(Expr::stream));
    }

    record SelectStatement(Fields fields, Topic topic, Optional<Filter> filter, Optional<Dimensions> dimensions)
        implements Expr {

        public SelectStatement {
            Objects.requireNonNull(fields, "fields");
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(filter, "filter");
            Objects.requireNonNull(dimensions, "dimensions");
        }

        public SelectStatement(Fields fields, Topic topic) {
            this(fields, topic, Optional.empty(), Optional.empty());
        }

        /** Paths of every record field the statement reads, in traversal order, without duplicates. */
        public List<String> jsonPaths() {
            return stream()
                .filter(JsonPathExpr.class::isInstance)
                .map(expr -> ((JsonPathExpr) expr).path())
                .distinct()
                .collect(Collectors.toUnmodifiableList());
        }

        /** The statement's window, {@link Window#none()} when it has none. */
        public Window window() {
            return dimensions.flatMap(Dimensions::window).orElse(Window.none());
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(List.of(fields, topic));
            filter.ifPresent(children::add);
            dimensions.ifPresent(children::add);
            return List.copyOf(children);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSelect(this);
        }
    }

    record Fields(List<Field> fields) implements Expr {
        public Fields {
            fields = List.copyOf(fields);
        }

        @Override
        public List<Expr> children() {
            return List.copyOf(fields);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFields(this);
        }
    }

    /** One projected expression, optionally renamed with {@code AS alias}. */
    record Field(Expr expression, Optional<String> alias) implements Expr {
        public Field {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(alias, "alias");
        }

        public Field(Expr expression) {
            this(expression, Optional.empty());
        }

        public Field(Expr expression, String alias) {
            this(expression, Optional.of(alias));
        }

        @Override
        public List<Expr> children() {
            return List.of(expression);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitField(this);
        }
    }

    /** Names of the topics records are read from. */
    record Topic(List<String> names) implements Expr {
        public Topic {
            names = List.copyOf(names);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTopic(this);
        }
    }

    /** The WHERE predicate. */
    record Filter(Expr expression) implements Expr {
        public Filter {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public List<Expr> children() {
            return List.of(expression);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFilter(this);
        }
    }

    /** GROUP BY paths plus the optional window. */
    record Dimensions(List<JsonPathExpr> expressions, Optional<Window> window) implements Expr {
        public Dimensions {
            expressions = List.copyOf(expressions);
            Objects.requireNonNull(window, "window");
        }

        public Dimensions(List<JsonPathExpr> expressions) {
            this(expressions, Optional.empty());
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(expressions);
            window.ifPresent(children::add);
            return List.copyOf(children);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDimensions(this);
        }
    }

    /**
     * Window descriptor handed to the executor as configuration. Construction only rejects
     * missing or negative spans; {@link #validate()} checks the spans against the kind:
     *
     * <ul>
     * <li>{@code TUMBLING}: {@code interval == length > 0}</li>
     * <li>{@code HOPPING}: {@code 0 < interval < length}</li>
     * <li>{@code SLIDING}: {@code length > 0}, zero interval</li>
     * <li>{@code SESSION}: {@code interval} is the inactivity gap and must be positive;
     *     {@code length} caps the session span, zero for unbounded</li>
     * <li>{@code NONE}: both zero</li>
     * </ul>
     */
    record Window(WindowType type, Duration length, Duration interval) implements Expr {
        private static final Window NONE = new Window(WindowType.NONE, Duration.ZERO, Duration.ZERO);

        public Window {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(length, "length");
            Objects.requireNonNull(interval, "interval");
            if (length.isNegative() || interval.isNegative()) {
                throw new IllegalArgumentException("Window spans must not be negative");
            }
        }

        /**
         * Checks that the spans fit the window kind.
         *
         * @return this window
         * @throws IllegalArgumentException if they do not
         */
        public Window validate() {
            switch (type) {
                case NONE -> require(length.isZero() && interval.isZero(), "NONE window has no spans");
                case TUMBLING -> require(!length.isZero() && interval.equals(length),
                    "TUMBLING window advances by its length");
                case HOPPING -> require(!interval.isZero() && interval.compareTo(length) < 0,
                    "HOPPING window advances by less than its length");
                case SLIDING -> require(!length.isZero() && interval.isZero(),
                    "SLIDING window has a length and no interval");
                case SESSION -> require(!interval.isZero(), "SESSION window needs an inactivity gap");
            }
            return this;
        }

        public static Window none() {
            return NONE;
        }

        public static Window tumbling(Duration length) {
            return new Window(WindowType.TUMBLING, length, length);
        }

        public static Window hopping(Duration length, Duration advance) {
            return new Window(WindowType.HOPPING, length, advance);
        }

        public static Window sliding(Duration length) {
            return new Window(WindowType.SLIDING, length, Duration.ZERO);
        }

        public static Window session(Duration gap) {
            return new Window(WindowType.SESSION, Duration.ZERO, gap);
        }

        public static Window session(Duration gap, Duration maxLength) {
            return new Window(WindowType.SESSION, maxLength, gap);
        }

        public boolean isWindowed() {
            return type != WindowType.NONE;
        }

        /** Whether one record can belong to more than one window. */
        public boolean overlaps() {
            return type == WindowType.HOPPING || type == WindowType.SLIDING;
        }

        private static void require(boolean condition, String message) {
            if (!condition) {
                throw new IllegalArgumentException(message);
            }
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitWindow(this);
        }
    }

    /** Binary operation. The operator code is interpreted by the evaluator, not here. */
    record BinaryExpr(int operator, Expr left, Expr right) implements Expr {
        public BinaryExpr {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public List<Expr> children() {
            return List.of(left, right);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * Function invocation. {@code raw} is the invocation as written, kept for diagnostics;
     * the function itself is looked up by name at evaluation time.
     */
    record CallExpr(String raw, String functionName, List<Expr> arguments) implements Expr {
        public CallExpr {
            Objects.requireNonNull(raw, "raw");
            Objects.requireNonNull(functionName, "functionName");
            arguments = List.copyOf(arguments);
        }

        @Override
        public List<Expr> children() {
            return arguments;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public String toString() {
            return raw;
        }
    }

    /**
     * Multi-branch conditional. Case order is significant: the first case whose
     * {@code when} matches wins. A statement without ELSE carries
     * {@code Literal(Node.UNDEFINED)} as its default branch.
     */
    record SwitchExpr(Expr subject, List<CaseExpr> cases, Expr defaultBranch) implements Expr {
        public SwitchExpr {
            Objects.requireNonNull(subject, "subject");
            cases = List.copyOf(cases);
            Objects.requireNonNull(defaultBranch, "defaultBranch");
        }

        /**
         * Returns the {@code then} branch of the first case whose {@code when} satisfies
         * {@code matches}, or the default branch when none does.
         */
        public Expr select(Predicate<? super Expr> matches) {
            for (CaseExpr c : cases) {
                if (matches.test(c.when())) {
                    return c.then();
                }
            }
            return defaultBranch;
        }

        @Override
        public List<Expr> children() {
            List<Expr> children = new ArrayList<>(cases.size() + 2);
            children.add(subject);
            children.addAll(cases);
            children.add(defaultBranch);
            return List.copyOf(children);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSwitch(this);
        }
    }

    record CaseExpr(Expr when, Expr then) implements Expr {
        public CaseExpr {
            Objects.requireNonNull(when, "when");
            Objects.requireNonNull(then, "then");
        }

        @Override
        public List<Expr> children() {
            return List.of(when, then);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCase(this);
        }
    }

    /** Reference to a field of the current record; the path syntax is resolved by the evaluator. */
    record JsonPathExpr(String path) implements Expr {
        public JsonPathExpr {
            Objects.requireNonNull(path, "path");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitJsonPath(this);
        }
    }

    /** A constant written in the query text. */
    record Literal(Node value) implements Expr {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }
}
