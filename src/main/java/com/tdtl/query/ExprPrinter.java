package com.tdtl.query;

import com.tdtl.json.JsonWriter;
import com.tdtl.value.Type;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Renders an expression tree as query text, mainly for logs and error messages.
 *
 * <p>Binary operator codes mean nothing to the tree, so their spelling is supplied by
 * the caller; the default prints {@code op<code>}.
 */
public class ExprPrinter implements ExprVisitor<String> {

    private final IntFunction<String> operatorNames;

    public ExprPrinter() {
        this(code -> "op" + code);
    }

    public ExprPrinter(IntFunction<String> operatorNames) {
        this.operatorNames = Objects.requireNonNull(operatorNames, "operatorNames");
    }

    public String print(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public String visitSelect(Expr.SelectStatement select) {
        StringBuilder sb = new StringBuilder("SELECT ")
            .append(print(select.fields()))
            .append(" FROM ")
            .append(print(select.topic()));
        select.filter().ifPresent(filter -> sb.append(" WHERE ").append(print(filter)));
        select.dimensions().ifPresent(dimensions -> sb.append(print(dimensions)));
        return sb.toString();
    }

    @Override
    public String visitFields(Expr.Fields fields) {
        return fields.fields().stream().map(this::print).collect(Collectors.joining(", "));
    }

    @Override
    public String visitField(Expr.Field field) {
        String expression = print(field.expression());
        return field.alias().map(alias -> expression + " AS " + alias).orElse(expression);
    }

    @Override
    public String visitTopic(Expr.Topic topic) {
        return String.join(", ", topic.names());
    }

    @Override
    public String visitFilter(Expr.Filter filter) {
        return print(filter.expression());
    }

    @Override
    public String visitDimensions(Expr.Dimensions dimensions) {
        StringBuilder sb = new StringBuilder();
        if (!dimensions.expressions().isEmpty()) {
            sb.append(" GROUP BY ")
                .append(dimensions.expressions().stream().map(this::print).collect(Collectors.joining(", ")));
        }
        dimensions.window()
            .filter(Expr.Window::isWindowed)
            .ifPresent(window -> sb.append(" WINDOW ").append(print(window)));
        return sb.toString();
    }

    @Override
    public String visitWindow(Expr.Window window) {
        return switch (window.type()) {
            case TUMBLING, SLIDING -> window.type() + "(" + span(window.length()) + ")";
            case HOPPING -> window.type() + "(" + span(window.length()) + ", " + span(window.interval()) + ")";
            case SESSION -> window.length().isZero()
                ? window.type() + "(" + span(window.interval()) + ")"
                : window.type() + "(" + span(window.interval()) + ", " + span(window.length()) + ")";
            default -> window.type().toString();
        };
    }

    @Override
    public String visitBinary(Expr.BinaryExpr binary) {
        return "(" + print(binary.left()) + " " + operatorNames.apply(binary.operator()) + " "
            + print(binary.right()) + ")";
    }

    @Override
    public String visitCall(Expr.CallExpr call) {
        return call.raw();
    }

    @Override
    public String visitSwitch(Expr.SwitchExpr switchExpr) {
        StringBuilder sb = new StringBuilder("CASE ").append(print(switchExpr.subject()));
        switchExpr.cases().forEach(c -> sb.append(' ').append(print(c)));
        if (switchExpr.defaultBranch() instanceof Expr.Literal literal
            && literal.value().type() == Type.UNDEFINED) {
            return sb.append(" END").toString();
        }
        return sb.append(" ELSE ").append(print(switchExpr.defaultBranch())).append(" END").toString();
    }

    @Override
    public String visitCase(Expr.CaseExpr caseExpr) {
        return "WHEN " + print(caseExpr.when()) + " THEN " + print(caseExpr.then());
    }

    @Override
    public String visitJsonPath(Expr.JsonPathExpr path) {
        return path.path();
    }

    @Override
    public String visitLiteral(Expr.Literal literal) {
        if (literal.value().type() == Type.STRING) {
            return JsonWriter.quote(literal.value().toString());
        }
        return literal.value().toString();
    }

    private static String span(Duration duration) {
        if (duration.getNano() == 0) {
            return duration.toSeconds() + "s";
        }
        return duration.toMillis() + "ms";
    }
}
