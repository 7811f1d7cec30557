package com.pipesql.generator;

import com.pipesql.dialect.DialectDescriptor;
import com.pipesql.exception.SQLGenerationException;
import com.pipesql.functions.BuiltinFunction;
import com.pipesql.functions.FunctionCategory;
import com.pipesql.functions.FunctionRegistry;
import com.pipesql.rq.ColumnDecl;
import com.pipesql.rq.ColumnId;
import com.pipesql.rq.ColumnKind;
import com.pipesql.rq.RqExpr;
import com.pipesql.rq.RqOperator;
import com.pipesql.rq.RqQuery;
import com.pipesql.rq.SortDirection;
import com.pipesql.rq.SortKey;
import com.pipesql.rq.Ty;
import com.pipesql.rq.WindowFrame;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders RQ expressions to SQL text for one dialect.
 *
 * <p>Each result carries its binding strength so that callers add
 * parentheses only where the surrounding operator binds tighter.
 */
final class ExpressionRenderer {

    static final int LOWEST = 0;
    static final int OR = 1;
    static final int AND = 2;
    static final int NOT = 3;
    static final int COMPARISON = 4;
    static final int ADDITIVE = 5;
    static final int MULTIPLICATIVE = 6;
    static final int UNARY = 7;
    static final int ATOMIC = 10;

    private static final Pattern CALL_FORM = Pattern.compile("[A-Za-z_]+\\((?:%s(?:, )?)*\\)");

    /**
     * Rendered SQL with its precedence and whether it contains window or
     * aggregate calls.
     */
    record Rendered(String sql, int precedence, boolean window, boolean aggregate) {

        static Rendered atomic(String sql) {
            return new Rendered(sql, ATOMIC, false, false);
        }
    }

    /**
     * The window a windowed compute is evaluated over.
     *
     * @param spec PARTITION BY and ORDER BY text, possibly empty
     * @param frame ROWS/RANGE frame text, or null for the default frame
     */
    record Over(String spec, String frame) {
    }

    private final DialectDescriptor dialect;
    private final RqQuery query;

    ExpressionRenderer(DialectDescriptor dialect, RqQuery query) {
        this.dialect = dialect;
        this.query = query;
    }

    Rendered render(RqExpr expr, QueryBlock block) {
        return render(expr, block, null);
    }

    Rendered render(RqExpr expr, QueryBlock block, Over over) {
        if (expr instanceof RqExpr.ColumnRef ref) {
            return column(block, ref.column());
        } else if (expr instanceof RqExpr.Constant constant) {
            return constant(constant);
        } else if (expr instanceof RqExpr.Unary unary) {
            return unary(unary, block, over);
        } else if (expr instanceof RqExpr.Binary binary) {
            return binary(binary, block, over);
        } else if (expr instanceof RqExpr.FunctionCall call) {
            return function(call, block, over);
        } else if (expr instanceof RqExpr.Case caseExpr) {
            return caseWhen(caseExpr, block, over);
        } else if (expr instanceof RqExpr.Between between) {
            return between(between, block, over);
        } else if (expr instanceof RqExpr.RawSql raw) {
            return raw(raw, block, over);
        }
        throw new IllegalStateException("Unknown expression: " + expr);
    }

    /**
     * Renders a column reference as seen from the block.
     *
     * @throws IllegalStateException if the column is not visible in the block
     */
    Rendered column(QueryBlock block, ColumnId id) {
        QueryBlock.Entry entry = block.scope.get(id);
        if (entry == null) {
            ColumnDecl decl = query.column(id);
            String qualifier = decl.kind() == ColumnKind.TABLE && decl.wildcard() != null
                ? block.wildcardQualifiers.get(decl.wildcard())
                : null;
            if (qualifier == null) {
                throw new IllegalStateException("Column " + id + " (" + decl.name() + ") is not in scope");
            }
            entry = new QueryBlock.Source(qualifier, decl.name());
        }
        if (entry instanceof QueryBlock.Computed computed) {
            return computed.rendered();
        }
        QueryBlock.Source source = (QueryBlock.Source) entry;
        String name = SQLQuoting.quoteIdentifierIfNeeded(source.name(), dialect);
        return Rendered.atomic(block.joined ? source.qualifier() + "." + name : name);
    }

    List<String> orderBy(List<SortKey> keys, QueryBlock block) {
        List<String> result = new ArrayList<>();
        for (SortKey key : keys) {
            String sql = render(key.expr(), block).sql();
            result.add(key.direction() == SortDirection.DESC ? sql + " DESC" : sql);
        }
        return result;
    }

    /**
     * Renders a frame clause. An unbounded frame is only spelled out when an
     * ordering would otherwise narrow it to the running default.
     */
    String frame(WindowFrame frame, boolean ordered) {
        if (frame.isUnbounded()) {
            return ordered ? "ROWS BETWEEN UNBOUNDED PRECEDING AND UNBOUNDED FOLLOWING" : null;
        }
        return frame.unit().name() + " BETWEEN " + bound(frame.start(), true) + " AND " + bound(frame.end(), false);
    }

    static String wrap(Rendered rendered, int minimum) {
        return rendered.precedence() < minimum ? "(" + rendered.sql() + ")" : rendered.sql();
    }

    // ==================== Literals ====================

    private Rendered constant(RqExpr.Constant constant) {
        Object value = constant.value();
        if (value == null || constant.type() == Ty.NULL) {
            return Rendered.atomic("NULL");
        }
        String sql;
        switch (constant.type()) {
            case BOOL:
                sql = Boolean.TRUE.equals(value) ? "TRUE" : "FALSE";
                break;
            case TEXT:
                sql = SQLQuoting.quoteLiteral(value.toString());
                break;
            case DATE:
                sql = "DATE " + SQLQuoting.quoteLiteral(value.toString());
                break;
            case TIME:
                sql = "TIME " + SQLQuoting.quoteLiteral(value.toString());
                break;
            case TIMESTAMP:
                sql = "TIMESTAMP " + SQLQuoting.quoteLiteral(value.toString().replace('T', ' '));
                break;
            default:
                sql = number(value);
                break;
        }
        int precedence = sql.startsWith("-") ? UNARY : ATOMIC;
        return new Rendered(sql, precedence, false, false);
    }

    private static String number(Object value) {
        if (value instanceof Double d) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        return value.toString();
    }

    // ==================== Operators ====================

    private Rendered unary(RqExpr.Unary unary, QueryBlock block, Over over) {
        Rendered operand = render(unary.operand(), block, over);
        String sql;
        int precedence;
        switch (unary.operator()) {
            case NEG: {
                String inner = wrap(operand, UNARY);
                // "--" would start a comment
                sql = inner.startsWith("-") ? "-(" + inner + ")" : "-" + inner;
                precedence = UNARY;
                break;
            }
            case NOT:
                sql = "NOT " + wrap(operand, NOT);
                precedence = NOT;
                break;
            case IS_NULL:
                sql = wrap(operand, ADDITIVE) + " IS NULL";
                precedence = COMPARISON;
                break;
            case IS_NOT_NULL:
                sql = wrap(operand, ADDITIVE) + " IS NOT NULL";
                precedence = COMPARISON;
                break;
            default:
                throw new IllegalStateException("Not a unary operator: " + unary.operator());
        }
        return new Rendered(sql, precedence, operand.window(), operand.aggregate());
    }

    private Rendered binary(RqExpr.Binary binary, QueryBlock block, Over over) {
        Rendered left = render(binary.left(), block, over);
        Rendered right = render(binary.right(), block, over);
        boolean window = left.window() || right.window();
        boolean aggregate = left.aggregate() || right.aggregate();
        RqOperator op = binary.operator();

        if (op == RqOperator.REGEX_MATCH) {
            String template = dialect.regexMatchTemplate();
            if (template == null) {
                throw SQLGenerationException.unsupported(dialect.name(), "regex match (~=)");
            }
            return templated(template, left, right, COMPARISON, ADDITIVE, window, aggregate);
        }
        if (op == RqOperator.INT_DIV) {
            return templated(dialect.intDivTemplate(), left, right, MULTIPLICATIVE, MULTIPLICATIVE + 1,
                window, aggregate);
        }

        int precedence = precedence(op);
        boolean associative = op == RqOperator.ADD || op == RqOperator.MUL
            || op == RqOperator.AND || op == RqOperator.OR;
        int leftMinimum = precedence == COMPARISON ? precedence + 1 : precedence;
        int rightMinimum = associative ? precedence : precedence + 1;
        String sql = wrap(left, leftMinimum) + " " + symbol(op) + " " + wrap(right, rightMinimum);
        return new Rendered(sql, precedence, window, aggregate);
    }

    /**
     * Fills a dialect template. Call-shaped templates need no parentheses
     * around their arguments; operator-shaped ones bind at the given level.
     */
    private static Rendered templated(String template, Rendered left, Rendered right, int precedence,
                                      int argumentMinimum, boolean window, boolean aggregate) {
        boolean enclosed = template.endsWith(")")
            && (template.startsWith("(") || Character.isLetter(template.charAt(0)));
        boolean callForm = CALL_FORM.matcher(template).matches();
        String l = callForm ? left.sql() : wrap(left, argumentMinimum);
        String r = callForm ? right.sql() : wrap(right, argumentMinimum);
        return new Rendered(template.formatted(l, r), enclosed ? ATOMIC : precedence, window, aggregate);
    }

    private static int precedence(RqOperator op) {
        switch (op) {
            case MUL:
            case DIV:
            case MOD:
                return MULTIPLICATIVE;
            case ADD:
            case SUB:
                return ADDITIVE;
            case EQ:
            case NE:
            case GT:
            case GTE:
            case LT:
            case LTE:
                return COMPARISON;
            case AND:
                return AND;
            case OR:
                return OR;
            default:
                throw new IllegalStateException("No precedence for " + op);
        }
    }

    private static String symbol(RqOperator op) {
        switch (op) {
            case MUL: return "*";
            case DIV: return "/";
            case MOD: return "%";
            case ADD: return "+";
            case SUB: return "-";
            case EQ: return "=";
            case NE: return "<>";
            case GT: return ">";
            case GTE: return ">=";
            case LT: return "<";
            case LTE: return "<=";
            case AND: return "AND";
            case OR: return "OR";
            default: throw new IllegalStateException("Not a binary operator: " + op);
        }
    }

    // ==================== Functions ====================

    private Rendered function(RqExpr.FunctionCall call, QueryBlock block, Over over) {
        BuiltinFunction function = FunctionRegistry.lookup(call.name())
            .orElseThrow(() -> new IllegalStateException("Unknown function: " + call.name()));
        if (function.template(dialect.name()) == null) {
            throw SQLGenerationException.unsupported(dialect.name(), "function `" + function.name() + "`");
        }
        boolean operatorForm = function.needsParenthesizedArguments(dialect.name());
        boolean window = false;
        boolean aggregate = false;
        List<String> args = new ArrayList<>();
        for (RqExpr arg : call.args()) {
            Rendered rendered = render(arg, block, over);
            window |= rendered.window();
            aggregate |= rendered.aggregate();
            args.add(operatorForm ? wrap(rendered, ATOMIC) : rendered.sql());
        }
        String sql = FunctionRegistry.translate(function.name(), dialect, args);
        int precedence = operatorForm && !(sql.startsWith("(") && sql.endsWith(")")) ? COMPARISON : ATOMIC;

        FunctionCategory category = function.category();
        if (over != null && category != FunctionCategory.SCALAR) {
            List<String> parts = new ArrayList<>();
            if (!over.spec().isEmpty()) {
                parts.add(over.spec());
            }
            boolean framed = category == FunctionCategory.AGGREGATE
                || function.name().equals("first") || function.name().equals("last");
            if (framed && over.frame() != null) {
                parts.add(over.frame());
            }
            return new Rendered(sql + " OVER (" + String.join(" ", parts) + ")", ATOMIC, true, false);
        }
        return new Rendered(sql, precedence,
            window || category == FunctionCategory.WINDOW,
            aggregate || category == FunctionCategory.AGGREGATE);
    }

    // ==================== Other Expressions ====================

    private Rendered caseWhen(RqExpr.Case caseExpr, QueryBlock block, Over over) {
        StringBuilder sql = new StringBuilder("CASE");
        boolean window = false;
        boolean aggregate = false;
        for (RqExpr.Branch branch : caseExpr.branches()) {
            Rendered condition = render(branch.condition(), block, over);
            Rendered value = render(branch.value(), block, over);
            sql.append(" WHEN ").append(condition.sql()).append(" THEN ").append(value.sql());
            window |= condition.window() || value.window();
            aggregate |= condition.aggregate() || value.aggregate();
        }
        if (caseExpr.otherwise() != null) {
            Rendered otherwise = render(caseExpr.otherwise(), block, over);
            sql.append(" ELSE ").append(otherwise.sql());
            window |= otherwise.window();
            aggregate |= otherwise.aggregate();
        }
        sql.append(" END");
        return new Rendered(sql.toString(), ATOMIC, window, aggregate);
    }

    private Rendered between(RqExpr.Between between, QueryBlock block, Over over) {
        Rendered operand = render(between.operand(), block, over);
        Rendered low = render(between.low(), block, over);
        Rendered high = render(between.high(), block, over);
        String sql = wrap(operand, ADDITIVE) + " BETWEEN " + wrap(low, ADDITIVE) + " AND " + wrap(high, ADDITIVE);
        return new Rendered(sql, COMPARISON,
            operand.window() || low.window() || high.window(),
            operand.aggregate() || low.aggregate() || high.aggregate());
    }

    private Rendered raw(RqExpr.RawSql raw, QueryBlock block, Over over) {
        StringBuilder sql = new StringBuilder();
        boolean window = false;
        boolean aggregate = false;
        for (Object part : raw.parts()) {
            if (part instanceof RqExpr expr) {
                Rendered rendered = render(expr, block, over);
                sql.append(rendered.sql());
                window |= rendered.window();
                aggregate |= rendered.aggregate();
            } else {
                sql.append(part);
            }
        }
        return new Rendered(sql.toString(), LOWEST, window, aggregate);
    }

    private static String bound(Long offset, boolean start) {
        if (offset == null) {
            return start ? "UNBOUNDED PRECEDING" : "UNBOUNDED FOLLOWING";
        }
        if (offset == 0) {
            return "CURRENT ROW";
        }
        return offset < 0 ? (-offset) + " PRECEDING" : offset + " FOLLOWING";
    }
}
