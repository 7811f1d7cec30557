package com.pipesql.parser;

import com.pipesql.exception.PipelineParseException;
import com.pipesql.pl.ArrayExpr;
import com.pipesql.pl.Assign;
import com.pipesql.pl.BinaryExpr;
import com.pipesql.pl.BinaryOperator;
import com.pipesql.pl.CaseExpr;
import com.pipesql.pl.Declaration;
import com.pipesql.pl.Expr;
import com.pipesql.pl.FuncCall;
import com.pipesql.pl.FuncDef;
import com.pipesql.pl.Ident;
import com.pipesql.pl.InterpolatedString;
import com.pipesql.pl.Literal;
import com.pipesql.pl.LiteralKind;
import com.pipesql.pl.Param;
import com.pipesql.pl.ParamKind;
import com.pipesql.pl.Pipeline;
import com.pipesql.pl.Query;
import com.pipesql.pl.Range;
import com.pipesql.pl.SourceSpan;
import com.pipesql.pl.TupleExpr;
import com.pipesql.pl.UnaryExpr;
import com.pipesql.pl.UnaryOperator;
import com.pipesql.pl.VarDef;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the PL tree from an ANTLR4 parse tree.
 *
 * <p>Each visit method returns a PL node ({@link Expr}, {@link Declaration},
 * {@link Param} or {@link Query}). Single-step pipelines collapse to their
 * only step, so {@code (a + b)} is just a {@link BinaryExpr}.
 *
 * <p>Interpolated strings are split here; each {@code {expr}} hole is parsed
 * with a fresh {@link PipelineParser} whose spans are anchored at the hole.
 */
public class PlAstBuilder extends PipeSqlBaseVisitor<Object> {

    private final SourceSpan origin;

    /**
     * @param origin position of the parsed text inside the original source;
     *               {@link SourceSpan#SYNTHETIC} for a whole program
     */
    public PlAstBuilder(SourceSpan origin) {
        this.origin = origin;
    }

    // ==================== Program & Declarations ====================

    @Override
    public Query visitProgram(PipeSqlParser.ProgramContext ctx) {
        List<Declaration> declarations = new ArrayList<>();
        for (PipeSqlParser.DeclarationContext decl : ctx.declaration()) {
            declarations.add((Declaration) visit(decl));
        }
        Expr main = ctx.pipeline() != null ? (Expr) visit(ctx.pipeline()) : null;
        return new Query(declarations, main);
    }

    @Override
    public FuncDef visitFuncDecl(PipeSqlParser.FuncDeclContext ctx) {
        List<Param> params = new ArrayList<>();
        for (PipeSqlParser.ParamContext param : ctx.param()) {
            params.add(visitParam(param));
        }
        Expr body = (Expr) visit(ctx.body);
        return new FuncDef(identText(ctx.name), params, body, span(ctx));
    }

    @Override
    public VarDef visitVarDecl(PipeSqlParser.VarDeclContext ctx) {
        return new VarDef(identText(ctx.name), (Expr) visit(ctx.value), span(ctx));
    }

    @Override
    public Param visitParam(PipeSqlParser.ParamContext ctx) {
        ParamKind kind = null;
        if (ctx.kind != null) {
            kind = ParamKind.fromAnnotation(ctx.kind.getText());
            if (kind == null) {
                throw error(ctx.kind, "unknown parameter kind `%s`".formatted(ctx.kind.getText()));
            }
        }
        Expr defaultValue = ctx.defaultValue != null ? (Expr) visit(ctx.defaultValue) : null;
        return new Param(identText(ctx.name), kind, defaultValue);
    }

    // ==================== Pipelines & Calls ====================

    @Override
    public Expr visitPipeline(PipeSqlParser.PipelineContext ctx) {
        return steps(ctx.exprCall(), ctx);
    }

    @Override
    public Expr visitInlinePipeline(PipeSqlParser.InlinePipelineContext ctx) {
        return steps(ctx.exprCall(), ctx);
    }

    private Expr steps(List<PipeSqlParser.ExprCallContext> calls, ParserRuleContext ctx) {
        if (calls.size() == 1) {
            return (Expr) visit(calls.get(0));
        }
        List<Expr> steps = new ArrayList<>(calls.size());
        for (PipeSqlParser.ExprCallContext call : calls) {
            steps.add((Expr) visit(call));
        }
        return new Pipeline(steps, span(ctx));
    }

    @Override
    public Expr visitExprCall(PipeSqlParser.ExprCallContext ctx) {
        if (ctx.funcCall() != null) {
            return (Expr) visit(ctx.funcCall());
        }
        return (Expr) visit(ctx.expr());
    }

    @Override
    public FuncCall visitFuncCall(PipeSqlParser.FuncCallContext ctx) {
        Ident callee = visitIdent(ctx.ident());
        List<Expr> args = new ArrayList<>();
        Map<String, Expr> named = new LinkedHashMap<>();
        for (PipeSqlParser.FuncArgContext arg : ctx.funcArg()) {
            if (arg instanceof PipeSqlParser.NamedArgContext namedArg) {
                String name = identText(namedArg.name);
                if (named.containsKey(name)) {
                    throw error(namedArg.name, "duplicate named argument `%s`".formatted(name));
                }
                named.put(name, (Expr) visit(namedArg.expr()));
            } else if (arg instanceof PipeSqlParser.AssignArgContext assign) {
                args.add(new Assign(identText(assign.alias), (Expr) visit(assign.expr()), span(assign)));
            } else {
                args.add((Expr) visit(((PipeSqlParser.PositionalArgContext) arg).expr()));
            }
        }
        return new FuncCall(callee, args, named, span(ctx));
    }

    // ==================== Operators ====================

    @Override
    public Expr visitExpr(PipeSqlParser.ExprContext ctx) {
        return (Expr) visit(ctx.orExpr());
    }

    @Override
    public Expr visitOrExpr(PipeSqlParser.OrExprContext ctx) {
        return foldLeft(ctx.andExpr(), BinaryOperator.OR);
    }

    @Override
    public Expr visitAndExpr(PipeSqlParser.AndExprContext ctx) {
        return foldLeft(ctx.coalesceExpr(), BinaryOperator.AND);
    }

    @Override
    public Expr visitCoalesceExpr(PipeSqlParser.CoalesceExprContext ctx) {
        return foldLeft(ctx.compareExpr(), BinaryOperator.COALESCE);
    }

    private Expr foldLeft(List<? extends ParserRuleContext> operands, BinaryOperator op) {
        Expr result = (Expr) visit(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            Expr right = (Expr) visit(operands.get(i));
            result = new BinaryExpr(result, op, right, span(operands.get(0), operands.get(i)));
        }
        return result;
    }

    @Override
    public Expr visitCompareExpr(PipeSqlParser.CompareExprContext ctx) {
        Expr left = (Expr) visit(ctx.addExpr(0));
        if (ctx.compareOp() == null) {
            return left;
        }
        Expr right = (Expr) visit(ctx.addExpr(1));
        BinaryOperator op = BinaryOperator.fromSymbol(ctx.compareOp().getText());
        return new BinaryExpr(left, op, right, span(ctx));
    }

    @Override
    public Expr visitAddExpr(PipeSqlParser.AddExprContext ctx) {
        Expr result = (Expr) visit(ctx.mulExpr(0));
        for (int i = 1; i < ctx.mulExpr().size(); i++) {
            BinaryOperator op = BinaryOperator.fromSymbol(ctx.addOp(i - 1).getText());
            Expr right = (Expr) visit(ctx.mulExpr(i));
            result = new BinaryExpr(result, op, right, span(ctx.mulExpr(0), ctx.mulExpr(i)));
        }
        return result;
    }

    @Override
    public Expr visitMulExpr(PipeSqlParser.MulExprContext ctx) {
        Expr result = (Expr) visit(ctx.rangeExpr(0));
        for (int i = 1; i < ctx.rangeExpr().size(); i++) {
            BinaryOperator op = BinaryOperator.fromSymbol(ctx.mulOp(i - 1).getText());
            Expr right = (Expr) visit(ctx.rangeExpr(i));
            result = new BinaryExpr(result, op, right, span(ctx.rangeExpr(0), ctx.rangeExpr(i)));
        }
        return result;
    }

    @Override
    public Expr visitRangeExpr(PipeSqlParser.RangeExprContext ctx) {
        if (ctx.RANGE() == null) {
            return (Expr) visit(ctx.lo);
        }
        Expr start = ctx.lo != null ? (Expr) visit(ctx.lo) : null;
        Expr end = ctx.hi != null ? (Expr) visit(ctx.hi) : null;
        return new Range(start, end, span(ctx));
    }

    @Override
    public Expr visitUnaryExpr(PipeSqlParser.UnaryExprContext ctx) {
        if (ctx.op == null) {
            return (Expr) visit(ctx.term());
        }
        UnaryOperator op = switch (ctx.op.getType()) {
            case PipeSqlLexer.MINUS -> UnaryOperator.NEG;
            case PipeSqlLexer.PLUS -> UnaryOperator.POS;
            case PipeSqlLexer.BANG -> UnaryOperator.NOT;
            case PipeSqlLexer.EQ -> UnaryOperator.SELF_EQ;
            default -> throw error(ctx.op, "unexpected operator `%s`".formatted(ctx.op.getText()));
        };
        return new UnaryExpr(op, (Expr) visit(ctx.unaryExpr()), span(ctx));
    }

    // ==================== Terms ====================

    @Override
    public Expr visitLiteralTerm(PipeSqlParser.LiteralTermContext ctx) {
        return visitLiteral(ctx.literal());
    }

    @Override
    public Expr visitIdentTerm(PipeSqlParser.IdentTermContext ctx) {
        return visitIdent(ctx.ident());
    }

    @Override
    public Expr visitTupleTerm(PipeSqlParser.TupleTermContext ctx) {
        return visitTuple(ctx.tuple());
    }

    @Override
    public Expr visitArrayTerm(PipeSqlParser.ArrayTermContext ctx) {
        return visitArray(ctx.array());
    }

    @Override
    public Expr visitCaseTerm(PipeSqlParser.CaseTermContext ctx) {
        return visitCaseExpr(ctx.caseExpr());
    }

    @Override
    public Expr visitInterpolationTerm(PipeSqlParser.InterpolationTermContext ctx) {
        return visitInterpolation(ctx.interpolation());
    }

    @Override
    public Expr visitNestedPipeline(PipeSqlParser.NestedPipelineContext ctx) {
        return (Expr) visit(ctx.pipeline());
    }

    @Override
    public TupleExpr visitTuple(PipeSqlParser.TupleContext ctx) {
        List<Expr> fields = new ArrayList<>();
        for (PipeSqlParser.TupleFieldContext field : ctx.tupleField()) {
            Expr value = (Expr) visit(field.exprCall());
            fields.add(field.alias != null ? new Assign(identText(field.alias), value, span(field)) : value);
        }
        return new TupleExpr(fields, span(ctx));
    }

    @Override
    public ArrayExpr visitArray(PipeSqlParser.ArrayContext ctx) {
        List<Expr> items = new ArrayList<>();
        for (PipeSqlParser.ExprCallContext item : ctx.exprCall()) {
            items.add((Expr) visit(item));
        }
        return new ArrayExpr(items, span(ctx));
    }

    @Override
    public CaseExpr visitCaseExpr(PipeSqlParser.CaseExprContext ctx) {
        List<CaseExpr.Arm> arms = new ArrayList<>();
        for (PipeSqlParser.CaseArmContext arm : ctx.caseArm()) {
            arms.add(new CaseExpr.Arm((Expr) visit(arm.condition), (Expr) visit(arm.value)));
        }
        return new CaseExpr(arms, span(ctx));
    }

    @Override
    public Ident visitIdent(PipeSqlParser.IdentContext ctx) {
        List<String> parts = new ArrayList<>();
        for (TerminalNode node : ctx.IDENT()) {
            parts.add(identText(node.getSymbol()));
        }
        return new Ident(parts, span(ctx));
    }

    @Override
    public Literal visitLiteral(PipeSqlParser.LiteralContext ctx) {
        Token token = ctx.getStart();
        String text = token.getText();
        SourceSpan span = span(ctx);
        return switch (token.getType()) {
            case PipeSqlLexer.INTEGER -> {
                try {
                    yield new Literal(Long.parseLong(text.replace("_", "")), LiteralKind.INTEGER, span);
                } catch (NumberFormatException e) {
                    throw error(token, "integer literal out of range: " + text);
                }
            }
            case PipeSqlLexer.FLOAT -> new Literal(Double.parseDouble(text.replace("_", "")), LiteralKind.FLOAT, span);
            case PipeSqlLexer.STRING -> new Literal(unquote(text), LiteralKind.STRING, span);
            case PipeSqlLexer.TRUE -> new Literal(Boolean.TRUE, LiteralKind.BOOLEAN, span);
            case PipeSqlLexer.FALSE -> new Literal(Boolean.FALSE, LiteralKind.BOOLEAN, span);
            case PipeSqlLexer.NULL -> new Literal(null, LiteralKind.NULL, span);
            case PipeSqlLexer.DATE_TIME -> dateTime(text.substring(1), span);
            default -> throw error(token, "unexpected literal `%s`".formatted(text));
        };
    }

    private static Literal dateTime(String text, SourceSpan span) {
        if (text.contains("T")) {
            return new Literal(text, LiteralKind.TIMESTAMP, span);
        }
        if (text.contains(":")) {
            return new Literal(text, LiteralKind.TIME, span);
        }
        return new Literal(text, LiteralKind.DATE, span);
    }

    // ==================== Interpolated Strings ====================

    @Override
    public InterpolatedString visitInterpolation(PipeSqlParser.InterpolationContext ctx) {
        Token token = ctx.getStart();
        InterpolatedString.Flavor flavor = token.getType() == PipeSqlLexer.S_STRING
            ? InterpolatedString.Flavor.SQL
            : InterpolatedString.Flavor.FORMAT;
        // strip the s/f prefix; the body keeps its quotes
        String body = unquote(token.getText().substring(1));

        List<InterpolatedString.Part> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c == '{' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                text.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < body.length() && body.charAt(i + 1) == '}') {
                text.append('}');
                i += 2;
            } else if (c == '{') {
                int close = matchingBrace(body, i, token);
                if (text.length() > 0) {
                    parts.add(new InterpolatedString.Text(text.toString()));
                    text.setLength(0);
                }
                SourceSpan holeOrigin = new SourceSpan(
                    absoluteOffset(token) + i + 3, close - i - 1,
                    absoluteLine(token), absoluteColumn(token) + i + 3);
                Expr hole = new PipelineParser().parseFragment(body.substring(i + 1, close), holeOrigin);
                parts.add(new InterpolatedString.Hole(hole));
                i = close + 1;
            } else {
                text.append(c);
                i++;
            }
        }
        if (text.length() > 0) {
            parts.add(new InterpolatedString.Text(text.toString()));
        }
        return new InterpolatedString(flavor, parts, span(ctx));
    }

    private int matchingBrace(String body, int open, Token token) {
        int depth = 0;
        for (int i = open; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        throw error(token, "unclosed `{` in interpolated string");
    }

    // ==================== Helpers ====================

    private static String identText(Token token) {
        String text = token.getText();
        if (text.length() >= 2 && text.startsWith("`") && text.endsWith("`")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    static String unquote(String quoted) {
        String inner = quoted.substring(1, quoted.length() - 1);
        if (inner.indexOf('\\') < 0) {
            return inner;
        }
        StringBuilder sb = new StringBuilder(inner.length());
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '\\' && i + 1 < inner.length()) {
                char next = inner.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private SourceSpan span(ParserRuleContext ctx) {
        return span(ctx, ctx);
    }

    private SourceSpan span(ParserRuleContext first, ParserRuleContext last) {
        Token start = first.getStart();
        Token stop = last.getStop() != null ? last.getStop() : start;
        int length = Math.max(stop.getStopIndex() - start.getStartIndex() + 1, 0);
        return new SourceSpan(absoluteOffset(start), length, absoluteLine(start), absoluteColumn(start));
    }

    private int absoluteOffset(Token token) {
        return origin.offset() + token.getStartIndex();
    }

    private int absoluteLine(Token token) {
        if (origin.equals(SourceSpan.SYNTHETIC)) {
            return token.getLine();
        }
        return origin.line() + token.getLine() - 1;
    }

    private int absoluteColumn(Token token) {
        if (token.getLine() == 1) {
            return origin.column() + token.getCharPositionInLine();
        }
        return token.getCharPositionInLine();
    }

    private PipelineParseException error(Token token, String message) {
        return new PipelineParseException(absoluteLine(token), absoluteColumn(token), token.getText(), message);
    }
}
