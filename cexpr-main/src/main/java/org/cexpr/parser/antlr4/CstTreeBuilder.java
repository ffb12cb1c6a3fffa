package org.cexpr.parser.antlr4;

import java.util.ArrayList;
import java.util.List;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cexpr.InvalidNodeStructureException;
import org.cexpr.cst.CstKind;
import org.cexpr.cst.SyntaxNode;

/**
 * Converts an ANTLR parse tree of the {@code CExpression} grammar into {@link SyntaxNode}s.
 * <p>
 * Every labelled expression alternative becomes one node of the matching {@link CstKind}. Unary
 * and binary forms of the same operator family share a kind ({@code -a} and {@code a - b} are
 * both {@code math_expression}) and are told apart by their number of named children. Tokens
 * become anonymous leaves, except identifiers, which are named leaves.
 * <p>
 * Trees nested deeper than {@link #MAX_DEPTH} are rejected, so the recursive walk over the
 * result stays within the thread's stack.
 */
class CstTreeBuilder extends CExpressionBaseVisitor<SyntaxNode> {

    static final int MAX_DEPTH = 256;

    private final String source;
    private final boolean surrogates;
    private int depth;

    CstTreeBuilder(String source) {
        this.source = source;
        this.surrogates = source.length() != source.codePointCount(0, source.length());
    }

    @Override
    public SyntaxNode visitTranslationUnit(CExpressionParser.TranslationUnitContext ctx) {
        return node(CstKind.TRANSLATION_UNIT, ctx);
    }

    @Override
    public SyntaxNode visitExpressionStatement(CExpressionParser.ExpressionStatementContext ctx) {
        return node(CstKind.EXPRESSION_STATEMENT, ctx);
    }

    // Leaves

    @Override
    public SyntaxNode visitNumberLiteral(CExpressionParser.NumberLiteralContext ctx) {
        return leaf(CstKind.NUMBER_LITERAL, ctx);
    }

    @Override
    public SyntaxNode visitCharLiteral(CExpressionParser.CharLiteralContext ctx) {
        return leaf(CstKind.CHAR_LITERAL, ctx);
    }

    @Override
    public SyntaxNode visitStringLiteral(CExpressionParser.StringLiteralContext ctx) {
        if (ctx.StringLiteral().size() == 1) {
            return leaf(CstKind.STRING_LITERAL, ctx);
        }
        List<SyntaxNode> parts = new ArrayList<>();
        for (TerminalNode part : ctx.StringLiteral()) {
            parts.add(namedLeaf(CstKind.STRING_LITERAL, part.getSymbol()));
        }
        return SyntaxNode.named(CstKind.CONCATENATED_STRING, source, start(ctx), end(ctx), parts);
    }

    @Override
    public SyntaxNode visitBooleanLiteral(CExpressionParser.BooleanLiteralContext ctx) {
        return leaf(ctx.value.getText().equals("true") ? CstKind.TRUE : CstKind.FALSE, ctx);
    }

    @Override
    public SyntaxNode visitIdentifier(CExpressionParser.IdentifierContext ctx) {
        return leaf(CstKind.IDENTIFIER, ctx);
    }

    @Override
    public SyntaxNode visitQualifiedIdentifier(CExpressionParser.QualifiedIdentifierContext ctx) {
        return node(CstKind.QUALIFIED_IDENTIFIER, ctx);
    }

    // Structural expressions

    @Override
    public SyntaxNode visitParenthesizedExpression(CExpressionParser.ParenthesizedExpressionContext ctx) {
        return node(CstKind.PARENTHESIZED_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitSizeofTypeExpression(CExpressionParser.SizeofTypeExpressionContext ctx) {
        return node(CstKind.SIZEOF_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitSizeofExpression(CExpressionParser.SizeofExpressionContext ctx) {
        return node(CstKind.SIZEOF_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitCastExpression(CExpressionParser.CastExpressionContext ctx) {
        return node(CstKind.CAST_EXPRESSION, ctx);
    }

    // Unary forms

    @Override
    public SyntaxNode visitMathUnaryExpression(CExpressionParser.MathUnaryExpressionContext ctx) {
        return node(CstKind.MATH_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitLogicalNotExpression(CExpressionParser.LogicalNotExpressionContext ctx) {
        return node(CstKind.LOGICAL_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitBitwiseNotExpression(CExpressionParser.BitwiseNotExpressionContext ctx) {
        return node(CstKind.BITWISE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitPointerExpression(CExpressionParser.PointerExpressionContext ctx) {
        return node(CstKind.POINTER_EXPRESSION, ctx);
    }

    // Binary forms

    @Override
    public SyntaxNode visitMultiplicativeExpression(CExpressionParser.MultiplicativeExpressionContext ctx) {
        return node(CstKind.MATH_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitAdditiveExpression(CExpressionParser.AdditiveExpressionContext ctx) {
        return node(CstKind.MATH_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitShiftExpression(CExpressionParser.ShiftExpressionContext ctx) {
        return node(CstKind.SHIFT_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitRelationalExpression(CExpressionParser.RelationalExpressionContext ctx) {
        return node(CstKind.RELATIONAL_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitEqualityExpression(CExpressionParser.EqualityExpressionContext ctx) {
        return node(CstKind.EQUALITY_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitBitwiseAndExpression(CExpressionParser.BitwiseAndExpressionContext ctx) {
        return node(CstKind.BITWISE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitBitwiseXorExpression(CExpressionParser.BitwiseXorExpressionContext ctx) {
        return node(CstKind.BITWISE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitBitwiseOrExpression(CExpressionParser.BitwiseOrExpressionContext ctx) {
        return node(CstKind.BITWISE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitLogicalAndExpression(CExpressionParser.LogicalAndExpressionContext ctx) {
        return node(CstKind.LOGICAL_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitLogicalOrExpression(CExpressionParser.LogicalOrExpressionContext ctx) {
        return node(CstKind.LOGICAL_EXPRESSION, ctx);
    }

    // Recognized but untranslatable

    @Override
    public SyntaxNode visitCallExpression(CExpressionParser.CallExpressionContext ctx) {
        return node(CstKind.CALL_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitArgumentList(CExpressionParser.ArgumentListContext ctx) {
        return node(CstKind.ARGUMENT_LIST, ctx);
    }

    @Override
    public SyntaxNode visitSubscriptExpression(CExpressionParser.SubscriptExpressionContext ctx) {
        return node(CstKind.SUBSCRIPT_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitFieldExpression(CExpressionParser.FieldExpressionContext ctx) {
        List<SyntaxNode> raw = new ArrayList<>();
        raw.add(visit(ctx.expression()));
        raw.add(SyntaxNode.token(source, offset(ctx.op.getStartIndex()), offset(ctx.op.getStopIndex() + 1)));
        raw.add(namedLeaf(CstKind.FIELD_IDENTIFIER, ctx.Identifier().getSymbol()));
        return SyntaxNode.named(CstKind.FIELD_EXPRESSION, source, start(ctx), end(ctx), raw);
    }

    @Override
    public SyntaxNode visitPostfixUpdateExpression(CExpressionParser.PostfixUpdateExpressionContext ctx) {
        return node(CstKind.UPDATE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitPrefixUpdateExpression(CExpressionParser.PrefixUpdateExpressionContext ctx) {
        return node(CstKind.UPDATE_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitConditionalExpression(CExpressionParser.ConditionalExpressionContext ctx) {
        return node(CstKind.CONDITIONAL_EXPRESSION, ctx);
    }

    @Override
    public SyntaxNode visitAssignmentExpression(CExpressionParser.AssignmentExpressionContext ctx) {
        return node(CstKind.ASSIGNMENT_EXPRESSION, ctx);
    }

    // Types

    @Override
    public SyntaxNode visitTypeDescriptor(CExpressionParser.TypeDescriptorContext ctx) {
        return node(CstKind.TYPE_DESCRIPTOR, ctx);
    }

    @Override
    public SyntaxNode visitTypeSpecifier(CExpressionParser.TypeSpecifierContext ctx) {
        if (ctx.Identifier() != null) {
            return namedLeaf(CstKind.TYPE_IDENTIFIER, ctx.Identifier().getSymbol());
        }
        return visit(ctx.getChild(0));
    }

    @Override
    public SyntaxNode visitSizedTypeSpecifier(CExpressionParser.SizedTypeSpecifierContext ctx) {
        return node(CstKind.SIZED_TYPE_SPECIFIER, ctx);
    }

    @Override
    public SyntaxNode visitPrimitiveType(CExpressionParser.PrimitiveTypeContext ctx) {
        return leaf(CstKind.PRIMITIVE_TYPE, ctx);
    }

    @Override
    public SyntaxNode visitStructSpecifier(CExpressionParser.StructSpecifierContext ctx) {
        List<SyntaxNode> raw = new ArrayList<>();
        Token keyword = ctx.getStart();
        raw.add(SyntaxNode.token(source, offset(keyword.getStartIndex()), offset(keyword.getStopIndex() + 1)));
        raw.add(namedLeaf(CstKind.TYPE_IDENTIFIER, ctx.Identifier().getSymbol()));
        return SyntaxNode.named(CstKind.STRUCT_SPECIFIER, source, start(ctx), end(ctx), raw);
    }

    @Override
    public SyntaxNode visitTypeQualifier(CExpressionParser.TypeQualifierContext ctx) {
        return leaf(CstKind.TYPE_QUALIFIER, ctx);
    }

    @Override
    public SyntaxNode visitAbstractPointerDeclarator(CExpressionParser.AbstractPointerDeclaratorContext ctx) {
        return node(CstKind.ABSTRACT_POINTER_DECLARATOR, ctx);
    }

    private SyntaxNode node(CstKind kind, ParserRuleContext ctx) {
        if (++depth > MAX_DEPTH) {
            throw new InvalidNodeStructureException("Expression nested deeper than " + MAX_DEPTH + " levels",
                    kind.kindName(), source.substring(start(ctx), end(ctx)), 0);
        }
        try {
            return SyntaxNode.named(kind, source, start(ctx), end(ctx), rawChildren(ctx));
        } finally {
            depth--;
        }
    }

    private List<SyntaxNode> rawChildren(ParserRuleContext ctx) {
        List<SyntaxNode> raw = new ArrayList<>();
        if (ctx.children != null) {
            for (ParseTree child : ctx.children) {
                if (child instanceof TerminalNode terminal) {
                    Token token = terminal.getSymbol();
                    if (token.getType() == Token.EOF) {
                        continue;
                    }
                    raw.add(token.getType() == CExpressionLexer.Identifier
                            ? namedLeaf(CstKind.IDENTIFIER, token)
                            : SyntaxNode.token(source, offset(token.getStartIndex()), offset(token.getStopIndex() + 1)));
                } else {
                    raw.add(visit(child));
                }
            }
        }
        return raw;
    }

    private SyntaxNode leaf(CstKind kind, ParserRuleContext ctx) {
        return SyntaxNode.named(kind, source, start(ctx), end(ctx), List.of());
    }

    private SyntaxNode namedLeaf(CstKind kind, Token token) {
        return SyntaxNode.named(kind, source, offset(token.getStartIndex()), offset(token.getStopIndex() + 1), List.of());
    }

    private int start(ParserRuleContext ctx) {
        return offset(ctx.getStart().getStartIndex());
    }

    private int end(ParserRuleContext ctx) {
        Token stop = ctx.getStop();
        if (stop == null || stop.getStopIndex() < ctx.getStart().getStartIndex()) {
            return start(ctx);
        }
        return offset(stop.getStopIndex() + 1);
    }

    // ANTLR indexes code points; String offsets are UTF-16 units.
    private int offset(int codePointIndex) {
        if (!surrogates) {
            return Math.min(codePointIndex, source.length());
        }
        int codePoints = source.codePointCount(0, source.length());
        return source.offsetByCodePoints(0, Math.min(codePointIndex, codePoints));
    }
}
