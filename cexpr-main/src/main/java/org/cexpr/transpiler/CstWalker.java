package org.cexpr.transpiler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.cexpr.InvalidNodeStructureException;
import org.cexpr.MissingIdentifierException;
import org.cexpr.MissingTypeException;
import org.cexpr.UnsupportedNodeException;
import org.cexpr.ast.AstNode;
import org.cexpr.ast.AstNodes;
import org.cexpr.ast.BinaryOperator;
import org.cexpr.ast.UnaryOperator;
import org.cexpr.cst.CstNode;
import org.cexpr.literal.CharLiteralDecoder;
import org.cexpr.literal.NumberLiteralDecoder;
import org.cexpr.literal.StringLiteralDecoder;
import org.cexpr.resolve.BuiltinTypeNames;
import org.cexpr.resolve.IdentifierPolicy;
import org.cexpr.resolve.TypeNameTable;
import org.cexpr.resolve.UsageKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates one concrete syntax tree into a target {@link AstNode}, dispatching on the node
 * kind.
 * <p>
 * Binary operands are coerced to the {@link CoercionWitness} of the translation, which is bound
 * to the type of the first translated left operand. A walker holds no state of its own besides
 * its collaborators; the witness is passed in so that it is shared across the whole tree.
 */
public class CstWalker {

    private static final Logger logger = LoggerFactory.getLogger(CstWalker.class);

    private static final String PLACEHOLDER = "_";

    private final TranslationContext context;
    private final IdentifierPolicy identifiers;
    private final TypeNameTable typeNames;

    public CstWalker(TranslationContext context, IdentifierPolicy identifiers, TypeNameTable typeNames) {
        this.context = context;
        this.identifiers = identifiers;
        this.typeNames = typeNames;
    }

    public AstNode walk(CstNode node, CoercionWitness witness) {
        logger.trace("NODE: {}, VAL: {}", node.kindName(), node.text());

        AstNode result = switch (node.kind()) {
            case NUMBER_LITERAL -> NumberLiteralDecoder.decode(node.text());
            case STRING_LITERAL -> StringLiteralDecoder.decode(node.text());
            case CHAR_LITERAL -> CharLiteralDecoder.decode(node.text());
            case TRANSLATION_UNIT, EXPRESSION_STATEMENT, ERROR -> statements(node, witness);
            case PARENTHESIZED_EXPRESSION -> parenthesized(node, witness);
            case SIZEOF_EXPRESSION -> sizeOf(node, witness);
            case CAST_EXPRESSION -> cast(node, witness);
            case MATH_EXPRESSION, LOGICAL_EXPRESSION, RELATIONAL_EXPRESSION, BITWISE_EXPRESSION,
                 EQUALITY_EXPRESSION, BINARY_EXPRESSION -> unaryOrBinary(node, witness);
            case SHIFT_EXPRESSION -> shift(node, witness);
            case TRUE, FALSE -> booleanLiteral(node);
            case TYPE_DESCRIPTOR, SIZED_TYPE_SPECIFIER -> type(node);
            case IDENTIFIER -> identifier(node);
            default -> throw new UnsupportedNodeException(node.kindName(), node.text());
        };

        logger.trace("NODE RESULT: {}", result);
        return result;
    }

    private AstNode statements(CstNode node, CoercionWitness witness) {
        int count = node.childCount();
        if (count == 0) {
            throw new InvalidNodeStructureException(
                    "Node type \"" + node.kindName() + "\" has no children", node.kindName(), node.text(), 0);
        }
        if (count == 1) {
            return walk(node.child(0), witness);
        }
        return AstNodes.statements(walkChildren(node, witness));
    }

    private AstNode parenthesized(CstNode node, CoercionWitness witness) {
        requireChildren(node, 1);
        return AstNodes.paren(walkChildren(node, witness));
    }

    private AstNode sizeOf(CstNode node, CoercionWitness witness) {
        requireChildren(node, 1);
        return AstNodes.sizeOf(walk(node.child(0), witness));
    }

    private AstNode cast(CstNode node, CoercionWitness witness) {
        requireChildren(node, 2);
        AstNode type = walk(node.child(0), witness);
        AstNode operand = walk(node.child(1), witness);
        return AstNodes.cast(type, operand);
    }

    private AstNode unaryOrBinary(CstNode node, CoercionWitness witness) {
        int count = node.childCount();
        if (count > 1) {
            BinaryOperator operator = OperatorTables.binary(operatorSymbol(node, 1));
            AstNode binary = binary(node, operator, witness);
            return binary.isAbsent() ? AstNode.ABSENT : witness.coerce(binary);
        }
        if (count == 1) {
            return unary(node, witness);
        }
        throw new InvalidNodeStructureException(
                "Invalid " + node.kindName() + " \"" + node.text() + "\"", node.kindName(), node.text(), 0);
    }

    private AstNode shift(CstNode node, CoercionWitness witness) {
        requireChildren(node, 2);
        BinaryOperator operator = OperatorTables.shift(operatorSymbol(node, 1));
        return binary(node, operator, witness);
    }

    /**
     * @return {@code left op witness(right)}, binding the witness to {@code typeof(left)} first
     */
    private AstNode binary(CstNode node, BinaryOperator operator, CoercionWitness witness) {
        AstNode left = walk(node.child(0), witness);
        if (!left.isAbsent()) {
            witness.bindIfUnset(AstNodes.typeOf(left));
        }
        AstNode right = walk(node.child(1), witness);
        if (left.isAbsent() || right.isAbsent()) {
            return AstNode.ABSENT;
        }
        return AstNodes.binary(operator, left, witness.coerce(right));
    }

    private AstNode unary(CstNode node, CoercionWitness witness) {
        UnaryOperator operator = OperatorTables.unary(operatorSymbol(node, 0));
        if (operator == UnaryOperator.NEGATE) {
            // negated operands are converted to a signed 64-bit integer first
            AstNode int64 = AstNodes.identifier(BuiltinTypeNames.INT64);
            witness.bindIfUnset(int64);
            AstNode converted = AstNodes.call(int64, walk(node.child(0), witness));
            return AstNodes.paren(AstNodes.unary(operator, AstNodes.paren(converted)));
        }
        return AstNodes.paren(AstNodes.unary(operator, walk(node.child(0), witness)));
    }

    private AstNode booleanLiteral(CstNode node) {
        return OperatorTables.booleanLiteral(node.text())
                .map(AstNodes::identifier)
                .orElseThrow(() -> new UnsupportedNodeException(node.kindName(), node.text()));
    }

    private AstNode type(CstNode node) {
        String written = node.text();
        String name = typeNames.lookup(written).orElse(written);
        return identifiers.resolve(name, UsageKind.TYPE, node.kindName())
                .filter(resolved -> !resolved.isBlank())
                .map(AstNodes::identifier)
                .orElseThrow(() -> new MissingTypeException(written));
    }

    private AstNode identifier(CstNode node) {
        String raw = node.text();
        String parentKind = node.parent().map(CstNode::kindName).orElse("");
        Optional<String> resolved = identifiers.resolve(raw, UsageKind.VALUE, parentKind)
                .filter(name -> !name.isBlank());
        if (resolved.isEmpty()) {
            if (raw.equals(PLACEHOLDER)) {
                return AstNode.ABSENT;
            }
            throw new MissingIdentifierException(raw);
        }
        return AstNodes.identifier(qualify(resolved.get()));
    }

    private String qualify(String name) {
        Optional<String> qualifier = context.qualifier();
        if (qualifier.isPresent() && identifiers.constantIdentifiers().contains(name)) {
            return name + "." + qualifier.get();
        }
        return name;
    }

    private List<AstNode> walkChildren(CstNode node, CoercionWitness witness) {
        List<AstNode> items = new ArrayList<>(node.childCount());
        for (int i = 0; i < node.childCount(); i++) {
            items.add(walk(node.child(i), witness));
        }
        return items;
    }

    private static String operatorSymbol(CstNode node, int rawIndex) {
        if (rawIndex >= node.rawChildCount()) {
            throw new InvalidNodeStructureException(
                    "Missing operator in \"" + node.text() + "\"", node.kindName(), node.text(), node.childCount());
        }
        return node.rawChild(rawIndex).text().strip();
    }

    private static void requireChildren(CstNode node, int expected) {
        if (node.childCount() < expected) {
            throw new InvalidNodeStructureException(
                    "Node type \"" + node.kindName() + "\" needs " + expected + " children but has " + node.childCount(),
                    node.kindName(), node.text(), node.childCount());
        }
    }
}
