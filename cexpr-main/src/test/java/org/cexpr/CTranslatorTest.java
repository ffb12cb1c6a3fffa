package org.cexpr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.cexpr.ast.AstNode;
import org.cexpr.ast.AstNode.BinaryOp;
import org.cexpr.ast.AstNode.Call;
import org.cexpr.ast.AstNode.Cast;
import org.cexpr.ast.AstNode.CharLiteral;
import org.cexpr.ast.AstNode.FloatLiteral;
import org.cexpr.ast.AstNode.Identifier;
import org.cexpr.ast.AstNode.IntLiteral;
import org.cexpr.ast.AstNode.Paren;
import org.cexpr.ast.AstNode.StatementList;
import org.cexpr.ast.AstNode.StringLiteral;
import org.cexpr.ast.AstNode.UnaryOp;
import org.cexpr.ast.AstNodes;
import org.cexpr.ast.BinaryOperator;
import org.cexpr.ast.FloatKind;
import org.cexpr.ast.IntKind;
import org.cexpr.ast.Radix;
import org.cexpr.ast.UnaryOperator;
import org.cexpr.cst.CstKind;
import org.cexpr.cst.SyntaxNode;
import org.cexpr.literal.NumberLiteralDecoder;
import org.cexpr.resolve.DefaultIdentifierPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CTranslatorTest {

    private static final Identifier A = new Identifier("a");
    private static final Identifier B = new Identifier("b");
    private static final Identifier X = new Identifier("x");
    private static final Identifier INT64 = new Identifier("int64");
    private static final AstNode TYPEOF_A = AstNodes.typeOf(A);

    private final CTranslator translator = CTranslator.builder()
            .mode(Mode.C)
            .identifierPolicy(DefaultIdentifierPolicy.builder()
                    .variables("a", "b", "c", "x")
                    .constants("FOO")
                    .build())
            .build();

    @Test
    void parenthesizedSumIsCoercedToTheLeftOperand() {
        AstNode result = translator.translate("(a + b)");

        assertThat(result).isEqualTo(new Paren(List.of(
                call(TYPEOF_A, new BinaryOp(BinaryOperator.PLUS, A, call(TYPEOF_A, B))))));
    }

    @Test
    void shiftCoercesItsRightOperandOnly() {
        AstNode result = translator.translate("a << 2");

        assertThat(result).isEqualTo(
                new BinaryOp(BinaryOperator.SHIFT_LEFT, A, call(TYPEOF_A, IntLiteral.decimal(2))));
    }

    @Test
    void negativeLiteralIsNegatedAfterConversionToInt64() {
        AstNode result = translator.translate("-5");

        assertThat(result).isEqualTo(new Paren(List.of(
                new UnaryOp(UnaryOperator.NEGATE, new Paren(List.of(call(INT64, IntLiteral.decimal(5))))))));
    }

    @Test
    void negativeLiteralTakesTheUnaryPathNotTheDecoderSign() {
        // the decoder folds a leading '-' into a plain negation; the parser never hands it one
        AstNode decoded = NumberLiteralDecoder.decode("-5");
        AstNode translated = translator.translate("-5");

        assertThat(decoded).isEqualTo(new UnaryOp(UnaryOperator.NEGATE, IntLiteral.decimal(5)));
        assertThat(translated).isInstanceOf(Paren.class).isNotEqualTo(decoded);
    }

    @Test
    void negationBindsTheWitnessBeforeAnyBinaryOperand() {
        AstNode negatedA = new Paren(List.of(
                new UnaryOp(UnaryOperator.NEGATE, new Paren(List.of(call(INT64, A))))));

        AstNode result = translator.translate("-a + b");

        assertThat(result).isEqualTo(call(INT64, new BinaryOp(BinaryOperator.PLUS, negatedA, call(INT64, B))));
    }

    @Test
    void negatedRightOperandKeepsTheLeftWitness() {
        AstNode negatedB = new Paren(List.of(
                new UnaryOp(UnaryOperator.NEGATE, new Paren(List.of(call(INT64, B))))));

        AstNode result = translator.translate("a + -b");

        assertThat(result).isEqualTo(call(TYPEOF_A, new BinaryOp(BinaryOperator.PLUS, A, call(TYPEOF_A, negatedB))));
    }

    @Test
    void otherUnaryOperatorsWrapWithoutConversion() {
        assertThat(translator.translate("~a")).isEqualTo(new Paren(List.of(new UnaryOp(UnaryOperator.NOT, A))));
        assertThat(translator.translate("+a")).isEqualTo(new Paren(List.of(new UnaryOp(UnaryOperator.PLUS, A))));
    }

    @Test
    void firstLeftOperandAnchorsTheWholeExpression() {
        AstNode typeOfFloat = AstNodes.typeOf(new FloatLiteral(1.5, FloatKind.FLOAT));

        AstNode result = translator.translate("1.5 * a");

        assertThat(result).isEqualTo(call(typeOfFloat,
                new BinaryOp(BinaryOperator.MULTIPLY, new FloatLiteral(1.5, FloatKind.FLOAT), call(typeOfFloat, A))));
    }

    @Test
    void operatorsAreMapped() {
        AstNode result = translator.translate("a % b");

        assertThat(((BinaryOp) ((Call) result).arguments().get(0)).operator()).isEqualTo(BinaryOperator.MOD);
        assertThat(((BinaryOp) ((Call) translator.translate("a || b")).arguments().get(0)).operator())
                .isEqualTo(BinaryOperator.OR);
    }

    @Test
    void literals() {
        assertThat(translator.translate("0x1A"))
                .isEqualTo(new IntLiteral(BigInteger.valueOf(26), IntKind.INT, Radix.HEXADECIMAL));
        assertThat(translator.translate("10ull"))
                .isEqualTo(new IntLiteral(BigInteger.TEN, IntKind.UINT64, Radix.DECIMAL));
        assertThat(translator.translate("'A'")).isEqualTo(new CharLiteral(65));
        assertThat(translator.translate("\"foo\\n\""))
                .isEqualTo(new StringLiteral(new byte[] {'f', 'o', 'o', '\n'}));
        assertThat(translator.translate("true")).isEqualTo(new Identifier("true"));
    }

    @Test
    void castsAndSizeof() {
        assertThat(translator.translate("(int) x")).isEqualTo(new Cast(new Identifier("cint"), X));
        assertThat(translator.translate("(uint32_t) x")).isEqualTo(new Cast(new Identifier("uint32"), X));
        assertThat(translator.translate("(void) x")).isEqualTo(new Cast(new Identifier("object"), X));
        assertThat(translator.translate("sizeof(unsigned long)"))
                .isEqualTo(call(new Identifier("sizeof"), new Identifier("culong")));
        assertThat(translator.translate("(uintptr_t) x")).isEqualTo(new Cast(new Identifier("ptr uint"), X));
    }

    @Test
    void castDoesNotBindTheWitness() {
        AstNode cast = new Cast(new Identifier("cint"), A);
        AstNode typeOfCast = AstNodes.typeOf(cast);

        AstNode result = translator.translate("(int) a + b");

        assertThat(result).isEqualTo(call(typeOfCast, new BinaryOp(BinaryOperator.PLUS, cast, call(typeOfCast, B))));
    }

    @Test
    void unknownTypeIsUntranslated() {
        TranslationResult result = translator.translateDetailed("sizeof(struct foo)");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(MissingTypeException.class);
    }

    @Test
    void constantsAreQualified() {
        Identifier qualified = new Identifier("FOO.Flags");
        AstNode typeOfFoo = AstNodes.typeOf(qualified);

        AstNode result = translator.translate("FOO | 1", "Flags");

        assertThat(result).isEqualTo(call(typeOfFoo,
                new BinaryOp(BinaryOperator.OR, qualified, call(typeOfFoo, IntLiteral.decimal(1)))));
        assertThat(translator.translate("FOO")).isEqualTo(new Identifier("FOO"));
    }

    @Test
    void severalStatementsBecomeAStatementList() {
        assertThat(translator.translate("a; b")).isEqualTo(new StatementList(List.of(A, B)));
    }

    @Test
    void unsupportedOperatorIsAbsent() {
        TranslationResult result = translator.translateDetailed("a %= 2");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.isTranslated()).isFalse();
        assertThat(result.failure()).containsInstanceOf(UnsupportedNodeException.class);
    }

    @Test
    void unknownSymbolFromTheProviderIsAbsent() {
        CTranslator custom = CTranslator.builder()
                .cstProvider((source, mode) -> {
                    SyntaxNode left = SyntaxNode.named(CstKind.NUMBER_LITERAL, "2", 0, 1, List.of());
                    SyntaxNode op = SyntaxNode.token("**", 0, 2);
                    SyntaxNode right = SyntaxNode.named(CstKind.NUMBER_LITERAL, "3", 0, 1, List.of());
                    return SyntaxNode.named(CstKind.MATH_EXPRESSION, "2 ** 3", 0, 6, List.of(left, op, right));
                })
                .build();

        TranslationResult result = custom.translateDetailed("2 ** 3");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(UnsupportedSymbolException.class);
    }

    @Test
    void unsupportedConstructsAreAbsent() {
        assertThat(translator.translate("f(1)")).isEqualTo(AstNode.ABSENT);
        assertThat(translator.translate("a ? b : c")).isEqualTo(AstNode.ABSENT);
        assertThat(translator.translate("a++")).isEqualTo(AstNode.ABSENT);
        assertThat(translator.translate("&a")).isEqualTo(AstNode.ABSENT);
        assertThat(translator.translate("\"a\" \"b\"")).isEqualTo(AstNode.ABSENT);
    }

    @Test
    void parseErrorIsAbsent() {
        TranslationResult result = translator.translateDetailed("a +");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(ExpressionParseException.class);
    }

    @Test
    void translationIsDeterministic() {
        String source = "(a + 0x10) << (b & 3) | -c";

        AstNode first = translator.translate(source);
        AstNode second = translator.translate(source);

        assertThat(first).isNotEqualTo(AstNode.ABSENT);
        assertThat(second).isEqualTo(first);
    }

    @Test
    void placeholderIsAbsentWithoutFailure() {
        TranslationResult placeholder = translator.translateDetailed("_");
        TranslationResult inExpression = translator.translateDetailed("_ + a");

        assertThat(placeholder.node()).isEqualTo(AstNode.ABSENT);
        assertThat(placeholder.failure()).isEmpty();
        assertThat(inExpression.node()).isEqualTo(AstNode.ABSENT);
        assertThat(inExpression.failure()).isEmpty();
    }

    @Test
    void unresolvableIdentifierAbortsTheExpression() {
        TranslationResult result = translator.translateDetailed("a + missing");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(MissingIdentifierException.class);
        assertThat(result.failure().get()).hasMessage("Missing identifier \"missing\"");
    }

    @Test
    void alternativeTokensInCppMode() {
        AstNode expected = call(TYPEOF_A, new BinaryOp(BinaryOperator.AND, A, call(TYPEOF_A, B)));

        assertThat(translator.translate("a and b", null, Mode.CPP)).isEqualTo(expected);
        assertThat(translator.translate("a and b")).isEqualTo(AstNode.ABSENT);
        assertThat(translator.translate("a::b", null, Mode.CPP)).isEqualTo(AstNode.ABSENT);
    }

    @Test
    void defaultModeComesFromSystemProperty() {
        String previous = System.getProperty(CTranslator.MODE_PROPERTY);
        System.setProperty(CTranslator.MODE_PROPERTY, "cpp");
        try {
            assertThat(CTranslator.builder().build().getDefaultMode()).isEqualTo(Mode.CPP);
        } finally {
            if (previous == null) {
                System.clearProperty(CTranslator.MODE_PROPERTY);
            } else {
                System.setProperty(CTranslator.MODE_PROPERTY, previous);
            }
        }
    }

    @Test
    void unexpectedFailureIsAbsent() {
        CTranslator failing = CTranslator.builder()
                .cstProvider((source, mode) -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        TranslationResult result = failing.translateDetailed("a");

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(IllegalStateException.class);
    }

    @Test
    void nestingUpToTheLimitTranslates() {
        String source = "(".repeat(200) + "1" + ")".repeat(200);

        TranslationResult result = translator.translateDetailed(source);

        assertThat(result.isTranslated()).isTrue();
        assertThat(result.node()).isInstanceOf(Paren.class);
    }

    @Test
    void nestingBeyondTheLimitIsAbsent() {
        String source = "(".repeat(300) + "1" + ")".repeat(300);

        TranslationResult result = translator.translateDetailed(source);

        assertThat(result.node()).isEqualTo(AstNode.ABSENT);
        assertThat(result.failure()).containsInstanceOf(InvalidNodeStructureException.class);
        assertThat(translator.translate("- ".repeat(300) + "1")).isEqualTo(AstNode.ABSENT);
    }

    @Test
    void pathologicalNestingNeverEscapesTheTranslator() {
        TranslationResult parens = translator.translateDetailed("(".repeat(20000) + "1" + ")".repeat(20000));
        TranslationResult negations = translator.translateDetailed("- ".repeat(20000) + "1");

        assertThat(parens.node()).isEqualTo(AstNode.ABSENT);
        assertThat(parens.failure()).isPresent();
        assertThat(negations.node()).isEqualTo(AstNode.ABSENT);
        assertThat(negations.failure()).isPresent();
        assertThat(translator.translate("a + b")).isNotEqualTo(AstNode.ABSENT);
    }

    @Test
    void sharedTranslatorIsThreadSafe() throws Exception {
        List<String> sources = List.of("a + b", "-5", "(a + b) * c", "a << 2", "sizeof(int) * x", "FOO ^ b");
        List<AstNode> expected = new ArrayList<>();
        for (String source : sources) {
            expected.add(translator.translate(source));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Callable<List<AstNode>>> tasks = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                tasks.add(() -> {
                    List<AstNode> results = new ArrayList<>();
                    for (String source : sources) {
                        results.add(translator.translate(source));
                    }
                    return results;
                });
            }
            for (Future<List<AstNode>> future : executor.invokeAll(tasks)) {
                assertThat(future.get()).isEqualTo(expected);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static AstNode call(AstNode callee, AstNode argument) {
        return new Call(callee, List.of(argument));
    }
}
