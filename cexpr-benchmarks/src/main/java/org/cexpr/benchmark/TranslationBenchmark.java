package org.cexpr.benchmark;

import java.util.concurrent.TimeUnit;

import org.cexpr.CTranslator;
import org.cexpr.ast.AstNode;
import org.cexpr.cst.CstNode;
import org.cexpr.literal.NumberLiteralDecoder;
import org.cexpr.parser.antlr4.Antlr4CstProvider;
import org.cexpr.resolve.DefaultIdentifierPolicy;
import org.openjdk.jmh.annotations.*;

/**
 * Single-thread translation cost of typical macro bodies, split into parsing and the full
 * parse-and-walk pipeline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dcexpr.translator.mode=c"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranslationBenchmark {

    @State(Scope.Thread)
    public static class TranslatorState {

        CTranslator translator;

        @Setup(Level.Trial)
        public void init() {
            translator = CTranslator.builder()
                    .identifierPolicy(DefaultIdentifierPolicy.builder()
                            .variables("a", "b", "flags")
                            .constants("FLAG_READ", "FLAG_WRITE", "PAGE_SHIFT")
                            .build())
                    .build();
        }
    }

    @Benchmark
    public AstNode translateLiteral(TranslatorState state) {
        return state.translator.translate("0x7fffffffull");
    }

    @Benchmark
    public AstNode translateArithmetic(TranslatorState state) {
        return state.translator.translate("(a + b) * 2 - -1");
    }

    @Benchmark
    public AstNode translateFlags(TranslatorState state) {
        return state.translator.translate("(FLAG_READ | FLAG_WRITE) << PAGE_SHIFT", "Flags");
    }

    @Benchmark
    public AstNode translateCastAndSizeof(TranslatorState state) {
        return state.translator.translate("(unsigned long) sizeof(uint64_t) * 8");
    }

    @Benchmark
    public AstNode translateUnsupported(TranslatorState state) {
        return state.translator.translate("flags ? a : b");
    }

    @Benchmark
    public CstNode parseOnly() {
        return Antlr4CstProvider.INSTANCE.parse("(FLAG_READ | FLAG_WRITE) << PAGE_SHIFT", org.cexpr.Mode.C);
    }

    @Benchmark
    public AstNode decodeNumberOnly() {
        return NumberLiteralDecoder.decode("0x7fffffffull");
    }
}
