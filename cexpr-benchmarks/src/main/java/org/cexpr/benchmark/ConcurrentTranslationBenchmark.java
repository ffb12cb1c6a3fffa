package org.cexpr.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.cexpr.CTranslator;
import org.cexpr.ast.AstNode;
import org.cexpr.resolve.DefaultIdentifierPolicy;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads translating different expressions with one shared translator. Gives a
 * contention baseline for the per-call translation state.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentTranslationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final String[] expressions = {
                "a + b * 2",
                "(a << 4) | -b"
        };

        CTranslator translator;

        @Setup(Level.Trial)
        public void init() {
            translator = CTranslator.builder()
                    .mode(org.cexpr.Mode.C)
                    .identifierPolicy(DefaultIdentifierPolicy.builder().variables("a", "b").build())
                    .build();
        }
    }

    @State(Scope.Thread)
    public static class ThreadState {

        private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);
        int threadIndex;

        @Setup(Level.Trial)
        public void init() {
            threadIndex = THREAD_COUNTER.getAndIncrement() % 2;
        }
    }

    @Benchmark
    public AstNode concurrentTranslateDifferentExpressions(SharedState shared, ThreadState local) {
        return shared.translator.translate(shared.expressions[local.threadIndex]);
    }
}
