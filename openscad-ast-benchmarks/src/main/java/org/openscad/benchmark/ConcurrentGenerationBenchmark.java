package org.openscad.benchmark;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.openjdk.jmh.annotations.*;
import org.openscad.ast.AstGenerator;
import org.openscad.ast.GenerationResult;
import org.openscad.cst.CstNode;
import org.openscad.cst.antlr4.Antlr4ScadParser;

/**
 * Two threads lowering different trees through one shared generator. Shows that a generator
 * carries no per-call state and gives a contention baseline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentGenerationBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        final AstGenerator generator = new AstGenerator();
        final CstNode[] roots = new CstNode[2];

        @Setup(Level.Trial)
        public void init() {
            roots[0] = Antlr4ScadParser.parseStrict(Models.BRACKET);
            roots[1] = Antlr4ScadParser.parseStrict(Models.grid(50));
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
    public GenerationResult concurrentGenerateDifferentTrees(SharedState shared, ThreadState local) {
        return shared.generator.generate(shared.roots[local.threadIndex]);
    }
}
