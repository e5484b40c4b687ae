package org.openscad.benchmark;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.*;
import org.openscad.ast.AstGenerator;
import org.openscad.ast.GenerationResult;
import org.openscad.cst.CstNode;
import org.openscad.cst.antlr4.Antlr4ScadParser;

/**
 * Lowering cost of already parsed trees, separate from the ANTLR parse. The CST is built once per
 * trial so only AST generation is measured.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class AstGenerationBenchmark {

    @State(Scope.Thread)
    public static class ParsedState {

        @Param({"small", "bracket", "grid"})
        String model;

        final AstGenerator generator = new AstGenerator();
        CstNode root;

        @Setup(Level.Trial)
        public void init() {
            String source = switch (model) {
                case "small" -> Models.SMALL;
                case "bracket" -> Models.BRACKET;
                default -> Models.grid(200);
            };
            root = Antlr4ScadParser.parseStrict(source);
        }
    }

    @State(Scope.Thread)
    public static class SourceState {

        final String source = Models.BRACKET;
    }

    @Benchmark
    public GenerationResult generateFromTree(ParsedState state) {
        return state.generator.generate(state.root);
    }

    @Benchmark
    public GenerationResult parseAndGenerate(SourceState state) {
        return new AstGenerator().generate(Antlr4ScadParser.parseStrict(state.source));
    }
}
