package org.gopy.benchmark;

import java.util.List;
import java.util.concurrent.TimeUnit;

import org.gopy.GoPy;
import org.gopy.LoweringOptions;
import org.gopy.benchmark.domain.SampleProgram;
import org.gopy.lowering.LoweredDecl;
import org.gopy.target.PyModule;
import org.openjdk.jmh.annotations.*;

/**
 * Measures lowering cost for a whole package and for a single declaration. Each invocation
 * starts from a fresh naming scope, as a tool lowering one package at a time would.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dgopy.lowering.strict=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class LoweringCostBenchmark {

    @State(Scope.Thread)
    public static class ProgramState {

        SampleProgram program;
        GoPy gopy;
        GoPy bare;

        @Setup(Level.Trial)
        public void init() {
            program = new SampleProgram();
            gopy = new GoPy(program.info());
            bare = new GoPy(program.info(), LoweringOptions.builder()
                    .emitDocStrings(false)
                    .attachComments(false)
                    .build());
        }
    }

    @Benchmark
    public PyModule compilePackage(ProgramState state) {
        return state.gopy.compileFiles(state.program.files());
    }

    @Benchmark
    public PyModule compilePackageWithoutComments(ProgramState state) {
        return state.bare.compileFiles(state.program.files());
    }

    @Benchmark
    public List<LoweredDecl> lowerSingleFunction(ProgramState state) {
        return state.gopy.lowerDecl(state.program.total());
    }
}
