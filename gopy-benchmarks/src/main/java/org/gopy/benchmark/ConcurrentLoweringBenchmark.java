package org.gopy.benchmark;

import java.util.concurrent.TimeUnit;

import org.gopy.GoPy;
import org.gopy.benchmark.domain.SampleProgram;
import org.gopy.target.PyModule;
import org.openjdk.jmh.annotations.*;

/**
 * Two threads lowering the same resolved package through one shared {@link GoPy}. Shows that
 * compilations keep no shared mutable state and gives a contention baseline.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Threads(2)
public class ConcurrentLoweringBenchmark {

    @State(Scope.Benchmark)
    public static class SharedState {

        SampleProgram program;
        GoPy gopy;

        @Setup(Level.Trial)
        public void init() {
            program = new SampleProgram();
            gopy = new GoPy(program.info());
        }
    }

    @Benchmark
    public PyModule concurrentCompilePackage(SharedState shared) {
        return shared.gopy.compileFiles(shared.program.files());
    }
}
