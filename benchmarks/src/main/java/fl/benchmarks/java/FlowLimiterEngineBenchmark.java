package fl.benchmarks.java;

import fl.core.clock.SystemClock;
import fl.core.model.FlowResult;
import fl.java.engine.FlowLimiterConfig;
import fl.java.engine.FlowLimiterEngine;
import fl.java.engine.LimitChangeListener;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for FlowLimiterEngine (thread-safe multi-subject wrapper).
 *
 * Each op records an outflow of 1 and a matching inflow on the same subject, so the net
 * position returns to zero and every record is admitted.
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - singleSubject: all records on one subject
 * - multiSubject: rotating through 1000 subjects (low contention)
 * - parallel: 8 threads on a single subject (high lock contention)
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar FlowLimiterEngine
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class FlowLimiterEngineBenchmark {

    private static final int SUBJECTS = 1_000;

    private FlowLimiterEngine engine;

    @Setup
    public void setup() {
        engine = new FlowLimiterEngine(SystemClock.instance(), FlowLimiterConfig.defaults(), LimitChangeListener.NO_OP);
        engine.setLimit("asset", 1_000, "bench");
        for (int i = 0; i < SUBJECTS; i++) {
            engine.setLimit("asset:" + i, 1_000, "bench");
        }
    }

    @Benchmark
    public FlowResult singleSubject() {
        return record("asset");
    }

    @Benchmark
    public FlowResult multiSubject() {
        return record("asset:" + ThreadLocalRandom.current().nextInt(SUBJECTS));
    }

    @Benchmark
    @Threads(8)
    public FlowResult parallel() {
        return record("asset");
    }

    // Net stays within +-threads, far below the limit of 1000.
    private FlowResult record(String subject) {
        engine.tryRecordOutflow(subject, 1);
        return engine.tryRecordInflow(subject, 1);
    }
}
