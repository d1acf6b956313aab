package fl.benchmarks.java;

import fl.core.algorithms.net_flow.NetFlowWindow;
import fl.core.clock.SystemClock;
import fl.core.model.FlowResult;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the single-subject NetFlowWindow (no locking).
 *
 * Scenarios:
 * - allow: alternating outflow/inflow that always fits (hot path, one map write per call)
 * - reject: limit exhausted in one direction (read-only path)
 * - disabled: limit 0, returns before touching the clock
 *
 * Run:
 *   mvn -pl benchmarks -am package
 *   java -jar benchmarks/target/benchmarks.jar NetFlowWindow
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class NetFlowWindowBenchmark {

    private NetFlowWindow allowWindow;
    private NetFlowWindow rejectWindow;
    private NetFlowWindow disabledWindow;
    private boolean outbound;

    @Setup
    public void setup() {
        SystemClock clock = SystemClock.instance();
        long sixHours = TimeUnit.HOURS.toNanos(6);

        allowWindow = new NetFlowWindow(clock, sixHours, 1_000);

        rejectWindow = new NetFlowWindow(clock, sixHours, 1);
        rejectWindow.tryRecordOutflow(1);

        disabledWindow = new NetFlowWindow(clock, sixHours, 0);
    }

    @Benchmark
    public FlowResult netFlow_allow() {
        outbound = !outbound;
        return outbound ? allowWindow.tryRecordOutflow(1) : allowWindow.tryRecordInflow(1);
    }

    @Benchmark
    public FlowResult netFlow_reject() {
        return rejectWindow.tryRecordOutflow(1);
    }

    @Benchmark
    public FlowResult netFlow_disabled() {
        return disabledWindow.tryRecordOutflow(1);
    }
}
