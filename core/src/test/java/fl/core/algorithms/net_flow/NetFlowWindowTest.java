package fl.core.algorithms.net_flow;

import fl.core.clock.ManualClock;
import fl.core.model.Decision;
import fl.core.model.FlowDirection;
import fl.core.model.FlowResult;
import fl.core.model.FlowSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class NetFlowWindowTest {

    private static final long SIX_HOURS = Duration.ofHours(6).toNanos();
    private static final long ONE_SECOND = 1_000_000_000L;

    // ========== NET FLOW ==========

    @Test
    void testAllow_whenWithinLimit() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 100);

        FlowResult result = window.tryRecordOutflow(60);
        assertEquals(Decision.ALLOW, result.decision());
        assertEquals(40, result.available(), "Remaining outflow after commit");

        result = window.tryRecordOutflow(40);
        assertEquals(Decision.ALLOW, result.decision(), "Exactly reaching the limit is allowed");
        assertEquals(100, window.currentOutflow());
    }

    @Test
    void testReject_leavesCountersUntouched() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 100);

        window.tryRecordOutflow(70);
        FlowResult result = window.tryRecordOutflow(31);

        assertEquals(Decision.REJECT, result.decision());
        assertEquals(FlowDirection.OUTFLOW, result.direction());
        assertEquals(31, result.attempted());
        assertEquals(30, result.available());
        assertEquals(70, window.currentOutflow(), "Rejected amount must not be committed");
        assertEquals(0, window.currentInflow());
    }

    @Test
    void testRepeatedRejection_hasNoCumulativeEffect() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 10);
        window.tryRecordInflow(4);
        window.tryRecordOutflow(12);

        FlowSnapshot before = window.snapshot("A");
        for (int i = 0; i < 5; i++) {
            assertEquals(Decision.REJECT, window.tryRecordOutflow(3).decision());
        }
        assertEquals(before, window.snapshot("A"));

        // Smaller amount still fits: 12 + 2 <= 4 + 10
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(2).decision());
    }

    @Test
    void testInflow_earnsBackOutflowCapacity() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, 100);

        assertEquals(Decision.ALLOW, window.tryRecordInflow(50).decision());
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(150).decision(), "150 <= 50 + 100");
        assertEquals(Decision.REJECT, window.tryRecordOutflow(1).decision());
    }

    @Test
    void testOutflow_earnsBackInflowCapacity() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, 100);

        window.tryRecordInflow(100);
        assertEquals(Decision.REJECT, window.tryRecordInflow(1).decision());

        window.tryRecordOutflow(30);
        assertEquals(Decision.ALLOW, window.tryRecordInflow(30).decision(), "130 <= 30 + 100");
        assertEquals(Decision.REJECT, window.tryRecordInflow(1).decision());
    }

    @Test
    void testLargeOneDirectionalTurnover_isAllowedWhileNetStaysBounded() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, 10);

        for (int i = 0; i < 1_000; i++) {
            assertEquals(Decision.ALLOW, window.tryRecordOutflow(10).decision());
            assertEquals(Decision.ALLOW, window.tryRecordInflow(10).decision());
        }
        assertEquals(10_000, window.currentOutflow());
        assertEquals(10_000, window.currentInflow());
    }

    @Test
    void testSixHourScenario() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, 100);

        assertEquals(Decision.ALLOW, window.tryRecordOutflow(100).decision());
        assertEquals(Decision.REJECT, window.tryRecordOutflow(1).decision());
        assertEquals(Decision.ALLOW, window.tryRecordInflow(1).decision());
        assertEquals(100, window.currentOutflow());
        assertEquals(1, window.currentInflow());
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(1).decision(), "101 <= 1 + 100");

        clock.advanceNanos(SIX_HOURS);

        assertEquals(0, window.currentOutflow());
        assertEquals(0, window.currentInflow());
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(100).decision(), "Fresh epoch");
    }

    @Test
    void testNetFlow_neverExceedsLimit_randomSequence() {
        ManualClock clock = new ManualClock(0);
        long limit = 500;
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, limit);
        Random random = new Random(42);

        for (int i = 0; i < 10_000; i++) {
            long amount = 1 + random.nextInt(200);
            FlowDirection direction = random.nextBoolean() ? FlowDirection.OUTFLOW : FlowDirection.INFLOW;
            window.tryRecord(direction, amount);

            long net = window.currentOutflow() - window.currentInflow();
            assertTrue(net <= limit, "outflow - inflow exceeded limit at step " + i);
            assertTrue(-net <= limit, "inflow - outflow exceeded limit at step " + i);
        }
    }

    // ========== DISABLED LIMIT ==========

    @Test
    void testZeroLimit_disablesEnforcementWithoutMutation() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 0);

        for (int i = 0; i < 100; i++) {
            FlowResult out = window.tryRecordOutflow(Long.MAX_VALUE / 2);
            FlowResult in = window.tryRecordInflow(7);
            assertEquals(Decision.ALLOW, out.decision());
            assertEquals(Decision.ALLOW, in.decision());
            assertEquals(Long.MAX_VALUE, out.available());
        }

        assertEquals(0, window.currentOutflow());
        assertEquals(0, window.currentInflow());
        assertEquals(0, window.trackedEpochs());
    }

    @Test
    void testDisablingMidEpoch_keepsRecordedCounters() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 100);

        window.tryRecordOutflow(80);
        assertEquals(100, window.setLimit(0));
        window.tryRecordOutflow(1_000);

        assertEquals(80, window.currentOutflow(), "Disabled records are not counted");
    }

    // ========== LIMIT CHANGES ==========

    @Test
    void testRaisingLimit_admitsPreviouslyRejectedAmount() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 100);

        window.tryRecordOutflow(100);
        assertEquals(Decision.REJECT, window.tryRecordOutflow(50).decision());

        window.setLimit(150);
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(50).decision());
        assertEquals(150, window.currentOutflow());
    }

    @Test
    void testLoweringLimit_keepsCountersButBlocksFurtherFlow() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 100);

        window.tryRecordOutflow(90);
        window.setLimit(50);

        assertEquals(90, window.currentOutflow(), "Recorded flow is not re-validated");
        FlowResult result = window.tryRecordOutflow(1);
        assertEquals(Decision.REJECT, result.decision());
        assertEquals(0, result.available());

        // Inflow is now allowed up to 90 + 50
        assertEquals(Decision.ALLOW, window.tryRecordInflow(140).decision());
        assertEquals(Decision.REJECT, window.tryRecordInflow(1).decision());
    }

    // ========== EPOCHS ==========

    @Test
    void testEpochIsolation() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 10);

        window.tryRecordInflow(10);
        window.tryRecordOutflow(20);

        clock.advanceNanos(ONE_SECOND);

        // Inflow recorded in the previous epoch earns nothing here
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(10).decision());
        assertEquals(Decision.REJECT, window.tryRecordOutflow(1).decision());
    }

    @Test
    void testEpochAlignment_toAbsoluteTime() {
        ManualClock clock = new ManualClock(700_000_000L); // 0.7s into epoch 0
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 5);

        window.tryRecordOutflow(5);
        FlowResult result = window.tryRecordOutflow(1);
        assertEquals(Decision.REJECT, result.decision());
        assertEquals(300_000_000L, result.retryAfterNanos(), "Time until the aligned boundary");

        clock.setNanos(999_999_999L);
        assertEquals(Decision.REJECT, window.tryRecordOutflow(1).decision());

        clock.setNanos(ONE_SECOND);
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(5).decision(), "Reset at aligned boundary");
    }

    @Test
    void testSnapshot_reportsLiveEpoch() {
        ManualClock clock = new ManualClock(2 * SIX_HOURS + 5);
        NetFlowWindow window = new NetFlowWindow(clock, SIX_HOURS, 100);

        window.tryRecordOutflow(30);
        window.tryRecordInflow(10);

        FlowSnapshot snapshot = window.snapshot("USDC");
        assertEquals("USDC", snapshot.subject());
        assertEquals(2, snapshot.epochIndex());
        assertEquals(100, snapshot.limit());
        assertEquals(30, snapshot.outflow());
        assertEquals(10, snapshot.inflow());
        assertEquals(3 * SIX_HOURS, snapshot.epochEndsAtNanos());
        assertEquals(80, snapshot.availableOutflow());
        assertEquals(120, snapshot.availableInflow());
    }

    @Test
    void testStaleEpochs_arePruned() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 10);

        for (int i = 0; i < 50; i++) {
            window.tryRecordOutflow(1);
            window.tryRecordInflow(1);
            clock.advanceNanos(ONE_SECOND);
        }

        assertTrue(window.trackedEpochs() <= 2, "Only current and previous epochs are kept");
    }

    // ========== EDGE CASES ==========

    @Test
    void testNearMaxValues_doNotOverflow() {
        ManualClock clock = new ManualClock(0);
        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, Long.MAX_VALUE - 1);

        assertEquals(Decision.ALLOW, window.tryRecordInflow(Long.MAX_VALUE - 1).decision());
        assertEquals(Decision.ALLOW, window.tryRecordOutflow(Long.MAX_VALUE).decision());
        assertEquals(Decision.REJECT, window.tryRecordOutflow(1).decision());
    }

    @Test
    void testInvalidArguments() {
        ManualClock clock = new ManualClock(0);

        assertThrows(IllegalArgumentException.class, () -> new NetFlowWindow(null, ONE_SECOND, 10));
        assertThrows(IllegalArgumentException.class, () -> new NetFlowWindow(clock, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> new NetFlowWindow(clock, -1, 10));
        assertThrows(IllegalArgumentException.class, () -> new NetFlowWindow(clock, ONE_SECOND, -1));

        NetFlowWindow window = new NetFlowWindow(clock, ONE_SECOND, 10);
        assertThrows(IllegalArgumentException.class, () -> window.tryRecordOutflow(0));
        assertThrows(IllegalArgumentException.class, () -> window.tryRecordInflow(-5));
        assertThrows(IllegalArgumentException.class, () -> window.tryRecord(null, 1));
        assertThrows(IllegalArgumentException.class, () -> window.setLimit(-1));
    }
}
