package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.BridgeRequestException.Reason;
import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTimeoutEvent;
import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import com.questrail.spooltag.bridge.model.ReadTagRequest;
import com.questrail.spooltag.bridge.time.DeterministicScheduler;
import com.questrail.spooltag.bridge.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TimedBridgeIntentExecutorTest
 * -----------------------------------------------------------------------------
 * Deadline arming and cancellation around the delegate executor.
 */
class TimedBridgeIntentExecutorTest {

    private static final long DEADLINE = TimeUnit.SECONDS.toNanos(30);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private List<BridgeIntents> delegated;
    private List<BridgeEvent> events;
    private TimedBridgeIntentExecutor executor;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        delegated = new ArrayList<>();
        events = new ArrayList<>();
        executor = new TimedBridgeIntentExecutor(delegated::add, events::add, scheduler, Instant::now);
    }

    private static BridgeIntents send(String id) {
        return BridgeIntents.of(new BridgeIntents.SendRequest(new ReadTagRequest(id, Optional.empty()), DEADLINE));
    }

    @Test
    void sendArmsTimeoutAtDeadline() {
        executor.execute(send("1"));

        assertEquals(1, delegated.size());
        assertEquals("1", executor.armedRequestId());

        clock.advanceNanos(DEADLINE - 1);
        scheduler.runDueTasks();
        assertTrue(events.isEmpty());

        clock.advanceNanos(1);
        scheduler.runDueTasks();
        assertEquals(1, events.size());
        assertEquals("1", ((BridgeTimeoutEvent.RequestTimeout) events.get(0)).requestId());
    }

    @Test
    void completionCancelsTimeout() {
        executor.execute(send("1"));
        executor.execute(BridgeIntents.of(new BridgeIntents.CompleteWrite("1", 3)));

        assertNull(executor.armedRequestId());
        assertEquals(0, scheduler.pendingCount());

        clock.advanceSeconds(60);
        scheduler.runDueTasks();
        assertTrue(events.isEmpty());
    }

    @Test
    void rejectionOfAnotherRequestKeepsTimeoutArmed() {
        executor.execute(send("1"));
        executor.execute(BridgeIntents.of(new BridgeIntents.FailRequest("2", Reason.REQUEST_IN_PROGRESS, "busy")));

        assertEquals("1", executor.armedRequestId());
        clock.advanceSeconds(30);
        scheduler.runDueTasks();
        assertEquals(1, events.size());
    }

    @Test
    void staleTaskThatSlipsPastCancelDoesNothing() {
        List<Runnable> captured = new ArrayList<>();
        TimedBridgeIntentExecutor capturing = new TimedBridgeIntentExecutor(delegated::add, events::add,
                (deadline, task) -> {
                    captured.add(task);
                    return () -> false;
                }, Instant::now);

        capturing.execute(send("1"));
        capturing.execute(BridgeIntents.of(new BridgeIntents.FailRequest("1", Reason.TIMEOUT, "x")));
        captured.get(0).run();

        assertTrue(events.isEmpty());
    }

    @Test
    void intentsWithoutRequestsOnlyDelegate() {
        executor.execute(BridgeIntents.of(new BridgeIntents.ReportViolation("noise")));

        assertEquals(1, delegated.size());
        assertEquals(0, scheduler.pendingCount());
    }
}
