package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.BridgeRequestException;
import com.questrail.spooltag.bridge.TagReadResult;
import com.questrail.spooltag.bridge.WriteOutcome;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class PendingCompletionsTest {

    private final PendingCompletions completions = new PendingCompletions();

    @Test
    void firstOutcomeWins() {
        CompletableFuture<WriteOutcome> f = completions.registerWrite("1");

        assertTrue(completions.completeWrite("1", new WriteOutcome(5)));
        assertFalse(completions.fail("1", new IllegalStateException("late")));
        assertEquals(new WriteOutcome(5), f.getNow(null));
        assertEquals(0, completions.size());
    }

    @Test
    void duplicateIdIsRejected() {
        completions.registerRead("1");
        assertThrows(IllegalStateException.class, () -> completions.registerRead("1"));
    }

    @Test
    void unknownIdIsIgnored() {
        assertFalse(completions.completeRead("nope", null));
        assertFalse(completions.completeWrite("nope", new WriteOutcome(0)));
    }

    @Test
    void failAllFailsReadsAndWrites() {
        CompletableFuture<TagReadResult> read = completions.registerRead("1");
        CompletableFuture<WriteOutcome> write = completions.registerWrite("2");

        completions.failAll(new BridgeRequestException(BridgeRequestException.Reason.NO_BRIDGE_CONNECTED, "stopped"));

        assertTrue(read.isCompletedExceptionally());
        assertTrue(write.isCompletedExceptionally());
        assertEquals(0, completions.size());
    }
}
