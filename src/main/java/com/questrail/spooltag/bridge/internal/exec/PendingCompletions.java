package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.BridgeRequestException;
import com.questrail.spooltag.bridge.TagReadResult;
import com.questrail.spooltag.bridge.WriteOutcome;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caller-facing futures keyed by request id.
 *
 * <p>A future is registered before its request event is submitted and removed
 * the first time it is completed or failed, so a late second outcome for the
 * same id is a no-op.</p>
 */
public final class PendingCompletions
{
    private final Map<String, CompletableFuture<TagReadResult>> reads = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<WriteOutcome>> writes = new ConcurrentHashMap<>();

    public CompletableFuture<TagReadResult> registerRead(String requestId) {
        CompletableFuture<TagReadResult> f = new CompletableFuture<>();
        if (reads.putIfAbsent(Objects.requireNonNull(requestId, "requestId"), f) != null) {
            throw new IllegalStateException("duplicate request id " + requestId);
        }
        return f;
    }

    public CompletableFuture<WriteOutcome> registerWrite(String requestId) {
        CompletableFuture<WriteOutcome> f = new CompletableFuture<>();
        if (writes.putIfAbsent(Objects.requireNonNull(requestId, "requestId"), f) != null) {
            throw new IllegalStateException("duplicate request id " + requestId);
        }
        return f;
    }

    public boolean completeRead(String requestId, TagReadResult result) {
        CompletableFuture<TagReadResult> f = reads.remove(requestId);
        return f != null && f.complete(result);
    }

    public boolean completeWrite(String requestId, WriteOutcome outcome) {
        CompletableFuture<WriteOutcome> f = writes.remove(requestId);
        return f != null && f.complete(outcome);
    }

    public boolean fail(String requestId, Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        CompletableFuture<TagReadResult> r = reads.remove(requestId);
        if (r != null) {
            return r.completeExceptionally(cause);
        }
        CompletableFuture<WriteOutcome> w = writes.remove(requestId);
        return w != null && w.completeExceptionally(cause);
    }

    /** Fails everything still outstanding, used on shutdown. */
    public void failAll(BridgeRequestException cause) {
        for (String id : reads.keySet()) {
            fail(id, cause);
        }
        for (String id : writes.keySet()) {
            fail(id, cause);
        }
    }

    public int size() {
        return reads.size() + writes.size();
    }
}
