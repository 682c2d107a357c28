package airbrake;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PromiseTest {

    // ── Transitions ─────────────────────────────────────────────────

    @Test
    void startsPending() {
        Promise<String> promise = new Promise<>();
        assertTrue(promise.isPending());
        assertFalse(promise.isResolved());
        assertFalse(promise.isRejected());
        assertEquals(Optional.empty(), promise.value(Duration.ZERO));
    }

    @Test
    void resolveReturnsSamePromise() {
        Promise<String> promise = new Promise<>();
        assertSame(promise, promise.resolve("ok"));
        assertEquals(Outcome.resolved("ok"), promise.value());
    }

    @Test
    void rejectAfterResolveIsIgnored() {
        Promise<String> promise = new Promise<>();
        promise.resolve("first");
        promise.reject("late");
        promise.resolve("second");

        assertTrue(promise.isResolved());
        assertEquals(Outcome.resolved("first"), promise.value());
    }

    @Test
    void resolveAfterRejectIsIgnored() {
        Promise<String> promise = new Promise<>();
        promise.reject("boom");
        promise.resolve("late");
        promise.reject("again");

        assertTrue(promise.isRejected());
        assertEquals(Outcome.rejected("boom"), promise.value());
    }

    @Test
    void rejectRequiresReason() {
        assertThrows(NullPointerException.class, () -> new Promise<String>().reject(null));
    }

    // ── Callbacks ───────────────────────────────────────────────────

    @Test
    void thenRunsOnResolveOnly() {
        List<String> seen = new ArrayList<>();
        Promise<String> promise = new Promise<String>()
                .then(v -> seen.add("then:" + v))
                .rescue(r -> seen.add("rescue:" + r));

        promise.resolve("42");
        promise.reject("ignored");

        assertEquals(List.of("then:42"), seen);
    }

    @Test
    void callbacksRegisteredAfterCompletionRunImmediately() {
        List<String> seen = new ArrayList<>();
        Promise<String> promise = new Promise<String>().reject("nope");

        promise.then(v -> seen.add("then:" + v));
        promise.rescue(r -> seen.add("rescue:" + r));

        assertEquals(List.of("rescue:nope"), seen);
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        List<String> seen = new ArrayList<>();
        Promise<String> promise = new Promise<String>()
                .then(v -> { throw new IllegalStateException("callback bug"); })
                .then(seen::add);

        promise.resolve("value");

        assertEquals(List.of("value"), seen);
        assertTrue(promise.isResolved());
    }

    // ── Blocking ────────────────────────────────────────────────────

    @Test
    void valueBlocksUntilResolvedFromAnotherThread() throws Exception {
        Promise<String> promise = new Promise<>();
        CountDownLatch waiting = new CountDownLatch(1);
        AtomicReference<Outcome<String>> observed = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            waiting.countDown();
            observed.set(promise.value());
        });
        waiter.start();

        assertTrue(waiting.await(1, TimeUnit.SECONDS));
        promise.resolve("done");
        waiter.join(2000);

        assertEquals(Outcome.resolved("done"), observed.get());
    }

    @Test
    void timedValueReturnsEmptyWhilePending() {
        Promise<String> promise = new Promise<>();
        assertTrue(promise.value(Duration.ofMillis(20)).isEmpty());
    }

    @Test
    void interruptedValueRestoresFlag() {
        Promise<String> promise = new Promise<>();
        Thread.currentThread().interrupt();
        try {
            Outcome<String> outcome = promise.value();
            assertInstanceOf(Outcome.Rejected.class, outcome);
            assertTrue(Thread.currentThread().isInterrupted());
            assertTrue(promise.isPending());
        } finally {
            Thread.interrupted();
        }
    }
}
