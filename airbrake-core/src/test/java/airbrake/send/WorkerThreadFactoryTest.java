package airbrake.send;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerThreadFactoryTest {

    @Test
    void threadsAreNumberedDaemonsPerSender() {
        WorkerThreadFactory factory = new WorkerThreadFactory();
        WorkerThreadFactory other = new WorkerThreadFactory();

        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertTrue(first.isDaemon() && second.isDaemon());
        assertTrue(factory.prefix().startsWith(WorkerThreadFactory.NAME_PREFIX));
        assertEquals(factory.prefix() + "1", first.getName());
        assertEquals(factory.prefix() + "2", second.getName());
        assertNotEquals(factory.prefix(), other.prefix());
    }

    @Test
    void workerCountsAsLiveUntilLoopReturns() throws Exception {
        WorkerThreadFactory factory = new WorkerThreadFactory();
        CountDownLatch release = new CountDownLatch(1);

        Runnable worker = factory.worker(() -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertEquals(1, factory.liveWorkers());

        Thread thread = factory.newThread(worker);
        thread.start();
        release.countDown();
        thread.join(5000);

        assertEquals(0, factory.liveWorkers());
    }

    @Test
    void workerStopsCountingWhenLoopThrows() throws Exception {
        WorkerThreadFactory factory = new WorkerThreadFactory();
        Thread thread = factory.newThread(factory.worker(() -> {
            throw new IllegalStateException("loop failed");
        }));

        thread.start();
        thread.join(5000);

        assertEquals(0, factory.liveWorkers());
    }
}
