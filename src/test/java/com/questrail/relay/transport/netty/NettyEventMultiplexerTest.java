package com.questrail.relay.transport.netty;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class NettyEventMultiplexerTest {

    private final NettyEventMultiplexer multiplexer = new NettyEventMultiplexer("multiplexer-test");

    @AfterEach
    void tearDown() throws InterruptedException {
        multiplexer.shutdown();
        assertTrue(multiplexer.awaitTermination(Duration.ofSeconds(5)));
    }

    @Test
    void afterIoTasksRunBehindEverythingQueuedInTheSameIteration() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        multiplexer.execute(() -> {
            multiplexer.executeAfterIo(() -> {
                order.add("read");
                done.countDown();
            });
            multiplexer.execute(() -> order.add("accept"));
            order.add("current");
        });

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertEquals(List.of("current", "accept", "read"), order);
    }

    @Test
    void afterIoIsRejectedOffTheLoop() {
        assertThrows(IllegalStateException.class, () -> multiplexer.executeAfterIo(() -> {}));
    }

    @Test
    void callRunsOnTheLoopThread() {
        assertTrue(multiplexer.call(multiplexer::inLoop));
        assertFalse(multiplexer.inLoop());
    }

    @Test
    void shutdownIsObservable() throws InterruptedException {
        assertFalse(multiplexer.isShuttingDown());

        multiplexer.shutdown();

        assertTrue(multiplexer.isShuttingDown());
        assertTrue(multiplexer.awaitTermination(Duration.ofSeconds(5)));
        assertTrue(multiplexer.isTerminated());
    }
}
