package com.questrail.relay.transport.netty;

import com.questrail.relay.transport.EventMultiplexer;

import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SingleThreadEventLoop;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.Future;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * NettyEventMultiplexer
 * =============================================================================
 * Netty-backed {@link EventMultiplexer}: a {@link NioEventLoopGroup} with exactly
 * one {@link EventLoop}.
 *
 * <h2>Architectural Role</h2>
 * Every channel of one relay (the listening or datagram socket and every
 * accepted connection) is registered with this single loop, so one selector
 * wait covers all of them. Termination requests are queued as loop tasks and
 * wake the same wait.
 *
 * <p>Selector readiness is level-triggered and the loop never applies a wait
 * timeout of its own. Registration is per channel: a channel is watched from
 * registration until it is closed. There is no global watch list to
 * rebuild.</p>
 *
 * <h2>Netty containment rule</h2>
 * {@link #group()} is for the Netty endpoints in sibling {@code netty}
 * packages only. Netty types MUST NOT escape to the relay core.
 */
public final class NettyEventMultiplexer implements EventMultiplexer
{
    private final EventLoopGroup group;
    private final EventLoop loop;

    public NettyEventMultiplexer(String threadName)
    {
        Objects.requireNonNull(threadName, "threadName");
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory(threadName));
        this.loop = group.next();
    }

    /**
     * The one-loop group every relay channel must be registered with.
     */
    public EventLoopGroup group()
    {
        return group;
    }

    @Override
    public void execute(Runnable task)
    {
        loop.execute(Objects.requireNonNull(task, "task"));
    }

    @Override
    public void executeAfterIo(Runnable task)
    {
        Objects.requireNonNull(task, "task");
        if (!loop.inEventLoop()) {
            throw new IllegalStateException("executeAfterIo must be called from the event loop");
        }
        if (loop instanceof SingleThreadEventLoop single) {
            // Tail tasks run after the selected keys and the task queue of
            // the current iteration have been processed.
            single.executeAfterEventLoopIteration(task);
        } else {
            loop.execute(task);
        }
    }

    @Override
    public <T> T call(Callable<T> task)
    {
        Objects.requireNonNull(task, "task");
        if (loop.inEventLoop()) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException("Loop task failed", e);
            }
        }
        Future<T> future = loop.submit(task);
        return future.syncUninterruptibly().getNow();
    }

    @Override
    public boolean inLoop()
    {
        return loop.inEventLoop();
    }

    @Override
    public void shutdown()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    @Override
    public boolean awaitTermination(Duration timeout) throws InterruptedException
    {
        return group.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public boolean isShuttingDown()
    {
        return group.isShuttingDown();
    }

    @Override
    public boolean isTerminated()
    {
        return group.isTerminated();
    }
}
