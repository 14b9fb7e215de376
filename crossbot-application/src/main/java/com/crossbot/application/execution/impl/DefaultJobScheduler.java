package com.crossbot.application.execution.impl;

import com.crossbot.application.execution.CancellableTask;
import com.crossbot.application.execution.CancellationToken;
import com.crossbot.application.execution.JobScheduler;
import com.crossbot.application.execution.RunHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler backed by a cached pool of daemon threads; one thread per submitted task.
 */
public class DefaultJobScheduler implements JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultJobScheduler.class);

    private final ExecutorService executor;

    public DefaultJobScheduler() {
        this.executor = Executors.newCachedThreadPool(new NamedDaemonFactory("crossbot-worker"));
    }

    @Override
    public RunHandle submit(String key, CancellableTask task) {
        CancellationToken token = new CancellationToken();
        AtomicBoolean started = new AtomicBoolean();
        CountDownLatch exited = new CountDownLatch(1);
        Future<?> future = executor.submit(() -> {
            started.set(true);
            String previous = Thread.currentThread().getName();
            Thread.currentThread().setName(previous + "-" + key);
            try {
                task.run(token);
            } finally {
                Thread.currentThread().setName(previous);
                exited.countDown();
            }
        });
        return new Handle(token, future, started, exited);
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * A cancelled Future reports done at once, while its thread may still be running;
     * termination is therefore tracked on the task body itself.
     */
    private static final class Handle implements RunHandle {
        private final CancellationToken token;
        private final Future<?> future;
        private final AtomicBoolean started;
        private final CountDownLatch exited;

        private Handle(CancellationToken token, Future<?> future, AtomicBoolean started, CountDownLatch exited) {
            this.token = token;
            this.future = future;
            this.started = started;
            this.exited = exited;
        }

        @Override
        public void cancel() {
            token.cancel();
        }

        @Override
        public boolean awaitTermination(long timeoutMs) {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
            try {
                future.get(timeoutMs, TimeUnit.MILLISECONDS);
                return true;
            } catch (TimeoutException e) {
                return false;
            } catch (CancellationException e) {
                return awaitExit(deadline);
            } catch (ExecutionException e) {
                log.error("[WORKER] terminated with error", e.getCause());
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return !isRunning();
            }
        }

        private boolean awaitExit(long deadlineNanos) {
            if (!started.get()) return true;
            try {
                return exited.await(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return exited.getCount() == 0;
            }
        }

        @Override
        public void forceStop() {
            token.cancel();
            future.cancel(true);
        }

        @Override
        public boolean isRunning() {
            if (!future.isDone()) return true;
            return started.get() && exited.getCount() > 0;
        }
    }

    private static final class NamedDaemonFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger();

        private NamedDaemonFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
