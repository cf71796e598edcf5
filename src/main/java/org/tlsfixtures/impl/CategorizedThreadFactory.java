package org.tlsfixtures.impl;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A ThreadFactory that names threads after the server they belong to and remembers them, so the server can join its
 * threads on shutdown.
 */
public class CategorizedThreadFactory implements ThreadFactory {
    private static final Logger log = LoggerFactory.getLogger(CategorizedThreadFactory.class);

    private final String name;
    private final String category;
    private final int uniqueServerId;

    private final AtomicInteger threadCount = new AtomicInteger(0);

    private final List<Thread> threads = new CopyOnWriteArrayList<>();

    /**
     * Exception handler for server threads. Logs the name of the thread and the exception that was caught.
     */
    private static final Thread.UncaughtExceptionHandler UNCAUGHT_EXCEPTION_HANDLER = (t, e) -> log.error("Uncaught throwable in thread: {}", t.getName(), e);


    /**
     * @param name the user-supplied name of the server
     * @param category the type of threads this factory is creating (e.g. event loop)
     * @param uniqueServerId a unique number for the server creating this thread factory, to differentiate multiple servers with the same name
     */
    public CategorizedThreadFactory(String name, String category, int uniqueServerId) {
        this.category = category;
        this.name = name;
        this.uniqueServerId = uniqueServerId;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread t = new Thread(r, name + "-" + uniqueServerId + "-" + category + "-" + threadCount.getAndIncrement());

        t.setUncaughtExceptionHandler(UNCAUGHT_EXCEPTION_HANDLER);
        threads.add(t);

        return t;
    }

    /**
     * Returns every thread this factory has created so far.
     */
    public List<Thread> getThreads() {
        return ImmutableList.copyOf(threads);
    }

    /**
     * Waits for every thread created by this factory to die.
     *
     * @return true if all threads exited within the timeout
     */
    public boolean joinAll(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        for (Thread t : threads) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return allDead();
            }
            t.join(remainingMs);
        }
        return allDead();
    }

    private boolean allDead() {
        for (Thread t : threads) {
            if (t.isAlive()) {
                return false;
            }
        }
        return true;
    }

}
