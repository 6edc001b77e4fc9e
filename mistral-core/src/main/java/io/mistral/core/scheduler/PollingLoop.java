package io.mistral.core.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.mistral.core.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static io.mistral.core.log.LogMarkers.UNEXPECTED_SERVER_ERROR;

/**
 * Background thread that runs a poll function repeatedly, sleeping
 * fixed_delay plus a random 0 to random_delay seconds before each run.
 *
 * Errors thrown by the poll function are logged and the loop continues.
 * Can be started again after it's stopped.
 */
public class PollingLoop
{
    private static final Logger logger = LoggerFactory.getLogger(PollingLoop.class);

    private final SchedulerConfig config;
    private final ThreadFactory threadFactory;

    private Worker worker;  // guarded by this

    public PollingLoop(String threadNameFormat, SchedulerConfig config)
    {
        this.config = config;
        this.threadFactory = new ThreadFactoryBuilder()
            .setDaemon(true)
            .setNameFormat(threadNameFormat)
            .build();
    }

    /**
     * Returns false if the loop is already running.
     */
    public synchronized boolean start(Runnable poll, ErrorReporter errorReporter)
    {
        if (worker != null) {
            return false;
        }
        worker = new Worker(poll, errorReporter);
        worker.thread = threadFactory.newThread(worker);
        worker.thread.start();
        return true;
    }

    /**
     * Wakes up and stops the loop. If graceful, waits until the current poll returns.
     * Returns false if the loop wasn't running.
     */
    public boolean stop(boolean graceful)
    {
        Worker stopping;
        synchronized (this) {
            stopping = worker;
            worker = null;
        }
        if (stopping == null) {
            return false;
        }
        stopping.shutdown();
        if (graceful && stopping.thread != Thread.currentThread()) {
            try {
                stopping.thread.join();
            }
            catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        return true;
    }

    private class Worker
            implements Runnable
    {
        private final Runnable poll;
        private final ErrorReporter errorReporter;
        private Thread thread;
        private boolean stopped = false;  // guarded by this

        Worker(Runnable poll, ErrorReporter errorReporter)
        {
            this.poll = poll;
            this.errorReporter = errorReporter;
        }

        @Override
        public void run()
        {
            while (sleep()) {
                try {
                    poll.run();
                }
                catch (Throwable t) {
                    logger.error(UNEXPECTED_SERVER_ERROR, "An uncaught exception is ignored. Polling will be retried.", t);
                    errorReporter.reportUncaughtError(t);
                }
            }
        }

        // returns false if stopped
        private synchronized boolean sleep()
        {
            long delay = TimeUnit.SECONDS.toMillis(config.getFixedDelay()) +
                ThreadLocalRandom.current().nextLong(TimeUnit.SECONDS.toMillis(config.getRandomDelay()) + 1);
            long deadline = System.currentTimeMillis() + delay;
            try {
                while (!stopped) {
                    long remaining = deadline - System.currentTimeMillis();
                    if (remaining <= 0) {
                        return true;
                    }
                    wait(remaining);
                }
            }
            catch (InterruptedException ex) {
                stopped = true;
            }
            return false;
        }

        synchronized void shutdown()
        {
            stopped = true;
            notifyAll();
        }
    }
}
