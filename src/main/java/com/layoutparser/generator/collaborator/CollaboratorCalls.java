package com.layoutparser.generator.collaborator;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import com.layoutparser.generator.exception.CollaboratorException;

/**
 * Runs collaborator calls with a deadline. Expiry is a hard failure for that call.
 */
public final class CollaboratorCalls {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "collaborator-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private CollaboratorCalls() {
        // Utility class
    }

    /**
     * Starts a helper task for a collaborator call, e.g. draining a process stream.
     */
    public static <T> Future<T> background(Callable<T> task) {
        return EXECUTOR.submit(task);
    }

    public static <T> T call(String collaborator, Duration timeout, Callable<T> action) {
        Future<T> future = EXECUTOR.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw CollaboratorException.timedOut(collaborator, timeout.toSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CollaboratorException collaboratorException) {
                throw collaboratorException;
            }
            throw new CollaboratorException(collaborator, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorException(collaborator, "interrupted", e);
        }
    }
}
