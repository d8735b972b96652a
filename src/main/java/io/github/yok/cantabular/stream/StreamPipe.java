package io.github.yok.cantabular.stream;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Transforms an input stream and consumes the transformed bytes concurrently.
 *
 * <p>
 * Two threads are started and joined by a pipe:
 * </p>
 * <ul>
 * <li>the transformer reads {@code body} and writes to the pipe; when it returns, the body and the
 * write end of the pipe are closed;</li>
 * <li>the consumer reads from the pipe; when it returns, the read end is closed so that a
 * transformer still writing fails instead of blocking.</li>
 * </ul>
 * <p>
 * {@link #stream} blocks until both threads have finished.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class StreamPipe {

    static final int PIPE_BUFFER_SIZE = 64 * 1024;

    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private StreamPipe() {
        // Utility class; do not instantiate.
    }

    /**
     * Reads from {@code in} and writes the transformed data to {@code out}.
     */
    @FunctionalInterface
    public interface Transformer {
        void transform(InputStream in, OutputStream out) throws Exception;
    }

    /**
     * Reads the transformed data.
     */
    @FunctionalInterface
    public interface Consumer {
        void consume(InputStream in) throws Exception;
    }

    /**
     * Runs {@code transform} over {@code body} and feeds its output to {@code consume}.
     *
     * @param body source stream; always closed
     * @param transform transformer run on its own thread
     * @param consume consumer run on its own thread
     * @throws StreamPipeException if the transformer, the consumer or both failed
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public static void stream(InputStream body, Transformer transform, Consumer consume)
            throws StreamPipeException, InterruptedException {
        PipedInputStream pipeIn = new PipedInputStream(PIPE_BUFFER_SIZE);
        PipedOutputStream pipeOut;
        try {
            pipeOut = new PipedOutputStream(pipeIn);
        } catch (IOException e) {
            close(body, "response body");
            throw new StreamPipeException("failed to create pipe: " + e.getMessage(), e);
        }

        int seq = THREAD_SEQ.incrementAndGet();
        ExecutorService pool = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "stream-pipe-" + seq);
            t.setDaemon(true);
            return t;
        });
        try {
            Future<?> transformer = pool.submit(() -> {
                try {
                    transform.transform(body, pipeOut);
                } finally {
                    close(body, "response body");
                    close(pipeOut, "pipe writer");
                }
                return null;
            });
            Future<?> consumer = pool.submit(() -> {
                try {
                    consume.consume(pipeIn);
                } finally {
                    close(pipeIn, "pipe reader");
                }
                return null;
            });

            Throwable transformError = outcome(transformer);
            Throwable consumeError = outcome(consumer);
            if (transformError != null && consumeError != null) {
                StreamPipeException e = new StreamPipeException(String.format(
                        "transform error: %s, consumer error: %s", transformError.getMessage(),
                        consumeError.getMessage()), transformError);
                e.addSuppressed(consumeError);
                throw e;
            }
            if (transformError != null) {
                throw new StreamPipeException("transform error: " + transformError.getMessage(),
                        transformError);
            }
            if (consumeError != null) {
                throw new StreamPipeException("consumer error: " + consumeError.getMessage(),
                        consumeError);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static Throwable outcome(Future<?> future) throws InterruptedException {
        try {
            future.get();
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private static void close(Closeable c, String what) {
        try {
            c.close();
        } catch (IOException e) {
            log.error("stream error: error closing {}", what, e);
        }
    }
}
