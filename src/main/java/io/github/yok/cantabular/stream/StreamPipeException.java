package io.github.yok.cantabular.stream;

/**
 * Failure of a {@link StreamPipe} run. The cause is the transformer failure when there is one,
 * otherwise the consumer failure; when both failed, the consumer failure is attached as suppressed.
 */
public class StreamPipeException extends Exception {

    private static final long serialVersionUID = 1L;

    public StreamPipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
