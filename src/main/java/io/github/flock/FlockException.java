package io.github.flock;

public class FlockException extends RuntimeException {

    public FlockException(String message) {
        super(message);
    }

    public FlockException(Throwable cause) {
        super(cause);
    }

    public FlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
