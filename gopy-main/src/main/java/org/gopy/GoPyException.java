package org.gopy;

public class GoPyException extends RuntimeException {

    public GoPyException(String message) {
        super(message);
    }

    public GoPyException(String message, Throwable cause) {
        super(message, cause);
    }

    public GoPyException(Throwable cause) {
        super(cause);
    }
}
