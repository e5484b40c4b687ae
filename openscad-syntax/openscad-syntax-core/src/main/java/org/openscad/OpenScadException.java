package org.openscad;

public class OpenScadException extends RuntimeException {

    public OpenScadException(String message) {
        super(message);
    }

    public OpenScadException(String message, Throwable cause) {
        super(message, cause);
    }

    public OpenScadException(Throwable cause) {
        super(cause);
    }
}
