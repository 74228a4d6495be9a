package me.internalizable.tatc.server;

/**
 * The front end could not start, typically because the port could not be bound.
 */
public class FrontendStartupException extends Exception {

    public FrontendStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
