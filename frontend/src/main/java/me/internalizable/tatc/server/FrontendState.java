package me.internalizable.tatc.server;

/**
 * States of the listening socket.
 *
 * <pre>
 * UNBOUND --bind--> BOUND --accept loop--> ACCEPTING --stop--> CLOSED
 * </pre>
 *
 * <p>A failed bind goes straight to {@link #CLOSED}. Nothing leaves {@link #CLOSED}.</p>
 */
public enum FrontendState {
    UNBOUND,
    BOUND,
    ACCEPTING,
    CLOSED
}
