package me.internalizable.tatc.connection;

/**
 * Lifecycle of a {@link Connection}. There is no way back from {@link #CLOSED}.
 */
public enum ConnectionState {
    OPEN,
    CLOSED
}
