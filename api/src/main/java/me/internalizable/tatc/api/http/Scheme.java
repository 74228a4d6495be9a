package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;

/**
 * URI scheme a request was originally made with.
 */
public enum Scheme {

    HTTP("http"),
    HTTPS("https");

    private final String value;

    Scheme(String value) {
        this.value = value;
    }

    /**
     * @return the lowercase scheme name as it appears in a URI
     */
    @Nonnull
    public String value() {
        return value;
    }

    public boolean isSecure() {
        return this == HTTPS;
    }

    @Override
    public String toString() {
        return value;
    }
}
