package me.internalizable.tatc.trust;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import me.internalizable.tatc.config.ConfigurationException;

@DisplayName("TrustConfig")
class TrustConfigTest {

    @Test
    @DisplayName("Should default to the conventional forwarding headers")
    void shouldUseConventionalDefaults() {
        var config = TrustConfig.enabledForAnyPeer();

        assertTrue(config.isEnabled());
        assertEquals("X-Forwarded-For", config.getForwardedForHeader());
        assertEquals("X-Forwarded-Proto", config.getForwardedProtoHeader());
        assertEquals("X-Forwarded-Host", config.getForwardedHostHeader());
        assertTrue(config.getTrustedProxies().trustsAny());
    }

    @Test
    @DisplayName("Should be disabled by default")
    void shouldBeDisabledByDefault() {
        assertFalse(TrustConfig.builder().build().isEnabled());
        assertFalse(TrustConfig.disabled().isEnabled());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "X Forwarded For", "X-Forwarded-For:", "X-Client(IP)", "Ünicode"})
    @DisplayName("Should reject invalid header names")
    void shouldRejectInvalidHeaderNames(String name) {
        assertThrows(ConfigurationException.class,
            () -> TrustConfig.builder().enabled(true).forwardedForHeader(name).build());
    }

    @Test
    @DisplayName("Should reject a missing header name")
    void shouldRejectNullHeaderName() {
        assertThrows(ConfigurationException.class,
            () -> TrustConfig.builder().forwardedProtoHeader(null).build());
    }

    @Test
    @DisplayName("Should compare header names case-insensitively")
    void shouldCompareCaseInsensitively() {
        var a = TrustConfig.builder().enabled(true).forwardedForHeader("x-real-ip").build();
        var b = TrustConfig.builder().enabled(true).forwardedForHeader("X-Real-IP").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
