package me.internalizable.tatc.api.http;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RequestContext")
class RequestContextTest {

    private static RequestContext context(String clientHost, byte[] body) {
        return new RequestContext(
            1L,
            new ClientAddress(clientHost, 0),
            Scheme.HTTP,
            "example.org",
            "POST",
            "/items?limit=5",
            "/items",
            "limit=5",
            RequestHeaders.builder().add("Host", "example.org").build(),
            body);
    }

    @Nested
    @DisplayName("Body")
    class BodyTests {

        @Test
        @DisplayName("Should not expose its body array")
        void shouldNotExposeBody() {
            byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
            var ctx = context("203.0.113.5", body);

            body[0] = 'j';
            ctx.body()[1] = 'a';

            assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), ctx.body());
            assertEquals(5, ctx.bodyLength());
        }

        @Test
        @DisplayName("Should treat a null body as empty")
        void shouldTreatNullBodyAsEmpty() {
            var ctx = context("203.0.113.5", null);

            assertEquals(0, ctx.body().length);
        }
    }

    @Nested
    @DisplayName("Equality")
    class EqualityTests {

        @Test
        @DisplayName("Should compare bodies by content")
        void shouldCompareBodiesByContent() {
            var a = context("203.0.113.5", new byte[] {1, 2, 3});
            var b = context("203.0.113.5", new byte[] {1, 2, 3});

            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("Should differ when the client differs")
        void shouldDifferByClient() {
            assertNotEquals(context("203.0.113.5", null), context("203.0.113.6", null));
        }
    }

    @Nested
    @DisplayName("ClientAddress")
    class ClientAddressTests {

        @Test
        @DisplayName("Should take host and port from a socket address")
        void shouldConvertSocketAddress() {
            var address = ClientAddress.of(new InetSocketAddress("10.0.0.1", 41234));

            assertEquals("10.0.0.1", address.host());
            assertEquals(41234, address.port());
            assertEquals("10.0.0.1:41234", address.toString());
        }

        @Test
        @DisplayName("Should bracket IPv6 hosts when printed")
        void shouldBracketIpv6() {
            assertEquals("[2001:db8::1]:0", new ClientAddress("2001:db8::1", 0).toString());
        }

        @Test
        @DisplayName("Should reject empty hosts and bad ports")
        void shouldRejectInvalidValues() {
            assertThrows(IllegalArgumentException.class, () -> new ClientAddress("", 0));
            assertThrows(IllegalArgumentException.class, () -> new ClientAddress("10.0.0.1", 70000));
        }
    }

    @Nested
    @DisplayName("HandlerResponse")
    class HandlerResponseTests {

        @Test
        @DisplayName("Should build a JSON response")
        void shouldBuildJson() {
            var response = HandlerResponse.json(404, "{\"detail\":\"Not Found\"}");

            assertEquals(404, response.status());
            assertEquals(HandlerResponse.APPLICATION_JSON, response.headers().get(0).getValue());
            assertEquals("{\"detail\":\"Not Found\"}", new String(response.body(), StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Should reject status codes outside 100-599")
        void shouldRejectBadStatus() {
            assertThrows(IllegalArgumentException.class, () -> HandlerResponse.empty(42));
            assertThrows(IllegalArgumentException.class, () -> HandlerResponse.empty(600));
        }
    }
}
