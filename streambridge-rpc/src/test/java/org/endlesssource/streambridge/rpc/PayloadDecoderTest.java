package org.endlesssource.streambridge.rpc;

import org.endlesssource.streambridge.api.BackendException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadDecoderTest {

    @Test
    void decode_jsonObjectString_becomesMap() {
        Object decoded = PayloadDecoder.decode("{\"items\":[{\"asin\":\"B1\",\"title\":\"X\"}],\"total\":1}");

        Map<?, ?> map = assertInstanceOf(Map.class, decoded);
        assertEquals(List.of(Map.of("asin", "B1", "title", "X")), map.get("items"));
        assertEquals(1L, map.get("total"));
    }

    @Test
    void decode_doubleEncodedPayload_isDecodedTwice() {
        String inner = "{\"manifestUrl\":\"https://cdn.example/a.mpd\"}";
        String outer = "\"" + inner.replace("\"", "\\\"") + "\"";

        Map<?, ?> map = assertInstanceOf(Map.class, PayloadDecoder.decode(outer));

        assertEquals("https://cdn.example/a.mpd", map.get("manifestUrl"));
    }

    @Test
    void decode_resultEnvelope_isUnwrapped() {
        Object decoded = PayloadDecoder.decode(Map.of("jsonrpc", "2.0", "id", 1, "result", "[\"a\",\"b\"]"));

        assertEquals(List.of("a", "b"), decoded);
    }

    @Test
    void decode_valueEnvelopeHoldingScalar_returnsScalar() {
        assertEquals("DE", PayloadDecoder.decode("{\"value\":\"DE\"}"));
    }

    @Test
    void decode_errorField_throwsBackendException() {
        BackendException e = assertThrows(BackendException.class,
                () -> PayloadDecoder.decode("{\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}"));

        assertTrue(e.getMessage().contains("Method not found"));
    }

    @Test
    void decode_nonJsonString_isKeptAsLiteral() {
        assertEquals("not json", PayloadDecoder.decode("not json"));
        assertEquals("{broken", PayloadDecoder.decode("{broken"));
        assertEquals("true", PayloadDecoder.decode("true"));
    }

    @Test
    void decode_payloadWithOwnValueField_isNotTreatedAsEnvelope() {
        Map<String, Object> payload = Map.of("value", "x", "title", "Kept");

        assertSame(payload, PayloadDecoder.decode(payload));
    }

    @Test
    void decode_nonStringScalars_passThrough() {
        assertNull(PayloadDecoder.decode(null));
        assertEquals(Boolean.TRUE, PayloadDecoder.decode(Boolean.TRUE));
    }
}
