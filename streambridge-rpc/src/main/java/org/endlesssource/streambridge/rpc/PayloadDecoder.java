package org.endlesssource.streambridge.rpc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.endlesssource.streambridge.api.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns an opaque RPC result into maps, lists and scalars.
 * <p>
 * Strings holding JSON are decoded, repeatedly for payloads that were encoded
 * twice. A result envelope is unwrapped; one carrying an {@code error} becomes
 * a {@link BackendException}. A string that is not JSON is returned as is.
 */
public final class PayloadDecoder {
    private static final Logger logger = LoggerFactory.getLogger(PayloadDecoder.class);

    private static final Gson GSON = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .create();
    private static final TypeAdapter<Object> VALUES = GSON.getAdapter(Object.class);

    private static final Set<String> ENVELOPE_KEYS = Set.of("result", "value", "error", "id", "jsonrpc", "status");
    private static final int MAX_DEPTH = 8;

    private PayloadDecoder() {
    }

    public static Object decode(Object raw) {
        Object value = raw;
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            if (value instanceof String text) {
                Optional<Object> parsed = parse(text);
                if (parsed.isEmpty()) {
                    return text;
                }
                value = parsed.get();
            } else if (value instanceof Map<?, ?> map && map.get("error") != null) {
                throw new BackendException("Extension reported an error: " + describeError(map.get("error")));
            } else if (value instanceof Map<?, ?> map && isEnvelope(map)) {
                value = map.containsKey("result") ? map.get("result") : map.get("value");
            } else {
                return value;
            }
        }
        throw new BackendException("Payload is nested more than " + MAX_DEPTH + " levels deep");
    }

    private static boolean isEnvelope(Map<?, ?> map) {
        return (map.containsKey("result") || map.containsKey("value")) && ENVELOPE_KEYS.containsAll(map.keySet());
    }

    private static Optional<Object> parse(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "{[\"".indexOf(trimmed.charAt(0)) < 0) {
            return Optional.empty();
        }
        try {
            JsonReader reader = new JsonReader(new StringReader(trimmed));
            Object parsed = VALUES.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                logger.debug("Trailing data after JSON payload, keeping it as text");
                return Optional.empty();
            }
            return Optional.ofNullable(parsed);
        } catch (IOException | JsonParseException | IllegalStateException e) {
            logger.debug("Payload is not JSON, keeping it as text: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static String describeError(Object error) {
        if (error instanceof Map<?, ?> details) {
            Object message = details.get("message");
            if (message != null) {
                Object code = details.get("code");
                return code == null ? message.toString() : message + " (" + code + ")";
            }
        }
        return error.toString();
    }
}
