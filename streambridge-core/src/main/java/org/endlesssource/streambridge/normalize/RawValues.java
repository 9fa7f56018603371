package org.endlesssource.streambridge.normalize;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lenient coercions for provider-shaped values. Nothing here throws on bad input.
 */
final class RawValues {
    private RawValues() {
    }

    /**
     * First non-null value among {@code keys}, in order.
     */
    static Object first(Map<?, ?> raw, List<String> keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Follow nested maps along {@code path}; null as soon as a step is missing.
     */
    static Object path(Map<?, ?> raw, String... path) {
        Object current = raw;
        for (String step : path) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(step);
        }
        return current;
    }

    static String string(Object value) {
        if (value instanceof CharSequence sequence) {
            String trimmed = sequence.toString().trim();
            return trimmed.isEmpty() ? null : trimmed;
        }
        if (value instanceof Number number) {
            return integral(number.doubleValue()) ? Long.toString(number.longValue()) : number.toString();
        }
        if (value instanceof Boolean bool) {
            return bool.toString();
        }
        if (value instanceof byte[] bytes) {
            return string(new String(bytes, StandardCharsets.UTF_8));
        }
        if (value instanceof Map<?, ?> localized) {
            // {"default": "Title"} and friends
            return string(first(localized, List.of("default", "text", "value", "en")));
        }
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                String coerced = string(element);
                if (coerced != null) {
                    return coerced;
                }
            }
        }
        return null;
    }

    static Integer integer(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
                return null;
            }
            return (int) d;
        }
        if (value instanceof CharSequence sequence) {
            String text = sequence.toString().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Integer.parseInt(text);
            } catch (NumberFormatException ignored) {
                // try decimal form below
            }
            try {
                return integer(Double.parseDouble(text));
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    /**
     * A year from a number or from the leading digits of a date such as {@code 2019-05-01}.
     */
    static Integer year(Object value) {
        if (value instanceof CharSequence sequence) {
            String text = sequence.toString().trim();
            if (text.length() > 4 && text.charAt(4) == '-') {
                return integer(text.substring(0, 4));
            }
        }
        Integer year = integer(value);
        return year != null && year > 0 ? year : null;
    }

    static Boolean bool(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence sequence) {
            String text = sequence.toString().trim().toLowerCase(Locale.ROOT);
            if (text.equals("true") || text.equals("1") || text.equals("yes")) {
                return true;
            }
            if (text.equals("false") || text.equals("0") || text.equals("no")) {
                return false;
            }
        }
        return null;
    }

    private static boolean integral(double value) {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }
}
