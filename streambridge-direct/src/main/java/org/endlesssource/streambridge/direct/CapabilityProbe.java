package org.endlesssource.streambridge.direct;

import org.endlesssource.streambridge.api.BackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds and calls capability methods on an extension object by name.
 * <p>
 * A call first tries the arguments positionally: the overload taking the most
 * leading arguments whose types fit wins. If no overload fits, a method taking
 * a single {@code Map} is called with the arguments by name.
 */
final class CapabilityProbe {
    private static final Logger logger = LoggerFactory.getLogger(CapabilityProbe.class);

    private final Object target;
    private final Map<Capability, String> methods;

    private CapabilityProbe(Object target, Map<Capability, String> methods) {
        this.target = target;
        this.methods = methods;
    }

    static CapabilityProbe inspect(Object target) {
        Map<Capability, String> found = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            for (String name : capability.methodNames()) {
                if (!overloads(target.getClass(), name).isEmpty()) {
                    found.put(capability, name);
                    break;
                }
            }
        }
        return new CapabilityProbe(target, found);
    }

    boolean supports(Capability capability) {
        return methods.containsKey(capability);
    }

    List<Capability> missingRequired() {
        return Arrays.stream(Capability.values())
                .filter(Capability::required)
                .filter(capability -> !supports(capability))
                .toList();
    }

    List<Capability> missingOptional() {
        return Arrays.stream(Capability.values())
                .filter(capability -> !capability.required())
                .filter(capability -> !supports(capability))
                .toList();
    }

    Optional<String> methodName(Capability capability) {
        return Optional.ofNullable(methods.get(capability));
    }

    /**
     * @param args arguments by name, in positional order
     * @throws BackendException if the capability is missing, no overload
     *                          accepts the arguments, or the call fails
     */
    Object invoke(Capability capability, Map<String, Object> args) {
        String name = methods.get(capability);
        if (name == null) {
            throw new BackendException(target.getClass().getName() + " does not support "
                    + capability.name().toLowerCase());
        }
        List<Method> candidates = overloads(target.getClass(), name);
        List<Object> positional = new ArrayList<>(args.values());

        Optional<Method> byPosition = candidates.stream()
                .filter(method -> method.getParameterCount() <= positional.size())
                .filter(method -> accepts(method, positional))
                .max(Comparator.comparingInt(Method::getParameterCount));
        if (byPosition.isPresent()) {
            Method method = byPosition.get();
            return call(method, positional.subList(0, method.getParameterCount()).toArray());
        }

        logger.debug("No positional overload of {} fits {}, retrying with named arguments", name, args.keySet());
        Optional<Method> byName = candidates.stream()
                .filter(method -> method.getParameterCount() == 1)
                .filter(method -> method.getParameterTypes()[0].isAssignableFrom(LinkedHashMap.class))
                .findFirst();
        if (byName.isPresent()) {
            return call(byName.get(), new Object[]{new LinkedHashMap<>(args)});
        }
        throw new BackendException("No overload of " + target.getClass().getName() + "." + name
                + " accepts " + args.keySet());
    }

    private Object call(Method method, Object[] args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new BackendException(method.getName() + " failed: " + cause.getMessage(), cause);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new BackendException("Cannot call " + method.getName() + ": " + e.getMessage(), e);
        }
    }

    private static boolean accepts(Method method, List<Object> args) {
        Class<?>[] types = method.getParameterTypes();
        for (int i = 0; i < types.length; i++) {
            Object arg = args.get(i);
            if (arg == null) {
                if (types[i].isPrimitive()) {
                    return false;
                }
            } else if (!box(types[i]).isInstance(arg) && !widens(arg, types[i])) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether a boxed argument reaches a primitive parameter through a widening
     * conversion, e.g. an {@code Integer} limit passed to a {@code long} parameter.
     */
    private static boolean widens(Object arg, Class<?> type) {
        if (!type.isPrimitive() || type == boolean.class || type == char.class) {
            return false;
        }
        int from = numericRank(arg.getClass());
        int to = numericRank(box(type));
        if (from < 0 || to < 0) {
            return false;
        }
        // char widens to int and above only
        if (arg instanceof Character) {
            return to >= numericRank(Integer.class);
        }
        return from < to;
    }

    private static int numericRank(Class<?> boxed) {
        if (boxed == Byte.class) {
            return 0;
        }
        if (boxed == Short.class || boxed == Character.class) {
            return 1;
        }
        if (boxed == Integer.class) {
            return 2;
        }
        if (boxed == Long.class) {
            return 3;
        }
        if (boxed == Float.class) {
            return 4;
        }
        if (boxed == Double.class) {
            return 5;
        }
        return -1;
    }

    private static List<Method> overloads(Class<?> type, String name) {
        return Arrays.stream(type.getMethods())
                .filter(method -> method.getName().equals(name))
                .filter(method -> !Modifier.isStatic(method.getModifiers()))
                .filter(method -> method.getDeclaringClass() != Object.class)
                .toList();
    }

    private static Class<?> box(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) {
            return Integer.class;
        }
        if (type == long.class) {
            return Long.class;
        }
        if (type == boolean.class) {
            return Boolean.class;
        }
        if (type == double.class) {
            return Double.class;
        }
        if (type == float.class) {
            return Float.class;
        }
        if (type == short.class) {
            return Short.class;
        }
        if (type == byte.class) {
            return Byte.class;
        }
        return Character.class;
    }
}
