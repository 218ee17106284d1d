package com.redline.param;

import com.redline.core.HandlerKind;
import com.redline.error.RequestException;
import com.redline.http.Request;
import com.redline.inject.ServiceLocator;
import com.redline.util.JsonUtil;

import java.util.HashMap;
import java.util.Map;

/**
 * Providers for the {@link StandardMarker}s. Every handler kind may use them.
 *
 * <p>String sources (path, query, header, form fields) are converted to the declared type:
 * numbers, booleans and enum constants are parsed, anything else goes through Jackson.</p>
 */
public final class StandardProviders {
    private static final Map<Class<?>, Class<?>> WRAPPERS = new HashMap<>();

    static {
        WRAPPERS.put(int.class, Integer.class);
        WRAPPERS.put(long.class, Long.class);
        WRAPPERS.put(double.class, Double.class);
        WRAPPERS.put(float.class, Float.class);
        WRAPPERS.put(short.class, Short.class);
        WRAPPERS.put(byte.class, Byte.class);
        WRAPPERS.put(char.class, Character.class);
        WRAPPERS.put(boolean.class, Boolean.class);
    }

    private StandardProviders() {
    }

    /**
     * Registers all standard providers.
     *
     * @param resolver the resolver to fill
     */
    public static void registerAll(ParameterResolver resolver) {
        HandlerKind[] all = HandlerKind.values();
        resolver.register(StandardMarker.PATH,
            (metadata, type, handler, name, request, locator) -> convert(request.getPathVariable(name), type), all);
        resolver.register(StandardMarker.QUERY,
            (metadata, type, handler, name, request, locator) -> convert(request.getQueryParam(name), type), all);
        resolver.register(StandardMarker.HEADER,
            (metadata, type, handler, name, request, locator) -> convert(request.getHeader(name), type), all);
        resolver.register(StandardMarker.ATTRIBUTE,
            (metadata, type, handler, name, request, locator) -> convert(request.getAttributes().get(name), type), all);
        resolver.register(StandardMarker.SERVICE,
            (metadata, type, handler, name, request, locator) -> locator.resolve(type), all);
        resolver.register(StandardMarker.BODY,
            (metadata, type, handler, name, request, locator) -> convert(request.getBody(), type), all);
        resolver.register(StandardMarker.FIELD, StandardProviders::field, all);
        resolver.register(StandardMarker.REQUEST,
            (metadata, type, handler, name, request, locator) -> request, all);
    }

    private static Object field(Object metadata, Class<?> type, String handlerName, String paramName,
                                Request request, ServiceLocator locator) throws Exception {
        Object body = request.getBody();
        if (body == null) {
            return null;
        }
        if (!(body instanceof Map)) {
            throw new RequestException(400, "Request body is not an object");
        }
        return convert(((Map<?, ?>) body).get(paramName), type);
    }

    /**
     * Converts a raw value to a target type.
     *
     * @param value the raw value, may be null
     * @param type the target type
     * @return the converted value, or null for a null value
     * @throws IllegalArgumentException if the value cannot be converted
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static Object convert(Object value, Class<?> type) {
        if (value == null) {
            return null;
        }
        Class<?> target = boxed(type);
        if (target.isInstance(value)) {
            return value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (target == Integer.class) {
                return Integer.valueOf(text);
            } else if (target == Long.class) {
                return Long.valueOf(text);
            } else if (target == Double.class) {
                return Double.valueOf(text);
            } else if (target == Float.class) {
                return Float.valueOf(text);
            } else if (target == Short.class) {
                return Short.valueOf(text);
            } else if (target == Byte.class) {
                return Byte.valueOf(text);
            } else if (target == Character.class) {
                if (text.length() == 1) {
                    return text.charAt(0);
                }
                throw new IllegalArgumentException("'" + value + "' is not a single character");
            } else if (target == Boolean.class) {
                if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                    return Boolean.valueOf(text);
                }
                throw new IllegalArgumentException("'" + value + "' is not a boolean");
            } else if (target.isEnum()) {
                return Enum.valueOf((Class<? extends Enum>) target, text);
            }
        }
        if (target == String.class) {
            return String.valueOf(value);
        }
        return JsonUtil.convert(value, target);
    }

    static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        Class<?> wrapper = WRAPPERS.get(type);
        if (wrapper == null) {
            throw new IllegalArgumentException("Unsupported parameter type " + type);
        }
        return wrapper;
    }
}
