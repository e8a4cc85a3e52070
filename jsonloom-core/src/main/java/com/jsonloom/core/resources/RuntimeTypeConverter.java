package com.jsonloom.core.resources;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/** Converts query-string and route text into the runtime types of identifiers and attributes. */
public final class RuntimeTypeConverter {

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            char.class, Character.class);

    private static final Map<Class<?>, Function<String, Object>> PARSERS = Map.ofEntries(
            Map.entry(String.class, value -> value),
            Map.entry(Boolean.class, RuntimeTypeConverter::parseBoolean),
            Map.entry(Byte.class, Byte::valueOf),
            Map.entry(Short.class, Short::valueOf),
            Map.entry(Integer.class, Integer::valueOf),
            Map.entry(Long.class, Long::valueOf),
            Map.entry(Float.class, Float::valueOf),
            Map.entry(Double.class, Double::valueOf),
            Map.entry(Character.class, RuntimeTypeConverter::parseCharacter),
            Map.entry(BigDecimal.class, BigDecimal::new),
            Map.entry(BigInteger.class, BigInteger::new),
            Map.entry(UUID.class, UUID::fromString),
            Map.entry(Instant.class, Instant::parse),
            Map.entry(LocalDate.class, LocalDate::parse),
            Map.entry(LocalDateTime.class, LocalDateTime::parse),
            Map.entry(LocalTime.class, LocalTime::parse),
            Map.entry(OffsetDateTime.class, OffsetDateTime::parse),
            Map.entry(ZonedDateTime.class, ZonedDateTime::parse));

    private RuntimeTypeConverter() {}

    /**
     * Converts text to the requested type.
     *
     * @throws IllegalArgumentException when the type is unsupported or the text does not parse
     */
    public static Object convertType(String value, Class<?> type) {
        if (value == null) {
            return null;
        }
        Class<?> target = wrap(type);
        try {
            if (target.isEnum()) {
                return parseEnum(value, target);
            }
            Function<String, Object> parser = PARSERS.get(target);
            if (parser == null) {
                throw new IllegalArgumentException("Conversion to type '" + target.getSimpleName() + "' is not supported.");
            }
            return parser.apply(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw conversionFailure(value, target, e);
        } catch (IllegalArgumentException e) {
            if (e.getMessage() != null && e.getMessage().startsWith("Conversion to type")) {
                throw e;
            }
            throw conversionFailure(value, target, e);
        }
    }

    public static boolean isSupported(Class<?> type) {
        Class<?> target = wrap(type);
        return target.isEnum() || PARSERS.containsKey(target);
    }

    /** Returns the zero value a field of this type holds when never assigned. */
    public static Object getDefaultValue(Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }
        if (type == boolean.class) {
            return Boolean.FALSE;
        }
        if (type == char.class) {
            return '\0';
        }
        return switch (type.getName()) {
            case "byte" -> (byte) 0;
            case "short" -> (short) 0;
            case "int" -> 0;
            case "long" -> 0L;
            case "float" -> 0f;
            default -> 0d;
        };
    }

    public static Class<?> wrap(Class<?> type) {
        return type.isPrimitive() ? PRIMITIVE_WRAPPERS.get(type) : type;
    }

    private static Object parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(value)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("not a boolean");
    }

    private static Object parseCharacter(String value) {
        if (value.length() != 1) {
            throw new IllegalArgumentException("not a single character");
        }
        return value.charAt(0);
    }

    private static Object parseEnum(String value, Class<?> target) {
        for (Object constant : target.getEnumConstants()) {
            if (((Enum<?>) constant).name().equalsIgnoreCase(value)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("no such constant");
    }

    private static IllegalArgumentException conversionFailure(String value, Class<?> target, Exception cause) {
        return new IllegalArgumentException(
                "Failed to convert '" + value + "' of type 'String' to type '" + target.getSimpleName() + "'.", cause);
    }
}
