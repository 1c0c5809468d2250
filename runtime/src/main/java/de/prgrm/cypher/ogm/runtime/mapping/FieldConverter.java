package de.prgrm.cypher.ogm.runtime.mapping;

import java.math.BigDecimal;
import java.time.*;
import java.util.*;
import java.util.function.Function;

import org.neo4j.driver.types.IsoDuration;

import de.prgrm.cypher.ogm.runtime.errors.ValidationException;

/**
 * Coerces property values to the declared Java type of a field. Values coming back from the
 * database use the driver's widest types (Long, Double, ZonedDateTime, IsoDuration), declared
 * fields may be narrower.
 */
final class FieldConverter {

    private static final Map<Class<?>, Class<?>> PRIMITIVES = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            byte.class, Byte.class,
            double.class, Double.class,
            float.class, Float.class,
            boolean.class, Boolean.class,
            char.class, Character.class);

    private static final Map<Class<?>, Function<String, Object>> TEXT_PARSERS = new HashMap<>();

    static {
        TEXT_PARSERS.put(String.class, text -> text);
        TEXT_PARSERS.put(Long.class, Long::valueOf);
        TEXT_PARSERS.put(Integer.class, Integer::valueOf);
        TEXT_PARSERS.put(Short.class, Short::valueOf);
        TEXT_PARSERS.put(Byte.class, Byte::valueOf);
        TEXT_PARSERS.put(Double.class, Double::valueOf);
        TEXT_PARSERS.put(Float.class, Float::valueOf);
        TEXT_PARSERS.put(BigDecimal.class, BigDecimal::new);
        TEXT_PARSERS.put(Boolean.class, FieldConverter::parseBoolean);
        TEXT_PARSERS.put(Character.class, FieldConverter::parseCharacter);
        TEXT_PARSERS.put(UUID.class, UUID::fromString);
        TEXT_PARSERS.put(LocalDate.class, LocalDate::parse);
        TEXT_PARSERS.put(LocalTime.class, LocalTime::parse);
        TEXT_PARSERS.put(LocalDateTime.class, LocalDateTime::parse);
        TEXT_PARSERS.put(OffsetTime.class, OffsetTime::parse);
        TEXT_PARSERS.put(OffsetDateTime.class, OffsetDateTime::parse);
        TEXT_PARSERS.put(ZonedDateTime.class, ZonedDateTime::parse);
        TEXT_PARSERS.put(Instant.class, Instant::parse);
        TEXT_PARSERS.put(Duration.class, Duration::parse);
        TEXT_PARSERS.put(Period.class, Period::parse);
    }

    static Class<?> boxed(Class<?> type) {
        return PRIMITIVES.getOrDefault(type, type);
    }

    /**
     * Whether values of {@code type} survive being written as {@link String#valueOf} text and
     * converted back.
     */
    static boolean isTextCodable(Class<?> type) {
        Class<?> boxed = boxed(type);
        return boxed == Object.class || boxed.isEnum() || TEXT_PARSERS.containsKey(boxed);
    }

    static Object convert(Object value, Class<?> type, String field) {
        if (value == null || type == Object.class || type.isInstance(value)) {
            return value;
        }
        Object converted;
        try {
            converted = tryConvert(value, type);
        } catch (IllegalArgumentException | ArithmeticException | DateTimeException e) {
            throw new ValidationException(mismatch(value, type, field), e);
        }
        if (converted == null) {
            throw new ValidationException(mismatch(value, type, field));
        }
        return converted;
    }

    private static String mismatch(Object value, Class<?> type, String field) {
        return "Field '" + field + "' expects " + type.getSimpleName()
                + " but got " + value.getClass().getSimpleName() + " (" + value + ")";
    }

    private static Object tryConvert(Object value, Class<?> type) {
        if (value instanceof Number number) {
            return fromNumber(number, type);
        }
        if (value instanceof String text) {
            return fromText(text, type);
        }
        if (value instanceof Collection<?> collection) {
            if (type == List.class) {
                return new ArrayList<>(collection);
            }
            if (type == Set.class) {
                return new LinkedHashSet<>(collection);
            }
            return null;
        }
        if (value instanceof ZonedDateTime zoned) {
            if (type == OffsetDateTime.class) {
                return zoned.toOffsetDateTime();
            }
            if (type == Instant.class) {
                return zoned.toInstant();
            }
            return null;
        }
        if (value instanceof OffsetDateTime offset) {
            if (type == ZonedDateTime.class) {
                return offset.toZonedDateTime();
            }
            if (type == Instant.class) {
                return offset.toInstant();
            }
            return null;
        }
        if (value instanceof IsoDuration iso) {
            if (type == Duration.class && iso.months() == 0) {
                return Duration.ofDays(iso.days()).plusSeconds(iso.seconds()).plusNanos(iso.nanoseconds());
            }
            if (type == Period.class && iso.seconds() == 0 && iso.nanoseconds() == 0) {
                return Period.of(0, Math.toIntExact(iso.months()), Math.toIntExact(iso.days()));
            }
            return null;
        }
        if (value instanceof Enum<?> constant && type == String.class) {
            return constant.name();
        }
        return null;
    }

    private static Object fromNumber(Number number, Class<?> type) {
        boolean integral = !(number instanceof Double || number instanceof Float || number instanceof BigDecimal);
        if (type == Long.class && integral) {
            return number.longValue();
        }
        if (type == Integer.class && integral && number.longValue() == number.intValue()) {
            return number.intValue();
        }
        if (type == Short.class && integral && number.longValue() == number.shortValue()) {
            return number.shortValue();
        }
        if (type == Double.class) {
            return number.doubleValue();
        }
        if (type == Float.class) {
            return number.floatValue();
        }
        if (type == BigDecimal.class) {
            return new BigDecimal(number.toString());
        }
        return null;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static Object fromText(String text, Class<?> type) {
        if (type.isEnum()) {
            return Enum.valueOf((Class<? extends Enum>) type, text);
        }
        Function<String, Object> parser = TEXT_PARSERS.get(type);
        return parser == null ? null : parser.apply(text);
    }

    private static Object parseBoolean(String text) {
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.valueOf(text);
        }
        return null;
    }

    private static Object parseCharacter(String text) {
        return text.length() == 1 ? text.charAt(0) : null;
    }

    private FieldConverter() {
    }
}
