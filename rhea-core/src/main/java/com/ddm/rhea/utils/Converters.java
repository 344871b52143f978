package com.ddm.rhea.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * 配置值的字符串到标量类型转换。
 * <p>
 * 与宽松的"失败返回 null"不同，这里转换失败一律抛出 {@link IllegalArgumentException}，
 * 由调用方补充键和原始值后报告给用户。空白值只能转换为 String，空值与缺失的键不同。
 *
 * @author : liyifei
 * @created : 2025/10/31, Friday
 * Copyright (c) 2004-2029 All Rights Reserved.
 **/
public final class Converters {

    private static final Set<Class<?>> SCALARS = Set.of(
            String.class, Boolean.class, boolean.class, Character.class, char.class,
            Byte.class, byte.class, Short.class, short.class, Integer.class, int.class,
            Long.class, long.class, Float.class, float.class, Double.class, double.class,
            BigInteger.class, BigDecimal.class, UUID.class, Duration.class, Instant.class,
            LocalDate.class, LocalDateTime.class, OffsetDateTime.class, ZonedDateTime.class, Date.class);

    private Converters() {
    }

    /**
     * 是否为可以直接由单个字符串值转换的标量类型（含枚举）。
     */
    public static boolean isScalar(Class<?> type) {
        return SCALARS.contains(type) || type.isEnum();
    }

    /**
     * 把配置值转换为标量类型；对象和集合由 binder 负责，这里不处理。
     *
     * @throws IllegalArgumentException 无法转换，或目标不是标量类型
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static <T> T cast(Object raw, Class<T> type) {
        if (raw == null) return null;
        if (type.isInstance(raw)) return type.cast(raw);
        if (!isScalar(type)) {
            throw new IllegalArgumentException(type.getName() + " is not a scalar type");
        }
        // 字符串原样保留，不做 trim
        if (type == String.class) return type.cast(String.valueOf(raw));

        final String s = String.valueOf(raw).trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Cannot convert an empty value to " + type.getSimpleName());
        }

        try {
            if (type == Boolean.class || type == boolean.class) return (T) parseBoolean(s);
            if (type == Character.class || type == char.class) {
                if (s.length() != 1) throw new IllegalArgumentException("expected a single character");
                return (T) Character.valueOf(s.charAt(0));
            }

            // 数值
            if (type == Byte.class || type == byte.class) return (T) Byte.valueOf(s);
            if (type == Short.class || type == short.class) return (T) Short.valueOf(s);
            if (type == Integer.class || type == int.class) return (T) Integer.valueOf(s);
            if (type == Long.class || type == long.class) return (T) Long.valueOf(s);
            if (type == Float.class || type == float.class) return (T) Float.valueOf(s);
            if (type == Double.class || type == double.class) return (T) Double.valueOf(s);
            if (type == BigInteger.class) return type.cast(new BigInteger(s));
            if (type == BigDecimal.class) return type.cast(new BigDecimal(s));
            if (type == UUID.class) return type.cast(UUID.fromString(s));

            // 枚举名忽略大小写
            if (type.isEnum()) return (T) parseEnum((Class<? extends Enum>) type, s);

            if (type == Duration.class) return type.cast(parseDuration(s));
            if (type == Instant.class) return type.cast(parseInstant(s));
            if (type == LocalDate.class) return type.cast(parseLocalDate(s));
            if (type == LocalDateTime.class) return type.cast(parseLocalDateTime(s));
            if (type == OffsetDateTime.class) return type.cast(parseOffsetDateTime(s));
            if (type == ZonedDateTime.class) return type.cast(parseZonedDateTime(s));
            if (type == Date.class) return type.cast(Date.from(parseInstant(s)));
        } catch (IllegalArgumentException | DateTimeException | ArithmeticException e) {
            throw new IllegalArgumentException("Cannot convert '" + s + "' to " + type.getSimpleName(), e);
        }
        throw new IllegalStateException("Unhandled scalar type " + type.getName());
    }

    private static Boolean parseBoolean(String s) {
        if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
        throw new IllegalArgumentException("expected true or false");
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String s) {
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equalsIgnoreCase(s)) return constant;
        }
        throw new IllegalArgumentException("no enum constant " + type.getSimpleName() + "." + s);
    }

    /**
     * 支持：纯数字=秒；或带单位的简写（ms/s/m/h/d）；或 ISO-8601（PT10S）。
     */
    private static Duration parseDuration(String s) {
        String v = s.toLowerCase(Locale.ROOT);
        if (v.matches("^[+-]?\\d+(\\.\\d+)?$")) {
            return Duration.ofMillis(new BigDecimal(v).movePointRight(3).longValueExact());
        }
        if (v.matches("^\\d+(ms|s|m|h|d)$")) {
            if (v.endsWith("ms")) return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2)));
            long n = Long.parseLong(v.substring(0, v.length() - 1));
            switch (v.charAt(v.length() - 1)) {
                case 's':
                    return Duration.ofSeconds(n);
                case 'm':
                    return Duration.ofMinutes(n);
                case 'h':
                    return Duration.ofHours(n);
                default:
                    return Duration.ofDays(n);
            }
        }
        return Duration.parse(s.toUpperCase(Locale.ROOT));
    }

    /**
     * Instant: 支持 ISO-8601；或 epoch 秒/毫秒（纯数字长度判断）
     */
    private static Instant parseInstant(String v) {
        if (v.matches("^[+-]?\\d+$")) {
            long epoch = Long.parseLong(v);
            // 13 位及以上按毫秒
            return v.length() >= 13 ? Instant.ofEpochMilli(epoch) : Instant.ofEpochSecond(epoch);
        }
        return Instant.parse(v);
    }

    /**
     * LocalDate: 优先 ISO_LOCAL_DATE（yyyy-MM-dd），否则从 Instant/epoch 推断为 UTC 日期
     */
    private static LocalDate parseLocalDate(String v) {
        if (v.matches("^\\d{4}-\\d{2}-\\d{2}$")) return LocalDate.parse(v, DateTimeFormatter.ISO_LOCAL_DATE);
        return LocalDateTime.ofInstant(parseInstant(v), ZoneOffset.UTC).toLocalDate();
    }

    /**
     * LocalDateTime: 优先 ISO_LOCAL_DATE_TIME；否则从 Instant(epoch/ISO) 转为 UTC 本地时间
     */
    private static LocalDateTime parseLocalDateTime(String v) {
        // 允许用空格代替 T
        if (v.matches("^\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?$")) {
            return LocalDateTime.parse(v.replace(' ', 'T'), DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        return LocalDateTime.ofInstant(parseInstant(v), ZoneOffset.UTC);
    }

    /**
     * OffsetDateTime: 优先 ISO_OFFSET_DATE_TIME；否则从 Instant 构造 UTC 偏移
     */
    private static OffsetDateTime parseOffsetDateTime(String v) {
        if (v.matches(".*(Z|[+-]\\d{2}:\\d{2})$") && v.contains("T")) {
            return OffsetDateTime.parse(v, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        }
        return OffsetDateTime.ofInstant(parseInstant(v), ZoneOffset.UTC);
    }

    /**
     * ZonedDateTime: 优先 ISO_ZONED_DATE_TIME；否则从 Instant + UTC 构造
     */
    private static ZonedDateTime parseZonedDateTime(String v) {
        if (v.contains("T")) {
            return ZonedDateTime.parse(v, DateTimeFormatter.ISO_ZONED_DATE_TIME);
        }
        return ZonedDateTime.ofInstant(parseInstant(v), ZoneOffset.UTC);
    }
}
