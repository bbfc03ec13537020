package com.ryuqq.tenantguard.application.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * 접두사 아래의 필수 설정값을 타입별로 읽는 도우미.
 *
 * <p>값이 없거나 형식이 틀리면 전체 키 이름을 담은 {@link IllegalArgumentException}을 던집니다.
 * 기본값은 제공하지 않습니다.</p>
 *
 * @author TenantGuard Team
 * @since 1.0.0
 */
public final class PropertiesReader {

    private final Properties properties;
    private final String prefix;

    /**
     * PropertiesReader 생성.
     *
     * @param properties 설정 원본
     * @param prefix 키 접두사 (예: {@code tenantguard.})
     */
    public PropertiesReader(Properties properties, String prefix) {
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    public String requireString(String key) {
        String fullKey = prefix + key;
        String value = properties.getProperty(fullKey);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required property: " + fullKey);
        }
        return value.trim();
    }

    public int requireInt(String key) {
        String value = requireString(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw malformed(key, value, "integer", e);
        }
    }

    public long requireLong(String key) {
        String value = requireString(key);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw malformed(key, value, "long", e);
        }
    }

    public double requireDouble(String key) {
        String value = requireString(key);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw malformed(key, value, "number", e);
        }
    }

    public boolean requireBoolean(String key) {
        String value = requireString(key).toLowerCase(Locale.ROOT);
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw malformed(key, value, "boolean", null);
    }

    public <E extends Enum<E>> E requireEnum(String key, Class<E> type) {
        String value = requireString(key);
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw malformed(key, value, type.getSimpleName(), e);
        }
    }

    private IllegalArgumentException malformed(String key, String value, String expected, Exception cause) {
        return new IllegalArgumentException(
            "Malformed property " + prefix + key + " (expected " + expected + ", current: " + value + ")", cause
        );
    }
}
