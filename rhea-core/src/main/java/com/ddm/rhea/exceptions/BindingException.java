package com.ddm.rhea.exceptions;

/**
 * 将配置绑定到 Java 类型时失败。
 *
 * @author liyifei
 * @since 1.0
 */
public class BindingException extends ConfigurationException {

    public enum Kind {
        /**
         * 必需的属性在配置中不存在
         */
        MISSING_VALUE,
        /**
         * 其它错误，例如值无法解析为目标类型
         */
        CUSTOM
    }

    private final Kind kind;
    private final String fieldName;

    private BindingException(Kind kind, String fieldName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.fieldName = fieldName;
    }

    public static BindingException missingValue(String fieldName) {
        return new BindingException(Kind.MISSING_VALUE, fieldName, "Missing value for field '" + fieldName + "'", null);
    }

    public static BindingException custom(String message) {
        return new BindingException(Kind.CUSTOM, null, message, null);
    }

    public static BindingException custom(String message, Throwable cause) {
        return new BindingException(Kind.CUSTOM, null, message, cause);
    }

    /**
     * 值无法解析为目标类型
     */
    public static BindingException invalidValue(String key, String value, Class<?> type, Throwable cause) {
        return custom("Failed to convert value '" + value + "' at key '" + key + "' to " + type.getName(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 缺失的属性名；仅 {@link Kind#MISSING_VALUE} 时非 null
     */
    public String getFieldName() {
        return fieldName;
    }
}
