package com.ddm.rhea.binder;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 属性缺省值：配置中不存在该属性时使用。
 * <p>
 * 标注了该注解的 record 组件不再是必需的。值按属性类型解析；
 * 空字符串对集合与 Map 表示空集合，对其它类型表示使用 Java 默认值。
 *
 * <pre>{@code
 * record ServerOptions(String host, @DefaultValue("8080") int port, @DefaultValue List<String> tags) {}
 * }</pre>
 *
 * @since 1.0
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.RECORD_COMPONENT, ElementType.PARAMETER})
public @interface DefaultValue {

    String value() default "";
}
