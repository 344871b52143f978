package com.ddm.rhea.binder;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;

import java.util.List;

/**
 * 单个属性的绑定元数据。
 *
 * @param fieldName    Java 属性名，用于错误信息
 * @param propertyName Jackson 反序列化时使用的属性名
 * @param keys         配置中查找的键，按优先级排列（忽略大小写）
 * @param type         属性类型
 * @param required     配置中不存在时是否报错
 * @param defaultValue {@link DefaultValue} 的值；未标注时为 null
 * @param accessor     读取当前值的成员（仅 POJO 有），用于原地合并嵌套对象
 * @author liyifei
 */
record PropertyBinding(String fieldName,
                       String propertyName,
                       List<String> keys,
                       JavaType type,
                       boolean required,
                       String defaultValue,
                       AnnotatedMember accessor) {

    boolean isOptional() {
        return type.getRawClass() == java.util.Optional.class;
    }
}
