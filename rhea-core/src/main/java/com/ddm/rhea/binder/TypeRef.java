package com.ddm.rhea.binder;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;

/**
 * 类型引用，用于在运行时获取泛型类型信息，解决 Java 泛型类型擦除问题。
 * <p>
 * 必须通过匿名内部类的方式创建实例，并指定具体的泛型类型：
 * <pre>{@code
 * List<Endpoint> endpoints = binder.reify(config.getSection("Endpoints"), new TypeRef<List<Endpoint>>() {});
 * Map<String, Integer> limits = binder.reify(config.getSection("Limits"), new TypeRef<Map<String, Integer>>() {});
 * }</pre>
 *
 * @param <T> 要引用的泛型类型
 * @author liyifei
 * @since 1.0
 */
public abstract class TypeRef<T> {

    private final Type type;

    /**
     * @throws IllegalStateException 未指定泛型参数，或泛型参数仍是未解析的类型变量
     */
    protected TypeRef() {
        if (!(getClass().getGenericSuperclass() instanceof ParameterizedType superType)) {
            throw new IllegalStateException("Missing type argument, declare the target as new TypeRef<Foo>() {}");
        }
        Type argument = superType.getActualTypeArguments()[0];
        if (argument instanceof TypeVariable<?> variable) {
            throw new IllegalStateException("Cannot bind to unresolved type variable " + variable.getName());
        }
        this.type = argument;
    }

    /**
     * 获取引用的类型信息，不会为 null。
     */
    public Type getType() {
        return type;
    }

    @Override
    public String toString() {
        return "TypeRef<" + type.getTypeName() + ">";
    }
}
