package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.Objects;

/**
 * 对象配置源：把任意 Jackson 可序列化对象作为配置数据。
 *
 * @since 1.0
 */
public class ObjectConfigurationSource implements ConfigurationSource {

    private final Object value;

    public ObjectConfigurationSource(Object value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new ObjectConfigurationProvider(value);
    }
}
