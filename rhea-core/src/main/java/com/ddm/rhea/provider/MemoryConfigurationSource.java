package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 内存配置源。键需要预先按 {@code :} 展开，例如 {@code Logging:Level}。
 *
 * @since 1.0
 */
public class MemoryConfigurationSource implements ConfigurationSource {

    private final Map<String, String> initialData;

    public MemoryConfigurationSource(Map<String, String> initialData) {
        this.initialData = new LinkedHashMap<>(Objects.requireNonNull(initialData, "initialData"));
    }

    public Map<String, String> getInitialData() {
        return initialData;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new MemoryConfigurationProvider(initialData);
    }
}
