package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * 环境变量配置源。
 *
 * @since 1.0
 */
public class EnvironmentVariablesConfigurationSource implements ConfigurationSource {

    private final String prefix;

    private final Supplier<Map<String, String>> environment;

    public EnvironmentVariablesConfigurationSource(String prefix) {
        this(prefix, System::getenv);
    }

    /**
     * @param environment 环境变量来源，测试时可替换
     */
    public EnvironmentVariablesConfigurationSource(String prefix, Supplier<Map<String, String>> environment) {
        this.prefix = prefix == null ? "" : prefix;
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new EnvironmentVariablesConfigurationProvider(prefix, environment);
    }
}
