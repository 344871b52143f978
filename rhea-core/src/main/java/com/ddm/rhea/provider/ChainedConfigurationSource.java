package com.ddm.rhea.provider;

import com.ddm.rhea.Configuration;
import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.Objects;

/**
 * 链式配置源：把已有配置接入新的构建器。
 *
 * @since 1.0
 */
public class ChainedConfigurationSource implements ConfigurationSource {

    private final Configuration configuration;

    public ChainedConfigurationSource(Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new ChainedConfigurationProvider(configuration);
    }
}
