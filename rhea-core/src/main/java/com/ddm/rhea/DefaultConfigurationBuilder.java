package com.ddm.rhea;

import com.ddm.rhea.exceptions.ReloadException;
import com.ddm.rhea.utils.Converters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 默认配置构建器。
 *
 * <p>支持的共享属性：
 * <ul>
 *   <li>{@value #RELOAD_TIMEOUT}：{@link ConfigurationRoot#reload()} 等待读操作结束的最长时间，
 *       可以是 {@link Duration} 或 {@code 5s}、{@code PT5S} 形式的字符串，默认 5 秒</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public class DefaultConfigurationBuilder implements ConfigurationBuilder {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfigurationBuilder.class);

    public static final String RELOAD_TIMEOUT = "rhea.reload.timeout";

    static final Duration DEFAULT_RELOAD_TIMEOUT = Duration.ofSeconds(5);

    private final List<ConfigurationSource> sources = new ArrayList<>();

    private final Map<String, Object> properties = new HashMap<>();

    @Override
    public DefaultConfigurationBuilder add(ConfigurationSource source) {
        sources.add(Objects.requireNonNull(source, "source"));
        return this;
    }

    @Override
    public List<ConfigurationSource> getSources() {
        return Collections.unmodifiableList(sources);
    }

    @Override
    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * 设置共享属性
     */
    public DefaultConfigurationBuilder property(String name, Object value) {
        properties.put(name, value);
        return this;
    }

    @Override
    public ConfigurationRoot build() {
        List<ConfigurationProvider> providers = new ArrayList<>(sources.size());
        try {
            for (ConfigurationSource source : sources) {
                providers.add(Objects.requireNonNull(source.build(this), "provider"));
            }
        } catch (RuntimeException e) {
            DefaultConfigurationRoot.closeAll(providers);
            throw e;
        }

        List<ReloadException.ProviderFailure> failures = DefaultConfigurationRoot.loadAll(providers);
        if (!failures.isEmpty()) {
            DefaultConfigurationRoot.closeAll(providers);
            throw ReloadException.of(failures);
        }
        log.info("Configuration built with {} provider(s)", providers.size());
        return new DefaultConfigurationRoot(providers, reloadTimeout());
    }

    private Duration reloadTimeout() {
        Object value = properties.get(RELOAD_TIMEOUT);
        if (value == null) {
            return DEFAULT_RELOAD_TIMEOUT;
        }
        Duration timeout = Converters.cast(value, Duration.class);
        if (timeout.isNegative()) {
            throw new IllegalArgumentException(RELOAD_TIMEOUT + " must not be negative: " + value);
        }
        return timeout;
    }
}
