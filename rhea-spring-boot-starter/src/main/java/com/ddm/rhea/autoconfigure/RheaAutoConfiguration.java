package com.ddm.rhea.autoconfigure;

import com.ddm.rhea.ConfigurationRoot;
import com.ddm.rhea.DefaultConfigurationBuilder;
import com.ddm.rhea.binder.ConfigurationBinder;
import com.ddm.rhea.config.ConfigurationRootPropertySource;
import com.ddm.rhea.provider.file.FileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.ConfigurableEnvironment;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Rhea 的自动配置类。
 * <p>自动配置以下组件：
 * <ul>
 *   <li>{@link ConfigurationRoot}：按 {@link RheaProperties} 构建的配置根</li>
 *   <li>{@link ConfigurationBinder}：配置绑定器</li>
 *   <li>{@link ConfigurationRootPropertySource}：把配置根接入 Spring Environment（可通过 {@code rhea.property-source=false} 关闭）</li>
 * </ul>
 *
 * @see RheaProperties
 * @author liyifei
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(RheaProperties.class)
public class RheaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RheaAutoConfiguration.class);

    /**
     * 创建配置根 Bean，容器关闭时一并关闭。
     *
     * @param props 配置属性
     * @return ConfigurationRoot 实例
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConfigurationRoot rheaConfigurationRoot(RheaProperties props) {
        DefaultConfigurationBuilder builder = new DefaultConfigurationBuilder();
        if (props.reloadTimeout() != null) {
            builder.property(DefaultConfigurationBuilder.RELOAD_TIMEOUT, props.reloadTimeout());
        }
        for (RheaProperties.FileEntry entry : props.filesOrEmpty()) {
            FileSource file = FileSource.builder(Path.of(entry.path()))
                    .optional(entry.optional())
                    .reloadOnChange(entry.reloadOnChange())
                    .reloadDelay(props.reloadDelay() == null ? FileSource.DEFAULT_RELOAD_DELAY : props.reloadDelay())
                    .build();
            switch (formatOf(entry)) {
                case "json":
                    builder.addJsonFile(file);
                    break;
                case "ini":
                    builder.addIniFile(file);
                    break;
                case "xml":
                    builder.addXmlFile(file);
                    break;
                default:
                    throw new IllegalStateException("Unsupported configuration file format: " + entry.path());
            }
        }
        if (props.environmentPrefix() != null) {
            builder.addEnvironmentVariables(props.environmentPrefix());
        }
        log.info("Building Rhea configuration from {} file(s)", props.filesOrEmpty().size());
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationBinder configurationBinder() {
        return new ConfigurationBinder();
    }

    /**
     * 注册属性源，优先级低于 Spring 自身的属性源。
     */
    @Bean
    @ConditionalOnProperty(prefix = "rhea", name = "property-source", havingValue = "true", matchIfMissing = true)
    public ConfigurationRootPropertySource rheaPropertySource(ConfigurationRoot root, ConfigurableEnvironment environment) {
        ConfigurationRootPropertySource source = new ConfigurationRootPropertySource(ConfigurationRootPropertySource.NAME, root);
        environment.getPropertySources().addLast(source);
        log.info("Registered property source '{}'", source.getName());
        return source;
    }

    private static String formatOf(RheaProperties.FileEntry entry) {
        if (entry.format() != null && !entry.format().isBlank()) {
            return entry.format().trim().toLowerCase(Locale.ROOT);
        }
        String path = entry.path().toLowerCase(Locale.ROOT);
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(dot + 1);
    }
}
