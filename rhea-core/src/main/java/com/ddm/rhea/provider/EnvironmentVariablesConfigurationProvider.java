package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationPath;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 环境变量配置提供者：只保留以前缀开头（忽略大小写）的变量，
 * 去掉前缀后把 {@code __} 替换为 {@code :}，例如 {@code APP_Logging__Level → Logging:Level}。
 *
 * @author liyifei
 * @since 1.0
 */
public class EnvironmentVariablesConfigurationProvider extends AbstractConfigurationProvider {

    private static final String NESTED_SEPARATOR = "__";

    private final String prefix;

    private final Supplier<Map<String, String>> environment;

    public EnvironmentVariablesConfigurationProvider(String prefix, Supplier<Map<String, String>> environment) {
        this.prefix = prefix;
        this.environment = environment;
    }

    @Override
    public void load() {
        Map<String, ConfigurationEntry> data = new HashMap<>();
        environment.get().forEach((name, value) -> {
            if (name.regionMatches(true, 0, prefix, 0, prefix.length())) {
                String key = name.substring(prefix.length()).replace(NESTED_SEPARATOR, ConfigurationPath.KEY_DELIMITER);
                if (!key.isEmpty()) {
                    put(data, key, value);
                }
            }
        });
        setData(data);
    }

    @Override
    public String getName() {
        return prefix.isEmpty() ? "EnvironmentVariables" : "EnvironmentVariables(" + prefix + ")";
    }
}
