package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;
import com.ddm.rhea.utils.ConfigurationKeys;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 命令行配置源。
 * <p>
 * 开关映射的键必须以 {@code -} 或 {@code --} 开头，匹配时忽略大小写；其它映射被忽略。
 *
 * @author liyifei
 * @since 1.0
 */
public class CommandLineConfigurationSource implements ConfigurationSource {

    private final List<String> args;

    private final Map<String, String> switchMappings;

    public CommandLineConfigurationSource(List<String> args, Map<String, String> switchMappings) {
        this.args = List.copyOf(Objects.requireNonNull(args, "args"));
        this.switchMappings = new HashMap<>();
        Objects.requireNonNull(switchMappings, "switchMappings").forEach((key, value) -> {
            if (key.startsWith("-")) {
                this.switchMappings.put(ConfigurationKeys.normalize(key), value);
            }
        });
    }

    public List<String> getArgs() {
        return args;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new CommandLineConfigurationProvider(args, switchMappings);
    }
}
