package com.ddm.rhea.provider;

import com.ddm.rhea.utils.ConfigurationKeys;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 命令行配置提供者。
 *
 * <p>支持的形式：
 * <ul>
 *   <li>{@code --key=value}、{@code /key=value}、{@code key=value}</li>
 *   <li>{@code --key value}、{@code /key value}</li>
 *   <li>{@code -k=value}、{@code -k value}：仅当 {@code -k} 在开关映射中定义时</li>
 * </ul>
 * 键按 {@code -} 拆分后转换为 Pascal 命名（{@code --no-build → NoBuild}）；缺少值的开关与无法识别的参数被忽略；
 * 同名键后出现的覆盖先出现的。
 *
 * @author liyifei
 * @since 1.0
 */
public class CommandLineConfigurationProvider extends AbstractConfigurationProvider {

    private final List<String> args;

    /**
     * 大写开关 → 配置键
     */
    private final Map<String, String> switchMappings;

    public CommandLineConfigurationProvider(List<String> args, Map<String, String> switchMappings) {
        this.args = args;
        this.switchMappings = switchMappings;
    }

    @Override
    public void load() {
        Map<String, ConfigurationEntry> data = new HashMap<>();
        Iterator<String> it = args.iterator();
        while (it.hasNext()) {
            String current = it.next();
            int start;
            if (current.startsWith("--")) {
                start = 2;
            } else if (current.startsWith("-")) {
                start = 1;
            } else if (current.startsWith("/")) {
                // "/key" 等价于 "--key"
                current = "--" + current.substring(1);
                start = 2;
            } else {
                start = 0;
            }

            String key;
            String value;
            int separator = current.indexOf('=');
            if (separator >= 0) {
                String mapped = switchMappings.get(ConfigurationKeys.normalize(current.substring(0, separator)));
                if (mapped != null) {
                    key = mapped;
                } else if (start == 1) {
                    continue;
                } else {
                    key = current.substring(start, separator);
                }
                value = current.substring(separator + 1);
            } else {
                if (start == 0) {
                    continue;
                }
                String mapped = switchMappings.get(ConfigurationKeys.normalize(current));
                if (mapped != null) {
                    key = mapped;
                } else if (start == 1) {
                    continue;
                } else {
                    key = current.substring(start);
                }
                if (!it.hasNext()) {
                    continue;
                }
                value = it.next();
            }

            if (!key.isEmpty()) {
                put(data, ConfigurationKeys.toPascalCase(key, '-'), value);
            }
        }
        setData(data);
    }

    @Override
    public String getName() {
        return "CommandLine";
    }
}
