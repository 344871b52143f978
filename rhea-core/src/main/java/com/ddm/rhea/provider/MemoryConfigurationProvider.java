package com.ddm.rhea.provider;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内存配置提供者。值为 null 的条目视为不存在。
 *
 * @author liyifei
 * @since 1.0
 */
public class MemoryConfigurationProvider extends AbstractConfigurationProvider {

    private final Map<String, String> initialData;

    public MemoryConfigurationProvider(Map<String, String> initialData) {
        this.initialData = new LinkedHashMap<>(initialData);
    }

    @Override
    public void load() {
        Map<String, ConfigurationEntry> data = new HashMap<>(initialData.size() * 2);
        initialData.forEach((key, value) -> {
            if (key != null && value != null) {
                put(data, key, value);
            }
        });
        setData(data);
    }
}
