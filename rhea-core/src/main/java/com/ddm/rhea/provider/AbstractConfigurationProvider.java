package com.ddm.rhea.provider;

import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.utils.ConfigurationKeys;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 基于不可变快照的提供者基类。
 * <p>
 * 快照以大写键为索引，每次 {@link #load()} 整体替换（写时复制），读路径零锁。
 *
 * @author liyifei
 * @since 1.0
 */
public abstract class AbstractConfigurationProvider implements ConfigurationProvider {

    /**
     * 当前快照（整体替换；初始化为空快照）
     */
    private volatile Map<String, ConfigurationEntry> data = Map.of();

    @Override
    public String get(String key) {
        ConfigurationEntry entry = data.get(ConfigurationKeys.normalize(key));
        return entry == null ? null : entry.value();
    }

    @Override
    public void collectChildKeys(List<String> earlierKeys, String parentPath) {
        ConfigurationKeys.accumulateChildKeys(data, earlierKeys, parentPath);
    }

    /**
     * 当前快照（只读）
     */
    protected Map<String, ConfigurationEntry> getData() {
        return data;
    }

    /**
     * 原子替换快照
     */
    protected void setData(Map<String, ConfigurationEntry> data) {
        this.data = Map.copyOf(Objects.requireNonNull(data, "data"));
    }

    /**
     * 向待发布的快照写入一条配置；大小写不同的同名键后写覆盖先写。
     */
    protected static void put(Map<String, ConfigurationEntry> data, String key, String value) {
        data.put(ConfigurationKeys.normalize(key), new ConfigurationEntry(key, value));
    }

    @Override
    public String toString() {
        return getName();
    }
}
