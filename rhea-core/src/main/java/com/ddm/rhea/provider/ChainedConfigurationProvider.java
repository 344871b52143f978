package com.ddm.rhea.provider;

import com.ddm.rhea.Configuration;
import com.ddm.rhea.ConfigurationKeyComparator;
import com.ddm.rhea.ConfigurationSection;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.token.ChangeToken;

import java.util.List;

/**
 * 链式配置提供者：所有读取委托给被包装的配置，重新加载令牌同样转发。
 * <p>
 * 被包装的配置由调用方管理，{@link #load()} 不做任何事。
 *
 * @author liyifei
 * @since 1.0
 */
public class ChainedConfigurationProvider implements ConfigurationProvider {

    private final Configuration configuration;

    public ChainedConfigurationProvider(Configuration configuration) {
        this.configuration = configuration;
    }

    @Override
    public String get(String key) {
        return configuration.get(key);
    }

    @Override
    public void load() {
        // 被包装的配置自行加载
    }

    @Override
    public ChangeToken getReloadToken() {
        return configuration.getReloadToken();
    }

    @Override
    public void collectChildKeys(List<String> earlierKeys, String parentPath) {
        List<ConfigurationSection> children = parentPath == null
                ? configuration.getChildren()
                : configuration.getSection(parentPath).getChildren();
        for (ConfigurationSection child : children) {
            earlierKeys.add(child.getKey());
        }
        earlierKeys.sort(ConfigurationKeyComparator.INSTANCE);
    }

    @Override
    public String getName() {
        return "Chained";
    }
}
