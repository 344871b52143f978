package com.ddm.rhea;

import com.ddm.rhea.token.ChangeToken;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 默认配置节：(配置根, 路径) 二元组，所有读取都委托给配置根。
 *
 * @author liyifei
 */
public class DefaultConfigurationSection implements ConfigurationSection {

    private final DefaultConfigurationRoot root;

    private final String path;

    public DefaultConfigurationSection(DefaultConfigurationRoot root, String path) {
        this.root = Objects.requireNonNull(root, "root");
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override
    public String getKey() {
        return ConfigurationPath.getSectionKey(path);
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getValue() {
        return root.get(path);
    }

    @Override
    public String get(String key) {
        return root.get(ConfigurationPath.combine(path, key));
    }

    @Override
    public ConfigurationSection getSection(String key) {
        return root.getSection(ConfigurationPath.combine(path, key));
    }

    @Override
    public List<ConfigurationSection> getChildren() {
        return root.getChildren(path);
    }

    @Override
    public ChangeToken getReloadToken() {
        return root.getReloadToken();
    }

    @Override
    public Optional<ConfigurationSection> asSection() {
        return Optional.of(this);
    }

    @Override
    public String toString() {
        String value = getValue();
        return value == null ? path : path + "=" + value;
    }
}
