package com.ddm.rhea;

import com.ddm.rhea.token.ChangeToken;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 分层配置的只读视图。键使用 {@value ConfigurationPath#KEY_DELIMITER} 分隔层级，查找忽略大小写。
 *
 * <p>实现包括配置根 {@link ConfigurationRoot} 和配置节 {@link ConfigurationSection}。
 * 遍历（{@link #iterator()}）按深度优先顺序返回每个可达节点的 (路径, 值) 对，
 * 不存在值的中间节点返回空字符串。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * Configuration config = new DefaultConfigurationBuilder()
 *         .addInMemory(Map.of("Logging:Level", "Info"))
 *         .build();
 *
 * config.get("logging:level");                 // "Info"
 * config.getSection("Logging").get("Level");   // "Info"
 * for (Map.Entry<String, String> e : config) {
 *     System.out.println(e.getKey() + "=" + e.getValue());
 * }
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public interface Configuration extends Iterable<Map.Entry<String, String>> {

    /**
     * 获取配置值。
     *
     * @param key 配置键（忽略大小写）
     * @return 配置值；不存在时返回 null。空字符串是一个存在的值
     */
    String get(String key);

    /**
     * 获取指定键对应的配置节。即使键不存在也返回配置节（{@link ConfigurationSection#exists()} 为 false）。
     */
    ConfigurationSection getSection(String key);

    /**
     * 直接子配置节，按 {@link ConfigurationKeyComparator} 排序。
     */
    List<ConfigurationSection> getChildren();

    /**
     * 重新加载通知令牌。令牌是单次的，每次触发后需要重新获取。
     */
    ChangeToken getReloadToken();

    /**
     * 尝试将当前配置视为配置节。
     */
    default Optional<ConfigurationSection> asSection() {
        return Optional.empty();
    }

    /**
     * 按绝对路径遍历所有可达节点。
     */
    @Override
    default Iterator<Map.Entry<String, String>> iterator() {
        return iterator(PathKind.ABSOLUTE);
    }

    /**
     * 按指定路径形式遍历所有可达节点。
     */
    default Iterator<Map.Entry<String, String>> iterator(PathKind kind) {
        return new ConfigurationIterator(this, kind);
    }
}
