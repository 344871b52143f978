package com.ddm.rhea.provider;

import java.util.Objects;

/**
 * 提供者快照中的一条配置：保留原始大小写的键和值。
 * <p>
 * 快照 Map 以大写键索引，本记录保存原始键用于展示和子键提取。
 *
 * @param key   原始大小写的完整键，不能为 null
 * @param value 配置值，不能为 null（空字符串表示“存在但为空”）
 * @since 1.0
 */
public record ConfigurationEntry(String key, String value) {

    public ConfigurationEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
