package com.ddm.rhea;

/**
 * 配置节：配置根在某个路径上的视图。
 * <p>
 * 配置节本身不持有数据，值与子节点都实时委托给配置根，因此始终能观察到最新的重新加载结果。
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigurationSection extends Configuration {

    /**
     * 配置节在父节点中的键（路径的最后一段）
     */
    String getKey();

    /**
     * 配置节的完整路径
     */
    String getPath();

    /**
     * 配置节的值；不存在时返回 null
     */
    String getValue();

    /**
     * 配置节是否存在：有值，或者至少有一个子节点。
     */
    default boolean exists() {
        return getValue() != null || !getChildren().isEmpty();
    }
}
