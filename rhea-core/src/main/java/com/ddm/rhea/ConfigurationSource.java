package com.ddm.rhea;

/**
 * 配置源：描述如何创建一个 {@link ConfigurationProvider}。
 *
 * @author liyifei
 * @since 1.0
 */
@FunctionalInterface
public interface ConfigurationSource {

    /**
     * 创建提供者。创建后由配置根负责加载。
     *
     * @param builder 当前构建器，可从中读取共享属性
     */
    ConfigurationProvider build(ConfigurationBuilder builder);
}
