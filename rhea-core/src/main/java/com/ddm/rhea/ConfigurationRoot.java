package com.ddm.rhea;

import java.util.List;

/**
 * 配置根：持有按注册顺序排列的提供者列表，后注册的提供者优先。
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigurationRoot extends Configuration, AutoCloseable {

    /**
     * 按顺序重新加载所有提供者。
     * <p>
     * 无论是否有提供者失败，都会通知当前的重新加载令牌并换上新令牌；
     * 失败的提供者汇总后以 {@link com.ddm.rhea.exceptions.ReloadException} 抛出。
     *
     * @throws com.ddm.rhea.exceptions.ReloadException 提供者加载失败，或等待读操作结束超时
     */
    void reload();

    /**
     * 提供者列表（不可修改），按注册顺序排列。
     */
    List<ConfigurationProvider> getProviders();

    /**
     * 生成配置树的调试视图：每行一个键，子节点缩进两个空格；
     * 有值的节点显示为 {@code key=value (Provider)}，标明生效的提供者，否则显示为 {@code key:}。
     */
    String getDebugView();

    /**
     * 关闭所有提供者并停止变更监听。
     */
    @Override
    void close();
}
