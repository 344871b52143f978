package com.ddm.rhea.token;

/**
 * 回调注册句柄。关闭后对应回调被静默禁用，重复关闭无副作用。
 *
 * @since 1.0
 */
@FunctionalInterface
public interface Registration extends AutoCloseable {

    /**
     * 不持有任何资源的空注册
     */
    Registration NONE = () -> {
    };

    @Override
    void close();
}
