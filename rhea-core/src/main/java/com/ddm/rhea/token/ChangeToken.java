package com.ddm.rhea.token;

/**
 * 变更通知令牌：单次触发，触发后由新的令牌接替。
 *
 * <p>生命周期：
 * <ol>
 *   <li><strong>Armed</strong>：可以注册任意多个回调，尚未触发</li>
 *   <li><strong>Fired</strong>：所有已注册回调恰好被调用一次，此后该实例不再触发</li>
 * </ol>
 * 要观察下一次变更，必须从配置（或提供者）重新获取令牌，令牌实例不可复用。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * Registration registration = root.getReloadToken()
 *         .registerChangeCallback(() -> log.info("configuration reloaded"));
 * // 不再关心时关闭注册
 * registration.close();
 * }</pre>
 *
 * @see ChangeTokens#onChange(java.util.function.Supplier, Runnable)
 * @author liyifei
 * @since 1.0
 */
public interface ChangeToken {

    /**
     * 是否已经发生变更（令牌已触发）。
     */
    boolean hasChanged();

    /**
     * 令牌是否可能触发回调。
     * <p>
     * 返回 false 表示该令牌永远不会触发（例如 {@link NeverChangeToken}），
     * 调用方可以跳过注册。
     */
    boolean isActive();

    /**
     * 注册变更回调。
     * <p>
     * 如果令牌已经触发，回调会在调用线程上立即执行，并返回空注册。
     *
     * @param callback 回调，不能为 null
     * @return 注册句柄，关闭后该回调不再被调用
     */
    Registration registerChangeCallback(Runnable callback);
}
