package com.ddm.rhea.token;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 组合令牌：任意一个子令牌触发即触发自身（逻辑或），且只触发一次。
 * <p>
 * 构造时即订阅所有活跃的子令牌；首个子令牌触发后，组合令牌调用自身回调，
 * 并释放对其余子令牌的订阅。子令牌同样是单次触发的，因此组合令牌触发后
 * 需要由持有者基于新的子令牌重新构造。
 *
 * @author liyifei
 * @since 1.0
 */
public final class CompositeChangeToken implements ChangeToken {

    private final List<ChangeToken> tokens;

    private final SingleChangeToken delegate = new SingleChangeToken();

    private final AtomicBoolean fired = new AtomicBoolean();

    private final List<Registration> subscriptions = new CopyOnWriteArrayList<>();

    private final boolean active;

    public CompositeChangeToken(Collection<? extends ChangeToken> tokens) {
        this.tokens = List.copyOf(tokens);
        boolean anyActive = false;
        for (ChangeToken token : this.tokens) {
            if (token.isActive()) {
                anyActive = true;
                subscriptions.add(token.registerChangeCallback(this::onChildChanged));
            }
        }
        this.active = anyActive;
        if (fired.get()) {
            // 构造过程中已有子令牌触发
            release();
        }
    }

    /**
     * 子令牌列表（不可修改）
     */
    public List<ChangeToken> getTokens() {
        return tokens;
    }

    @Override
    public boolean hasChanged() {
        return delegate.hasChanged();
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public Registration registerChangeCallback(Runnable callback) {
        return delegate.registerChangeCallback(callback);
    }

    private void onChildChanged() {
        if (fired.compareAndSet(false, true)) {
            release();
            delegate.notifyChanged();
        }
    }

    private void release() {
        for (Registration subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
    }
}
