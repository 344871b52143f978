package com.ddm.rhea.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 由持有者手动触发的单次令牌（Armed → Fired 状态机）。
 *
 * <p><strong>语义：</strong>
 * <ul>
 *   <li>{@link #notifyChanged()} 按注册顺序调用所有回调，每个回调恰好一次</li>
 *   <li>重复调用 {@link #notifyChanged()} 无效果</li>
 *   <li>触发后再注册的回调会在调用线程上立即执行</li>
 *   <li>单个回调抛出的异常只记录日志，不影响其它回调</li>
 * </ul>
 * 回调在锁外执行，回调内部可以安全地注册新的令牌。
 *
 * @author liyifei
 * @since 1.0
 */
public class SingleChangeToken implements ChangeToken {

    private static final Logger log = LoggerFactory.getLogger(SingleChangeToken.class);

    private final Object lock = new Object();

    /**
     * 已注册但尚未执行的回调，保持注册顺序
     */
    private final Set<Callback> callbacks = new LinkedHashSet<>();

    private volatile boolean changed;

    @Override
    public boolean hasChanged() {
        return changed;
    }

    @Override
    public boolean isActive() {
        return true;
    }

    @Override
    public Registration registerChangeCallback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (!changed) {
                Callback holder = new Callback(callback);
                callbacks.add(holder);
                return () -> unregister(holder);
            }
        }
        invoke(callback);
        return Registration.NONE;
    }

    /**
     * 触发令牌。
     *
     * @return 本次调用是否真正触发了令牌（已触发过则返回 false）
     */
    public boolean notifyChanged() {
        List<Callback> snapshot;
        synchronized (lock) {
            if (changed) {
                return false;
            }
            changed = true;
            snapshot = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        log.trace("Change token fired, invoking {} callback(s)", snapshot.size());
        for (Callback holder : snapshot) {
            if (!holder.cancelled) {
                invoke(holder.action);
            }
        }
        return true;
    }

    /**
     * 当前仍处于注册状态的回调数量。
     */
    protected int callbackCount() {
        synchronized (lock) {
            return callbacks.size();
        }
    }

    private void unregister(Callback holder) {
        holder.cancelled = true;
        synchronized (lock) {
            callbacks.remove(holder);
        }
    }

    private static void invoke(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Change callback failed", e);
        }
    }

    private static final class Callback {
        private final Runnable action;
        private volatile boolean cancelled;

        private Callback(Runnable action) {
            this.action = action;
        }
    }
}
