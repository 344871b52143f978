package com.ddm.rhea.token;

import java.util.Objects;

/**
 * 永不触发的令牌，是不支持变更跟踪的提供者的默认令牌。
 *
 * @since 1.0
 */
public final class NeverChangeToken implements ChangeToken {

    public static final NeverChangeToken INSTANCE = new NeverChangeToken();

    private NeverChangeToken() {
    }

    @Override
    public boolean hasChanged() {
        return false;
    }

    @Override
    public boolean isActive() {
        return false;
    }

    @Override
    public Registration registerChangeCallback(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        return Registration.NONE;
    }

    @Override
    public String toString() {
        return "NeverChangeToken";
    }
}
