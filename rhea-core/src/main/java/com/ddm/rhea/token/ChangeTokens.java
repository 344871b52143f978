package com.ddm.rhea.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 令牌工具方法。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ChangeTokens {

    private static final Logger log = LoggerFactory.getLogger(ChangeTokens.class);

    private ChangeTokens() {
    }

    /**
     * 持续监听变更：每次令牌触发后调用 consumer，然后从 producer 取得新令牌继续订阅。
     * <p>
     * producer 必须在通知之前换上新令牌，否则会对同一个已触发的令牌反复订阅。
     *
     * @param producer 令牌来源，例如 {@code root::getReloadToken}
     * @param consumer 变更处理逻辑
     * @return 关闭后停止监听
     */
    public static Registration onChange(Supplier<? extends ChangeToken> producer, Runnable consumer) {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
        ChangeLoop loop = new ChangeLoop(producer, consumer);
        loop.subscribe();
        return loop;
    }

    private static final class ChangeLoop implements Registration {
        private final Supplier<? extends ChangeToken> producer;
        private final Runnable consumer;
        private volatile boolean closed;
        private volatile Registration current = Registration.NONE;

        private ChangeLoop(Supplier<? extends ChangeToken> producer, Runnable consumer) {
            this.producer = producer;
            this.consumer = consumer;
        }

        private void subscribe() {
            if (closed) {
                return;
            }
            ChangeToken token = producer.get();
            if (token == null || !token.isActive()) {
                log.debug("Change token is not active, stop listening");
                return;
            }
            current = token.registerChangeCallback(this::onChanged);
            if (closed) {
                current.close();
            }
        }

        private void onChanged() {
            if (closed) {
                return;
            }
            try {
                consumer.run();
            } finally {
                subscribe();
            }
        }

        @Override
        public void close() {
            closed = true;
            current.close();
        }
    }
}
