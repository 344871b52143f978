package com.ddm.rhea;

import com.ddm.rhea.exceptions.LoadException;
import com.ddm.rhea.exceptions.ReloadException;
import com.ddm.rhea.exceptions.ReloadException.ProviderFailure;
import com.ddm.rhea.token.ChangeToken;
import com.ddm.rhea.token.CompositeChangeToken;
import com.ddm.rhea.token.Registration;
import com.ddm.rhea.token.SingleChangeToken;
import com.ddm.rhea.utils.ConfigurationKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 默认配置根。
 * <p>
 * 设计要点：
 * - 提供者列表构建后固定；读操作（get/children/debug view）持有读锁，可并发。
 * - reload() 在有限时间内获取写锁；读操作未能及时结束时抛出 BORROWED 类型的 {@link ReloadException}。
 * - 重新加载令牌 = 所有提供者当前令牌 + 配置根自身触发器 的组合令牌。
 *   每个组合令牌上配置根最先注册重建回调，保证用户回调执行时新令牌已经就位。
 * - 令牌通知总是在写锁释放之后进行，回调中可以安全地读取配置或再次 reload。
 *
 * @author : liyifei
 * @created : 2025/11/10, Monday
 * Copyright (c) 2004-2029 All Rights Reserved.
 **/
public class DefaultConfigurationRoot implements ConfigurationRoot {

    private static final Logger log = LoggerFactory.getLogger(DefaultConfigurationRoot.class);

    private final List<ConfigurationProvider> providers;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Duration reloadTimeout;

    /**
     * 令牌切换互斥
     */
    private final Object tokenLock = new Object();

    /**
     * 当前发布的令牌
     */
    private volatile ReloadState state;

    private volatile boolean closed;

    /**
     * @param providers     已加载的提供者，按优先级从低到高排列
     * @param reloadTimeout reload() 等待读操作结束的最长时间
     */
    public DefaultConfigurationRoot(List<ConfigurationProvider> providers, Duration reloadTimeout) {
        this.providers = List.copyOf(providers);
        this.reloadTimeout = Objects.requireNonNull(reloadTimeout, "reloadTimeout");
        synchronized (tokenLock) {
            publish();
        }
    }

    @Override
    public String get(String key) {
        Objects.requireNonNull(key, "key");
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            for (int i = providers.size() - 1; i >= 0; i--) {
                String value = providers.get(i).get(key);
                if (value != null) {
                    return value;
                }
            }
            return null;
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public ConfigurationSection getSection(String key) {
        return new DefaultConfigurationSection(this, key);
    }

    @Override
    public List<ConfigurationSection> getChildren() {
        return getChildren(null);
    }

    @Override
    public ChangeToken getReloadToken() {
        return state.composite;
    }

    @Override
    public List<ConfigurationProvider> getProviders() {
        return providers;
    }

    /**
     * 合并所有提供者在指定路径下的子键：忽略大小写去重（保留最后出现的写法），再排序。
     *
     * @param path 父路径；为 null 表示顶层
     */
    List<ConfigurationSection> getChildren(String path) {
        List<String> keys = new ArrayList<>();
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            for (ConfigurationProvider provider : providers) {
                provider.collectChildKeys(keys, path);
            }
        } finally {
            readLock.unlock();
        }

        Map<String, String> distinct = new LinkedHashMap<>();
        for (String key : keys) {
            distinct.put(ConfigurationKeys.normalize(key), key);
        }
        List<String> sorted = new ArrayList<>(distinct.values());
        sorted.sort(ConfigurationKeyComparator.INSTANCE);

        List<ConfigurationSection> children = new ArrayList<>(sorted.size());
        for (String key : sorted) {
            children.add(getSection(path == null ? key : ConfigurationPath.combine(path, key)));
        }
        return children;
    }

    @Override
    public void reload() {
        List<ProviderFailure> failures;
        Lock writeLock = lock.writeLock();
        boolean acquired;
        try {
            acquired = writeLock.tryLock(reloadTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ReloadException.borrowed(lock.getReadLockCount());
        }
        if (!acquired) {
            int readers = lock.getReadLockCount();
            log.warn("Reload timed out after {}ms waiting for {} reader(s)", reloadTimeout.toMillis(), readers);
            throw ReloadException.borrowed(readers);
        }
        try {
            failures = loadAll(providers);
        } finally {
            writeLock.unlock();
        }

        // 触发旧令牌；重建回调先于用户回调换上新令牌
        state.trigger.notifyChanged();

        if (!failures.isEmpty()) {
            throw ReloadException.of(failures);
        }
        log.info("Configuration reloaded ({} provider(s))", providers.size());
    }

    @Override
    public String getDebugView() {
        StringBuilder sb = new StringBuilder();
        appendDebugView(sb, getChildren(), "");
        return sb.toString();
    }

    private void appendDebugView(StringBuilder sb, List<ConfigurationSection> children, String indent) {
        for (ConfigurationSection child : children) {
            sb.append(indent).append(child.getKey());
            boolean found = false;
            for (int i = providers.size() - 1; i >= 0 && !found; i--) {
                ConfigurationProvider provider = providers.get(i);
                String value = provider.get(child.getPath());
                if (value != null) {
                    sb.append('=').append(value).append(" (").append(provider.getName()).append(')');
                    found = true;
                }
            }
            if (!found) {
                sb.append(':');
            }
            sb.append('\n');
            appendDebugView(sb, child.getChildren(), indent + "  ");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        synchronized (tokenLock) {
            state.subscription.close();
        }
        closeAll(providers);
        log.info("Configuration closed");
    }

    @Override
    public String toString() {
        return "DefaultConfigurationRoot" + providers;
    }

    /**
     * 发布新的组合令牌（调用方持有 tokenLock）。
     */
    private void publish() {
        List<ChangeToken> tokens = new ArrayList<>(providers.size() + 1);
        for (ConfigurationProvider provider : providers) {
            tokens.add(provider.getReloadToken());
        }
        SingleChangeToken trigger = new SingleChangeToken();
        tokens.add(trigger);
        ReloadState next = new ReloadState(trigger, new CompositeChangeToken(tokens));
        this.state = next;
        next.subscription = next.composite.registerChangeCallback(() -> onChanged(next));
    }

    private void onChanged(ReloadState fired) {
        synchronized (tokenLock) {
            if (closed || state != fired) {
                return;
            }
            log.debug("Reload token fired, publishing a new one");
            publish();
        }
    }

    /**
     * 按顺序加载所有提供者，收集全部失败（不短路）。
     */
    static List<ProviderFailure> loadAll(List<ConfigurationProvider> providers) {
        List<ProviderFailure> failures = new ArrayList<>();
        for (ConfigurationProvider provider : providers) {
            try {
                provider.load();
            } catch (LoadException e) {
                log.warn("Failed to load {}: {}", provider.getName(), e.getMessage());
                failures.add(new ProviderFailure(provider.getName(), e));
            } catch (RuntimeException e) {
                log.warn("Unexpected failure loading {}", provider.getName(), e);
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                failures.add(new ProviderFailure(provider.getName(), new LoadException(message, e)));
            }
        }
        return failures;
    }

    static void closeAll(List<ConfigurationProvider> providers) {
        for (ConfigurationProvider provider : providers) {
            try {
                provider.close();
            } catch (Exception e) {
                // 单个提供者关闭失败不影响其余提供者
                log.warn("Failed to close {}", provider.getName(), e);
            }
        }
    }

    private static final class ReloadState {
        private final SingleChangeToken trigger;
        private final CompositeChangeToken composite;
        private Registration subscription = Registration.NONE;

        private ReloadState(SingleChangeToken trigger, CompositeChangeToken composite) {
            this.trigger = trigger;
            this.composite = composite;
        }
    }
}
