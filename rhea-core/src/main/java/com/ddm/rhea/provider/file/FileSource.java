package com.ddm.rhea.provider.file;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 文件配置源的公共参数。
 *
 * @param path           文件路径
 * @param optional       文件不存在时是否视为空配置（否则加载失败）
 * @param reloadOnChange 文件变化时是否自动重新加载
 * @param reloadDelay    收到文件变化后延迟多久再读取，避免读到写了一半的文件
 * @author liyifei
 * @since 1.0
 */
public record FileSource(Path path, boolean optional, boolean reloadOnChange, Duration reloadDelay) {

    /**
     * 默认重新加载延迟
     */
    public static final Duration DEFAULT_RELOAD_DELAY = Duration.ofMillis(250);

    public FileSource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(reloadDelay, "reloadDelay");
        if (reloadDelay.isNegative()) {
            throw new IllegalArgumentException("reloadDelay must not be negative: " + reloadDelay);
        }
    }

    /**
     * 必需的文件，不监听变化
     */
    public static FileSource of(Path path) {
        return new FileSource(path, false, false, DEFAULT_RELOAD_DELAY);
    }

    /**
     * 可选的文件，不监听变化
     */
    public static FileSource optional(Path path) {
        return new FileSource(path, true, false, DEFAULT_RELOAD_DELAY);
    }

    public static Builder builder(Path path) {
        return new Builder(path);
    }

    public static final class Builder {
        private final Path path;
        private boolean optional;
        private boolean reloadOnChange;
        private Duration reloadDelay = DEFAULT_RELOAD_DELAY;

        private Builder(Path path) {
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder optional() {
            return optional(true);
        }

        public Builder optional(boolean optional) {
            this.optional = optional;
            return this;
        }

        public Builder reloadOnChange() {
            return reloadOnChange(true);
        }

        public Builder reloadOnChange(boolean reloadOnChange) {
            this.reloadOnChange = reloadOnChange;
            return this;
        }

        public Builder reloadDelay(Duration reloadDelay) {
            this.reloadDelay = reloadDelay;
            return this;
        }

        public FileSource build() {
            return new FileSource(path, optional, reloadOnChange, reloadDelay);
        }
    }
}
