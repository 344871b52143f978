package com.ddm.rhea.token;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 监听单个文件的单次令牌：文件被创建、修改或删除时触发。
 * <p>
 * 第一次注册回调时才开始监听；全部回调注销或令牌触发后停止监听。
 *
 * @author liyifei
 * @since 1.0
 */
public final class FileChangeToken extends SingleChangeToken {

    private final Path path;

    private Registration watch;

    public FileChangeToken(Path path) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public Registration registerChangeCallback(Runnable callback) {
        startWatching();
        Registration registration = super.registerChangeCallback(callback);
        return () -> {
            registration.close();
            if (callbackCount() == 0) {
                stopWatching();
            }
        };
    }

    private synchronized void startWatching() {
        if (watch == null && !hasChanged()) {
            watch = FileWatcher.shared().watch(path, this::onFileChanged);
        }
    }

    private synchronized void stopWatching() {
        if (watch != null) {
            watch.close();
            watch = null;
        }
    }

    private void onFileChanged() {
        stopWatching();
        notifyChanged();
    }

    @Override
    public String toString() {
        return "FileChangeToken[" + path + "]";
    }
}
