package com.ddm.rhea.token;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * 进程内共享的文件监听器：按目录注册 {@link WatchService}，
 * 在单个 daemon 线程上分发文件事件。
 *
 * @author : liyifei
 * @created : 2025/11/14, Friday
 * Copyright (c) 2004-2029 All Rights Reserved.
 **/
final class FileWatcher {

    private static final Logger log = LoggerFactory.getLogger(FileWatcher.class);

    private static volatile FileWatcher shared;

    private final WatchService watchService;

    /**
     * 已注册目录 → WatchKey
     */
    private final Map<Path, WatchKey> directories = new ConcurrentHashMap<>();

    /**
     * 文件绝对路径 → 监听者
     */
    private final Map<Path, List<Runnable>> listeners = new ConcurrentHashMap<>();

    private final Thread thread;

    private FileWatcher() throws IOException {
        this.watchService = FileSystems.getDefault().newWatchService();
        this.thread = new Thread(this::poll, "rhea-file-watcher");
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((th, ex) -> log.error("Uncaught in file watcher thread", ex));
        thread.start();
        log.info("File watcher started");
    }

    static FileWatcher shared() {
        FileWatcher watcher = shared;
        if (watcher == null) {
            synchronized (FileWatcher.class) {
                watcher = shared;
                if (watcher == null) {
                    try {
                        watcher = new FileWatcher();
                    } catch (IOException e) {
                        throw new IllegalStateException("Failed to create file watch service", e);
                    }
                    shared = watcher;
                }
            }
        }
        return watcher;
    }

    /**
     * 监听单个文件的创建、修改与删除。父目录不存在时无法监听，返回空注册。
     */
    Registration watch(Path file, Runnable listener) {
        Path target = file.toAbsolutePath().normalize();
        Path dir = target.getParent();
        if (dir == null || !Files.isDirectory(dir)) {
            log.warn("Cannot watch {}: parent directory does not exist", target);
            return Registration.NONE;
        }
        List<Runnable> list;
        synchronized (this) {
            try {
                directories.computeIfAbsent(dir, d -> {
                    try {
                        return d.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                    } catch (IOException e) {
                        throw new IllegalStateException(e);
                    }
                });
            } catch (IllegalStateException e) {
                log.warn("Cannot watch {}", target, e.getCause());
                return Registration.NONE;
            }
            list = listeners.computeIfAbsent(target, p -> new CopyOnWriteArrayList<>());
            list.add(listener);
        }
        log.debug("Watching {}", target);
        return () -> unwatch(target, list, listener);
    }

    /**
     * 移除监听者；文件没有监听者时移除其条目，目录下不再有被监听的文件时取消 WatchKey。
     * 在监听线程上（回调中）注销时，取消推迟到本轮事件分发之后，回调通常会立即重新注册。
     */
    private synchronized void unwatch(Path file, List<Runnable> list, Runnable listener) {
        if (!list.remove(listener) || !list.isEmpty()) {
            return;
        }
        listeners.remove(file, list);
        if (Thread.currentThread() != thread) {
            cancelIfUnused(file.getParent());
        }
    }

    private synchronized void cancelIfUnused(Path dir) {
        for (Path watched : listeners.keySet()) {
            if (dir.equals(watched.getParent())) {
                return;
            }
        }
        WatchKey key = directories.remove(dir);
        if (key != null) {
            key.cancel();
            log.debug("Stopped watching {}", dir);
        }
    }

    boolean isWatching(Path file) {
        return listeners.containsKey(file.toAbsolutePath().normalize());
    }

    boolean isWatchingDirectory(Path dir) {
        return directories.containsKey(dir.toAbsolutePath().normalize());
    }

    private void poll() {
        while (true) {
            WatchKey key;
            try {
                key = watchService.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            Path dir = (Path) key.watchable();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == OVERFLOW) {
                    listeners.forEach((file, list) -> {
                        if (dir.equals(file.getParent())) {
                            dispatch(file, list);
                        }
                    });
                    continue;
                }
                Path file = dir.resolve((Path) event.context());
                List<Runnable> list = listeners.get(file);
                if (list != null) {
                    log.trace("File event {} on {}", event.kind().name(), file);
                    dispatch(file, list);
                }
            }
            cancelIfUnused(dir);
            if (!key.reset()) {
                directories.remove(dir, key);
                log.debug("Watch key for {} is no longer valid", dir);
            }
        }
    }

    private static void dispatch(Path file, List<Runnable> list) {
        for (Runnable listener : list) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("File change listener failed for {}", file, e);
            }
        }
    }
}
