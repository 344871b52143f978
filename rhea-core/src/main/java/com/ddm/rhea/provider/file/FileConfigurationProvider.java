package com.ddm.rhea.provider.file;

import com.ddm.rhea.exceptions.FileLoadException;
import com.ddm.rhea.exceptions.LoadException;
import com.ddm.rhea.provider.AbstractConfigurationProvider;
import com.ddm.rhea.provider.ConfigurationEntry;
import com.ddm.rhea.token.ChangeToken;
import com.ddm.rhea.token.ChangeTokens;
import com.ddm.rhea.token.FileChangeToken;
import com.ddm.rhea.token.Registration;
import com.ddm.rhea.token.SingleChangeToken;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 文件类配置提供者基类。
 * <p>
 * 设计要点：
 * - load()：文件不存在时，可选文件得到空配置，必需文件抛出 NOT_FOUND；内容无法解析抛出 MALFORMED。
 * - reloadOnChange：监听文件变化，每次变化取消尚未执行的重新加载并按 reloadDelay 重新计时（去抖），
 *   在共享的 daemon 调度线程上执行，读路径从不等待。
 * - 监听触发的重新加载：先替换快照，再换上新令牌，最后通知旧令牌。
 *   此时文件不存在视为空配置；解析失败保留旧快照，不通知。
 * - 由配置根调用的 load() 不通知令牌，由配置根统一通知。
 *
 * @author liyifei
 */
public abstract class FileConfigurationProvider extends AbstractConfigurationProvider {

    private static final Logger log = LoggerFactory.getLogger(FileConfigurationProvider.class);

    /**
     * 单线程调度器（daemon 线程），所有文件提供者共享
     */
    private static volatile ScheduledExecutorService scheduler;

    private final FileSource file;

    private final Registration watching;

    private volatile SingleChangeToken token = new SingleChangeToken();

    private ScheduledFuture<?> pending;

    private volatile boolean closed;

    protected FileConfigurationProvider(FileSource file) {
        this.file = Objects.requireNonNull(file, "file");
        if (file.reloadOnChange()) {
            this.watching = ChangeTokens.onChange(() -> new FileChangeToken(file.path()), this::scheduleReload);
            log.debug("Watching {} for changes (delay={}ms)", file.path(), file.reloadDelay().toMillis());
        } else {
            this.watching = Registration.NONE;
        }
    }

    public FileSource getFile() {
        return file;
    }

    @Override
    public ChangeToken getReloadToken() {
        return token;
    }

    @Override
    public void load() {
        load(false);
    }

    /**
     * 解析文件内容。
     *
     * @return 以大写键为索引的快照
     * @throws IOException              读取失败（{@link JsonProcessingException} 视为格式错误）
     * @throws IllegalArgumentException 内容格式错误
     */
    protected abstract Map<String, ConfigurationEntry> parse(InputStream in) throws IOException;

    private void load(boolean fromWatch) {
        Path path = file.path();
        if (!Files.isRegularFile(path)) {
            if (file.optional() || fromWatch) {
                setData(Map.of());
                return;
            }
            throw FileLoadException.notFound(path);
        }

        Map<String, ConfigurationEntry> data;
        try (InputStream in = Files.newInputStream(path)) {
            data = parse(in);
        } catch (NoSuchFileException e) {
            if (file.optional() || fromWatch) {
                setData(Map.of());
                return;
            }
            throw FileLoadException.notFound(path);
        } catch (JsonProcessingException e) {
            throw FileLoadException.malformed(path, e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw FileLoadException.malformed(path, e.getMessage(), e);
        } catch (IOException e) {
            throw new LoadException("Failed to read the configuration file '" + path + "'", e);
        }
        setData(data);
        log.debug("Loaded {} key(s) from {}", data.size(), path);
    }

    private synchronized void scheduleReload() {
        if (closed) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
        }
        pending = scheduler().schedule(this::reloadFromWatch, file.reloadDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reloadFromWatch() {
        if (closed) {
            return;
        }
        try {
            load(true);
        } catch (LoadException e) {
            log.warn("Reload of {} failed, keep previous data.", file.path(), e);
            return;
        }
        SingleChangeToken previous = this.token;
        this.token = new SingleChangeToken();
        log.info("Reloaded {} after file change", file.path());
        previous.notifyChanged();
    }

    @Override
    public void close() {
        closed = true;
        watching.close();
        synchronized (this) {
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
    }

    @Override
    public String getName() {
        Path name = file.path().getFileName();
        return getClass().getSimpleName() + " for '" + (name == null ? file.path() : name) + "'"
                + (file.optional() ? " (Optional)" : " (Required)");
    }

    private static ScheduledExecutorService scheduler() {
        ScheduledExecutorService sch = scheduler;
        if (sch == null) {
            synchronized (FileConfigurationProvider.class) {
                sch = scheduler;
                if (sch == null) {
                    sch = Executors.newSingleThreadScheduledExecutor(r -> {
                        Thread t = new Thread(r, "rhea-file-reload");
                        t.setDaemon(true);
                        t.setUncaughtExceptionHandler((th, ex) -> log.error("Uncaught in file reload thread", ex));
                        return t;
                    });
                    scheduler = sch;
                }
            }
        }
        return sch;
    }
}
