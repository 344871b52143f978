package com.ddm.rhea.exceptions;

import java.util.List;
import java.util.Objects;

/**
 * 构建或重新加载配置失败。
 * <ul>
 *   <li>{@link Kind#PROVIDER}：一个或多个提供者加载失败，{@link #getFailures()} 按提供者顺序列出全部失败</li>
 *   <li>{@link Kind#BORROWED}：等待读操作结束超时，{@link #getOutstandingReaders()} 为未释放的读锁数</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public class ReloadException extends ConfigurationException {

    public enum Kind {
        PROVIDER,
        BORROWED
    }

    /**
     * 单个提供者的失败
     *
     * @param providerName 提供者名称
     * @param error        加载异常
     */
    public record ProviderFailure(String providerName, LoadException error) {
        public ProviderFailure {
            Objects.requireNonNull(providerName, "providerName");
            Objects.requireNonNull(error, "error");
        }

        @Override
        public String toString() {
            return error.getMessage() + " (" + providerName + ")";
        }
    }

    private final Kind kind;
    private final List<ProviderFailure> failures;
    private final int outstandingReaders;

    private ReloadException(Kind kind, String message, List<ProviderFailure> failures, int outstandingReaders) {
        super(message, failures.isEmpty() ? null : failures.get(0).error());
        this.kind = kind;
        this.failures = failures;
        this.outstandingReaders = outstandingReaders;
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i).error());
        }
    }

    public static ReloadException of(List<ProviderFailure> failures) {
        if (failures == null || failures.isEmpty()) {
            throw new IllegalArgumentException("failures must not be empty");
        }
        List<ProviderFailure> copy = List.copyOf(failures);
        return new ReloadException(Kind.PROVIDER, format(copy), copy, 0);
    }

    public static ReloadException borrowed(int outstandingReaders) {
        return new ReloadException(Kind.BORROWED,
                "Configuration cannot be reloaded while " + outstandingReaders + " reader(s) hold it",
                List.of(), outstandingReaders);
    }

    public Kind getKind() {
        return kind;
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }

    public int getOutstandingReaders() {
        return outstandingReaders;
    }

    private static String format(List<ProviderFailure> failures) {
        if (failures.size() == 1) {
            return failures.get(0).toString();
        }
        StringBuilder sb = new StringBuilder("One or more load errors occurred:");
        for (int i = 0; i < failures.size(); i++) {
            sb.append(System.lineSeparator()).append("  [").append(i + 1).append("]: ").append(failures.get(i));
        }
        return sb.toString();
    }
}
