package com.ddm.rhea.exceptions;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 文件类提供者加载失败：文件不存在，或内容格式错误。
 *
 * @author liyifei
 * @since 1.0
 */
public class FileLoadException extends LoadException {

    public enum Reason {
        /**
         * 必需的文件不存在
         */
        NOT_FOUND,
        /**
         * 文件内容无法解析
         */
        MALFORMED
    }

    private final Path path;
    private final Reason reason;

    public FileLoadException(Path path, Reason reason, String message) {
        this(path, reason, message, null);
    }

    public FileLoadException(Path path, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.path = Objects.requireNonNull(path, "path");
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public static FileLoadException notFound(Path path) {
        return new FileLoadException(path, Reason.NOT_FOUND,
                "The configuration file '" + path + "' was not found and is not optional.");
    }

    public static FileLoadException malformed(Path path, String detail, Throwable cause) {
        return new FileLoadException(path, Reason.MALFORMED,
                "The configuration file '" + path + "' is malformed: " + detail, cause);
    }

    public Path getPath() {
        return path;
    }

    public Reason getReason() {
        return reason;
    }
}
