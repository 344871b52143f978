package com.ddm.rhea;

import java.util.Objects;

/**
 * 配置路径工具类，提供对分层配置键的纯函数操作。
 * <p>
 * 配置键使用单字符分隔符 {@value #KEY_DELIMITER} 表示层级，例如 {@code Data:DB1:Connection1}。
 * 手工拼接键时应使用 {@link #combine(String...)}，而不是直接字符串拼接。
 *
 * <p><strong>示例：</strong>
 * <pre>{@code
 * ConfigurationPath.combine("parent", "", "key");   // "parent::key"
 * ConfigurationPath.getSectionKey("a:b:c");          // "c"
 * ConfigurationPath.getParentPath("a:b:c");          // "a:b"
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigurationPath {

    /**
     * 配置键分隔符
     */
    public static final String KEY_DELIMITER = ":";

    /**
     * 分隔符字符形式
     */
    public static final char KEY_DELIMITER_CHAR = ':';

    private ConfigurationPath() {
    }

    /**
     * 使用分隔符连接各个路径片段。
     * <p>
     * 空片段原样保留，因此会出现连续的分隔符（如 {@code "parent::"}）。
     *
     * @param segments 路径片段
     * @return 组合后的路径
     */
    public static String combine(String... segments) {
        Objects.requireNonNull(segments, "segments");
        return String.join(KEY_DELIMITER, segments);
    }

    /**
     * 使用分隔符连接各个路径片段。
     *
     * @param segments 路径片段
     * @return 组合后的路径
     */
    public static String combine(Iterable<String> segments) {
        Objects.requireNonNull(segments, "segments");
        return String.join(KEY_DELIMITER, segments);
    }

    /**
     * 提取路径的最后一个片段。
     *
     * @param path 配置路径
     * @return 最后一个分隔符之后的部分；没有分隔符时返回整个路径
     */
    public static String getSectionKey(String path) {
        int index = path.lastIndexOf(KEY_DELIMITER_CHAR);
        return index < 0 ? path : path.substring(index + 1);
    }

    /**
     * 提取父节点路径。
     *
     * @param path 配置路径
     * @return 最后一个分隔符之前的部分；没有分隔符时返回空字符串
     */
    public static String getParentPath(String path) {
        int index = path.lastIndexOf(KEY_DELIMITER_CHAR);
        return index < 0 ? "" : path.substring(0, index);
    }
}
