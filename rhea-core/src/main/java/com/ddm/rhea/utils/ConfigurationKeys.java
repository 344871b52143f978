package com.ddm.rhea.utils;

import com.ddm.rhea.ConfigurationKeyComparator;
import com.ddm.rhea.ConfigurationPath;
import com.ddm.rhea.provider.ConfigurationEntry;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 配置键相关的工具方法：键规范化、子键收集、Pascal 命名转换。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigurationKeys {

    private ConfigurationKeys() {
    }

    /**
     * 将键规范化为快照 Map 使用的索引形式（大写）。
     */
    public static String normalize(String key) {
        return key.toUpperCase(Locale.ROOT);
    }

    /**
     * 从快照中收集指定父路径下的直接子键片段，追加到 {@code keys} 后整体排序。
     * <p>
     * 只有以父路径为前缀（忽略大小写）且前缀之后紧跟分隔符的键才算作子孙，
     * 仅做子串匹配是不够的（{@code "A:BC"} 不是 {@code "A:B"} 的子键）。
     *
     * @param data       以大写键为索引的快照，值中保留原始大小写的键
     * @param keys       先前提供者已收集的子键，结果直接追加到该列表
     * @param parentPath 父路径；为 null 时收集顶层片段
     */
    public static void accumulateChildKeys(Map<String, ConfigurationEntry> data,
                                           List<String> keys,
                                           String parentPath) {
        if (parentPath == null) {
            for (ConfigurationEntry entry : data.values()) {
                keys.add(segment(entry.key(), 0));
            }
        } else {
            // 大写后长度可能变化（ß → SS），前缀位置只能在原始键上确定
            String parentKey = normalize(parentPath);
            int depth = delimiterCount(parentPath);
            for (ConfigurationEntry entry : data.values()) {
                String key = entry.key();
                int end = delimiterIndex(key, depth);
                if (end >= 0 && normalize(key.substring(0, end)).equals(parentKey)) {
                    keys.add(segment(key, end + 1));
                }
            }
        }
        keys.sort(ConfigurationKeyComparator.INSTANCE);
    }

    private static int delimiterCount(String path) {
        int count = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == ConfigurationPath.KEY_DELIMITER_CHAR) {
                count++;
            }
        }
        return count;
    }

    /**
     * 第 {@code n} 个（从 0 开始）分隔符的位置，不存在时返回 -1。
     */
    private static int delimiterIndex(String key, int n) {
        int index = -1;
        for (int i = 0; i <= n; i++) {
            index = key.indexOf(ConfigurationPath.KEY_DELIMITER_CHAR, index + 1);
            if (index < 0) {
                return -1;
            }
        }
        return index;
    }

    private static String segment(String key, int start) {
        int index = key.indexOf(ConfigurationPath.KEY_DELIMITER_CHAR, start);
        return index < 0 ? key.substring(start) : key.substring(start, index);
    }

    /**
     * 首字母大写：{@code noBuild → NoBuild}。
     */
    public static String toPascalCase(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int first = text.codePointAt(0);
        return new StringBuilder(text.length())
                .appendCodePoint(Character.toUpperCase(first))
                .append(text, Character.charCount(first), text.length())
                .toString();
    }

    /**
     * 按分隔符拆分后逐段首字母大写并拼接：{@code no-build → NoBuild}。
     */
    public static String toPascalCase(String text, char separator) {
        StringBuilder sb = new StringBuilder(text.length());
        int start = 0;
        for (int i = 0; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == separator) {
                sb.append(toPascalCase(text.substring(start, i)));
                start = i + 1;
            }
        }
        return sb.toString();
    }
}
