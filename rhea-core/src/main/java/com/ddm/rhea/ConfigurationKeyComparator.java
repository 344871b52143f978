package com.ddm.rhea;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 配置键比较器，为分层键提供稳定的全序。
 * <p>
 * 比较规则（逐片段比较）：
 * <ul>
 *   <li>数字 vs 数字：按数值比较（{@code "2" < "10"}）</li>
 *   <li>数字 vs 非数字：数字在前</li>
 *   <li>非数字 vs 非数字：忽略大小写的字典序</li>
 *   <li>公共前缀相同：片段少的在前</li>
 * </ul>
 * <p>
 * 比较前会丢弃所有空片段，因此 {@code ":Foo"} 与 {@code "Foo"} 相等，
 * 中间含有连续分隔符的键也可能与不同的键比较相等。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigurationKeyComparator implements Comparator<String> {

    public static final ConfigurationKeyComparator INSTANCE = new ConfigurationKeyComparator();

    private ConfigurationKeyComparator() {
    }

    @Override
    public int compare(String key, String otherKey) {
        List<String> parts1 = split(key);
        List<String> parts2 = split(otherKey);
        int max = Math.min(parts1.size(), parts2.size());

        for (int i = 0; i < max; i++) {
            String x = parts1.get(i);
            String y = parts2.get(i);
            boolean xNumeric = isIndex(x);
            boolean yNumeric = isIndex(y);

            if (xNumeric) {
                if (!yNumeric) {
                    return -1;
                }
                int result = compareIndexes(x, y);
                if (result != 0) {
                    return result;
                }
            } else if (yNumeric) {
                return 1;
            } else {
                int result = x.toUpperCase(Locale.ROOT).compareTo(y.toUpperCase(Locale.ROOT));
                if (result != 0) {
                    return result;
                }
            }
        }
        return Integer.compare(parts1.size(), parts2.size());
    }

    /**
     * 判断片段是否为非负整数（仅由 ASCII 数字组成）。
     *
     * @param segment 键片段
     * @return 是否为数组下标形式
     */
    public static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * 比较两个数字片段，支持任意长度。
     */
    static int compareIndexes(String x, String y) {
        String a = stripLeadingZeros(x);
        String b = stripLeadingZeros(y);
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    private static List<String> split(String key) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        int length = key.length();
        for (int i = 0; i <= length; i++) {
            if (i == length || key.charAt(i) == ConfigurationPath.KEY_DELIMITER_CHAR) {
                if (i > start) {
                    parts.add(key.substring(start, i));
                }
                start = i + 1;
            }
        }
        return parts;
    }
}
