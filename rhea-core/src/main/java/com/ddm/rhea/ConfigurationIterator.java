package com.ddm.rhea;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 深度优先遍历配置树，返回每个可达节点的 (路径, 值)。
 * <p>
 * 遍历对象本身是配置节时：{@link PathKind#ABSOLUTE} 会先返回该节点自身，
 * {@link PathKind#RELATIVE} 则跳过自身，并去掉子节点路径中的节点前缀。
 * 没有值的节点返回空字符串。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigurationIterator implements Iterator<Map.Entry<String, String>> {

    private final Deque<ConfigurationSection> stack = new ArrayDeque<>();

    private final int prefixLength;

    private Map.Entry<String, String> first;

    public ConfigurationIterator(Configuration configuration, PathKind kind) {
        pushAll(configuration.getChildren());
        Optional<ConfigurationSection> self = configuration.asSection();
        if (self.isPresent()) {
            ConfigurationSection section = self.get();
            if (kind == PathKind.RELATIVE) {
                this.prefixLength = section.getPath().length() + 1;
            } else {
                this.prefixLength = 0;
                this.first = entry(section.getPath(), section.getValue());
            }
        } else {
            this.prefixLength = 0;
        }
    }

    @Override
    public boolean hasNext() {
        return first != null || !stack.isEmpty();
    }

    @Override
    public Map.Entry<String, String> next() {
        if (first != null) {
            Map.Entry<String, String> result = first;
            first = null;
            return result;
        }
        ConfigurationSection section = stack.poll();
        if (section == null) {
            throw new NoSuchElementException();
        }
        pushAll(section.getChildren());
        return entry(section.getPath().substring(prefixLength), section.getValue());
    }

    private void pushAll(List<ConfigurationSection> children) {
        // 逆序压栈，保证按排序顺序弹出
        for (int i = children.size() - 1; i >= 0; i--) {
            stack.push(children.get(i));
        }
    }

    private static Map.Entry<String, String> entry(String key, String value) {
        return Map.entry(key, value == null ? "" : value);
    }
}
