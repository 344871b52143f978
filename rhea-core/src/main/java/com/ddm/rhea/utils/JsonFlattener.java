package com.ddm.rhea.utils;

import com.ddm.rhea.ConfigurationPath;
import com.ddm.rhea.provider.ConfigurationEntry;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * 将 Jackson 树展开为扁平配置。
 * <ul>
 *   <li>对象属性 → 嵌套键，属性名首字母大写</li>
 *   <li>数组元素 → {@code :0}、{@code :1} …</li>
 *   <li>空对象 → 在其键上记录空字符串</li>
 *   <li>null → 空字符串，或者（{@code skipNulls}）不记录</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public final class JsonFlattener {

    private final Map<String, ConfigurationEntry> data = new HashMap<>();

    private final Deque<String> paths = new ArrayDeque<>();

    private final boolean skipNulls;

    private JsonFlattener(boolean skipNulls) {
        this.skipNulls = skipNulls;
    }

    /**
     * 展开顶层对象。
     *
     * @param root      顶层对象节点
     * @param skipNulls 为 true 时 null 视为不存在，否则记录为空字符串
     * @return 以大写键为索引的快照
     */
    public static Map<String, ConfigurationEntry> flatten(JsonNode root, boolean skipNulls) {
        if (!root.isObject()) {
            throw new IllegalArgumentException("Top-level element must be an object. Instead, '"
                    + root.getNodeType().name().toLowerCase() + "' was found.");
        }
        JsonFlattener flattener = new JsonFlattener(skipNulls);
        flattener.visitObject(root);
        return flattener.data;
    }

    private void visitObject(JsonNode node) {
        if (node.isEmpty()) {
            addValue("");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            enter(ConfigurationKeys.toPascalCase(field.getKey()));
            visitValue(field.getValue());
            exit();
        }
    }

    private void visitValue(JsonNode node) {
        if (node.isObject()) {
            visitObject(node);
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                enter(Integer.toString(i));
                visitValue(node.get(i));
                exit();
            }
        } else if (node.isNull() || node.isMissingNode()) {
            if (!skipNulls) {
                addValue("");
            }
        } else {
            addValue(node.asText());
        }
    }

    private void addValue(String value) {
        String key = paths.peek();
        if (key != null) {
            data.put(ConfigurationKeys.normalize(key), new ConfigurationEntry(key, value));
        }
    }

    private void enter(String context) {
        String parent = paths.peek();
        paths.push(parent == null ? context : ConfigurationPath.combine(parent, context));
    }

    private void exit() {
        paths.pop();
    }
}
