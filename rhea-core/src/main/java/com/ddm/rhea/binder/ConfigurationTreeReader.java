package com.ddm.rhea.binder;

import com.ddm.rhea.Configuration;
import com.ddm.rhea.ConfigurationKeyComparator;
import com.ddm.rhea.ConfigurationPath;
import com.ddm.rhea.ConfigurationSection;
import com.ddm.rhea.exceptions.BindingException;
import com.ddm.rhea.utils.ConfigurationKeys;
import com.ddm.rhea.utils.Converters;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.AnnotatedMember;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 按目标类型把配置树整理为 Jackson 树，再交给 Jackson 完成对象构造。
 * <p>
 * 设计要点：
 * - 标量：由 {@link Converters} 解析叶子值（失败时报告键和原始值），再转换为对应的 JSON 节点。
 * - 序列（List/Set/数组）：只取键为非负整数的子节点，按数值升序；其它子节点被忽略。
 * - Map：取全部子节点，键保持原始大小写。
 * - record：组件默认必需，{@link Optional} 或标注 {@link DefaultValue} 的组件除外。
 * - POJO：仅 {@code @JsonProperty(required = true)} 的属性必需；原地绑定时缺失的属性保持原值。
 * - 属性元数据按类型缓存在 Caffeine 中。
 *
 * @author : liyifei
 * @created : 2025/11/12, Wednesday
 * Copyright (c) 2004-2029 All Rights Reserved.
 **/
final class ConfigurationTreeReader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationTreeReader.class);

    private final ObjectMapper mapper;

    private final JsonNodeFactory nodes;

    /**
     * 类型 → 属性绑定元数据
     */
    private final LoadingCache<JavaType, List<PropertyBinding>> properties;

    ConfigurationTreeReader(ObjectMapper mapper) {
        this.mapper = mapper;
        this.nodes = mapper.getNodeFactory();
        this.properties = Caffeine.newBuilder()
                .maximumSize(1024)
                .build(this::describe);
    }

    /**
     * 读取新值对应的 Jackson 树。
     *
     * @return 配置中不存在时返回 null
     */
    JsonNode read(Configuration node, JavaType type) {
        Class<?> raw = type.getRawClass();
        if (raw == Optional.class) {
            if (!exists(node)) {
                return null;
            }
            JsonNode inner = read(node, type.containedTypeOrUnknown(0));
            return inner == null ? NullNode.getInstance() : inner;
        }
        if (Converters.isScalar(raw)) {
            String value = valueOf(node);
            return value == null ? null : scalar(pathOf(node), value, raw);
        }
        if (!exists(node)) {
            return null;
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            return readSequence(node, type.getContentType());
        }
        if (type.isMapLikeType()) {
            return readMap(node, type.getContentType());
        }
        if (raw == Object.class || JsonNode.class.isAssignableFrom(raw)) {
            return readUntyped(node);
        }
        if (raw.isRecord()) {
            return readBean(node, type, null);
        }
        List<ConfigurationSection> children = node.getChildren();
        if (children.isEmpty()) {
            // 没有子节点：交给 Jackson 从字符串构造（URI、Path、Locale 等）
            String value = valueOf(node);
            return value == null ? NullNode.getInstance() : TextNode.valueOf(value);
        }
        return readBean(node, type, null);
    }

    /**
     * 读取 POJO / record 的属性树。
     *
     * @param target 原地绑定的目标对象；为 null 表示构造新对象
     */
    ObjectNode readBean(Configuration node, JavaType type, Object target) {
        boolean fresh = target == null;
        ObjectNode object = nodes.objectNode();
        for (PropertyBinding property : properties.get(type)) {
            Configuration section = find(node, property);
            if (section != null && !fresh && bindNested(section, property, target)) {
                continue;
            }
            JsonNode value = section == null ? null : read(section, property.type());
            if (value == null) {
                if (property.defaultValue() != null) {
                    value = defaultNode(node, property);
                } else if (property.isOptional() && fresh) {
                    value = NullNode.getInstance();
                } else if (property.required() && fresh) {
                    throw BindingException.missingValue(property.fieldName());
                }
            }
            if (value != null) {
                object.set(property.propertyName(), value);
            }
        }
        return object;
    }

    /**
     * 原地合并已存在的嵌套 POJO。
     *
     * @return 是否已处理
     */
    private boolean bindNested(Configuration section, PropertyBinding property, Object target) {
        AnnotatedMember accessor = property.accessor();
        Class<?> raw = property.type().getRawClass();
        if (accessor == null || raw.isRecord() || Converters.isScalar(raw) || raw == Optional.class
                || property.type().isContainerType() || raw == Object.class) {
            return false;
        }
        Object current;
        try {
            current = accessor.getValue(target);
        } catch (IllegalArgumentException e) {
            log.debug("Cannot read current value of {}, replacing it", property.fieldName(), e);
            return false;
        }
        if (current == null || current.getClass().isRecord()) {
            return false;
        }
        ObjectNode tree = readBean(section, mapper.constructType(current.getClass()), current);
        try {
            mapper.readerForUpdating(current).readValue(tree);
        } catch (IOException e) {
            throw BindingException.custom("Failed to bind '" + pathOf(section) + "': " + e.getMessage(), e);
        }
        return true;
    }

    private ArrayNode readSequence(Configuration node, JavaType elementType) {
        ArrayNode array = nodes.arrayNode();
        // 子节点已按数值升序排列，非数字键被忽略
        for (ConfigurationSection child : node.getChildren()) {
            if (ConfigurationKeyComparator.isIndex(child.getKey())) {
                JsonNode element = read(child, elementType);
                array.add(element == null ? NullNode.getInstance() : element);
            }
        }
        return array;
    }

    private ObjectNode readMap(Configuration node, JavaType valueType) {
        ObjectNode object = nodes.objectNode();
        for (ConfigurationSection child : node.getChildren()) {
            JsonNode value = read(child, valueType);
            object.set(child.getKey(), value == null ? NullNode.getInstance() : value);
        }
        return object;
    }

    private JsonNode readUntyped(Configuration node) {
        List<ConfigurationSection> children = node.getChildren();
        if (children.isEmpty()) {
            String value = valueOf(node);
            return value == null ? NullNode.getInstance() : TextNode.valueOf(value);
        }
        ObjectNode object = nodes.objectNode();
        for (ConfigurationSection child : children) {
            object.set(child.getKey(), readUntyped(child));
        }
        return object;
    }

    private JsonNode scalar(String key, String value, Class<?> type) {
        Object parsed;
        try {
            parsed = Converters.cast(value, type);
        } catch (IllegalArgumentException e) {
            throw BindingException.invalidValue(key, value, type, e);
        }
        return mapper.valueToTree(parsed);
    }

    private JsonNode defaultNode(Configuration node, PropertyBinding property) {
        String defaultValue = property.defaultValue();
        JavaType type = property.type();
        Class<?> raw = type.getRawClass();
        if (raw == Optional.class) {
            raw = type.containedTypeOrUnknown(0).getRawClass();
        }
        if (defaultValue.isEmpty()) {
            if (type.isArrayType() || type.isCollectionLikeType()) {
                return nodes.arrayNode();
            }
            if (type.isMapLikeType()) {
                return nodes.objectNode();
            }
            return property.isOptional() ? NullNode.getInstance() : null;
        }
        String key = pathOf(node);
        key = key.isEmpty() ? property.keys().get(0) : ConfigurationPath.combine(key, property.keys().get(0));
        return Converters.isScalar(raw) ? scalar(key, defaultValue, raw) : TextNode.valueOf(defaultValue);
    }

    private static Configuration find(Configuration node, PropertyBinding property) {
        for (String key : property.keys()) {
            ConfigurationSection section = node.getSection(key);
            if (section.exists()) {
                return section;
            }
        }
        return null;
    }

    static boolean exists(Configuration node) {
        return node.asSection().map(ConfigurationSection::exists).orElseGet(() -> !node.getChildren().isEmpty());
    }

    static String valueOf(Configuration node) {
        return node.asSection().map(ConfigurationSection::getValue).orElse(null);
    }

    static String pathOf(Configuration node) {
        return node.asSection().map(ConfigurationSection::getPath).orElse("");
    }

    /* ===================== metadata ===================== */

    private List<PropertyBinding> describe(JavaType type) {
        Class<?> raw = type.getRawClass();
        List<PropertyBinding> result = raw.isRecord() ? describeRecord(type) : describeBean(type);
        log.debug("Described {} binding properties for {}", result.size(), type);
        return Collections.unmodifiableList(result);
    }

    private List<PropertyBinding> describeRecord(JavaType type) {
        Class<?> raw = type.getRawClass();
        List<PropertyBinding> result = new ArrayList<>();
        for (RecordComponent component : raw.getRecordComponents()) {
            String name = component.getName();
            Field field;
            try {
                field = raw.getDeclaredField(name);
            } catch (NoSuchFieldException e) {
                throw new IllegalStateException("Record component without field: " + raw.getName() + "." + name, e);
            }
            JsonProperty explicit = field.getAnnotation(JsonProperty.class);
            String propertyName = explicit != null && !explicit.value().isEmpty() ? explicit.value() : name;
            DefaultValue defaultValue = component.getAnnotation(DefaultValue.class);
            JavaType componentType = mapper.getTypeFactory().resolveMemberType(component.getGenericType(), type.getBindings());
            boolean optional = componentType.getRawClass() == Optional.class;
            result.add(new PropertyBinding(
                    name,
                    propertyName,
                    keys(propertyName, explicit != null && !explicit.value().isEmpty(), field.getAnnotation(JsonAlias.class)),
                    componentType,
                    !optional && defaultValue == null,
                    defaultValue == null ? null : defaultValue.value(),
                    null));
        }
        return result;
    }

    private List<PropertyBinding> describeBean(JavaType type) {
        BeanDescription description = mapper.getDeserializationConfig().introspect(type);
        List<PropertyBinding> result = new ArrayList<>();
        for (BeanPropertyDefinition property : description.findProperties()) {
            if (!property.couldDeserialize()) {
                continue;
            }
            JsonAlias alias = annotation(property, JsonAlias.class);
            DefaultValue defaultValue = annotation(property, DefaultValue.class);
            AnnotatedMember accessor = property.getGetter() != null ? property.getGetter() : property.getField();
            if (accessor != null) {
                accessor.fixAccess(true);
            }
            result.add(new PropertyBinding(
                    property.getInternalName(),
                    property.getName(),
                    keys(property.getName(), property.isExplicitlyNamed(), alias),
                    property.getPrimaryType(),
                    property.isRequired(),
                    defaultValue == null ? null : defaultValue.value(),
                    accessor));
        }
        return result;
    }

    private static <A extends Annotation> A annotation(BeanPropertyDefinition property, Class<A> type) {
        for (AnnotatedMember member : new AnnotatedMember[]{property.getField(), property.getSetter(), property.getConstructorParameter()}) {
            if (member != null) {
                A found = member.getAnnotation(type);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private static List<String> keys(String propertyName, boolean explicit, JsonAlias alias) {
        List<String> keys = new ArrayList<>();
        keys.add(explicit ? propertyName : ConfigurationKeys.toPascalCase(propertyName));
        if (alias != null) {
            Collections.addAll(keys, alias.value());
        }
        return keys;
    }
}
