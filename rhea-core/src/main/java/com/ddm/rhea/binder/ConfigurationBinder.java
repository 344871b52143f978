package com.ddm.rhea.binder;

import com.ddm.rhea.Configuration;
import com.ddm.rhea.ConfigurationSection;
import com.ddm.rhea.exceptions.BindingException;
import com.ddm.rhea.utils.Converters;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * 把配置绑定到 Java 类型。
 *
 * <p>支持的目标类型：record（规范构造器）、可变 POJO、{@link Optional}、List/Set/数组、Map、枚举与标量。
 * 属性对应的配置键默认为首字母大写的属性名，可以用 {@code @JsonProperty} 重命名、用 {@code @JsonAlias} 增加别名，
 * 查找时忽略大小写。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * record Endpoint(String host, int port, Optional<Duration> timeout) {}
 * record ServiceOptions(String name, List<Endpoint> endpoints, Map<String, String> tags) {}
 *
 * ConfigurationBinder binder = ConfigurationBinder.getDefault();
 * ServiceOptions options = binder.reify(root.getSection("Service"), ServiceOptions.class);
 *
 * int retries = binder.getValueOrDefault(root, "Service:Retries", Integer.class, 3);
 * }</pre>
 *
 * <p>绑定过程中的错误统一以 {@link BindingException} 抛出：
 * 必需属性缺失为 {@link BindingException.Kind#MISSING_VALUE}，值无法解析等为 {@link BindingException.Kind#CUSTOM}。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ConfigurationBinder {

    private static final ConfigurationBinder DEFAULT = new ConfigurationBinder();

    private final ObjectMapper mapper;

    private final ConfigurationTreeReader reader;

    public ConfigurationBinder() {
        this(defaultMapper());
    }

    /**
     * @param mapper 用于最终构造对象的 Jackson mapper，可以注册自定义模块
     */
    public ConfigurationBinder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.reader = new ConfigurationTreeReader(mapper);
    }

    public static ConfigurationBinder getDefault() {
        return DEFAULT;
    }

    /**
     * 默认 mapper：字段可见、忽略未知属性、枚举忽略大小写、支持 Optional 与 java.time。
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new Jdk8Module())
                .addModule(new JavaTimeModule())
                .visibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .build();
    }

    /**
     * 构造新的对象。
     *
     * @throws BindingException 必需属性缺失或值无法转换
     */
    public <T> T reify(Configuration configuration, Class<T> type) {
        return reify(configuration, mapper.constructType(type));
    }

    /**
     * 构造新的泛型对象，例如 {@code new TypeRef<List<Endpoint>>() {}}。
     */
    public <T> T reify(Configuration configuration, TypeRef<T> type) {
        return reify(configuration, mapper.constructType(type.getType()));
    }

    private <T> T reify(Configuration configuration, JavaType type) {
        Objects.requireNonNull(configuration, "configuration");
        JsonNode tree = reader.read(configuration, type);
        if (tree == null) {
            tree = absent(configuration, type);
        }
        return convert(configuration, tree, type);
    }

    /**
     * 原地绑定：配置中存在的属性覆盖对象当前值，不存在的属性保持不变，已有的嵌套对象同样原地合并。
     * <p>
     * 出错时对象可能已被部分修改。
     *
     * @throws BindingException 值无法转换，或目标是不可变的 record
     */
    public <T> void bind(Configuration configuration, T instance) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(instance, "instance");
        Class<?> type = instance.getClass();
        if (type.isRecord()) {
            throw BindingException.custom("Cannot bind into immutable record " + type.getName() + ", use reify instead");
        }
        JsonNode tree = reader.readBean(configuration, mapper.constructType(type), instance);
        try {
            mapper.readerForUpdating(instance).readValue(tree);
        } catch (IOException e) {
            throw BindingException.custom("Failed to bind " + describe(configuration) + ": " + e.getMessage(), e);
        }
    }

    /**
     * 把指定键下的配置节原地绑定到对象；配置节不存在时不做任何事。
     */
    public <T> void bindAt(Configuration configuration, String key, T instance) {
        ConfigurationSection section = configuration.getSection(key);
        if (section.exists()) {
            bind(section, instance);
        }
    }

    /**
     * 读取单个值。
     *
     * @return 键不存在时为空
     * @throws BindingException 值无法转换为目标类型
     */
    public <T> Optional<T> getValue(Configuration configuration, String key, Class<T> type) {
        String raw = configuration.get(key);
        if (raw == null) {
            return Optional.empty();
        }
        if (Converters.isScalar(type)) {
            try {
                return Optional.ofNullable(Converters.cast(raw, type));
            } catch (IllegalArgumentException e) {
                throw BindingException.invalidValue(key, raw, type, e);
            }
        }
        try {
            return Optional.ofNullable(mapper.convertValue(TextNode.valueOf(raw), type));
        } catch (IllegalArgumentException e) {
            throw BindingException.invalidValue(key, raw, type, e);
        }
    }

    /**
     * 读取单个值，不存在时返回缺省值。
     */
    public <T> T getValueOrDefault(Configuration configuration, String key, Class<T> type, T defaultValue) {
        return getValue(configuration, key, type).orElse(defaultValue);
    }

    private <T> T convert(Configuration configuration, JsonNode tree, JavaType type) {
        try {
            return mapper.readerFor(type).readValue(tree);
        } catch (IOException e) {
            throw BindingException.custom("Failed to bind " + describe(configuration) + " to "
                    + type.getTypeName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 配置整体不存在时的树：Optional 为空，集合为空集合，对象按属性规则构造（必需属性会报缺失），标量报缺失。
     */
    private JsonNode absent(Configuration configuration, JavaType type) {
        Class<?> raw = type.getRawClass();
        if (raw == Optional.class) {
            return NullNode.getInstance();
        }
        if (type.isArrayType() || type.isCollectionLikeType()) {
            return mapper.createArrayNode();
        }
        if (type.isMapLikeType()) {
            return mapper.createObjectNode();
        }
        if (Converters.isScalar(raw) || raw == Object.class || raw.isInterface()) {
            throw BindingException.missingValue(ConfigurationTreeReader.pathOf(configuration));
        }
        return reader.readBean(configuration, type, null);
    }

    private static String describe(Configuration configuration) {
        String path = ConfigurationTreeReader.pathOf(configuration);
        return path.isEmpty() ? "configuration" : "'" + path + "'";
    }
}
