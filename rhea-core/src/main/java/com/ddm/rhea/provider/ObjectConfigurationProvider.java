package com.ddm.rhea.provider;

import com.ddm.rhea.exceptions.LoadException;
import com.ddm.rhea.utils.JsonFlattener;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 对象配置提供者：通过 Jackson 把对象转换为树后展开。
 * <p>
 * 属性名首字母大写，集合元素按下标展开，null 与空 {@link java.util.Optional} 视为不存在，
 * 因此展开结果可以由绑定器还原为同类型对象。
 *
 * @author liyifei
 * @since 1.0
 */
public class ObjectConfigurationProvider extends AbstractConfigurationProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private final Object value;

    public ObjectConfigurationProvider(Object value) {
        this.value = value;
    }

    @Override
    public void load() {
        JsonNode tree;
        try {
            tree = MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new LoadException("Failed to convert " + value.getClass().getName() + " to configuration", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new LoadException("Object configuration must serialize to an object, but "
                    + value.getClass().getName() + " does not");
        }
        setData(JsonFlattener.flatten(tree, true));
    }

    @Override
    public String getName() {
        return "Object(" + value.getClass().getSimpleName() + ")";
    }
}
