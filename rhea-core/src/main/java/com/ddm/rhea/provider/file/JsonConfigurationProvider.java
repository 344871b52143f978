package com.ddm.rhea.provider.file;

import com.ddm.rhea.provider.ConfigurationEntry;
import com.ddm.rhea.utils.JsonFlattener;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * JSON 文件配置提供者。
 * <p>
 * 顶层元素必须是对象；属性名首字母大写，数组按下标展开，null 记为空字符串，空对象在其键上记为空字符串。
 * 允许注释和尾随逗号，同一对象内的重复属性视为格式错误。
 *
 * @author liyifei
 * @since 1.0
 */
public class JsonConfigurationProvider extends FileConfigurationProvider {

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .build();

    public JsonConfigurationProvider(FileSource file) {
        super(file);
    }

    @Override
    protected Map<String, ConfigurationEntry> parse(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || root.isMissingNode()) {
            throw new IllegalArgumentException("The file is empty.");
        }
        return JsonFlattener.flatten(root, false);
    }
}
