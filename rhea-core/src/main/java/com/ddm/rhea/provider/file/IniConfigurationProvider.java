package com.ddm.rhea.provider.file;

import com.ddm.rhea.ConfigurationPath;
import com.ddm.rhea.provider.ConfigurationEntry;
import com.ddm.rhea.utils.ConfigurationKeys;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * INI 文件配置提供者。
 *
 * <p>格式：
 * <pre>
 * ; 注释（也可以用 # 或 /）
 * TopLevel=value
 * [Data:Db]
 * ConnectionString = "jdbc:h2:mem:test"
 * </pre>
 * 节名作为键前缀；键和值两端的空白被去掉，值两端的双引号被去掉。
 * 没有 {@code =} 的行与重复键视为格式错误。
 *
 * @author liyifei
 * @since 1.0
 */
public class IniConfigurationProvider extends FileConfigurationProvider {

    public IniConfigurationProvider(FileSource file) {
        super(file);
    }

    @Override
    protected Map<String, ConfigurationEntry> parse(InputStream in) throws IOException {
        Map<String, ConfigurationEntry> data = new HashMap<>();
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String prefix = "";
        String raw;
        int lineNumber = 0;
        while ((raw = reader.readLine()) != null) {
            lineNumber++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#") || line.startsWith("/")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                prefix = line.substring(1, line.length() - 1).trim() + ConfigurationPath.KEY_DELIMITER;
                continue;
            }
            int separator = line.indexOf('=');
            if (separator < 0) {
                throw new IllegalArgumentException("Unrecognized line format at line " + lineNumber + ": '" + raw + "'");
            }
            String key = prefix + line.substring(0, separator).trim();
            String value = line.substring(separator + 1).trim();
            if (value.length() > 1 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            ConfigurationEntry previous = data.put(ConfigurationKeys.normalize(key), new ConfigurationEntry(key, value));
            if (previous != null) {
                throw new IllegalArgumentException("A duplicate key '" + key + "' was found at line " + lineNumber + ".");
            }
        }
        return data;
    }
}
