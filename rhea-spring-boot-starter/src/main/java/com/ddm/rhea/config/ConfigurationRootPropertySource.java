package com.ddm.rhea.config;

import com.ddm.rhea.Configuration;
import com.ddm.rhea.ConfigurationKeyComparator;
import com.ddm.rhea.ConfigurationPath;
import org.springframework.core.env.EnumerablePropertySource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把 {@link Configuration} 暴露为 Spring 属性源。
 * <p>
 * Spring 属性名与配置键的对应关系：{@code a.b[0].c ↔ a:b:0:c}。每次查找都实时读取配置，
 * 因此配置重新加载后 Environment 立即可见新值。
 *
 * @author liyifei
 * @since 1.0
 */
public class ConfigurationRootPropertySource extends EnumerablePropertySource<Configuration> {

    public static final String NAME = "rhea";

    public ConfigurationRootPropertySource(String name, Configuration source) {
        super(name, source);
    }

    @Override
    public Object getProperty(String name) {
        return getSource().get(toConfigurationKey(name));
    }

    @Override
    public String[] getPropertyNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, String> entry : getSource()) {
            if (getSource().get(entry.getKey()) != null) {
                names.add(toPropertyName(entry.getKey()));
            }
        }
        return names.toArray(new String[0]);
    }

    /**
     * {@code a.b[0].c → a:b:0:c}
     */
    static String toConfigurationKey(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '.' || c == '[') {
                sb.append(ConfigurationPath.KEY_DELIMITER_CHAR);
            } else if (c != ']') {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * {@code a:b:0:c → a.b[0].c}
     */
    static String toPropertyName(String key) {
        StringBuilder sb = new StringBuilder(key.length() + 4);
        for (String segment : key.split(ConfigurationPath.KEY_DELIMITER, -1)) {
            if (ConfigurationKeyComparator.isIndex(segment) && sb.length() > 0) {
                sb.append('[').append(segment).append(']');
            } else {
                if (sb.length() > 0) {
                    sb.append('.');
                }
                sb.append(segment);
            }
        }
        return sb.toString();
    }
}
