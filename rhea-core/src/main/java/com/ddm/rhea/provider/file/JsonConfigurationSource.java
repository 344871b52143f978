package com.ddm.rhea.provider.file;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.Objects;

/**
 * JSON 文件配置源。
 *
 * @since 1.0
 */
public class JsonConfigurationSource implements ConfigurationSource {

    private final FileSource file;

    public JsonConfigurationSource(FileSource file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public FileSource getFile() {
        return file;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new JsonConfigurationProvider(file);
    }
}
