package com.ddm.rhea.provider.file;

import com.ddm.rhea.ConfigurationBuilder;
import com.ddm.rhea.ConfigurationProvider;
import com.ddm.rhea.ConfigurationSource;

import java.util.Objects;

/**
 * INI 文件配置源。
 *
 * @since 1.0
 */
public class IniConfigurationSource implements ConfigurationSource {

    private final FileSource file;

    public IniConfigurationSource(FileSource file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public FileSource getFile() {
        return file;
    }

    @Override
    public ConfigurationProvider build(ConfigurationBuilder builder) {
        return new IniConfigurationProvider(file);
    }
}
