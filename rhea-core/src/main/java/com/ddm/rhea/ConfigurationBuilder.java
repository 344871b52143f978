package com.ddm.rhea;

import com.ddm.rhea.provider.ChainedConfigurationSource;
import com.ddm.rhea.provider.CommandLineConfigurationSource;
import com.ddm.rhea.provider.EnvironmentVariablesConfigurationSource;
import com.ddm.rhea.provider.MemoryConfigurationSource;
import com.ddm.rhea.provider.ObjectConfigurationSource;
import com.ddm.rhea.provider.file.FileSource;
import com.ddm.rhea.provider.file.IniConfigurationSource;
import com.ddm.rhea.provider.file.JsonConfigurationSource;
import com.ddm.rhea.provider.file.XmlConfigurationSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 配置构建器：按顺序登记配置源，构建时后登记的配置源优先。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * ConfigurationRoot root = new DefaultConfigurationBuilder()
 *         .addJsonFile(FileSource.builder(Path.of("appsettings.json")).reloadOnChange().build())
 *         .addEnvironmentVariables("APP_")
 *         .addCommandLine(args)
 *         .build();
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigurationBuilder {

    /**
     * 追加配置源（不去重，不校验）。
     */
    ConfigurationBuilder add(ConfigurationSource source);

    /**
     * 已登记的配置源（不可修改）
     */
    List<ConfigurationSource> getSources();

    /**
     * 构建器共享属性，配置源在创建提供者时可以读取。
     */
    Map<String, Object> getProperties();

    /**
     * 创建并加载所有提供者。
     *
     * @throws com.ddm.rhea.exceptions.ReloadException 任一提供者加载失败时，汇总全部失败
     */
    ConfigurationRoot build();

    default ConfigurationBuilder addInMemory(Map<String, String> data) {
        return add(new MemoryConfigurationSource(data));
    }

    default ConfigurationBuilder addEnvironmentVariables() {
        return add(new EnvironmentVariablesConfigurationSource(""));
    }

    /**
     * 只加载以指定前缀开头（忽略大小写）的环境变量，前缀从键中去掉，{@code __} 转换为分隔符。
     */
    default ConfigurationBuilder addEnvironmentVariables(String prefix) {
        return add(new EnvironmentVariablesConfigurationSource(prefix));
    }

    default ConfigurationBuilder addCommandLine(String[] args) {
        return add(new CommandLineConfigurationSource(List.of(args), Map.of()));
    }

    /**
     * @param switchMappings 开关到配置键的映射，键必须以 {@code -} 或 {@code --} 开头
     */
    default ConfigurationBuilder addCommandLine(String[] args, Map<String, String> switchMappings) {
        return add(new CommandLineConfigurationSource(List.of(args), switchMappings));
    }

    default ConfigurationBuilder addJsonFile(Path path) {
        return addJsonFile(FileSource.of(path));
    }

    default ConfigurationBuilder addJsonFile(FileSource file) {
        return add(new JsonConfigurationSource(file));
    }

    default ConfigurationBuilder addIniFile(Path path) {
        return addIniFile(FileSource.of(path));
    }

    default ConfigurationBuilder addIniFile(FileSource file) {
        return add(new IniConfigurationSource(file));
    }

    default ConfigurationBuilder addXmlFile(Path path) {
        return addXmlFile(FileSource.of(path));
    }

    default ConfigurationBuilder addXmlFile(FileSource file) {
        return add(new XmlConfigurationSource(file));
    }

    /**
     * 将任意可被 Jackson 序列化的对象展开为配置键值。
     */
    default ConfigurationBuilder addObject(Object value) {
        return add(new ObjectConfigurationSource(value));
    }

    /**
     * 将已有配置（配置根或配置节）作为提供者接入。
     */
    default ConfigurationBuilder addConfiguration(Configuration configuration) {
        return add(new ChainedConfigurationSource(configuration));
    }
}
