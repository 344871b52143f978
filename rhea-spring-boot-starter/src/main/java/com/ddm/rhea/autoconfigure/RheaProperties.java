package com.ddm.rhea.autoconfigure;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Rhea 配置绑定类，对应属性前缀：{@code rhea.*}
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * rhea:
 *   files:
 *     - path: config/appsettings.json
 *       reload-on-change: true
 *     - path: config/appsettings.local.ini
 *       optional: true
 *   environment-prefix: APP_
 *   reload-delay: 250
 *   reload-timeout: 5
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
@ConfigurationProperties(prefix = "rhea")
public record RheaProperties(

        /**
         * 配置文件列表，按顺序登记，后面的文件优先。
         */
        List<FileEntry> files,

        /**
         * 环境变量前缀；为 null 时不加载环境变量，为空字符串时加载全部环境变量。
         * 环境变量在所有文件之后登记，优先级高于文件。
         */
        String environmentPrefix,

        /**
         * 文件变化后延迟多久重新加载。
         * 单位：毫秒（通过 {@code @DurationUnit(ChronoUnit.MILLIS)} 指定）。
         */
        @DurationUnit(ChronoUnit.MILLIS)
        Duration reloadDelay,

        /**
         * reload() 等待读操作结束的最长时间。
         * 单位：秒（通过 {@code @DurationUnit(ChronoUnit.SECONDS)} 指定）。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        Duration reloadTimeout,

        /**
         * 是否把配置根注册为 Spring Environment 的属性源，默认 true。
         */
        Boolean propertySource

) {

    /**
     * 单个配置文件。
     *
     * @param path           文件路径
     * @param format         文件格式：json、ini、xml；为空时按扩展名推断
     * @param optional       文件不存在时是否忽略
     * @param reloadOnChange 文件变化时是否重新加载
     */
    public record FileEntry(
            String path,
            String format,
            boolean optional,
            boolean reloadOnChange
    ) {
    }

    public List<FileEntry> filesOrEmpty() {
        return files == null ? List.of() : files;
    }
}
