package com.ddm.rhea;

import com.ddm.rhea.token.ChangeToken;
import com.ddm.rhea.token.NeverChangeToken;

import java.util.List;

/**
 * 配置提供者：从某个数据源加载扁平的键值快照。
 *
 * <p>实现类需要：
 * <ul>
 *   <li>通过 {@link #load()} （重新）填充快照，可重复调用；失败时抛出 {@link com.ddm.rhea.exceptions.LoadException}</li>
 *   <li>{@link #get(String)} 忽略大小写地精确查找</li>
 *   <li>{@link #collectChildKeys(List, String)} 只收集真正位于父路径之下的子键片段</li>
 * </ul>
 *
 * <p><strong>实现示例：</strong>
 * <pre>{@code
 * public class SystemPropertiesConfigurationProvider extends AbstractConfigurationProvider {
 *     @Override
 *     public void load() {
 *         Map<String, ConfigurationEntry> data = new HashMap<>();
 *         System.getProperties().forEach((k, v) -> put(data, k.toString().replace('.', ':'), v.toString()));
 *         setData(data);
 *     }
 * }
 * }</pre>
 *
 * <p>实现类应该保证线程安全：{@link #load()} 可能与读操作并发执行。
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigurationProvider extends AutoCloseable {

    /**
     * 获取配置值（忽略大小写）。
     *
     * @return 配置值；不存在时返回 null
     */
    String get(String key);

    /**
     * 加载（或重新加载）数据。
     *
     * @throws com.ddm.rhea.exceptions.LoadException 加载失败
     */
    void load();

    /**
     * 重新加载通知令牌，默认永不触发。
     */
    default ChangeToken getReloadToken() {
        return NeverChangeToken.INSTANCE;
    }

    /**
     * 将父路径下的直接子键片段追加到 {@code earlierKeys}。
     *
     * @param earlierKeys 先前提供者已收集的子键
     * @param parentPath  父路径；为 null 表示顶层
     */
    void collectChildKeys(List<String> earlierKeys, String parentPath);

    /**
     * 提供者名称，仅用于诊断和调试视图。
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * 释放资源（例如停止文件监听）。默认无操作。
     */
    @Override
    default void close() {
        // 默认无操作，由具体实现类重写
    }
}
