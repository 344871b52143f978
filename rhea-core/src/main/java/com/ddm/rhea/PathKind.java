package com.ddm.rhea;

/**
 * 遍历配置时输出键的路径形式。
 *
 * @see Configuration#iterator(PathKind)
 * @since 1.0
 */
public enum PathKind {

    /**
     * 完整路径（从根开始）
     */
    ABSOLUTE,

    /**
     * 相对于被遍历节点的路径
     */
    RELATIVE
}
