package com.golizard.termgraph.service;

/**
 * 节点注释状态
 */
public enum AnnotationKind {
    /** 无注释 */
    UNANNOTATED,
    /** 真实注释（携带外部标识符） */
    REAL,
    /** 边界哨兵：由边界标记阶段写入，裁剪时不可越过 */
    BOUNDARY,
    /** 过渡节点：不作为边界标记的起点，但裁剪时保留 */
    TRANSIT
}
