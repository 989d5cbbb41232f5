package com.lakeindex.document;

/**
 * 文档生命周期状态。物理清除由压缩器完成，不单独建模。
 */
public enum DocumentStatus {
    LIVE,
    TOMBSTONED
}
