package com.initialone.jconstify.model;

/** 改写结果落盘方式，整个运行期间只读。 */
public enum CommitPolicy {
    /** 写到同目录的 *.new，原文件不动 */
    DRY_RUN,
    /** 临时文件 + 原子替换 */
    OVERWRITE,
    /** 先备份为 *.bak，再原子替换 */
    OVERWRITE_WITH_BACKUP;

    public static CommitPolicy of(boolean dryRun, boolean backup) {
        if (dryRun) return DRY_RUN;
        return backup ? OVERWRITE_WITH_BACKUP : OVERWRITE;
    }
}
