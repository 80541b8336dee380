package com.initialone.jconstify.pipeline;

/** 改写结果校验不通过时怎么办。 */
public enum ValidationPolicy {
    /** 不校验 */
    OFF,
    /** 记录警告，照常写盘 */
    WARN,
    /** 视为不可重试失败 */
    FAIL
}
