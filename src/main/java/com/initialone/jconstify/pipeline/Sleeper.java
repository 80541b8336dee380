package com.initialone.jconstify.pipeline;

/** 重试退避的休眠点；测试里替换成只记录时长的实现。 */
@FunctionalInterface
public interface Sleeper {
    void sleep(long millis) throws InterruptedException;

    Sleeper SYSTEM = Thread::sleep;
}
