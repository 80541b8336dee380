package com.initialone.jconstify.llm;

import com.initialone.jconstify.model.RewriteOutcome;
import com.initialone.jconstify.model.RewriteRequest;

/**
 * 改写服务：源码进，改写后的源码（或已分类的失败）出。
 * 每次调用只做一次尝试，不抛异常，失败一律体现在 {@link RewriteOutcome} 里。
 */
public interface RewriteClient {
    RewriteOutcome rewrite(RewriteRequest request);
}
