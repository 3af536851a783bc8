package com.convoagent.types.common;

/**
 * 全局常量定义类。
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** MDC 中的 trace id 键 */
    public final static String MDC_TRACE_ID = "traceId";

    /** MDC 中的 request id 键 */
    public final static String MDC_REQUEST_ID = "requestId";

    /** 上游认证中间件写入的用户标识请求属性 */
    public final static String REQUEST_ATTR_USER_ID = "auth.userId";

    /** 上游认证中间件写入的超级用户标记请求属性（Boolean） */
    public final static String REQUEST_ATTR_SUPERUSER = "auth.superuser";

    /** 未携带认证属性时的用户标识请求头 */
    public final static String HEADER_USER_ID = "X-User-Id";

}
