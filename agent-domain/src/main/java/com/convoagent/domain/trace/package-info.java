/**
 * 链路追踪上下文：按调用隔离的 trace、span 栈、采样与跨线程传播。
 */
package com.convoagent.domain.trace;
