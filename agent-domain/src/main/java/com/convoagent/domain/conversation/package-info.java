/**
 * 会话线程上下文：线程消息历史与检查点持久化契约。
 */
package com.convoagent.domain.conversation;
