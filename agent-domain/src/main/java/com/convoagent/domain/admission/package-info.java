/**
 * 准入控制上下文：按身份的固定窗口计数限流。
 */
package com.convoagent.domain.admission;
