/**
 * 工具上下文：统一的工具能力接口、按调用组装的注册表以及结构化结果。
 */
package com.convoagent.domain.tool;
