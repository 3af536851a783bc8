/**
 * 状态图上下文：PLANNING / EXECUTING / DONE 两节点图、转移函数与单轮执行引擎。
 */
package com.convoagent.domain.graph;
