/**
 * 运行记录上下文：每次未被拒绝的调用恰好记录一次。
 */
package com.convoagent.domain.run;
