package com.convoagent.domain.graph.adapter.gateway;

import com.convoagent.domain.graph.model.valobj.ChatGeneration;
import com.convoagent.domain.graph.model.valobj.ChatGenerationRequest;

/**
 * 文本生成能力网关。不执行工具，只返回模型请求的工具调用。
 */
public interface IChatModelGateway {

    ChatGeneration generate(ChatGenerationRequest request);

    String modelName();
}
