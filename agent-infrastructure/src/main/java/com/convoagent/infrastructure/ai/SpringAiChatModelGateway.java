package com.convoagent.infrastructure.ai;

import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;
import com.convoagent.domain.graph.adapter.gateway.IChatModelGateway;
import com.convoagent.domain.graph.model.valobj.ChatGeneration;
import com.convoagent.domain.graph.model.valobj.ChatGenerationRequest;
import com.convoagent.domain.tool.model.valobj.ToolSpec;
import com.convoagent.types.exception.NodeFailureException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 基于 Spring AI ChatModel 的生成网关。
 * <p>
 * 关闭内部工具执行（internalToolExecutionEnabled=false），模型返回的工具调用原样交回执行引擎。
 * 连续的 TOOL 消息合并为一条 ToolResponseMessage，与上一条带工具调用的 AssistantMessage 对应。
 * </p>
 */
@Slf4j
@Component
public class SpringAiChatModelGateway implements IChatModelGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final String modelName;
    private final Double temperature;

    public SpringAiChatModelGateway(ObjectProvider<ChatModel> chatModelProvider,
                                    @Value("${agent.runtime.model-name:gpt-4o-mini}") String modelName,
                                    @Value("${agent.runtime.temperature:0.2}") Double temperature) {
        this.chatModelProvider = chatModelProvider;
        this.modelName = modelName;
        this.temperature = temperature;
    }

    @Override
    public ChatGeneration generate(ChatGenerationRequest request) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new NodeFailureException(request.node(), "ChatModel 未配置");
        }
        Prompt prompt = new Prompt(toMessages(request), buildOptions(request));
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException ex) {
            log.warn("LLM_CALL_FAILED node={}, model={}, errorType={}, error={}",
                    request.node(), modelName, ex.getClass().getSimpleName(), ex.getMessage());
            throw new NodeFailureException(request.node(), "模型调用失败: " + ex.getMessage(), ex);
        }
        return toGeneration(request.node(), response);
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private OpenAiChatOptions buildOptions(ChatGenerationRequest request) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(modelName)
                .temperature(temperature)
                .internalToolExecutionEnabled(false);
        if (request.toolsEnabled()) {
            List<ToolCallback> callbacks = new ArrayList<>(request.tools().size());
            for (ToolSpec spec : request.tools()) {
                callbacks.add(new ToolSpecCallback(spec));
            }
            builder.toolCallbacks(callbacks);
        }
        return builder.build();
    }

    List<Message> toMessages(ChatGenerationRequest request) {
        List<Message> messages = new ArrayList<>();
        if (StringUtils.isNotBlank(request.systemPrompt())) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        List<ToolResponseMessage.ToolResponse> pendingToolResponses = new ArrayList<>();
        List<ConversationMessage> history = request.messages() == null ? Collections.emptyList() : request.messages();
        for (ConversationMessage message : history) {
            if (message.getRole() == null) {
                continue;
            }
            switch (message.getRole()) {
                case TOOL -> pendingToolResponses.add(new ToolResponseMessage.ToolResponse(
                        message.getToolCallId(), message.getToolName(), StringUtils.defaultString(message.getContent())));
                case USER -> {
                    flushToolResponses(messages, pendingToolResponses);
                    messages.add(new UserMessage(StringUtils.defaultString(message.getContent())));
                }
                case AGENT -> {
                    flushToolResponses(messages, pendingToolResponses);
                    messages.add(toAssistantMessage(message));
                }
                default -> log.debug("忽略未知角色消息: {}", message.getRole());
            }
        }
        flushToolResponses(messages, pendingToolResponses);
        return messages;
    }

    private void flushToolResponses(List<Message> messages, List<ToolResponseMessage.ToolResponse> pending) {
        if (pending.isEmpty()) {
            return;
        }
        messages.add(new ToolResponseMessage(new ArrayList<>(pending)));
        pending.clear();
    }

    private AssistantMessage toAssistantMessage(ConversationMessage message) {
        String content = StringUtils.defaultString(message.getContent());
        if (!message.hasToolCalls()) {
            return new AssistantMessage(content);
        }
        List<AssistantMessage.ToolCall> toolCalls = new ArrayList<>(message.getToolCalls().size());
        for (ToolCallRequest call : message.getToolCalls()) {
            toolCalls.add(new AssistantMessage.ToolCall(call.id(), "function", call.name(),
                    StringUtils.defaultIfBlank(call.arguments(), "{}")));
        }
        return new AssistantMessage(content, Collections.emptyMap(), toolCalls);
    }

    private ChatGeneration toGeneration(String node, ChatResponse response) {
        Generation generation = response == null ? null : response.getResult();
        if (generation == null || generation.getOutput() == null) {
            throw new NodeFailureException(node, "模型未返回生成结果");
        }
        AssistantMessage output = generation.getOutput();
        List<ToolCallRequest> toolCalls = new ArrayList<>();
        if (output.hasToolCalls()) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                String callId = StringUtils.isBlank(call.id()) ? "call_" + UUID.randomUUID() : call.id();
                toolCalls.add(new ToolCallRequest(callId, call.name(), call.arguments()));
            }
        }
        Integer promptTokens = null;
        Integer completionTokens = null;
        Usage usage = response.getMetadata() == null ? null : response.getMetadata().getUsage();
        if (usage != null) {
            promptTokens = usage.getPromptTokens();
            completionTokens = usage.getCompletionTokens();
        }
        return new ChatGeneration(output.getText(), toolCalls, promptTokens, completionTokens);
    }
}
