package com.convoagent.test.support;

import com.convoagent.domain.conversation.model.valobj.ToolCallRequest;
import com.convoagent.domain.graph.adapter.gateway.IChatModelGateway;
import com.convoagent.domain.graph.model.valobj.ChatGeneration;
import com.convoagent.domain.graph.model.valobj.ChatGenerationRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * 按脚本依次应答的模型网关，脚本用完后交给兜底应答。
 */
public class ScriptedChatModelGateway implements IChatModelGateway {

    private final Deque<Function<ChatGenerationRequest, ChatGeneration>> script = new ArrayDeque<>();
    private final List<ChatGenerationRequest> requests = new ArrayList<>();
    private Function<ChatGenerationRequest, ChatGeneration> fallback;

    public synchronized ScriptedChatModelGateway thenAnswer(Function<ChatGenerationRequest, ChatGeneration> answer) {
        script.addLast(answer);
        return this;
    }

    public ScriptedChatModelGateway thenText(String text) {
        return thenAnswer(request -> new ChatGeneration(text, List.of(), 10, 5));
    }

    public ScriptedChatModelGateway thenToolCall(String callId, String toolName, String arguments) {
        return thenAnswer(request -> new ChatGeneration("",
                List.of(new ToolCallRequest(callId, toolName, arguments)), 12, 3));
    }

    public ScriptedChatModelGateway thenThrow(RuntimeException error) {
        return thenAnswer(request -> {
            throw error;
        });
    }

    public synchronized ScriptedChatModelGateway otherwise(Function<ChatGenerationRequest, ChatGeneration> answer) {
        this.fallback = answer;
        return this;
    }

    @Override
    public ChatGeneration generate(ChatGenerationRequest request) {
        Function<ChatGenerationRequest, ChatGeneration> answer;
        synchronized (this) {
            requests.add(request);
            answer = script.pollFirst();
            if (answer == null) {
                answer = fallback;
            }
        }
        if (answer == null) {
            throw new IllegalStateException("no scripted answer for node " + request.node());
        }
        return answer.apply(request);
    }

    @Override
    public String modelName() {
        return "scripted-model";
    }

    public synchronized List<ChatGenerationRequest> requests() {
        return new ArrayList<>(requests);
    }
}
