package com.convoagent.domain.graph.service;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 规划与执行节点的系统提示词。
 */
@Service
public class AgentPromptDomainService {

    private static final String PLANNER_TEMPLATE = "You are an AI planning assistant. "
            + "Analyze the user's request and create a concise execution plan.\n\n"
            + "Your plan should:\n"
            + "1. Identify the key tasks needed to fulfill the request\n"
            + "2. Determine which tools (if any) are needed\n"
            + "3. Outline the steps in a clear, logical order\n\n"
            + "Keep the plan brief and actionable. If the request is simple (like a greeting or question),\n"
            + "indicate that no complex execution is needed.\n\n"
            + "Available tools: %s\n";

    private static final String EXECUTOR_TEMPLATE = "You are a helpful AI assistant. "
            + "You have access to tools for directory lookups and HTTP requests.\n\n"
            + "Current execution plan: %s\n\n"
            + "Follow the plan to help the user. Be concise and helpful. %s\n"
            + "If the request is simple, just respond naturally without overthinking.\n";

    public String plannerPrompt(List<String> availableTools) {
        String tools = availableTools == null || availableTools.isEmpty() ? "none" : String.join(", ", availableTools);
        return String.format(PLANNER_TEMPLATE, tools);
    }

    public String executorPrompt(String plan, boolean toolsEnabled) {
        String toolHint = toolsEnabled
                ? "If you need to use tools, use them."
                : "Tools are not available for this step. Answer with the information you already have.";
        return String.format(EXECUTOR_TEMPLATE, plan == null ? "" : plan, toolHint);
    }
}
