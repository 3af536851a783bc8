package com.convoagent.infrastructure.ai;

import com.convoagent.domain.evaluation.adapter.gateway.IJudgeGateway;
import com.convoagent.domain.evaluation.model.valobj.EvaluationMetric;
import com.convoagent.domain.evaluation.model.valobj.JudgeVerdict;
import com.convoagent.types.exception.JudgeFailureException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 评审模型网关：以指标细则为 system 提示，要求模型返回 {score, reasoning} 结构化结果。
 */
@Slf4j
@Component
public class SpringAiJudgeGateway implements IJudgeGateway {

    private static final String USER_TEMPLATE = "Input: %s\nGeneration: %s";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final String judgeModel;

    public SpringAiJudgeGateway(ObjectProvider<ChatModel> chatModelProvider,
                                @Value("${agent.evaluation.judge-model:gpt-4o-mini}") String judgeModel) {
        this.chatModelProvider = chatModelProvider;
        this.judgeModel = judgeModel;
    }

    @Override
    public JudgeVerdict judge(EvaluationMetric metric, String input, String output) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new JudgeFailureException("评审模型未配置");
        }
        JudgeScore result;
        try {
            result = ChatClient.builder(chatModel).build()
                    .prompt()
                    .system(metric.rubric())
                    .user(String.format(USER_TEMPLATE, input, output))
                    .options(OpenAiChatOptions.builder().model(judgeModel).temperature(0.0D).build())
                    .call()
                    .entity(JudgeScore.class);
        } catch (RuntimeException ex) {
            count(metric.name(), "failure");
            throw new JudgeFailureException("评审调用失败: " + ex.getMessage(), ex);
        }
        if (result == null) {
            count(metric.name(), "failure");
            throw new JudgeFailureException("评审模型未返回结构化结果");
        }
        count(metric.name(), "success");
        return new JudgeVerdict(result.score(), result.reasoning());
    }

    @Override
    public String judgeModel() {
        return judgeModel;
    }

    private void count(String metric, String outcome) {
        Counter.builder("agent.evaluation.score.total")
                .tag("metric", metric)
                .tag("outcome", outcome)
                .register(Metrics.globalRegistry)
                .increment();
    }

    /**
     * 评审结构化输出。score 取值 [0, 1]，reasoning 为一句话理由。
     */
    public record JudgeScore(Double score, String reasoning) {
    }
}
