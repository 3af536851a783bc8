package com.convoagent.domain.conversation.service;

import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 会话领域服务：输入校验、线程标识解析与失败兜底文案。
 */
@Service
public class ConversationDomainService {

    public static final int THREAD_ID_MAX_LENGTH = 128;
    private static final Pattern THREAD_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_.:\\-]+$");
    private static final int MESSAGE_MAX_LENGTH = 32_000;
    private static final String DEFAULT_FAILURE_MESSAGE =
            "Sorry, I was not able to complete this request. Please try again later.";
    private static final String DEFAULT_TIMEOUT_MESSAGE =
            "Sorry, this request took too long to complete. Please try again.";

    public String normalizeMessage(String message) {
        if (!hasText(message)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "message 不能为空");
        }
        String normalized = message.trim();
        if (normalized.length() > MESSAGE_MAX_LENGTH) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "message 长度不能超过 " + MESSAGE_MAX_LENGTH);
        }
        return normalized;
    }

    /**
     * 校验调用方给出的 threadId；未给出时生成新的线程标识。
     */
    public String resolveThreadId(String requestedThreadId) {
        if (requestedThreadId == null) {
            return generateThreadId();
        }
        String normalized = requestedThreadId.trim();
        if (normalized.isEmpty()) {
            return generateThreadId();
        }
        if (normalized.length() > THREAD_ID_MAX_LENGTH || !THREAD_ID_PATTERN.matcher(normalized).matches()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "thread_id 格式非法");
        }
        return normalized;
    }

    /**
     * 线程已记录属主时只有属主可以继续对话；尚无属主的线程由本轮调用方认领。
     */
    public boolean isThreadAccessible(ConversationThreadEntity thread, String userId) {
        return thread == null || thread.getUserId() == null || thread.getUserId().equals(userId);
    }

    public String generateThreadId() {
        return UUID.randomUUID().toString();
    }

    public String failureMessage(String bestEffort) {
        return hasText(bestEffort) ? bestEffort.trim() : DEFAULT_FAILURE_MESSAGE;
    }

    public String timeoutMessage() {
        return DEFAULT_TIMEOUT_MESSAGE;
    }

    public String resolveErrorMessage(Throwable throwable) {
        if (throwable == null) {
            return "unknown error";
        }
        if (throwable instanceof AppException appException && hasText(appException.getInfo())) {
            return appException.getInfo();
        }
        Throwable cursor = throwable;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        if (cursor instanceof AppException appException && hasText(appException.getInfo())) {
            return appException.getInfo();
        }
        String message = hasText(cursor.getMessage()) ? cursor.getMessage() : throwable.getMessage();
        return hasText(message) ? message : throwable.getClass().getSimpleName();
    }

    private boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
