package com.convoagent.infrastructure.util;

import com.convoagent.domain.conversation.model.valobj.ConversationMessage;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 持久化字段的 JSON 编解码（JSONB 列与对象之间）。
 */
@Component
public class JsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final TypeReference<List<ConversationMessage>> MESSAGE_LIST_REF =
            new TypeReference<List<ConversationMessage>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> readMap(String json) {
        return readValue(json, MAP_REF);
    }

    /**
     * 读取线程消息列表；空列返回空列表。
     */
    public List<ConversationMessage> readMessages(String json) {
        List<ConversationMessage> messages = readValue(json, MESSAGE_LIST_REF);
        return messages == null ? new ArrayList<>() : messages;
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "JSON 解析失败", ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "JSON 序列化失败", ex);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
