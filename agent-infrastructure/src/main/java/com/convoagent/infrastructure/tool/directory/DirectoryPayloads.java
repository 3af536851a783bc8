package com.convoagent.infrastructure.tool.directory;

import com.convoagent.infrastructure.dao.po.DirectoryItemPO;
import com.convoagent.infrastructure.dao.po.DirectoryUserPO;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 目录工具返回给模型的字段布局（snake_case）。
 */
final class DirectoryPayloads {

    private DirectoryPayloads() {
    }

    static Map<String, Object> user(DirectoryUserPO po) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", po.getId());
        payload.put("email", po.getEmail());
        payload.put("full_name", po.getFullName());
        payload.put("is_active", po.getIsActive());
        payload.put("is_superuser", po.getIsSuperuser());
        return payload;
    }

    static Map<String, Object> item(DirectoryItemPO po) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", po.getId());
        payload.put("title", po.getTitle());
        payload.put("description", po.getDescription());
        payload.put("owner_id", po.getOwnerId());
        return payload;
    }

    static boolean isUuid(String value) {
        if (value == null) {
            return false;
        }
        try {
            UUID.fromString(value.trim());
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
