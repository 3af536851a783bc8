package com.convoagent.domain.conversation.adapter.repository;

import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;

/**
 * 会话检查点仓储接口。
 */
public interface ICheckpointRepository {

    /**
     * 加载线程；不存在时返回 version=0 的空线程，不返回 null。
     *
     * @throws com.convoagent.types.exception.StoreUnavailableException 存储不可达
     */
    ConversationThreadEntity load(String threadId);

    /**
     * 以单次原子写入保存整轮结果。按 version 做比较并交换，版本不一致时整轮写入失败。
     *
     * @throws com.convoagent.types.exception.StoreUnavailableException 存储不可达或版本冲突
     */
    ConversationThreadEntity save(ConversationThreadEntity thread);
}
