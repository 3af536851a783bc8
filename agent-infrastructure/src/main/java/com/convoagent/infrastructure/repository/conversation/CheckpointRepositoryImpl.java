package com.convoagent.infrastructure.repository.conversation;

import com.convoagent.domain.conversation.adapter.repository.ICheckpointRepository;
import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;
import com.convoagent.infrastructure.dao.ConversationCheckpointDao;
import com.convoagent.infrastructure.dao.po.ConversationCheckpointPO;
import com.convoagent.infrastructure.util.JsonCodec;
import com.convoagent.types.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

/**
 * 会话检查点仓储实现。
 * <p>
 * 整个线程（消息列表、计划、版本）存一行，一轮结果通过一次 INSERT 或一次带版本条件的 UPDATE 原子写入。
 * </p>
 */
@Slf4j
@Repository
public class CheckpointRepositoryImpl implements ICheckpointRepository {

    private final ConversationCheckpointDao checkpointDao;
    private final JsonCodec jsonCodec;

    public CheckpointRepositoryImpl(ConversationCheckpointDao checkpointDao, JsonCodec jsonCodec) {
        this.checkpointDao = checkpointDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public ConversationThreadEntity load(String threadId) {
        ConversationCheckpointPO po;
        try {
            po = checkpointDao.selectByThreadId(threadId);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("检查点读取失败: " + threadId, ex);
        }
        if (po == null) {
            return ConversationThreadEntity.empty(threadId);
        }
        return toEntity(po);
    }

    @Override
    public ConversationThreadEntity save(ConversationThreadEntity thread) {
        thread.validate();
        long expectedVersion = thread.expectedVersion();
        ConversationCheckpointPO po = toPO(thread, expectedVersion + 1L);
        int affected;
        try {
            affected = thread.isNew()
                    ? checkpointDao.insertIfAbsent(po)
                    : checkpointDao.updateWithVersion(po, expectedVersion);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("检查点写入失败: " + thread.getThreadId(), ex);
        }
        if (affected == 0) {
            log.warn("CHECKPOINT_VERSION_CONFLICT threadId={}, expectedVersion={}", thread.getThreadId(), expectedVersion);
            throw new StoreUnavailableException("检查点版本冲突，线程已被并发更新: " + thread.getThreadId());
        }
        thread.incrementVersion();
        return thread;
    }

    private ConversationThreadEntity toEntity(ConversationCheckpointPO po) {
        ConversationThreadEntity entity = new ConversationThreadEntity();
        entity.setThreadId(po.getThreadId());
        entity.setUserId(po.getUserId());
        entity.setMessages(jsonCodec.readMessages(po.getMessages()));
        entity.setPlan(po.getPlan());
        entity.setVersion(po.getVersion() == null ? 0L : po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ConversationCheckpointPO toPO(ConversationThreadEntity entity, long nextVersion) {
        return ConversationCheckpointPO.builder()
                .threadId(entity.getThreadId())
                .userId(entity.getUserId())
                .messages(jsonCodec.writeValue(entity.history()))
                .plan(entity.getPlan())
                .version(nextVersion)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
