package com.convoagent.test.support;

import com.convoagent.domain.conversation.adapter.repository.ICheckpointRepository;
import com.convoagent.domain.conversation.model.entity.ConversationThreadEntity;
import com.convoagent.types.exception.StoreUnavailableException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 内存检查点仓储，按 version 做比较并交换。
 */
public class InMemoryCheckpointRepository implements ICheckpointRepository {

    private final Map<String, ConversationThreadEntity> store = new LinkedHashMap<>();
    private final AtomicInteger saveCount = new AtomicInteger();
    private volatile boolean unavailable;

    @Override
    public synchronized ConversationThreadEntity load(String threadId) {
        if (unavailable) {
            throw new StoreUnavailableException("checkpoint store is down");
        }
        ConversationThreadEntity stored = store.get(threadId);
        return stored == null ? ConversationThreadEntity.empty(threadId) : copy(stored);
    }

    @Override
    public synchronized ConversationThreadEntity save(ConversationThreadEntity thread) {
        if (unavailable) {
            throw new StoreUnavailableException("checkpoint store is down");
        }
        thread.validate();
        ConversationThreadEntity stored = store.get(thread.getThreadId());
        long storedVersion = stored == null ? 0L : stored.expectedVersion();
        if (storedVersion != thread.expectedVersion()) {
            throw new StoreUnavailableException("检查点版本冲突: " + thread.getThreadId());
        }
        thread.incrementVersion();
        store.put(thread.getThreadId(), copy(thread));
        saveCount.incrementAndGet();
        return thread;
    }

    public synchronized ConversationThreadEntity snapshot(String threadId) {
        ConversationThreadEntity stored = store.get(threadId);
        return stored == null ? null : copy(stored);
    }

    public int saveCount() {
        return saveCount.get();
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    private ConversationThreadEntity copy(ConversationThreadEntity source) {
        ConversationThreadEntity target = new ConversationThreadEntity();
        target.setThreadId(source.getThreadId());
        target.setUserId(source.getUserId());
        target.setMessages(new ArrayList<>(source.history()));
        target.setPlan(source.getPlan());
        target.setVersion(source.getVersion());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
