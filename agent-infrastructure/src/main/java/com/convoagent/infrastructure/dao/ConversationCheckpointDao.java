package com.convoagent.infrastructure.dao;

import com.convoagent.infrastructure.dao.po.ConversationCheckpointPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 会话检查点 DAO。
 */
@Mapper
public interface ConversationCheckpointDao {

    ConversationCheckpointPO selectByThreadId(@Param("threadId") String threadId);

    /**
     * 首次写入，thread_id 已存在时不写，返回 0。
     */
    int insertIfAbsent(ConversationCheckpointPO po);

    /**
     * 按期望版本覆盖整行，版本不一致返回 0。
     */
    int updateWithVersion(@Param("po") ConversationCheckpointPO po,
                          @Param("expectedVersion") Long expectedVersion);
}
