package com.convoagent.infrastructure.dao;

import com.convoagent.infrastructure.dao.po.DirectoryItemPO;
import com.convoagent.infrastructure.dao.po.DirectoryUserPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 用户/条目目录只读查询，供查询类工具使用。
 */
@Mapper
public interface DirectoryLookupDao {

    DirectoryUserPO selectUserByEmail(@Param("email") String email);

    DirectoryItemPO selectItemById(@Param("id") String id);

    List<DirectoryItemPO> selectItemsByOwnerId(@Param("ownerId") String ownerId,
                                              @Param("limit") int limit);
}
