package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 目录条目 PO（只读）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectoryItemPO {

    private String id;
    private String title;
    private String description;
    private String ownerId;
}
