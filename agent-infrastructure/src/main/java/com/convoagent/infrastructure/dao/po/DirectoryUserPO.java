package com.convoagent.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 目录用户 PO（只读）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectoryUserPO {

    private String id;
    private String email;
    private String fullName;
    private Boolean isActive;
    private Boolean isSuperuser;
}
