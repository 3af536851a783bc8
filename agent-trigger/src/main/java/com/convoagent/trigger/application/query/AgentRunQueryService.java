package com.convoagent.trigger.application.query;

import com.convoagent.api.dto.AgentRunDTO;
import com.convoagent.api.dto.AgentRunPageDTO;
import com.convoagent.domain.run.adapter.repository.IAgentRunRepository;
import com.convoagent.domain.run.model.entity.AgentRunEntity;
import com.convoagent.domain.run.model.valobj.AgentRunPage;
import com.convoagent.domain.run.model.valobj.AgentRunQuery;
import com.convoagent.trigger.application.common.AdmissionGuard;
import com.convoagent.trigger.application.common.AdmissionRoutes;
import com.convoagent.trigger.application.common.AgentRunViewAssembler;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.enums.RunStatusEnum;
import com.convoagent.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * 运行记录读用例。列表只返回当前用户的记录；单条查询对非本人且非超级用户返回无权访问。
 */
@Slf4j
@Service
public class AgentRunQueryService {

    /** 读接口配额为默认配额的倍数 */
    private static final int HISTORY_LIMIT_MULTIPLIER = 2;

    private final IAgentRunRepository agentRunRepository;
    private final AgentRunViewAssembler agentRunViewAssembler;
    private final AdmissionGuard admissionGuard;

    public AgentRunQueryService(IAgentRunRepository agentRunRepository,
                                AgentRunViewAssembler agentRunViewAssembler,
                                AdmissionGuard admissionGuard) {
        this.agentRunRepository = agentRunRepository;
        this.agentRunViewAssembler = agentRunViewAssembler;
        this.admissionGuard = admissionGuard;
    }

    public AgentRunPageDTO listRuns(String userId, String threadId, String search, String status,
                                    Integer skip, Integer limit) {
        requireUser(userId);
        admissionGuard.admit(AdmissionRoutes.HISTORY, userId, HISTORY_LIMIT_MULTIPLIER);
        RunStatusEnum statusFilter = parseStatus(status);
        AgentRunQuery query = AgentRunQuery.of(userId, threadId, search, statusFilter, skip, limit);
        List<AgentRunEntity> runs = agentRunRepository.findPage(query);
        long total = agentRunRepository.count(query);
        return agentRunViewAssembler.toPageDTO(new AgentRunPage(runs, total, query.limit(), query.offset()));
    }

    public AgentRunDTO getRun(String userId, boolean superuser, String runId) {
        requireUser(userId);
        if (!isUuid(runId)) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Agent run not found");
        }
        AgentRunEntity run = agentRunRepository.findById(runId.trim());
        if (run == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Agent run not found");
        }
        if (!run.isOwnedBy(userId) && !superuser) {
            log.warn("AGENT_RUN_ACCESS_DENIED runId={}, ownerId={}, userId={}", run.getRunId(), run.getUserId(), userId);
            throw new AppException(ResponseCode.FORBIDDEN.getCode(), "Not enough permissions to access this run");
        }
        return agentRunViewAssembler.toRunDTO(run);
    }

    private RunStatusEnum parseStatus(String status) {
        try {
            return RunStatusEnum.fromCode(status);
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "status 取值非法: " + status);
        }
    }

    private void requireUser(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "userId 不能为空");
        }
    }

    private boolean isUuid(String value) {
        if (StringUtils.isBlank(value)) {
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
