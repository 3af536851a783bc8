package com.convoagent.trigger.http;

import com.convoagent.api.dto.AgentHealthDTO;
import com.convoagent.api.dto.AgentInvocationRequestDTO;
import com.convoagent.api.dto.AgentInvocationResponseDTO;
import com.convoagent.api.dto.AgentRunDTO;
import com.convoagent.api.dto.AgentRunPageDTO;
import com.convoagent.api.dto.EvaluationReportDTO;
import com.convoagent.api.response.Response;
import com.convoagent.domain.graph.service.AgentGraphEngine;
import com.convoagent.domain.tool.service.ToolRegistryFactory;
import com.convoagent.domain.trace.service.AgentTracer;
import com.convoagent.trigger.application.command.AgentInvocationCommandService;
import com.convoagent.trigger.application.command.EvaluationApplicationService;
import com.convoagent.trigger.application.query.AgentRunQueryService;
import com.convoagent.types.common.Constants;
import com.convoagent.types.enums.ResponseCode;
import com.convoagent.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Agent API：调用、运行记录查询、离线评测与健康检查。
 * <p>
 * 调用方身份优先取上游认证中间件写入的请求属性，其次取 X-User-Id 请求头。
 * </p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
public class AgentController {

    private final AgentInvocationCommandService agentInvocationCommandService;
    private final AgentRunQueryService agentRunQueryService;
    private final EvaluationApplicationService evaluationApplicationService;
    private final AgentGraphEngine agentGraphEngine;
    private final ToolRegistryFactory toolRegistryFactory;
    private final AgentTracer agentTracer;

    public AgentController(AgentInvocationCommandService agentInvocationCommandService,
                           AgentRunQueryService agentRunQueryService,
                           EvaluationApplicationService evaluationApplicationService,
                           AgentGraphEngine agentGraphEngine,
                           ToolRegistryFactory toolRegistryFactory,
                           AgentTracer agentTracer) {
        this.agentInvocationCommandService = agentInvocationCommandService;
        this.agentRunQueryService = agentRunQueryService;
        this.evaluationApplicationService = evaluationApplicationService;
        this.agentGraphEngine = agentGraphEngine;
        this.toolRegistryFactory = toolRegistryFactory;
        this.agentTracer = agentTracer;
    }

    @PostMapping("/run")
    public Response<AgentInvocationResponseDTO> run(@RequestBody AgentInvocationRequestDTO request,
                                                    HttpServletRequest httpRequest) {
        AgentInvocationResponseDTO data = agentInvocationCommandService.invoke(resolveUserId(httpRequest), request);
        return success(data);
    }

    @GetMapping("/runs")
    public Response<AgentRunPageDTO> listRuns(@RequestParam(value = "skip", required = false) Integer skip,
                                              @RequestParam(value = "limit", required = false) Integer limit,
                                              @RequestParam(value = "thread_id", required = false) String threadId,
                                              @RequestParam(value = "search", required = false) String search,
                                              @RequestParam(value = "status", required = false) String status,
                                              HttpServletRequest httpRequest) {
        AgentRunPageDTO data = agentRunQueryService.listRuns(resolveUserId(httpRequest), threadId, search, status, skip, limit);
        return success(data);
    }

    @GetMapping("/runs/{run_id}")
    public Response<AgentRunDTO> getRun(@PathVariable("run_id") String runId, HttpServletRequest httpRequest) {
        AgentRunDTO data = agentRunQueryService.getRun(resolveUserId(httpRequest), resolveSuperuser(httpRequest), runId);
        return success(data);
    }

    @PostMapping("/evaluations")
    public Response<EvaluationReportDTO> triggerEvaluation(HttpServletRequest httpRequest) {
        EvaluationReportDTO data = evaluationApplicationService.triggerByUser(
                resolveUserId(httpRequest), resolveSuperuser(httpRequest));
        return success(data);
    }

    @GetMapping("/health")
    public Response<AgentHealthDTO> health() {
        AgentHealthDTO data = new AgentHealthDTO();
        data.setStatus("healthy");
        data.setModelName(agentGraphEngine.modelName());
        data.setTracingEnabled(agentTracer.isTracingEnabled());
        data.setTraceSampleRate(agentTracer.sampleRate());
        data.setAvailableTools(toolRegistryFactory.statelessToolNames());
        return success(data);
    }

    private String resolveUserId(HttpServletRequest request) {
        Object attribute = request.getAttribute(Constants.REQUEST_ATTR_USER_ID);
        if (attribute != null && StringUtils.isNotBlank(String.valueOf(attribute))) {
            return String.valueOf(attribute).trim();
        }
        String header = request.getHeader(Constants.HEADER_USER_ID);
        if (StringUtils.isNotBlank(header)) {
            return header.trim();
        }
        throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "缺少调用方身份");
    }

    private boolean resolveSuperuser(HttpServletRequest request) {
        Object attribute = request.getAttribute(Constants.REQUEST_ATTR_SUPERUSER);
        if (attribute instanceof Boolean flag) {
            return flag;
        }
        return attribute != null && Boolean.parseBoolean(String.valueOf(attribute));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
