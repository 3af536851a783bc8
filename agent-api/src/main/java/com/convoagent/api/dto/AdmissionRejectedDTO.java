package com.convoagent.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 限流拒绝时返回的重试提示。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AdmissionRejectedDTO {

    private String status;
    private Long retryAfterSeconds;
}
