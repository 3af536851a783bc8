package com.convoagent.types.exception;

import com.convoagent.types.enums.ResponseCode;

/**
 * 评测打分失败（超时、分数格式错误、越界），仅影响单个 (run, metric)。
 */
public class JudgeFailureException extends AppException {

    private static final long serialVersionUID = 1924853036281941710L;

    public JudgeFailureException(String message) {
        super(ResponseCode.JUDGE_FAILURE.getCode(), message);
    }

    public JudgeFailureException(String message, Throwable cause) {
        super(ResponseCode.JUDGE_FAILURE.getCode(), message, cause);
    }
}
