package com.convoagent.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 统一承载业务异常的异常码与描述信息，HTTP 层由统一异常处理转换为 Response。
 * 需要额外语义（重试提示、存储不可用等）的场景使用本类的子类。
 * </p>
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return getClass().getName() + "{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
