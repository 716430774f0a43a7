/**
 * SessionException.java
 *
 * 一个自定义的运行时异常，用于表示单个代码执行会话中发生的、可以报告给客户端的错误。
 * 它携带了结构化的错误分类，以便通知层将其转换为 session_error 事件的负载。
 * 这类错误只影响所属会话，不会影响其他会话或整个服务。
 */
package club.ppmc.runner.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class SessionException extends RuntimeException {

    /** 错误分类。 */
    private final SessionErrorType type;

    /**
     * 构造函数。
     * @param type 错误分类。
     * @param message 详细的错误信息，将展示给用户。
     */
    public SessionException(SessionErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public SessionException(SessionErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     *
     * @return 包含错误信息和错误分类的Map。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "error", getMessage() != null ? getMessage() : type.name(),
                "errorType", type.name());
    }
}
