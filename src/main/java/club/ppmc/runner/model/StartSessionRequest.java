/**
 * StartSessionRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装客户端发起的启动代码执行会话的请求。
 * 由 SessionController 的 /app/session/start 消息端点接收。
 */
package club.ppmc.runner.model;

/**
 * @param language 语言标识，缺省时按 "python" 处理。
 * @param code 用户源代码。
 */
public record StartSessionRequest(String language, String code) {}
