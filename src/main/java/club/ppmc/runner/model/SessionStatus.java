/**
 * SessionStatus.java
 *
 * 该文件定义了会话状态查询接口返回的只读快照。
 */
package club.ppmc.runner.model;

/**
 * @param sessionId 客户端会话ID。
 * @param active 会话表中是否存在该会话。
 * @param language 会话所用语言，不存在时为 null。
 * @param closing 会话是否已进入清理流程。
 * @param alive 子进程是否仍在运行。
 * @param artifactsSent 已发送的图片产物数量。
 */
public record SessionStatus(
        String sessionId,
        boolean active,
        String language,
        boolean closing,
        boolean alive,
        int artifactsSent) {

    public static SessionStatus inactive(String sessionId) {
        return new SessionStatus(sessionId, false, null, false, false, 0);
    }
}
