/**
 * SessionEventPublisher.java
 *
 * 会话生命周期事件的发送出口。
 * 核心组件（ProcessLauncher、OutputPump、ArtifactScanner 等）只依赖这个接口，
 * 不关心事件最终经由哪种传输层送达客户端。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.SessionNotice;

public interface SessionEventPublisher {

    void sessionStarted(String sessionId);

    /**
     * 转发一段进程输出。同一会话的多次调用按产生顺序发出。
     */
    void output(String sessionId, String data);

    /**
     * 发送一个图片产物。
     *
     * @param filename 图片的文件名（不含目录）。
     * @param imageDataEncoded Base64 编码后的图片数据。
     */
    void artifact(String sessionId, String filename, String imageDataEncoded);

    void processEnded(String sessionId);

    void error(String sessionId, SessionException error);

    default void notice(String sessionId, SessionNotice notice) {
        output(sessionId, notice.getText());
    }
}
