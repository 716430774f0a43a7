/**
 * CleanupCoordinator.java
 *
 * 负责以幂等的方式拆除一个执行会话：强制终止进程、删除工作区、释放句柄并从会话表中移除。
 * 它可能被输出泵的自然结束路径、用户的断开/终止请求以及新会话对旧会话的驱逐同时调用，
 * 通过会话的 closing 标志的原子翻转保证每个会话实例只被真正清理一次。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.model.ExecutionSession;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CleanupCoordinator {

    private final SessionTable sessionTable;

    public CleanupCoordinator(SessionTable sessionTable) {
        this.sessionTable = sessionTable;
    }

    /**
     * 清理该客户端当前登记的会话（如果有）。
     *
     * @return 本次调用是否执行了实际的清理。
     */
    public boolean cleanup(String sessionId) {
        ExecutionSession session = sessionTable.get(sessionId);
        return session != null && cleanup(session);
    }

    /**
     * 清理指定的会话实例。
     *
     * @return 本次调用是否执行了实际的清理；其他并发或后续调用返回 false 且没有副作用。
     */
    public boolean cleanup(ExecutionSession session) {
        if (!session.beginClosing()) {
            return false;
        }
        String sessionId = session.getSessionId();

        Process process = session.getProcess();
        if (process != null && process.isAlive()) {
            log.info("正在强制终止会话 {} 的进程。", sessionId);
            killProcessTree(process);
        }

        deleteWorkspace(session.getWorkspace());
        deleteWorkspace(session.getStoreWorkspace());

        session.clearResources();
        sessionTable.remove(sessionId, session);
        log.info("会话 {} 已清理完毕。", sessionId);
        return true;
    }

    private void killProcessTree(Process process) {
        try {
            process.toHandle().descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            log.debug("该进程不支持 ProcessHandle，仅终止主进程: {}", e.getMessage());
        }
        process.destroyForcibly();
    }

    private void deleteWorkspace(Path workspace) {
        if (workspace != null && Files.exists(workspace) && !FileUtils.deleteQuietly(workspace.toFile())) {
            log.warn("删除工作区 {} 失败，已忽略。", workspace);
        }
    }
}
