/**
 * ExecutionSessionService.java
 *
 * 该服务是代码执行会话对外的统一入口，负责处理来自客户端的启动、输入和断开请求。
 * 它为每个WebSocket连接维护最多一个存活的执行会话：启动交给 ProcessLauncher，
 * 拆除交给 CleanupCoordinator，所有结果都以会话事件的形式只发送给发起请求的客户端。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.ExecutionSession;
import club.ppmc.runner.model.SessionNotice;
import club.ppmc.runner.model.SessionStatus;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ExecutionSessionService {

    private final ProcessLauncher processLauncher;
    private final SessionTable sessionTable;
    private final CleanupCoordinator cleanupCoordinator;
    private final SessionEventPublisher publisher;
    private final LanguageRegistry languageRegistry;

    public ExecutionSessionService(
            ProcessLauncher processLauncher,
            SessionTable sessionTable,
            CleanupCoordinator cleanupCoordinator,
            SessionEventPublisher publisher,
            LanguageRegistry languageRegistry) {
        this.processLauncher = processLauncher;
        this.sessionTable = sessionTable;
        this.cleanupCoordinator = cleanupCoordinator;
        this.publisher = publisher;
        this.languageRegistry = languageRegistry;
    }

    /**
     * 启动一个新的执行会话。如果该客户端已有会话在运行，会先将其终止。
     *
     * @param sessionId 客户端会话ID。
     * @param language 语言标识。
     * @param code 用户源代码。
     */
    public void start(String sessionId, String language, String code) {
        try {
            processLauncher.launch(sessionId, language, code);
        } catch (SessionException e) {
            log.warn("客户端 {} 启动会话失败 [{}]: {}", sessionId, e.getType(), e.getMessage());
            publisher.error(sessionId, e);
        }
    }

    /**
     * 将一行输入写入会话进程的标准输入。成功时不发送任何确认事件。
     */
    public void sendInput(String sessionId, String line) {
        ExecutionSession session = sessionTable.get(sessionId);
        if (session == null) {
            publisher.notice(sessionId, SessionNotice.NO_ACTIVE_SESSION);
            publisher.processEnded(sessionId);
            return;
        }

        if (session.isClosing()) {
            rejectInput(session, SessionNotice.SESSION_CLOSED);
            return;
        }
        if (!session.isProcessAlive()) {
            rejectInput(session, SessionNotice.NO_ACTIVE_SESSION);
            return;
        }

        try {
            session.writeLine(line == null ? "" : line);
        } catch (IOException e) {
            log.warn("向客户端 {} 的进程写入输入失败: {}", sessionId, e.getMessage());
            publisher.error(sessionId, new SessionException(
                    SessionErrorType.IO_FAILURE, "Failed to write input: " + e.getMessage(), e));
        }
    }

    private void rejectInput(ExecutionSession session, SessionNotice notice) {
        String sessionId = session.getSessionId();
        log.warn("客户端 {} 向不可用的会话发送了输入: {}", sessionId, notice);
        publisher.notice(sessionId, notice);
        if (session.markEnded()) {
            publisher.processEnded(sessionId);
        }
        cleanupCoordinator.cleanup(session);
    }

    /**
     * 处理用户主动终止会话的请求。
     */
    public void disconnect(String sessionId) {
        ExecutionSession session = sessionTable.get(sessionId);
        if (session == null) {
            publisher.processEnded(sessionId);
            return;
        }

        boolean announce = session.markEnded();
        if (announce && !session.isClosing()) {
            publisher.notice(sessionId, SessionNotice.KILLED_BY_USER);
        }
        if (cleanupCoordinator.cleanup(session)) {
            log.info("客户端 {} 的会话已被用户终止。", sessionId);
        }
        if (announce) {
            publisher.processEnded(sessionId);
        }
    }

    /**
     * 客户端连接已经断开，静默地清理其会话。
     */
    public void release(String sessionId) {
        if (cleanupCoordinator.cleanup(sessionId)) {
            log.info("客户端 {} 断开连接，其会话已清理。", sessionId);
        }
    }

    public SessionStatus status(String sessionId) {
        ExecutionSession session = sessionTable.get(sessionId);
        if (session == null) {
            return SessionStatus.inactive(sessionId);
        }
        return new SessionStatus(
                sessionId,
                true,
                session.getLanguage(),
                session.isClosing(),
                session.isProcessAlive(),
                session.getSentArtifactCount());
    }

    public int activeSessionCount() {
        return sessionTable.size();
    }

    public List<String> supportedLanguages() {
        return languageRegistry.supportedLanguages();
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 ExecutionSessionService。将清理所有存活的执行会话。");
        sessionTable.snapshot().forEach(cleanupCoordinator::cleanup);
    }
}
