/**
 * OutputPump.java
 *
 * 每个存活会话独占一个输出泵任务。
 * 它以有界超时反复读取子进程的合并输出并立即转发，直到会话进入关闭流程或进程结束；
 * 进程自然结束时再读取一次剩余输出、扫描图片产物并发出 process_ended，
 * 无论走哪条路径，最后都会调用 CleanupCoordinator。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.ExecutionSession;
import club.ppmc.runner.util.TimedOutputReader;
import java.io.EOFException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OutputPump implements Runnable {

    private final ExecutionSession session;
    private final SessionEventPublisher publisher;
    private final ArtifactScanner artifactScanner;
    private final CleanupCoordinator cleanupCoordinator;
    private final Executor readerExecutor;
    private final Duration pollInterval;

    public OutputPump(
            ExecutionSession session,
            SessionEventPublisher publisher,
            ArtifactScanner artifactScanner,
            CleanupCoordinator cleanupCoordinator,
            Executor readerExecutor,
            Duration pollInterval) {
        this.session = session;
        this.publisher = publisher;
        this.artifactScanner = artifactScanner;
        this.cleanupCoordinator = cleanupCoordinator;
        this.readerExecutor = readerExecutor;
        this.pollInterval = pollInterval;
    }

    @Override
    public void run() {
        String sessionId = session.getSessionId();
        try {
            pumpOutput();
            if (!session.isClosing()) {
                artifactScanner.scan(session);
                if (session.markEnded()) {
                    publisher.processEnded(sessionId);
                }
            }
        } catch (RuntimeException e) {
            log.error("会话 {} 的输出泵发生意外错误。", sessionId, e);
        } finally {
            cleanupCoordinator.cleanup(session);
        }
    }

    private void pumpOutput() {
        String sessionId = session.getSessionId();
        try {
            forwardUntilEnd();
        } catch (IOException e) {
            if (!session.isClosing()) {
                log.warn("读取会话 {} 的进程输出失败: {}", sessionId, e.getMessage());
                publisher.error(sessionId, new SessionException(
                        SessionErrorType.IO_FAILURE, "Failed to read process output: " + e.getMessage(), e));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("会话 {} 的输出泵被中断。", sessionId);
        }
    }

    private void forwardUntilEnd() throws IOException, InterruptedException {
        String sessionId = session.getSessionId();
        Process process = session.getProcess();
        if (process == null) {
            // 会话在输出泵启动之前就已被清理
            return;
        }

        var reader = new TimedOutputReader(process.getInputStream(), readerExecutor);
        try {
            while (!session.isClosing() && process.isAlive()) {
                String chunk = reader.read(pollInterval);
                if (!chunk.isEmpty()) {
                    publisher.output(sessionId, chunk);
                }
            }
        } catch (EOFException e) {
            log.debug("会话 {} 的输出流已结束。", sessionId);
        }

        // 由外部触发的拆除不需要剩余输出
        if (!session.isClosing()) {
            String leftover = reader.drain(pollInterval);
            if (!leftover.isEmpty()) {
                publisher.output(sessionId, leftover);
            }
        }
    }
}
