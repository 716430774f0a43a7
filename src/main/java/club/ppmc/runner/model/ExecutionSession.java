/**
 * ExecutionSession.java
 *
 * 该文件定义了一个客户端连接所拥有的临时代码执行会话的内部状态。
 * 它聚合了子进程、进程输入写入器、工作区目录、已发送的图片产物集合以及输出泵的句柄。
 * 会话由 ProcessLauncher 创建，由 OutputPump 与请求处理线程并发访问，最终由 CleanupCoordinator 销毁。
 */
package club.ppmc.runner.model;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ExecutionSession {

    @Getter
    private final String sessionId;

    @Getter
    private final String language;

    /** 只允许从 false 翻转为 true 一次，赢得翻转者负责清理。 */
    private final AtomicBoolean closing = new AtomicBoolean(false);

    /** 保证 process_ended 事件对每个会话实例最多发出一次。 */
    private final AtomicBoolean endAnnounced = new AtomicBoolean(false);

    private final Set<Path> sentArtifacts = ConcurrentHashMap.newKeySet();
    private final Object inputLock = new Object();

    @Getter
    private volatile Process process;

    @Getter
    private volatile Path workspace;

    /** 查询语言的数据库存储目录，其他语言为 null。 */
    @Getter
    private volatile Path storeWorkspace;

    @Getter
    private volatile Future<?> pumpHandle;

    private volatile Writer inputWriter;

    public ExecutionSession(
            String sessionId, String language, Process process, Path workspace, Path storeWorkspace) {
        this.sessionId = sessionId;
        this.language = language;
        this.process = process;
        this.workspace = workspace;
        this.storeWorkspace = storeWorkspace;
        if (process != null) {
            this.inputWriter = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
        }
    }

    public boolean isClosing() {
        return closing.get();
    }

    /**
     * 尝试将会话标记为关闭。
     *
     * @return 只有第一次调用返回 true。
     */
    public boolean beginClosing() {
        return closing.compareAndSet(false, true);
    }

    /**
     * 尝试占用本会话唯一一次 process_ended 通知的机会。
     *
     * @return 只有第一次调用返回 true。
     */
    public boolean markEnded() {
        return endAnnounced.compareAndSet(false, true);
    }

    public boolean isProcessAlive() {
        Process current = process;
        return current != null && current.isAlive();
    }

    /**
     * 记录输出泵的句柄。如果会话在此期间已进入清理流程，句柄随即被丢弃，
     * 保证已清理的会话不会残留对输出泵的引用。
     */
    public void attachPump(Future<?> pump) {
        this.pumpHandle = pump;
        if (isClosing()) {
            this.pumpHandle = null;
        }
    }

    public boolean isArtifactSent(Path path) {
        return sentArtifacts.contains(path);
    }

    public void markArtifactSent(Path path) {
        sentArtifacts.add(path);
    }

    public int getSentArtifactCount() {
        return sentArtifacts.size();
    }

    /**
     * 扫描图片产物时使用的互斥锁，保证同一路径不会被两次并发扫描重复发送。
     */
    public Object artifactLock() {
        return sentArtifacts;
    }

    /**
     * 向进程标准输入写入一行文本（自动追加换行符）。
     *
     * @throws IOException 如果输入流已关闭或写入失败。
     */
    public void writeLine(String line) throws IOException {
        synchronized (inputLock) {
            Writer writer = inputWriter;
            if (writer == null) {
                throw new IOException("Process input is closed");
            }
            writer.write(line);
            writer.write('\n');
            writer.flush();
        }
    }

    /**
     * 释放会话持有的所有句柄。只应由 CleanupCoordinator 在赢得关闭翻转后调用。
     */
    public void clearResources() {
        synchronized (inputLock) {
            if (inputWriter != null) {
                try {
                    inputWriter.close();
                } catch (IOException e) {
                    log.debug("关闭会话 {} 的进程输入流时出错: {}", sessionId, e.getMessage());
                } finally {
                    inputWriter = null;
                }
            }
        }
        process = null;
        workspace = null;
        storeWorkspace = null;
        pumpHandle = null;
        sentArtifacts.clear();
    }
}
