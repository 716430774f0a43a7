/**
 * ArtifactScanner.java
 *
 * 该服务负责在会话工作区中发现用户程序生成的图片文件（例如绘图结果），
 * 经过可选的缩放后以 Base64 编码发送给客户端。
 * 每个路径在一个会话中最多发送一次，即使扫描被触发多次。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.ExecutionSession;
import club.ppmc.runner.model.RunnerSettings;
import club.ppmc.runner.util.ImageDownscaler;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class ArtifactScanner {

    private static final String IMAGE_GLOB = "*.{png,jpg,jpeg}";

    private final SessionEventPublisher publisher;
    private final ImageDownscaler downscaler;

    public ArtifactScanner(SessionEventPublisher publisher, RunnerSettings settings) {
        this.publisher = publisher;
        this.downscaler = new ImageDownscaler(settings.getMaxImageDimension(), settings.isResizeEnabled());
    }

    /**
     * 扫描会话的主工作区，发送所有尚未发送过的图片。
     *
     * @param session 进程仍在运行或刚刚退出的会话。
     */
    public void scan(ExecutionSession session) {
        Path workspace = session.getWorkspace();
        if (workspace == null || !Files.isDirectory(workspace)) {
            return;
        }
        synchronized (session.artifactLock()) {
            for (Path candidate : listImages(workspace)) {
                if (!session.isArtifactSent(candidate)) {
                    handleArtifact(session, candidate);
                }
            }
        }
    }

    private List<Path> listImages(Path workspace) {
        var images = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(workspace, IMAGE_GLOB)) {
            stream.forEach(images::add);
        } catch (IOException e) {
            log.warn("扫描工作区 {} 中的图片时出错: {}", workspace, e.getMessage());
            return Collections.emptyList();
        }
        Collections.sort(images);
        return images;
    }

    /**
     * 处理单个图片文件。失败只影响这一个文件，不会中断扫描或会话。
     */
    void handleArtifact(ExecutionSession session, Path path) {
        String sessionId = session.getSessionId();
        if (!Files.exists(path)) {
            publisher.error(sessionId, new SessionException(
                    SessionErrorType.MISSING_ARTIFACT, "Plot file not found: " + path));
            return;
        }
        try {
            byte[] imageData = downscaler.prepare(path);
            String encoded = Base64.getEncoder().encodeToString(imageData);
            publisher.artifact(sessionId, path.getFileName().toString(), encoded);
            session.markArtifactSent(path);
            log.info("已向会话 {} 发送图片 {} ({} 字节)。", sessionId, path.getFileName(), imageData.length);
        } catch (IOException | RuntimeException e) {
            log.warn("处理会话 {} 的图片 {} 失败: {}", sessionId, path, e.getMessage());
            publisher.error(sessionId, new SessionException(
                    SessionErrorType.ARTIFACT_PROCESSING_FAILURE,
                    "Could not handle plot file " + path + ": " + e.getMessage(),
                    e));
        }
    }
}
