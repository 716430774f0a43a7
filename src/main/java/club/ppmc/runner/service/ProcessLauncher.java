/**
 * ProcessLauncher.java
 *
 * 该服务负责启动一个新的代码执行会话。
 * 它校验语言与源码，先驱逐同一客户端的旧会话，再为本次运行创建独立的工作区、落盘源码、
 * 组装命令，并在伪终端中启动子进程。只有进程成功启动后才会在 SessionTable 中登记会话，
 * 随后为会话启动专属的 OutputPump 任务。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.ExecutionSession;
import club.ppmc.runner.model.LanguageSpec;
import club.ppmc.runner.model.RunnerSettings;
import club.ppmc.runner.util.EntryPointLocator;
import club.ppmc.runner.util.ShellQuoting;
import club.ppmc.runner.util.SystemCommandExecutor;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ProcessLauncher {

    static final String QUERY_DATABASE = "ephemeral.db";
    static final String PREPOPULATE_COPY = "prepopulate.sql";

    private final RunnerSettings settings;
    private final LanguageRegistry languageRegistry;
    private final SessionTable sessionTable;
    private final CleanupCoordinator cleanupCoordinator;
    private final ArtifactScanner artifactScanner;
    private final SessionEventPublisher publisher;
    private final ProcessSpawner processSpawner;
    private final EntryPointLocator entryPointLocator;
    private final SystemCommandExecutor commandExecutor;
    private final ExecutorService pumpExecutor = Executors.newCachedThreadPool();

    public ProcessLauncher(
            RunnerSettings settings,
            LanguageRegistry languageRegistry,
            SessionTable sessionTable,
            CleanupCoordinator cleanupCoordinator,
            ArtifactScanner artifactScanner,
            SessionEventPublisher publisher,
            ProcessSpawner processSpawner,
            EntryPointLocator entryPointLocator,
            SystemCommandExecutor commandExecutor) {
        this.settings = settings;
        this.languageRegistry = languageRegistry;
        this.sessionTable = sessionTable;
        this.cleanupCoordinator = cleanupCoordinator;
        this.artifactScanner = artifactScanner;
        this.publisher = publisher;
        this.processSpawner = processSpawner;
        this.entryPointLocator = entryPointLocator;
        this.commandExecutor = commandExecutor;
    }

    /**
     * 为客户端启动一个新的执行会话，成功后发出 session_started 并开始转发输出。
     *
     * @param sessionId 客户端会话ID。
     * @param requestedLanguage 语言标识，null 时按默认语言处理。
     * @param code 用户源代码。
     * @return 已登记的会话。
     * @throws SessionException 语言不受支持、源码为空或进程启动失败时抛出；此时不会登记任何会话。
     */
    public ExecutionSession launch(String sessionId, String requestedLanguage, String code) {
        if (code == null || code.trim().isEmpty()) {
            throw new SessionException(SessionErrorType.EMPTY_CODE, "No code provided");
        }
        String language = normalizeLanguage(requestedLanguage);
        LanguageSpec spec = languageRegistry.find(language)
                .orElseThrow(() -> new SessionException(
                        SessionErrorType.UNSUPPORTED_LANGUAGE, "Unsupported language '" + language + "'"));

        if (cleanupCoordinator.cleanup(sessionId)) {
            log.info("客户端 {} 的旧会话已在启动新会话前被清理。", sessionId);
        }

        ExecutionSession session = spawnSession(sessionId, spec, code);

        ExecutionSession replaced = sessionTable.register(session);
        if (replaced != null && replaced != session) {
            log.warn("客户端 {} 有并发启动的会话被替换，正在清理旧会话。", sessionId);
            cleanupCoordinator.cleanup(replaced);
        }

        publisher.sessionStarted(sessionId);
        Future<?> pump = pumpExecutor.submit(new OutputPump(
                session,
                publisher,
                artifactScanner,
                cleanupCoordinator,
                pumpExecutor,
                Duration.ofMillis(settings.getPollIntervalMillis())));
        session.attachPump(pump);
        return session;
    }

    private ExecutionSession spawnSession(String sessionId, LanguageSpec spec, String code) {
        Path workspace = null;
        Path storeWorkspace = null;
        try {
            workspace = createWorkspace(spec.queryLanguage() ? "sql_session_" : "user_session_");
            String runCommand;
            if (spec.queryLanguage()) {
                storeWorkspace = createWorkspace("sql_store_");
                runCommand = prepareQuery(spec, workspace, storeWorkspace, code);
            } else {
                runCommand = prepareProgram(spec, workspace, code);
            }

            Process process = processSpawner.spawn(shellCommand(workspace, runCommand), workspace, environment());
            log.info("已为客户端 {} 启动 {} 进程，工作区: {}", sessionId, spec.key(), workspace);
            return new ExecutionSession(sessionId, spec.key(), process, workspace, storeWorkspace);

        } catch (IOException | RuntimeException e) {
            log.error("为客户端 {} 启动 {} 进程失败: {}", sessionId, spec.key(), e.getMessage());
            FileUtils.deleteQuietly(workspace == null ? null : workspace.toFile());
            FileUtils.deleteQuietly(storeWorkspace == null ? null : storeWorkspace.toFile());
            throw new SessionException(SessionErrorType.SPAWN_FAILURE, "Failed to start process: " + e.getMessage(), e);
        }
    }

    private String prepareProgram(LanguageSpec spec, Path workspace, String code) throws IOException {
        String stem = spec.defaultStem();
        if (spec.entryPointDiscovery()) {
            stem = entryPointLocator.findPublicClassName(code).orElse(spec.defaultStem());
        }
        String fileName = spec.sourceFileName(stem);
        Files.writeString(workspace.resolve(fileName), code, StandardCharsets.UTF_8);
        return spec.render(fileName, stem, null);
    }

    private String prepareQuery(LanguageSpec spec, Path workspace, Path storeWorkspace, String code)
            throws IOException {
        prepopulate(storeWorkspace);
        String fileName = spec.sourceFileName(spec.defaultStem());
        Files.writeString(workspace.resolve(fileName), code, StandardCharsets.UTF_8);
        return spec.render(fileName, spec.defaultStem(), storeWorkspace.resolve(QUERY_DATABASE).toString());
    }

    /**
     * 将共享的预填充脚本复制到会话自己的存储目录，并在用户脚本运行前将其应用到数据库。
     * 预填充失败只记录日志，用户脚本仍会执行。
     */
    private void prepopulate(Path storeWorkspace) throws IOException {
        if (!StringUtils.hasText(settings.getPrepopulateScript())) {
            return;
        }
        Path template = Paths.get(settings.getPrepopulateScript()).toAbsolutePath().normalize();
        if (!Files.isRegularFile(template)) {
            log.debug("预填充脚本 {} 不存在，跳过预填充。", template);
            return;
        }

        Path script = storeWorkspace.resolve(PREPOPULATE_COPY);
        FileUtils.copyFile(template.toFile(), script.toFile());
        try {
            int exitCode = commandExecutor
                    .executeCommand(
                            List.of(settings.getSqlEngine(), QUERY_DATABASE),
                            storeWorkspace.toFile(),
                            script.toFile(),
                            Duration.ofSeconds(settings.getPrepopulateTimeoutSeconds()),
                            line -> log.debug("[prepopulate] {}", line))
                    .get(settings.getPrepopulateTimeoutSeconds() + 5, TimeUnit.SECONDS);
            if (exitCode != 0) {
                log.warn("预填充数据库失败，退出码: {}。将继续执行用户脚本。", exitCode);
            }
        } catch (ExecutionException | TimeoutException e) {
            log.warn("预填充数据库失败: {}。将继续执行用户脚本。", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while prepopulating the database", e);
        }
    }

    private Path createWorkspace(String prefix) throws IOException {
        Path root = Paths.get(settings.getWorkspaceRoot()).toAbsolutePath().normalize();
        Files.createDirectories(root);
        return Files.createTempDirectory(root, prefix);
    }

    List<String> shellCommand(Path workspace, String runCommand) {
        // TERM=dumb 让程序以非交互终端模式输出，GCC_COLORS 置空关闭编译器彩色诊断
        String script = "export TERM=dumb GCC_COLORS=; cd " + ShellQuoting.quote(workspace.toString())
                + " && " + runCommand;
        return List.of(settings.getShell(), "-c", script);
    }

    private Map<String, String> environment() {
        var env = new HashMap<>(System.getenv());
        env.put("TERM", "dumb");
        env.putIfAbsent("LANG", "C.UTF-8");
        return env;
    }

    static String normalizeLanguage(String language) {
        if (!StringUtils.hasText(language)) {
            return LanguageRegistry.DEFAULT_LANGUAGE;
        }
        return language.trim().toLowerCase(Locale.ROOT);
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 ProcessLauncher 的输出泵线程池...");
        pumpExecutor.shutdownNow();
    }
}
