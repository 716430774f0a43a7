/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 负责从 application.properties 组装运行配置，并定义应用级别的共享Bean。
 */
package club.ppmc.runner.config;

import club.ppmc.runner.model.RunnerSettings;
import club.ppmc.runner.service.LanguageRegistry;
import com.google.gson.Gson;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 定义全局的运行配置。
     * 其他服务都应依赖此Bean，而不是直接使用 @Value 注解。
     */
    @Bean
    public RunnerSettings runnerSettings(
            @Value("${app.workspace-root:${java.io.tmpdir}}") String workspaceRoot,
            @Value("${app.shell:/bin/bash}") String shell,
            @Value("${app.pump.poll-interval-ms:100}") long pollIntervalMillis,
            @Value("${app.pty.columns:120}") int ptyColumns,
            @Value("${app.pty.rows:40}") int ptyRows,
            @Value("${app.artifacts.resize-enabled:true}") boolean resizeEnabled,
            @Value("${app.artifacts.max-dimension:800}") int maxImageDimension,
            @Value("${app.sql.engine:sqlite3}") String sqlEngine,
            @Value("${app.sql.prepopulate-script:}") String prepopulateScript,
            @Value("${app.sql.prepopulate-timeout-seconds:30}") long prepopulateTimeoutSeconds) {
        var settings = new RunnerSettings();
        settings.setWorkspaceRoot(workspaceRoot);
        settings.setShell(shell);
        settings.setPollIntervalMillis(pollIntervalMillis);
        settings.setPtyColumns(ptyColumns);
        settings.setPtyRows(ptyRows);
        settings.setResizeEnabled(resizeEnabled);
        settings.setMaxImageDimension(maxImageDimension);
        settings.setSqlEngine(sqlEngine);
        settings.setPrepopulateScript(prepopulateScript);
        settings.setPrepopulateTimeoutSeconds(prepopulateTimeoutSeconds);
        return settings;
    }

    /**
     * 静态的语言执行规格表。
     */
    @Bean
    public LanguageRegistry languageRegistry(RunnerSettings runnerSettings) {
        return LanguageRegistry.defaults(runnerSettings.getSqlEngine());
    }

    /**
     * 定义一个全局的 Gson Bean。
     * 在WebSocket通知服务中用于将会话事件对象转换为JSON字符串，确保与前端的兼容性。
     */
    @Bean
    public Gson gson() {
        return new Gson();
    }
}
