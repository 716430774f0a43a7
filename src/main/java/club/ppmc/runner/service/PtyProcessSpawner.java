/**
 * PtyProcessSpawner.java
 *
 * 使用 pty4j 在伪终端 (pseudo-terminal) 中启动会话子进程。
 * 与普通管道不同，伪终端让用户程序认为自己运行在真实终端中，
 * 从而使行缓冲、输入提示和行编辑的行为与交互式运行一致。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.model.RunnerSettings;
import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class PtyProcessSpawner implements ProcessSpawner {

    private final RunnerSettings settings;

    public PtyProcessSpawner(RunnerSettings settings) {
        this.settings = settings;
    }

    @Override
    public Process spawn(List<String> command, Path workingDirectory, Map<String, String> environment)
            throws IOException {
        PtyProcess process = new PtyProcessBuilder(command.toArray(new String[0]))
                .setDirectory(workingDirectory.toString())
                .setEnvironment(environment)
                .setRedirectErrorStream(true)
                .setInitialColumns(settings.getPtyColumns())
                .setInitialRows(settings.getPtyRows())
                .setConsole(false)
                .start();
        log.debug("已在伪终端中启动进程: {}", String.join(" ", command));
        return process;
    }
}
