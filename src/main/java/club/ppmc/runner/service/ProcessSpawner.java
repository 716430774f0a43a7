package club.ppmc.runner.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 启动会话子进程的策略。生产环境下子进程挂接在伪终端上。
 */
public interface ProcessSpawner {

    /**
     * @param command 完整的命令行（通常为 {@code [shell, "-c", script]}）。
     * @param workingDirectory 子进程的工作目录。
     * @param environment 子进程的完整环境变量。
     * @return 已启动的进程，其输入流包含合并后的标准输出和标准错误。
     * @throws IOException 如果进程无法启动。
     */
    Process spawn(List<String> command, Path workingDirectory, Map<String, String> environment)
            throws IOException;
}
