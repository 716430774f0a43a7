/**
 * RunnerSettings.java
 *
 * 该文件定义了一个POJO，用于表示代码运行服务的各项配置。
 * 这些设置在启动时由 AppConfig 从 application.properties 中读取并组装，之后只读使用。
 * 它是一个可变对象，以便于在测试中按需覆盖单个配置项。
 */
package club.ppmc.runner.model;

import lombok.Data;

@Data
public class RunnerSettings {

    // --- 工作区与进程 ---
    /**
     * 存放所有会话临时工作区的父目录。
     * 默认值为系统临时目录。
     */
    private String workspaceRoot = System.getProperty("java.io.tmpdir");

    /**
     * 用于执行组合命令的 shell，命令以 {@code <shell> -c <command>} 的形式启动。
     */
    private String shell = "/bin/bash";

    /**
     * 输出泵单次读取的最长等待时间（毫秒）。
     * 它同时决定了关闭信号最多多久会被察觉。
     */
    private long pollIntervalMillis = 100;

    private int ptyColumns = 120;
    private int ptyRows = 40;

    // --- 图片产物 ---
    private boolean resizeEnabled = true;

    /**
     * 发送给客户端的图片的最长边上限（像素）。
     */
    private int maxImageDimension = 800;

    // --- SQL 查询引擎 ---
    private String sqlEngine = "sqlite3";

    /**
     * 可选的预填充脚本路径。文件不存在时跳过预填充。
     */
    private String prepopulateScript;

    private long prepopulateTimeoutSeconds = 30;
}
