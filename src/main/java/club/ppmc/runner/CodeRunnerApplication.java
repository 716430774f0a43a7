/**
 * CodeRunnerApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动代码运行服务：每个 WebSocket 连接可以拥有一个临时的、交互式的代码执行会话。
 */
package club.ppmc.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CodeRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeRunnerApplication.class, args);
    }
}
