/**
 * SessionStatusController.java
 *
 * 提供只读的HTTP接口，用于查询支持的语言以及执行会话的当前状态。
 */
package club.ppmc.runner.controller;

import club.ppmc.runner.model.SessionStatus;
import club.ppmc.runner.service.ExecutionSessionService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class SessionStatusController {

    private final ExecutionSessionService executionSessionService;

    public SessionStatusController(ExecutionSessionService executionSessionService) {
        this.executionSessionService = executionSessionService;
    }

    @GetMapping("/languages")
    public ResponseEntity<List<String>> getLanguages() {
        return ResponseEntity.ok(executionSessionService.supportedLanguages());
    }

    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Integer>> getActiveSessions() {
        return ResponseEntity.ok(Map.of("active", executionSessionService.activeSessionCount()));
    }

    /**
     * 查询某个客户端会话的状态。没有会话时返回 active=false，而不是404。
     */
    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionStatus> getSession(@PathVariable String sessionId) {
        return ResponseEntity.ok(executionSessionService.status(sessionId));
    }
}
