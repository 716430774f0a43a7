/**
 * SessionTable.java
 *
 * 客户端会话ID到执行会话的并发安全映射，是“某个客户端当前是否有存活会话”的唯一事实来源。
 */
package club.ppmc.runner.service;

import club.ppmc.runner.model.ExecutionSession;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

@Component
public class SessionTable {

    private final Map<String, ExecutionSession> sessions = new ConcurrentHashMap<>();

    @Nullable
    public ExecutionSession get(String sessionId) {
        return sessions.get(sessionId);
    }

    /**
     * 登记会话，原子地替换同一客户端已有的条目。
     *
     * @return 被替换掉的旧会话，没有则为 null。调用方负责清理它。
     */
    @Nullable
    public ExecutionSession register(ExecutionSession session) {
        return sessions.put(session.getSessionId(), session);
    }

    /**
     * 仅当表中登记的仍是这个会话实例时才移除，避免误删同一客户端的新会话。
     */
    public boolean remove(String sessionId, ExecutionSession session) {
        return sessions.remove(sessionId, session);
    }

    public int size() {
        return sessions.size();
    }

    public Collection<ExecutionSession> snapshot() {
        return List.copyOf(sessions.values());
    }
}
