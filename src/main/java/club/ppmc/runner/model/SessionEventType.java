package club.ppmc.runner.model;

/**
 * 会话生命周期中对外发出的事件类型。
 */
public enum SessionEventType {
    SESSION_STARTED("session_started"),
    OUTPUT("output"),
    ARTIFACT("artifact"),
    PROCESS_ENDED("process_ended"),
    SESSION_ERROR("session_error");

    private final String eventName;

    SessionEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
