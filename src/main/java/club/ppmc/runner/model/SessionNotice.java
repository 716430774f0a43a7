package club.ppmc.runner.model;

import lombok.Getter;

/**
 * 以输出事件形式展示给用户的固定提示文本。
 */
@Getter
public enum SessionNotice {
    NO_ACTIVE_SESSION("[No active session]\n"),
    SESSION_CLOSED("[Session closed]\n"),
    KILLED_BY_USER("[Session killed by user]\n");

    private final String text;

    SessionNotice(String text) {
        this.text = text;
    }
}
