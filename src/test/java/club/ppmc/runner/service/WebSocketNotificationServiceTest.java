package club.ppmc.runner.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.exception.SessionException;
import club.ppmc.runner.model.SessionNotice;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.simp.SimpMessagingTemplate;

@ExtendWith(MockitoExtension.class)
class WebSocketNotificationServiceTest {

    @Mock
    private SimpMessagingTemplate messagingTemplate;

    private final Gson gson = new Gson();
    private WebSocketNotificationService service;

    @BeforeEach
    void setUp() {
        service = new WebSocketNotificationService(messagingTemplate, gson);
    }

    @Test
    void shouldSendOutputToSessionTopic() {
        service.output("abc", "hi\n");

        JsonObject event = captured("/topic/session/abc/output");
        assertEquals("output", event.get("type").getAsString());
        assertEquals("hi\n", event.getAsJsonObject("data").get("data").getAsString());
    }

    @Test
    void shouldSendArtifactFields() {
        service.artifact("abc", "plot.png", "iVBORw0K");

        JsonObject data = captured("/topic/session/abc/artifact").getAsJsonObject("data");
        assertEquals("plot.png", data.get("filename").getAsString());
        assertEquals("iVBORw0K", data.get("imageDataEncoded").getAsString());
    }

    @Test
    void shouldSendErrorWithType() {
        service.error("abc", new SessionException(SessionErrorType.UNSUPPORTED_LANGUAGE, "Unsupported language 'ruby'"));

        JsonObject data = captured("/topic/session/abc/session_error").getAsJsonObject("data");
        assertEquals("Unsupported language 'ruby'", data.get("error").getAsString());
        assertEquals("UNSUPPORTED_LANGUAGE", data.get("errorType").getAsString());
    }

    @Test
    void shouldSendNoticeAsOutput() {
        service.notice("abc", SessionNotice.SESSION_CLOSED);

        JsonObject event = captured("/topic/session/abc/output");
        assertEquals("[Session closed]\n", event.getAsJsonObject("data").get("data").getAsString());
    }

    @Test
    void shouldSendLifecycleEvents() {
        service.processEnded("abc");

        JsonObject event = captured("/topic/session/abc/process_ended");
        assertEquals("process_ended", event.get("type").getAsString());
        assertEquals(0, event.getAsJsonObject("data").size());
    }

    private JsonObject captured(String destination) {
        var payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(destination), payload.capture());
        return gson.fromJson((String) payload.getValue(), JsonObject.class);
    }
}
