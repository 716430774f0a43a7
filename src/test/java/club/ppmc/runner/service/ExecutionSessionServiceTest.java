package club.ppmc.runner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import club.ppmc.runner.exception.SessionErrorType;
import club.ppmc.runner.model.ExecutionSession;
import club.ppmc.runner.model.SessionStatus;
import club.ppmc.runner.support.RecordingEventPublisher;
import club.ppmc.runner.support.RunnerFixture;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExecutionSessionServiceTest {

    private static final String SID = "client-1";
    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path workspaceRoot;

    private RunnerFixture fixture;
    private RecordingEventPublisher events;
    private ExecutionSessionService service;

    @BeforeEach
    void setUp() {
        fixture = new RunnerFixture(workspaceRoot);
        events = fixture.publisher;
        service = fixture.service;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void shouldForwardOutputAndEndOnce() throws Exception {
        service.start(SID, "shell", "echo hi");

        assertTrue(events.awaitType("process_ended", WAIT));
        assertEquals("session_started", events.events().get(0).type());
        assertEquals("hi\n", events.joinedOutput());
        assertTrue(events.await(p -> fixture.sessionTable.size() == 0, WAIT));
        Thread.sleep(200);
        assertEquals(1, events.count("process_ended"));
        assertWorkspaceRootEmpty();
    }

    @Test
    void shouldRejectUnsupportedLanguage() {
        service.start(SID, "ruby", "puts 1");

        var errors = events.ofType("session_error");
        assertEquals(1, errors.size());
        assertEquals("Unsupported language 'ruby'", errors.get(0).data());
        assertEquals(SessionErrorType.UNSUPPORTED_LANGUAGE, errors.get(0).error().getType());
        assertEquals(0, events.count("session_started"));
        assertEquals(0, fixture.sessionTable.size());
    }

    @Test
    void shouldRejectBlankCode() {
        service.start(SID, "shell", "   \n");

        var errors = events.ofType("session_error");
        assertEquals(1, errors.size());
        assertEquals("No code provided", errors.get(0).data());
        assertEquals(SessionErrorType.EMPTY_CODE, errors.get(0).error().getType());
        assertEquals(0, fixture.sessionTable.size());
    }

    @Test
    void shouldNotifyWhenInputHasNoSession() {
        service.sendInput(SID, "hello");

        assertEquals("[No active session]\n", events.joinedOutput());
        assertEquals(1, events.count("process_ended"));
        assertEquals("process_ended", events.events().get(1).type());
    }

    @Test
    void shouldDeliverInputToRunningProgram() throws Exception {
        service.start(SID, "shell", "read x\necho \"got $x\"");
        assertTrue(events.awaitType("session_started", WAIT));

        service.sendInput(SID, "world");

        assertTrue(events.awaitType("process_ended", WAIT));
        assertThat(events.joinedOutput()).contains("got world");
        assertEquals(0, events.count("session_error"));
    }

    @Test
    void shouldPreserveOutputOrder() throws Exception {
        service.start(SID, "shell", "i=1\nwhile [ $i -le 200 ]; do echo line$i; i=$((i+1)); done");

        assertTrue(events.awaitType("process_ended", WAIT));
        String expected = IntStream.rangeClosed(1, 200)
                .mapToObj(i -> "line" + i + "\n")
                .collect(Collectors.joining());
        assertEquals(expected, events.joinedOutput());
    }

    @Test
    void shouldKillRunningProgramOnDisconnect() throws Exception {
        service.start(SID, "shell", "sleep 30");
        assertTrue(events.awaitType("session_started", WAIT));
        ExecutionSession session = fixture.sessionTable.get(SID);
        assertNotNull(session);
        Process process = session.getProcess();

        service.disconnect(SID);

        assertTrue(events.joinedOutput().contains("[Session killed by user]\n"));
        assertEquals(1, events.count("process_ended"));
        assertEquals(0, fixture.sessionTable.size());
        assertTrue(process.waitFor(5, TimeUnit.SECONDS));
        Thread.sleep(300);
        assertEquals(1, events.count("process_ended"));
        assertWorkspaceRootEmpty();
    }

    @Test
    void shouldAnswerDisconnectWithoutSession() {
        service.disconnect(SID);

        assertEquals(1, events.count("process_ended"));
        assertEquals(0, events.count("output"));
    }

    @Test
    void shouldReportNoSessionAfterDisconnect() {
        service.disconnect(SID);
        service.sendInput(SID, "late");

        assertEquals("[No active session]\n", events.joinedOutput());
    }

    @Test
    void shouldRejectInputToClosingSession() throws Exception {
        Path workspace = Files.createTempDirectory(workspaceRoot, "user_session_");
        var session = new ExecutionSession(SID, "shell", null, workspace, null);
        fixture.sessionTable.register(session);
        session.beginClosing();

        service.sendInput(SID, "late");
        service.sendInput(SID, "later");

        assertEquals("[Session closed]\n[Session closed]\n", events.joinedOutput());
        assertEquals(1, events.count("process_ended"));
        // 翻转 closing 的一方负责拆除，输入路径不会抢先清理
        assertTrue(Files.exists(workspace));
        assertFalse(fixture.cleanupCoordinator.cleanup(session));
    }

    @Test
    void shouldRejectInputToExitedProcess() throws Exception {
        Path workspace = Files.createTempDirectory(workspaceRoot, "user_session_");
        Process process = new ProcessBuilder("true").start();
        assertTrue(process.waitFor(5, TimeUnit.SECONDS));
        fixture.sessionTable.register(new ExecutionSession(SID, "shell", process, workspace, null));

        service.sendInput(SID, "late");

        assertEquals("[No active session]\n", events.joinedOutput());
        assertEquals(1, events.count("process_ended"));
        assertEquals("process_ended", events.events().get(1).type());
        assertEquals(0, fixture.sessionTable.size());
        assertFalse(Files.exists(workspace));
    }

    @Test
    void shouldReportEmptyCodeBeforeUnknownLanguage() {
        service.start(SID, "ruby", "");

        var errors = events.ofType("session_error");
        assertEquals(1, errors.size());
        assertEquals(SessionErrorType.EMPTY_CODE, errors.get(0).error().getType());
    }

    @Test
    void shouldEvictPreviousSessionOnRestart() throws Exception {
        service.start(SID, "shell", "sleep 30");
        assertTrue(events.awaitType("session_started", WAIT));
        ExecutionSession first = fixture.sessionTable.get(SID);
        Path firstWorkspace = first.getWorkspace();

        service.start(SID, "shell", "echo second");

        assertTrue(first.isClosing());
        assertFalse(Files.exists(firstWorkspace));
        assertTrue(events.awaitType("process_ended", WAIT));
        assertThat(events.joinedOutput()).isEqualTo("second\n");
        Thread.sleep(200);
        assertEquals(1, events.count("process_ended"));
        assertEquals(2, events.count("session_started"));
    }

    @Test
    void shouldReleaseSilentlyWhenClientGoesAway() throws Exception {
        service.start(SID, "shell", "sleep 30");
        assertTrue(events.awaitType("session_started", WAIT));
        int before = events.events().size();

        service.release(SID);

        assertEquals(0, fixture.sessionTable.size());
        Thread.sleep(200);
        assertEquals(before, events.events().size());
        assertWorkspaceRootEmpty();
    }

    @Test
    void shouldLeaveNothingBehindWhenSpawnFails() throws Exception {
        fixture.close();
        fixture = new RunnerFixture(
                workspaceRoot,
                (command, dir, env) -> {
                    throw new IOException("boom");
                },
                RunnerFixture.testLanguages());
        events = fixture.publisher;

        fixture.service.start(SID, "shell", "echo never");

        var errors = events.ofType("session_error");
        assertEquals(1, errors.size());
        assertEquals("Failed to start process: boom", errors.get(0).data());
        assertEquals(SessionErrorType.SPAWN_FAILURE, errors.get(0).error().getType());
        assertEquals(0, events.count("session_started"));
        assertEquals(0, fixture.sessionTable.size());
        assertWorkspaceRootEmpty();
    }

    @Test
    void shouldSendGeneratedImageOnce() throws Exception {
        Path image = Files.createTempFile("fixture", ".png");
        try {
            ImageIO.write(new BufferedImage(1000, 1200, BufferedImage.TYPE_INT_RGB), "png", image.toFile());

            service.start(SID, "shell", "cp '" + image + "' plot.png\necho done");

            assertTrue(events.awaitType("process_ended", WAIT));
            var artifacts = events.ofType("artifact");
            assertEquals(1, artifacts.size());
            String[] parts = artifacts.get(0).data().split(":", 2);
            assertEquals("plot.png", parts[0]);
            BufferedImage sent = ImageIO.read(new ByteArrayInputStream(Base64.getDecoder().decode(parts[1])));
            assertEquals(667, sent.getWidth());
            assertEquals(800, sent.getHeight());
            int artifactIndex = events.events().indexOf(artifacts.get(0));
            int endIndex = events.events().indexOf(events.ofType("process_ended").get(0));
            assertThat(artifactIndex).isLessThan(endIndex);
        } finally {
            Files.deleteIfExists(image);
        }
    }

    @Test
    void shouldReportStatus() throws Exception {
        assertEquals(SessionStatus.inactive(SID), service.status(SID));

        service.start(SID, "shell", "sleep 30");
        assertTrue(events.awaitType("session_started", WAIT));
        SessionStatus status = service.status(SID);

        assertTrue(status.active());
        assertTrue(status.alive());
        assertFalse(status.closing());
        assertEquals("shell", status.language());
        assertEquals(1, service.activeSessionCount());
    }

    private void assertWorkspaceRootEmpty() throws IOException {
        try (Stream<Path> entries = Files.list(workspaceRoot)) {
            assertEquals(0, entries.count());
        }
    }
}
