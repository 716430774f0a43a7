/**
 * TimedOutputReader.java
 *
 * 为子进程的输出流提供“带超时的读取”。
 * Java 的 InputStream 只支持阻塞读取，因此由一个后台任务持续阻塞读取并把文本片段放入队列，
 * 调用方则以有界的超时从队列中取数据：超时返回空串，流结束时抛出 EOFException。
 */
package club.ppmc.runner.util;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TimedOutputReader {

    private static final int BUFFER_SIZE = 4096;

    private final BlockingQueue<Chunk> chunks = new LinkedBlockingQueue<>();
    private volatile Chunk terminal;

    public TimedOutputReader(InputStream in, Executor executor) {
        executor.execute(() -> readLoop(in));
    }

    private void readLoop(InputStream in) {
        // 按字符读取，避免多字节 UTF-8 字符被切断在两个片段之间
        try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            char[] buffer = new char[BUFFER_SIZE];
            int charsRead;
            while ((charsRead = reader.read(buffer)) != -1) {
                if (charsRead > 0) {
                    chunks.add(Chunk.text(new String(buffer, 0, charsRead)));
                }
            }
            chunks.add(Chunk.end());
        } catch (IOException e) {
            chunks.add(Chunk.failure(e));
        }
    }

    /**
     * 在超时时间内读取下一段输出。
     *
     * @param timeout 最长等待时间。
     * @return 读到的文本；超时未读到数据时返回空串。
     * @throws EOFException 如果输出流已经结束。
     * @throws IOException 如果后台读取失败。
     */
    public String read(Duration timeout) throws IOException, InterruptedException {
        if (terminal != null) {
            throw terminalException();
        }
        Chunk chunk = chunks.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (chunk == null) {
            return "";
        }
        if (chunk.data() != null) {
            return chunk.data();
        }
        terminal = chunk;
        throw terminalException();
    }

    /**
     * 读取剩余的所有输出，直到流结束或在一个静默周期内没有新数据。
     * 读取失败时返回已读到的部分。
     */
    public String drain(Duration quietPeriod) throws InterruptedException {
        var leftover = new StringBuilder();
        try {
            String chunk;
            while (!(chunk = read(quietPeriod)).isEmpty()) {
                leftover.append(chunk);
            }
        } catch (EOFException e) {
            // 流已结束，剩余数据已全部读出
        } catch (IOException e) {
            log.debug("读取剩余输出时出错: {}", e.getMessage());
        }
        return leftover.toString();
    }

    private IOException terminalException() {
        if (terminal.failure() != null) {
            return new IOException(terminal.failure().getMessage(), terminal.failure());
        }
        return new EOFException("Process output stream ended");
    }

    private record Chunk(String data, IOException failure) {

        static Chunk text(String data) {
            return new Chunk(data, null);
        }

        static Chunk end() {
            return new Chunk(null, null);
        }

        static Chunk failure(IOException e) {
            return new Chunk(null, e);
        }
    }
}
