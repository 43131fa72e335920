package org.arenaclient.match.resources.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.arenaclient.match.api.engine.EngineLaunchException;
import org.arenaclient.match.api.engine.EngineLinkException;
import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.PlayerSlot;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.javalin.Javalin;

/**
 * Runs a placeholder process as the engine while a Javalin echo endpoint stands in for its
 * control port.
 */
@Tag("integration")
class ProcessEngineTest {

    @TempDir
    Path workDir;

    private final MatchConfig config = MatchConfig.builder().map("M").players("a", "b").build();
    private final HttpClient httpClient = HttpClient.newHttpClient();
    private Javalin endpoint;
    private ProcessEngine engine;

    @BeforeEach
    void setUp() {
        endpoint = Javalin.create(c -> c.showJavalinBanner = false)
            .ws("/sc2api", ws -> ws.onBinaryMessage(ctx ->
                ctx.send(ByteBuffer.wrap(Arrays.copyOfRange(ctx.data(), ctx.offset(), ctx.offset() + ctx.length())))))
            .start("127.0.0.1", 0);
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.terminate(Duration.ofSeconds(2));
        }
        endpoint.stop();
    }

    @Test
    @DisplayName("Connects both control links and relays frames per slot")
    void relaysFrames() {
        engine = engine(List.of("sleep", "30"), endpoint.port(), Duration.ofSeconds(10));

        engine.start();

        assertThat(engine.isAlive()).isTrue();
        engine.sendFrame(PlayerSlot.PLAYER_1, new byte[] {1, 1}).join();
        engine.sendFrame(PlayerSlot.PLAYER_2, new byte[] {2, 2}).join();
        assertThat(engine.recvFrame(PlayerSlot.PLAYER_2).orTimeout(5, TimeUnit.SECONDS).join()).containsExactly(2, 2);
        assertThat(engine.recvFrame(PlayerSlot.PLAYER_1).orTimeout(5, TimeUnit.SECONDS).join()).containsExactly(1, 1);
    }

    @Test
    @DisplayName("Terminate stops the process without reporting an unexpected exit")
    void terminateIsNotACrash() {
        AtomicInteger exits = new AtomicInteger();
        engine = engine(List.of("sleep", "30"), endpoint.port(), Duration.ofSeconds(10));
        engine.onExit(exits::incrementAndGet);
        engine.start();

        engine.terminate(Duration.ofSeconds(2));

        await().atMost(Duration.ofSeconds(5)).until(() -> !engine.isAlive());
        assertThat(exits).hasValue(0);
        assertThat(engine.recvFrame(PlayerSlot.PLAYER_1).handle((f, t) -> t).join()).isInstanceOf(EngineLinkException.class);
    }

    @Test
    @DisplayName("An unexpected exit fails the links and runs the exit callbacks")
    void unexpectedExit() {
        AtomicInteger exits = new AtomicInteger();
        engine = engine(List.of("sh", "-c", "sleep 1"), endpoint.port(), Duration.ofSeconds(10));
        engine.onExit(exits::incrementAndGet);
        engine.start();

        await().atMost(Duration.ofSeconds(10)).until(() -> exits.get() == 1);

        assertThat(engine.isAlive()).isFalse();
        assertThat(engine.recvFrame(PlayerSlot.PLAYER_2).handle((f, t) -> t).join()).isInstanceOf(EngineLinkException.class);
    }

    @Test
    @DisplayName("A process that exits during startup fails the launch")
    void exitDuringStartup() throws IOException {
        engine = engine(List.of("sh", "-c", "exit 3"), freePort(), Duration.ofSeconds(10));

        assertThatThrownBy(engine::start)
            .isInstanceOf(EngineLaunchException.class)
            .hasMessageContaining("exited during startup");
    }

    @Test
    @DisplayName("An endpoint that never opens fails the launch after the startup window")
    void unreachableEndpoint() throws IOException {
        engine = engine(List.of("sleep", "30"), freePort(), Duration.ofMillis(600));

        assertThatThrownBy(engine::start)
            .isInstanceOf(EngineLaunchException.class)
            .hasMessageContaining("not reachable");
        assertThat(engine.isAlive()).isTrue();
    }

    @Test
    @DisplayName("An engine cannot be started twice")
    void startTwice() {
        engine = engine(List.of("sleep", "30"), endpoint.port(), Duration.ofSeconds(10));
        engine.start();

        assertThatThrownBy(engine::start).isInstanceOf(IllegalStateException.class);
    }

    private ProcessEngine engine(List<String> command, int port, Duration startupTimeout) {
        EngineSettings settings = new EngineSettings(command, "/sc2api", startupTimeout, Duration.ofMillis(50), 1024 * 1024);
        return new ProcessEngine(new EngineProcessLauncher(command), settings, httpClient, config, "127.0.0.1", port, workDir);
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
