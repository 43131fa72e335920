package org.arenaclient.node.processes.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.arenaclient.match.model.MatchConfig;
import org.arenaclient.match.model.PlayerSlot;
import org.arenaclient.match.protocol.EngineStatus;
import org.arenaclient.match.protocol.FrameCodec;
import org.arenaclient.match.protocol.MessageKind;
import org.arenaclient.match.protocol.ResponseFrame;
import org.arenaclient.match.services.InstanceCoordinator;
import org.arenaclient.match.services.InstanceCoordinator.BotRoute;
import org.arenaclient.match.session.MatchSession;
import org.arenaclient.match.testing.FakeConnection;
import org.arenaclient.match.testing.TestFrames;
import org.arenaclient.node.processes.gateway.ConnectionGateway.Handshake;
import org.arenaclient.node.processes.gateway.ConnectionGateway.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class ConnectionGatewayTest {

    private static final String VALID_CONFIG = "{\"Map\": \"M\", \"Player1\": \"a\", \"Player2\": \"b\"}";

    @Mock
    private InstanceCoordinator coordinator;

    @Mock
    private MatchSession session;

    private ConnectionGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new ConnectionGateway(coordinator);
    }

    @Test
    @DisplayName("Classifies peers by supervisor header and role")
    void classifiesPeers() {
        assertThat(ConnectionGateway.classify(new Handshake(true, null, null))).contains(Role.SUPERVISOR);
        assertThat(ConnectionGateway.classify(new Handshake(false, "Supervisor", null))).contains(Role.SUPERVISOR);
        assertThat(ConnectionGateway.classify(new Handshake(false, "bot", null))).contains(Role.BOT);
        assertThat(ConnectionGateway.classify(new Handshake(false, null, null))).contains(Role.BOT);
        assertThat(ConnectionGateway.classify(new Handshake(false, " ", null))).contains(Role.BOT);
        assertThat(ConnectionGateway.classify(new Handshake(false, "observer", null))).isEmpty();
    }

    @Test
    @DisplayName("Refuses an unknown role")
    void refusesUnknownRole() {
        FakeConnection peer = new FakeConnection("peer");

        gateway.onConnect(peer, new Handshake(false, "observer", null));

        assertThat(peer.closeCode()).isEqualTo(ConnectionGateway.CLOSE_POLICY_VIOLATION);
        assertThat(gateway.getConnectionCounts()).containsEntry(Role.SUPERVISOR, 0L).containsEntry(Role.BOT, 0L);
    }

    @Test
    @DisplayName("Greets a supervisor and answers Ping")
    void supervisorPing() {
        FakeConnection supervisor = supervisor();

        gateway.onText(supervisor, " Ping ");

        assertThat(supervisor.texts()).containsExactly("{\"Status\":\"Connected\"}", "Pong");
        assertThat(gateway.getConnectionCounts()).containsEntry(Role.SUPERVISOR, 1L);
    }

    @Test
    @DisplayName("Submits a valid match configuration")
    void submitsConfig() {
        FakeConnection supervisor = supervisor();

        gateway.onText(supervisor, VALID_CONFIG);

        verify(coordinator).submit(eq(supervisor), any(MatchConfig.class));
    }

    @Test
    @DisplayName("Rejects an invalid configuration without contacting the coordinator")
    void rejectsInvalidConfig() {
        FakeConnection supervisor = supervisor();

        gateway.onText(supervisor, "{\"Map\": \"M\"}");

        assertThat(supervisor.lastText()).contains("Rejected").contains("Player1");
        verify(coordinator, never()).submit(any(), any());
    }

    @Test
    @DisplayName("Refuses a second request while one is outstanding")
    void oneOutstandingRequest() {
        FakeConnection supervisor = supervisor();
        when(coordinator.hasOutstandingRequest(supervisor)).thenReturn(true);

        gateway.onText(supervisor, VALID_CONFIG);

        assertThat(supervisor.lastText()).contains("already outstanding");
        verify(coordinator, never()).submit(any(), any());
    }

    @Test
    @DisplayName("Quit, Reset and disconnect abort the supervisor's requests")
    void supervisorAborts() {
        FakeConnection supervisor = supervisor();

        gateway.onText(supervisor, "Quit");
        gateway.onText(supervisor, "Reset");
        gateway.onClose(supervisor, 1000, "bye");

        verify(coordinator).abortRequestsOf(supervisor, "Supervisor sent Quit");
        verify(coordinator).abortRequestsOf(supervisor, "Supervisor sent Reset");
        verify(coordinator).abortRequestsOf(supervisor, "Supervisor disconnected");
    }

    @Test
    @DisplayName("Unknown text and binary data from a supervisor are answered with an error")
    void supervisorErrors() {
        FakeConnection supervisor = supervisor();

        gateway.onText(supervisor, "Hello");
        gateway.onBinary(supervisor, new byte[] {1});

        assertThat(supervisor.texts()).hasSize(3);
        assertThat(supervisor.texts().get(1)).contains("Unknown message");
        assertThat(supervisor.texts().get(2)).contains("Binary messages");
    }

    @Test
    @DisplayName("Answers a bot's ping before it joins")
    void botPing() {
        FakeConnection bot = bot();

        gateway.onBinary(bot, TestFrames.request(MessageKind.PING, 4));

        ResponseFrame pong = FrameCodec.decodeResponse(bot.binaries().get(0));
        assertThat(pong.kind()).isEqualTo(MessageKind.PING);
        assertThat(pong.id()).isEqualTo(4);
        assertThat(pong.status()).isEqualTo(EngineStatus.LAUNCHED);
        assertThat(bot.isOpen()).isTrue();
    }

    @Test
    @DisplayName("A bot's quit before joining is answered and closes the connection")
    void botQuit() {
        FakeConnection bot = bot();

        gateway.onBinary(bot, TestFrames.request(MessageKind.QUIT, 2));

        assertThat(FrameCodec.decodeResponse(bot.binaries().get(0)).status()).isEqualTo(EngineStatus.QUIT);
        assertThat(bot.closeCode()).isEqualTo(ConnectionGateway.CLOSE_NORMAL);
    }

    @Test
    @DisplayName("A joined bot's frames and close go to its session")
    void routesJoinedBot() {
        FakeConnection bot = bot();
        when(coordinator.routeBot(eq(bot), any(), isNull()))
            .thenReturn(Optional.of(new BotRoute(session, PlayerSlot.PLAYER_2)));
        byte[] observation = TestFrames.observationRequest(1);

        gateway.onBinary(bot, TestFrames.joinRequest("b"));
        gateway.onBinary(bot, observation);
        gateway.onClose(bot, 1001, "gone");

        verify(session).deliver(PlayerSlot.PLAYER_2, observation);
        verify(session).botDisconnected(PlayerSlot.PLAYER_2);
    }

    @Test
    @DisplayName("A join with no awaiting session is refused")
    void joinWithoutSession() {
        FakeConnection bot = bot();
        when(coordinator.routeBot(eq(bot), any(), isNull())).thenReturn(Optional.empty());

        gateway.onBinary(bot, TestFrames.joinRequest("b"));

        assertThat(bot.closeCode()).isEqualTo(ConnectionGateway.CLOSE_TRY_AGAIN_LATER);
    }

    @Test
    @DisplayName("The handshake player hint is passed to routing")
    void playerHint() {
        FakeConnection bot = new FakeConnection("bot");
        gateway.onConnect(bot, new Handshake(false, "bot", "a"));
        when(coordinator.routeBot(eq(bot), any(), eq("a"))).thenReturn(Optional.empty());

        gateway.onBinary(bot, TestFrames.joinRequest("unnamed"));

        verify(coordinator).routeBot(eq(bot), any(), eq("a"));
    }

    @Test
    @DisplayName("Bots must not send text, malformed frames or other requests before joining")
    void botViolations() {
        FakeConnection texting = bot();
        FakeConnection malformed = bot();
        FakeConnection eager = bot();

        gateway.onText(texting, "hello");
        gateway.onBinary(malformed, TestFrames.truncated());
        gateway.onBinary(eager, TestFrames.observationRequest(1));

        assertThat(texting.closeCode()).isEqualTo(ConnectionGateway.CLOSE_UNSUPPORTED_DATA);
        assertThat(malformed.closeCode()).isEqualTo(ConnectionGateway.CLOSE_POLICY_VIOLATION);
        assertThat(eager.closeCode()).isEqualTo(ConnectionGateway.CLOSE_POLICY_VIOLATION);
    }

    private FakeConnection supervisor() {
        FakeConnection supervisor = new FakeConnection("supervisor");
        gateway.onConnect(supervisor, new Handshake(true, null, null));
        return supervisor;
    }

    private FakeConnection bot() {
        FakeConnection bot = new FakeConnection("bot");
        gateway.onConnect(bot, new Handshake(false, "bot", null));
        return bot;
    }
}
