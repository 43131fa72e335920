package org.arenaclient.match.resources;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.arenaclient.match.api.resources.IResource.UsageState;
import org.arenaclient.match.api.resources.PortUnavailableException;
import org.arenaclient.match.model.GamePorts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
class PortAllocatorTest {

    @Test
    @DisplayName("Leases distinct ports until the range is exhausted")
    void leasesDistinctPorts() {
        PortAllocator ports = allocator(47200, 47201);

        int first = ports.allocate();
        int second = ports.allocate();

        assertThat(first).isNotEqualTo(second);
        assertThat(ports.getLeasedPorts()).containsExactlyInAnyOrder(47200, 47201);
        assertThat(ports.getUsageState()).isEqualTo(UsageState.WAITING);
        assertThatThrownBy(ports::allocate)
            .isInstanceOf(PortUnavailableException.class)
            .hasMessageContaining("No free port");
    }

    @Test
    @DisplayName("Released ports can be leased again")
    void releaseMakesPortAvailable() {
        PortAllocator ports = allocator(47210, 47210);
        int port = ports.allocate();

        ports.release(port);
        ports.release(port);

        assertThat(ports.getLeasedPorts()).isEmpty();
        assertThat(ports.getUsageState()).isEqualTo(UsageState.ACTIVE);
        assertThat(ports.allocate()).isEqualTo(port);
    }

    @Test
    @DisplayName("Skips ports that are bound by another process")
    void skipsBoundPorts() throws IOException {
        PortAllocator ports = allocator(47220, 47221);
        try (ServerSocket occupied = new ServerSocket()) {
            occupied.bind(new InetSocketAddress("127.0.0.1", 47220));

            assertThat(ports.allocate()).isEqualTo(47221);
        }
    }

    @Test
    @DisplayName("The scan continues after the last lease")
    void roundRobin() {
        PortAllocator ports = allocator(47230, 47232);
        int first = ports.allocate();
        ports.release(first);

        assertThat(ports.allocate()).isEqualTo(47231);
    }

    @Test
    @DisplayName("A slow bind check does not block other callers of the pool")
    void bindCheckRunsOutsideTheLock() throws Exception {
        CountDownLatch probing = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        PortAllocator ports = new PortAllocator("test-ports", config(47250, 47251)) {
            @Override
            boolean isBindable(int port) {
                if (port == 47250) {
                    probing.countDown();
                    try {
                        proceed.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.isBindable(port);
            }
        };
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> first = executor.submit(ports::allocate);
            assertThat(probing.await(5, TimeUnit.SECONDS)).isTrue();

            assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
                assertThat(ports.getLeasedPorts()).containsExactly(47250);
                assertThat(ports.allocate()).isEqualTo(47251);
            });

            proceed.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(47250);
            assertThat(ports.getLeasedPorts()).containsExactlyInAnyOrder(47250, 47251);
        } finally {
            proceed.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A candidate that fails the bind check is not left leased")
    void failedBindCheckReleasesReservation() throws IOException {
        PortAllocator ports = allocator(47255, 47255);
        try (ServerSocket occupied = new ServerSocket()) {
            occupied.bind(new InetSocketAddress("127.0.0.1", 47255));

            assertThatThrownBy(ports::allocate).isInstanceOf(PortUnavailableException.class);
            assertThat(ports.getLeasedPorts()).isEmpty();
        }
    }

    @Test
    @DisplayName("Game port sets are leased whole or not at all")
    void gamePortsAllOrNothing() {
        PortAllocator ports = allocator(47260, 47265);

        GamePorts gamePorts = ports.allocateGamePorts();

        assertThat(gamePorts.asList()).doesNotHaveDuplicates().hasSize(GamePorts.COUNT);
        assertThat(ports.getLeasedPorts()).containsExactlyInAnyOrderElementsOf(gamePorts.asList());
        assertThatThrownBy(ports::allocateGamePorts).isInstanceOf(PortUnavailableException.class);
        assertThat(ports.getLeasedPorts()).hasSize(GamePorts.COUNT);

        ports.release(gamePorts);

        assertThat(ports.getLeasedPorts()).isEmpty();
    }

    @Test
    @DisplayName("Rejects an invalid range")
    void invalidRange() {
        assertThatThrownBy(() -> allocator(47240, 47239)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> allocator(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    private static PortAllocator allocator(int start, int end) {
        return new PortAllocator("test-ports", config(start, end));
    }

    private static Config config(int start, int end) {
        return ConfigFactory.parseString(
            "host = \"127.0.0.1\"\nrangeStart = " + start + "\nrangeEnd = " + end);
    }
}
