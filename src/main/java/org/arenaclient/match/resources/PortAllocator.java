package org.arenaclient.match.resources;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.arenaclient.match.api.resources.PortUnavailableException;
import org.arenaclient.match.model.GamePorts;

import com.typesafe.config.Config;

/**
 * Leases local ports to engine instances from a configured range.
 * <p>
 * A port is handed out only if it is not leased and can currently be bound on the configured
 * host. The scan continues from the last lease so that recently released ports are reused last,
 * which gives the operating system time to release lingering sockets.
 * <p>
 * <strong>Thread Safety:</strong> the lease set is guarded by one lock. A candidate is reserved
 * under the lock and checked for bindability outside it; a candidate that cannot be bound is
 * returned to the pool.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * ports { host = "127.0.0.1", rangeStart = 9100, rangeEnd = 9199 }
 * </pre>
 */
public class PortAllocator extends AbstractResource {

    private final String host;
    private final int rangeStart;
    private final int rangeEnd;
    private final Set<Integer> leased = new TreeSet<>();
    private final Object lock = new Object();
    private int cursor;

    public PortAllocator(String name, Config options) {
        super(name, options);
        this.host = options.hasPath("host") ? options.getString("host") : "127.0.0.1";
        this.rangeStart = options.hasPath("rangeStart") ? options.getInt("rangeStart") : 9100;
        this.rangeEnd = options.hasPath("rangeEnd") ? options.getInt("rangeEnd") : 9199;
        if (rangeStart < 1 || rangeEnd > 65535 || rangeStart > rangeEnd) {
            throw new IllegalArgumentException(String.format(
                "Invalid port range %d-%d for '%s'", rangeStart, rangeEnd, name));
        }
        this.cursor = rangeStart;
    }

    /**
     * Leases a free port.
     *
     * @return the port.
     * @throws PortUnavailableException if every port in the range is leased or not bindable.
     */
    public int allocate() {
        int size = rangeEnd - rangeStart + 1;
        for (int attempt = 0; attempt < size; attempt++) {
            int port = reserveNext();
            if (port < 0) {
                break;
            }
            if (isBindable(port)) {
                log.debug("Leased port {} ({} leased)", port, getLeasedPorts().size());
                return port;
            }
            synchronized (lock) {
                leased.remove(port);
            }
        }
        throw new PortUnavailableException(String.format(
            "No free port in range %d-%d on %s", rangeStart, rangeEnd, host));
    }

    /**
     * Leases the ports the engine instances of one match connect over. Either all of them are
     * leased or none.
     *
     * @return the port set.
     * @throws PortUnavailableException if the range cannot supply a full set.
     */
    public GamePorts allocateGamePorts() {
        List<Integer> taken = new ArrayList<>(GamePorts.COUNT);
        try {
            for (int i = 0; i < GamePorts.COUNT; i++) {
                taken.add(allocate());
            }
        } catch (PortUnavailableException e) {
            taken.forEach(this::release);
            throw e;
        }
        return GamePorts.of(taken);
    }

    /**
     * Returns every port of a set to the pool.
     *
     * @param gamePorts The set.
     */
    public void release(GamePorts gamePorts) {
        gamePorts.asList().forEach(this::release);
    }

    /**
     * Returns a port to the pool. Releasing a port that is not leased is a no-op.
     *
     * @param port The port.
     */
    public void release(int port) {
        synchronized (lock) {
            if (leased.remove(port)) {
                log.debug("Released port {}", port);
            }
        }
    }

    public Set<Integer> getLeasedPorts() {
        synchronized (lock) {
            return Set.copyOf(leased);
        }
    }

    public String getHost() {
        return host;
    }

    @Override
    public UsageState getUsageState() {
        synchronized (lock) {
            return leased.size() >= rangeEnd - rangeStart + 1 ? UsageState.WAITING : UsageState.ACTIVE;
        }
    }

    private int reserveNext() {
        synchronized (lock) {
            int size = rangeEnd - rangeStart + 1;
            for (int i = 0; i < size; i++) {
                int port = rangeStart + Math.floorMod(cursor - rangeStart + i, size);
                if (!leased.contains(port)) {
                    leased.add(port);
                    cursor = port + 1;
                    return port;
                }
            }
            return -1;
        }
    }

    boolean isBindable(int port) {
        try (ServerSocket socket = new ServerSocket()) {
            socket.setReuseAddress(false);
            socket.bind(new InetSocketAddress(host, port));
            return true;
        } catch (IOException e) {
            log.debug("Port {} is not bindable: {}", port, e.getMessage());
            return false;
        }
    }
}
