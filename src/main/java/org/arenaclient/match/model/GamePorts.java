package org.arenaclient.match.model;

import java.util.List;

/**
 * Ports the engine instances of one match use to reach each other, passed to every player in its
 * join request.
 *
 * @param shared     Shared port.
 * @param serverGame Game port of the hosting instance.
 * @param serverBase Base port of the hosting instance.
 * @param clientGame Game port of the joining instance.
 * @param clientBase Base port of the joining instance.
 */
public record GamePorts(int shared, int serverGame, int serverBase, int clientGame, int clientBase) {

    /**
     * Number of ports in a set.
     */
    public static final int COUNT = 5;

    /**
     * @param ports Exactly {@link #COUNT} ports, in component order.
     * @return the port set.
     */
    public static GamePorts of(List<Integer> ports) {
        if (ports.size() != COUNT) {
            throw new IllegalArgumentException("A game port set needs " + COUNT + " ports, got " + ports.size());
        }
        return new GamePorts(ports.get(0), ports.get(1), ports.get(2), ports.get(3), ports.get(4));
    }

    public List<Integer> asList() {
        return List.of(shared, serverGame, serverBase, clientGame, clientBase);
    }
}
