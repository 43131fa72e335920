package org.arenaclient.cli.commands;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.arenaclient.cli.CommandLineInterface;
import org.arenaclient.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

/**
 * Starts a node with the configured processes and blocks until the JVM is asked to shut down.
 */
@Command(
    name = "serve",
    description = "Start the match coordinator and the WebSocket gateway"
)
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);
    static final String GATEWAY_OPTIONS = "node.processes.gateway.options";

    @Option(names = {"--host"}, description = "Interface the gateway binds to (overrides configuration)")
    private String host;

    @Option(names = {"--port"}, description = "Port the gateway listens on (overrides configuration)")
    private Integer port;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws InterruptedException {
        final Config config = withOverrides(parent.getConfig(), host, port);
        final Node node = new Node(config);
        final CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping node");
            node.stop();
            stopped.countDown();
        }, "arenaclient-shutdown"));

        node.start();
        stopped.await();
        return 0;
    }

    static Config withOverrides(final Config config, final String host, final Integer port) {
        final Map<String, Object> overrides = new HashMap<>();
        if (host != null) {
            overrides.put(GATEWAY_OPTIONS + ".host", host);
        }
        if (port != null) {
            overrides.put(GATEWAY_OPTIONS + ".port", port);
        }
        if (overrides.isEmpty()) {
            return config;
        }
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }
}
