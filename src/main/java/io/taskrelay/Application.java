package io.taskrelay;

import io.taskrelay.config.impl.RelayConfig;
import io.taskrelay.config.type.ConfigLoader;
import io.taskrelay.transport.NettyTransport;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Main class to start the task relay.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        /* An explicit config file wins; otherwise the bundled defaults */
        final RelayConfig cfg = args.length > 0
                ? ConfigLoader.load(Path.of(args[0]))
                : ConfigLoader.loadResource("relay.yaml");

        final TaskRelay relay = TaskRelay.open(cfg);
        final NettyTransport transport = new NettyTransport(cfg.getTransport().getPort(), relay.getRegistry(), relay.getPublisher());
        transport.start();

        /* Ensure graceful shutdown to flush mmap logs */
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down task relay...");
                transport.stop();
                relay.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));

        log.info("Task relay started on port {}", transport.getPort());
    }
}
