package com.lsnp.peer.command;

import com.lsnp.peer.auth.TokenAuthority;
import com.lsnp.peer.net.NetworkUtil;
import com.lsnp.peer.net.UdpTransport;
import com.lsnp.peer.node.LsnpNode;
import com.lsnp.peer.node.NodeConfig;
import com.lsnp.peer.presence.PresenceService;
import picocli.CommandLine;

import java.io.InputStreamReader;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "run",
        description = "Join the local network and open an interactive console",
        mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"--user", "-u"}, description = "Username (identity becomes user@ip)", required = true)
    private String user;

    @CommandLine.Option(names = {"--display-name"}, description = "Display name (default: username)")
    private String displayName;

    @CommandLine.Option(names = {"--status"}, description = "Status text", defaultValue = "Online")
    private String status;

    @CommandLine.Option(names = {"--ip"}, description = "Local IPv4 address (default: auto-detect)")
    private String ip;

    @CommandLine.Option(names = {"--port", "-p"}, description = "UDP port", defaultValue = "" + UdpTransport.DEFAULT_PORT)
    private int port;

    @CommandLine.Option(names = {"--download-dir"}, description = "Where received files are written", defaultValue = "downloads")
    private Path downloadDir;

    @CommandLine.Option(names = {"--presence-interval"}, description = "Seconds between PING/PROFILE broadcasts",
            defaultValue = "" + PresenceService.DEFAULT_INTERVAL_SECONDS)
    private long presenceInterval;

    @CommandLine.Option(names = {"--token-ttl"}, description = "Lifetime of issued tokens in seconds",
            defaultValue = "" + TokenAuthority.DEFAULT_TTL_SECONDS)
    private long tokenTtl;

    @CommandLine.Option(names = {"--verbose", "-v"}, description = "Log protocol traffic at debug level")
    private boolean verbose;

    @CommandLine.Option(names = {"--json"}, description = "Output newline-delimited JSON events instead of human-readable text")
    private boolean json;

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            System.setProperty("LSNP_LOG_LEVEL", "DEBUG");
        }

        ConsoleEvents events = new ConsoleEvents(System.out, json);
        try {
            return run(events);
        } catch (Exception e) {
            if (json) {
                events.json().error(e.getMessage());
                return 1;
            }
            throw e;
        }
    }

    private Integer run(ConsoleEvents events) throws Exception {
        InetAddress address = ip != null ? InetAddress.getByName(ip) : NetworkUtil.localIpv4Address();
        NodeConfig config = NodeConfig.defaults(user, address, downloadDir)
                .withProfile(displayName != null ? displayName : user, status)
                .withPorts(port, port)
                .withTokenTtl(tokenTtl)
                .withPresenceInterval(presenceInterval);

        LsnpNode node = LsnpNode.bind(config, events);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!json) System.out.println("\nShutting down...");
            node.close();
        }));

        node.start();
        if (json) {
            events.json().started(node.identity(), port);
        } else {
            System.out.println("Joined as " + node.identity() + " on UDP port " + port + ". Type 'help' for commands.");
        }

        try {
            new ConsoleShell(node, new InputStreamReader(System.in, StandardCharsets.UTF_8), System.out).run();
        } finally {
            node.close();
        }
        return 0;
    }
}
