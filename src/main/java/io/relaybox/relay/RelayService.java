package io.relaybox.relay;

import io.relaybox.config.RelayBoxConfig;
import io.relaybox.model.ErrorKind;
import io.relaybox.util.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Accepts relay clients on a TCP port. The transport is assumed to be authenticated by an
 * outer layer; this service only checks the capability token carried in HELLO.
 */
public final class RelayService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RelayService.class);
    private static final int HANDSHAKE_TIMEOUT_MS = 10_000;

    private final RelayBoxConfig config;
    private final AllocationTable table;
    private final RelayForwarder forwarder;
    private final Set<RelayConnection> connections = ConcurrentHashMap.newKeySet();
    private final RelayAdmission admission;
    private final ThreadPoolExecutor workers;
    private volatile ServerSocket server;
    private volatile boolean accepting;
    private Thread acceptor;

    public RelayService(RelayBoxConfig config, AllocationTable table, RelayForwarder forwarder) {
        this(config, table, forwarder, RelayAdmission.unlimited(Clock.systemUTC()));
    }

    public RelayService(RelayBoxConfig config, AllocationTable table, RelayForwarder forwarder, RelayAdmission admission) {
        this.config = config;
        this.table = table;
        this.forwarder = forwarder;
        this.admission = admission;
        // One worker per connection; a full pool refuses instead of queueing.
        this.workers = new ThreadPoolExecutor(
                0,
                config.maxRelayConnections(),
                60L,
                TimeUnit.SECONDS,
                new SynchronousQueue<>(),
                Threads.named("relaybox-relay")
        );
    }

    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("relay already started");
        }
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(config.bindHost(), config.relayPort()));
        server = socket;
        accepting = true;
        acceptor = new Thread(this::acceptLoop, "relaybox-relay-acceptor");
        acceptor.setDaemon(true);
        acceptor.start();
        log.info("Relay listening on {}:{}", config.bindHost(), port());
    }

    public int port() {
        ServerSocket current = server;
        return current == null ? -1 : current.getLocalPort();
    }

    private void acceptLoop() {
        while (accepting) {
            Socket client;
            try {
                client = server.accept();
            } catch (IOException e) {
                if (accepting) {
                    log.warn("Relay accept failed: {}", e.getMessage());
                }
                continue;
            }
            String source = client.getInetAddress().getHostAddress();
            Optional<ErrorKind> refusal = admission.admitConnection(source);
            if (refusal.isPresent()) {
                refuse(client, refusal.get());
                continue;
            }
            RelayConnection connection = new RelayConnection(
                    client, source, admission, table, forwarder, config.maxFrameSize(), HANDSHAKE_TIMEOUT_MS, connections::remove);
            connections.add(connection);
            try {
                workers.execute(connection);
            } catch (RejectedExecutionException e) {
                connections.remove(connection);
                log.warn("Relay connection limit {} reached, refusing {}", config.maxRelayConnections(), source);
                refuse(client, ErrorKind.SERVICE_UNAVAILABLE);
            }
        }
    }

    private static void refuse(Socket client, ErrorKind reason) {
        try (Socket socket = client) {
            socket.setSoTimeout(HANDSHAKE_TIMEOUT_MS);
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
            RelayFrames.write(out, RelayFrame.reject(reason));
        } catch (IOException e) {
            log.debug("Could not deliver REJECT {} to {}: {}", reason.code(), client.getRemoteSocketAddress(), e.getMessage());
        }
    }

    public void stopAccepting() {
        accepting = false;
        ServerSocket current = server;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.debug("Relay listener close failed: {}", e.getMessage());
            }
        }
    }

    /**
     * Waits for live allocations to end on their own. Returns true if none remain.
     */
    public boolean awaitAllocations(long timeoutMs) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        while (table.activeCount() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(50L);
        }
        return true;
    }

    public int openConnections() {
        return connections.size();
    }

    @Override
    public void close() {
        stopAccepting();
        for (AllocationView view : table.list()) {
            table.terminate(view.id(), "shutdown");
        }
        for (RelayConnection connection : connections) {
            connection.close(ErrorKind.SERVICE_UNAVAILABLE);
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Relay workers did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Relay stopped");
    }
}
