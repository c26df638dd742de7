package db.runner.net;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import db.runner.config.EngineConfig;
import db.runner.query.QueryProcessor;

/**
 * TCP front end for {@link QueryProcessor}. Each framed request is one query; each reply is the framed
 * result string. Connections are served by a fixed pool of {@code maxConnections} workers; extra
 * connections wait for a free worker. All connections share one processor and therefore one catalog.
 */
public class QueryServer implements Closeable {
    private final QueryProcessor processor;
    private final MessageFraming framing;
    private final String host;
    private final int port;
    private final int maxConnections;

    private final Set<Socket> openSockets = ConcurrentHashMap.newKeySet();
    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;
    private volatile boolean running;

    public QueryServer(QueryProcessor processor, EngineConfig config) {
        this.processor = processor;
        this.framing = new MessageFraming(config.maxMessageBytes());
        this.host = config.host();
        this.port = config.port();
        this.maxConnections = config.maxConnections();
    }

    public synchronized void start() throws IOException {
        if (running) throw new IllegalStateException("Server already started");
        serverSocket = new ServerSocket();
        serverSocket.bind(new InetSocketAddress(host, port));
        AtomicInteger workerIds = new AtomicInteger();
        workers = Executors.newFixedThreadPool(maxConnections, r -> {
            Thread t = new Thread(r, "query-worker-" + workerIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        running = true;
        acceptThread = new Thread(this::acceptLoop, "query-server-accept");
        acceptThread.start();
        System.out.println("Query server listening on " + serverSocket.getLocalSocketAddress());
    }

    /** Bound port; useful when configured with port 0. */
    public int localPort() {
        if (serverSocket == null) throw new IllegalStateException("Server not started");
        return serverSocket.getLocalPort();
    }

    public boolean isRunning() { return running; }

    /** Block until the accept loop ends (after {@link #close()}). */
    public void awaitShutdown() throws InterruptedException {
        Thread t = acceptThread;
        if (t != null) t.join();
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                openSockets.add(socket);
                workers.execute(() -> serve(socket));
            } catch (SocketException e) {
                if (running) logError("Accept failed", e);
                break;
            } catch (IOException e) {
                logError("Accept failed", e);
            }
        }
    }

    void serve(Socket socket) {
        String peer = String.valueOf(socket.getRemoteSocketAddress());
        logInfo("Connection established: " + peer);
        try (socket;
             InputStream in = new BufferedInputStream(socket.getInputStream());
             OutputStream out = new BufferedOutputStream(socket.getOutputStream())) {
            String query;
            while ((query = framing.read(in)) != null) {
                framing.write(out, fitReply(processor.execute(query)));
            }
            logInfo("Connection closed: " + peer);
        } catch (FramingException e) {
            logInfo("Closing " + peer + " after protocol error: " + e.getMessage());
        } catch (IOException e) {
            // peer went away mid-request; catalog state is unaffected
            if (running) logInfo("Connection dropped: " + peer + " (" + e.getMessage() + ")");
        } finally {
            openSockets.remove(socket);
        }
    }

    // A result over the frame limit is replaced by a one-line error so the session survives
    private String fitReply(String reply) {
        int size = MessageFraming.encodedLength(reply);
        if (size <= framing.maxMessageBytes()) return reply;
        return "Result of " + size + " bytes exceeds limit " + framing.maxMessageBytes();
    }

    @Override
    public synchronized void close() throws IOException {
        if (!running) return;
        running = false;
        try {
            serverSocket.close();
        } finally {
            for (Socket s : openSockets) {
                try {
                    s.close();
                } catch (IOException e) {
                    logError("Failed closing connection " + s.getRemoteSocketAddress(), e);
                }
            }
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) workers.shutdownNow();
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private void logInfo(String message) {
        System.err.println("[QueryServer] " + message);
    }

    private void logError(String message, Exception e) {
        System.err.println("[QueryServer] " + message);
        e.printStackTrace(System.err);
    }
}
