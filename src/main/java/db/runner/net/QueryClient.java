package db.runner.net;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Blocking client for {@link QueryServer}: one framed request, one framed reply.
 */
public class QueryClient implements Closeable {
    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final MessageFraming framing;

    public QueryClient(String host, int port, int maxMessageBytes) throws IOException {
        this.socket = new Socket();
        socket.connect(new InetSocketAddress(host, port));
        this.in = new BufferedInputStream(socket.getInputStream());
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.framing = new MessageFraming(maxMessageBytes);
    }

    public String send(String query) throws IOException {
        framing.write(out, query);
        String reply = framing.read(in);
        if (reply == null) throw new IOException("Server closed the connection");
        return reply;
    }

    public String remoteAddress() { return String.valueOf(socket.getRemoteSocketAddress()); }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
