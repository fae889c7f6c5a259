package ai.kcache.taskman.admin;

import ai.kcache.taskman.TaskManager;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Line based TCP console to inspect the task manager. Commands:
 * <ul>
 *     <li>{@code help}: the commands list</li>
 *     <li>{@code tasks}: one {@code - <name>: since <started> (<n> restarts)} line per task</li>
 *     <li>{@code reset_restarts [name]}: resets the restarts counter of one or of all tasks</li>
 * </ul>
 * Anything else closes the connection.
 */
public class AdminConsole implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(AdminConsole.class);

    public static final String GREETING = "Hello, write `help` for help.";
    public static final String FAREWELL = "Good Bye.";
    public static final String OK = "Ok";
    public static final List<String> HELP = List.of(
        "Commands",
        "- help: this help text",
        "- tasks: list tasks",
        "- reset_restarts [name]: reset the restarts counter");

    private static final String EOL = "\r\n";
    static final int MAX_LINE_LENGTH = 1024;

    private final TaskManager taskManager;
    private final InetSocketAddress address;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger connections = new AtomicInteger(1);
    private volatile ServerSocket serverSocket;

    public AdminConsole(TaskManager taskManager, String host, int port) {
        this.taskManager = taskManager;
        this.address = new InetSocketAddress(host, port);
    }

    public void start() throws IOException {
        var socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(address);
        serverSocket = socket;

        var acceptor = new Thread(this::acceptLoop, "admin-console");
        acceptor.setDaemon(true);
        acceptor.start();
        LOG.info("Admin console is listening on {}", socket.getLocalSocketAddress());
    }

    /**
     * Actual port, useful when started with port 0.
     */
    public int port() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true) && serverSocket != null) {
            LOG.info("Stop admin console");
            serverSocket.close();
        }
    }

    private void acceptLoop() {
        while (!closed.get()) {
            try {
                var socket = serverSocket.accept();
                var handler = new Thread(() -> handle(socket), "admin-console-conn-" + connections.getAndIncrement());
                handler.setDaemon(true);
                handler.start();
            } catch (SocketException e) {
                if (!closed.get()) {
                    LOG.error("Admin console socket failed: {}", e.getMessage(), e);
                }
                return;
            } catch (IOException e) {
                LOG.error("Cannot accept admin console connection: {}", e.getMessage(), e);
            }
        }
    }

    private void handle(Socket socket) {
        try (socket;
             var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             var writer = new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))
        {
            try {
                writeLine(writer, GREETING);
                var running = true;
                while (running) {
                    running = processCommand(readLine(reader), writer);
                }
            } catch (Exception e) {
                LOG.error("Error while serving admin console connection from {}: {}",
                    socket.getRemoteSocketAddress(), e.getMessage(), e);
            }
            writeLine(writer, FAREWELL);
        } catch (IOException e) {
            LOG.warn("Admin console connection closed with error: {}", e.getMessage());
        }
    }

    /**
     * @return {@code false} when the connection must be closed
     */
    private boolean processCommand(String line, Writer writer) throws IOException {
        if (line == null) {
            return false;
        }

        var parts = line.strip().split("\\s+");
        var command = parts[0].toLowerCase(Locale.ROOT);
        var args = Arrays.asList(parts).subList(1, parts.length);

        switch (command) {
            case "help" -> {
                for (var help : HELP) {
                    writeLine(writer, help);
                }
                return true;
            }
            case "tasks" -> {
                for (var task : taskManager.currentTasks()) {
                    writeLine(writer, "- %s: since %s (%d restarts)".formatted(task.name(), task.started(),
                        task.restarts()));
                }
                return true;
            }
            case "reset_restarts" -> {
                if (args.isEmpty()) {
                    taskManager.resetAllRestarts();
                } else {
                    taskManager.resetRestarts(args.get(0));
                }
                writeLine(writer, OK);
                return true;
            }
            default -> {
                return false;
            }
        }
    }

    /**
     * Reads one line of at most {@link #MAX_LINE_LENGTH} chars. A longer line is skipped up to its end and
     * rejected with an {@link IOException}.
     *
     * @return {@code null} at the end of the stream
     */
    @Nullable
    private static String readLine(Reader reader) throws IOException {
        var line = new StringBuilder();
        int ch;
        while ((ch = reader.read()) != -1 && ch != '\n') {
            line.append((char) ch);
            if (line.length() > MAX_LINE_LENGTH) {
                do {
                    ch = reader.read();
                } while (ch != -1 && ch != '\n');
                throw new IOException("Command line is longer than " + MAX_LINE_LENGTH + " chars");
            }
        }
        if (ch == -1 && line.length() == 0) {
            return null;
        }
        return line.toString();
    }

    private static void writeLine(Writer writer, String line) throws IOException {
        writer.write(line);
        writer.write(EOL);
        writer.flush();
    }
}
