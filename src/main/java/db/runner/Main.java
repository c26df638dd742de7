package db.runner;

import java.io.IOException;

import db.runner.catalog.Catalog;
import db.runner.catalog.CsvSourceLoader;
import db.runner.cli.QueryShell;
import db.runner.config.EngineConfig;
import db.runner.net.QueryClient;
import db.runner.net.QueryServer;
import db.runner.query.QueryProcessor;

/**
 * Entry point. Usage: {@code [shell|server|client] [--config=file] [--data=dir] [--join=hash|merge]
 * [--host=h] [--port=n] [--maxConnections=n] [--maxMessageBytes=n]}.
 */
public class Main {
    public static void main(String[] args) {
        String mode = "shell";
        for (String a : args) {
            if (a != null && !a.startsWith("--")) { mode = a; break; }
        }

        EngineConfig config;
        try {
            config = EngineConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            switch (mode) {
                case "shell" -> runShell(config);
                case "server" -> runServer(config);
                case "client" -> runClient(config);
                default -> {
                    System.err.println("Unknown mode: " + mode + " (expected shell, server or client)");
                    System.exit(2);
                }
            }
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static QueryProcessor newProcessor(EngineConfig config) {
        Catalog catalog = new Catalog(new CsvSourceLoader(config.dataPath()));
        return new QueryProcessor(catalog, config.newJoinStrategy());
    }

    private static void runShell(EngineConfig config) {
        QueryProcessor qp = newProcessor(config);
        System.out.println("Query mode (data directory: " + config.dataPath().toAbsolutePath() + ", join: " + config.joinStrategy() + ")");
        new QueryShell(qp::execute, System.in, System.out).run();
    }

    private static void runServer(EngineConfig config) throws IOException, InterruptedException {
        QueryServer server = new QueryServer(newProcessor(config), config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (IOException e) {
                System.err.println("[Main] Failed stopping server: " + e.getMessage());
            }
        }, "query-server-shutdown"));
        server.start();
        server.awaitShutdown();
    }

    private static void runClient(EngineConfig config) throws IOException {
        try (QueryClient client = new QueryClient(config.host(), config.port(), config.maxMessageBytes())) {
            System.out.println("Connection established: " + client.remoteAddress());
            new QueryShell(client::send, System.in, System.out).run();
        }
    }
}

/* -------------------------------------------------------------------------
 * Example queries against the bundled data directory (run from the project root):
 *   FROM data/students.csv SELECT id,name TAKE 5
 *   FROM data/students.csv COUNTBY active ORDERBY count
 *   FROM data/students.csv JOIN data/enrollments.csv id ORDERBY course TAKE -3
 *   FROM data/enrollments.csv COUNTBY course ORDERBY count TAKE 2
 * ------------------------------------------------------------------------- */
