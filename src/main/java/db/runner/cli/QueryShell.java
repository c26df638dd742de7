package db.runner.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Scanner;

/**
 * Line-oriented prompt. Each non-blank line is handed to the handler and the reply printed;
 * {@code exit} or end of input ends the session.
 */
public class QueryShell {
    public static final String PROMPT = "query> ";

    /** Turns one query line into its printable result. */
    public interface Handler {
        String handle(String query) throws IOException;
    }

    private final Handler handler;
    private final InputStream input;
    private final PrintStream output;

    public QueryShell(Handler handler, InputStream input, PrintStream output) {
        this.handler = handler;
        this.input = input;
        this.output = output;
    }

    /** Returns the number of queries handled. */
    public int run() {
        int handled = 0;
        try (Scanner scanner = new Scanner(input)) {
            while (true) {
                output.print(PROMPT);
                output.flush();
                if (!scanner.hasNextLine()) {
                    output.println();
                    break;
                }
                String line = scanner.nextLine().trim();
                if (line.equalsIgnoreCase("exit")) {
                    output.println("Exiting query mode");
                    break;
                }
                if (line.isEmpty()) continue;
                try {
                    String reply = handler.handle(line);
                    output.print(reply);
                    if (!reply.endsWith("\n")) output.println();
                    handled++;
                } catch (IOException e) {
                    output.println("Error: " + e.getMessage());
                    break;
                }
            }
        }
        return handled;
    }
}
