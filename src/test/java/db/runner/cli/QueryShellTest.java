package db.runner.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class QueryShellTest {

    private static ByteArrayInputStream input(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void forwardsNonBlankLinesUntilExit() {
        List<String> seen = new ArrayList<>();
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        QueryShell shell = new QueryShell(q -> { seen.add(q); return "ok:" + q; },
            input("  FROM a.csv  \n\nexit\nFROM ignored.csv\n"), new PrintStream(buf, true, StandardCharsets.UTF_8));

        assertEquals(1, shell.run());
        assertEquals(List.of("FROM a.csv"), seen);
        String printed = buf.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("ok:FROM a.csv\n"), printed);
        assertTrue(printed.contains("Exiting query mode"), printed);
    }

    @Test
    void endOfInputEndsSession() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        QueryShell shell = new QueryShell(q -> "row\n", input("FROM a.csv\nFROM b.csv"), new PrintStream(buf, true, StandardCharsets.UTF_8));
        assertEquals(2, shell.run());
        assertTrue(buf.toString(StandardCharsets.UTF_8).startsWith(QueryShell.PROMPT + "row\n"));
    }

    @Test
    void transportFailureStopsTheShell() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        QueryShell shell = new QueryShell(q -> { throw new IOException("Server closed the connection"); },
            input("FROM a.csv\nFROM b.csv\n"), new PrintStream(buf, true, StandardCharsets.UTF_8));
        assertEquals(0, shell.run());
        assertTrue(buf.toString(StandardCharsets.UTF_8).contains("Error: Server closed the connection"));
    }
}
