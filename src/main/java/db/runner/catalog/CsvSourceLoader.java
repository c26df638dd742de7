package db.runner.catalog;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import db.runner.exec.Relation;
import db.runner.exec.Row;

/**
 * Loader for comma-delimited text: first line is the header, each later line one row.
 * No quoting or escaping; every field is type-inferred on its own via {@link Cell#infer(String)}.
 */
public class CsvSourceLoader implements SourceLoader {
    private static final String DELIMITER = ",";

    private final Path dataDirectory;

    public CsvSourceLoader(Path dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public Path resolve(String sourceName) {
        try {
            return dataDirectory.resolve(sourceName);
        } catch (InvalidPathException e) {
            throw new SourceException(SourceException.Kind.IO, sourceName, "Invalid source name: " + sourceName, e);
        }
    }

    @Override
    public Relation load(String sourceName) {
        Path file = resolve(sourceName);
        try {
            if (Files.size(file) == 0) throw SourceException.empty(sourceName);
            try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return read(sourceName, reader);
            }
        } catch (NoSuchFileException e) {
            throw new SourceException(SourceException.Kind.IO, sourceName, "No such source: " + sourceName, e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.IO, sourceName,
                "Cannot read source " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private Relation read(String sourceName, BufferedReader reader) throws IOException {
        String header = reader.readLine();
        if (header == null) throw SourceException.empty(sourceName);
        Schema schema = parseHeader(sourceName, header.stripTrailing());

        List<Row> rows = new ArrayList<>();
        int lineNo = 1;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.stripTrailing();
            if (line.isEmpty()) continue;
            String[] fields = line.split(DELIMITER, -1);
            if (fields.length != schema.size()) {
                throw malformed(sourceName, "expected " + schema.size() + " fields at line " + lineNo + ", found " + fields.length);
            }
            rows.add(Row.parse(fields));
        }
        if (rows.isEmpty()) throw SourceException.empty(sourceName);
        return new Relation(schema, rows);
    }

    private Schema parseHeader(String sourceName, String header) {
        if (header.isEmpty()) throw malformed(sourceName, "missing header");
        List<String> names = Arrays.asList(header.split(DELIMITER, -1));
        for (String n : names) {
            if (n.isEmpty()) throw malformed(sourceName, "empty column name in header");
        }
        Schema schema = new Schema(names);
        String dup = schema.firstDuplicate();
        if (dup != null) throw malformed(sourceName, "duplicate column name '" + dup + "' in header");
        return schema;
    }

    private static SourceException malformed(String sourceName, String detail) {
        return new SourceException(SourceException.Kind.MALFORMED, sourceName, "Malformed source " + sourceName + ": " + detail);
    }
}
