package db.runner.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

import db.runner.exec.JoinStrategy;

/**
 * Engine settings. Layers, lowest priority first: field defaults, the classpath resource
 * {@value #RESOURCE}, the JSON file named by {@code --config=path}, then individual {@code --key=value} flags.
 */
public class EngineConfig {
    public static final String RESOURCE = "engine.json";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().setPrettyPrinting().create();

    private String dataDirectory = ".";
    private String joinStrategy = "hash";
    private String host = "127.0.0.1";
    private int port = 9090;
    private int maxConnections = 8;
    private int maxMessageBytes = 16 * 1024 * 1024;

    // Gson needs the no-arg constructor so absent keys keep their defaults
    public EngineConfig() {}

    public static EngineConfig defaultConfig() {
        return new EngineConfig().validate();
    }

    /**
     * Build the effective configuration from the classpath resource, an optional config file and flags.
     * Arguments that do not start with {@code --} are ignored here (they are the run mode).
     */
    public static EngineConfig fromArgs(String[] args) {
        JsonObject merged = new JsonObject();
        mergeInto(merged, readResource());

        JsonObject flags = new JsonObject();
        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (!s.startsWith("--")) continue;
            int eq = s.indexOf('=');
            if (eq < 0) throw new IllegalArgumentException("Expected --key=value but got: " + s);
            String key = s.substring(2, eq);
            String value = s.substring(eq + 1);
            switch (key) {
                case "config" -> mergeInto(merged, readFile(Paths.get(value)));
                case "data", "dataDirectory" -> flags.addProperty("dataDirectory", value);
                case "join", "joinStrategy" -> flags.addProperty("joinStrategy", value);
                case "host" -> flags.addProperty("host", value);
                case "port", "maxConnections", "maxMessageBytes" -> flags.add(key, parseInt(key, value));
                default -> throw new IllegalArgumentException("Unknown option: --" + key);
            }
        }
        mergeInto(merged, flags);
        return fromJson(merged);
    }

    public static EngineConfig fromJson(JsonObject json) {
        try {
            EngineConfig cfg = GSON.fromJson(json, EngineConfig.class);
            return (cfg == null ? new EngineConfig() : cfg).validate();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    public static EngineConfig fromJson(String json) {
        return fromJson(parseObject(new StringReader(json), "inline configuration"));
    }

    private EngineConfig validate() {
        if (dataDirectory == null || dataDirectory.isBlank()) throw new IllegalArgumentException("dataDirectory must not be empty");
        if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be empty");
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be positive: " + maxConnections);
        if (maxMessageBytes < 1) throw new IllegalArgumentException("maxMessageBytes must be positive: " + maxMessageBytes);
        JoinStrategy.named(joinStrategy); // fails on unknown names
        return this;
    }

    private static JsonObject readResource() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) return new JsonObject();
            return parseObject(new InputStreamReader(in, StandardCharsets.UTF_8), RESOURCE);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading " + RESOURCE + ": " + e.getMessage(), e);
        }
    }

    private static JsonObject readFile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parseObject(reader, file.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading config file " + file + ": " + e.getMessage(), e);
        }
    }

    private static JsonObject parseObject(Reader reader, String origin) {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            if (root.isJsonNull()) return new JsonObject();
            if (!root.isJsonObject()) throw new IllegalArgumentException("Configuration in " + origin + " must be a JSON object");
            return root.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed JSON in " + origin + ": " + e.getMessage(), e);
        }
    }

    private static void mergeInto(JsonObject target, JsonObject source) {
        for (Map.Entry<String, JsonElement> e : source.entrySet()) target.add(e.getKey(), e.getValue());
    }

    private static JsonPrimitive parseInt(String key, String value) {
        try {
            return new JsonPrimitive(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + key + " requires an integer but got: " + value, e);
        }
    }

    public String dataDirectory() { return dataDirectory; }
    public Path dataPath() { return Paths.get(dataDirectory); }
    public String joinStrategy() { return joinStrategy; }
    public JoinStrategy newJoinStrategy() { return JoinStrategy.named(joinStrategy); }
    public String host() { return host; }
    public int port() { return port; }
    public int maxConnections() { return maxConnections; }
    public int maxMessageBytes() { return maxMessageBytes; }

    public String toJson() { return GSON.toJson(this); }

    @Override
    public String toString() {
        return "EngineConfig{dataDirectory=" + dataDirectory + ", joinStrategy=" + joinStrategy
            + ", host=" + host + ", port=" + port + ", maxConnections=" + maxConnections
            + ", maxMessageBytes=" + maxMessageBytes + "}";
    }
}
