package db.runner.catalog;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import db.runner.QueryException;
import db.runner.exec.Relation;

/**
 * Process-wide cache of loaded sources, keyed by source name.
 * <p>
 * Each name is loaded at most once: the first caller installs a pending future and performs the load,
 * concurrent callers for the same name block on that future and share its result. A failed load is
 * removed again so a later query can retry. Cached relations are immutable and read without locking.
 * There is no eviction.
 */
public class Catalog {
    private final SourceLoader loader;
    private final ConcurrentMap<String, CompletableFuture<Relation>> entries = new ConcurrentHashMap<>();

    public Catalog(SourceLoader loader) {
        this.loader = loader;
    }

    public Relation load(String sourceName) {
        if (sourceName == null || sourceName.isEmpty()) throw new IllegalArgumentException("sourceName must not be empty");
        CompletableFuture<Relation> pending = new CompletableFuture<>();
        CompletableFuture<Relation> existing = entries.putIfAbsent(sourceName, pending);
        if (existing != null) return await(existing);

        try {
            Relation loaded = loader.load(sourceName);
            pending.complete(loaded);
            logInfo("Loaded " + sourceName + " (" + loaded.size() + " rows, columns " + loaded.schema() + ")");
            return loaded;
        } catch (RuntimeException | Error e) {
            entries.remove(sourceName, pending);
            pending.completeExceptionally(e);
            throw e;
        }
    }

    public boolean isCached(String sourceName) {
        CompletableFuture<Relation> f = entries.get(sourceName);
        return f != null && f.isDone() && !f.isCompletedExceptionally();
    }

    public Set<String> sourceNames() { return Set.copyOf(entries.keySet()); }

    private Relation await(CompletableFuture<Relation> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryException qe) throw qe;
            if (cause instanceof Error err) throw err;
            throw new QueryException("Load failed: " + cause.getMessage(), cause);
        }
    }

    private void logInfo(String message) {
        System.err.println("[Catalog] " + message);
    }
}
