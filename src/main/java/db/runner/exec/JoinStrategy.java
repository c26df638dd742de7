package db.runner.exec;

import java.util.Locale;

/**
 * Inner equi-join on one column present in both inputs. Every strategy yields the same multiset of rows;
 * only the row order may differ.
 */
public interface JoinStrategy {
    Relation join(Relation left, Relation right, String joinColumn);

    /** Resolve a strategy by its configuration name: {@code hash} or {@code merge}. */
    static JoinStrategy named(String name) {
        if (name == null) throw new IllegalArgumentException("join strategy name must not be null");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "hash" -> new HashJoin();
            case "merge", "sort-merge" -> new SortMergeJoin();
            default -> throw new IllegalArgumentException("Unknown join strategy: " + name + " (expected hash or merge)");
        };
    }
}
