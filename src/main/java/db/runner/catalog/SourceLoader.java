package db.runner.catalog;

import db.runner.exec.Relation;

/**
 * Reads a named source into a fresh relation. Implementations do no caching; see {@link Catalog}.
 */
public interface SourceLoader {
    Relation load(String sourceName);
}
