package db.runner.exec;

import static db.runner.exec.TestRelations.lines;
import static db.runner.exec.TestRelations.relation;
import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;

import org.junit.jupiter.api.Test;

import db.runner.catalog.DataType;

public class GroupCountOperatorTest {

    @Test
    void countsInFirstOccurrenceOrder() {
        Relation r = relation("id,name", "1,x", "2,y", "1,z");
        Relation out = new GroupCountOperator("id").apply(r);
        assertEquals(List.of("id", "count"), out.schema().columns());
        assertEquals(List.of("1,2", "2,1"), lines(out));
        assertEquals(DataType.INTEGER, out.rows().get(0).get(1).type());
    }

    @Test
    void keysOfDifferentTypeAreDistinctGroups() {
        Relation r = relation("v", "1", "01", "x", "1");
        // "01" infers to the same INTEGER as "1"
        assertEquals(List.of("1,3", "x,1"), lines(new GroupCountOperator("v").apply(r)));
    }

    @Test
    void countsSumToInputSizeAndKeysAreUnique() {
        Relation r = relation("c", "a", "b", "a", "c", "b", "a", "d");
        Relation out = new GroupCountOperator("c").apply(r);
        long total = 0;
        for (Row row : out.rows()) total += ((BigInteger) row.get(1).value()).longValue();
        assertEquals(r.size(), total);
        assertEquals(4, out.size());
        assertEquals(List.of("a,3", "b,2", "c,1", "d,1"), lines(out));
    }

    @Test
    void emptyInputGivesEmptyOutput() {
        Relation out = new GroupCountOperator("c").apply(Relation.empty(relation("c", "a").schema()));
        assertTrue(out.isEmpty());
        assertEquals(List.of("c", "count"), out.schema().columns());
    }

    @Test
    void unknownColumnFails() {
        assertThrows(UnknownColumnException.class, () -> new GroupCountOperator("nope").apply(relation("c", "a")));
    }

    @Test
    void groupingByCountColumnConflicts() {
        Relation r = relation("count", "1", "1");
        assertThrows(SchemaConflictException.class, () -> new GroupCountOperator("count").apply(r));
    }
}
