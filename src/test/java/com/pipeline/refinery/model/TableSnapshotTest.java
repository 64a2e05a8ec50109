package com.pipeline.refinery.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;

import static org.junit.jupiter.api.Assertions.*;

class TableSnapshotTest {

    private static TableSnapshot sample() {
        return TableSnapshot.fromRows(Arrays.asList("id", "date"), Arrays.asList(
                Arrays.asList("1", "a"),
                Arrays.asList("2"),
                Arrays.asList("3", "c")));
    }

    @Test
    void shortRowsArePaddedAndLongRowsRejected() {
        assertEquals(Arrays.asList("2", ""), sample().getRow(1));
        assertThrows(IllegalArgumentException.class, () -> TableSnapshot.fromRows(
                Arrays.asList("id"), Arrays.asList(Arrays.asList("1", "extra"))));
    }

    @Test
    void addColumnAppendsButNeverOverwrites() {
        TableSnapshot table = sample();

        table.addColumn("date_cleaned", Arrays.asList("x", "y", "z"));

        assertEquals(Arrays.asList("id", "date", "date_cleaned"), table.getColumnNames());
        assertThrows(IllegalArgumentException.class, () -> table.addColumn("id", Arrays.asList("7", "8", "9")));
        assertEquals(Arrays.asList("1", "2", "3"), table.getColumn("id"));
        assertThrows(IllegalArgumentException.class, () -> table.addColumn("bad", Arrays.asList("1")));
    }

    @Test
    void removeRowsKeepsOrder() {
        TableSnapshot table = sample();
        BitSet drop = new BitSet();
        drop.set(1);

        assertEquals(1, table.removeRows(drop));
        assertEquals(Arrays.asList("1", "3"), table.getColumn("id"));
        assertEquals(0, table.removeRows(new BitSet()));
    }

    @Test
    void copyIsIndependent() {
        TableSnapshot table = sample();
        TableSnapshot copy = table.copy();

        copy.replaceColumn(1, Arrays.asList("p", "q", "r"));
        copy.addColumn("extra", Arrays.asList("", "", ""));

        assertEquals("a", table.getCell(0, 1));
        assertEquals(2, table.getColumnCount());
        assertEquals("p", copy.getCell(0, 1));
    }
}
