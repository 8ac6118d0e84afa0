package com.example.mongoprofile.aggregate;

/**
 * All array-valued occurrences at one position. Elements of every array instance are merged
 * into a single shared {@code items} aggregate, regardless of their index.
 */
public class ArrayAggregate {
    private long totalSeen = 0;
    private long emptyCount = 0;
    private FieldAggregate items;

    public long getTotalSeen() {
        return totalSeen;
    }

    public long getEmptyCount() {
        return emptyCount;
    }

    /**
     * Shared element aggregate, {@code null} while only empty arrays have been seen
     */
    public FieldAggregate getItems() {
        return items;
    }

    void incrementTotalSeen() {
        totalSeen++;
    }

    void incrementEmptyCount() {
        emptyCount++;
    }

    FieldAggregate items() {
        if (items == null) {
            items = new FieldAggregate();
        }
        return items;
    }

    void merge(ArrayAggregate other) {
        totalSeen += other.totalSeen;
        emptyCount += other.emptyCount;
        if (other.items != null) {
            items().merge(other.items);
        }
    }
}
