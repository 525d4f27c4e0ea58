package com.flagship.game_economy.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded ring of transactions. When full, the oldest entry is evicted first.
 *
 * Not thread-safe; callers guard it with the owning wallet's lock or the
 * history's own monitor.
 */
public class TransactionHistory {

    private final int capacity;
    private final ArrayDeque<Transaction> entries;

    public TransactionHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 128));
    }

    public void append(Transaction transaction) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(transaction);
    }

    /**
     * The most recent {@code count} entries, oldest first.
     */
    public List<Transaction> recent(int count) {
        int take = Math.min(Math.max(count, 0), entries.size());
        List<Transaction> result = new ArrayList<>(take);
        Iterator<Transaction> newestFirst = entries.descendingIterator();
        for (int i = 0; i < take; i++) {
            result.add(newestFirst.next());
        }
        Collections.reverse(result);
        return result;
    }

    public List<Transaction> all() {
        return new ArrayList<>(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Replaces the contents, keeping only the newest {@code capacity} entries.
     */
    void restore(Collection<Transaction> restored) {
        entries.clear();
        for (Transaction transaction : restored) {
            append(transaction);
        }
    }
}
