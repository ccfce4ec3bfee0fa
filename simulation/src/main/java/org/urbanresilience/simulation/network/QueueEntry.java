package org.urbanresilience.simulation.network;

import java.util.Comparator;

/**
 * Priority queue entry. Equal priorities are served in insertion order.
 */
final class QueueEntry {

    static final Comparator<QueueEntry> ORDER = Comparator
            .comparingDouble((QueueEntry e) -> e.priority)
            .thenComparingLong(e -> e.sequence);

    final int node;
    final double cost;
    final double priority;
    final long sequence;

    QueueEntry(int node, double cost, double priority, long sequence) {
        this.node = node;
        this.cost = cost;
        this.priority = priority;
        this.sequence = sequence;
    }
}
