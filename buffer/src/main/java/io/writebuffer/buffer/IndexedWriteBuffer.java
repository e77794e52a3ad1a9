package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.retry.RetryPolicy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optimized implementation: lanes are insertion-ordered maps keyed by an admission sequence, with an identity
 * index so that superseding a deduplicated write is constant time instead of a lane scan.
 */
public class IndexedWriteBuffer extends AbstractWriteBuffer {
    private final Map<Lane, LinkedHashMap<Long, WriteOperation>> lanes = new EnumMap<>(Lane.class);
    private final IdentityHashMap<WriteOperation, Long> slots = new IdentityHashMap<>();
    private long nextSlot = 0;

    public IndexedWriteBuffer(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        super(config, retryPolicy, clock);
        for (Lane lane : Lane.FORMATION_ORDER) lanes.put(lane, new LinkedHashMap<>());
    }

    @Override
    protected void append(Lane lane, WriteOperation op) {
        long slot = nextSlot++;
        slots.put(op, slot);
        lanes.get(lane).put(slot, op);
    }

    @Override
    protected boolean remove(Lane lane, WriteOperation op) {
        Long slot = slots.remove(op);
        return slot != null && lanes.get(lane).remove(slot) != null;
    }

    @Override
    protected List<WriteOperation> poll(Lane lane, int max) {
        LinkedHashMap<Long, WriteOperation> q = lanes.get(lane);
        List<WriteOperation> out = new ArrayList<>(Math.min(max, q.size()));
        Iterator<WriteOperation> it = q.values().iterator();
        while (out.size() < max && it.hasNext()) {
            WriteOperation op = it.next();
            it.remove();
            slots.remove(op);
            out.add(op);
        }
        return out;
    }

    @Override
    protected WriteOperation peek(Lane lane) {
        LinkedHashMap<Long, WriteOperation> q = lanes.get(lane);
        return q.isEmpty() ? null : q.values().iterator().next();
    }

    @Override
    protected int size(Lane lane) { return lanes.get(lane).size(); }

    @Override
    protected List<WriteOperation> removeAll(Lane lane) {
        LinkedHashMap<Long, WriteOperation> q = lanes.get(lane);
        List<WriteOperation> out = new ArrayList<>(q.values());
        for (WriteOperation op : out) slots.remove(op);
        q.clear();
        return out;
    }
}
