package io.writebuffer.buffer;

import io.writebuffer.config.WriteBufferConfig;
import io.writebuffer.core.WriteOperation;
import io.writebuffer.retry.RetryPolicy;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reference implementation: each lane is a plain deque, superseded operations are found by a linear scan.
 */
public class PortableWriteBuffer extends AbstractWriteBuffer {
    private final Map<Lane, ArrayDeque<WriteOperation>> lanes = new EnumMap<>(Lane.class);

    public PortableWriteBuffer(WriteBufferConfig config, RetryPolicy retryPolicy, Clock clock) {
        super(config, retryPolicy, clock);
        for (Lane lane : Lane.FORMATION_ORDER) lanes.put(lane, new ArrayDeque<>());
    }

    @Override
    protected void append(Lane lane, WriteOperation op) { lanes.get(lane).addLast(op); }

    @Override
    protected boolean remove(Lane lane, WriteOperation op) {
        return lanes.get(lane).removeIf(queued -> queued == op);
    }

    @Override
    protected List<WriteOperation> poll(Lane lane, int max) {
        ArrayDeque<WriteOperation> q = lanes.get(lane);
        List<WriteOperation> out = new ArrayList<>(Math.min(max, q.size()));
        while (out.size() < max && !q.isEmpty()) out.add(q.pollFirst());
        return out;
    }

    @Override
    protected WriteOperation peek(Lane lane) { return lanes.get(lane).peekFirst(); }

    @Override
    protected int size(Lane lane) { return lanes.get(lane).size(); }

    @Override
    protected List<WriteOperation> removeAll(Lane lane) {
        ArrayDeque<WriteOperation> q = lanes.get(lane);
        List<WriteOperation> out = new ArrayList<>(q);
        q.clear();
        return out;
    }
}
