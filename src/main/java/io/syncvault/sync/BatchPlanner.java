package io.syncvault.sync;

import io.syncvault.model.Checkpoint;
import io.syncvault.model.Record;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits an ordered record sequence into fixed-size batches and maps checkpoints back onto that
 * plan. The same sequence and size always produce the same plan, which is what makes a
 * checkpoint from an interrupted run meaningful to its resume.
 */
public final class BatchPlanner {
    private BatchPlanner() {
    }

    /**
     * @param index   zero-based position in the plan
     * @param records records of this batch, in source order
     * @param through source records covered by this batch and every batch before it
     */
    public record Batch(int index, List<Record> records, long through) {
        public Batch {
            records = List.copyOf(records);
        }

        public String lastKey() {
            return records.isEmpty() ? "" : records.get(records.size() - 1).key();
        }

        public int size() {
            return records.size();
        }
    }

    public static <T> List<List<T>> batch(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("batch size must be >= 1, was " + size);
        }
        List<List<T>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int start = 0; start < items.size(); start += size) {
            out.add(List.copyOf(items.subList(start, Math.min(items.size(), start + size))));
        }
        return out;
    }

    public static List<Batch> plan(List<Record> records, int size) {
        List<List<Record>> chunks = batch(records, size);
        List<Batch> out = new ArrayList<>(chunks.size());
        long through = 0L;
        for (int i = 0; i < chunks.size(); i++) {
            through += chunks.get(i).size();
            out.add(new Batch(i, chunks.get(i), through));
        }
        return out;
    }

    /**
     * Batches still to be written after {@code checkpoint}. The checkpoint is trusted only when
     * its last key closes a batch of this plan: first at its own index, then anywhere else in the
     * plan. A checkpoint that matches nothing replays the whole plan.
     */
    public static List<Batch> resumeFrom(List<Batch> plan, Checkpoint checkpoint) {
        if (checkpoint == null) {
            return plan;
        }
        int index = checkpoint.batchIndex();
        if (index < plan.size() && plan.get(index).lastKey().equals(checkpoint.lastKey())) {
            return plan.subList(index + 1, plan.size());
        }
        for (Batch batch : plan) {
            if (!batch.lastKey().isEmpty() && batch.lastKey().equals(checkpoint.lastKey())) {
                return plan.subList(batch.index() + 1, plan.size());
            }
        }
        return plan;
    }

    public static Checkpoint checkpointAfter(Batch batch) {
        return new Checkpoint(batch.index(), batch.lastKey(), batch.through(), Instant.now().toEpochMilli());
    }
}
