package io.syncvault.sync;

import io.syncvault.model.Checkpoint;
import io.syncvault.model.Record;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.syncvault.TestRecords.numbered;

final class BatchPlannerTest {

    @Test
    void planSplitsInOrderWithShortTail() {
        List<BatchPlanner.Batch> plan = BatchPlanner.plan(numbered("rec", 25), 10);

        Assertions.assertEquals(3, plan.size());
        Assertions.assertEquals(List.of(10, 10, 5), plan.stream().map(BatchPlanner.Batch::size).toList());
        Assertions.assertEquals("rec-10", plan.get(0).lastKey());
        Assertions.assertEquals(25L, plan.get(2).through());
        Assertions.assertTrue(BatchPlanner.plan(List.of(), 10).isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class, () -> BatchPlanner.batch(List.of(1), 0));
    }

    @Test
    void checkpointRecordsBatchPosition() {
        BatchPlanner.Batch second = BatchPlanner.plan(numbered("rec", 25), 10).get(1);

        Checkpoint checkpoint = BatchPlanner.checkpointAfter(second);

        Assertions.assertEquals(1, checkpoint.batchIndex());
        Assertions.assertEquals("rec-20", checkpoint.lastKey());
        Assertions.assertEquals(20L, checkpoint.recordsProcessed());
    }

    @Test
    void resumeSkipsConfirmedBatches() {
        List<Record> records = numbered("rec", 25);
        List<BatchPlanner.Batch> plan = BatchPlanner.plan(records, 10);

        Assertions.assertSame(plan, BatchPlanner.resumeFrom(plan, null));
        List<BatchPlanner.Batch> rest = BatchPlanner.resumeFrom(plan, new Checkpoint(0, "rec-10", 10, 0L));
        Assertions.assertEquals(List.of(1, 2), rest.stream().map(BatchPlanner.Batch::index).toList());
        Assertions.assertTrue(BatchPlanner.resumeFrom(plan, new Checkpoint(2, "rec-25", 25, 0L)).isEmpty());
    }

    @Test
    void resumeFindsMovedKeyOrReplaysEverything() {
        List<BatchPlanner.Batch> plan = BatchPlanner.plan(numbered("rec", 25), 10);

        List<BatchPlanner.Batch> moved = BatchPlanner.resumeFrom(plan, new Checkpoint(0, "rec-20", 20, 0L));
        Assertions.assertEquals(List.of(2), moved.stream().map(BatchPlanner.Batch::index).toList());

        Assertions.assertEquals(plan, BatchPlanner.resumeFrom(plan, new Checkpoint(1, "rec-99", 20, 0L)));
        Assertions.assertEquals(plan, BatchPlanner.resumeFrom(plan, new Checkpoint(7, "", 70, 0L)));
    }
}
