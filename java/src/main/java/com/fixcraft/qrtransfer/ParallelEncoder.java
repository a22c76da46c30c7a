package com.fixcraft.qrtransfer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scatter/gather encoding of a chunk sequence. Batches larger than the
 * threshold go to a fixed pool; smaller ones run on the calling thread. Either
 * way every chunk is attempted, a failing chunk never stops its siblings, and
 * records come back sorted by index.
 */
public final class ParallelEncoder {
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int workers;
    private final int threshold;

    public ParallelEncoder(int workers, int threshold) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.workers = workers;
        this.threshold = threshold;
    }

    public static ParallelEncoder sequential() {
        return new ParallelEncoder(1, Integer.MAX_VALUE);
    }

    /** {@code min(8, cores + 2)}. */
    public static int defaultWorkers() {
        int cores = Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(Constants.MAX_WORKERS, cores + 2));
    }

    public int workers() {
        return workers;
    }

    public int threshold() {
        return threshold;
    }

    public boolean runsParallel(int chunkCount) {
        return workers > 1 && chunkCount > threshold;
    }

    public EncodeOutcome encodeAll(List<Chunk> chunks, ChunkEncoder encoder) {
        if (chunks == null || encoder == null) {
            throw new IllegalArgumentException("encodeAll expects chunks and an encoder");
        }
        int count = chunks.size();
        WireRecord[] slots = new WireRecord[count];
        Map<Integer, Throwable> failures = new ConcurrentHashMap<>();
        if (runsParallel(count)) {
            RuntimeLog.debug("Encoding " + count + " chunks on " + Math.min(workers, count) + " workers");
            runPooled(chunks, encoder, slots, failures);
        } else {
            for (int i = 0; i < count; i++) {
                encodeSlot(chunks.get(i), encoder, slots, i, failures);
            }
        }
        return gather(chunks, slots, failures);
    }

    private void runPooled(List<Chunk> chunks, ChunkEncoder encoder, WireRecord[] slots,
                           Map<Integer, Throwable> failures) {
        int count = chunks.size();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, count), threadFactory());
        CountDownLatch latch = new CountDownLatch(count);
        try {
            for (int i = 0; i < count; i++) {
                final int slot = i;
                pool.execute(() -> {
                    try {
                        encodeSlot(chunks.get(slot), encoder, slots, slot, failures);
                    } finally {
                        latch.countDown();
                    }
                });
            }
            latch.await();
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new IllegalStateException("Parallel encoding interrupted", exc);
        } finally {
            shutdownPool(pool);
        }
    }

    private static void encodeSlot(Chunk chunk, ChunkEncoder encoder, WireRecord[] slots, int slot,
                                   Map<Integer, Throwable> failures) {
        try {
            WireRecord record = encoder.encode(chunk);
            if (record == null || record.index != chunk.index) {
                throw new IllegalStateException("Encoder returned no record for part " + chunk.index);
            }
            slots[slot] = record;
        } catch (RuntimeException exc) {
            RuntimeLog.warn(String.format("Part %02d failed to encode: %s", chunk.index, exc.getMessage()));
            failures.put(chunk.index, exc);
        }
    }

    private static EncodeOutcome gather(List<Chunk> chunks, WireRecord[] slots, Map<Integer, Throwable> failures) {
        List<WireRecord> records = new ArrayList<>(slots.length);
        Map<Integer, Throwable> failed = new HashMap<>(failures);
        for (int i = 0; i < slots.length; i++) {
            if (slots[i] != null) {
                records.add(slots[i]);
            } else if (!failed.containsKey(chunks.get(i).index)) {
                failed.put(chunks.get(i).index, new IllegalStateException("No result for part " + chunks.get(i).index));
            }
        }
        records.sort(Comparator.comparingInt(r -> r.index));
        return new EncodeOutcome(records, failed);
    }

    private static ThreadFactory threadFactory() {
        int poolId = POOL_SEQ.incrementAndGet();
        AtomicInteger threadSeq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "qrtransfer-encode-" + poolId + "-" + threadSeq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdownPool(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException exc) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }
}
