package io.valuation.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.valuation.core.Record;
import io.valuation.core.Sink;
import io.valuation.core.Source;
import io.valuation.core.Transform;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finite source -> parallel transform -> ordered sink.
 *
 * Transforms run on a fixed worker pool and may complete in any order; a single sink thread buffers
 * their outputs and emits them in source seq order. A failing transform does not hold up the records
 * behind it: its slot is skipped and the failure is kept in {@link #failures()}.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final int maxInFlight;

    private final ExecutorService workerPool;
    private final ArrayBlockingQueue<Slot<O>> queue;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicInteger inflight = new AtomicInteger(0);
    private final ConcurrentLinkedQueue<Failure> failures = new ConcurrentLinkedQueue<>();
    private volatile Thread srcThread;
    private volatile Thread sinkThread;

    private final Timer transformTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    /** A transform or sink failure, keyed by the seq of the record that caused it. */
    public record Failure(long seq, String stage, Exception error) {}

    Pipeline(Source<I> source,
             Transform<I, O> transform,
             Sink<O> sink,
             int workers,
             int queueCapacity,
             MetricRegistry registry,
             String name) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        int poolSize = Math.max(1, workers);
        int capacity = Math.max(1, queueCapacity);
        this.maxInFlight = capacity;
        this.workerPool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, name + "-worker");
            t.setDaemon(true);
            return t;
        });
        this.queue = new ArrayBlockingQueue<>(capacity + 1);
        this.transformTimer = registry.timer(name + ".transform.time");
        this.inMeter = registry.meter(name + ".input.rate");
        this.outMeter = registry.meter(name + ".output.rate");
        this.errorMeter = registry.meter(name + ".error.rate");
    }

    public void start() {
        if (!running.compareAndSet(false, true)) return;
        srcThread = new Thread(this::runSource, "pipeline-source");
        srcThread.setDaemon(true);
        srcThread.start();
        // single sink thread to enforce ordering
        sinkThread = new Thread(this::runSink, "pipeline-sink");
        sinkThread.setDaemon(true);
        sinkThread.start();
    }

    /**
     * Blocks until every record has been transformed and handed to the sink.
     *
     * @throws InterruptedException if the caller is interrupted while waiting; the pipeline keeps running
     *                              and should be {@link #close() closed}.
     */
    public void awaitCompletion() throws InterruptedException {
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st == null || kt == null) throw new IllegalStateException("pipeline not started");
        st.join();
        kt.join();
        running.set(false);
        workerPool.shutdown();
    }

    public boolean isRunning() { return running.get(); }
    public int getInflight() { return inflight.get(); }

    public List<Failure> failures() { return new ArrayList<>(failures); }

    private void runSource() {
        long count = 0;
        while (!cancelled.get()) {
            if (inflight.get() >= maxInFlight) { sleepQuiet(1); continue; }
            Optional<Record<I>> opt = source.poll();
            if (opt.isEmpty()) {
                if (source.isFinished()) break;
                sleepQuiet(1);
                continue;
            }
            inMeter.mark();
            Record<I> in = opt.get();
            inflight.incrementAndGet();
            count++;
            workerPool.submit(() -> process(in));
        }
        if (cancelled.get()) return;
        while (inflight.get() > 0 && !cancelled.get()) { sleepQuiet(1); }
        offerQuiet(Slot.end(count));
    }

    private void process(Record<I> in) {
        Slot<O> slot;
        try (Timer.Context ignored = transformTimer.time()) {
            O out = transform.apply(in);
            slot = Slot.of(in.seq(), out);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            inflight.decrementAndGet();
            return;
        } catch (Exception e) {
            errorMeter.mark();
            failures.add(new Failure(in.seq(), "transform", e));
            log.warn("transform failed for seq={}: {}", in.seq(), e.toString());
            slot = Slot.skipped(in.seq());
        }
        try {
            queue.put(slot);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } finally {
            inflight.decrementAndGet();
        }
    }

    private void runSink() {
        long expectedSeq = 0;
        TreeMap<Long, Slot<O>> pending = new TreeMap<>();
        try {
            while (true) {
                Slot<O> slot = queue.take();
                if (slot.isEnd()) {
                    if (!pending.isEmpty() || expectedSeq != slot.seq) {
                        log.warn("pipeline ended with {} of {} records emitted", expectedSeq, slot.seq);
                    }
                    return;
                }
                pending.put(slot.seq, slot);
                Slot<O> ready;
                while ((ready = pending.remove(expectedSeq)) != null) {
                    if (!ready.skipped) emit(new Record<>(ready.seq, ready.payload));
                    expectedSeq++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void emit(Record<O> record) {
        try {
            sink.accept(record);
            outMeter.mark();
        } catch (Exception e) {
            errorMeter.mark();
            failures.add(new Failure(record.seq(), "sink", e));
            log.warn("sink failed for seq={}: {}", record.seq(), e.toString());
        }
    }

    private void offerQuiet(Slot<O> slot) {
        try {
            queue.put(slot);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuiet(long millis) {
        try { Thread.sleep(millis); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    /**
     * Abandons in-flight work. Outputs not yet emitted are dropped; whatever the sink already received
     * stays as it was.
     */
    @Override
    public void close() {
        if (!cancelled.compareAndSet(false, true)) return;
        running.set(false);
        workerPool.shutdownNow();
        Thread st = srcThread;
        Thread kt = sinkThread;
        if (st != null) st.interrupt();
        if (kt != null) kt.interrupt();
    }

    static final class Slot<T> {
        final long seq;
        final T payload;
        final boolean skipped;
        private final boolean end;

        private Slot(long seq, T payload, boolean skipped, boolean end) {
            this.seq = seq; this.payload = payload; this.skipped = skipped; this.end = end;
        }
        static <T> Slot<T> of(long seq, T payload) { return new Slot<>(seq, payload, false, false); }
        static <T> Slot<T> skipped(long seq) { return new Slot<>(seq, null, true, false); }
        // seq of the end marker is the number of records the source produced
        static <T> Slot<T> end(long count) { return new Slot<>(count, null, true, true); }
        boolean isEnd() { return end; }
    }
}
