package io.raggedcsv.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.raggedcsv.core.Record;
import io.raggedcsv.core.Sink;
import io.raggedcsv.core.Source;
import io.raggedcsv.core.Transform;
import io.raggedcsv.error.DeadLetterSink;
import io.raggedcsv.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finite source -> parallel transform -> ordered sink. Each record is transformed independently on a
 * fixed worker pool; the calling thread acts as the single sink thread and releases outputs strictly
 * in seq order. Records that fail in the transform or the sink go to the dead-letter sinks and do not
 * stop the run.
 */
public class Pipeline<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final DeadLetterSink<I> dlqIn;
    private final DeadLetterSink<O> dlqOut;
    private final ExecutorService workerPool;
    private final Semaphore inflight;
    private final LinkedBlockingQueue<Batch<O>> completed = new LinkedBlockingQueue<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    public Pipeline(Source<I> source,
                    Transform<I, O> transform,
                    Sink<O> sink,
                    int workers,
                    int maxInFlight,
                    Metrics metrics,
                    DeadLetterSink<I> dlqIn,
                    DeadLetterSink<O> dlqOut) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        Objects.requireNonNull(metrics);
        this.dlqIn = dlqIn;
        this.dlqOut = dlqOut;
        this.workerPool = Executors.newFixedThreadPool(Math.max(1, workers));
        this.inflight = new Semaphore(Math.max(1, maxInFlight));
        this.transformTimer = metrics.timer("transform.time");
        this.sinkTimer = metrics.timer("sink.time");
        this.inMeter = metrics.meter("input.rate");
        this.outMeter = metrics.meter("output.rate");
        this.errorMeter = metrics.meter("error.rate");
    }

    /**
     * Drains the source and blocks until every record has reached the sink or a dead-letter sink.
     * A pipeline runs once.
     */
    public RunSummary run() throws InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("pipeline has already run");
        }
        Thread pump = new Thread(this::runSource, "pipeline-source");
        pump.start();
        try {
            return runSink();
        } finally {
            pump.join();
            workerPool.shutdown();
        }
    }

    private void runSource() {
        long submitted = 0;
        try {
            while (true) {
                Optional<Record<I>> next = source.poll();
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    continue;
                }
                Record<I> in = next.get();
                inflight.acquire();
                inMeter.mark();
                submitted++;
                workerPool.submit(() -> process(in));
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Source failed after {} records; remaining input is skipped", submitted, e);
        } finally {
            completed.add(Batch.endOfInput(submitted));
        }
    }

    private void process(Record<I> in) {
        boolean posted = false;
        try (Timer.Context ignored = transformTimer.time()) {
            Record<O> out = transform.apply(in);
            completed.add(Batch.of(in.seq(), out));
            posted = true;
        } catch (Exception e) {
            errorMeter.mark();
            log.debug("Transform failed for seq {}", in.seq(), e);
            if (dlqIn != null) dlqIn.acceptFailure(DeadLetterSink.Stage.TRANSFORM, in, e);
            completed.add(Batch.failed(in.seq()));
            posted = true;
        } finally {
            // an Error skips both branches; the sink still has to hear about this seq
            if (!posted) {
                errorMeter.mark();
                log.error("Transform aborted for seq {}; counted as failed", in.seq());
                completed.add(Batch.failed(in.seq()));
            }
            inflight.release();
        }
    }

    private RunSummary runSink() throws InterruptedException {
        TreeMap<Long, Batch<O>> pending = new TreeMap<>();
        long expectedSeq = 0;
        long total = -1;
        long written = 0;
        long failed = 0;
        while (total < 0 || expectedSeq < total) {
            Batch<O> batch = completed.take();
            if (batch.endOfInput) {
                total = batch.seq;
                continue;
            }
            pending.put(batch.seq, batch);
            Batch<O> ready;
            while ((ready = pending.remove(expectedSeq)) != null) {
                if (ready.output == null) {
                    failed++;
                } else if (emit(ready.output)) {
                    written++;
                } else {
                    failed++;
                }
                expectedSeq++;
            }
        }
        return new RunSummary(total, written, failed);
    }

    private boolean emit(Record<O> out) {
        try (Timer.Context ignored = sinkTimer.time()) {
            sink.accept(out);
            outMeter.mark();
            return true;
        } catch (Exception e) {
            errorMeter.mark();
            log.debug("Sink failed for seq {}", out.seq(), e);
            if (dlqOut != null) dlqOut.acceptFailure(DeadLetterSink.Stage.SINK, out, e);
            return false;
        }
    }

    @Override
    public void close() {
        workerPool.shutdownNow();
        source.close();
        sink.close();
        try {
            if (dlqIn != null) dlqIn.close();
            if (dlqOut != null && dlqOut != (Object) dlqIn) dlqOut.close();
        } catch (Exception e) {
            log.warn("Closing dead-letter sinks failed", e);
        }
    }

    /** Outcome of one run: records pulled from the source, written by the sink, and dead-lettered. */
    public record RunSummary(long total, long written, long failed) {
        public boolean allSucceeded() { return failed == 0; }
    }

    static final class Batch<T> {
        final long seq;
        final Record<T> output;
        final boolean endOfInput;

        private Batch(long seq, Record<T> output, boolean endOfInput) {
            this.seq = seq; this.output = output; this.endOfInput = endOfInput;
        }
        static <T> Batch<T> of(long seq, Record<T> output) { return new Batch<>(seq, Objects.requireNonNull(output, "transform output"), false); }
        static <T> Batch<T> failed(long seq) { return new Batch<>(seq, null, false); }
        static <T> Batch<T> endOfInput(long count) { return new Batch<>(count, null, true); }
    }
}
