package com.astrazeneca.fusac.modes;

import com.astrazeneca.fusac.data.AnnotatedRecord;
import com.astrazeneca.fusac.data.ReadSource;
import com.astrazeneca.fusac.data.SamView;
import com.astrazeneca.fusac.data.VariantSite;
import com.astrazeneca.fusac.data.scopedata.Scope;
import com.astrazeneca.fusac.exception.UnsupportedVariantShapeException;
import com.astrazeneca.fusac.modules.*;
import com.astrazeneca.fusac.postprocessmodules.RecordAnnotator;
import com.astrazeneca.fusac.printers.VariantPrinter;
import htsjdk.variant.variantcontext.VariantContext;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;
import static com.astrazeneca.fusac.data.scopedata.GlobalReadOnlyScope.instance;

/**
 * Abstract Mode of FUSAC. Provide interfaces for possible modes (not-parallel and parallel) and the record pipeline.
 */
public abstract class AbstractMode {
    /**
     * CompletableFuture which used to signal the writer that it was the last Future in the queue.
     */
    final static CompletableFuture<AnnotatedRecord> LAST_SIGNAL_FUTURE = CompletableFuture.completedFuture(null);

    protected final Iterable<VariantContext> records;
    protected final ReadSource readSource;
    protected final VariantPrinter variantPrinter;

    public AbstractMode(Iterable<VariantContext> records, ReadSource readSource, VariantPrinter variantPrinter) {
        this.records = records;
        this.readSource = readSource;
        this.variantPrinter = variantPrinter;
    }

    /**
     * Starts the pipeline on the variant site: fetches reads, groups them into molecules, classifies molecules,
     * aggregates allele support and annotates the record.
     * @param initialScope scope with record and its site
     * @param executor current Executor for parallel/single mode
     * @return future of annotated record. If pipeline fails, the record is returned unannotated.
     */
    public CompletableFuture<AnnotatedRecord> pipeline(Scope<VariantSite> initialScope, Executor executor) {
        return CompletableFuture.supplyAsync(
                () -> new SamFileParser(readSource).process(initialScope), executor)
                .thenApply(new MoleculeGrouper()::process)
                .thenApply(new StrandClassifier()::process)
                .thenApply(new PositionAggregator()::process)
                .thenApply(new RecordAnnotator())
                .exceptionally(ex -> {
                    printExceptionAndContinue(asException(ex), "record", initialScope.site.printSite(),
                            initialScope.site);
                    return AnnotatedRecord.unannotated(initialScope.record);
                });
    }

    /**
     * Processes one record. Records that are not single nucleotide substitutions pass through unannotated.
     * @param record variant record
     * @param executor current Executor for parallel/single mode
     * @return record ready to be written
     */
    AnnotatedRecord processRecord(VariantContext record, Executor executor) {
        VariantSite site;
        try {
            site = VariantSite.of(record);
        } catch (UnsupportedVariantShapeException ex) {
            printExceptionAndContinue(ex, "record", record.getContig() + ":" + record.getStart(), null);
            return AnnotatedRecord.unannotated(record);
        }
        return pipeline(new Scope<>(record, site, site), executor).join();
    }

    private static Exception asException(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        return cause instanceof Exception ? (Exception) cause : new RuntimeException(cause);
    }

    public abstract void notParallel();

    public void parallel() {
        createParallelMode().process();
    }

    protected abstract AbstractParallelMode createParallelMode();

    /**
     * Abstract class for parallel modes of FUSAC. Initializes executor, starts tasks and prints the records.
     * The tasks producer must be overriding in the childs. The calling thread is the only writer: it takes
     * futures from the queue in order of submission until the last signal.
     */
    protected abstract class AbstractParallelMode {
        final ExecutorService executor = Executors.newFixedThreadPool(instance().conf.threads);
        final ExecutorService producer = Executors.newSingleThreadExecutor();
        final BlockingQueue<Future<AnnotatedRecord>> toPrint = new LinkedBlockingQueue<>(instance().conf.queueSize);

        void process() {
            Future<?> production = producer.submit(() -> {
                try {
                    produceTasks();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException(e);
                } finally {
                    signalLast();
                }
            });
            try {
                while (true) {
                    Future<AnnotatedRecord> wrk = toPrint.take();
                    if (wrk == LAST_SIGNAL_FUTURE) {
                        break;
                    }
                    variantPrinter.print(wrk.get());
                }
                // the last signal is also sent when reading of records failed
                production.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                throw cause instanceof RuntimeException ? (RuntimeException) cause : new RuntimeException(cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException(e);
            } finally {
                producer.shutdownNow();
                closeReaders();
                executor.shutdown();
            }
        }

        /**
         * Closes BAM readers opened by the workers. One closing task runs in each thread of the pool: every task
         * waits until all of them are started, so no thread can take two of them.
         */
        private void closeReaders() {
            int threads = instance().conf.threads;
            CountDownLatch allStarted = new CountDownLatch(threads);
            Callable<Void> closeTask = () -> {
                allStarted.countDown();
                allStarted.await();
                SamView.closeAll();
                return null;
            };
            List<Future<Void>> closing = new ArrayList<>(threads);
            for (int i = 0; i < threads; i++) {
                closing.add(executor.submit(closeTask));
            }
            for (Future<Void> future : closing) {
                try {
                    future.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                } catch (ExecutionException e) {
                    printExceptionAndContinue(asException(e.getCause()), "thread", "pool", null);
                }
            }
        }

        private void signalLast() {
            try {
                toPrint.put(LAST_SIGNAL_FUTURE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        abstract void produceTasks() throws InterruptedException;
    }
}
