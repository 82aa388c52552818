package com.astrazeneca.fusac.modes;

import com.astrazeneca.fusac.collection.DirectThreadExecutor;
import com.astrazeneca.fusac.data.AnnotatedRecord;
import com.astrazeneca.fusac.data.ReadSource;
import com.astrazeneca.fusac.printers.VariantPrinter;
import htsjdk.variant.variantcontext.VariantContext;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;

/**
 * Mode annotating each variant record of the VCF with molecular support and FFPE filter.
 */
public class AnnotationMode extends AbstractMode {

    public AnnotationMode(Iterable<VariantContext> records, ReadSource readSource, VariantPrinter variantPrinter) {
        super(records, readSource, variantPrinter);
    }

    /**
     * In not parallel mode each record will be processed and written in sequence.
     */
    @Override
    public void notParallel() {
        for (VariantContext record : records) {
            variantPrinter.print(new AnnotationWorker(record).call());
        }
    }

    /**
     * In parallel mode workers are created for each record and are processed in parallel.
     */
    @Override
    protected AbstractParallelMode createParallelMode() {
        return new AbstractParallelMode() {
            @Override
            void produceTasks() throws InterruptedException {
                for (VariantContext record : records) {
                    Future<AnnotatedRecord> submit = executor.submit(new AnnotationWorker(record));
                    toPrint.put(submit);
                }
            }
        };
    }

    /**
     * Each worker will process pipeline for one record. Failures of the record never reach the writer:
     * the record is returned unannotated.
     */
    private class AnnotationWorker implements Callable<AnnotatedRecord> {
        private final VariantContext record;

        AnnotationWorker(VariantContext record) {
            this.record = record;
        }

        @Override
        public AnnotatedRecord call() {
            try {
                return processRecord(record, new DirectThreadExecutor());
            } catch (RuntimeException ex) {
                printExceptionAndContinue(ex, "record", record.getContig() + ":" + record.getStart(), null);
                return AnnotatedRecord.unannotated(record);
            }
        }
    }
}
