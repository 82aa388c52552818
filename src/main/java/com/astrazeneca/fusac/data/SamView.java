package com.astrazeneca.fusac.data;

import htsjdk.samtools.*;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static com.astrazeneca.fusac.Utils.printExceptionAndContinue;

/**
 * Positional query over a BAM file. Only one reader on the same file is opened per thread, so workers never
 * share a reader.
 */
public class SamView implements AutoCloseable {
    private static ThreadLocal<Map<String, SamReader>> threadLocalSAMReaders = ThreadLocal.withInitial(HashMap::new);
    private static final AtomicInteger openReaders = new AtomicInteger();

    private SAMRecordIterator iterator;
    private int filter;

    /**
     * @param file indexed BAM file
     * @param samfilter flags of records to skip, e.g. 0x900
     * @param contig chromosome name
     * @param start 1-based start, inclusive
     * @param end 1-based end, inclusive
     * @param stringency htsjdk validation stringency
     */
    public SamView(String file, String samfilter, String contig, int start, int end, ValidationStringency stringency) {
        iterator = fetchReader(file, stringency).queryOverlapping(contig, start, end);
        filter = Integer.decode(samfilter);
    }

    /**
     * Read record from BAM file. Skip the records that are filtered with -F filter option.
     * @return next record or null when there are no more records in the region
     */
    public SAMRecord read() {
        while (iterator.hasNext()) {
            SAMRecord record = iterator.next();
            if (filter != 0 && (record.getFlags() & filter) != 0) {
                continue;
            }
            return record;
        }
        return null;
    }

    @Override
    public void close() {
        iterator.close();
    }

    /**
     * Closes the readers opened by the calling thread. Must be called from each thread that read the BAM
     * before the thread is finished.
     */
    public static void closeAll() {
        Map<String, SamReader> readers = threadLocalSAMReaders.get();
        for (Map.Entry<String, SamReader> entry : readers.entrySet()) {
            try {
                entry.getValue().close();
            } catch (IOException e) {
                printExceptionAndContinue(e, "reader", entry.getKey(), null);
            }
            openReaders.decrementAndGet();
        }
        threadLocalSAMReaders.remove();
    }

    /**
     * @return number of readers open in all threads
     */
    public static int openReaders() {
        return openReaders.get();
    }

    private static SamReader fetchReader(String file, ValidationStringency stringency) {
        return threadLocalSAMReaders.get().computeIfAbsent(
                file,
                (f) -> {
                    SamReader reader = SamReaderFactory.makeDefault().validationStringency(stringency)
                            .open(SamInputResource.of(f));
                    openReaders.incrementAndGet();
                    return reader;
                }
        );
    }
}
