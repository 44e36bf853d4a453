package br.edu.ifba.wikicorpus.ingest;

import br.edu.ifba.wikicorpus.parser.DumpMetadata;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one dump import.
 *
 * @param parsed articles read from the dump
 * @param imported articles committed to the corpus
 * @param skippedTitles titles dropped by the {@link InvalidRecordPolicy#SKIP} policy, in dump order
 * @param metadata dump header information
 * @param elapsed wall-clock duration of the import
 */
public record ImportReport(long parsed, long imported, List<String> skippedTitles, DumpMetadata metadata,
        Duration elapsed) {

    public ImportReport {
        skippedTitles = skippedTitles == null ? List.of() : List.copyOf(skippedTitles);
    }

    public long skipped() {
        return skippedTitles.size();
    }
}
