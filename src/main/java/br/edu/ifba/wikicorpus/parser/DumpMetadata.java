package br.edu.ifba.wikicorpus.parser;

import java.time.Instant;

/**
 * Header information of a dump, read from its optional {@code siteinfo} block.
 * Fields the dump does not provide are {@code null}.
 */
public record DumpMetadata(
        String siteName,
        String generator,
        String language,
        Instant dumpDate,
        long articleCount) {

    public static DumpMetadata empty() {
        return new DumpMetadata(null, null, null, null, 0L);
    }

    public DumpMetadata withArticleCount(final long count) {
        return new DumpMetadata(siteName, generator, language, dumpDate, count);
    }
}
