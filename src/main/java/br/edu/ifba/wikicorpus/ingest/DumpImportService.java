package br.edu.ifba.wikicorpus.ingest;

import br.edu.ifba.wikicorpus.exception.ArticleValidationException;
import br.edu.ifba.wikicorpus.exception.DumpStreamException;
import br.edu.ifba.wikicorpus.parser.Article;
import br.edu.ifba.wikicorpus.parser.ArticleValidator;
import br.edu.ifba.wikicorpus.parser.DumpSource;
import br.edu.ifba.wikicorpus.parser.DumpStreamParser;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * End-to-end import of a dump file: open, parse, validate, then hand the
 * collected batch to the {@link ParallelIngestionCoordinator}.
 *
 * <p>Invalid records, including a title seen twice in the same dump, are
 * handled according to the configured {@link InvalidRecordPolicy}. Stream
 * errors always abort before anything is written.</p>
 */
@ApplicationScoped
public class DumpImportService {

    private static final Logger LOG = Logger.getLogger(DumpImportService.class);

    private final ParallelIngestionCoordinator coordinator;
    private final InvalidRecordPolicy policy;
    private final Clock clock;

    @Inject
    public DumpImportService(ParallelIngestionCoordinator coordinator, IngestionConfig config) {
        this(coordinator, config.invalidRecordPolicy(), Clock.systemUTC());
    }

    public DumpImportService(@NotNull ParallelIngestionCoordinator coordinator, @NotNull InvalidRecordPolicy policy,
            @NotNull Clock clock) {
        this.coordinator = coordinator;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * Imports a plain or gzip-compressed dump file.
     *
     * @throws DumpStreamException on unreadable or malformed input
     * @throws ArticleValidationException under {@link InvalidRecordPolicy#ABORT}
     * @throws br.edu.ifba.wikicorpus.exception.CorpusStoreException if writing fails
     */
    public ImportReport importDump(@NotNull Path dump) {
        LOG.infof("Importing dump %s (invalid records: %s)", dump, policy);
        try (InputStream in = DumpSource.open(dump)) {
            return importDump(in);
        } catch (IOException e) {
            throw new DumpStreamException("Failed to read dump " + dump, e);
        }
    }

    public ImportReport importDump(@NotNull InputStream in) {
        Instant started = clock.instant();
        List<Article> accepted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();

        DumpStreamParser parser = new DumpStreamParser(clock);
        long parsed = parser.parse(in, article -> {
            try {
                ArticleValidator.validate(article);
                if (!seenTitles.add(article.title())) {
                    throw new ArticleValidationException(article.title(), "duplicate title in dump");
                }
                accepted.add(article);
            } catch (ArticleValidationException e) {
                if (policy == InvalidRecordPolicy.ABORT) {
                    throw e;
                }
                LOG.warnf("Skipping record: %s", e.getMessage());
                skipped.add(e.getTitle());
            }
        });

        long imported = coordinator.importAll(accepted);
        Duration elapsed = Duration.between(started, clock.instant());
        LOG.infof("Import finished: %d parsed, %d imported, %d skipped in %s",
            parsed, imported, skipped.size(), elapsed);
        return new ImportReport(parsed, imported, skipped, parser.getMetadata(), elapsed);
    }
}
