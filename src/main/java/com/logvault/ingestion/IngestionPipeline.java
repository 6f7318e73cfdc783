package com.logvault.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.logvault.config.IngestionProperties;
import com.logvault.domain.CancellationSignal;
import com.logvault.domain.LogQuery;
import com.logvault.domain.RunSummary;
import com.logvault.observability.IngestionEventListener;
import com.logvault.query.CompletionToken;
import com.logvault.query.LogSearchTransport;
import com.logvault.query.PageSequence;
import com.logvault.query.QueryEngine;
import com.logvault.query.QueryHandle;
import com.logvault.query.ResultPage;
import com.logvault.query.Sleeper;
import com.logvault.storage.ColumnarSink;
import com.logvault.storage.SinkHandle;
import com.logvault.storage.parquet.ParquetColumnarSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Pulls one query's result pages and writes them to a columnar sink, page by page.
 *
 * The sink is opened before anything is fetched. On any failure the pipeline stops pulling
 * pages, closes the sink so already accepted records are flushed, and rethrows the original error.
 */
@Service
public class IngestionPipeline {
    private static final Logger logger = LoggerFactory.getLogger(IngestionPipeline.class);

    private static final String TIMESTAMP_FIELD = "timestamp";

    private final LogSearchTransport transport;
    private final ObjectMapper objectMapper;
    private final IngestionEventListener listener;
    private final IngestionProperties defaultProperties;
    private final Sleeper sleeper;
    private final Clock clock;

    @Autowired
    public IngestionPipeline(LogSearchTransport transport,
                             ObjectMapper objectMapper,
                             IngestionEventListener listener,
                             IngestionProperties properties) {
        this(transport, objectMapper, listener, properties, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public IngestionPipeline(LogSearchTransport transport,
                             ObjectMapper objectMapper,
                             IngestionEventListener listener,
                             IngestionProperties properties,
                             Sleeper sleeper,
                             Clock clock) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.listener = listener;
        this.defaultProperties = properties;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * Run with the application's configured settings.
     */
    public RunSummary run(LogQuery query, Path destination) {
        return run(query, destination, defaultProperties, new CancellationSignal());
    }

    public RunSummary run(LogQuery query, Path destination, IngestionProperties properties,
                          CancellationSignal cancellation) {
        properties.validate();
        Instant started = clock.instant();
        logger.info("Starting ingestion of log {} ({}) into {}", query.getLogKey(), query.getRegion().getCode(), destination);

        try {
            ColumnarSink sink = createSink(properties.getSink());
            SinkHandle sinkHandle = sink.open(destination);
            EventDeduplicator deduplicator = new EventDeduplicator(properties.getSink().isDedupeEvents());

            int pagesFetched = 0;
            long rawEvents = 0;
            Long minTimestamp = null;
            Long maxTimestamp = null;

            try (sinkHandle) {
                QueryEngine engine = new QueryEngine(transport, properties, objectMapper, sleeper, clock,
                    listener, cancellation);
                QueryHandle handle = engine.submit(query);
                CompletionToken token = engine.pollToCompletion(handle);
                PageSequence pages = engine.pages(token);

                while (pages.hasNext()) {
                    ResultPage page = pages.next();
                    pagesFetched++;
                    rawEvents += page.size();

                    List<ObjectNode> records = deduplicator.filter(page.getRecords());
                    for (ObjectNode record : records) {
                        JsonNode ts = record.get(TIMESTAMP_FIELD);
                        if (ts != null && ts.isNumber()) {
                            long value = ts.longValue();
                            minTimestamp = minTimestamp == null ? value : Math.min(minTimestamp, value);
                            maxTimestamp = maxTimestamp == null ? value : Math.max(maxTimestamp, value);
                        }
                    }
                    sinkHandle.append(records);
                }
            }

            RunSummary summary = new RunSummary(pagesFetched, sinkHandle.getRecordsFlushed(),
                sinkHandle.getOutputFiles(), rawEvents, deduplicator.getDuplicatesDropped(),
                minTimestamp, maxTimestamp, Duration.between(started, clock.instant()));
            listener.onRunComplete(query, summary);
            return summary;
        } catch (RuntimeException e) {
            listener.onRunFailed(query, e, Duration.between(started, clock.instant()));
            throw e;
        }
    }

    protected ColumnarSink createSink(IngestionProperties.Sink settings) {
        return new ParquetColumnarSink(settings);
    }
}
