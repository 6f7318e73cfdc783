package com.logvault.observability;

import com.logvault.domain.IngestionCancelledException;
import com.logvault.domain.LogQuery;
import com.logvault.domain.RunSummary;
import com.logvault.query.ratelimit.RateLimitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Default listener: one structured log line per event, and the matching metric.
 */
@Component
public class LoggingIngestionEventListener implements IngestionEventListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingIngestionEventListener.class);

    private final IngestionMetrics metrics;

    public LoggingIngestionEventListener(IngestionMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onSubmit(LogQuery query) {
        metrics.recordQuerySubmitted();
        logger.info("query_submit region={} log_key={} from={} to={} filtered={}",
            query.getRegion().getCode(), query.getLogKey(), query.getFrom(), query.getTo(), query.hasFilter());
    }

    @Override
    public void onPollAttempt(LogQuery query, int attempt, Duration delay, Duration elapsed) {
        metrics.recordPollAttempt();
        logger.info("query_poll region={} log_key={} attempt={} delay_ms={} elapsed_ms={}",
            query.getRegion().getCode(), query.getLogKey(), attempt, delay.toMillis(), elapsed.toMillis());
    }

    @Override
    public void onPageFetched(LogQuery query, int pageIndex, int recordCount, Duration elapsed) {
        metrics.recordPageFetched(recordCount);
        logger.info("page_fetched region={} log_key={} page_index={} records={} elapsed_ms={}",
            query.getRegion().getCode(), query.getLogKey(), pageIndex, recordCount, elapsed.toMillis());
    }

    @Override
    public void onRateLimited(LogQuery query, RateLimitSignal signal, int throttledResponses) {
        metrics.recordRateLimited(signal.getWaitSeconds());
        logger.warn("rate_limited region={} log_key={} wait_seconds={} source={} throttled_responses={}",
            query.getRegion().getCode(), query.getLogKey(), signal.getWaitSeconds(),
            signal.getSource().getLabel(), throttledResponses);
    }

    @Override
    public void onTransientRetry(LogQuery query, int attempt, Duration wait, Throwable cause) {
        metrics.recordTransientRetry();
        logger.warn("transient_retry region={} log_key={} attempt={} wait_ms={} error={}",
            query.getRegion().getCode(), query.getLogKey(), attempt, wait.toMillis(), cause.getMessage());
    }

    @Override
    public void onRunComplete(LogQuery query, RunSummary summary) {
        metrics.recordRunCompleted(summary.getRecordsWritten(), summary.getElapsed());
        logger.info("run_complete region={} log_key={} pages={} records={} files={} duplicates_dropped={} elapsed_ms={}",
            query.getRegion().getCode(), query.getLogKey(), summary.getPagesFetched(), summary.getRecordsWritten(),
            summary.getOutputFiles().size(), summary.getDuplicatesDropped(), summary.getElapsed().toMillis());
    }

    @Override
    public void onRunFailed(LogQuery query, Throwable error, Duration elapsed) {
        if (error instanceof IngestionCancelledException) {
            metrics.recordRunCancelled(elapsed);
            logger.warn("run_cancelled region={} log_key={} elapsed_ms={} reason={}",
                query.getRegion().getCode(), query.getLogKey(), elapsed.toMillis(), error.getMessage());
            return;
        }
        metrics.recordRunFailed(elapsed);
        logger.error("run_failed region={} log_key={} elapsed_ms={} error_type={} error={}",
            query.getRegion().getCode(), query.getLogKey(), elapsed.toMillis(),
            error.getClass().getSimpleName(), error.getMessage());
    }
}
