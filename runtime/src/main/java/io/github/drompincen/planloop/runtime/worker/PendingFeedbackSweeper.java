package io.github.drompincen.planloop.runtime.worker;

import io.github.drompincen.planloop.persistence.document.FeedbackDocument;
import io.github.drompincen.planloop.persistence.repository.FeedbackRepository;
import io.github.drompincen.planloop.protocol.api.FeedbackStatus;
import io.github.drompincen.planloop.runtime.config.PlanloopProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Re-dispatches feedback that has sat PENDING longer than the grace period, e.g. after a
 * restart dropped the in-memory queue. Double dispatch is harmless since the pipeline
 * claims the row before doing anything.
 */
@Component
public class PendingFeedbackSweeper {

    private static final Logger log = LoggerFactory.getLogger(PendingFeedbackSweeper.class);

    private final FeedbackRepository feedbackRepository;
    private final PipelineDispatcher dispatcher;
    private final PlanloopProperties properties;
    private final Clock clock;

    public PendingFeedbackSweeper(FeedbackRepository feedbackRepository, PipelineDispatcher dispatcher,
                                  PlanloopProperties properties, Clock clock) {
        this.feedbackRepository = feedbackRepository;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${planloop.worker.sweep-interval-ms:60000}",
            initialDelayString = "${planloop.worker.sweep-interval-ms:60000}")
    public void sweep() {
        redispatchStale();
    }

    public int redispatchStale() {
        Instant cutoff = clock.instant().minus(properties.getWorker().getPendingGrace());
        List<FeedbackDocument> stale = feedbackRepository.findByStatusAndCreatedAtBefore(FeedbackStatus.PENDING, cutoff);
        int dispatched = 0;
        for (FeedbackDocument feedback : stale) {
            if (dispatcher.dispatchFeedback(feedback.getFeedbackId())) {
                dispatched++;
            }
        }
        if (!stale.isEmpty()) {
            log.info("Re-dispatched {} of {} stale pending feedback item(s)", dispatched, stale.size());
        }
        return dispatched;
    }
}
