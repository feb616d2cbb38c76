package io.github.drompincen.planloop.runtime.worker;

import io.github.drompincen.planloop.runtime.feedback.FeedbackProcessingPipeline;
import io.github.drompincen.planloop.runtime.feedback.ProcessingOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands pipeline runs to the worker pool. Each run goes to completion on one worker thread.
 */
@Component
public class PipelineDispatcher {

    private static final Logger log = LoggerFactory.getLogger(PipelineDispatcher.class);

    private final TaskExecutor executor;
    private final FeedbackProcessingPipeline feedbackPipeline;

    public PipelineDispatcher(@Qualifier("pipelineExecutor") TaskExecutor executor,
                              FeedbackProcessingPipeline feedbackPipeline) {
        this.executor = executor;
        this.feedbackPipeline = feedbackPipeline;
    }

    /**
     * Queues processing of a feedback row. Returns false if the pool refused the work; the row
     * stays PENDING and the sweeper picks it up later.
     */
    public boolean dispatchFeedback(String feedbackId) {
        return submit("feedback " + feedbackId, () -> {
            ProcessingOutcome outcome = feedbackPipeline.process(feedbackId);
            log.debug("Feedback {} finished with outcome {}", feedbackId, outcome);
        });
    }

    public boolean submit(String description, Runnable work) {
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (RuntimeException e) {
                    log.error("Pipeline run for {} crashed: {}", description, e.getMessage(), e);
                }
            });
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Worker pool is full, {} not queued: {}", description, e.getMessage());
            return false;
        }
    }
}
