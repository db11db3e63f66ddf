package com.example.podcast_backend.service;

import com.example.podcast_backend.config.CommitRetryProperties;
import com.example.podcast_backend.exception.CommitExhaustedException;
import com.example.podcast_backend.exception.RetriesExhaustedException;
import com.example.podcast_backend.util.BoundedRetry;
import com.example.podcast_backend.util.RetryPolicy;
import com.example.podcast_backend.util.TransientDataErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction with bounded retry on transient connectivity errors.
 *
 * <p>Every attempt is a fresh {@code REQUIRES_NEW} transaction. A failing attempt is rolled back by
 * the transaction manager before the exception leaves the template, so the connection goes back to
 * the pool without an open transaction. The unit of work must therefore be safe to run again:
 * re-read the entity, check its state, then write.
 */
@Service
public class DurableCommitService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DurableCommitService.class);

    private final TransactionTemplate transactionTemplate;
    private final RetryPolicy intermediatePolicy;
    private final RetryPolicy terminalPolicy;

    public DurableCommitService(PlatformTransactionManager transactionManager, CommitRetryProperties properties) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.intermediatePolicy = properties.getIntermediate().toPolicy();
        this.terminalPolicy = properties.getTerminal().toPolicy();
    }

    /**
     * Intermediate state writes (claiming a job, moving it to PROCESSING).
     */
    public <T> T commitIntermediate(String label, Supplier<T> work) {
        return commit(label, intermediatePolicy, work);
    }

    /**
     * The write that puts a job in its terminal state. Uses the larger retry budget.
     *
     * @throws CommitExhaustedException when every attempt failed transiently
     */
    public <T> T commitTerminal(String label, Supplier<T> work) {
        return commit(label, terminalPolicy, work);
    }

    /**
     * Single attempt, used for the last best-effort ERROR write after a terminal commit gave up.
     */
    public <T> T commitOnce(String label, Supplier<T> work) {
        return commit(label, RetryPolicy.once(), work);
    }

    private <T> T commit(String label, RetryPolicy policy, Supplier<T> work) {
        try {
            return BoundedRetry.run("commit " + label, policy, TransientDataErrors::isTransient,
                    () -> transactionTemplate.execute(status -> work.get()));
        } catch (RetriesExhaustedException e) {
            LOGGER.error("COMMIT EXHAUSTED label={} attempts={} cause={}", label, e.getAttempts(), String.valueOf(e.getCause()));
            throw new CommitExhaustedException(label, e.getAttempts(), e.getCause());
        } catch (RuntimeException e) {
            if (policy.maxAttempts() == 1 && TransientDataErrors.isTransient(e)) {
                LOGGER.error("COMMIT FAILED label={} attempts=1 cause={}", label, e.toString());
                throw new CommitExhaustedException(label, 1, e);
            }
            throw e;
        }
    }
}
