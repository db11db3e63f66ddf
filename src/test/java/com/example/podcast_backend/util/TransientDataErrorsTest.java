package com.example.podcast_backend.util;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class TransientDataErrorsTest {

    @Test
    void connectionLevelErrorsAreTransient() {
        assertThat(TransientDataErrors.isTransient(new CannotCreateTransactionException("pool empty"))).isTrue();
        assertThat(TransientDataErrors.isTransient(new QueryTimeoutException("slow"))).isTrue();
    }

    @Test
    void sqlStateClass08DeepInTheCauseChainIsTransient() {
        RuntimeException wrapped = new RuntimeException("flush failed",
                new IllegalStateException("jdbc", new SQLException("gone", "08006")));

        assertThat(TransientDataErrors.isTransient(wrapped)).isTrue();
    }

    @Test
    void driverMessageAboutDroppedConnectionIsTransient() {
        assertThat(TransientDataErrors.isTransient(new RuntimeException("I/O: Connection reset by peer"))).isTrue();
    }

    @Test
    void constraintViolationsAreNotTransient() {
        assertThat(TransientDataErrors.isTransient(new DataIntegrityViolationException("duplicate key"))).isFalse();
        assertThat(TransientDataErrors.isTransient(new IllegalStateException("bad state"))).isFalse();
        assertThat(TransientDataErrors.isTransient(null)).isFalse();
    }
}
