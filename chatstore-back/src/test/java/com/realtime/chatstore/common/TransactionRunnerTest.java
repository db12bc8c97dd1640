package com.realtime.chatstore.common;

import com.realtime.chatstore.common.error.ConflictException;
import com.realtime.chatstore.config.ChatProps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TransactionRunnerTest {

    private PlatformTransactionManager txManager;
    private TransactionRunner runner;

    @BeforeEach
    void setUp() {
        txManager = mock(PlatformTransactionManager.class);
        when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        ChatProps props = new ChatProps();
        props.setTxMaxAttempts(3);
        runner = new TransactionRunner(txManager, props);
    }

    @Test
    void retriesWholeTransactionOnLockFailure() {
        AtomicInteger calls = new AtomicInteger();

        String result = runner.write("op", () -> {
            if (calls.incrementAndGet() < 3) throw new CannotAcquireLockException("serialization failure");
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        verify(txManager, times(3)).getTransaction(any());
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> runner.write("op", () -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("deadlock");
        })).isInstanceOf(CannotAcquireLockException.class);

        assertThat(calls).hasValue(3);
    }

    @Test
    void constraintViolationBecomesConflictWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> runner.run("op", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key value violates unique constraint");
        }))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("request conflicts with existing data")
                .hasMessageNotContaining("duplicate key");

        assertThat(calls).hasValue(1);
    }
}
