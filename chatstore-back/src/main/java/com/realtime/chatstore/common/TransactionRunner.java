package com.realtime.chatstore.common;

import com.realtime.chatstore.common.error.ConflictException;
import com.realtime.chatstore.config.ChatProps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 쓰기 작업 하나를 단일 트랜잭션으로 실행하고, 직렬화 실패/락 실패 시 트랜잭션 전체를 다시 돌린다.
 * 하위 단계만 재시도하는 일은 없다.
 * 유니크/체크 제약 위반은 재시도하지 않고 {@link ConflictException} 으로 바꿔 던진다.
 */
@Slf4j
@Component
public class TransactionRunner {

    private final TransactionTemplate template;
    private final int maxAttempts;

    public TransactionRunner(PlatformTransactionManager txManager, ChatProps props) {
        this.template = new TransactionTemplate(txManager);
        this.maxAttempts = Math.max(1, props.getTxMaxAttempts());
    }

    public <T> T write(String operation, Supplier<T> work) {
        int attempt = 1;
        while (true) {
            try {
                return template.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                if (attempt >= maxAttempts) {
                    log.warn("{} gave up after {} attempts: {}", operation, attempt, e.getMessage());
                    throw e;
                }
                log.warn("{} hit a concurrency failure (attempt {}/{}), retrying", operation, attempt, maxAttempts);
                attempt++;
            } catch (DataIntegrityViolationException e) {
                log.warn("{} violated a constraint: {}", operation, e.getMostSpecificCause().getMessage());
                throw new ConflictException("request conflicts with existing data", e);
            }
        }
    }

    public void run(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }
}
