package com.realtime.chatstore.support;

import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * H2(PostgreSQL 모드) 위에서 서비스 전체를 띄운다.
 * 서비스가 자기 트랜잭션을 직접 열기 때문에 테스트 트랜잭션 롤백 대신 매번 테이블을 비운다.
 */
@SpringBootTest
@Import(TestClockConfig.class)
public abstract class StoreIntegrationTest {

    private static final List<String> TABLES = List.of(
            "last_messages", "messages", "participants", "group_conversations", "conversations",
            "friend_requests", "friends", "files", "users");

    @Autowired
    protected UserRepository userRepository;

    @Autowired
    protected JdbcTemplate jdbc;

    @AfterEach
    void wipe() {
        jdbc.execute("SET REFERENTIAL_INTEGRITY FALSE");
        try {
            TABLES.forEach(t -> jdbc.execute("TRUNCATE TABLE " + t));
        } finally {
            jdbc.execute("SET REFERENTIAL_INTEGRITY TRUE");
        }
    }

    /** 작은 정수 id 를 쓰면 부호 있는/없는 UUID 비교 결과가 같아서 기대값을 적기 쉽다 */
    protected static UUID id(long n) {
        return new UUID(0L, n);
    }

    protected User user(long n) {
        return userRepository.saveAndFlush(User.builder()
                .id(id(n))
                .username("user" + n)
                .email("user" + n + "@example.com")
                .displayName("User " + n)
                .passwordHash("hash-" + n)
                .build());
    }

    /**
     * 작업들을 배리어에서 한꺼번에 출발시킨다.
     * 작업 순서대로 반환값 또는 던진 예외를 돌려준다.
     */
    protected List<Object> race(List<Callable<?>> tasks) throws InterruptedException {
        CyclicBarrier start = new CyclicBarrier(tasks.size());
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Callable<?> task : tasks) {
                Callable<Object> guarded = () -> {
                    start.await(10, TimeUnit.SECONDS);
                    try {
                        return task.call();
                    } catch (Exception e) {
                        return e;
                    }
                };
                futures.add(pool.submit(guarded));
            }
            List<Object> outcomes = new ArrayList<>();
            for (Future<Object> f : futures) {
                try {
                    outcomes.add(f.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException | TimeoutException e) {
                    throw new AssertionError("concurrent task did not finish", e);
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }
}
