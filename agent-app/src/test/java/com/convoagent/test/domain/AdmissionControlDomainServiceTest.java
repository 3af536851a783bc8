package com.convoagent.test.domain;

import com.convoagent.domain.admission.model.valobj.AdmissionDecision;
import com.convoagent.domain.admission.model.valobj.RateBudget;
import com.convoagent.domain.admission.service.AdmissionControlDomainService;
import com.convoagent.infrastructure.repository.admission.RateBudgetRepositoryImpl;
import com.convoagent.test.support.MutableClock;
import com.convoagent.types.exception.AdmissionRejectedException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class AdmissionControlDomainServiceTest {

    /** 对齐到 60 秒窗口起点的时间戳 */
    private static final long WINDOW_START = 60_000L * 28_333_334L;

    private MutableClock clock;
    private RateBudgetRepositoryImpl rateBudgetRepository;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.ofEpochMilli(WINDOW_START + 15_000L));
        Cache<String, RateBudget> cache = CacheBuilder.newBuilder().maximumSize(1_000L).build();
        rateBudgetRepository = new RateBudgetRepositoryImpl(cache);
    }

    @Test
    public void shouldRejectCallAboveLimitWithinWindow() {
        AdmissionControlDomainService service = service(true, 3);

        for (int i = 1; i <= 3; i++) {
            AdmissionDecision decision = service.admit("/api/v1/agent/run:user:u-1");
            Assertions.assertTrue(decision.allowed());
            Assertions.assertEquals(i, decision.used());
        }
        AdmissionDecision rejected = service.admit("/api/v1/agent/run:user:u-1");

        Assertions.assertFalse(rejected.allowed());
        Assertions.assertEquals(4L, rejected.used());
        Assertions.assertEquals(45_000L, rejected.retryAfterMillis());
    }

    @Test
    public void shouldAdmitAgainInNextWindow() {
        AdmissionControlDomainService service = service(true, 2);
        service.admit("id");
        service.admit("id");
        Assertions.assertFalse(service.admit("id").allowed());

        clock.advance(Duration.ofSeconds(45));
        AdmissionDecision decision = service.admit("id");

        Assertions.assertTrue(decision.allowed());
        Assertions.assertEquals(1L, decision.used());
    }

    @Test
    public void shouldReportRetryAfterWhenLimitIsOne() {
        AdmissionControlDomainService service = service(true, 1);
        service.admitOrThrow("id", service.defaultLimit());

        AdmissionRejectedException ex = Assertions.assertThrows(AdmissionRejectedException.class,
                () -> service.admitOrThrow("id", service.defaultLimit()));

        Assertions.assertEquals("id", ex.getIdentity());
        Assertions.assertTrue(ex.getRetryAfterMillis() > 0L);
        Assertions.assertEquals(45L, ex.getRetryAfterSeconds());
    }

    @Test
    public void shouldCountIdentitiesIndependently() {
        AdmissionControlDomainService service = service(true, 1);

        Assertions.assertTrue(service.admit("/api/v1/agent/run:user:u-1").allowed());
        Assertions.assertTrue(service.admit("/api/v1/agent/run:user:u-2").allowed());
        Assertions.assertTrue(service.admit("/api/v1/agent/runs:user:u-1").allowed());
        Assertions.assertFalse(service.admit("/api/v1/agent/run:user:u-1").allowed());
    }

    @Test
    public void shouldAdmitEverythingWhenDisabled() {
        AdmissionControlDomainService service = service(false, 1);

        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(service.admit("id").allowed());
        }
    }

    @Test
    public void shouldAdmitExactlyLimitUnderConcurrency() throws Exception {
        AdmissionControlDomainService service = service(true, 10);
        int callers = 40;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit(() -> {
                    start.await(2, TimeUnit.SECONDS);
                    return service.admit("shared").allowed();
                }));
            }
            start.countDown();
            int allowed = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    allowed++;
                }
            }
            Assertions.assertEquals(10, allowed);
        } finally {
            pool.shutdownNow();
        }
    }

    private AdmissionControlDomainService service(boolean enabled, long limit) {
        return new AdmissionControlDomainService(rateBudgetRepository, clock, enabled, limit, Duration.ofSeconds(60));
    }
}
