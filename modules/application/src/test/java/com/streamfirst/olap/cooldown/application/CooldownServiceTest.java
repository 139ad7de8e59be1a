package com.streamfirst.olap.cooldown.application;

import com.streamfirst.olap.cooldown.adapters.InMemoryTabletMetaStore;
import com.streamfirst.olap.cooldown.domain.CooldownError;
import com.streamfirst.olap.cooldown.domain.CooldownOutcome;
import com.streamfirst.olap.cooldown.domain.Result;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Scheduling of cooldown attempts across tablets: policy filtering, one attempt per
 * tablet at a time and back-off after retryable failures.
 */
@Slf4j
class CooldownServiceTest {

    private static final long REPLICA_ID = 10001L;
    private static final byte[] SEGMENT = "service segment".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path localRoot;

    private ScriptedRemoteBackend backend;
    private CooldownTestFixture fixture;
    private CooldownService service;

    @BeforeEach
    void setUp() {
        backend = new ScriptedRemoteBackend(CooldownTestFixture.RESOURCE_ID);
        CooldownOptions options = new CooldownOptions(Duration.ZERO, 2, Duration.ofSeconds(10), Duration.ofSeconds(30));
        fixture = new CooldownTestFixture(localRoot, CooldownTestFixture.registryWith(backend),
            new InMemoryTabletMetaStore(), options, new MutableClock(CooldownTestFixture.START));
        service = new CooldownService(fixture.tabletManager, options, fixture.clock);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        service.close();
    }

    @Test
    void onlyTabletsWithAPolicyAreScheduled() throws Exception {
        Tablet cooled = ownedTablet(1L);
        Tablet localOnly = fixture.createTabletWithData(2L, REPLICA_ID, SEGMENT);
        localOnly.updateCooldownConf(1, REPLICA_ID);

        List<CompletableFuture<Result<CooldownOutcome>>> futures = service.cooldownAll();

        assertThat(futures).hasSize(1);
        assertThat(futures.get(0).get(10, TimeUnit.SECONDS).orElseThrow()).isEqualTo(CooldownOutcome.UPLOADED);
        assertThat(cooled.rowsetMetas().get(0).isLocal()).isFalse();
        assertThat(localOnly.rowsetMetas()).allMatch(rowset -> rowset.isLocal());
    }

    @Test
    void tabletIsNotSubmittedTwiceWhileRunning() throws Exception {
        Tablet tablet = ownedTablet(1L);
        tablet.cooldown().orElseThrow();
        CountDownLatch uploading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        backend.beforeEachUpload(() -> {
            uploading.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        CompletableFuture<Result<CooldownOutcome>> first = service.submit(tablet);
        assertThat(uploading.await(10, TimeUnit.SECONDS)).isTrue();
        Result<CooldownOutcome> second = service.submit(tablet).get(10, TimeUnit.SECONDS);

        assertThat(second.orElseThrow()).isEqualTo(CooldownOutcome.IN_PROGRESS);
        release.countDown();
        assertThat(first.get(10, TimeUnit.SECONDS).orElseThrow()).isEqualTo(CooldownOutcome.UPLOADED);
    }

    @Test
    void retryableFailureBacksOffWithGrowingDelay() throws Exception {
        Tablet tablet = ownedTablet(1L);
        tablet.setStoragePolicyId(999L);

        Result<CooldownOutcome> failed = service.submit(tablet).get(10, TimeUnit.SECONDS);
        assertThat(failed.hasError(CooldownError.CONFIGURATION_ERROR)).isTrue();
        assertThat(service.nextAttemptAt(1L)).contains(CooldownTestFixture.START.plusSeconds(10));

        assertThat(service.cooldownAll()).isEmpty();

        fixture.clock.advance(Duration.ofSeconds(10));
        List<CompletableFuture<Result<CooldownOutcome>>> retried = service.cooldownAll();
        assertThat(retried).hasSize(1);
        retried.get(0).get(10, TimeUnit.SECONDS);
        assertThat(service.nextAttemptAt(1L)).contains(CooldownTestFixture.START.plusSeconds(10 + 20));

        fixture.clock.advance(Duration.ofSeconds(20));
        service.cooldownAll().get(0).get(10, TimeUnit.SECONDS);
        // capped at the maximum back-off
        assertThat(service.nextAttemptAt(1L)).contains(CooldownTestFixture.START.plusSeconds(30 + 30));
    }

    @Test
    void successClearsBackOff() throws Exception {
        Tablet tablet = ownedTablet(1L);
        tablet.setStoragePolicyId(999L);
        service.submit(tablet).get(10, TimeUnit.SECONDS);
        assertThat(service.nextAttemptAt(1L)).isPresent();

        tablet.setStoragePolicyId(CooldownTestFixture.POLICY_ID);
        assertThat(service.submit(tablet).get(10, TimeUnit.SECONDS).orElseThrow())
            .isEqualTo(CooldownOutcome.UPLOADED);
        assertThat(service.nextAttemptAt(1L)).isEmpty();
    }

    @Test
    void missingLeaseDoesNotBackOff() throws Exception {
        Tablet tablet = fixture.createTabletWithData(1L, REPLICA_ID, SEGMENT);
        tablet.setStoragePolicyId(CooldownTestFixture.POLICY_ID);

        Result<CooldownOutcome> result = service.submit(tablet).get(10, TimeUnit.SECONDS);

        assertThat(result.hasError(CooldownError.NOT_COOLDOWN_OWNER)).isTrue();
        assertThat(service.nextAttemptAt(1L)).isEmpty();
    }

    private Tablet ownedTablet(long tabletId) throws Exception {
        Tablet tablet = fixture.createTabletWithData(tabletId, REPLICA_ID, SEGMENT);
        tablet.setStoragePolicyId(CooldownTestFixture.POLICY_ID);
        tablet.updateCooldownConf(1, REPLICA_ID);
        return tablet;
    }
}
