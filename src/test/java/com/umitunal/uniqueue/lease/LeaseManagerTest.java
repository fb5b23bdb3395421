package com.umitunal.uniqueue.lease;

import com.umitunal.uniqueue.FlakyJobStore;
import com.umitunal.uniqueue.TestClock;
import com.umitunal.uniqueue.config.QueueConfig;
import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.LeaseConflictException;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.model.Lease;
import com.umitunal.uniqueue.storage.RocksJobStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class LeaseManagerTest {

    @TempDir
    Path tempDir;

    private RocksJobStore store;
    private TestClock clock;
    private LeaseManager leaseManager;

    @BeforeEach
    void setUp() throws Exception {
        store = new RocksJobStore(StorageConfig.newBuilder(tempDir.toString()).withDurableWrites(false).build());
        clock = new TestClock(1_000_000L);
        leaseManager = new LeaseManager(store, QueueConfig.defaults(), clock);
    }

    @AfterEach
    void tearDown() {
        leaseManager.close();
        store.close();
    }

    private String submitAndLease(String owner, long leaseMs, Lease[] leaseOut) throws Exception {
        long now = clock.millis();
        String id = store.submit(JobRecord.draft("video_convert", null, new byte[0], 0, 3, now, now));
        store.update(id, record -> leaseOut[0] = record.lease(owner, leaseMs, now));
        return id;
    }

    @Test
    @DisplayName("Should return an expired job to PENDING without counting an attempt")
    void testReclaimExpired() throws Exception {
        // Given
        Lease[] lease = new Lease[1];
        String id = submitAndLease("crashed-worker", 1000, lease);
        AtomicInteger notified = new AtomicInteger();
        leaseManager.setReclaimListener(notified::incrementAndGet);

        // When
        clock.advance(Duration.ofMillis(1001));
        int reclaimed = leaseManager.reclaimExpired();

        // Then
        assertThat(reclaimed).isEqualTo(1);
        assertThat(notified.get()).isEqualTo(1);
        JobRecord job = store.get(id);
        assertThat(job.getState()).isEqualTo(JobState.PENDING);
        assertThat(job.getAttemptCount()).isZero();
        assertThat(job.getLeaseOwner()).isNull();
    }

    @Test
    @DisplayName("Should leave live leases alone")
    void testLiveLease() throws Exception {
        Lease[] lease = new Lease[1];
        String id = submitAndLease("worker-1", 1000, lease);
        leaseManager.setReclaimListener(() -> fail("no reclaim expected"));

        clock.advance(Duration.ofMillis(999));

        assertThat(leaseManager.reclaimExpired()).isZero();
        assertThat(store.get(id).getState()).isEqualTo(JobState.LEASED);
    }

    @Test
    @DisplayName("Should reject the stale worker's report after the job was leased again")
    void testStaleReportAfterReclaim() throws Exception {
        // Given - worker A's lease expires and worker B takes over
        Lease[] stale = new Lease[1];
        String id = submitAndLease("worker-a", 1000, stale);
        clock.advance(Duration.ofMillis(2000));
        leaseManager.reclaimExpired();
        long now = clock.millis();
        Lease[] current = new Lease[1];
        store.update(id, record -> current[0] = record.lease("worker-b", 1000, now));

        // When/Then - A comes back with a success report
        assertThatThrownBy(() -> store.update(id, record -> record.succeed(stale[0], "late", now)))
                .isInstanceOf(LeaseConflictException.class);

        store.update(id, record -> record.succeed(current[0], "ok", now));
        JobRecord job = store.get(id);
        assertThat(job.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(job.getResult()).isEqualTo("ok");
        assertThat(job.getAttemptCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should cancel a reclaimed job whose cancellation was requested")
    void testReclaimCancelled() throws Exception {
        Lease[] lease = new Lease[1];
        String id = submitAndLease("worker-1", 1000, lease);
        store.update(id, record -> record.cancel(clock.millis()));

        clock.advance(Duration.ofSeconds(5));
        leaseManager.reclaimExpired();

        assertThat(store.get(id).getState()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    @DisplayName("Should back off while the store fails and reclaim once it is back")
    void testSweepBackoff() throws Exception {
        // Given - an expired lease and a store that is down
        Lease[] lease = new Lease[1];
        String id = submitAndLease("crashed-worker", 1000, lease);
        long version = store.get(id).getVersion();
        FlakyJobStore flaky = new FlakyJobStore(store);
        LeaseManager flakyManager = new LeaseManager(flaky,
                QueueConfig.newBuilder().withReclaimInterval(Duration.ofSeconds(1)).build(), clock);
        clock.advance(Duration.ofSeconds(5));
        flaky.setFailing(true);

        // When - failed sweeps pause further sweeps for an interval
        flakyManager.sweep();
        flakyManager.sweep();
        clock.advance(Duration.ofMillis(999));
        flakyManager.sweep();

        // Then
        assertThat(flaky.getCalls()).isEqualTo(1);
        assertThat(store.get(id).getVersion()).isEqualTo(version);
        assertThat(store.get(id).getState()).isEqualTo(JobState.LEASED);

        // When - the store comes back
        flaky.setFailing(false);
        clock.advance(Duration.ofMillis(1));
        flakyManager.sweep();

        // Then
        JobRecord job = store.get(id);
        assertThat(job.getState()).isEqualTo(JobState.PENDING);
        assertThat(job.getAttemptCount()).isZero();
    }

    @Test
    @DisplayName("Should not reclaim a job whose lease was renewed after the sweep read it")
    void testRenewalWins() throws Exception {
        Lease[] lease = new Lease[1];
        String id = submitAndLease("worker-1", 1000, lease);
        long readVersion = store.get(id).getVersion();
        clock.advance(Duration.ofMillis(1500));

        // Renewal lands between the sweep's read and its write
        store.update(id, record -> record.renewLease(lease[0], 1000, clock.millis()));

        assertThatThrownBy(() -> store.update(id, readVersion, record -> record.reclaim(clock.millis())))
                .isInstanceOf(LeaseConflictException.class);
        assertThat(leaseManager.reclaimExpired()).isZero();
        assertThat(store.get(id).getLeaseOwner()).isEqualTo("worker-1");
    }
}
