package com.umitunal.uniqueue.model;

import com.umitunal.uniqueue.core.CancelOutcome;
import com.umitunal.uniqueue.core.IllegalTransitionException;
import com.umitunal.uniqueue.core.Job;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.LeaseConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class JobRecordTest {

    private static final long NOW = 1_000_000L;

    private JobRecord record;

    @BeforeEach
    void setUp() {
        record = JobRecord.draft("pdf_render", null, new byte[]{1, 2}, 5, 3, NOW, NOW);
        record.assignIdentity("job-1", 1);
    }

    @Test
    @DisplayName("Should start pending with name defaulting to type")
    void testDraft() {
        assertThat(record.getState()).isEqualTo(JobState.PENDING);
        assertThat(record.getName()).isEqualTo("pdf_render");
        assertThat(record.getAttemptCount()).isZero();
        assertThat(record.getHistory()).extracting(Job.HistoryEntry::getMessage).containsExactly("submitted");
        assertThat(record.isEligible(NOW)).isTrue();
    }

    @Test
    @DisplayName("Should lease a pending job and count the attempt only on report")
    void testLeaseAndSucceed() throws Exception {
        // When
        Lease lease = record.lease("worker-1", 30_000, NOW);

        // Then
        assertThat(record.getState()).isEqualTo(JobState.LEASED);
        assertThat(record.getLeaseOwner()).isEqualTo("worker-1");
        assertThat(record.getLeaseExpiresAt()).isEqualTo(NOW + 30_000);
        assertThat(record.getAttemptCount()).isZero();

        record.succeed(lease, "out.pdf", NOW + 10);
        assertThat(record.getState()).isEqualTo(JobState.SUCCEEDED);
        assertThat(record.getAttemptCount()).isEqualTo(1);
        assertThat(record.getResult()).isEqualTo("out.pdf");
        assertThat(record.getProgress()).isEqualTo(100);
        assertThat(record.getLeaseOwner()).isNull();
    }

    @Test
    @DisplayName("Should not lease before notBefore")
    void testNotBefore() {
        JobRecord delayed = JobRecord.draft("t", "n", new byte[0], 0, 3, NOW + 5000, NOW);
        delayed.assignIdentity("job-2", 2);

        assertThat(delayed.isEligible(NOW)).isFalse();
        assertThatThrownBy(() -> delayed.lease("w", 1000, NOW))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    @DisplayName("Should retry until attempts are exhausted, then fail")
    void testRetryThenFail() throws Exception {
        Lease first = record.lease("w", 1000, NOW);
        record.retry(first, "boom", NOW + 100, NOW);
        assertThat(record.getState()).isEqualTo(JobState.RETRYING);
        assertThat(record.getNotBefore()).isEqualTo(NOW + 100);
        assertThat(record.getError()).isEqualTo("boom");

        record.promote(NOW + 100);
        Lease second = record.lease("w", 1000, NOW + 100);
        record.retry(second, "boom", NOW + 300, NOW + 100);
        record.promote(NOW + 300);
        Lease third = record.lease("w", 1000, NOW + 300);
        record.retry(third, "boom again", NOW + 700, NOW + 300);

        assertThat(record.getState()).isEqualTo(JobState.FAILED);
        assertThat(record.getAttemptCount()).isEqualTo(3);
        assertThat(record.getError()).isEqualTo("boom again");
    }

    @Test
    @DisplayName("Should not promote a retrying job before its backoff elapsed")
    void testPromoteTooEarly() throws Exception {
        Lease lease = record.lease("w", 1000, NOW);
        record.retry(lease, "boom", NOW + 500, NOW);

        assertThatThrownBy(() -> record.promote(NOW + 499))
                .isInstanceOf(IllegalTransitionException.class);
    }

    @Test
    @DisplayName("Should reject reports made with a stale lease")
    void testStaleLease() throws Exception {
        // Given - first lease expires and the job is leased again
        Lease stale = record.lease("worker-1", 100, NOW);
        record.reclaim(NOW + 200);
        Lease current = record.lease("worker-2", 100, NOW + 200);

        // When/Then
        assertThatThrownBy(() -> record.succeed(stale, null, NOW + 250))
                .isInstanceOf(LeaseConflictException.class);
        assertThat(current.getEpoch()).isGreaterThan(stale.getEpoch());
        assertThat(record.getLeaseOwner()).isEqualTo("worker-2");
    }

    @Test
    @DisplayName("Should reject a stale lease of the same owner")
    void testStaleLeaseSameOwner() throws Exception {
        Lease stale = record.lease("worker-1", 100, NOW);
        record.reclaim(NOW + 200);
        record.lease("worker-1", 100, NOW + 200);

        assertThatThrownBy(() -> record.checkLease(stale))
                .isInstanceOf(LeaseConflictException.class);
    }

    @Test
    @DisplayName("Should reclaim only expired leases, without counting an attempt")
    void testReclaim() throws Exception {
        record.lease("worker-1", 100, NOW);

        assertThatThrownBy(() -> record.reclaim(NOW + 50))
                .isInstanceOf(IllegalTransitionException.class);

        record.reclaim(NOW + 101);
        assertThat(record.getState()).isEqualTo(JobState.PENDING);
        assertThat(record.getAttemptCount()).isZero();
        assertThat(record.getLeaseOwner()).isNull();
    }

    @Test
    @DisplayName("Should extend but never shorten a lease on renewal")
    void testRenew() throws Exception {
        Lease lease = record.lease("w", 1000, NOW);

        record.renewLease(lease, 1000, NOW + 500);
        assertThat(record.getLeaseExpiresAt()).isEqualTo(NOW + 1500);
        assertThat(lease.getExpiresAt()).isEqualTo(NOW + 1500);

        record.renewLease(lease, 100, NOW + 600);
        assertThat(record.getLeaseExpiresAt()).isEqualTo(NOW + 1500);
    }

    @Test
    @DisplayName("Should cancel pending work at once and flag leased work")
    void testCancel() throws Exception {
        assertThat(record.cancel(NOW)).isEqualTo(CancelOutcome.CANCELLED);
        assertThat(record.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(record.cancel(NOW)).isEqualTo(CancelOutcome.NOT_CANCELLABLE);

        JobRecord running = JobRecord.draft("t", "n", new byte[0], 0, 3, NOW, NOW);
        running.assignIdentity("job-3", 3);
        Lease lease = running.lease("w", 1000, NOW);

        assertThat(running.cancel(NOW)).isEqualTo(CancelOutcome.CANCEL_REQUESTED);
        assertThat(running.getState()).isEqualTo(JobState.LEASED);
        assertThat(running.isCancelRequested()).isTrue();

        // A successful report after the request still ends cancelled
        running.succeed(lease, "done", NOW + 10);
        assertThat(running.getState()).isEqualTo(JobState.CANCELLED);
        assertThat(running.getResult()).isNull();
    }

    @Test
    @DisplayName("Should cancel a flagged job when its lease is reclaimed")
    void testCancelOnReclaim() throws Exception {
        record.lease("w", 100, NOW);
        record.cancel(NOW);

        record.reclaim(NOW + 200);
        assertThat(record.getState()).isEqualTo(JobState.CANCELLED);
    }

    @Test
    @DisplayName("Should return a relinquished job to the queue without counting an attempt")
    void testRelinquish() throws Exception {
        Lease lease = record.lease("w", 1000, NOW);

        record.relinquish(lease, "shutdown", NOW + 10);

        assertThat(record.getState()).isEqualTo(JobState.PENDING);
        assertThat(record.getAttemptCount()).isZero();
        assertThat(record.isEligible(NOW + 10)).isTrue();
    }

    @Test
    @DisplayName("Should time the latest attempt and stamp completion only on terminal states")
    void testTiming() throws Exception {
        // First attempt fails and is retried, nothing is complete yet
        Lease first = record.lease("w", 1000, NOW);
        record.retry(first, "boom", NOW + 50, NOW + 20);
        assertThat(record.getStartedAt()).isEqualTo(NOW);
        assertThat(record.getCompletedAt()).isZero();
        assertThat(record.getDuration()).isEmpty();

        // Second attempt succeeds
        record.promote(NOW + 50);
        Lease second = record.lease("w", 1000, NOW + 60);
        record.succeed(second, "ok", NOW + 160);

        assertThat(record.getStartedAt()).isEqualTo(NOW + 60);
        assertThat(record.getCompletedAt()).isEqualTo(NOW + 160);
        assertThat(record.getDuration()).hasValue(Duration.ofMillis(100));
    }

    @Test
    @DisplayName("Should clamp progress and require the lease")
    void testProgress() throws Exception {
        Lease lease = record.lease("w", 1000, NOW);

        record.reportProgress(lease, 150, "almost", NOW);
        assertThat(record.getProgress()).isEqualTo(100);
        record.reportProgress(lease, -5, null, NOW);
        assertThat(record.getProgress()).isZero();

        record.fail(lease, "bad input", NOW);
        assertThatThrownBy(() -> record.reportProgress(lease, 10, null, NOW))
                .isInstanceOf(LeaseConflictException.class);
    }

    @Test
    @DisplayName("Should bump the version on every change")
    void testVersion() throws Exception {
        long initial = record.getVersion();
        Lease lease = record.lease("w", 1000, NOW);
        assertThat(record.getVersion()).isEqualTo(initial + 1);
        record.renewLease(lease, 1000, NOW);
        assertThat(record.getVersion()).isEqualTo(initial + 2);
    }

    @Test
    @DisplayName("Should keep only the most recent history entries")
    void testHistoryBound() throws Exception {
        for (int i = 0; i < 40; i++) {
            record.lease("w", 10, NOW + i * 100L);
            record.reclaim(NOW + i * 100L + 20);
        }
        assertThat(record.getHistory()).hasSize(JobRecord.MAX_HISTORY);
        assertThat(record.getHistory().get(0).getMessage()).isNotEqualTo("submitted");
    }
}
