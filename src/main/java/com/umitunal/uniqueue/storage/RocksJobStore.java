package com.umitunal.uniqueue.storage;

import com.umitunal.uniqueue.config.StorageConfig;
import com.umitunal.uniqueue.core.JobMutation;
import com.umitunal.uniqueue.core.JobNotFoundException;
import com.umitunal.uniqueue.core.JobState;
import com.umitunal.uniqueue.core.JobStore;
import com.umitunal.uniqueue.core.LeaseConflictException;
import com.umitunal.uniqueue.core.QueueException;
import com.umitunal.uniqueue.core.QueueMetrics;
import com.umitunal.uniqueue.core.StoreException;
import com.umitunal.uniqueue.model.JobRecord;
import com.umitunal.uniqueue.model.JobRecordSerializer;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed job store.
 *
 * <p>Key layout:
 * <ul>
 *   <li>{@code job/<id>} - serialized {@link JobRecord}</li>
 *   <li>{@code meta/sequence} - highest sequence number handed out (8 bytes)</li>
 * </ul>
 *
 * <p>Updates run in optimistic transactions: the record is read with {@code getForUpdate},
 * mutated and written back; if another writer committed the same key in between, the commit
 * fails and the read-modify-write is replayed against the fresh record.
 */
public class RocksJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(RocksJobStore.class);

    private static final byte[] JOB_PREFIX = "job/".getBytes(UTF_8);
    private static final byte[] SEQUENCE_KEY = "meta/sequence".getBytes(UTF_8);

    static final Comparator<JobRecord> SCHEDULING_ORDER = Comparator
            .comparingInt(JobRecord::getPriority).reversed()
            .thenComparingLong(JobRecord::getCreatedAt)
            .thenComparingLong(JobRecord::getSequence);

    private final OptimisticTransactionDB transactionDB;
    private final ColumnFamilyHandle jobs;
    private final JobRecordSerializer serializer = new JobRecordSerializer();
    private final WriteOptions writeOpts;
    private final OptimisticTransactionOptions txnOpts;
    private final ReadOptions readOpts;
    private final ReadOptions scanReadOpts;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;
    private final Cache blockCache;
    private final Filter bloomFilter;
    private final int maxCommitRetries;
    private final AtomicLong sequence;
    private final AtomicLong commitConflictCount = new AtomicLong(0);

    public RocksJobStore(StorageConfig config) throws StoreException {
        RocksDB.loadLibrary();

        this.maxCommitRetries = config.getMaxCommitRetries();
        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024L * 1024L);
        this.bloomFilter = new BloomFilter(10, false);

        BlockBasedTableConfig tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setIncreaseParallelism(Runtime.getRuntime().availableProcessors())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setMaxOpenFiles(-1);
        this.cfOptions = new ColumnFamilyOptions()
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize(config.getMemoryBufferSizeMB() * 1024L * 1024L)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setTargetFileSizeBase(64 * 1024 * 1024)
                .setTableFormatConfig(tableConfig);

        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites())
                .setDisableWAL(!config.isDurableWrites());
        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);
        this.readOpts = new ReadOptions();
        // Full scans should not evict hot records from the block cache
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);

        // Open the default column family explicitly and keep its handle for every read and write
        List<ColumnFamilyDescriptor> descriptors = Collections.singletonList(
                new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOptions));
        List<ColumnFamilyHandle> handles = new ArrayList<>(1);
        try {
            this.transactionDB = OptimisticTransactionDB.open(dbOptions, config.getDataDirectory(), descriptors, handles);
            this.jobs = handles.get(0);
        } catch (RocksDBException e) {
            closeOptions();
            throw new StoreException("Failed to open job store at " + config.getDataDirectory(), e);
        }
        this.sequence = new AtomicLong(recoverSequence());
        log.info("Opened job store at {} (sequence={}, durableWrites={})",
                config.getDataDirectory(), sequence.get(), config.isDurableWrites());
    }

    @Override
    public String submit(JobRecord draft) throws StoreException {
        long next = sequence.incrementAndGet();
        String id = "job-" + next;
        draft.assignIdentity(id, next);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
            txn.put(jobs, SEQUENCE_KEY, longBytes(next));
            txn.put(jobs, jobKey(id), serializer.serialize(draft));
            txn.commit();
            return id;
        } catch (RocksDBException e) {
            throw new StoreException("Failed to persist job " + id, e);
        }
    }

    @Override
    public JobRecord get(String id) throws JobNotFoundException, StoreException {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    @Override
    public Optional<JobRecord> find(String id) throws StoreException {
        try {
            byte[] value = transactionDB.get(jobs, readOpts, jobKey(id));
            return value == null ? Optional.empty() : Optional.of(decode(id, value));
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read job " + id, e);
        }
    }

    @Override
    public JobRecord update(String id, JobMutation mutation) throws QueueException {
        return applyUpdate(id, null, mutation);
    }

    @Override
    public JobRecord update(String id, long expectedVersion, JobMutation mutation) throws QueueException {
        return applyUpdate(id, expectedVersion, mutation);
    }

    private JobRecord applyUpdate(String id, Long expectedVersion, JobMutation mutation) throws QueueException {
        byte[] key = jobKey(id);

        for (int attempt = 1; ; attempt++) {
            try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts)) {
                byte[] value = txn.getForUpdate(readOpts, jobs, key, true);
                if (value == null) {
                    throw new JobNotFoundException(id);
                }

                JobRecord record = decode(id, value);
                if (expectedVersion != null && record.getVersion() != expectedVersion) {
                    throw new LeaseConflictException(id, String.format(
                            "Job %s is at version %d, expected %d", id, record.getVersion(), expectedVersion));
                }

                mutation.apply(record);
                txn.put(jobs, key, serializer.serialize(record));
                txn.commit();
                return record;

            } catch (RocksDBException e) {
                if (isConflict(e) && attempt < maxCommitRetries) {
                    // Another writer committed this job first, replay against its result
                    commitConflictCount.incrementAndGet();
                    log.trace("Commit conflict on job {} (attempt {})", id, attempt);
                    continue;
                }
                throw new StoreException("Failed to update job " + id, e);
            }
        }
    }

    @Override
    public List<JobRecord> listEligible(long now) throws StoreException {
        List<JobRecord> eligible = collect(record -> record.isEligible(now));
        eligible.sort(SCHEDULING_ORDER);
        return eligible;
    }

    @Override
    public List<JobRecord> listByState(JobState state) throws StoreException {
        List<JobRecord> records = collect(record -> record.getState() == state);
        records.sort(Comparator.comparingLong(JobRecord::getSequence));
        return records;
    }

    @Override
    public Map<String, Integer> countLeasedByType(long now) throws StoreException {
        Map<String, Integer> counts = new HashMap<>();
        scan(record -> {
            if (record.getState() == JobState.LEASED && !record.isLeaseExpired(now)) {
                counts.merge(record.getType(), 1, Integer::sum);
            }
        });
        return counts;
    }

    @Override
    public QueueMetrics getMetrics(long recentSince) throws StoreException {
        Map<JobState, Long> byState = new EnumMap<>(JobState.class);
        Map<String, Map<JobState, Long>> byType = new HashMap<>();
        long[] recent = new long[2];

        scan(record -> {
            byState.merge(record.getState(), 1L, Long::sum);
            byType.computeIfAbsent(record.getType(), t -> new EnumMap<>(JobState.class))
                    .merge(record.getState(), 1L, Long::sum);
            if (record.getCompletedAt() >= recentSince) {
                if (record.getState() == JobState.SUCCEEDED) {
                    recent[0]++;
                } else if (record.getState() == JobState.FAILED) {
                    recent[1]++;
                }
            }
        });

        return new QueueMetrics(byState, byType, recentSince, recent[0], recent[1]);
    }

    @Override
    public long purgeTerminal(long cutoff) throws StoreException {
        long purged = 0;

        try (final RocksIterator iter = transactionDB.newIterator(jobs, scanReadOpts);
             final WriteBatch batch = new WriteBatch()) {

            // Keep the sequence high-water mark even if the newest job is deleted
            batch.put(jobs, SEQUENCE_KEY, longBytes(sequence.get()));

            for (iter.seek(JOB_PREFIX); iter.isValid() && hasPrefix(iter.key()); iter.next()) {
                JobRecord record = decode(null, iter.value());

                if (record.isTerminal() && record.getUpdatedAt() < cutoff) {
                    batch.delete(jobs, iter.key());
                    purged++;

                    if (purged % 1000 == 0) {
                        transactionDB.write(writeOpts, batch);
                        batch.clear();
                    }
                }
            }

            if (batch.count() > 0) {
                transactionDB.write(writeOpts, batch);
            }
        } catch (RocksDBException e) {
            throw new StoreException("Failed to purge terminal jobs", e);
        }

        log.debug("Purged {} terminal jobs updated before {}", purged, cutoff);
        return purged;
    }

    /**
     * Number of optimistic commit conflicts that were replayed. Useful for monitoring contention.
     */
    public long getCommitConflictCount() {
        return commitConflictCount.get();
    }

    @Override
    public void close() {
        try {
            transactionDB.put(jobs, writeOpts, SEQUENCE_KEY, longBytes(sequence.get()));
        } catch (RocksDBException e) {
            log.warn("Failed to persist sequence {} on close: {}", sequence.get(), e.getMessage());
        }
        jobs.close();
        transactionDB.close();
        closeOptions();
        log.info("Closed job store");
    }

    private void closeOptions() {
        scanReadOpts.close();
        readOpts.close();
        txnOpts.close();
        writeOpts.close();
        dbOptions.close();
        cfOptions.close();
        // BlockBasedTableConfig has no close(), it goes away with the column family options
        blockCache.close();
        bloomFilter.close();
    }

    /**
     * Highest sequence in use: the persisted mark, or a higher one found on a record if a
     * concurrent submitter committed its mark out of order.
     */
    private long recoverSequence() throws StoreException {
        long stored;
        try {
            byte[] value = transactionDB.get(jobs, readOpts, SEQUENCE_KEY);
            stored = value == null ? 0 : ByteBuffer.wrap(value).getLong();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to read job sequence", e);
        }

        long[] highest = {stored};
        scan(record -> highest[0] = Math.max(highest[0], record.getSequence()));
        return highest[0];
    }

    private List<JobRecord> collect(Predicate<JobRecord> filter) throws StoreException {
        List<JobRecord> records = new ArrayList<>();
        scan(record -> {
            if (filter.test(record)) {
                records.add(record);
            }
        });
        return records;
    }

    private void scan(Consumer<JobRecord> consumer) throws StoreException {
        try (final RocksIterator iter = transactionDB.newIterator(jobs, scanReadOpts)) {
            for (iter.seek(JOB_PREFIX); iter.isValid() && hasPrefix(iter.key()); iter.next()) {
                consumer.accept(decode(null, iter.value()));
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StoreException("Failed to scan jobs", e);
        }
    }

    private JobRecord decode(String id, byte[] value) throws StoreException {
        try {
            return serializer.deserialize(value);
        } catch (IllegalArgumentException e) {
            throw new StoreException("Corrupt job record" + (id != null ? " " + id : ""), e);
        }
    }

    private static boolean isConflict(RocksDBException e) {
        Status status = e.getStatus();
        return status != null
                && (status.getCode() == Status.Code.Busy || status.getCode() == Status.Code.TryAgain);
    }

    private static boolean hasPrefix(byte[] key) {
        return key.length >= JOB_PREFIX.length
                && Arrays.equals(key, 0, JOB_PREFIX.length, JOB_PREFIX, 0, JOB_PREFIX.length);
    }

    private static byte[] jobKey(String id) {
        byte[] idBytes = id.getBytes(UTF_8);
        return ByteBuffer.allocate(JOB_PREFIX.length + idBytes.length)
                .put(JOB_PREFIX)
                .put(idBytes)
                .array();
    }

    private static byte[] longBytes(long value) {
        return ByteBuffer.allocate(8).putLong(value).array();
    }
}
