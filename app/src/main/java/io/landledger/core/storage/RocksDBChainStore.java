package io.landledger.core.storage;

import io.landledger.core.protocol.Block;
import io.landledger.core.protocol.BlockCodec;
import io.landledger.core.protocol.Transaction;
import io.landledger.core.protocol.TransactionCodec;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks"  : key = position in chain (8, big-endian), val = block JSON
 *  - "mempool" : key = position in pool  (8, big-endian), val = transaction JSON
 *
 * Big-endian keys iterate in chain order. Whole-sequence rewrites go through
 * one WriteBatch (deleteRange + puts) so a replaced chain is never half written.
 */
public final class RocksDBChainStore implements ChainStore, AutoCloseable {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] KEY_RANGE_START = longToBytes(0L);
    private static final byte[] KEY_RANGE_END = longToBytes(Long.MAX_VALUE);

    private final RocksDB db;
    private final ColumnFamilyHandle cfDefault;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMempool;
    private final DBOptions dbOptions;

    private long blockCount;

    private RocksDBChainStore(RocksDB db,
                              ColumnFamilyHandle cfDefault,
                              ColumnFamilyHandle cfBlocks,
                              ColumnFamilyHandle cfMempool,
                              DBOptions dbOptions) {
        this.db = db;
        this.cfDefault = cfDefault;
        this.cfBlocks = cfBlocks;
        this.cfMempool = cfMempool;
        this.dbOptions = dbOptions;
        this.blockCount = countKeys(cfBlocks);
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(Path dataDir) {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new PersistenceException("Failed to create data directory " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.UTF_8)),
                    new ColumnFamilyDescriptor("mempool".getBytes(StandardCharsets.UTF_8))
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir.toString(), cfDescs, cfHandles);
            return new RocksDBChainStore(db, cfHandles.get(0), cfHandles.get(1), cfHandles.get(2), dbOpts);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new PersistenceException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- ChainStore API ----------------

    @Override
    public synchronized List<Block> loadBlocks() {
        List<Block> blocks = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfBlocks)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                blocks.add(BlockCodec.fromBytes(it.value()));
            }
        }
        return blocks;
    }

    @Override
    public synchronized void appendBlock(Block block) {
        if (block == null) return;
        try (WriteOptions wo = new WriteOptions().setSync(true)) {
            db.put(cfBlocks, wo, longToBytes(blockCount), BlockCodec.toBytes(block));
            blockCount++;
        } catch (RocksDBException e) {
            throw new PersistenceException("appendBlock failed at index " + block.index(), e);
        }
    }

    @Override
    public synchronized void replaceBlocks(List<Block> blocks) {
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            batch.deleteRange(cfBlocks, KEY_RANGE_START, KEY_RANGE_END);
            for (int i = 0; i < blocks.size(); i++) {
                batch.put(cfBlocks, longToBytes(i), BlockCodec.toBytes(blocks.get(i)));
            }
            db.write(wo, batch);
            blockCount = blocks.size();
        } catch (RocksDBException e) {
            throw new PersistenceException("replaceBlocks failed", e);
        }
    }

    @Override
    public synchronized List<Transaction> loadMempool() {
        List<Transaction> txs = new ArrayList<>();
        try (RocksIterator it = db.newIterator(cfMempool)) {
            for (it.seekToFirst(); it.isValid(); it.next()) {
                txs.add(TransactionCodec.fromBytes(it.value()));
            }
        }
        return txs;
    }

    @Override
    public synchronized void saveMempool(List<Transaction> transactions) {
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            batch.deleteRange(cfMempool, KEY_RANGE_START, KEY_RANGE_END);
            for (int i = 0; i < transactions.size(); i++) {
                batch.put(cfMempool, longToBytes(i), TransactionCodec.toBytes(transactions.get(i)));
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new PersistenceException("saveMempool failed", e);
        }
    }

    @Override
    public synchronized long size() {
        return blockCount;
    }

    @Override
    public synchronized void close() {
        // Close CF handles first, then DB/options
        cfBlocks.close();
        cfMempool.close();
        cfDefault.close();
        db.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private long countKeys(ColumnFamilyHandle cf) {
        try (RocksIterator it = db.newIterator(cf)) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }
}
