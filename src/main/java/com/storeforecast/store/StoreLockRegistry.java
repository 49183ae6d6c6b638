package com.storeforecast.store;

import com.storeforecast.config.ForecastProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Non-blocking per-store locks. Training takes the exclusive lock, which also holds an OS file
 * lock so that a second process cannot train the same store. Predictions take the shared lock.
 * An empty result means the store is busy.
 */
@Slf4j
@Component
public class StoreLockRegistry {

    private final ConcurrentHashMap<String, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();
    private final Path root;

    public StoreLockRegistry(ForecastProperties properties) {
        this.root = Paths.get(properties.getModelDir());
    }

    public Optional<StoreLease> tryExclusive(String storeId) {
        ReentrantReadWriteLock lock = lockFor(storeId);
        if (!lock.writeLock().tryLock()) {
            return Optional.empty();
        }
        FileChannel channel = null;
        try {
            Path lockFile = root.resolve(ModelStore.storeDirectoryName(storeId) + ".lock");
            Files.createDirectories(root);
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                lock.writeLock().unlock();
                log.info("Store locked by another process | store={}", storeId);
                return Optional.empty();
            }
            return Optional.of(new ExclusiveLease(storeId, lock, channel, fileLock));
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            lock.writeLock().unlock();
            return Optional.empty();
        } catch (IOException e) {
            closeQuietly(channel);
            lock.writeLock().unlock();
            throw new UncheckedIOException("Cannot open lock file for store " + storeId, e);
        }
    }

    public Optional<StoreLease> tryShared(String storeId) {
        ReentrantReadWriteLock lock = lockFor(storeId);
        if (!lock.readLock().tryLock()) {
            return Optional.empty();
        }
        return Optional.of(new SharedLease(storeId, lock));
    }

    private ReentrantReadWriteLock lockFor(String storeId) {
        return locks.computeIfAbsent(storeId, id -> new ReentrantReadWriteLock());
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel", e);
        }
    }

    private record SharedLease(String storeId, ReentrantReadWriteLock lock) implements StoreLease {
        @Override
        public boolean exclusive() {
            return false;
        }

        @Override
        public void close() {
            lock.readLock().unlock();
        }
    }

    private record ExclusiveLease(String storeId, ReentrantReadWriteLock lock,
                                  FileChannel channel, FileLock fileLock) implements StoreLease {
        @Override
        public boolean exclusive() {
            return true;
        }

        @Override
        public void close() {
            try {
                fileLock.release();
            } catch (IOException e) {
                log.warn("Failed to release file lock | store={}", storeId, e);
            } finally {
                closeQuietly(channel);
                lock.writeLock().unlock();
            }
        }
    }
}
