package com.eyelevel.tableingestor.service.load;

import com.eyelevel.tableingestor.exception.StageTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per table name, serializing creation and insertion for that table within this process.
 * A job only ever holds a single table lock, so waiting on it cannot deadlock.
 */
@Slf4j
@Component
public class TableLockRegistry {

    // never evicted: bounded by the number of distinct table names, and a lock must outlive its waiters
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String tableName, Duration maxWait, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(tableName, name -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StageTimeoutException("LOAD", maxWait, e);
        }
        if (!acquired) {
            log.warn("Timed out waiting {} ms for the lock on table '{}'.", maxWait.toMillis(), tableName);
            throw new StageTimeoutException("LOAD", maxWait, null);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
