package com.mouse.smartbet.finance;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per bankroll account. Work on the same account is serialized, different accounts run in parallel.
 * The lock is held around the whole database transaction, so it is released only after commit or rollback.
 */
@Slf4j
@Component
public class AccountLockRegistry {

    // Never pruned: one small lock per account id seen, bounded by the number of accounts.
    private final ConcurrentMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long accountId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(accountId, id -> new ReentrantLock());
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for account lock {} (queue={})", accountId, lock.getQueueLength());
        }
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(Long accountId) {
        ReentrantLock lock = locks.get(accountId);
        return lock != null && lock.isLocked();
    }

    public int size() {
        return locks.size();
    }
}
