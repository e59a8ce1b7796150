package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.common.response.ErrorCode;
import com.eventhub.event.config.LockProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

/**
 * Per-document mutual exclusion backed by Redis locks, shared by every instance of the service.
 * Locks carry no fixed lease; the Redisson watchdog keeps them alive while the holder runs.
 * Circuit breaker protects against Redis outages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityLockService {

    private final RedissonClient redissonClient;
    private final LockProperties lockProperties;

    /**
     * Acquires the locks for the given keys in sorted order (deadlock prevention).
     * Duplicate keys are acquired once. Returns acquired locks for cleanup.
     */
    @CircuitBreaker(name = "entityLock", fallbackMethod = "acquireLocksFallback")
    public List<RLock> acquireLocks(Collection<String> lockKeys) {
        List<RLock> acquiredLocks = new ArrayList<>();
        try {
            for (String key : new TreeSet<>(lockKeys)) {
                RLock lock = redissonClient.getLock(key);
                boolean acquired = lock.tryLock(lockProperties.getWaitTimeMs(), TimeUnit.MILLISECONDS);
                if (!acquired) {
                    throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                            "Failed to acquire lock: " + key);
                }
                acquiredLocks.add(lock);
            }
            return acquiredLocks;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseLocks(acquiredLocks);
            throw new BusinessException(ErrorCode.LOCK_ACQUISITION_FAILED,
                    "Lock acquisition interrupted");
        } catch (RuntimeException e) {
            releaseLocks(acquiredLocks);
            throw e;
        }
    }

    @SuppressWarnings("unused")
    private List<RLock> acquireLocksFallback(Collection<String> lockKeys, Throwable t) {
        if (t instanceof BusinessException businessException) {
            throw businessException;
        }
        log.error("Entity lock unavailable for keys: {}", lockKeys, t);
        throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE,
                "Service temporarily unavailable. Please try again shortly.", t);
    }

    public void releaseLocks(List<RLock> locks) {
        for (int i = locks.size() - 1; i >= 0; i--) {
            RLock lock = locks.get(i);
            try {
                if (lock.isHeldByCurrentThread()) {
                    lock.unlock();
                }
            } catch (Exception e) {
                log.warn("Failed to release lock: {}", lock.getName(), e);
            }
        }
    }
}
