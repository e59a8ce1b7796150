package com.eventhub.event.service;

import com.eventhub.common.exception.BusinessException;
import com.eventhub.event.config.LockProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EntityLockServiceTest {

    @Mock
    private RedissonClient redissonClient;

    private EntityLockService entityLockService;

    @BeforeEach
    void setUp() {
        entityLockService = new EntityLockService(redissonClient, new LockProperties());
    }

    @Test
    void acquireLocks_success_returnsLocksInKeyOrder() throws InterruptedException {
        RLock eventLock = mock(RLock.class);
        RLock attendeeLock = mock(RLock.class);

        when(redissonClient.getLock("lock:event:e1")).thenReturn(eventLock);
        when(redissonClient.getLock("lock:attendee:a1")).thenReturn(attendeeLock);
        when(eventLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(attendeeLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);

        List<RLock> locks = entityLockService.acquireLocks(List.of("lock:event:e1", "lock:attendee:a1"));

        assertThat(locks).containsExactly(attendeeLock, eventLock);
        InOrder inOrder = inOrder(redissonClient);
        inOrder.verify(redissonClient).getLock("lock:attendee:a1");
        inOrder.verify(redissonClient).getLock("lock:event:e1");
    }

    @Test
    void acquireLocks_duplicateKeys_acquiredOnce() throws InterruptedException {
        RLock lock = mock(RLock.class);
        when(redissonClient.getLock("lock:event:e1")).thenReturn(lock);
        when(lock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);

        List<RLock> locks = entityLockService.acquireLocks(List.of("lock:event:e1", "lock:event:e1"));

        assertThat(locks).hasSize(1);
        verify(lock, times(1)).tryLock(anyLong(), any(TimeUnit.class));
    }

    @Test
    void acquireLocks_usesConfiguredWaitTime() throws InterruptedException {
        LockProperties properties = new LockProperties();
        properties.setWaitTimeMs(250);
        entityLockService = new EntityLockService(redissonClient, properties);
        RLock lock = mock(RLock.class);
        when(redissonClient.getLock("lock:venue:v1")).thenReturn(lock);
        when(lock.tryLock(250L, TimeUnit.MILLISECONDS)).thenReturn(true);

        assertThat(entityLockService.acquireLocks(List.of("lock:venue:v1"))).containsExactly(lock);
    }

    @Test
    void acquireLocks_partialFailure_releasesAcquiredAndThrows() throws InterruptedException {
        RLock attendeeLock = mock(RLock.class);
        RLock eventLock = mock(RLock.class);

        when(redissonClient.getLock("lock:attendee:a1")).thenReturn(attendeeLock);
        when(redissonClient.getLock("lock:event:e1")).thenReturn(eventLock);
        when(attendeeLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(true);
        when(eventLock.tryLock(anyLong(), any(TimeUnit.class))).thenReturn(false);
        when(attendeeLock.isHeldByCurrentThread()).thenReturn(true);

        assertThatThrownBy(() -> entityLockService.acquireLocks(List.of("lock:event:e1", "lock:attendee:a1")))
                .isInstanceOf(BusinessException.class)
                .hasMessageContaining("Failed to acquire lock");

        verify(attendeeLock).unlock();
        verify(eventLock, never()).unlock();
    }

    @Test
    void acquireLocks_interrupted_releasesAndRestoresInterruptFlag() throws InterruptedException {
        RLock lock = mock(RLock.class);
        when(redissonClient.getLock("lock:event:e1")).thenReturn(lock);
        when(lock.tryLock(anyLong(), any(TimeUnit.class))).thenThrow(new InterruptedException());

        try {
            assertThatThrownBy(() -> entityLockService.acquireLocks(List.of("lock:event:e1")))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void releaseLocks_releasesAllHeldLocks() {
        RLock lock1 = mock(RLock.class);
        RLock lock2 = mock(RLock.class);

        when(lock1.isHeldByCurrentThread()).thenReturn(true);
        when(lock2.isHeldByCurrentThread()).thenReturn(false);

        entityLockService.releaseLocks(List.of(lock1, lock2));

        verify(lock1).unlock();
        verify(lock2, never()).unlock();
    }

    @Test
    void releaseLocks_unlockFailure_continuesWithRemaining() {
        RLock lock1 = mock(RLock.class);
        RLock lock2 = mock(RLock.class);

        when(lock1.isHeldByCurrentThread()).thenReturn(true);
        when(lock2.isHeldByCurrentThread()).thenReturn(true);
        doThrow(new IllegalMonitorStateException("expired")).when(lock2).unlock();

        entityLockService.releaseLocks(List.of(lock1, lock2));

        verify(lock1).unlock();
    }
}
