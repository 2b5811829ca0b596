package com.socialnetwork.infrastructure.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AfterCommitTest {

    private final AtomicInteger runs = new AtomicInteger();

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    void testRun_WithoutTransactionRunsImmediately() {
        // When
        AfterCommit.run(runs::incrementAndGet);

        // Then
        assertEquals(1, runs.get());
    }

    @Test
    void testRun_DeferredUntilCommit() {
        // Given
        TransactionSynchronizationManager.initSynchronization();

        // When
        AfterCommit.run(runs::incrementAndGet);

        // Then
        assertEquals(0, runs.get());
        TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
        assertEquals(1, runs.get());
    }

    @Test
    void testRun_SkippedOnRollback() {
        // Given
        TransactionSynchronizationManager.initSynchronization();

        // When
        AfterCommit.run(runs::incrementAndGet);
        TransactionSynchronizationManager.getSynchronizations()
                .forEach(sync -> sync.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        // Then
        assertEquals(0, runs.get());
    }
}
