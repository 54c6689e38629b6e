package com.simod.discovery.service.dispatch;

import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.exception.InvalidTransitionException;
import com.simod.discovery.service.exception.JobNotFoundException;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.job.JobOutcome;
import com.simod.discovery.service.job.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryWorkerTest {

    private static final DiscoveryTask TASK = new DiscoveryTask(
            "job-1", "job-1/event_log.csv", null, 1, Instant.parse("2024-05-01T10:00:00Z"));

    @Mock
    private TaskQueue queue;
    @Mock
    private TaskProcessor processor;
    @Mock
    private TaskDelivery delivery;

    private DiscoveryWorker worker;

    @BeforeEach
    void setUp() {
        worker = new DiscoveryWorker(queue, processor, new DispatchConfig());
    }

    @Test
    void handle_outcomeRecorded_acknowledges() {
        when(delivery.task()).thenReturn(TASK);
        when(processor.process(TASK)).thenReturn(Optional.of(JobOutcome.succeeded("job-1/results/r.tar.gz")));

        worker.handle(delivery);

        verify(delivery).ack();
        verify(delivery, never()).nack(anyBoolean());
    }

    @Test
    void handle_staleDelivery_acknowledges() {
        when(delivery.task()).thenReturn(TASK);
        when(processor.process(TASK)).thenReturn(Optional.empty());

        worker.handle(delivery);

        verify(delivery).ack();
    }

    @Test
    void handle_jobGoneOrInInvalidState_dropsTask() {
        when(delivery.task()).thenReturn(TASK);
        when(processor.process(TASK))
                .thenThrow(new JobNotFoundException("job-1"))
                .thenThrow(new InvalidTransitionException("job-1", JobStatus.PENDING, JobStatus.SUCCEEDED));

        worker.handle(delivery);
        worker.handle(delivery);

        verify(delivery, times(2)).ack();
        verify(delivery, never()).nack(anyBoolean());
    }

    @Test
    void handle_outcomeNotRecorded_requeues() {
        when(delivery.task()).thenReturn(TASK);
        when(processor.process(TASK)).thenThrow(new StorageException("Database unavailable"));

        worker.handle(delivery);

        verify(delivery).nack(true);
        verify(delivery, never()).ack();
        assertThat(worker.getBusyWorkerCount()).isZero();
    }

    @Test
    void startedWorkers_pollQueueUntilStopped() {
        DispatchConfig config = new DispatchConfig();
        config.getWorker().setThreadCount(2);
        config.getWorker().setPollMs(10);
        config.getWorker().setShutdownTimeoutSeconds(5);
        TaskQueue idleQueue = mock(TaskQueue.class);
        when(idleQueue.dequeue(anyLong())).thenReturn(Optional.empty());
        DiscoveryWorker pool = new DiscoveryWorker(idleQueue, processor, config);

        pool.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> pool.getActiveWorkerCount() == 2);
        pool.stop();

        assertThat(pool.getActiveWorkerCount()).isZero();
        verify(idleQueue, atLeastOnce()).dequeue(10);
    }
}
