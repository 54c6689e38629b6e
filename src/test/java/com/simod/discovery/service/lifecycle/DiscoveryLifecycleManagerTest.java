package com.simod.discovery.service.lifecycle;

import com.simod.discovery.service.artifact.ArtifactStore;
import com.simod.discovery.service.artifact.FileSystemArtifactStore;
import com.simod.discovery.service.config.DiscoveryConfig;
import com.simod.discovery.service.config.DispatchConfig;
import com.simod.discovery.service.config.MetricsConfig;
import com.simod.discovery.service.config.RetentionConfig;
import com.simod.discovery.service.config.StorageConfig;
import com.simod.discovery.service.dispatch.DiscoveryTask;
import com.simod.discovery.service.dispatch.TaskQueue;
import com.simod.discovery.service.exception.DispatchException;
import com.simod.discovery.service.exception.InvalidTransitionException;
import com.simod.discovery.service.exception.JobNotFoundException;
import com.simod.discovery.service.exception.JobNotReadyException;
import com.simod.discovery.service.exception.StorageException;
import com.simod.discovery.service.exception.UnsupportedMediaTypeException;
import com.simod.discovery.service.exception.ValidationException;
import com.simod.discovery.service.job.Job;
import com.simod.discovery.service.job.JobOutcome;
import com.simod.discovery.service.job.JobStatus;
import com.simod.discovery.service.persistence.InMemoryJobRepository;
import com.simod.discovery.service.schema.DiscoveryConfigurationValidator;
import com.simod.discovery.service.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;
import org.springframework.scheduling.annotation.AnnotationAsyncExecutionInterceptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class DiscoveryLifecycleManagerTest {

    private static final byte[] LOG = "case_id,activity\n1,A\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path storageRoot;

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    private InMemoryJobRepository repository;
    private ArtifactStore artifactStore;
    private TaskQueue taskQueue;
    private CallbackNotifier callbackNotifier;
    private DispatchConfig dispatchConfig;
    private RetentionConfig retentionConfig;
    private DiscoveryConfigurationValidator validator;
    private SimpleMeterRegistry registry;
    private MetricsConfig metricsConfig;
    private DiscoveryLifecycleManager manager;

    @BeforeEach
    void setUp() {
        repository = new InMemoryJobRepository();
        var storageConfig = new StorageConfig();
        storageConfig.setPath(storageRoot.toString());
        var fileStore = new FileSystemArtifactStore(storageConfig);
        fileStore.init();
        artifactStore = spy(fileStore);
        taskQueue = mock(TaskQueue.class);
        callbackNotifier = mock(CallbackNotifier.class);
        dispatchConfig = new DispatchConfig();
        retentionConfig = new RetentionConfig();
        validator = new DiscoveryConfigurationValidator(new DiscoveryConfig());
        registry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(registry);
        manager = new DiscoveryLifecycleManager(repository, artifactStore, taskQueue, validator, callbackNotifier,
                retentionConfig, dispatchConfig, metricsConfig, clock);
    }

    @Nested
    @DisplayName("submit")
    class Submit {

        @Test
        void logOnly_createsPendingDispatchedJob() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(job.getSubmittedAt()).isEqualTo(clock.instant());
            assertThat(job.getExpiresAt()).isAfter(job.getSubmittedAt());
            assertThat(job.getDispatchedAt()).isEqualTo(clock.instant());
            assertThat(job.getInputLogPath()).isEqualTo(job.getId() + "/event_log.csv");
            assertThat(job.getInputConfigPath()).isNull();
            verify(taskQueue).enqueue(new DiscoveryTask(job.getId(), job.getInputLogPath(), null, 1, clock.instant()));
        }

        @Test
        void withConfiguration_storesRewrittenConfiguration() throws Exception {
            var config = new UploadedFile("config.yaml", "application/x-yaml", """
                    version: 4
                    common:
                      train_log_path: /somewhere/else.csv
                      test_log_path: /somewhere/test.csv
                    """.getBytes(StandardCharsets.UTF_8));

            Job job = manager.submit(new SubmissionRequest(csv(), config, "https://client.example/hook"));

            assertThat(job.getInputConfigPath()).isEqualTo(job.getId() + "/configuration.yaml");
            assertThat(job.getCallbackUrl()).isEqualTo("https://client.example/hook");
            String stored = Files.readString(artifactStore.resolve(job.getInputConfigPath()));
            assertThat(stored)
                    .contains(artifactStore.resolve(job.getInputLogPath()).toAbsolutePath().toString())
                    .doesNotContain("/somewhere/else.csv")
                    .doesNotContain("/somewhere/test.csv");
        }

        @Test
        void missingLog_isRejected() {
            assertThatThrownBy(() -> manager.submit(SubmissionRequest.of(null)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> manager.submit(SubmissionRequest.of(new UploadedFile("log.csv", "text/csv", new byte[0]))))
                    .isInstanceOf(ValidationException.class);
            assertThat(repository.count()).isZero();
        }

        @Test
        void unknownLogType_isUnsupported() {
            assertThatThrownBy(() -> manager.submit(SubmissionRequest.of(new UploadedFile("log.txt", "text/plain", LOG))))
                    .isInstanceOf(UnsupportedMediaTypeException.class);
            assertThat(repository.count()).isZero();
        }

        @Test
        void malformedConfiguration_leavesNoTrace() {
            var config = new UploadedFile("config.yaml", null, "common: [unclosed\n".getBytes(StandardCharsets.UTF_8));

            assertThatThrownBy(() -> manager.submit(new SubmissionRequest(csv(), config, null)))
                    .isInstanceOf(ValidationException.class);

            assertThat(repository.count()).isZero();
            assertThat(artifactStore.listNamespaces()).isEmpty();
            verify(taskQueue, never()).enqueue(any());
        }

        @Test
        void invalidCallbackUrl_isRejected() {
            assertThatThrownBy(() -> manager.submit(new SubmissionRequest(csv(), null, "ftp://client.example/x")))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> manager.submit(new SubmissionRequest(csv(), null, "not a url")))
                    .isInstanceOf(ValidationException.class);
            assertThat(repository.count()).isZero();
        }

        @Test
        void storageFailure_leavesNoRecord() {
            doThrow(new StorageException("disk full")).when(artifactStore).store(any(), any(), any(byte[].class));

            assertThatThrownBy(() -> manager.submit(SubmissionRequest.of(csv())))
                    .isInstanceOf(StorageException.class);

            assertThat(repository.count()).isZero();
            verify(taskQueue, never()).enqueue(any());
        }

        @Test
        void dispatchFailure_leavesJobPendingForReconciliation() {
            doThrow(new DispatchException("queue full", "x")).when(taskQueue).enqueue(any());

            Job job = manager.submit(SubmissionRequest.of(csv()));

            Job stored = manager.get(job.getId());
            assertThat(stored.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(stored.getDispatchedAt()).isNull();
        }

        @Test
        void storedGauge_tracksRecordCount() {
            manager.registerGauges();

            manager.submit(SubmissionRequest.of(csv()));
            manager.submit(SubmissionRequest.of(csv()));

            assertThat(registry.get("discovery.jobs.stored").gauge().value()).isEqualTo(2.0);
        }
    }

    @Nested
    @DisplayName("worker transitions")
    class WorkerTransitions {

        @Test
        void markRunning_claimsOnlyOnce() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            assertThat(manager.markRunning(job.getId())).get()
                    .satisfies(running -> {
                        assertThat(running.getStatus()).isEqualTo(JobStatus.RUNNING);
                        assertThat(running.getAttempts()).isEqualTo(1);
                        assertThat(running.getStartedAt()).isNotNull();
                    });
            assertThat(manager.markRunning(job.getId())).isEmpty();
        }

        @Test
        void reportOutcome_success_recordsOutputAndNotifies() {
            Job job = runningJob();
            clock.advance(Duration.ofMinutes(5));

            Job done = manager.reportOutcome(job.getId(), JobOutcome.succeeded(job.getId() + "/results/r.tar.gz"));

            assertThat(done.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
            assertThat(done.getCompletedAt()).isEqualTo(clock.instant());
            assertThat(done.getExpiresAt()).isEqualTo(clock.instant().plus(retentionConfig.getWindow()));
            assertThat(done.getOutputPath()).isEqualTo(job.getId() + "/results/r.tar.gz");
            verify(callbackNotifier, never()).notifyCompletion(any());
        }

        @Test
        void reportOutcome_withCallback_notifiesOnce() {
            Job job = manager.submit(new SubmissionRequest(csv(), null, "http://client.example/hook"));
            manager.markRunning(job.getId());

            Job done = manager.reportOutcome(job.getId(), JobOutcome.failed("engine crashed"));
            manager.reportOutcome(job.getId(), JobOutcome.failed("engine crashed"));

            verify(callbackNotifier).notifyCompletion(done);
        }

        @Test
        void reportOutcome_callbackRejectedBySaturatedExecutor_stillRecordsOutcome() {
            var executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(1);
            executor.setMaxPoolSize(1);
            executor.setQueueCapacity(0);
            executor.initialize();
            var release = new CountDownLatch(1);
            executor.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            try {
                var beanFactory = new DefaultListableBeanFactory();
                beanFactory.registerSingleton("notificationExecutor", executor);
                var interceptor = new AnnotationAsyncExecutionInterceptor(null);
                interceptor.setBeanFactory(beanFactory);
                var proxyFactory = new ProxyFactory(callbackNotifier);
                proxyFactory.setProxyTargetClass(true);
                proxyFactory.addAdvice(interceptor);
                var asyncNotifier = (CallbackNotifier) proxyFactory.getProxy();
                var asyncManager = new DiscoveryLifecycleManager(repository, artifactStore, taskQueue, validator,
                        asyncNotifier, retentionConfig, dispatchConfig, metricsConfig, clock);
                Job job = asyncManager.submit(new SubmissionRequest(csv(), null, "http://client.example/hook"));
                asyncManager.markRunning(job.getId());

                Job done = asyncManager.reportOutcome(job.getId(), JobOutcome.failed("engine crashed"));

                assertThat(done.getStatus()).isEqualTo(JobStatus.FAILED);
                assertThat(manager.get(job.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
                assertThat(metricsConfig.getNotificationsFailed().count()).isEqualTo(1.0);
                verify(callbackNotifier, never()).notifyCompletion(any());
            } finally {
                release.countDown();
                executor.shutdown();
            }
        }

        @Test
        void reportOutcome_duplicate_isNoOp() {
            Job job = runningJob();
            Job first = manager.reportOutcome(job.getId(), JobOutcome.succeeded(job.getId() + "/results/r.tar.gz"));

            Job second = manager.reportOutcome(job.getId(), JobOutcome.failed("late failure"));

            assertThat(second.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
            assertThat(second.getOutputPath()).isEqualTo(first.getOutputPath());
            assertThat(second.getErrorDetail()).isNull();
        }

        @Test
        void reportOutcome_onPendingJob_isInvalid() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            assertThatThrownBy(() -> manager.reportOutcome(job.getId(), JobOutcome.failed("x")))
                    .isInstanceOf(InvalidTransitionException.class);
            assertThat(manager.get(job.getId()).getStatus()).isEqualTo(JobStatus.PENDING);
        }

        @Test
        void reportOutcome_unknownJob_isNotFound() {
            assertThatThrownBy(() -> manager.reportOutcome("missing", JobOutcome.failed("x")))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        void heartbeat_onlyWhileRunning() {
            Job job = runningJob();
            clock.advance(Duration.ofSeconds(30));

            assertThat(manager.heartbeat(job.getId())).isTrue();
            assertThat(manager.get(job.getId()).getHeartbeatAt()).isEqualTo(clock.instant());

            manager.reportOutcome(job.getId(), JobOutcome.failed("x"));
            assertThat(manager.heartbeat(job.getId())).isFalse();
        }
    }

    @Nested
    @DisplayName("requeue")
    class Requeue {

        @Test
        void lostWorker_returnsJobToPendingWithBackoff() {
            Job job = runningJob();

            Job requeued = manager.requeue(job.getId(), "no heartbeat").orElseThrow();

            assertThat(requeued.getStatus()).isEqualTo(JobStatus.PENDING);
            assertThat(requeued.getStartedAt()).isNull();
            assertThat(requeued.getDispatchedAt()).isNull();
            assertThat(requeued.getNextDispatchAt()).isEqualTo(clock.instant().plus(Duration.ofSeconds(30)));
        }

        @Test
        void exhaustedAttempts_failsJob() {
            dispatchConfig.getRetry().setMaxAttempts(2);
            Job job = runningJob();
            manager.requeue(job.getId(), "no heartbeat");
            manager.markRunning(job.getId());

            Job failed = manager.requeue(job.getId(), "no heartbeat").orElseThrow();

            assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(failed.getErrorDetail()).contains("2 attempts");
        }

        @Test
        void backoff_doublesPerAttempt() {
            assertThat(manager.backoff(1)).isEqualTo(Duration.ofSeconds(30));
            assertThat(manager.backoff(2)).isEqualTo(Duration.ofSeconds(60));
            assertThat(manager.backoff(3)).isEqualTo(Duration.ofSeconds(120));
        }

        @Test
        void notRunning_isIgnored() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            assertThat(manager.requeue(job.getId(), "no heartbeat")).isEmpty();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void expiredJobs_areInvisible() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            clock.advance(retentionConfig.getWindow().plusSeconds(1));

            assertThatThrownBy(() -> manager.get(job.getId())).isInstanceOf(JobNotFoundException.class);
            assertThat(manager.list()).isEmpty();
        }

        @Test
        void list_returnsOldestFirst() {
            Job first = manager.submit(SubmissionRequest.of(csv()));
            clock.advance(Duration.ofSeconds(1));
            Job second = manager.submit(SubmissionRequest.of(csv()));

            assertThat(manager.list()).extracting(Job::getId).containsExactly(first.getId(), second.getId());
        }

        @Test
        void openResult_whileProcessing_isNotReady() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            assertThatThrownBy(() -> manager.openResult(job.getId()))
                    .isInstanceOf(JobNotReadyException.class)
                    .satisfies(e -> assertThat(((JobNotReadyException) e).getStatus()).isEqualTo(JobStatus.PENDING));
        }

        @Test
        void openResult_failedJob_hasNoResult() {
            Job job = runningJob();
            manager.reportOutcome(job.getId(), JobOutcome.failed("x"));

            assertThatThrownBy(() -> manager.openResult(job.getId())).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        void openResult_succeededJob_streamsArtifact() throws Exception {
            Job job = runningJob();
            String ref = artifactStore.store(job.getId(), "results/best_result.tar.gz", new byte[]{1, 2, 3});
            manager.reportOutcome(job.getId(), JobOutcome.succeeded(ref));

            ResultArtifact result = manager.openResult(job.getId());

            assertThat(result.fileName()).isEqualTo("best_result.tar.gz");
            try (InputStream in = result.content()) {
                assertThat(in.readAllBytes()).containsExactly(1, 2, 3);
            }
        }

        @Test
        void openResult_artifactGone_isNotFound() {
            Job job = runningJob();
            manager.reportOutcome(job.getId(), JobOutcome.succeeded(job.getId() + "/results/missing.tar.gz"));

            assertThatThrownBy(() -> manager.openResult(job.getId())).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        void openConfiguration_withoutUpload_generatesMinimalConfiguration() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            String config = new String(manager.openConfiguration(job.getId()), StandardCharsets.UTF_8);

            assertThat(config).contains("train_log_path").contains("event_log.csv");
        }
    }

    @Nested
    @DisplayName("removal")
    class Removal {

        @Test
        void delete_removesRecordAndArtifacts() {
            Job job = manager.submit(SubmissionRequest.of(csv()));

            Job deleted = manager.delete(job.getId());

            assertThat(deleted.getStatus()).isEqualTo(JobStatus.EXPIRED);
            assertThat(repository.findById(job.getId())).isEmpty();
            assertThat(artifactStore.exists(job.getInputLogPath())).isFalse();
            assertThatThrownBy(() -> manager.delete(job.getId())).isInstanceOf(JobNotFoundException.class);
        }

        @Test
        void deleteAll_removesEverything() {
            manager.submit(SubmissionRequest.of(csv()));
            manager.submit(SubmissionRequest.of(csv()));

            assertThat(manager.deleteAll()).isEqualTo(2);
            assertThat(repository.count()).isZero();
            assertThat(artifactStore.listNamespaces()).isEmpty();
        }
    }

    private Job runningJob() {
        Job job = manager.submit(SubmissionRequest.of(csv()));
        return manager.markRunning(job.getId()).orElseThrow();
    }

    private static UploadedFile csv() {
        return new UploadedFile("log.csv", "text/csv", LOG);
    }
}
