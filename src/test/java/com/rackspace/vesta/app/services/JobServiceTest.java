/*
 * Copyright 2026 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.vesta.app.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rackspace.vesta.app.config.JobProperties;
import com.rackspace.vesta.app.exceptions.DegradedServiceException;
import com.rackspace.vesta.app.exceptions.JobNotFoundException;
import com.rackspace.vesta.app.model.Job;
import com.rackspace.vesta.app.model.JobStatus;
import com.rackspace.vesta.app.model.JobStatusView;
import com.rackspace.vesta.app.model.TimeRange;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class JobServiceTest {

  static final Instant NOW = Instant.parse("2024-01-15T00:00:00Z");
  static final Duration MINUTE = Duration.ofMinutes(1);
  static final List<TimeRange> RANGES = List.of(new TimeRange(0, 1000));

  final JobStore jobStore = mock(JobStore.class);
  final JobQueue jobQueue = mock(JobQueue.class);
  final MeterRegistry meterRegistry = new SimpleMeterRegistry();
  final JobService jobService = new JobService(jobStore, jobQueue,
      new JobProperties().setPointsPerBatch(2), Clock.fixed(NOW, ZoneOffset.UTC), meterRegistry);

  @BeforeEach
  void setUp() {
    when(jobStore.insert(any())).thenReturn(Mono.just(true));
    when(jobStore.archive(any(), any())).thenReturn(Mono.just(true));
    when(jobQueue.findLive(anyString())).thenReturn(Mono.empty());
    when(jobQueue.registerLive(anyString(), any(), any())).thenReturn(Mono.just(true));
    when(jobQueue.enqueue(any(), any())).thenReturn(Mono.just(true));
    when(jobQueue.take(any())).thenReturn(Mono.just(true));
    when(jobQueue.retainUntilPurge(any(), any())).thenReturn(Mono.just(true));
    when(jobQueue.forgetLive(anyString(), any())).thenReturn(Mono.just(true));
  }

  @Nested
  class submit {

    @Test
    void createsAndEnqueues() {
      StepVerifier.create(jobService.submit("S1", List.of("P1", "P2", "P3"), RANGES, 0, 1000,
              MINUTE, "S1:fp"))
          .assertNext(jobId -> {
            verify(jobStore).insert(argThat(job -> job.getId().equals(jobId)
                && job.getStatus() == JobStatus.queued
                && job.getTotalBatches() == 2
                && job.getCreatedAt().equals(NOW)));
            verify(jobQueue).registerLive(eq("S1:fp"), eq(jobId), any());
            verify(jobQueue).enqueue(jobId, NOW);
          })
          .verifyComplete();

      assertThat(meterRegistry.get("vesta.jobs.transitions").tag("status", "queued")
          .counter().count()).isEqualTo(1);
    }

    @Test
    void reusesLiveJob() {
      final Job live = job(JobStatus.processing);
      when(jobQueue.findLive("S1:fp")).thenReturn(Mono.just(live.getId()));
      when(jobStore.find(live.getId())).thenReturn(Mono.just(live));

      StepVerifier.create(jobService.submit("S1", List.of("P1"), RANGES, 0, 1000, MINUTE,
              "S1:fp"))
          .expectNext(live.getId())
          .verifyComplete();

      verify(jobStore, never()).insert(any());
    }

    @Test
    void finishedJobIsNotReused() {
      final Job done = job(JobStatus.completed);
      when(jobQueue.findLive("S1:fp")).thenReturn(Mono.just(done.getId()));
      when(jobStore.find(done.getId())).thenReturn(Mono.just(done));

      StepVerifier.create(jobService.submit("S1", List.of("P1"), RANGES, 0, 1000, MINUTE,
              "S1:fp"))
          .assertNext(jobId -> assertThat(jobId).isNotEqualTo(done.getId()))
          .verifyComplete();
    }

    @Test
    void losingRaceReturnsWinner() {
      final Job winner = job(JobStatus.queued);
      when(jobQueue.findLive("S1:fp"))
          .thenReturn(Mono.empty(), Mono.just(winner.getId()));
      when(jobStore.find(winner.getId())).thenReturn(Mono.just(winner));
      when(jobQueue.registerLive(anyString(), any(), any())).thenReturn(Mono.just(false));
      when(jobStore.cancelQueued(any(), anyString(), any())).thenReturn(Mono.just(true));

      StepVerifier.create(jobService.submit("S1", List.of("P1"), RANGES, 0, 1000, MINUTE,
              "S1:fp"))
          .expectNext(winner.getId())
          .verifyComplete();

      verify(jobStore).cancelQueued(argThat(id -> !id.equals(winner.getId())),
          eq("superseded by " + winner.getId()), eq(NOW));
      verify(jobQueue, never()).enqueue(any(), any());
    }

    @Test
    void storeFailureIsDegraded() {
      when(jobStore.insert(any())).thenReturn(Mono.error(new IllegalStateException("down")));

      StepVerifier.create(jobService.submit("S1", List.of("P1"), RANGES, 0, 1000, MINUTE,
              "S1:fp"))
          .expectError(DegradedServiceException.class)
          .verify();
    }
  }

  @Nested
  class status {

    @Test
    void fallsBackToHistory() {
      final Job archived = job(JobStatus.completed).setArchivedAt(NOW);
      when(jobStore.find(archived.getId())).thenReturn(Mono.empty());
      when(jobStore.findArchived(archived.getId())).thenReturn(Mono.just(archived));

      StepVerifier.create(jobService.status(archived.getId()))
          .assertNext(view -> {
            assertThat(view.getStatus()).isEqualTo(JobStatus.completed);
            assertThat(view.isArchived()).isTrue();
          })
          .verifyComplete();
    }

    @Test
    void unknownJob() {
      final UUID jobId = UUID.randomUUID();
      when(jobStore.find(jobId)).thenReturn(Mono.empty());
      when(jobStore.findArchived(jobId)).thenReturn(Mono.empty());

      StepVerifier.create(jobService.status(jobId))
          .expectError(JobNotFoundException.class)
          .verify();
    }
  }

  @Nested
  class cancel {

    @Test
    void queuedJobFailsImmediately() {
      final Job queued = job(JobStatus.queued);
      when(jobStore.find(queued.getId())).thenReturn(Mono.just(queued));
      when(jobStore.cancelQueued(queued.getId(), JobService.CANCELLED, NOW))
          .thenReturn(Mono.just(true));

      StepVerifier.create(jobService.cancel(queued.getId()))
          .assertNext(view -> {
            assertThat(view.getStatus()).isEqualTo(JobStatus.failed);
            assertThat(view.getError()).isEqualTo(JobService.CANCELLED);
            assertThat(view.getMessage()).isEqualTo("Cancelled");
          })
          .verifyComplete();

      verify(jobQueue).take(queued.getId());
      verify(jobStore).archive(queued, NOW);
      verify(jobQueue).forgetLive("S1:fp", queued.getId());
    }

    @Test
    void processingJobIsFlagged() {
      final Job processing = job(JobStatus.processing);
      when(jobStore.find(processing.getId())).thenReturn(Mono.just(processing));
      when(jobStore.requestCancel(processing.getId())).thenReturn(Mono.just(true));

      StepVerifier.create(jobService.cancel(processing.getId()))
          .assertNext(view -> assertThat(view.getStatus()).isEqualTo(JobStatus.processing))
          .verifyComplete();

      verify(jobStore).requestCancel(processing.getId());
      verify(jobStore, never()).cancelQueued(any(), anyString(), any());
    }

    @Test
    void claimedWhileCancellingIsFlagged() {
      final Job queued = job(JobStatus.queued);
      when(jobStore.find(queued.getId())).thenReturn(Mono.just(queued));
      when(jobStore.cancelQueued(any(), anyString(), any())).thenReturn(Mono.just(false));
      when(jobStore.requestCancel(queued.getId())).thenReturn(Mono.just(true));

      StepVerifier.create(jobService.cancel(queued.getId()))
          .expectNextCount(1)
          .verifyComplete();

      verify(jobStore).requestCancel(queued.getId());
      verify(jobStore, never()).archive(any(), any());
    }
  }

  @Test
  void viewReportsProgress() {
    final JobStatusView view = JobService.toView(job(JobStatus.processing)
        .setCursor(3)
        .setTotalBatches(4));

    assertThat(view.getProgress()).isEqualTo(0.75);
    assertThat(view.getCompletedBatches()).isEqualTo(3);
    assertThat(view.getMessage()).isEqualTo("Fetched 3 of 4 batches");
    assertThat(view.getPointErrors()).isNull();
  }

  static Job job(JobStatus status) {
    return new Job()
        .setId(UUID.randomUUID())
        .setSite("S1")
        .setPoints(List.of("P1"))
        .setRanges(RANGES)
        .setStartMs(0)
        .setEndMs(1000)
        .setResolution(MINUTE)
        .setStatus(status)
        .setCacheKey("S1:fp")
        .setCreatedAt(NOW);
  }
}
