package io.lift.indexer.supervisor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.lift.indexer.chain.ChainReaderException;
import io.lift.indexer.config.IndexerProperties;
import io.lift.indexer.decoder.EventDecoderRegistry;
import io.lift.indexer.decoder.RepaymentEscrowEventDecoder;
import io.lift.indexer.handler.BusinessHandlerRegistry;
import io.lift.indexer.handler.EventDispatcher;
import io.lift.indexer.handler.HandlerResult;
import io.lift.indexer.poller.Poller;
import io.lift.indexer.poller.PollerRegistry;
import io.lift.indexer.poller.TickResult;
import io.lift.indexer.source.SchemaKind;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.store.CursorRecord;
import io.lift.indexer.store.EventFilter;
import io.lift.indexer.store.EventPage;
import io.lift.indexer.store.EventProcessingStatus;
import io.lift.indexer.store.IndexedEvent;
import io.lift.indexer.support.FakeChainReader;
import io.lift.indexer.support.InMemoryCursorStore;
import io.lift.indexer.support.InMemoryEventStore;
import io.lift.indexer.support.MutableClock;
import io.lift.indexer.support.ScriptedBusinessHandler;
import io.lift.indexer.support.TestLogs;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

@ExtendWith(MockitoExtension.class)
class IndexerSupervisorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");
    private static final SourceConfig SOURCE = SourceConfig
        .of(TestLogs.NETWORK_ID, TestLogs.REPAYMENT_ESCROW, SchemaKind.REPAYMENT_ESCROW)
        .withConfirmations(12);

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> scheduledFuture;

    private FakeChainReader chain;
    private InMemoryCursorStore cursorStore;
    private InMemoryEventStore eventStore;
    private ScriptedBusinessHandler handler;
    private MutableClock clock;
    private PollerRegistry pollers;
    private IndexerSupervisor supervisor;

    @BeforeEach
    void setUp() {
        lenient().when(taskScheduler.scheduleAtFixedRate(any(Runnable.class), any(Duration.class)))
            .thenAnswer(invocation -> scheduledFuture);

        chain = new FakeChainReader(TestLogs.NETWORK_ID);
        cursorStore = new InMemoryCursorStore();
        eventStore = new InMemoryEventStore();
        handler = new ScriptedBusinessHandler(SchemaKind.REPAYMENT_ESCROW);
        clock = new MutableClock(NOW);

        IndexerProperties properties = new IndexerProperties();
        properties.setMaxRetries(3);
        properties.setStaleThresholdMs(Duration.ofMinutes(5).toMillis());
        properties.setHandlerTimeoutMs(5000);
        pollers = new PollerRegistry(taskScheduler, Duration.ofSeconds(30));
        EventDispatcher dispatcher = new EventDispatcher(
            new BusinessHandlerRegistry(List.of(handler)),
            eventStore,
            Runnable::run,
            properties,
            clock
        );
        supervisor = new IndexerSupervisor(
            pollers,
            chain,
            new EventDecoderRegistry(List.of(new RepaymentEscrowEventDecoder())),
            eventStore,
            cursorStore,
            dispatcher,
            properties,
            clock
        );
    }

    @Test
    @DisplayName("실행 중 start를 다시 호출하면 poller를 중복 생성하지 않는다")
    void secondStartShouldBeNoOp() {
        StartResult first = supervisor.start(List.of(SOURCE));
        StartResult second = supervisor.start(List.of(SOURCE));

        assertThat(first.outcome()).isEqualTo(StartResult.Outcome.ACCEPTED);
        assertThat(second.outcome()).isEqualTo(StartResult.Outcome.ALREADY_RUNNING);
        assertThat(second.activePollerCount()).isEqualTo(1);
        assertThat(supervisor.status().activePollerCount()).isEqualTo(1);
        verify(taskScheduler, times(1)).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    @DisplayName("start는 cursor가 없으면 높이 0으로 만들고 기존 cursor의 높이는 덮어쓰지 않는다")
    void startShouldCreateMissingCursorAndKeepExistingHeight() {
        SourceConfig other = SourceConfig.of(TestLogs.NETWORK_ID, TestLogs.ALLOCATION_ESCROW, SchemaKind.ALLOCATION_ESCROW);
        cursorStore.put(new CursorRecord(UUID.randomUUID(), SOURCE.key(), 500, NOW, true, 0, null, null, NOW, NOW));

        supervisor.start(List.of(SOURCE, other));

        assertThat(cursorStore.get(SOURCE.key()).lastProcessedHeight()).isEqualTo(500);
        assertThat(cursorStore.get(other.key()).lastProcessedHeight()).isZero();
        assertThat(cursorStore.get(other.key()).active()).isTrue();
        assertThat(supervisor.status().cursors()).hasSize(2);
    }

    @Test
    @DisplayName("start는 비활성 cursor를 높이 변경 없이 다시 활성화한다")
    void startShouldReactivateInactiveCursor() {
        cursorStore.put(new CursorRecord(UUID.randomUUID(), SOURCE.key(), 77, NOW, false, 0, null, null, NOW, NOW));

        supervisor.start(List.of(SOURCE));

        assertThat(cursorStore.get(SOURCE.key()).active()).isTrue();
        assertThat(cursorStore.get(SOURCE.key()).lastProcessedHeight()).isEqualTo(77);
    }

    @Test
    @DisplayName("중복된 source identity는 ConfigurationError로 거부되고 아무 poller도 시작하지 않는다")
    void startShouldRejectDuplicateSources() {
        SourceConfig sameKeyDifferentCase = SourceConfig.of(
            TestLogs.NETWORK_ID,
            TestLogs.REPAYMENT_ESCROW.toUpperCase().replace("0X", "0x"),
            SchemaKind.REPAYMENT_ESCROW
        );

        assertThatThrownBy(() -> supervisor.start(List.of(SOURCE, sameKeyDifferentCase)))
            .isInstanceOf(IndexerConfigurationException.class)
            .hasMessageContaining("Duplicate source");

        assertThat(supervisor.isRunning()).isFalse();
        assertThat(cursorStore.findAll()).isEmpty();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    @DisplayName("RPC가 설정되지 않은 네트워크의 source는 거부된다")
    void startShouldRejectUnknownNetwork() {
        SourceConfig unknownNetwork = SourceConfig.of(999, TestLogs.REPAYMENT_ESCROW, SchemaKind.REPAYMENT_ESCROW);

        assertThatThrownBy(() -> supervisor.start(List.of(unknownNetwork)))
            .isInstanceOf(IndexerConfigurationException.class)
            .hasMessageContaining("999");
        assertThat(supervisor.isRunning()).isFalse();
    }

    @Test
    @DisplayName("stop은 모든 timer를 취소하고 여러 번 호출해도 안전하다")
    void stopShouldCancelTimersAndBeIdempotent() {
        supervisor.stop();

        supervisor.start(List.of(SOURCE));
        supervisor.stop();
        supervisor.stop();

        verify(scheduledFuture, times(1)).cancel(false);
        IndexerStatus status = supervisor.status();
        assertThat(status.running()).isFalse();
        assertThat(status.activePollerCount()).isZero();
        assertThat(status.cursors()).hasSize(1);

        assertThat(supervisor.start(List.of(SOURCE)).accepted()).isTrue();
        assertThat(supervisor.status().activePollerCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("deactivate는 해당 source의 poller를 멈추고 cursor를 비활성화한다")
    void deactivateShouldStopPollerAndMarkCursorInactive() {
        supervisor.start(List.of(SOURCE));
        Poller poller = pollers.find(SOURCE.key()).orElseThrow();

        assertThat(supervisor.deactivate(SOURCE.key())).isTrue();

        assertThat(pollers.size()).isZero();
        assertThat(cursorStore.get(SOURCE.key()).active()).isFalse();
        assertThat(poller.tick().status()).isEqualTo(TickResult.Status.INACTIVE);
        assertThat(supervisor.deactivate(
            SourceConfig.of(TestLogs.NETWORK_ID, TestLogs.ALLOCATION_ESCROW, SchemaKind.ALLOCATION_ESCROW).key()
        )).isFalse();
    }

    @Test
    @DisplayName("start 도중 cursor 활성화가 실패하면 이미 시작한 poller를 취소하고 실행 중이 아닌 상태로 남는다")
    void startFailureShouldCancelPollersAlreadyRegistered() {
        SourceConfig other = SourceConfig.of(TestLogs.NETWORK_ID, TestLogs.ALLOCATION_ESCROW, SchemaKind.ALLOCATION_ESCROW);
        cursorStore.failOnEnsureActive(other.key(), new IllegalStateException("database unavailable"));

        assertThatThrownBy(() -> supervisor.start(List.of(SOURCE, other)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("database unavailable");

        // then: running=false인데 poller가 남아 있는 상태가 되지 않는다.
        IndexerStatus status = supervisor.status();
        assertThat(status.running()).isFalse();
        assertThat(status.activePollerCount()).isZero();
        verify(scheduledFuture, times(1)).cancel(false);

        // when: 저장소가 복구되면 다시 start할 수 있다.
        cursorStore.failOnEnsureActive(other.key(), null);
        assertThat(supervisor.start(List.of(SOURCE, other)).activePollerCount()).isEqualTo(2);
        assertThat(supervisor.isRunning()).isTrue();
    }

    @Test
    @DisplayName("실행 중 deactivate한 source는 activate로 높이를 유지한 채 다시 polling한다")
    void activateShouldResumeDeactivatedSourceWhileRunning() {
        supervisor.start(List.of(SOURCE));
        cursorStore.put(new CursorRecord(UUID.randomUUID(), SOURCE.key(), 300, NOW, true, 0, null, null, NOW, NOW));
        supervisor.deactivate(SOURCE.key());

        assertThat(supervisor.activate(SOURCE)).isTrue();

        assertThat(supervisor.isRunning()).isTrue();
        assertThat(pollers.find(SOURCE.key())).isPresent();
        assertThat(cursorStore.get(SOURCE.key()).active()).isTrue();
        assertThat(cursorStore.get(SOURCE.key()).lastProcessedHeight()).isEqualTo(300);
        // then: 이미 polling 중인 source는 중복 등록하지 않는다.
        assertThat(supervisor.activate(SOURCE)).isFalse();
        verify(taskScheduler, times(2)).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    @DisplayName("실행 중이 아니면 activate는 아무것도 하지 않는다")
    void activateShouldBeIgnoredWhenStopped() {
        assertThat(supervisor.activate(SOURCE)).isFalse();

        assertThat(cursorStore.findAll()).isEmpty();
        verify(taskScheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    @Test
    @DisplayName("handler가 두 번 실패 후 세 번째 시도에서 성공하면 processed=true, retryCount=2가 된다")
    void retrySweepShouldEventuallyProcessEvent() {
        handler.thenFail("payment not found").thenFail("payment still not found");
        chain.head(TestLogs.NETWORK_ID, 150)
            .addLogs(TestLogs.proceedsReceived(110, TestLogs.txHash(1), 0, 5, 1000));
        supervisor.start(List.of(SOURCE));
        tick();

        RetrySweepResult firstSweep = supervisor.retryFailedEvents(10);
        RetrySweepResult secondSweep = supervisor.retryFailedEvents(10);

        assertThat(firstSweep).isEqualTo(new RetrySweepResult(0, 1, 0));
        assertThat(secondSweep).isEqualTo(new RetrySweepResult(1, 0, 0));
        IndexedEvent event = eventStore.only();
        assertThat(event.processed()).isTrue();
        assertThat(event.retryCount()).isEqualTo(2);
        assertThat(event.processingError()).isNull();
        assertThat(handler.applied()).hasSize(3);
        assertThat(chain.getLogsCalls()).hasSize(1);
    }

    @Test
    @DisplayName("retryCount는 cap을 넘지 않고 cap에 도달한 이벤트는 sweep 대상에서 제외된다")
    void retrySweepShouldStopAtCap() {
        handler.withRule(event -> HandlerResult.failed("always failing"));
        chain.head(TestLogs.NETWORK_ID, 150)
            .addLogs(TestLogs.proceedsReceived(110, TestLogs.txHash(1), 0, 5, 1000));
        supervisor.start(List.of(SOURCE));
        tick();

        supervisor.retryFailedEvents(10);
        supervisor.retryFailedEvents(10);
        RetrySweepResult afterCap = supervisor.retryFailedEvents(10);

        assertThat(afterCap).isEqualTo(RetrySweepResult.empty());
        IndexedEvent event = eventStore.only();
        assertThat(event.retryCount()).isEqualTo(3);
        assertThat(event.processed()).isFalse();
        assertThat(event.status()).isEqualTo(EventProcessingStatus.NEEDS_MANUAL_INTERVENTION);
        assertThat(handler.applied()).hasSize(3);

        EventPage stuck = supervisor.listEvents(EventFilter.byStatus(EventProcessingStatus.NEEDS_MANUAL_INTERVENTION));
        assertThat(stuck.total()).isEqualTo(1);
        assertThat(stuck.events()).extracting(IndexedEvent::id).containsExactly(event.id());
    }

    @Test
    @DisplayName("retryFailedEvents는 limit만큼만 오래된 순서로 처리한다")
    void retrySweepShouldHonorLimit() {
        handler.thenFail("a").thenFail("b").thenFail("c");
        chain.head(TestLogs.NETWORK_ID, 150)
            .addLogs(
                TestLogs.proceedsReceived(110, TestLogs.txHash(1), 0, 5, 1000),
                TestLogs.proceedsReceived(111, TestLogs.txHash(2), 0, 5, 1000),
                TestLogs.proceedsReceived(112, TestLogs.txHash(3), 0, 5, 1000)
            );
        supervisor.start(List.of(SOURCE));
        tick();

        RetrySweepResult result = supervisor.retryFailedEvents(2);

        assertThat(result.processed()).isEqualTo(2);
        assertThat(eventStore.countByStatus(EventProcessingStatus.PROCESSED)).isEqualTo(2);
        assertThat(eventStore.countByStatus(EventProcessingStatus.FAILED)).isEqualTo(1);
        IndexedEvent remaining = eventStore.findRetryable(10).get(0);
        assertThat(remaining.blockNumber()).isEqualTo(112);
    }

    @Test
    @DisplayName("retryFailedEvents의 limit은 양수여야 한다")
    void retrySweepShouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> supervisor.retryFailedEvents(0))
            .isInstanceOf(IndexerConfigurationException.class);
    }

    @Test
    @DisplayName("health는 supervisor 중지, 미동기화, 오류, stale, cap 도달 이벤트를 모두 보고한다")
    void healthShouldReportEveryProblem() {
        IndexerHealth stopped = supervisor.health();
        assertThat(stopped.healthy()).isFalse();
        assertThat(stopped.issues()).contains("indexer is not running");

        supervisor.start(List.of(SOURCE));
        IndexerHealth neverSynced = supervisor.health();
        assertThat(neverSynced.healthy()).isFalse();
        assertThat(neverSynced.issues()).anyMatch(issue -> issue.contains("never synced"));

        chain.head(TestLogs.NETWORK_ID, 150);
        tick();
        IndexerHealth healthy = supervisor.health();
        assertThat(healthy.healthy()).isTrue();
        assertThat(healthy.summary()).startsWith("healthy");
        assertThat(healthy.sources()).singleElement().satisfies(source -> {
            assertThat(source.lastProcessedHeight()).isEqualTo(138);
            assertThat(source.healthy()).isTrue();
        });

        clock.advance(Duration.ofMinutes(6));
        IndexerHealth stale = supervisor.health();
        assertThat(stale.healthy()).isFalse();
        assertThat(stale.sources().get(0).stale()).isTrue();

        chain.failNextGetLogs(new ChainReaderException("rpc down"));
        chain.head(TestLogs.NETWORK_ID, 200);
        tick();
        IndexerHealth erroring = supervisor.health();
        assertThat(erroring.sources().get(0).errorCount()).isEqualTo(1);
        assertThat(erroring.issues()).anyMatch(issue -> issue.contains("rpc down"));
        assertThat(erroring.summary()).startsWith("unhealthy");
    }

    @Test
    @DisplayName("health는 retry cap에 도달한 이벤트 수를 보고한다")
    void healthShouldCountEventsNeedingIntervention() {
        handler.withRule(event -> HandlerResult.failed("always failing"));
        chain.head(TestLogs.NETWORK_ID, 150)
            .addLogs(TestLogs.proceedsReceived(110, TestLogs.txHash(1), 0, 5, 1000));
        supervisor.start(List.of(SOURCE));
        tick();
        assertThat(supervisor.health().failedEvents()).isEqualTo(1);

        supervisor.retryFailedEvents(10);
        supervisor.retryFailedEvents(10);

        IndexerHealth health = supervisor.health();
        assertThat(health.failedEvents()).isZero();
        assertThat(health.eventsNeedingIntervention()).isEqualTo(1);
        assertThat(health.issues()).anyMatch(issue -> issue.contains("manual intervention"));
    }

    @Test
    @DisplayName("getEvent는 id로 이벤트를 조회하고 없으면 비어 있다")
    void getEventShouldLookUpById() {
        chain.head(TestLogs.NETWORK_ID, 150)
            .addLogs(TestLogs.proceedsReceived(110, TestLogs.txHash(1), 0, 5, 1000));
        supervisor.start(List.of(SOURCE));
        tick();
        IndexedEvent stored = eventStore.only();

        assertThat(supervisor.getEvent(stored.id())).contains(stored);
        assertThat(supervisor.getEvent(UUID.randomUUID())).isEmpty();
        assertThat(supervisor.listEvents(null).total()).isEqualTo(1);
    }

    private void tick() {
        pollers.find(SOURCE.key()).orElseThrow().tick();
    }
}
