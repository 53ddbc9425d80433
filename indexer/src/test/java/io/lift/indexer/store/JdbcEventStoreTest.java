package io.lift.indexer.store;

import static org.assertj.core.api.Assertions.assertThat;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.decoder.AllocationEscrowEventDecoder;
import io.lift.indexer.decoder.DecodeResult;
import io.lift.indexer.decoder.EventDecoderRegistry;
import io.lift.indexer.decoder.RepaymentEscrowEventDecoder;
import io.lift.indexer.event.ProceedsReceived;
import io.lift.indexer.event.UnknownPayload;
import io.lift.indexer.source.SchemaKind;
import io.lift.indexer.source.SourceConfig;
import io.lift.indexer.support.JdbcStoreTestConfig;
import io.lift.indexer.support.TestLogs;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@JdbcTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@Import(JdbcStoreTestConfig.class)
class JdbcEventStoreTest {

    private static final Instant BLOCK_TIME = Instant.parse("2026-03-01T00:00:00Z");
    private static final SourceConfig REPAYMENT = SourceConfig
        .of(TestLogs.NETWORK_ID, TestLogs.REPAYMENT_ESCROW, SchemaKind.REPAYMENT_ESCROW);
    private static final SourceConfig ALLOCATION = SourceConfig
        .of(TestLogs.NETWORK_ID, TestLogs.ALLOCATION_ESCROW, SchemaKind.ALLOCATION_ESCROW);

    private final EventDecoderRegistry decoders = new EventDecoderRegistry(List.of(
        new RepaymentEscrowEventDecoder(),
        new AllocationEscrowEventDecoder()
    ));

    @Autowired
    private JdbcEventStore eventStore;

    @Test
    @DisplayName("같은 (networkId, txHash, logIndex)는 한 번만 저장되고 payload가 타입 그대로 복원된다")
    void insertIfAbsentShouldDeduplicateOnLogKey() {
        // given: ProceedsReceived 로그
        RawLog log = TestLogs.proceedsReceived(120, TestLogs.txHash(1), 3, 42, 5_000_000);

        // when: 같은 로그를 두 번 저장한다.
        Optional<IndexedEvent> first = eventStore.insertIfAbsent(newEvent(REPAYMENT, log, 3));
        Optional<IndexedEvent> second = eventStore.insertIfAbsent(newEvent(REPAYMENT, log, 3));

        // then: 두 번째는 중복으로 무시된다.
        assertThat(first).isPresent();
        assertThat(second).isEmpty();
        IndexedEvent stored = eventStore.findByLogKey(TestLogs.NETWORK_ID, TestLogs.txHash(1), 3).orElseThrow();
        assertThat(stored.id()).isEqualTo(first.get().id());
        assertThat(stored.status()).isEqualTo(EventProcessingStatus.PENDING);
        assertThat(stored.eventName()).isEqualTo(ProceedsReceived.EVENT_NAME);
        assertThat(stored.blockTimestamp()).isEqualTo(BLOCK_TIME);
        assertThat(stored.rawTopics()).isEqualTo(log.topics());
        assertThat(stored.decodedArgs()).isEqualTo(new ProceedsReceived(
            BigInteger.valueOf(42),
            BigInteger.valueOf(5_000_000),
            TestLogs.considerationRefHex(7)
        ));
    }

    @Test
    @DisplayName("디코딩되지 않은 로그는 Unknown 이벤트로 저장되고 UNDECODED 상태다")
    void undecodedLogShouldBeStoredForAudit() {
        RawLog log = TestLogs.unknownEvent(121, TestLogs.txHash(2), 0);

        IndexedEvent stored = eventStore.insertIfAbsent(newEvent(REPAYMENT, log, 3)).orElseThrow();

        assertThat(stored.eventName()).isEqualTo(UnknownPayload.EVENT_NAME);
        assertThat(stored.decodedArgs()).isEqualTo(UnknownPayload.INSTANCE);
        assertThat(stored.decodeError()).isNotBlank();
        assertThat(stored.status()).isEqualTo(EventProcessingStatus.UNDECODED);
        assertThat(eventStore.countByStatus(EventProcessingStatus.UNDECODED)).isEqualTo(1);
        assertThat(eventStore.findRetryable(10)).isEmpty();
    }

    @Test
    @DisplayName("markProcessed는 예상한 retryCount일 때만 한 번 성공한다")
    void markProcessedShouldBeConditional() {
        IndexedEvent stored = eventStore.insertIfAbsent(
            newEvent(REPAYMENT, TestLogs.proceedsReceived(120, TestLogs.txHash(3), 0, 1, 1), 3)
        ).orElseThrow();

        assertThat(eventStore.markProcessed(stored.id(), 1, BLOCK_TIME)).isFalse();
        assertThat(eventStore.markProcessed(stored.id(), 0, BLOCK_TIME)).isTrue();
        assertThat(eventStore.markProcessed(stored.id(), 0, BLOCK_TIME)).isFalse();

        IndexedEvent processed = eventStore.findById(stored.id()).orElseThrow();
        assertThat(processed.status()).isEqualTo(EventProcessingStatus.PROCESSED);
        assertThat(processed.processedAt()).isEqualTo(BLOCK_TIME);
        assertThat(processed.processingError()).isNull();
    }

    @Test
    @DisplayName("markFailed는 retryCount를 올리고 상한에 도달하면 수동 개입 상태가 된다")
    void markFailedShouldStopAtRetryCap() {
        // given: maxRetries 2인 이벤트
        IndexedEvent stored = eventStore.insertIfAbsent(
            newEvent(REPAYMENT, TestLogs.proceedsReceived(120, TestLogs.txHash(4), 0, 1, 1), 2)
        ).orElseThrow();

        // when: 세 번 실패를 기록한다.
        boolean first = eventStore.markFailed(stored.id(), 0, "no payment");
        assertThat(eventStore.findRetryable(10)).extracting(IndexedEvent::id).containsExactly(stored.id());
        boolean second = eventStore.markFailed(stored.id(), 1, "no payment");
        boolean third = eventStore.markFailed(stored.id(), 2, "no payment");

        // then: 상한을 넘어 기록되지 않고 재시도 대상에서 빠진다.
        assertThat(first).isTrue();
        assertThat(second).isTrue();
        assertThat(third).isFalse();
        IndexedEvent failed = eventStore.findById(stored.id()).orElseThrow();
        assertThat(failed.retryCount()).isEqualTo(2);
        assertThat(failed.status()).isEqualTo(EventProcessingStatus.NEEDS_MANUAL_INTERVENTION);
        assertThat(eventStore.findRetryable(10)).isEmpty();
        assertThat(eventStore.countByStatus(EventProcessingStatus.NEEDS_MANUAL_INTERVENTION)).isEqualTo(1);
    }

    @Test
    @DisplayName("find는 필터를 적용하고 blockNumber, logIndex 내림차순으로 페이지를 돌려준다")
    void findShouldFilterAndPage() {
        // given: 두 컨트랙트에 걸친 이벤트 네 건
        eventStore.insertIfAbsent(newEvent(REPAYMENT, TestLogs.proceedsReceived(100, TestLogs.txHash(10), 0, 1, 1), 3));
        eventStore.insertIfAbsent(newEvent(REPAYMENT, TestLogs.paidFunder(101, TestLogs.txHash(11), 0, 1, 1), 3));
        eventStore.insertIfAbsent(newEvent(REPAYMENT, TestLogs.proceedsReceived(101, TestLogs.txHash(11), 1, 1, 1), 3));
        eventStore.insertIfAbsent(newEvent(
            ALLOCATION,
            TestLogs.marketWindowOpened(102, TestLogs.txHash(12), 0, 1, 1_767_225_600L),
            3
        ));

        // when: 컨트랙트 필터 + limit 2
        EventPage page = eventStore.find(new EventFilter(
            TestLogs.NETWORK_ID,
            "0x00000000000000000000000000000000000000AA",
            null,
            null,
            null,
            null,
            2,
            0
        ));

        // then: 전체 3건 중 최신 2건
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.limit()).isEqualTo(2);
        assertThat(page.events())
            .extracting(event -> event.blockNumber() + ":" + event.logIndex())
            .containsExactly("101:1", "101:0");

        EventPage proceedsOnly = eventStore.find(new EventFilter(
            null, null, ProceedsReceived.EVENT_NAME, false, false, EventProcessingStatus.PENDING, null, 1
        ));
        assertThat(proceedsOnly.total()).isEqualTo(2);
        assertThat(proceedsOnly.offset()).isEqualTo(1);
        assertThat(proceedsOnly.events()).extracting(IndexedEvent::blockNumber).containsExactly(100L);
    }

    @Test
    @DisplayName("limit은 최대 100으로 제한된다")
    void findShouldClampLimit() {
        EventPage page = eventStore.find(new EventFilter(null, null, null, null, null, null, 1000, null));

        assertThat(page.limit()).isEqualTo(EventFilter.MAX_LIMIT);
        assertThat(page.offset()).isZero();
    }

    private NewIndexedEvent newEvent(SourceConfig source, RawLog log, int maxRetries) {
        DecodeResult decoded = decoders.decode(source.schemaKind(), log);
        return NewIndexedEvent.from(source, log, BLOCK_TIME, decoded, maxRetries);
    }
}
