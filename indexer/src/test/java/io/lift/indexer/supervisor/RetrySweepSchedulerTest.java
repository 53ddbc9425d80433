package io.lift.indexer.supervisor;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.lift.indexer.config.IndexerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrySweepSchedulerTest {

    @Mock
    private IndexerSupervisor supervisor;

    @Test
    @DisplayName("retry sweep이 비활성화되어 있으면 아무것도 재시도하지 않는다")
    void sweepShouldSkipWhenDisabled() {
        IndexerProperties properties = new IndexerProperties();
        properties.getRetrySweep().setEnabled(false);

        new RetrySweepScheduler(properties, supervisor).sweep();

        verify(supervisor, never()).retryFailedEvents(anyInt());
    }

    @Test
    @DisplayName("활성화되어 있으면 설정된 batchSize로 retryFailedEvents를 호출한다")
    void sweepShouldRetryWithConfiguredBatchSize() {
        IndexerProperties properties = new IndexerProperties();
        properties.getRetrySweep().setEnabled(true);
        properties.getRetrySweep().setBatchSize(25);
        when(supervisor.retryFailedEvents(25)).thenReturn(new RetrySweepResult(3, 1, 0));

        new RetrySweepScheduler(properties, supervisor).sweep();

        verify(supervisor).retryFailedEvents(25);
    }

    @Test
    @DisplayName("sweep 실패는 스케줄러 스레드 밖으로 던지지 않는다")
    void sweepShouldNotPropagateFailure() {
        IndexerProperties properties = new IndexerProperties();
        properties.getRetrySweep().setEnabled(true);
        when(supervisor.retryFailedEvents(anyInt())).thenThrow(new IllegalStateException("database down"));

        new RetrySweepScheduler(properties, supervisor).sweep();

        verify(supervisor).retryFailedEvents(100);
    }
}
