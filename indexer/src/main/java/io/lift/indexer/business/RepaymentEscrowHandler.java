package io.lift.indexer.business;

import io.lift.indexer.event.EventPayload;
import io.lift.indexer.event.PaidFunder;
import io.lift.indexer.event.PaidPlatform;
import io.lift.indexer.event.PaidSteward;
import io.lift.indexer.event.ProceedsReceived;
import io.lift.indexer.handler.BusinessHandler;
import io.lift.indexer.handler.DecodedEvent;
import io.lift.indexer.handler.HandlerResult;
import io.lift.indexer.source.SchemaKind;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class RepaymentEscrowHandler implements BusinessHandler {

    private static final Logger log = LoggerFactory.getLogger(RepaymentEscrowHandler.class);

    private final PaymentRepository paymentRepository;

    public RepaymentEscrowHandler(PaymentRepository paymentRepository) {
        this.paymentRepository = paymentRepository;
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.REPAYMENT_ESCROW;
    }

    @Override
    @Transactional
    public HandlerResult apply(DecodedEvent event) {
        EventPayload payload = event.payload();
        if (payload instanceof ProceedsReceived proceeds) {
            return onProceedsReceived(event, proceeds);
        }
        if (payload instanceof PaidFunder paid) {
            log.info("Funder payment processed: projectId={}, amount={}, tx={}", paid.projectId(), paid.amount(), event.txHash());
        } else if (payload instanceof PaidPlatform paid) {
            log.info("Platform fee processed: projectId={}, amount={}, tx={}", paid.projectId(), paid.amount(), event.txHash());
        } else if (payload instanceof PaidSteward paid) {
            log.info("Steward payment processed: projectId={}, amount={}, tx={}", paid.projectId(), paid.amount(), event.txHash());
        } else {
            log.debug("Ignoring {} on {}", event.eventName(), schemaKind());
        }
        return HandlerResult.ok();
    }

    private HandlerResult onProceedsReceived(DecodedEvent event, ProceedsReceived proceeds) {
        Optional<PaymentRow> payment =
            paymentRepository.findByConsideration(proceeds.projectId(), proceeds.considerationRef());
        if (payment.isEmpty()) {
            // The payment row may be written after the chain event; the retry sweep picks this up again.
            return HandlerResult.failed(
                "No payment for projectId=" + proceeds.projectId() + ", considerationRef=" + proceeds.considerationRef()
            );
        }

        PaymentRow row = payment.get();
        paymentRepository.markInEscrow(row.id());
        boolean recorded = paymentRepository.insertPaymentEventIfAbsent(
            row.id(),
            PaymentRepository.EVENT_PROCEEDS_NOTIFIED,
            proceeds.amount(),
            event.eventId()
        );
        log.info(
            "Proceeds received: paymentId={}, projectId={}, amount={}, newPaymentEvent={}",
            row.id(),
            proceeds.projectId(),
            proceeds.amount(),
            recorded
        );
        return HandlerResult.ok();
    }
}
