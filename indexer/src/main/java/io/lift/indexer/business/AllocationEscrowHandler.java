package io.lift.indexer.business;

import io.lift.indexer.event.EventPayload;
import io.lift.indexer.event.MarketWindowExtended;
import io.lift.indexer.event.MarketWindowOpened;
import io.lift.indexer.event.UnitsSold;
import io.lift.indexer.handler.BusinessHandler;
import io.lift.indexer.handler.DecodedEvent;
import io.lift.indexer.handler.HandlerResult;
import io.lift.indexer.source.SchemaKind;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class AllocationEscrowHandler implements BusinessHandler {

    private static final Logger log = LoggerFactory.getLogger(AllocationEscrowHandler.class);

    private final PaymentRepository paymentRepository;
    private final LiftUnitRepository liftUnitRepository;

    public AllocationEscrowHandler(PaymentRepository paymentRepository, LiftUnitRepository liftUnitRepository) {
        this.paymentRepository = paymentRepository;
        this.liftUnitRepository = liftUnitRepository;
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.ALLOCATION_ESCROW;
    }

    @Override
    @Transactional
    public HandlerResult apply(DecodedEvent event) {
        EventPayload payload = event.payload();
        if (payload instanceof UnitsSold sold) {
            return onUnitsSold(event, sold);
        }
        if (payload instanceof MarketWindowOpened opened) {
            log.info(
                "Market window opened: projectId={}, closesAt={}",
                opened.projectId(),
                Instant.ofEpochSecond(opened.closesAt())
            );
        } else if (payload instanceof MarketWindowExtended extended) {
            log.info(
                "Market window extended: projectId={}, newClosesAt={}",
                extended.projectId(),
                Instant.ofEpochSecond(extended.newClosesAt())
            );
        } else {
            log.debug("Ignoring {} on {}", event.eventName(), schemaKind());
        }
        return HandlerResult.ok();
    }

    private HandlerResult onUnitsSold(DecodedEvent event, UnitsSold sold) {
        if (sold.tokenIds().size() != sold.amounts().size()) {
            return HandlerResult.failed(
                "UnitsSold tokenIds/amounts length mismatch: " + sold.tokenIds().size() + " vs " + sold.amounts().size()
            );
        }

        PaymentRow payment = paymentRepository.createPurchaseIfAbsent(
            sold.projectId(),
            sold.considerationRef(),
            sold.proceeds(),
            event.networkId(),
            sold.beneficiary(),
            event.blockTimestamp()
        );
        for (int i = 0; i < sold.tokenIds().size(); i++) {
            liftUnitRepository.markSold(
                sold.tokenIds().get(i),
                sold.projectId(),
                sold.amounts().get(i),
                sold.beneficiary(),
                event.blockTimestamp()
            );
        }

        log.info(
            "Units sold: projectId={}, beneficiary={}, tokenCount={}, proceeds={}, paymentId={}",
            sold.projectId(),
            sold.beneficiary(),
            sold.tokenIds().size(),
            sold.proceeds(),
            payment.id()
        );
        return HandlerResult.ok();
    }
}
