package io.lift.indexer.business;

import io.lift.indexer.event.LiftUnitTransfer;
import io.lift.indexer.handler.BusinessHandler;
import io.lift.indexer.handler.DecodedEvent;
import io.lift.indexer.handler.HandlerResult;
import io.lift.indexer.source.SchemaKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class LiftUnitTransferHandler implements BusinessHandler {

    private static final Logger log = LoggerFactory.getLogger(LiftUnitTransferHandler.class);

    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final LiftUnitRepository liftUnitRepository;

    public LiftUnitTransferHandler(LiftUnitRepository liftUnitRepository) {
        this.liftUnitRepository = liftUnitRepository;
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.LIFT_UNITS;
    }

    @Override
    @Transactional
    public HandlerResult apply(DecodedEvent event) {
        if (!(event.payload() instanceof LiftUnitTransfer transfer)) {
            log.debug("Ignoring {} on {}", event.eventName(), schemaKind());
            return HandlerResult.ok();
        }
        if (transfer.tokenIds().size() != transfer.amounts().size()) {
            return HandlerResult.failed(
                "Transfer ids/values length mismatch: " + transfer.tokenIds().size() + " vs " + transfer.amounts().size()
            );
        }

        boolean burned = ZERO_ADDRESS.equals(transfer.to());
        int changed = 0;
        for (int i = 0; i < transfer.tokenIds().size(); i++) {
            if (liftUnitRepository.applyTransfer(
                transfer.tokenIds().get(i),
                transfer.amounts().get(i),
                transfer.to(),
                burned,
                event.blockNumber(),
                event.logIndex()
            )) {
                changed++;
            }
        }
        log.info(
            "Lift unit transfer applied: tx={}, logIndex={}, from={}, to={}, tokens={}, changed={}",
            event.txHash(),
            event.logIndex(),
            transfer.from(),
            transfer.to(),
            transfer.tokenIds().size(),
            changed
        );
        return HandlerResult.ok();
    }
}
