package io.lift.indexer.event;

import java.math.BigInteger;
import java.util.List;

/**
 * ERC-1155 TransferSingle and TransferBatch share this shape; single transfers carry one id/value pair.
 */
public record LiftUnitTransfer(
    boolean batch,
    String operator,
    String from,
    String to,
    List<BigInteger> tokenIds,
    List<BigInteger> amounts
) implements EventPayload {

    public static final String SINGLE_EVENT_NAME = "TransferSingle";
    public static final String BATCH_EVENT_NAME = "TransferBatch";

    public LiftUnitTransfer {
        tokenIds = tokenIds == null ? List.of() : List.copyOf(tokenIds);
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
    }

    @Override
    public String eventName() {
        return batch ? BATCH_EVENT_NAME : SINGLE_EVENT_NAME;
    }
}
