package io.lift.indexer.event;

import java.math.BigInteger;
import java.util.List;

public record UnitsSold(
    BigInteger projectId,
    String beneficiary,
    List<BigInteger> tokenIds,
    List<BigInteger> amounts,
    String considerationRef,
    BigInteger proceeds
) implements EventPayload {

    public static final String EVENT_NAME = "UnitsSold";

    public UnitsSold {
        tokenIds = tokenIds == null ? List.of() : List.copyOf(tokenIds);
        amounts = amounts == null ? List.of() : List.copyOf(amounts);
    }

    @Override
    public String eventName() {
        return EVENT_NAME;
    }
}
