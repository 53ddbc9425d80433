package io.lift.indexer.business;

import java.math.BigInteger;
import java.util.UUID;

public record PaymentRow(
    UUID id,
    String paymentType,
    BigInteger projectId,
    String considerationRef,
    BigInteger amount,
    String status,
    boolean proceedsNotified
) {
}
