package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.event.PaidFunder;
import io.lift.indexer.event.PaidPlatform;
import io.lift.indexer.event.PaidSteward;
import io.lift.indexer.event.ProceedsReceived;
import io.lift.indexer.source.SchemaKind;
import java.math.BigInteger;
import java.util.List;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

@Component
public class RepaymentEscrowEventDecoder extends AbiLogDecoder {

    public static final Event PROCEEDS_RECEIVED = new Event(
        ProceedsReceived.EVENT_NAME,
        List.of(
            TypeReference.create(Uint256.class, true),
            TypeReference.create(Uint256.class),
            TypeReference.create(Bytes32.class)
        )
    );

    public static final Event PAID_FUNDER = payoutEvent(PaidFunder.EVENT_NAME);
    public static final Event PAID_PLATFORM = payoutEvent(PaidPlatform.EVENT_NAME);
    public static final Event PAID_STEWARD = payoutEvent(PaidSteward.EVENT_NAME);

    public RepaymentEscrowEventDecoder() {
        register(PROCEEDS_RECEIVED, this::decodeProceedsReceived);
        register(PAID_FUNDER, log -> {
            Payout payout = decodePayout(log, PAID_FUNDER);
            return new PaidFunder(payout.projectId(), payout.amount());
        });
        register(PAID_PLATFORM, log -> {
            Payout payout = decodePayout(log, PAID_PLATFORM);
            return new PaidPlatform(payout.projectId(), payout.amount());
        });
        register(PAID_STEWARD, log -> {
            Payout payout = decodePayout(log, PAID_STEWARD);
            return new PaidSteward(payout.projectId(), payout.amount());
        });
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.REPAYMENT_ESCROW;
    }

    private ProceedsReceived decodeProceedsReceived(RawLog log) {
        ensureTopics(log, PROCEEDS_RECEIVED);
        List<Type> decoded = decodeData(log, PROCEEDS_RECEIVED);
        return new ProceedsReceived(
            uintTopic(log.topics().get(1)),
            uintValue(decoded.get(0)),
            bytes32Hex(decoded.get(1))
        );
    }

    private Payout decodePayout(RawLog log, Event event) {
        ensureTopics(log, event);
        List<Type> decoded = decodeData(log, event);
        return new Payout(uintTopic(log.topics().get(1)), uintValue(decoded.get(0)));
    }

    private static Event payoutEvent(String name) {
        return new Event(
            name,
            List.of(
                TypeReference.create(Uint256.class, true),
                TypeReference.create(Uint256.class)
            )
        );
    }

    private record Payout(BigInteger projectId, BigInteger amount) {
    }
}
