package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.event.LiftUnitTransfer;
import io.lift.indexer.source.SchemaKind;
import java.math.BigInteger;
import java.util.List;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

/**
 * ERC-1155 transfer events of the lift unit token.
 */
@Component
public class LiftUnitsEventDecoder extends AbiLogDecoder {

    public static final Event TRANSFER_SINGLE = new Event(
        LiftUnitTransfer.SINGLE_EVENT_NAME,
        List.of(
            TypeReference.create(Address.class, true),
            TypeReference.create(Address.class, true),
            TypeReference.create(Address.class, true),
            TypeReference.create(Uint256.class),
            TypeReference.create(Uint256.class)
        )
    );

    public static final Event TRANSFER_BATCH = new Event(
        LiftUnitTransfer.BATCH_EVENT_NAME,
        List.of(
            TypeReference.create(Address.class, true),
            TypeReference.create(Address.class, true),
            TypeReference.create(Address.class, true),
            new TypeReference<DynamicArray<Uint256>>() {
            },
            new TypeReference<DynamicArray<Uint256>>() {
            }
        )
    );

    public LiftUnitsEventDecoder() {
        register(TRANSFER_SINGLE, this::decodeTransferSingle);
        register(TRANSFER_BATCH, this::decodeTransferBatch);
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.LIFT_UNITS;
    }

    private LiftUnitTransfer decodeTransferSingle(RawLog log) {
        ensureTopics(log, TRANSFER_SINGLE);
        List<Type> decoded = decodeData(log, TRANSFER_SINGLE);
        BigInteger tokenId = uintValue(decoded.get(0));
        BigInteger value = uintValue(decoded.get(1));
        return new LiftUnitTransfer(
            false,
            addressFromTopic(log.topics().get(1)),
            addressFromTopic(log.topics().get(2)),
            addressFromTopic(log.topics().get(3)),
            List.of(tokenId),
            List.of(value)
        );
    }

    private LiftUnitTransfer decodeTransferBatch(RawLog log) {
        ensureTopics(log, TRANSFER_BATCH);
        List<Type> decoded = decodeData(log, TRANSFER_BATCH);
        List<BigInteger> ids = uintArray(decoded.get(0));
        List<BigInteger> values = uintArray(decoded.get(1));
        if (ids.size() != values.size()) {
            throw new EventDecodeException(
                "TransferBatch ids/values size mismatch: " + ids.size() + " != " + values.size()
            );
        }
        return new LiftUnitTransfer(
            true,
            addressFromTopic(log.topics().get(1)),
            addressFromTopic(log.topics().get(2)),
            addressFromTopic(log.topics().get(3)),
            ids,
            values
        );
    }
}
