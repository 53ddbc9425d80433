package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.event.MarketWindowExtended;
import io.lift.indexer.event.MarketWindowOpened;
import io.lift.indexer.event.UnitsSold;
import io.lift.indexer.source.SchemaKind;
import java.util.List;
import org.springframework.stereotype.Component;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;

@Component
public class AllocationEscrowEventDecoder extends AbiLogDecoder {

    public static final Event UNITS_SOLD = new Event(
        UnitsSold.EVENT_NAME,
        List.of(
            TypeReference.create(Uint256.class, true),
            TypeReference.create(Address.class, true),
            new TypeReference<DynamicArray<Uint256>>() {
            },
            new TypeReference<DynamicArray<Uint256>>() {
            },
            TypeReference.create(Bytes32.class),
            TypeReference.create(Uint256.class)
        )
    );

    public static final Event MARKET_WINDOW_OPENED = new Event(
        MarketWindowOpened.EVENT_NAME,
        List.of(
            TypeReference.create(Uint256.class, true),
            TypeReference.create(Uint64.class)
        )
    );

    public static final Event MARKET_WINDOW_EXTENDED = new Event(
        MarketWindowExtended.EVENT_NAME,
        List.of(
            TypeReference.create(Uint256.class, true),
            TypeReference.create(Uint64.class)
        )
    );

    public AllocationEscrowEventDecoder() {
        register(UNITS_SOLD, this::decodeUnitsSold);
        register(MARKET_WINDOW_OPENED, this::decodeMarketWindowOpened);
        register(MARKET_WINDOW_EXTENDED, this::decodeMarketWindowExtended);
    }

    @Override
    public SchemaKind schemaKind() {
        return SchemaKind.ALLOCATION_ESCROW;
    }

    private UnitsSold decodeUnitsSold(RawLog log) {
        ensureTopics(log, UNITS_SOLD);
        List<Type> decoded = decodeData(log, UNITS_SOLD);
        UnitsSold event = new UnitsSold(
            uintTopic(log.topics().get(1)),
            addressFromTopic(log.topics().get(2)),
            uintArray(decoded.get(0)),
            uintArray(decoded.get(1)),
            bytes32Hex(decoded.get(2)),
            uintValue(decoded.get(3))
        );
        if (event.tokenIds().size() != event.amounts().size()) {
            throw new EventDecodeException(
                "UnitsSold tokenIds/amounts size mismatch: " + event.tokenIds().size() + " != " + event.amounts().size()
            );
        }
        return event;
    }

    private MarketWindowOpened decodeMarketWindowOpened(RawLog log) {
        ensureTopics(log, MARKET_WINDOW_OPENED);
        List<Type> decoded = decodeData(log, MARKET_WINDOW_OPENED);
        return new MarketWindowOpened(uintTopic(log.topics().get(1)), uintValue(decoded.get(0)).longValueExact());
    }

    private MarketWindowExtended decodeMarketWindowExtended(RawLog log) {
        ensureTopics(log, MARKET_WINDOW_EXTENDED);
        List<Type> decoded = decodeData(log, MARKET_WINDOW_EXTENDED);
        return new MarketWindowExtended(uintTopic(log.topics().get(1)), uintValue(decoded.get(0)).longValueExact());
    }
}
