package io.lift.indexer.decoder;

import io.lift.indexer.chain.RawLog;
import io.lift.indexer.event.EventPayload;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.utils.Numeric;

/**
 * Topic0 dispatch plus the ABI helpers shared by the contract decoders.
 */
public abstract class AbiLogDecoder implements EventDecoder {

    private final Map<String, Registration> eventsByTopic0 = new HashMap<>();

    protected final void register(Event event, Function<RawLog, EventPayload> decodeFunction) {
        String topic0 = EventEncoder.encode(event).toLowerCase(Locale.ROOT);
        eventsByTopic0.put(topic0, new Registration(event, decodeFunction));
    }

    @Override
    public DecodeResult decode(RawLog log) {
        String topic0 = log.topic0();
        if (topic0.isBlank()) {
            return DecodeResult.failure("Log has no topics");
        }
        Registration registration = eventsByTopic0.get(topic0);
        if (registration == null) {
            return DecodeResult.failure("No " + schemaKind() + " event for topic0 " + topic0);
        }
        try {
            return DecodeResult.decoded(registration.decodeFunction().apply(log));
        } catch (RuntimeException e) {
            return DecodeResult.failure(registration.event().getName() + ": " + e.getMessage());
        }
    }

    public String topic0Of(String eventName) {
        return eventsByTopic0.entrySet()
            .stream()
            .filter(entry -> entry.getValue().event().getName().equals(eventName))
            .map(Map.Entry::getKey)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event: " + eventName));
    }

    protected List<Type> decodeData(RawLog log, Event event) {
        List<Type> decoded;
        try {
            decoded = FunctionReturnDecoder.decode(log.data(), event.getNonIndexedParameters());
        } catch (RuntimeException e) {
            throw new EventDecodeException(event.getName() + " data is not valid ABI", e);
        }
        int expected = event.getNonIndexedParameters().size();
        if (decoded.size() != expected) {
            throw new EventDecodeException(
                event.getName() + " data decode failed: expected " + expected + " fields, got " + decoded.size()
            );
        }
        return decoded;
    }

    protected void ensureTopics(RawLog log, Event event) {
        int expected = event.getIndexedParameters().size() + 1;
        if (log.topics().size() < expected) {
            throw new EventDecodeException(
                event.getName() + " requires at least " + expected + " topics, got " + log.topics().size()
            );
        }
    }

    protected BigInteger uintTopic(String topic) {
        String hex = Numeric.cleanHexPrefix(topic == null ? "" : topic.trim());
        if (hex.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigInteger(hex, 16);
    }

    protected String addressFromTopic(String topic) {
        String hex = Numeric.cleanHexPrefix(topic == null ? "" : topic.trim());
        if (hex.length() < 40) {
            throw new EventDecodeException("Indexed address topic has invalid length: " + topic);
        }
        return "0x" + hex.substring(hex.length() - 40).toLowerCase(Locale.ROOT);
    }

    protected BigInteger uintValue(Type value) {
        if (value instanceof Uint256 uint) {
            return uint.getValue();
        }
        if (value instanceof Uint64 uint) {
            return uint.getValue();
        }
        throw new EventDecodeException("Expected uint but got " + value.getTypeAsString());
    }

    protected String bytes32Hex(Type value) {
        if (!(value instanceof Bytes32 bytes)) {
            throw new EventDecodeException("Expected bytes32 but got " + value.getTypeAsString());
        }
        return Numeric.toHexString(bytes.getValue());
    }

    protected List<BigInteger> uintArray(Type value) {
        if (!(value instanceof DynamicArray<?> array)) {
            throw new EventDecodeException("Expected uint256[] but got " + value.getTypeAsString());
        }
        List<BigInteger> result = new ArrayList<>();
        for (Type element : array.getValue()) {
            result.add(uintValue(element));
        }
        return List.copyOf(result);
    }

    private record Registration(Event event, Function<RawLog, EventPayload> decodeFunction) {
    }
}
