package io.lift.indexer.chain;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlock;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;

public class Web3jChainReader implements ChainReader {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainReader.class);

    private static final Comparator<RawLog> LOG_ORDER = Comparator
        .comparingLong(RawLog::blockNumber)
        .thenComparingLong(RawLog::logIndex);

    private final Map<Long, Web3j> clients;

    public Web3jChainReader(Map<Long, Web3j> clients) {
        this.clients = Map.copyOf(clients);
    }

    public void shutdown() {
        clients.values().forEach(Web3j::shutdown);
    }

    @Override
    public boolean supportsNetwork(long networkId) {
        return clients.containsKey(networkId);
    }

    @Override
    public long headHeight(long networkId) {
        EthBlockNumber response = send(client(networkId).ethBlockNumber(), "eth_blockNumber");
        BigInteger head = response.getBlockNumber();
        if (head == null) {
            throw new ChainReaderException("eth_blockNumber returned no value on network " + networkId);
        }
        return head.longValueExact();
    }

    @Override
    public List<RawLog> getLogs(long networkId, String contractAddress, long fromHeight, long toHeight) {
        if (fromHeight > toHeight) {
            return List.of();
        }
        List<RawLog> logs = fetchRange(networkId, contractAddress, fromHeight, toHeight);
        logs.sort(LOG_ORDER);
        return List.copyOf(logs);
    }

    @Override
    public Instant blockTimestamp(long networkId, String blockHash) {
        EthBlock response = send(client(networkId).ethGetBlockByHash(blockHash, false), "eth_getBlockByHash");
        EthBlock.Block block = response.getBlock();
        if (block == null || block.getTimestamp() == null) {
            throw new ChainReaderException("Missing block for hash: " + blockHash);
        }
        return Instant.ofEpochSecond(block.getTimestamp().longValueExact());
    }

    private List<RawLog> fetchRange(long networkId, String contractAddress, long fromHeight, long toHeight) {
        try {
            return fetchContractLogs(networkId, contractAddress, fromHeight, toHeight);
        } catch (ChainReaderException e) {
            if (!isRangeTooLargeError(e) || fromHeight >= toHeight) {
                throw e;
            }
            long middle = fromHeight + (toHeight - fromHeight) / 2;
            log.warn(
                "eth_getLogs window too large; splitting network={}, address={}, from={}, to={}",
                networkId,
                contractAddress,
                fromHeight,
                toHeight
            );
            List<RawLog> logs = new ArrayList<>(fetchRange(networkId, contractAddress, fromHeight, middle));
            logs.addAll(fetchRange(networkId, contractAddress, middle + 1, toHeight));
            return logs;
        }
    }

    private List<RawLog> fetchContractLogs(long networkId, String contractAddress, long fromHeight, long toHeight) {
        EthFilter filter = new EthFilter(
            DefaultBlockParameter.valueOf(BigInteger.valueOf(fromHeight)),
            DefaultBlockParameter.valueOf(BigInteger.valueOf(toHeight)),
            contractAddress
        );
        EthLog response = send(client(networkId).ethGetLogs(filter), "eth_getLogs");

        List<RawLog> logs = new ArrayList<>();
        for (EthLog.LogResult<?> result : response.getLogs()) {
            if (!(result.get() instanceof Log chainLog)) {
                throw new ChainReaderException("eth_getLogs returned a non-log entry for " + contractAddress);
            }
            if (chainLog.isRemoved()) {
                continue;
            }
            logs.add(toRawLog(chainLog));
        }
        return logs;
    }

    private RawLog toRawLog(Log chainLog) {
        if (chainLog.getTransactionHash() == null || chainLog.getLogIndex() == null || chainLog.getBlockNumber() == null) {
            throw new ChainReaderException("Malformed log without txHash/logIndex/blockNumber");
        }
        BigInteger txIndex = chainLog.getTransactionIndex();
        return new RawLog(
            chainLog.getTransactionHash(),
            chainLog.getLogIndex().longValueExact(),
            chainLog.getBlockNumber().longValueExact(),
            chainLog.getBlockHash(),
            txIndex == null ? 0L : txIndex.longValueExact(),
            chainLog.getAddress(),
            chainLog.getTopics(),
            chainLog.getData()
        );
    }

    private <T extends Response<?>> T send(Request<?, T> request, String method) {
        T response;
        try {
            response = request.send();
        } catch (IOException e) {
            throw new ChainReaderException(method + " transport failure: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ChainReaderException(method + " returned no response");
        }
        if (response.hasError()) {
            throw new ChainReaderException(
                method + " failed(code=" + response.getError().getCode() + "): " + response.getError().getMessage()
            );
        }
        return response;
    }

    private Web3j client(long networkId) {
        Web3j web3j = clients.get(networkId);
        if (web3j == null) {
            throw new ChainReaderException("No RPC endpoint configured for network " + networkId);
        }
        return web3j;
    }

    private boolean isRangeTooLargeError(Exception e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("query returned more than")
            || normalized.contains("too many results")
            || normalized.contains("request too large")
            || normalized.contains("response size exceeded")
            || normalized.contains("block range")
            || normalized.contains("limit exceeded");
    }
}
