package io.lift.indexer.config;

import io.lift.indexer.chain.Web3jChainReader;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Configuration
public class Web3Config {

    private static final Logger log = LoggerFactory.getLogger(Web3Config.class);

    @Bean
    public OkHttpClient rpcHttpClient(IndexerProperties properties) {
        IndexerProperties.Rpc rpc = properties.getRpc();
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofMillis(rpc.getConnectTimeoutMs()))
            .readTimeout(Duration.ofMillis(rpc.getReadTimeoutMs()))
            .writeTimeout(Duration.ofMillis(rpc.getReadTimeoutMs()))
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public Web3jChainReader chainReader(IndexerProperties properties, OkHttpClient rpcHttpClient) {
        Map<Long, Web3j> clients = new HashMap<>();
        for (IndexerProperties.Network network : properties.getNetworks()) {
            Web3j previous = clients.put(
                network.getNetworkId(),
                Web3j.build(new HttpService(network.getRpcUrl(), rpcHttpClient))
            );
            if (previous != null) {
                throw new IllegalStateException("Duplicate RPC configuration for network " + network.getNetworkId());
            }
            log.info("Configured RPC client: networkId={}, rpcUrl={}", network.getNetworkId(), network.getRpcUrl());
        }
        return new Web3jChainReader(clients);
    }
}
