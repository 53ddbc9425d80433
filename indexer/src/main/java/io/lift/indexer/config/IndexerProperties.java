package io.lift.indexer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "lift.indexer")
public class IndexerProperties {

    @Min(1)
    private long pollIntervalMs = 30000L;
    @Min(1)
    private int maxRetries = 3;
    @Min(1)
    private long staleThresholdMs = 300000L;
    @Min(1)
    private long handlerTimeoutMs = 30000L;
    @Min(1)
    private int schedulerPoolSize = 4;
    @Min(1)
    private int handlerPoolSize = 4;
    private boolean autoStart;
    @Valid
    private final Rpc rpc = new Rpc();
    @Valid
    private final RetrySweep retrySweep = new RetrySweep();
    @Valid
    private List<Network> networks = new ArrayList<>();
    @Valid
    private List<Source> sources = new ArrayList<>();

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getStaleThresholdMs() {
        return staleThresholdMs;
    }

    public void setStaleThresholdMs(long staleThresholdMs) {
        this.staleThresholdMs = staleThresholdMs;
    }

    public long getHandlerTimeoutMs() {
        return handlerTimeoutMs;
    }

    public void setHandlerTimeoutMs(long handlerTimeoutMs) {
        this.handlerTimeoutMs = handlerTimeoutMs;
    }

    public int getSchedulerPoolSize() {
        return schedulerPoolSize;
    }

    public void setSchedulerPoolSize(int schedulerPoolSize) {
        this.schedulerPoolSize = schedulerPoolSize;
    }

    public int getHandlerPoolSize() {
        return handlerPoolSize;
    }

    public void setHandlerPoolSize(int handlerPoolSize) {
        this.handlerPoolSize = handlerPoolSize;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Rpc getRpc() {
        return rpc;
    }

    public RetrySweep getRetrySweep() {
        return retrySweep;
    }

    public List<Network> getNetworks() {
        return networks;
    }

    public void setNetworks(List<Network> networks) {
        this.networks = networks;
    }

    public List<Source> getSources() {
        return sources;
    }

    public void setSources(List<Source> sources) {
        this.sources = sources;
    }

    public static class Rpc {
        @Min(1)
        private long connectTimeoutMs = 10000L;
        @Min(1)
        private long readTimeoutMs = 30000L;

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(long readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }
    }

    public static class RetrySweep {
        private boolean enabled;
        @Min(1)
        private long intervalMs = 60000L;
        @Min(1)
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalMs() {
            return intervalMs;
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Network {
        @Min(1)
        private long networkId;
        @NotBlank
        private String rpcUrl;

        public long getNetworkId() {
            return networkId;
        }

        public void setNetworkId(long networkId) {
            this.networkId = networkId;
        }

        public String getRpcUrl() {
            return rpcUrl;
        }

        public void setRpcUrl(String rpcUrl) {
            this.rpcUrl = rpcUrl;
        }
    }

    public static class Source {
        @Min(1)
        private long networkId;
        @NotBlank
        private String contractAddress;
        @NotBlank
        private String schemaKind;
        private Long startHeight;
        private Integer confirmations;
        private Integer batchSize;

        public long getNetworkId() {
            return networkId;
        }

        public void setNetworkId(long networkId) {
            this.networkId = networkId;
        }

        public String getContractAddress() {
            return contractAddress;
        }

        public void setContractAddress(String contractAddress) {
            this.contractAddress = contractAddress;
        }

        public String getSchemaKind() {
            return schemaKind;
        }

        public void setSchemaKind(String schemaKind) {
            this.schemaKind = schemaKind;
        }

        public Long getStartHeight() {
            return startHeight;
        }

        public void setStartHeight(Long startHeight) {
            this.startHeight = startHeight;
        }

        public Integer getConfirmations() {
            return confirmations;
        }

        public void setConfirmations(Integer confirmations) {
            this.confirmations = confirmations;
        }

        public Integer getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(Integer batchSize) {
            this.batchSize = batchSize;
        }
    }
}
