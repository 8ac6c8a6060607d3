package com.work.reservation.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 账本连接配置（demo/宿主侧）。
 *
 * mode=mock: 使用内存 MockLedger
 * mode=web3j: 通过 JSON-RPC 读取预约合约并订阅事件
 */
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * 预约合约地址（web3j 模式必填）
     */
    private String contractAddress;

    /**
     * 事件过滤器轮询间隔
     */
    private Duration eventPollInterval = Duration.ofSeconds(2);

    /**
     * RPC 请求超时
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public Duration getEventPollInterval() {
        return eventPollInterval;
    }

    public void setEventPollInterval(Duration eventPollInterval) {
        this.eventPollInterval = eventPollInterval;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
