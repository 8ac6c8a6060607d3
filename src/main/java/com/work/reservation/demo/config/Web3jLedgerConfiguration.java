package com.work.reservation.demo.config;

import com.work.reservation.demo.ledger.web3j.Web3jLedgerEventSource;
import com.work.reservation.demo.ledger.web3j.Web3jLedgerReader;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.concurrent.TimeUnit;

/**
 * Web3j 装配：
 * 当 ledger.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "ledger", name = "mode", havingValue = "web3j")
public class Web3jLedgerConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(LedgerProperties properties) {
        long timeoutMillis = properties.getRequestTimeout().toMillis();
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .build();
        // HTTP RPC + 过滤器轮询；如需推送订阅，可改为 WebSocketService
        return Web3j.build(new HttpService(properties.getRpcUrl(), http),
                properties.getEventPollInterval().toMillis(),
                org.web3j.utils.Async.defaultExecutorService());
    }

    @Bean
    public Web3jLedgerReader web3jLedgerReader(Web3j web3j, LedgerProperties properties) {
        return new Web3jLedgerReader(web3j, requireContract(properties));
    }

    @Bean(destroyMethod = "close")
    public Web3jLedgerEventSource web3jLedgerEventSource(Web3j web3j, LedgerProperties properties) {
        return new Web3jLedgerEventSource(web3j, requireContract(properties));
    }

    private static String requireContract(LedgerProperties properties) {
        String address = properties.getContractAddress();
        if (address == null || address.trim().isEmpty()) {
            throw new IllegalStateException("ledger.contract-address 不能为空（ledger.mode=web3j）");
        }
        return address.trim();
    }
}
