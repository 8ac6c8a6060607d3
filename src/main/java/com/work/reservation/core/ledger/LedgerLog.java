package com.work.reservation.core.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 事件订阅投递的单条已解码日志。args 的数值字段编码不统一（BigInteger / 数字 / 字符串 / ABI 类型），
 * 使用前必须经过规范化。
 */
public class LedgerLog {

    private final Map<String, Object> args;
    private final String transactionHash;
    private final Long blockNumber;

    public LedgerLog(Map<String, Object> args, String transactionHash, Long blockNumber) {
        this.args = args == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        this.transactionHash = transactionHash;
        this.blockNumber = blockNumber;
    }

    public static LedgerLog of(Map<String, Object> args) {
        return new LedgerLog(args, null, null);
    }

    public Map<String, Object> getArgs() {
        return args;
    }

    public Object arg(String name) {
        return args.get(name);
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public Long getBlockNumber() {
        return blockNumber;
    }
}
