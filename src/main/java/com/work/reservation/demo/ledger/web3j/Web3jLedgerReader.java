package com.work.reservation.demo.ledger.web3j;

import com.work.reservation.core.exception.LedgerRateLimitedException;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.support.LedgerValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Web3j eth_call 的预约读取：
 * - getReservation(bytes32) 读单条详情
 * - totalReservations() + reservationKeyByIndex(uint256) 枚举全量
 *
 * 429 / rate limit 类错误抛 {@link LedgerRateLimitedException}，供上层退避。
 */
public class Web3jLedgerReader implements LedgerReader {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerReader.class);

    private final Web3j web3j;
    private final String contractAddress;

    public Web3jLedgerReader(Web3j web3j, String contractAddress) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
    }

    @Override
    public ReservationRecord getReservation(ReservationKey key) {
        List<Object> out = call(ReservationContractAbi.getReservation(toBytes32(key)));
        if (out.size() < 6) {
            // 空返回按不存在处理（零地址）
            return new ReservationRecord(key, null, LedgerValues.ZERO_ADDRESS, "0", 0L, 0L, 0);
        }
        return new ReservationRecord(key,
                LedgerValues.tokenId(out.get(0)),
                LedgerValues.address(out.get(1)),
                String.valueOf(out.get(2)),
                LedgerValues.asLong(out.get(3)),
                LedgerValues.asLong(out.get(4)),
                ((BigInteger) out.get(5)).intValue());
    }

    @Override
    public List<ReservationRecord> listReservations() {
        List<Object> total = call(ReservationContractAbi.totalReservations());
        long count = total.isEmpty() ? 0L : ((BigInteger) total.get(0)).longValue();
        List<ReservationRecord> result = new ArrayList<>((int) Math.min(count, 1024L));
        for (long i = 0; i < count; i++) {
            List<Object> keyOut = call(ReservationContractAbi.reservationKeyByIndex(BigInteger.valueOf(i)));
            if (keyOut.isEmpty()) {
                continue;
            }
            ReservationRecord r = getReservation(ReservationKey.of(keyOut.get(0)));
            if (r.exists()) {
                result.add(r);
            }
        }
        return result;
    }

    /**
     * 返回按输出参数顺序解码后的原始值（BigInteger / String / byte[] 等）。
     */
    private List<Object> call(Function function) {
        String data = FunctionEncoder.encode(function);
        EthCall resp;
        try {
            resp = web3j.ethCall(Transaction.createEthCallTransaction(null, contractAddress, data),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            log.warn("Web3j eth_call {} failed. err={}", function.getName(), e.getMessage());
            throw wrap(function.getName(), e.getMessage(), e);
        }
        if (resp.hasError()) {
            String msg = resp.getError().getCode() + " " + resp.getError().getMessage();
            throw wrap(function.getName(), msg, null);
        }
        List<Object> values = new ArrayList<>();
        for (Object decoded : FunctionReturnDecoder.decode(resp.getValue(), function.getOutputParameters())) {
            values.add(((Type<?>) decoded).getValue());
        }
        return values;
    }

    private static LedgerReadException wrap(String fn, String msg, Throwable cause) {
        String text = "eth_call " + fn + " failed: " + msg;
        LedgerReadException plain = new LedgerReadException(text, cause);
        return LedgerRateLimitedException.looksRateLimited(plain) ? new LedgerRateLimitedException(text, cause) : plain;
    }

    /**
     * 规范化 key 已是 0x + 64 位十六进制；不透明字符串 key 在链上不存在对应的 bytes32。
     */
    static byte[] toBytes32(ReservationKey key) {
        String v = key.value();
        if (v.length() != 66 || !v.startsWith("0x")) {
            throw new IllegalArgumentException("reservationKey 不是 bytes32: " + key);
        }
        return Numeric.hexStringToByteArray(v);
    }
}
