package com.work.reservation.demo.ledger.web3j;

import com.work.reservation.core.ledger.LedgerEventSource;
import com.work.reservation.core.ledger.LedgerLog;
import com.work.reservation.core.ledger.LedgerLogListener;
import com.work.reservation.core.ledger.LedgerSubscription;
import com.work.reservation.core.model.ReservationEventType;
import io.reactivex.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.EventValues;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.tx.Contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 基于 eth_newFilter 轮询的事件订阅。每个事件类型一个过滤器。
 *
 * 过滤器出错后 Flowable 会终止，此处只记录日志；丢失的定案由兜底轮询补齐。
 */
public class Web3jLedgerEventSource implements LedgerEventSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Web3jLedgerEventSource.class);

    private final Web3j web3j;
    private final String contractAddress;
    private final List<Disposable> disposables = new CopyOnWriteArrayList<>();

    public Web3jLedgerEventSource(Web3j web3j, String contractAddress) {
        this.web3j = web3j;
        this.contractAddress = contractAddress;
    }

    @Override
    public LedgerSubscription subscribe(ReservationEventType type, LedgerLogListener listener) {
        Event event = ReservationContractAbi.event(type);
        List<String> names = ReservationContractAbi.argNames(type);

        EthFilter filter = new EthFilter(DefaultBlockParameterName.LATEST, DefaultBlockParameterName.LATEST,
                contractAddress);
        filter.addSingleTopic(EventEncoder.encode(event));

        Disposable d = web3j.ethLogFlowable(filter).subscribe(
                raw -> {
                    LedgerLog decoded = decode(event, names, raw);
                    if (decoded == null) {
                        return;
                    }
                    try {
                        listener.onLogs(Collections.singletonList(decoded));
                    } catch (Exception e) {
                        log.warn("Ledger log listener failed. event={} tx={} err={}",
                                type.getEventName(), raw.getTransactionHash(), e.toString());
                    }
                },
                err -> log.warn("Ledger event filter terminated. event={} err={}", type.getEventName(), err.toString()));
        disposables.add(d);
        log.info("Subscribed {} on {}", type.getEventName(), contractAddress);
        return () -> {
            d.dispose();
            disposables.remove(d);
        };
    }

    static LedgerLog decode(Event event, List<String> names, Log raw) {
        EventValues values = Contract.staticExtractEventParameters(event, raw);
        if (values == null) {
            log.debug("Skip log not matching {}. tx={}", event.getName(), raw.getTransactionHash());
            return null;
        }
        List<Type<?>> ordered = new ArrayList<>();
        for (Object v : values.getIndexedValues()) {
            ordered.add((Type<?>) v);
        }
        for (Object v : values.getNonIndexedValues()) {
            ordered.add((Type<?>) v);
        }
        Map<String, Object> args = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size() && i < names.size(); i++) {
            args.put(names.get(i), ordered.get(i));
        }
        Long block = raw.getBlockNumber() == null ? null : raw.getBlockNumber().longValue();
        return new LedgerLog(args, raw.getTransactionHash(), block);
    }

    @Override
    public void close() {
        for (Disposable d : disposables) {
            d.dispose();
        }
        disposables.clear();
    }
}
