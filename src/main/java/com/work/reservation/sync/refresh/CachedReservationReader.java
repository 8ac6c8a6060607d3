package com.work.reservation.sync.refresh;

import com.work.reservation.core.cache.CacheKeys;
import com.work.reservation.core.cache.ReservationCacheManager;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.ledger.LedgerReader;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.sync.config.ReservationSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 单条预约详情的读穿缓存：先查新鲜缓存，再读链；读链失败时回退到旧值。
 *
 * 兜底轮询需要链上真值，不走这里，直接使用 {@link LedgerReader}。
 */
@Service
public class CachedReservationReader {

    private static final Logger log = LoggerFactory.getLogger(CachedReservationReader.class);

    private final LedgerReader ledgerReader;
    private final ReservationCacheManager cache;
    private final ReservationSyncProperties props;

    public CachedReservationReader(LedgerReader ledgerReader,
                                   ReservationCacheManager cache,
                                   ReservationSyncProperties props) {
        this.ledgerReader = ledgerReader;
        this.cache = cache;
        this.props = props;
    }

    public ReservationRecord getReservation(ReservationKey key) {
        String cacheKey = CacheKeys.reservation(key);
        Optional<ReservationRecord> fresh = cache.get(cacheKey, ReservationRecord.class, false);
        if (fresh.isPresent()) {
            return fresh.get();
        }
        try {
            ReservationRecord record = ledgerReader.getReservation(key);
            cache.put(cacheKey, record, props.getCache().getReservationTtl());
            return record;
        } catch (RuntimeException e) {
            Optional<ReservationRecord> stale = cache.get(cacheKey, ReservationRecord.class, true);
            if (stale.isPresent()) {
                log.warn("Ledger read failed, serving stale reservation. key={} err={}", key, e.toString());
                return stale.get();
            }
            if (e instanceof LedgerReadException) {
                throw e;
            }
            throw new LedgerReadException("getReservation failed: " + key, e);
        }
    }
}
