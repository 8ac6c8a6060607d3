package com.work.reservation.core.cache;

import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.support.LedgerValues;

/**
 * 缓存 key 约定。分区形如 "token:7"，其下派生数据形如 "token:7:reservations"，
 * 失效一个分区即失效 base 本身和 "base:" 前缀下的全部条目。
 */
public final class CacheKeys {

    public static final String ALL_BOOKINGS = "bookings:all";
    public static final String SESSION = "session";

    private CacheKeys() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String reservation(ReservationKey key) {
        return "reservation:" + key.value();
    }

    public static String token(String tokenId) {
        return "token:" + tokenId;
    }

    public static String tokenReservations(String tokenId) {
        return token(tokenId) + ":reservations";
    }

    public static String user(String address) {
        return "user:" + LedgerValues.address(address);
    }

    public static String userBookings(String address) {
        return user(address) + ":bookings";
    }
}
