package com.work.reservation.demo.ledger.web3j;

import com.work.reservation.core.model.ReservationEventType;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint96;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 预约合约的 ABI 片段（只包含对账需要的事件与只读方法）。
 *
 * 事件参数顺序即 {@link #argNames(ReservationEventType)} 的顺序：先 indexed，后 non-indexed。
 */
final class ReservationContractAbi {

    static final Event RESERVATION_REQUESTED = new Event("ReservationRequested", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {
            },
            new TypeReference<Uint256>(true) {
            },
            new TypeReference<Address>(true) {
            },
            new TypeReference<Uint32>() {
            },
            new TypeReference<Uint32>() {
            }));

    static final Event RESERVATION_CONFIRMED = new Event("ReservationConfirmed", keyAndToken());

    static final Event BOOKING_CANCELED = new Event("BookingCanceled", keyAndToken());

    static final Event RESERVATION_REQUEST_CANCELED = new Event("ReservationRequestCanceled", keyAndToken());

    static final Event RESERVATION_REQUEST_DENIED = new Event("ReservationRequestDenied", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {
            },
            new TypeReference<Uint256>(true) {
            },
            new TypeReference<Uint8>() {
            }));

    private ReservationContractAbi() {
    }

    static Event event(ReservationEventType type) {
        switch (type) {
            case REQUESTED:
                return RESERVATION_REQUESTED;
            case CONFIRMED:
                return RESERVATION_CONFIRMED;
            case BOOKING_CANCELED:
                return BOOKING_CANCELED;
            case REQUEST_CANCELED:
                return RESERVATION_REQUEST_CANCELED;
            case DENIED:
                return RESERVATION_REQUEST_DENIED;
            default:
                throw new IllegalArgumentException("unsupported event: " + type);
        }
    }

    static List<String> argNames(ReservationEventType type) {
        switch (type) {
            case REQUESTED:
                return Arrays.asList("reservationKey", "tokenId", "renter", "start", "end");
            case DENIED:
                return Arrays.asList("reservationKey", "tokenId", "reason");
            default:
                return Arrays.asList("reservationKey", "tokenId");
        }
    }

    /**
     * getReservation(bytes32) returns (uint256 labId, address renter, uint96 price, uint32 start, uint32 end, uint8 status)
     */
    static Function getReservation(byte[] reservationKey) {
        return new Function("getReservation",
                Collections.<Type>singletonList(new Bytes32(reservationKey)),
                Arrays.<TypeReference<?>>asList(
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<Address>() {
                        },
                        new TypeReference<Uint96>() {
                        },
                        new TypeReference<Uint32>() {
                        },
                        new TypeReference<Uint32>() {
                        },
                        new TypeReference<Uint8>() {
                        }));
    }

    static Function totalReservations() {
        return new Function("totalReservations", Collections.<Type>emptyList(),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint256>() {
                }));
    }

    static Function reservationKeyByIndex(BigInteger index) {
        return new Function("reservationKeyByIndex",
                Collections.<Type>singletonList(new Uint256(index)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bytes32>() {
                }));
    }

    private static List<TypeReference<?>> keyAndToken() {
        return Arrays.<TypeReference<?>>asList(
                new TypeReference<Bytes32>(true) {
                },
                new TypeReference<Uint256>(true) {
                });
    }
}
