package com.work.reservation.demo.ledger.web3j;

import com.work.reservation.core.exception.LedgerRateLimitedException;
import com.work.reservation.core.exception.LedgerReadException;
import com.work.reservation.core.model.ReservationKey;
import com.work.reservation.core.model.ReservationRecord;
import com.work.reservation.core.model.ReservationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.abi.datatypes.generated.Uint96;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthCall;

import java.io.IOException;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class Web3jLedgerReaderTest {

    private static final String RENTER = "0x00000000000000000000000000000000000000aa";

    private Web3j web3j;
    private Request<?, ?> request;
    private Web3jLedgerReader reader;

    @BeforeEach
    public void setUp() {
        web3j = mock(Web3j.class);
        request = mock(Request.class);
        doReturn(request).when(web3j).ethCall(any(), any());
        reader = new Web3jLedgerReader(web3j, "0x00000000000000000000000000000000000000c0");
    }

    @Test
    public void hex_and_decimal_keys_pad_to_32_bytes() {
        byte[] hex = Web3jLedgerReader.toBytes32(ReservationKey.of("0x0102"));
        byte[] dec = Web3jLedgerReader.toBytes32(ReservationKey.of("258"));

        assertEquals(32, hex.length);
        assertEquals(1, hex[30]);
        assertEquals(2, hex[31]);
        assertArrayEquals(hex, dec);
    }

    @Test
    public void decodes_reservation_struct() throws Exception {
        EthCall resp = new EthCall();
        resp.setResult("0x"
                + TypeEncoder.encode(new Uint256(7))
                + TypeEncoder.encode(new Address(RENTER))
                + TypeEncoder.encode(new Uint96(BigInteger.valueOf(1000)))
                + TypeEncoder.encode(new Uint32(100))
                + TypeEncoder.encode(new Uint32(200))
                + TypeEncoder.encode(new Uint8(ReservationStatus.BOOKED.getCode())));
        doReturn(resp).when(request).send();

        ReservationRecord record = reader.getReservation(ReservationKey.of("0x01"));

        assertTrue(record.exists());
        assertEquals("7", record.getTokenId());
        assertEquals(RENTER, record.getRenter());
        assertEquals("1000", record.getPrice());
        assertEquals(Long.valueOf(200L), record.getEnd());
        assertEquals(ReservationStatus.BOOKED, record.getStatus());
    }

    @Test
    public void empty_result_is_treated_as_missing() throws Exception {
        EthCall resp = new EthCall();
        resp.setResult("0x");
        doReturn(resp).when(request).send();

        assertFalse(reader.getReservation(ReservationKey.of("0x01")).exists());
    }

    @Test
    public void rpc_429_becomes_rate_limited_error() throws Exception {
        EthCall resp = new EthCall();
        resp.setError(new Response.Error(429, "Too Many Requests"));
        doReturn(resp).when(request).send();

        assertThrows(LedgerRateLimitedException.class, () -> reader.getReservation(ReservationKey.of("0x01")));
    }

    @Test
    public void io_failure_becomes_read_error() throws Exception {
        doThrow(new IOException("connection refused")).when(request).send();

        LedgerReadException e = assertThrows(LedgerReadException.class,
                () -> reader.getReservation(ReservationKey.of("0x01")));
        assertFalse(e.isRateLimited());
        assertTrue(e.getCause() instanceof IOException);
    }
}
