package com.autocoin.infrastructure.stream;

import com.autocoin.domain.model.Tick;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.Deflater;

import static org.junit.jupiter.api.Assertions.*;

class TickDecoderTest {

    private static final String TRADE = """
        {"type":"trade","code":"KRW-BTC","timestamp":1700000000000,"trade_price":50000000.0,
         "change_rate":0.012,"trade_volume":0.25,"ask_bid":"BID"}
        """;

    private final TickDecoder decoder = new TickDecoder();

    @Test
    void decodeText_tradeFrame() {
        List<Tick> ticks = decoder.decodeText(TRADE);

        assertEquals(1, ticks.size());
        Tick tick = ticks.get(0);
        assertEquals("KRW-BTC", tick.market());
        assertEquals(1700000000000L, tick.timestamp());
        assertEquals(50000000.0, tick.tradePrice());
        assertEquals(0.012, tick.changeRate());
        assertEquals(0.25, tick.volume());
    }

    @Test
    void decodeText_tickerFrame() {
        List<Tick> ticks = decoder.decodeText("""
            {"type":"ticker","code":"KRW-ETH","trade_price":3000000,"change_rate":-0.01,
             "trade_volume":1.2,"acc_trade_volume":100.0,"timestamp":1700000000500}
            """);

        assertEquals(1, ticks.size());
        assertEquals("KRW-ETH", ticks.get(0).market());
        assertEquals(-0.01, ticks.get(0).changeRate());
    }

    @Test
    void decodeText_arrayYieldsOneTickPerElement() {
        List<Tick> ticks = decoder.decodeText("[" + TRADE + "," + TRADE.replace("KRW-BTC", "KRW-XRP") + "]");

        assertEquals(2, ticks.size());
        assertEquals("KRW-XRP", ticks.get(1).market());
    }

    @Test
    void decodeText_skipsUnknownTypesAndMalformedFrames() {
        assertTrue(decoder.decodeText("{\"type\":\"orderbook\",\"code\":\"KRW-BTC\"}").isEmpty());
        assertTrue(decoder.decodeText("{\"type\":\"trade\",\"code\":\"KRW-BTC\"}").isEmpty(),
            "Frame without trade_price is skipped");
        assertTrue(decoder.decodeText("{not json").isEmpty());
        assertTrue(decoder.decodeText("").isEmpty());
    }

    @Test
    void decodeBinary_plainJson() {
        List<Tick> ticks = decoder.decodeBinary(TRADE.trim().getBytes(StandardCharsets.UTF_8));

        assertEquals(1, ticks.size());
    }

    @Test
    void decodeBinary_zeroFlagFollowedByText() {
        byte[] json = TRADE.trim().getBytes(StandardCharsets.UTF_8);
        byte[] frame = new byte[json.length + 1];
        System.arraycopy(json, 0, frame, 1, json.length);

        assertEquals(1, decoder.decodeBinary(frame).size());
    }

    @Test
    void decodeBinary_rawDeflate() {
        byte[] compressed = rawDeflate(TRADE.trim().getBytes(StandardCharsets.UTF_8));

        List<Tick> ticks = decoder.decodeBinary(compressed);

        assertEquals(1, ticks.size());
        assertEquals("KRW-BTC", ticks.get(0).market());
    }

    @Test
    void decodeBinary_garbageYieldsNothing() {
        assertTrue(decoder.decodeBinary(new byte[]{(byte) 0xff, (byte) 0xfe, 0x01}).isEmpty());
        assertTrue(decoder.decodeBinary(new byte[0]).isEmpty());
    }

    private static byte[] rawDeflate(byte[] input) {
        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
        deflater.setInput(input);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[1024];
        while (!deflater.finished()) {
            int n = deflater.deflate(buffer);
            out.write(buffer, 0, n);
        }
        deflater.end();
        return out.toByteArray();
    }
}
