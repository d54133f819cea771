package top.guoziyang.dbrpc.transport;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import top.guoziyang.dbrpc.common.DriverException;
import top.guoziyang.dbrpc.common.ErrorCode;

public class EncoderTest {

    private final Encoder encoder = new Encoder(5_000L);

    @Test
    public void testRequest() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("table_name", "t");
        params.put("data", Collections.singletonMap("k", "v"));
        Request request = new Request("req-1", "insert", params, Priority.URGENT,
            Instant.ofEpochMilli(1_000L), 750L);

        Package decoded = encoder.decode(encoder.encode(Package.request(request)));

        assertEquals(Package.Type.REQUEST, decoded.getType());
        Request back = decoded.getRequest();
        assertEquals("req-1", back.getId());
        assertEquals("insert", back.getMethod());
        assertEquals(Priority.URGENT, back.getPriority());
        assertEquals(750L, back.getTimeoutMillis());
        assertEquals(Instant.ofEpochMilli(1_000L), back.getCreatedAt());
        assertEquals("v", back.params().getMap("data").get("k"));
    }

    @Test
    public void testMissingTimeoutUsesDefault() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", "x");
        body.put("method", "select");
        byte[] raw = new byte[1 + ValueCodec.encode(body).length];
        raw[0] = 0;
        System.arraycopy(ValueCodec.encode(body), 0, raw, 1, raw.length - 1);

        Request request = encoder.decode(raw).getRequest();
        assertEquals(5_000L, request.getTimeoutMillis());
        assertEquals(Priority.NORMAL, request.getPriority());
    }

    @Test
    public void testHugeTimeoutDoesNotExpireAtOnce() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", "x");
        body.put("method", "select");
        body.put("timeout_ms", Long.MAX_VALUE);
        byte[] raw = new byte[1 + ValueCodec.encode(body).length];
        raw[0] = 0;
        System.arraycopy(ValueCodec.encode(body), 0, raw, 1, raw.length - 1);

        Request request = encoder.decode(raw).getRequest();
        assertEquals(Long.MAX_VALUE, request.getTimeoutMillis());
        assertEquals(Long.MAX_VALUE, request.deadlineMillis());
        assertTrue(request.deadlineMillis() > System.currentTimeMillis());
    }

    @Test
    public void testResults() {
        List<Map<String, Object>> rows = Arrays.asList(
            Collections.<String, Object>singletonMap("id", 1L),
            Collections.<String, Object>singletonMap("id", 2L));
        Result[] results = {
            Result.success(Collections.singletonMap("row_id", 9L)),
            Result.rows(rows),
            Result.error(ErrorCode.TABLE_NOT_FOUND, "no such table: t"),
        };
        for (Result result : results) {
            Package decoded = encoder.decode(encoder.encode(Package.result("r", result)));
            assertEquals(Package.Type.RESULT, decoded.getType());
            assertEquals("r", decoded.getRequestId());
            assertEquals(result, decoded.getResult());
        }
    }

    @Test
    public void testProtocolError() {
        DriverException err = DriverException.of(ErrorCode.UNKNOWN_METHOD, "Unknown method: frobnicate");
        Package decoded = encoder.decode(encoder.encode(Package.protocolError(null, err)));

        assertEquals(Package.Type.PROTOCOL_ERROR, decoded.getType());
        assertNull(decoded.getRequestId());
        assertEquals(ErrorCode.UNKNOWN_METHOD, decoded.getErr().getCode());
        assertTrue(decoded.getErr().getMessage().contains("frobnicate"));
    }

    @Test
    public void testInvalidPackages() {
        byte[][] invalid = {
            new byte[0],
            new byte[]{0},
            new byte[]{9, ValueCodec.TAG_NULL},
            new byte[]{0, ValueCodec.TAG_LONG, 0, 0, 0, 0, 0, 0, 0, 1},
        };
        for (byte[] raw : invalid) {
            try {
                encoder.decode(raw);
                fail("expected MALFORMED_FRAME for " + Arrays.toString(raw));
            } catch (DriverException e) {
                assertEquals(ErrorCode.MALFORMED_FRAME, e.getCode());
            }
        }
    }
}
