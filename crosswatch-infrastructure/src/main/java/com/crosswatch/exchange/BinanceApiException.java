package com.crosswatch.exchange;

import java.io.IOException;
import java.util.Set;

/**
 * Non-2xx answer from Binance. Carries the HTTP status and the Binance error code
 * ({@code {"code":-2019,"msg":"Margin is insufficient."}}), 0 when the body had none.
 */
public class BinanceApiException extends IOException {

    /** Codes worth retrying: unknown/disconnected/too many requests/timeout/timestamp. */
    private static final Set<Integer> TRANSIENT_CODES = Set.of(-1000, -1001, -1003, -1007, -1021);

    public static final int TIMESTAMP_OUTSIDE_RECV_WINDOW = -1021;

    private final int httpStatus;
    private final int code;

    public BinanceApiException(int httpStatus, int code, String message) {
        super("HTTP " + httpStatus + (code != 0 ? " code " + code : "") + ": " + message);
        this.httpStatus = httpStatus;
        this.code = code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public int code() {
        return code;
    }

    public boolean isTransient() {
        if (httpStatus >= 500 || httpStatus == 429 || httpStatus == 418) return true;
        return TRANSIENT_CODES.contains(code);
    }

    public boolean isTimestampError() {
        return code == TIMESTAMP_OUTSIDE_RECV_WINDOW;
    }
}
