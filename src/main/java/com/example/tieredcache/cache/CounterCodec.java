package com.example.tieredcache.cache;

import java.nio.charset.StandardCharsets;

/**
 * 카운터 값 인코딩 (ASCII 10진수)
 * Redis INCRBY가 읽고 쓰는 표현과 같아서 로컬/분산 티어가 같은 바이트를 공유할 수 있다
 */
public final class CounterCodec {

    private CounterCodec() {
    }

    public static byte[] encode(long value) {
        return Long.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * @throws NumberFormatException 카운터 표현이 아닌 값
     */
    public static long decode(byte[] bytes) {
        return Long.parseLong(new String(bytes, StandardCharsets.US_ASCII).trim());
    }
}
