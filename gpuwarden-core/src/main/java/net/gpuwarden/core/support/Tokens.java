package net.gpuwarden.core.support;

import java.security.SecureRandom;
import java.util.HexFormat;

/** 예약 토큰: 32바이트 난수, hex 64자 */
public final class Tokens {
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private Tokens() {}

    public static String newSessionToken() {
        byte[] b = new byte[32];
        RANDOM.nextBytes(b);
        return HEX.formatHex(b);
    }
}
