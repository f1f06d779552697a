package com.ryuqq.graphics.core.dimension;

import java.util.Locale;
import java.util.Set;

/**
 * 치수 화살표 이름 상수.
 *
 * @author Graphics Team
 * @since 1.0.0
 */
public final class ArrowNames {

    public static final String CLOSED_FILLED = "";
    public static final String NONE = "NONE";
    public static final String ARCHTICK = "ARCHTICK";
    public static final String OBLIQUE = "OBLIQUE";
    public static final String INTEGRAL = "INTEGRAL";
    public static final String DOT_SMALL = "DOTSMALL";
    public static final String DOT_BLANK = "DOTBLANK";

    private static final Set<String> TICKS = Set.of(ARCHTICK, OBLIQUE, NONE, INTEGRAL);
    private static final Set<String> ORIGIN_ZERO = Set.of(ARCHTICK, OBLIQUE, NONE, INTEGRAL, DOT_SMALL, DOT_BLANK);

    // Utility class - prevent instantiation
    private ArrowNames() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 틱(tick) 형태의 화살표인지 확인.
     *
     * @param name 화살표 이름 (null은 기본 화살표)
     * @return ARCHTICK, OBLIQUE, NONE, INTEGRAL이면 true
     */
    public static boolean isTick(String name) {
        return name != null && TICKS.contains(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * 삽입점이 곧 연결점인 화살표인지 확인 (틱과 작은 점).
     *
     * <p>연속 치수에서 이웃 치수와 겹쳐 두 번 그려지므로 억제 대상입니다.</p>
     *
     * @param name 화살표 이름 (null은 기본 화살표)
     * @return 틱 화살표 또는 DOTSMALL, DOTBLANK이면 true
     */
    public static boolean isOriginZero(String name) {
        return name != null && ORIGIN_ZERO.contains(name.trim().toUpperCase(Locale.ROOT));
    }
}
