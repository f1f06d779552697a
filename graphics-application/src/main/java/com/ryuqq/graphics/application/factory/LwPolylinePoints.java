package com.ryuqq.graphics.application.factory;

import com.ryuqq.graphics.core.exception.DxfValueException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * LWPOLYLINE 점 포맷 변환.
 *
 * <p>사용자 포맷(x, y, s, e, b의 임의 순서)으로 주어진 점을
 * 저장 순서 {@code (x, y, start_width, end_width, bulge)}로 바꿉니다. 빠진 값은 0입니다.</p>
 *
 * <pre>
 * format "xyb":  (1, 2, 0.5) → [1, 2, 0, 0, 0.5]
 * format "xyseb": (1, 2)     → [1, 2, 0, 0, 0]
 * </pre>
 *
 * @author Graphics Team
 * @since 1.0.0
 */
final class LwPolylinePoints {

    static final String DEFAULT_FORMAT = "xyseb";

    private LwPolylinePoints() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param points 사용자 포맷의 점
     * @param format x, y, s, e, b로 이루어진 포맷 (null이면 "xyseb")
     * @return 저장 순서의 점 목록
     * @throws DxfValueException 포맷이 잘못된 경우 (field: "format")
     */
    static List<List<Double>> normalize(List<double[]> points, String format) {
        if (points == null) {
            throw new IllegalArgumentException("points cannot be null");
        }
        int[] slots = slots(format == null ? DEFAULT_FORMAT : format);
        List<List<Double>> normalized = new ArrayList<>(points.size());
        for (double[] point : points) {
            if (point == null) {
                throw new IllegalArgumentException("points cannot contain null");
            }
            Double[] values = {0.0, 0.0, 0.0, 0.0, 0.0};
            for (int i = 0; i < Math.min(point.length, slots.length); i++) {
                values[slots[i]] = point[i];
            }
            normalized.add(List.of(values));
        }
        return Collections.unmodifiableList(normalized);
    }

    private static int[] slots(String format) {
        String code = format.trim().toLowerCase(Locale.ROOT);
        if (code.isEmpty() || code.length() > DEFAULT_FORMAT.length()) {
            throw new DxfValueException("format", "invalid point format: '" + format + "'");
        }
        int[] slots = new int[code.length()];
        boolean[] seen = new boolean[DEFAULT_FORMAT.length()];
        for (int i = 0; i < code.length(); i++) {
            int slot = DEFAULT_FORMAT.indexOf(code.charAt(i));
            if (slot < 0 || seen[slot]) {
                throw new DxfValueException("format", "invalid point format: '" + format + "'");
            }
            seen[slot] = true;
            slots[i] = slot;
        }
        if (!seen[0] || !seen[1]) {
            throw new DxfValueException("format", "point format requires x and y: '" + format + "'");
        }
        return slots;
    }
}
