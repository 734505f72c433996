package com.has.global.util;

import com.has.global.exception.BusinessException;
import com.has.global.exception.ErrorCode;

import java.util.regex.Pattern;

// "HH:mm" 문자열 시각 처리. 하루 안의 분(0 ~ 1439)으로 변환해 비교한다
public class TimeOfDayUtils {

    private static final Pattern HH_MM = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d)$");
    private static final int MINUTES_PER_DAY = 24 * 60;

    private TimeOfDayUtils() {
        throw new UnsupportedOperationException("유틸리티 클래스는 인스턴스화할 수 없습니다.");
    }

    public static boolean isValid(String time) {
        return time != null && HH_MM.matcher(time).matches();
    }

    public static int toMinutes(String time) {
        if (!isValid(time)) {
            throw new BusinessException(ErrorCode.INVALID_TIME_FORMAT, "시간 형식 오류: " + time);
        }
        return Integer.parseInt(time.substring(0, 2)) * 60 + Integer.parseInt(time.substring(3, 5));
    }

    public static String format(int minutes) {
        int normalized = Math.floorMod(minutes, MINUTES_PER_DAY);
        return String.format("%02d:%02d", normalized / 60, normalized % 60);
    }

    // 종료 시각 = 시작 + round(시간 * 60)분, 자정을 넘으면 다음 날 시각으로 감싼다
    public static String endTime(String startTime, double durationHours) {
        return format(toMinutes(startTime) + (int) Math.round(durationHours * 60));
    }
}
