package com.retail.storeintel.entity;

import java.time.LocalTime;

/**
 * Contiguous, non-overlapping local-time windows of a trading day.
 * NIGHT wraps midnight (22:00 - 06:00).
 */
public enum DayPeriod {

    MORNING(6, 12),
    AFTERNOON(12, 18),
    EVENING(18, 22),
    NIGHT(22, 6);

    private final int startHour;
    private final int endHour;

    DayPeriod(int startHour, int endHour) {
        this.startHour = startHour;
        this.endHour = endHour;
    }

    public int getStartHour() {
        return startHour;
    }

    public int getEndHour() {
        return endHour;
    }

    public static DayPeriod fromHour(int hour) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + hour);
        }
        if (hour >= 6 && hour < 12) {
            return MORNING;
        } else if (hour >= 12 && hour < 18) {
            return AFTERNOON;
        } else if (hour >= 18 && hour < 22) {
            return EVENING;
        }
        return NIGHT;
    }

    public static DayPeriod fromTime(LocalTime time) {
        return fromHour(time.getHour());
    }
}
