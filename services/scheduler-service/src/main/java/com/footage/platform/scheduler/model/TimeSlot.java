package com.footage.platform.scheduler.model;

import lombok.*;

import java.time.DayOfWeek;

/**
 * A weekly publishing slot in UTC. {@code dayOfWeek} is 0 = Sunday through 6 = Saturday.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlot {

    private int dayOfWeek;
    private int hourOfDay;

    public static TimeSlot of(int dayOfWeek, int hourOfDay) {
        if (dayOfWeek < 0 || dayOfWeek > 6) {
            throw new IllegalArgumentException("dayOfWeek must be in [0,6]: " + dayOfWeek);
        }
        if (hourOfDay < 0 || hourOfDay > 23) {
            throw new IllegalArgumentException("hourOfDay must be in [0,23]: " + hourOfDay);
        }
        return new TimeSlot(dayOfWeek, hourOfDay);
    }

    public static int dayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public DayOfWeek toDayOfWeek() {
        return dayOfWeek == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
    }
}
