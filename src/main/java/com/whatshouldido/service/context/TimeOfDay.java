package com.whatshouldido.service.context;

public enum TimeOfDay {
    EARLY_MORNING,
    MORNING,
    LUNCH,
    AFTERNOON,
    EVENING,
    NIGHT,
    LATE_NIGHT;

    public static TimeOfDay fromHour(int hour) {
        if (hour >= 6 && hour < 9) {
            return EARLY_MORNING;
        }
        if (hour >= 9 && hour < 12) {
            return MORNING;
        }
        if (hour >= 12 && hour < 14) {
            return LUNCH;
        }
        if (hour >= 14 && hour < 17) {
            return AFTERNOON;
        }
        if (hour >= 17 && hour < 20) {
            return EVENING;
        }
        if (hour >= 20 && hour < 23) {
            return NIGHT;
        }
        return LATE_NIGHT;
    }
}
