package io.yasched.trigger;

import io.yasched.timing.CalendarDate;
import io.yasched.timing.Moment;
import io.yasched.timing.TimeOfDay;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Shared due logic for calendar-anchored triggers.
 *
 * <p>With a time of day the window of a matching date is
 * {@code [date@time, date@time + length)}; without one it is the whole date.
 * A window fires at most once.
 */
final class WallClockWindow {

    private WallClockWindow() {
    }

    static boolean isDue(Moment now, Moment lastRun, TimeOfDay at, Duration length, Predicate<CalendarDate> matches) {
        CalendarDate today = now.date();
        if (at == null) {
            return matches.test(today)
                    && (lastRun == null || lastRun.date().isBefore(today));
        }
        // a window opened late yesterday may still be open
        for (CalendarDate date : new CalendarDate[]{today, today.plusDays(-1)}) {
            if (!matches.test(date)) {
                continue;
            }
            Moment start = Moment.of(date, at);
            Moment end = start.plus(length);
            boolean open = !now.isBefore(start) && now.isBefore(end);
            if (open && (lastRun == null || lastRun.isBefore(start))) {
                return true;
            }
        }
        return false;
    }

    static Moment nextDue(Moment now, Moment lastRun, TimeOfDay at, Duration length,
                          Predicate<CalendarDate> matches, int horizonDays) {
        if (isDue(now, lastRun, at, length, matches)) {
            return now;
        }
        CalendarDate today = now.date();
        for (int i = 0; i <= horizonDays; i++) {
            CalendarDate date = today.plusDays(i);
            if (!matches.test(date)) {
                continue;
            }
            Moment start = Moment.of(date, at == null ? TimeOfDay.MIDNIGHT : at);
            if (start.isAfter(now) && (lastRun == null || lastRun.isBefore(start))) {
                return start;
            }
        }
        throw new IllegalStateException("No window within " + horizonDays + " days of " + now);
    }
}
