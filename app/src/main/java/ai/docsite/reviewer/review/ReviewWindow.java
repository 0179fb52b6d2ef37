package ai.docsite.reviewer.review;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Works out where a review window starts.
 *
 * <p>Without a recorded last review, the window opens at the most recent past occurrence of the default
 * weekday and time, never today. All values keep an explicit offset.
 */
public final class ReviewWindow {

    private ReviewWindow() {
    }

    public static OffsetDateTime resolveSince(Optional<OffsetDateTime> lastReviewed,
                                              DayOfWeek defaultWeekday,
                                              LocalTime defaultTime,
                                              int weeksBack,
                                              Clock clock) {
        Objects.requireNonNull(defaultWeekday, "defaultWeekday");
        Objects.requireNonNull(defaultTime, "defaultTime");
        Objects.requireNonNull(clock, "clock");
        if (weeksBack < 0) {
            throw new IllegalArgumentException("weeksBack must be zero or greater");
        }
        OffsetDateTime start = lastReviewed
                .orElseGet(() -> defaultStart(defaultWeekday, defaultTime, clock));
        return start.minusWeeks(weeksBack);
    }

    static OffsetDateTime defaultStart(DayOfWeek weekday, LocalTime time, Clock clock) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        int daysSince = Math.floorMod(today.getDayOfWeek().getValue() - weekday.getValue(), 7);
        if (daysSince == 0) {
            daysSince = 7;
        }
        ZonedDateTime target = ZonedDateTime.of(today.minusDays(daysSince), time, now.getZone());
        if (target.isAfter(now)) {
            target = target.minusWeeks(1);
        }
        return target.toOffsetDateTime();
    }
}
