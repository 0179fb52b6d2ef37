package ai.docsite.reviewer.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ReviewWindowTest {

    private static final LocalTime THREE_PM = LocalTime.of(15, 0);

    @Test
    void defaultsToMostRecentPastWeekday() {
        Clock thursday = Clock.fixed(Instant.parse("2024-05-09T12:00:00Z"), ZoneOffset.UTC);

        OffsetDateTime since = ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.TUESDAY, THREE_PM, 0, thursday);

        assertThat(since).isEqualTo(OffsetDateTime.parse("2024-05-07T15:00:00Z"));
    }

    @Test
    void sameWeekdayGoesBackAFullWeek() {
        Clock tuesdayAfternoon = Clock.fixed(Instant.parse("2024-05-07T16:00:00Z"), ZoneOffset.UTC);
        Clock tuesdayMorning = Clock.fixed(Instant.parse("2024-05-07T08:00:00Z"), ZoneOffset.UTC);

        assertThat(ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.TUESDAY, THREE_PM, 0, tuesdayAfternoon))
                .isEqualTo(OffsetDateTime.parse("2024-04-30T15:00:00Z"));
        assertThat(ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.TUESDAY, THREE_PM, 0, tuesdayMorning))
                .isEqualTo(OffsetDateTime.parse("2024-04-30T15:00:00Z"));
    }

    @Test
    void weeksBackExtendsTheWindow() {
        Clock thursday = Clock.fixed(Instant.parse("2024-05-09T12:00:00Z"), ZoneOffset.UTC);

        assertThat(ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.TUESDAY, THREE_PM, 2, thursday))
                .isEqualTo(OffsetDateTime.parse("2024-04-23T15:00:00Z"));
    }

    @Test
    void recordedLastReviewTakesPrecedence() {
        Clock thursday = Clock.fixed(Instant.parse("2024-05-09T12:00:00Z"), ZoneOffset.UTC);
        OffsetDateTime lastReviewed = OffsetDateTime.parse("2024-05-01T09:30:00+02:00");

        assertThat(ReviewWindow.resolveSince(Optional.of(lastReviewed), DayOfWeek.TUESDAY, THREE_PM, 0, thursday))
                .isEqualTo(lastReviewed);
        assertThat(ReviewWindow.resolveSince(Optional.of(lastReviewed), DayOfWeek.TUESDAY, THREE_PM, 1, thursday))
                .isEqualTo(OffsetDateTime.parse("2024-04-24T09:30:00+02:00"));
    }

    @Test
    void usesTheClockZoneOffset() {
        Clock berlin = Clock.fixed(Instant.parse("2024-05-09T12:00:00Z"), ZoneId.of("Europe/Berlin"));

        OffsetDateTime since = ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.TUESDAY, THREE_PM, 0, berlin);

        assertThat(since).isEqualTo(OffsetDateTime.parse("2024-05-07T15:00:00+02:00"));
    }

    @Test
    void rejectsNegativeWeeksBack() {
        Clock clock = Clock.systemUTC();

        assertThatThrownBy(() -> ReviewWindow.resolveSince(Optional.empty(), DayOfWeek.MONDAY, THREE_PM, -1, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
