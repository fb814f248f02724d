package github.sarthakdev143.signage_engine.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleWindowTest {

    private static final Path FOLDER = Path.of("/srv/signage/sunday");

    // 2024-06-09 is a Sunday.
    private final ScheduleWindow sundayMorning = new ScheduleWindow(
            "Sunday", FOLDER, "Cut", 2.0, 6, LocalTime.of(8, 0), LocalTime.of(13, 30));

    @Test
    void matchesInsideHalfOpenRange() {
        assertThat(sundayMorning.matches(LocalDateTime.of(2024, 6, 9, 7, 59))).isFalse();
        assertThat(sundayMorning.matches(LocalDateTime.of(2024, 6, 9, 8, 0))).isTrue();
        assertThat(sundayMorning.matches(LocalDateTime.of(2024, 6, 9, 13, 29))).isTrue();
        assertThat(sundayMorning.matches(LocalDateTime.of(2024, 6, 9, 13, 30))).isFalse();
    }

    @Test
    void doesNotMatchOtherDays() {
        assertThat(sundayMorning.matches(LocalDateTime.of(2024, 6, 10, 10, 0))).isFalse();
    }

    @Test
    void rangeMayWrapPastMidnight() {
        ScheduleWindow night = new ScheduleWindow(
                "Night", FOLDER, "Fade", 2.0, null, LocalTime.of(22, 0), LocalTime.of(6, 0));

        assertThat(night.matches(LocalDateTime.of(2024, 6, 9, 23, 0))).isTrue();
        assertThat(night.matches(LocalDateTime.of(2024, 6, 10, 5, 59))).isTrue();
        assertThat(night.matches(LocalDateTime.of(2024, 6, 10, 6, 0))).isFalse();
        assertThat(night.matches(LocalDateTime.of(2024, 6, 10, 12, 0))).isFalse();
    }

    @Test
    void dayOnlyWindowMatchesWholeDay() {
        ScheduleWindow monday = new ScheduleWindow("Monday", FOLDER, "Fade", 2.0, 0, null, null);

        assertThat(monday.matches(LocalDateTime.of(2024, 6, 10, 0, 0))).isTrue();
        assertThat(monday.matches(LocalDateTime.of(2024, 6, 10, 23, 59))).isTrue();
        assertThat(monday.matches(LocalDateTime.of(2024, 6, 9, 12, 0))).isFalse();
    }

    @Test
    void unrestrictedWindowAlwaysMatches() {
        ScheduleWindow fallback = ScheduleWindow.unrestricted("Default", FOLDER, "Fade", 2.0);

        assertThat(fallback.dayOfWeek()).isNull();
        assertThat(fallback.matches(LocalDateTime.of(2024, 6, 12, 3, 14))).isTrue();
    }

    @Test
    void rejectsInvalidDefinitions() {
        assertThatThrownBy(() -> new ScheduleWindow("Bad", FOLDER, "Fade", 2.0, 7, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScheduleWindow("Bad", FOLDER, "Fade", 2.0, null, LocalTime.NOON, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScheduleWindow("Bad", FOLDER, "Fade", -1.0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
