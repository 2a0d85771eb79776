/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.icstoolkit.storage.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.assertj.core.api.SoftAssertions;
import org.junit.jupiter.api.Test;

import com.linagora.icstoolkit.storage.exception.EventValidationException;

class EventTest {
    private static final IcsInstant NINE = IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 9, 0));
    private static final IcsInstant TEN = IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 10, 0));

    private Event.Builder standup() {
        return Event.builder()
            .uid("standup@test")
            .title("Standup")
            .start(NINE)
            .end(TEN);
    }

    @Test
    void buildShouldGenerateUidWhenMissing() {
        Event event = standup().uid((EventUid) null).build();

        assertThat(event.uid().value()).endsWith("@" + EventUid.UID_DOMAIN);
    }

    @Test
    void blankTitleShouldBeRejected() {
        assertThatThrownBy(() -> standup().title("  ").build())
            .isInstanceOf(EventValidationException.class);
    }

    @Test
    void endBeforeStartShouldBeRejected() {
        assertThatThrownBy(() -> standup().start(TEN).end(NINE).build())
            .isInstanceOf(EventValidationException.class);
    }

    @Test
    void lineBreaksShouldBeStoredAsLineFeeds() {
        Event event = standup()
            .title("Stand\r\nup")
            .description("a\rb")
            .location("Room\r\n4\n")
            .organizer(new Organizer(Optional.of("Alice\rDoe"), "alice@test"))
            .attendee(new Attendee(Optional.of("Bob\r\nSmith"), "bob@test", Optional.empty(), Optional.empty(), false))
            .build();

        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(event.title()).isEqualTo("Stand\nup");
            softly.assertThat(event.description()).contains("a\nb");
            softly.assertThat(event.location()).contains("Room\n4\n");
            softly.assertThat(event.organizer().flatMap(Organizer::name)).contains("Alice\nDoe");
            softly.assertThat(event.attendees().get(0).name()).contains("Bob\nSmith");
        });
    }

    @Test
    void mixingUtcAndFloatingShouldBeRejected() {
        assertThatThrownBy(() -> standup().end(IcsInstant.floating(LocalDateTime.of(2024, 1, 15, 10, 0))).build())
            .isInstanceOf(EventValidationException.class);
    }

    @Test
    void outOfRangePriorityShouldBeRejected() {
        assertThatThrownBy(() -> standup().priority(10).build())
            .isInstanceOf(EventValidationException.class);
    }

    @Test
    void negativeSequenceShouldBeRejected() {
        assertThatThrownBy(() -> standup().sequence(-1).build())
            .isInstanceOf(EventValidationException.class);
    }

    @Test
    void zeroLengthEventShouldBeAccepted() {
        Event event = standup().end(NINE).build();

        assertThat(event.start()).isEqualTo(event.end());
    }

    @Test
    void reviseShouldIncrementSequenceAndKeepUid() {
        Event event = standup().sequence(3).build();

        Event revised = event.revise(builder -> builder.title("Daily standup").uid("other@test").sequence(0));

        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(revised.uid()).isEqualTo(event.uid());
            softly.assertThat(revised.title()).isEqualTo("Daily standup");
            softly.assertThat(revised.sequence()).isEqualTo(4);
        });
    }

    @Test
    void collectionsShouldBeDetachedFromCaller() {
        List<String> categories = new ArrayList<>(List.of("work"));
        Event event = standup().categories(categories).build();
        categories.add("home");

        assertThat(event.categories()).containsExactly("work");
    }

    @Test
    void recurrenceDatesShouldBeSplitByType() {
        IcsInstant jan16 = IcsInstant.date(LocalDate.of(2024, 1, 16));
        IcsInstant jan17 = IcsInstant.date(LocalDate.of(2024, 1, 17));
        Event event = standup()
            .recurrenceDate(RecurrenceDate.rdate(jan16))
            .recurrenceDate(RecurrenceDate.rdate(jan16))
            .recurrenceDate(RecurrenceDate.exdate(jan17))
            .build();

        assertThat(event.rdates()).containsExactly(jan16);
        assertThat(event.exdates()).containsExactly(jan17);
    }

    @Test
    void isAllDayShouldFollowStartKind() {
        Event event = standup()
            .start(IcsInstant.date(LocalDate.of(2024, 1, 15)))
            .end(IcsInstant.date(LocalDate.of(2024, 1, 16)))
            .build();

        assertThat(event.isAllDay()).isTrue();
    }
}
