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

package com.linagora.icstoolkit.merge;

import static com.linagora.icstoolkit.merge.EventFixtures.calendar;
import static com.linagora.icstoolkit.merge.EventFixtures.event;
import static com.linagora.icstoolkit.merge.EventFixtures.utc;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.assertj.core.api.SoftAssertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.Event;

class MergeEngineTest {
    private static final CalendarId MERGED_ID = new CalendarId("merged");

    private MergeEngine testee;

    @BeforeEach
    void setUp() {
        testee = new MergeEngine(new DuplicateResolver(), () -> MERGED_ID);
    }

    @Test
    void mergeShouldRemoveDuplicatesAcrossCalendars() {
        Event standupA = event("standup-a@test", "Standup", utc(9, 0), utc(9, 30));
        Event standupB = event("standup-b@test", "Standup", utc(9, 0), utc(9, 30));
        Event lunch = event("Lunch", utc(12, 0), utc(13, 0));

        MergeResult result = testee.merge(List.of(calendar("a", standupA), calendar("b", standupB, lunch)), "Team", true);

        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(result.mergedEvents()).isEqualTo(2);
            softly.assertThat(result.removedDuplicates()).isEqualTo(1);
            softly.assertThat(result.calendar().events()).extracting(Event::title).containsExactly("Standup", "Lunch");
            softly.assertThat(result.calendar().events().get(0).uid().value()).isEqualTo("standup-a@test");
            softly.assertThat(result.calendar().id()).isEqualTo(MERGED_ID);
            softly.assertThat(result.calendar().name()).isEqualTo("Team");
        });
    }

    @Test
    void mergeWithoutDeduplicationShouldKeepEveryEvent() {
        CalendarRecord a = calendar("a", event("Standup", utc(9, 0), utc(9, 30)), event("Review", utc(15, 0), utc(16, 0)));
        CalendarRecord b = calendar("b", event("Standup", utc(9, 0), utc(9, 30)), event("Lunch", utc(12, 0), utc(13, 0)));

        MergeResult result = testee.merge(List.of(a, b), "Team", false);

        assertThat(result.mergedEvents()).isEqualTo(a.events().size() + b.events().size());
        assertThat(result.removedDuplicates()).isZero();
        assertThat(result.calendar().events()).extracting(Event::title)
            .containsExactly("Standup", "Review", "Standup", "Lunch");
    }

    @Test
    void mergeShouldNotTouchSourceCalendars() {
        CalendarRecord a = calendar("a", event("Standup", utc(9, 0), utc(9, 30)));
        CalendarRecord b = calendar("b", event("Standup", utc(9, 0), utc(9, 30)));
        CalendarRecord aBefore = CalendarRecord.of(a.id(), a.name(), a.events());

        testee.merge(List.of(a, b), "Team", true);

        assertThat(a).isEqualTo(aBefore);
        assertThat(b.events()).hasSize(1);
    }

    @Test
    void mergeShouldKeepUidAndSequence() {
        Event revised = event("Standup", utc(9, 0), utc(9, 30)).revise(builder -> builder.location("Room 4"));

        MergeResult result = testee.merge(List.of(calendar("a", revised), calendar("b")), "Team", true);

        assertThat(result.calendar().events()).containsExactly(revised);
        assertThat(result.calendar().events().get(0).sequence()).isEqualTo(1);
    }

    @Test
    void calendarOrderShouldDecideWhichCopyWins() {
        Event standupA = event("standup-a@test", "Standup", utc(9, 0), utc(9, 30));
        Event standupB = event("standup-b@test", "standup", utc(9, 0), utc(9, 30));

        MergeResult result = testee.merge(List.of(calendar("b", standupB), calendar("a", standupA)), "Team", true);

        assertThat(result.calendar().events()).containsExactly(standupB);
    }

    @Test
    void mergeShouldAcceptASingleCalendar() {
        CalendarRecord a = calendar("a", event("Standup", utc(9, 0), utc(9, 30)));

        MergeResult result = testee.merge(List.of(a), "Copy", true);

        assertThat(result.calendar().events()).isEqualTo(a.events());
    }

    @Test
    void defaultIdFactoryShouldGenerateFreshIds() {
        MergeEngine engine = new MergeEngine(new DuplicateResolver());
        List<CalendarRecord> sources = List.of(calendar("a"), calendar("b"));

        CalendarId first = engine.merge(sources, "Team", true).calendar().id();
        CalendarId second = engine.merge(sources, "Team", true).calendar().id();

        assertThat(first).isNotEqualTo(second).isNotIn(new CalendarId("a"), new CalendarId("b"));
    }
}
