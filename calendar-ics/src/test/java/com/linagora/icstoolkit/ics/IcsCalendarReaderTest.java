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

package com.linagora.icstoolkit.ics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import org.assertj.core.api.SoftAssertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.linagora.icstoolkit.storage.exception.IcsParseException;
import com.linagora.icstoolkit.storage.model.Alarm;
import com.linagora.icstoolkit.storage.model.AlarmTrigger;
import com.linagora.icstoolkit.storage.model.Attendee;
import com.linagora.icstoolkit.storage.model.DurationUnit;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.EventStatus;
import com.linagora.icstoolkit.storage.model.EventUid;
import com.linagora.icstoolkit.storage.model.IcsDuration;
import com.linagora.icstoolkit.storage.model.IcsInstant;
import com.linagora.icstoolkit.storage.model.Organizer;
import com.linagora.icstoolkit.storage.model.Transparency;

class IcsCalendarReaderTest {

    private IcsCalendarReader testee;

    @BeforeEach
    void setUp() {
        testee = new IcsCalendarReader();
    }

    private static String calendar(String... lines) {
        StringBuilder builder = new StringBuilder()
            .append("BEGIN:VCALENDAR\r\n")
            .append("VERSION:2.0\r\n")
            .append("PRODID:-//Test//Test//EN\r\n");
        for (String line : lines) {
            builder.append(line).append("\r\n");
        }
        return builder.append("END:VCALENDAR\r\n").toString();
    }

    @Test
    void shouldReadTimedEvent() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:standup-1@example.com",
            "DTSTAMP:20240101T000000Z",
            "DTSTART:20240115T090000Z",
            "DTEND:20240115T093000Z",
            "SUMMARY:Team Standup",
            "DESCRIPTION:Daily sync\\, bring notes\\nSecond line",
            "LOCATION:Room 4",
            "STATUS:CONFIRMED",
            "TRANSP:OPAQUE",
            "PRIORITY:5",
            "SEQUENCE:2",
            "END:VEVENT"));

        Event event = result.events().get(0);
        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(result.skippedEvents()).isZero();
            softly.assertThat(result.warnings()).isEmpty();
            softly.assertThat(event.uid()).isEqualTo(new EventUid("standup-1@example.com"));
            softly.assertThat(event.title()).isEqualTo("Team Standup");
            softly.assertThat(event.start()).isEqualTo(IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 9, 0)));
            softly.assertThat(event.end()).isEqualTo(IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 9, 30)));
            softly.assertThat(event.description()).contains("Daily sync, bring notes\nSecond line");
            softly.assertThat(event.location()).contains("Room 4");
            softly.assertThat(event.status()).contains(EventStatus.CONFIRMED);
            softly.assertThat(event.transparency()).contains(Transparency.OPAQUE);
            softly.assertThat(event.priority()).contains(5);
            softly.assertThat(event.sequence()).isEqualTo(2);
        });
    }

    @Test
    void shouldReadAllDayEvent() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:holiday@example.com",
            "DTSTART;VALUE=DATE:20240115",
            "DTEND;VALUE=DATE:20240116",
            "SUMMARY:Holiday",
            "END:VEVENT"));

        Event event = result.events().get(0);
        assertThat(event.isAllDay()).isTrue();
        assertThat(event.start()).isEqualTo(IcsInstant.date(LocalDate.of(2024, 1, 15)));
        assertThat(event.end()).isEqualTo(IcsInstant.date(LocalDate.of(2024, 1, 16)));
    }

    @Test
    void missingEndShouldUseDuration() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:review@example.com",
            "DTSTART:20240115T140000Z",
            "DURATION:PT90M",
            "SUMMARY:Review",
            "END:VEVENT"));

        assertThat(result.events().get(0).end()).isEqualTo(IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 15, 30)));
    }

    @Test
    void missingEndAndDurationShouldDefaultToStartForTimedEvents() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:reminder@example.com",
            "DTSTART:20240115T140000",
            "SUMMARY:Reminder",
            "END:VEVENT"));

        Event event = result.events().get(0);
        assertThat(event.end()).isEqualTo(event.start());
    }

    @Test
    void missingEndAndDurationShouldLastOneDayForDates() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:birthday@example.com",
            "DTSTART;VALUE=DATE:20240229",
            "SUMMARY:Birthday",
            "END:VEVENT"));

        assertThat(result.events().get(0).end()).isEqualTo(IcsInstant.date(LocalDate.of(2024, 3, 1)));
    }

    @Test
    void missingSummaryShouldUseDefaultTitle() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:anonymous@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "END:VEVENT"));

        assertThat(result.events().get(0).title()).isEqualTo(VEventReader.UNTITLED_EVENT);
    }

    @Test
    void missingUidShouldBeGenerated() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:No uid",
            "END:VEVENT"));

        assertThat(result.events().get(0).uid().value()).endsWith("@" + EventUid.UID_DOMAIN);
    }

    @Test
    void invalidStartShouldSkipOnlyThatEvent() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:broken@example.com",
            "DTSTART:2024-01-15",
            "SUMMARY:Broken",
            "END:VEVENT",
            "BEGIN:VEVENT",
            "UID:fine@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:Fine",
            "END:VEVENT"));

        assertThat(result.events()).extracting(Event::title).containsExactly("Fine");
        assertThat(result.skippedEvents()).isEqualTo(1);
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void missingStartShouldSkipEvent() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:nostart@example.com",
            "SUMMARY:No start",
            "END:VEVENT"));

        assertThat(result.events()).isEmpty();
        assertThat(result.skippedEvents()).isEqualTo(1);
    }

    @Test
    void endBeforeStartShouldSkipEvent() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:backwards@example.com",
            "DTSTART:20240115T150000Z",
            "DTEND:20240115T140000Z",
            "SUMMARY:Backwards",
            "END:VEVENT"));

        assertThat(result.events()).isEmpty();
        assertThat(result.skippedEvents()).isEqualTo(1);
    }

    @Test
    void invalidOptionalFieldsShouldBeDroppedWithWarnings() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:sloppy@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:Sloppy",
            "PRIORITY:12",
            "STATUS:MAYBE",
            "RDATE:20240230T140000Z",
            "EXDATE:20240116T140000Z",
            "END:VEVENT"));

        Event event = result.events().get(0);
        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(result.skippedEvents()).isZero();
            softly.assertThat(result.warnings()).hasSize(3);
            softly.assertThat(event.priority()).isEmpty();
            softly.assertThat(event.status()).isEmpty();
            softly.assertThat(event.rdates()).isEmpty();
            softly.assertThat(event.exdates()).containsExactly(IcsInstant.utc(LocalDateTime.of(2024, 1, 16, 14, 0)));
        });
    }

    @Test
    void shouldReadPeopleListsAndRecurrence() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:planning@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:Planning",
            "ORGANIZER;CN=Alice:mailto:alice@example.com",
            "ATTENDEE;CN=Bob;ROLE=REQ-PARTICIPANT;PARTSTAT=ACCEPTED;RSVP=TRUE:mailto:bob@example.com",
            "ATTENDEE:mailto:carol@example.com",
            "CATEGORIES:Work,Planning",
            "CATEGORIES:Quarterly",
            "RESOURCES:Projector",
            "RRULE:FREQ=WEEKLY;BYDAY=MO",
            "RDATE;VALUE=DATE:20240120,20240121",
            "END:VEVENT"));

        Event event = result.events().get(0);
        SoftAssertions.assertSoftly(softly -> {
            softly.assertThat(event.organizer()).contains(new Organizer(Optional.of("Alice"), "alice@example.com"));
            softly.assertThat(event.attendees()).containsExactly(
                new Attendee(Optional.of("Bob"), "bob@example.com", Optional.of("REQ-PARTICIPANT"),
                    Optional.of("ACCEPTED"), true),
                Attendee.of("carol@example.com"));
            softly.assertThat(event.categories()).containsExactly("Work", "Planning", "Quarterly");
            softly.assertThat(event.resources()).containsExactly("Projector");
            softly.assertThat(event.rrule()).contains("FREQ=WEEKLY;BYDAY=MO");
            softly.assertThat(event.rdates()).containsExactly(
                IcsInstant.date(LocalDate.of(2024, 1, 20)),
                IcsInstant.date(LocalDate.of(2024, 1, 21)));
        });
    }

    @Test
    void invalidRecurrenceRuleShouldBeDroppedWithWarning() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:rule@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:No frequency",
            "RRULE:COUNT=3",
            "END:VEVENT"));

        assertThat(result.events()).singleElement()
            .satisfies(event -> assertThat(event.rrule()).isEmpty());
        assertThat(result.warnings()).singleElement()
            .satisfies(warning -> assertThat(warning).startsWith("Dropped RRULE"));
    }

    @Test
    void shouldDecodeParameterValues() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:params@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:Encoded names",
            "ORGANIZER;CN=\"Doe, Alice\":mailto:alice@example.com",
            "ATTENDEE;CN=\"Bob ^'Builder^'^nSecond line\":mailto:bob@example.com",
            "END:VEVENT"));

        Event event = result.events().get(0);
        assertThat(event.organizer()).contains(new Organizer(Optional.of("Doe, Alice"), "alice@example.com"));
        assertThat(event.attendees()).containsExactly(new Attendee(Optional.of("Bob \"Builder\"\nSecond line"),
            "bob@example.com", Optional.empty(), Optional.empty(), false));
    }

    @Test
    void shouldReadAlarms() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:alarm@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:With alarm",
            "BEGIN:VALARM",
            "TRIGGER:-PT15M",
            "ACTION:DISPLAY",
            "DESCRIPTION:Reminder",
            "END:VALARM",
            "BEGIN:VALARM",
            "TRIGGER:soon",
            "ACTION:DISPLAY",
            "END:VALARM",
            "END:VEVENT"));

        Event event = result.events().get(0);
        assertThat(event.alarms()).containsExactly(new Alarm(
            AlarmTrigger.relative(IcsDuration.negative(15, DurationUnit.MINUTES)),
            "DISPLAY", Optional.empty(), Optional.of("Reminder"), Optional.empty(), Optional.empty()));
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void shouldUnfoldLongLines() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT",
            "UID:folded@example.com",
            "DTSTART:20240115T140000Z",
            "DTEND:20240115T150000Z",
            "SUMMARY:A very long",
            "  summary",
            "END:VEVENT"));

        assertThat(result.events().get(0).title()).isEqualTo("A very long summary");
    }

    @Test
    void documentWithoutEventsShouldYieldEmptyResult() {
        IcsImportResult result = testee.read(calendar());

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.skippedEvents()).isZero();
    }

    @Test
    void unparseableDocumentShouldFail() {
        assertThatThrownBy(() -> testee.read("this is not a calendar"))
            .isInstanceOfSatisfying(IcsParseException.class,
                e -> assertThat(e.fieldName()).isEqualTo(IcsCalendarReader.CALENDAR_FIELD));
    }

    @Test
    void eventsShouldKeepDocumentOrder() {
        IcsImportResult result = testee.read(calendar(
            "BEGIN:VEVENT", "UID:b", "DTSTART:20240116T090000Z", "SUMMARY:B", "END:VEVENT",
            "BEGIN:VEVENT", "UID:a", "DTSTART:20240115T090000Z", "SUMMARY:A", "END:VEVENT"));

        assertThat(result.events()).extracting(Event::title).isEqualTo(List.of("B", "A"));
    }
}
