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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.linagora.icstoolkit.storage.CalendarDAO;
import com.linagora.icstoolkit.storage.MemoryCalendarDAO;
import com.linagora.icstoolkit.storage.exception.CalendarNotFoundException;
import com.linagora.icstoolkit.storage.exception.CalendarPreconditionException;
import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;

class ShareBundleServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-01T08:30:00Z"), ZoneOffset.UTC);
    private static final CalendarRecord CALENDAR_A = calendar("a", event("standup-a@test", "Standup", utc(9, 0), utc(9, 30)));
    private static final CalendarRecord CALENDAR_B = calendar("b", event("standup-b@test", "Standup", utc(9, 0), utc(9, 30)));

    private CalendarDAO calendarDAO;
    private ShareBundleService testee;

    @BeforeEach
    void setUp() {
        calendarDAO = new MemoryCalendarDAO();
        calendarDAO.save(CALENDAR_A).block();
        calendarDAO.save(CALENDAR_B).block();
        CalendarToolkitConfiguration configuration = new CalendarToolkitConfiguration(3,
            CalendarToolkitConfiguration.BUNDLE_PRODID_DEFAULT, "Team", "Imported");
        testee = new ShareBundleService(calendarDAO,
            new BundleSerializer(CLOCK, new DuplicateResolver(), configuration), configuration);
    }

    @Test
    void generateShouldRenderRequestedCalendars() {
        String bundle = testee.generate(List.of(CALENDAR_A.id(), CALENDAR_B.id()), true).block();

        assertThat(bundle).contains("X-WR-CALNAME:Team\r\n", "UID:standup-a@test");
        assertThat(StringUtils.countMatches(bundle, "BEGIN:VEVENT")).isEqualTo(1);
    }

    @Test
    void generateShouldKeepDuplicatesWhenNotRequested() {
        String bundle = testee.generate(List.of(CALENDAR_A.id(), CALENDAR_B.id()), false).block();

        assertThat(StringUtils.countMatches(bundle, "BEGIN:VEVENT")).isEqualTo(2);
    }

    @Test
    void generateShouldRejectEmptyRequest() {
        assertThatThrownBy(() -> testee.generate(List.of(), true).block())
            .isInstanceOf(CalendarPreconditionException.class);
    }

    @Test
    void generateShouldRejectTooManyCalendars() {
        List<CalendarId> ids = IntStream.range(0, 4)
            .mapToObj(i -> new CalendarId("calendar-" + i))
            .collect(Collectors.toList());

        assertThatThrownBy(() -> testee.generate(ids, true).block())
            .isInstanceOf(CalendarPreconditionException.class);
    }

    @Test
    void generateShouldFailOnUnknownCalendar() {
        assertThatThrownBy(() -> testee.generate(List.of(CALENDAR_A.id(), new CalendarId("unknown")), true).block())
            .isInstanceOf(CalendarNotFoundException.class);
    }
}
