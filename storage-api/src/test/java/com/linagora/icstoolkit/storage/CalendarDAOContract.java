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

package com.linagora.icstoolkit.storage;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.IcsInstant;

public interface CalendarDAOContract {

    CalendarDAO getDAO();

    private static Event event(String title) {
        return Event.builder()
            .uid(title + "@test")
            .title(title)
            .start(IcsInstant.utc(LocalDateTime.of(2024, 1, 1, 9, 0)))
            .end(IcsInstant.utc(LocalDateTime.of(2024, 1, 1, 10, 0)))
            .build();
    }

    @Test
    default void shouldSaveCalendar() {
        CalendarRecord calendar = CalendarRecord.of(new CalendarId("1"), "Work", List.of(event("Standup")));
        getDAO().save(calendar).block();

        assertThat(getDAO().find(new CalendarId("1")).block()).isEqualTo(calendar);
    }

    @Test
    default void findShouldReturnEmptyWhenUnknown() {
        assertThat(getDAO().find(new CalendarId("unknown")).blockOptional()).isEmpty();
    }

    @Test
    default void saveShouldReplaceCalendarWithSameId() {
        CalendarRecord calendar = CalendarRecord.of(new CalendarId("1"), "Work", List.of(event("Standup")));
        CalendarRecord updated = calendar.withEvents(List.of(event("Standup"), event("Lunch")));
        getDAO().save(calendar).block();
        getDAO().save(updated).block();

        assertThat(getDAO().find(new CalendarId("1")).block().events()).hasSize(2);
    }

    @Test
    default void shouldDeleteCalendar() {
        CalendarRecord calendar = CalendarRecord.of(new CalendarId("1"), "Work", List.of(event("Standup")));
        getDAO().save(calendar).block();
        getDAO().delete(new CalendarId("1")).block();

        assertThat(getDAO().find(new CalendarId("1")).block()).isNull();
    }

    @Test
    default void listShouldReturnAllCalendars() {
        CalendarRecord work = CalendarRecord.of(new CalendarId("1"), "Work", List.of(event("Standup")));
        CalendarRecord home = CalendarRecord.of(new CalendarId("2"), "Home", List.of());
        getDAO().save(work).block();
        getDAO().save(home).block();

        assertThat(getDAO().list().collectList().block()).containsExactlyInAnyOrder(work, home);
    }
}
