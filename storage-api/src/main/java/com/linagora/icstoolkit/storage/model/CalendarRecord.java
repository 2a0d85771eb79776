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

import java.net.URI;
import java.util.List;
import java.util.Optional;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A calendar and the ordered events it owns.
 */
public record CalendarRecord(CalendarId id,
                             String name,
                             Optional<String> color,
                             Optional<URI> sourceUrl,
                             List<Event> events) {

    public static CalendarRecord of(CalendarId id, String name, List<Event> events) {
        return new CalendarRecord(id, name, Optional.empty(), Optional.empty(), events);
    }

    public CalendarRecord {
        Preconditions.checkNotNull(id, "id must not be null");
        Preconditions.checkArgument(name != null && !name.isBlank(), "Calendar name must not be blank");
        Preconditions.checkNotNull(color, "color must not be null");
        Preconditions.checkNotNull(sourceUrl, "sourceUrl must not be null");
        events = ImmutableList.copyOf(events);
    }

    public CalendarRecord withEvents(List<Event> newEvents) {
        return new CalendarRecord(id, name, color, sourceUrl, newEvents);
    }

    public String toShortString() {
        return MoreObjects.toStringHelper(this)
            .add("id", id.value())
            .add("name", name)
            .add("events", events.size())
            .toString();
    }
}
