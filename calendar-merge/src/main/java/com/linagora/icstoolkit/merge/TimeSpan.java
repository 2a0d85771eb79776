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

import java.time.LocalDateTime;

import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.IcsInstant;
import com.linagora.icstoolkit.storage.model.InstantKind;

/**
 * Half-open wall clock interval of an event, tagged with the kind of clock it is read on.
 * <p>
 * All-day events cover whole days, from the midnight starting their first day to the midnight ending their
 * last one; a zero-length all-day event still covers its single day. A span whose start and end are both
 * dates has the {@link InstantKind#DATE_ONLY} kind and can be compared with any other span.
 */
record TimeSpan(InstantKind kind, LocalDateTime start, LocalDateTime end) {

    static TimeSpan of(Event event) {
        IcsInstant start = event.start();
        IcsInstant end = event.end();
        if (start.isDateOnly() && end.isDateOnly()) {
            LocalDateTime startOfDay = start.dateTime();
            LocalDateTime endOfDay = end.dateTime();
            if (!endOfDay.isAfter(startOfDay)) {
                endOfDay = startOfDay.plusDays(1);
            }
            return new TimeSpan(InstantKind.DATE_ONLY, startOfDay, endOfDay);
        }
        InstantKind kind = start.isDateOnly() ? end.kind() : start.kind();
        return new TimeSpan(kind, start.dateTime(), end.dateTime());
    }

    boolean isComparableWith(TimeSpan other) {
        return kind == other.kind
            || kind == InstantKind.DATE_ONLY
            || other.kind == InstantKind.DATE_ONLY;
    }

    boolean overlaps(TimeSpan other) {
        return isComparableWith(other)
            && start.isBefore(other.end)
            && other.start.isBefore(end);
    }

    boolean isEmpty() {
        return !end.isAfter(start);
    }
}
