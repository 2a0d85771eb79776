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

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A point in time as carried by ICS date and date-time values.
 * <p>
 * The wall clock value is always held as a {@link LocalDateTime}: for {@link InstantKind#UTC} it is the
 * UTC wall clock, for {@link InstantKind#FLOATING} the viewer's local wall clock, and for
 * {@link InstantKind#DATE_ONLY} the midnight starting that day. Values are truncated to the second.
 * <p>
 * Two instants are only comparable when they share a kind, or when one of them is a date, which is then
 * promoted to its midnight in the kind of the other side. UTC and floating values are never compared.
 */
public record IcsInstant(InstantKind kind, LocalDateTime dateTime) implements Comparable<IcsInstant> {

    public static IcsInstant utc(Instant instant) {
        return new IcsInstant(InstantKind.UTC, LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
    }

    public static IcsInstant utc(LocalDateTime dateTime) {
        return new IcsInstant(InstantKind.UTC, dateTime);
    }

    public static IcsInstant floating(LocalDateTime dateTime) {
        return new IcsInstant(InstantKind.FLOATING, dateTime);
    }

    public static IcsInstant date(LocalDate date) {
        return new IcsInstant(InstantKind.DATE_ONLY, date.atStartOfDay());
    }

    public IcsInstant {
        Preconditions.checkNotNull(kind, "kind must not be null");
        Preconditions.checkNotNull(dateTime, "dateTime must not be null");
        if (kind == InstantKind.DATE_ONLY) {
            dateTime = dateTime.truncatedTo(ChronoUnit.DAYS);
        } else {
            dateTime = dateTime.truncatedTo(ChronoUnit.SECONDS);
        }
    }

    public boolean isDateOnly() {
        return kind == InstantKind.DATE_ONLY;
    }

    public LocalDate toLocalDate() {
        return dateTime.toLocalDate();
    }

    public boolean isComparableWith(IcsInstant other) {
        return kind == other.kind
            || kind == InstantKind.DATE_ONLY
            || other.kind == InstantKind.DATE_ONLY;
    }

    @Override
    public int compareTo(IcsInstant other) {
        Preconditions.checkArgument(isComparableWith(other),
            "Cannot compare a %s instant with a %s instant", kind, other.kind);
        return dateTime.compareTo(other.dateTime);
    }

    public boolean isBefore(IcsInstant other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(IcsInstant other) {
        return compareTo(other) > 0;
    }

    /**
     * Adds a signed duration. Whole days keep a date a date; any finer unit turns it into a floating
     * date-time starting at midnight.
     */
    public IcsInstant plus(IcsDuration duration) {
        if (kind == InstantKind.DATE_ONLY) {
            if (duration.unit() == DurationUnit.DAYS) {
                long days = duration.negative() ? -duration.value() : duration.value();
                return date(toLocalDate().plusDays(days));
            }
            return floating(dateTime.plusSeconds(duration.toSeconds()));
        }
        return new IcsInstant(kind, dateTime.plusSeconds(duration.toSeconds()));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("kind", kind)
            .add("dateTime", isDateOnly() ? toLocalDate() : dateTime)
            .toString();
    }
}
