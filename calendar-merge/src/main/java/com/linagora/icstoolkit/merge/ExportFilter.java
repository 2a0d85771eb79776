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

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Restricts which events of a calendar get exported. Every bound applies to the event start and is
 * inclusive. When {@code futureOnly} is set, the lower bound is the export time and {@code dateFrom} is
 * ignored. A non empty {@code categories} set keeps events carrying at least one of them.
 */
public record ExportFilter(Optional<Instant> dateFrom,
                           Optional<Instant> dateTo,
                           Set<String> categories,
                           boolean futureOnly) {

    public static final ExportFilter ALL = new ExportFilter(Optional.empty(), Optional.empty(), Set.of(), false);

    public ExportFilter {
        Preconditions.checkNotNull(dateFrom, "dateFrom must not be null");
        Preconditions.checkNotNull(dateTo, "dateTo must not be null");
        categories = ImmutableSet.copyOf(categories);
    }

    public ExportFilter from(Instant instant) {
        return new ExportFilter(Optional.of(instant), dateTo, categories, futureOnly);
    }

    public ExportFilter to(Instant instant) {
        return new ExportFilter(dateFrom, Optional.of(instant), categories, futureOnly);
    }

    public ExportFilter withCategories(Collection<String> newCategories) {
        return new ExportFilter(dateFrom, dateTo, ImmutableSet.copyOf(newCategories), futureOnly);
    }

    public ExportFilter onlyFuture() {
        return new ExportFilter(dateFrom, dateTo, categories, true);
    }

    public Optional<Instant> lowerBound(Instant now) {
        if (futureOnly) {
            return Optional.of(now);
        }
        return dateFrom;
    }
}
