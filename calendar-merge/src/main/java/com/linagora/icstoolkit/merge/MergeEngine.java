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

import java.util.List;
import java.util.function.Supplier;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;

/**
 * Combines calendars into a new one. Source calendars are read, never modified; events are copied as they
 * are, UID and SEQUENCE included.
 */
public class MergeEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(MergeEngine.class);

    private final DuplicateResolver duplicateResolver;
    private final Supplier<CalendarId> calendarIdFactory;

    @Inject
    @Singleton
    public MergeEngine(DuplicateResolver duplicateResolver) {
        this(duplicateResolver, CalendarId::generate);
    }

    public MergeEngine(DuplicateResolver duplicateResolver, Supplier<CalendarId> calendarIdFactory) {
        this.duplicateResolver = duplicateResolver;
        this.calendarIdFactory = calendarIdFactory;
    }

    public MergeResult merge(List<CalendarRecord> calendars, String newName, boolean removeDuplicates) {
        DuplicateResolution resolution = duplicateResolver.resolveAll(calendars, DuplicatePolicy.of(removeDuplicates));
        CalendarRecord target = CalendarRecord.of(calendarIdFactory.get(), newName, resolution.retained());

        LOGGER.debug("Merged {} calendars into {}: {} events, {} duplicates removed",
            calendars.size(), target.id().value(), target.events().size(), resolution.removedDuplicates());
        return new MergeResult(target, target.events().size(), resolution.removedDuplicates());
    }
}
