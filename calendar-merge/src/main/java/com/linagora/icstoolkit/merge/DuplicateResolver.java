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

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.Event;

/**
 * Finds events sharing a {@link EventFingerprint}. The first occurrence in iteration order wins, so the
 * result depends on the order of the input: when merging A then B, A's copy of a duplicate is kept.
 */
public class DuplicateResolver {

    @Inject
    @Singleton
    public DuplicateResolver() {
    }

    public DuplicateResolution resolve(List<Event> events, DuplicatePolicy policy) {
        return partition(new HashSet<>(), events, policy);
    }

    /**
     * Resolves events about to be added to a calendar against the events it already holds. Existing events
     * always win and are never reported; {@code retained} is the part of {@code incoming} to add.
     */
    public DuplicateResolution resolveIncoming(List<Event> existing, List<Event> incoming, DuplicatePolicy policy) {
        Set<EventFingerprint> seen = existing.stream()
            .map(EventFingerprint::of)
            .collect(Collectors.toCollection(HashSet::new));
        return partition(seen, incoming, policy);
    }

    /**
     * Resolves the concatenation of the calendars' events, calendars taken in the given order.
     */
    public DuplicateResolution resolveAll(Collection<CalendarRecord> calendars, DuplicatePolicy policy) {
        return resolve(concatenate(calendars), policy);
    }

    private DuplicateResolution partition(Set<EventFingerprint> seen, List<Event> events, DuplicatePolicy policy) {
        ImmutableList.Builder<Event> kept = ImmutableList.builder();
        ImmutableList.Builder<Event> removed = ImmutableList.builder();

        for (Event event : events) {
            if (seen.add(EventFingerprint.of(event))) {
                kept.add(event);
            } else {
                removed.add(event);
            }
        }

        ImmutableList<Event> keptEvents = kept.build();
        if (policy.removesDuplicates()) {
            return new DuplicateResolution(keptEvents, removed.build(), keptEvents);
        }
        return new DuplicateResolution(keptEvents, removed.build(), events);
    }

    static List<Event> concatenate(Collection<CalendarRecord> calendars) {
        return calendars.stream()
            .flatMap(calendar -> calendar.events().stream())
            .collect(ImmutableList.toImmutableList());
    }
}
