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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.Transparency;

/**
 * Reports every pair of events whose time spans strictly overlap. Touching events do not conflict.
 * <p>
 * Events are swept in start order, ties broken by input position, against the set of spans still open at
 * the current start. Timed UTC and floating events are never compared with each other.
 */
public class ConflictDetector {

    private record Entry(int index, Event event, TimeSpan span) {
    }

    @Inject
    @Singleton
    public ConflictDetector() {
    }

    public List<EventConflict> findConflicts(List<Event> events) {
        List<Entry> sorted = IntStream.range(0, events.size())
            .mapToObj(index -> new Entry(index, events.get(index), TimeSpan.of(events.get(index))))
            .sorted(Comparator.comparing((Entry entry) -> entry.span().start())
                .thenComparingInt(Entry::index))
            .toList();

        ImmutableList.Builder<EventConflict> conflicts = ImmutableList.builder();
        List<Entry> active = new ArrayList<>();
        for (Entry current : sorted) {
            active.removeIf(open -> !open.span().end().isAfter(current.span().start()));
            for (Entry open : active) {
                if (open.span().overlaps(current.span())) {
                    conflicts.add(new EventConflict(open.event(), current.event()));
                }
            }
            if (!current.span().isEmpty()) {
                active.add(current);
            }
        }
        return conflicts.build();
    }

    /**
     * Same as {@link #findConflicts(List)}, restricted to events that block time: transparent events are
     * left out. Status plays no part, a cancelled but opaque event still counts.
     */
    public List<EventConflict> findBusyConflicts(List<Event> events) {
        return findConflicts(events.stream()
            .filter(ConflictDetector::isBusy)
            .collect(ImmutableList.toImmutableList()));
    }

    static boolean isBusy(Event event) {
        return event.transparency().filter(Transparency.TRANSPARENT::equals).isEmpty();
    }
}
