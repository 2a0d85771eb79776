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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.model.Event;

/**
 * Partition of an event sequence into first occurrences ({@code kept}) and later copies ({@code removed}).
 * {@code retained} is what the caller should store: {@code kept} when duplicates are removed, otherwise
 * the untouched input.
 */
public record DuplicateResolution(List<Event> kept, List<Event> removed, List<Event> retained) {

    public DuplicateResolution {
        kept = ImmutableList.copyOf(kept);
        removed = ImmutableList.copyOf(removed);
        retained = ImmutableList.copyOf(retained);
    }

    public int removedDuplicates() {
        return kept.size() + removed.size() - retained.size();
    }

    public boolean hasDuplicates() {
        return !removed.isEmpty();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("kept", kept.size())
            .add("removed", removed.size())
            .add("retained", retained.size())
            .toString();
    }
}
