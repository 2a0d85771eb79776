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

package com.linagora.icstoolkit.ics;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.model.Event;

/**
 * Outcome of reading a document: the events that could be built, how many VEVENTs had to be skipped,
 * and one warning per dropped property or skipped event.
 */
public record IcsImportResult(List<Event> events, int skippedEvents, List<String> warnings) {

    public IcsImportResult {
        Preconditions.checkArgument(skippedEvents >= 0, "skippedEvents must not be negative");
        events = ImmutableList.copyOf(events);
        warnings = ImmutableList.copyOf(warnings);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
