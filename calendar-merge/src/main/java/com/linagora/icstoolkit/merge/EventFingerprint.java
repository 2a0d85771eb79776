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

import java.util.Locale;

import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.IcsInstant;

/**
 * Identity of an event for deduplication purposes: case-insensitive title and exact timing. Description,
 * location, attendees and UID play no part.
 */
public record EventFingerprint(String normalizedTitle, IcsInstant start, IcsInstant end) {

    public static EventFingerprint of(Event event) {
        return new EventFingerprint(event.title().trim().toLowerCase(Locale.ROOT), event.start(), event.end());
    }
}
