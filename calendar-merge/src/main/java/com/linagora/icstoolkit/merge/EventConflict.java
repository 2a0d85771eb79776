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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.linagora.icstoolkit.storage.model.Event;

/**
 * Two overlapping events. {@code first} starts earlier, or at the same time but comes first in the input.
 */
public record EventConflict(Event first, Event second) {

    public EventConflict {
        Preconditions.checkNotNull(first, "first must not be null");
        Preconditions.checkNotNull(second, "second must not be null");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("first", first.toShortString())
            .add("second", second.toShortString())
            .toString();
    }
}
