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

import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * VALARM trigger: either relative to the event start (signed duration) or an absolute UTC date-time.
 */
public record AlarmTrigger(Optional<IcsDuration> relative, Optional<IcsInstant> absolute) {

    public static AlarmTrigger relative(IcsDuration offset) {
        return new AlarmTrigger(Optional.of(offset), Optional.empty());
    }

    public static AlarmTrigger absolute(IcsInstant instant) {
        return new AlarmTrigger(Optional.empty(), Optional.of(instant));
    }

    public AlarmTrigger {
        Preconditions.checkNotNull(relative, "relative must not be null");
        Preconditions.checkNotNull(absolute, "absolute must not be null");
        Preconditions.checkArgument(relative.isPresent() != absolute.isPresent(),
            "A trigger is either relative or absolute");
    }

    public boolean isRelative() {
        return relative.isPresent();
    }
}
