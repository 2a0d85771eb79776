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

import java.util.Locale;
import java.util.Optional;

import com.google.common.base.Preconditions;

public record Alarm(AlarmTrigger trigger,
                    String action,
                    Optional<String> summary,
                    Optional<String> description,
                    Optional<IcsDuration> repeatInterval,
                    Optional<Integer> repeat) {
    public static final String DISPLAY = "DISPLAY";

    public static Alarm display(AlarmTrigger trigger) {
        return new Alarm(trigger, DISPLAY, Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public Alarm {
        Preconditions.checkNotNull(trigger, "trigger must not be null");
        Preconditions.checkArgument(action != null && !action.isBlank(), "Alarm action must not be blank");
        action = action.trim().toUpperCase(Locale.ROOT);
        Preconditions.checkNotNull(summary, "summary must not be null");
        Preconditions.checkNotNull(description, "description must not be null");
        Preconditions.checkNotNull(repeatInterval, "repeatInterval must not be null");
        Preconditions.checkNotNull(repeat, "repeat must not be null");
        repeat.ifPresent(count -> Preconditions.checkArgument(count >= 0, "Alarm repeat count must not be negative"));
        summary = LineBreaks.normalize(summary);
        description = LineBreaks.normalize(description);
    }
}
