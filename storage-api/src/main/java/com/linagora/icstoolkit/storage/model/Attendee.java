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

public record Attendee(Optional<String> name,
                       String email,
                       Optional<String> role,
                       Optional<String> participationStatus,
                       boolean rsvp) {

    public static Attendee of(String email) {
        return new Attendee(Optional.empty(), email, Optional.empty(), Optional.empty(), false);
    }

    public Attendee {
        Preconditions.checkNotNull(name, "name must not be null");
        Preconditions.checkArgument(email != null && !email.isBlank(), "Attendee email must not be blank");
        Preconditions.checkNotNull(role, "role must not be null");
        Preconditions.checkNotNull(participationStatus, "participationStatus must not be null");
        name = LineBreaks.normalize(name);
    }
}
