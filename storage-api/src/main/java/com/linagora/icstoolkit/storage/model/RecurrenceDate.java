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

import com.google.common.base.Preconditions;

public record RecurrenceDate(IcsInstant date, RecurrenceType type) {

    public static RecurrenceDate rdate(IcsInstant date) {
        return new RecurrenceDate(date, RecurrenceType.RDATE);
    }

    public static RecurrenceDate exdate(IcsInstant date) {
        return new RecurrenceDate(date, RecurrenceType.EXDATE);
    }

    public RecurrenceDate {
        Preconditions.checkNotNull(date, "date must not be null");
        Preconditions.checkNotNull(type, "type must not be null");
    }
}
