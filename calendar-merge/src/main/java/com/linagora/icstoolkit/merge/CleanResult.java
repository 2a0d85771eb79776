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

import com.google.common.base.Preconditions;
import com.linagora.icstoolkit.storage.model.CalendarRecord;

public record CleanResult(CalendarRecord calendar, int removedDuplicates) {

    public CleanResult {
        Preconditions.checkNotNull(calendar, "calendar must not be null");
        Preconditions.checkArgument(removedDuplicates >= 0, "removedDuplicates must not be negative");
    }
}
