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

import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.model.CalendarId;

/**
 * {@code skippedEvents} counts VEVENTs that could not be read; {@code skippedDuplicates} counts readable
 * events left out because the target calendar already held them.
 */
public record ImportReport(CalendarId calendarId, String calendarName, int importedEvents, int skippedEvents,
                           int skippedDuplicates, List<String> warnings) {

    public ImportReport {
        warnings = ImmutableList.copyOf(warnings);
    }
}
