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

import java.io.StringWriter;
import java.time.Clock;
import java.util.List;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.icstoolkit.ics.IcsCalendarWriter;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.IcsInstant;

/**
 * Renders calendars as a single PUBLISH document, with the same deduplication semantics as
 * {@link MergeEngine}. Every VEVENT is stamped with the same generation time.
 */
public class BundleSerializer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BundleSerializer.class);

    private final Clock clock;
    private final DuplicateResolver duplicateResolver;
    private final CalendarToolkitConfiguration configuration;

    @Inject
    @Singleton
    public BundleSerializer(Clock clock, DuplicateResolver duplicateResolver, CalendarToolkitConfiguration configuration) {
        this.clock = clock;
        this.duplicateResolver = duplicateResolver;
        this.configuration = configuration;
    }

    public String serialize(List<CalendarRecord> calendars, boolean removeDuplicates) {
        return serialize(calendars, configuration.bundleName(), removeDuplicates);
    }

    public String serialize(List<CalendarRecord> calendars, String bundleName, boolean removeDuplicates) {
        DuplicateResolution resolution = duplicateResolver.resolveAll(calendars, DuplicatePolicy.of(removeDuplicates));
        IcsInstant dtStamp = IcsInstant.utc(clock.instant());

        StringWriter output = new StringWriter();
        new IcsCalendarWriter(output)
            .publish(configuration.bundleProdId(), bundleName, resolution.retained(), dtStamp);

        LOGGER.debug("Serialized {} events from {} calendars, {} duplicates removed",
            resolution.retained().size(), calendars.size(), resolution.removedDuplicates());
        return output.toString();
    }
}
