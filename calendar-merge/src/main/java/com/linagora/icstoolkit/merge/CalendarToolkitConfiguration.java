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

import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

public record CalendarToolkitConfiguration(int bundleMaxCalendars,
                                           String bundleProdId,
                                           String bundleName,
                                           String importDefaultCalendarName) {

    public static final String BUNDLE_MAX_CALENDARS_PROPERTY = "bundle.max.calendars";
    public static final int BUNDLE_MAX_CALENDARS_DEFAULT = 15;

    public static final String BUNDLE_PRODID_PROPERTY = "bundle.prodid";
    public static final String BUNDLE_PRODID_DEFAULT = "-//Linagora//ICS Toolkit//EN";

    public static final String BUNDLE_NAME_PROPERTY = "bundle.name";
    public static final String BUNDLE_NAME_DEFAULT = "Shared calendars";

    public static final String IMPORT_DEFAULT_CALENDAR_NAME_PROPERTY = "import.default.calendar.name";
    public static final String IMPORT_DEFAULT_CALENDAR_NAME_DEFAULT = "Imported Calendar";

    public static final CalendarToolkitConfiguration DEFAULT = new CalendarToolkitConfiguration(
        BUNDLE_MAX_CALENDARS_DEFAULT,
        BUNDLE_PRODID_DEFAULT,
        BUNDLE_NAME_DEFAULT,
        IMPORT_DEFAULT_CALENDAR_NAME_DEFAULT);

    public static CalendarToolkitConfiguration from(Configuration configuration) {
        Optional<Integer> bundleMaxCalendars = Optional.ofNullable(configuration.getString(BUNDLE_MAX_CALENDARS_PROPERTY, null))
            .map(String::trim)
            .map(Integer::parseInt)
            .map(maxCalendars -> {
                Preconditions.checkArgument(maxCalendars > 0, "'%s' must be positive".formatted(BUNDLE_MAX_CALENDARS_PROPERTY));
                return maxCalendars;
            });

        return new CalendarToolkitConfiguration(
            bundleMaxCalendars.orElse(BUNDLE_MAX_CALENDARS_DEFAULT),
            readString(configuration, BUNDLE_PRODID_PROPERTY).orElse(BUNDLE_PRODID_DEFAULT),
            readString(configuration, BUNDLE_NAME_PROPERTY).orElse(BUNDLE_NAME_DEFAULT),
            readString(configuration, IMPORT_DEFAULT_CALENDAR_NAME_PROPERTY).orElse(IMPORT_DEFAULT_CALENDAR_NAME_DEFAULT));
    }

    private static Optional<String> readString(Configuration configuration, String property) {
        return Optional.ofNullable(configuration.getString(property, null))
            .map(String::trim)
            .filter(StringUtils::isNotEmpty);
    }

    public CalendarToolkitConfiguration {
        Preconditions.checkArgument(bundleMaxCalendars > 0, "bundleMaxCalendars must be positive");
        Preconditions.checkArgument(StringUtils.isNotBlank(bundleProdId), "bundleProdId must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(bundleName), "bundleName must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(importDefaultCalendarName), "importDefaultCalendarName must not be blank");
    }
}
