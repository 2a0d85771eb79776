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

package com.linagora.icstoolkit.app.modules;

import java.io.FileNotFoundException;
import java.time.Clock;

import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Scopes;
import com.google.inject.Singleton;
import com.linagora.icstoolkit.app.ClasspathPropertiesProvider;
import com.linagora.icstoolkit.ics.IcsCalendarReader;
import com.linagora.icstoolkit.merge.BundleSerializer;
import com.linagora.icstoolkit.merge.CalendarExportService;
import com.linagora.icstoolkit.merge.CalendarImportService;
import com.linagora.icstoolkit.merge.CalendarMergeService;
import com.linagora.icstoolkit.merge.CalendarToolkitConfiguration;
import com.linagora.icstoolkit.merge.ConflictDetector;
import com.linagora.icstoolkit.merge.DuplicateResolver;
import com.linagora.icstoolkit.merge.MergeEngine;
import com.linagora.icstoolkit.merge.ShareBundleService;

public class IcsToolkitModule extends AbstractModule {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsToolkitModule.class);

    public static final String CONFIGURATION_NAME = "ics-toolkit";

    @Override
    protected void configure() {
        bind(IcsCalendarReader.class).in(Scopes.SINGLETON);

        bind(DuplicateResolver.class).in(Scopes.SINGLETON);
        bind(ConflictDetector.class).in(Scopes.SINGLETON);
        bind(MergeEngine.class).in(Scopes.SINGLETON);
        bind(BundleSerializer.class).in(Scopes.SINGLETON);

        bind(CalendarMergeService.class).in(Scopes.SINGLETON);
        bind(ShareBundleService.class).in(Scopes.SINGLETON);
        bind(CalendarImportService.class).in(Scopes.SINGLETON);
        bind(CalendarExportService.class).in(Scopes.SINGLETON);
    }

    @Provides
    @Singleton
    Clock provideClock() {
        return Clock.systemUTC();
    }

    @Provides
    @Singleton
    ClasspathPropertiesProvider providePropertiesProvider() {
        return new ClasspathPropertiesProvider();
    }

    @Provides
    @Singleton
    CalendarToolkitConfiguration provideConfiguration(ClasspathPropertiesProvider propertiesProvider) throws ConfigurationException {
        try {
            return CalendarToolkitConfiguration.from(propertiesProvider.getConfiguration(CONFIGURATION_NAME));
        } catch (FileNotFoundException e) {
            LOGGER.info("No {}.properties found, using default configuration", CONFIGURATION_NAME);
            return CalendarToolkitConfiguration.DEFAULT;
        }
    }
}
