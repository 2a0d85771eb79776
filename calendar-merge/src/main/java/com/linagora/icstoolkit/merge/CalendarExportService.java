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
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.ics.IcsCalendarWriter;
import com.linagora.icstoolkit.storage.CalendarDAO;
import com.linagora.icstoolkit.storage.exception.CalendarNotFoundException;
import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.IcsInstant;

import reactor.core.publisher.Mono;

/**
 * Exports one stored calendar as a PUBLISH document named after it.
 * <p>
 * Without a timezone database, floating and date-only starts are compared to the filter bounds by their
 * wall clock read as UTC.
 */
public class CalendarExportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarExportService.class);

    private final CalendarDAO calendarDAO;
    private final Clock clock;
    private final CalendarToolkitConfiguration configuration;

    @Inject
    @Singleton
    public CalendarExportService(CalendarDAO calendarDAO, Clock clock, CalendarToolkitConfiguration configuration) {
        this.calendarDAO = calendarDAO;
        this.clock = clock;
        this.configuration = configuration;
    }

    public Mono<String> exportIcs(CalendarId calendarId) {
        return exportIcs(calendarId, ExportFilter.ALL);
    }

    public Mono<String> exportIcs(CalendarId calendarId, ExportFilter filter) {
        Preconditions.checkNotNull(filter, "filter must not be null");

        return calendarDAO.find(calendarId)
            .switchIfEmpty(Mono.error(() -> new CalendarNotFoundException(calendarId)))
            .map(calendar -> export(calendar, filter));
    }

    private String export(CalendarRecord calendar, ExportFilter filter) {
        Instant now = clock.instant();
        Optional<Instant> lowerBound = filter.lowerBound(now);
        List<Event> events = calendar.events().stream()
            .filter(event -> lowerBound.map(bound -> !startOf(event).isBefore(bound)).orElse(true))
            .filter(event -> filter.dateTo().map(bound -> !startOf(event).isAfter(bound)).orElse(true))
            .filter(event -> filter.categories().isEmpty()
                || event.categories().stream().anyMatch(filter.categories()::contains))
            .collect(ImmutableList.toImmutableList());

        StringWriter output = new StringWriter();
        new IcsCalendarWriter(output)
            .publish(configuration.bundleProdId(), calendar.name(), events, IcsInstant.utc(now));

        LOGGER.info("Exported {} of {} events from calendar {}", events.size(), calendar.events().size(),
            calendar.id().value());
        return output.toString();
    }

    private static Instant startOf(Event event) {
        LocalDateTime wallClock = event.start().dateTime();
        return wallClock.toInstant(ZoneOffset.UTC);
    }
}
