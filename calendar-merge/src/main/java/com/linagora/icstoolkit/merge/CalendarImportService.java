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

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.ics.IcsCalendarReader;
import com.linagora.icstoolkit.ics.IcsImportResult;
import com.linagora.icstoolkit.storage.CalendarDAO;
import com.linagora.icstoolkit.storage.exception.CalendarNotFoundException;
import com.linagora.icstoolkit.storage.exception.CalendarPreconditionException;
import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;
import com.linagora.icstoolkit.storage.model.Event;

import reactor.core.publisher.Mono;

/**
 * Imports ICS documents, either as a new calendar or into an existing one. Broken events are skipped and
 * reported.
 */
public class CalendarImportService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarImportService.class);

    private final CalendarDAO calendarDAO;
    private final IcsCalendarReader reader;
    private final DuplicateResolver duplicateResolver;
    private final CalendarToolkitConfiguration configuration;

    @Inject
    @Singleton
    public CalendarImportService(CalendarDAO calendarDAO, IcsCalendarReader reader,
                                 DuplicateResolver duplicateResolver, CalendarToolkitConfiguration configuration) {
        this.calendarDAO = calendarDAO;
        this.reader = reader;
        this.duplicateResolver = duplicateResolver;
        this.configuration = configuration;
    }

    /**
     * Creates a calendar out of a document. A document that yields no event at all is rejected.
     */
    public Mono<ImportReport> importIcs(String icsContent, String calendarName) {
        String name = StringUtils.isBlank(calendarName) ? configuration.importDefaultCalendarName() : calendarName.trim();

        return Mono.fromCallable(() -> reader.read(icsContent))
            .flatMap(result -> {
                if (result.isEmpty()) {
                    return Mono.error(new CalendarPreconditionException(
                        "No valid event found in the document (%d skipped)".formatted(result.skippedEvents())));
                }
                return store(name, result);
            });
    }

    private Mono<ImportReport> store(String name, IcsImportResult result) {
        CalendarRecord calendar = CalendarRecord.of(CalendarId.generate(), name, result.events());
        if (result.skippedEvents() > 0) {
            LOGGER.warn("Skipped {} events while importing calendar '{}'", result.skippedEvents(), name);
        }
        return calendarDAO.save(calendar)
            .thenReturn(new ImportReport(calendar.id(), name, result.events().size(), result.skippedEvents(), 0, result.warnings()))
            .doOnNext(report -> LOGGER.info("Imported {} events into calendar {}", report.importedEvents(), calendar.id().value()));
    }

    /**
     * Adds the events of a document to a stored calendar. With {@code removeDuplicates}, events matching one
     * already in the calendar, or an earlier one of the document, are left out; the calendar's own events
     * are never touched. A document without any event leaves the calendar unchanged.
     */
    public Mono<ImportReport> importIcs(CalendarId calendarId, String icsContent, boolean removeDuplicates) {
        Preconditions.checkNotNull(icsContent, "icsContent must not be null");

        return calendarDAO.find(calendarId)
            .switchIfEmpty(Mono.error(() -> new CalendarNotFoundException(calendarId)))
            .flatMap(calendar -> Mono.fromCallable(() -> reader.read(icsContent))
                .flatMap(result -> importInto(calendar, result, DuplicatePolicy.of(removeDuplicates))));
    }

    private Mono<ImportReport> importInto(CalendarRecord calendar, IcsImportResult result, DuplicatePolicy policy) {
        if (result.isEmpty() && result.skippedEvents() > 0) {
            return Mono.error(new CalendarPreconditionException(
                "No valid event found in the document (%d skipped)".formatted(result.skippedEvents())));
        }

        DuplicateResolution resolution = duplicateResolver.resolveIncoming(calendar.events(), result.events(), policy);
        ImportReport report = new ImportReport(calendar.id(), calendar.name(), resolution.retained().size(),
            result.skippedEvents(), resolution.removedDuplicates(), result.warnings());
        if (resolution.retained().isEmpty()) {
            return Mono.just(report);
        }

        List<Event> events = ImmutableList.<Event>builder()
            .addAll(calendar.events())
            .addAll(resolution.retained())
            .build();
        return calendarDAO.save(calendar.withEvents(events))
            .thenReturn(report)
            .doOnNext(imported -> LOGGER.info("Imported {} events into calendar {}, {} duplicates skipped",
                imported.importedEvents(), calendar.id().value(), imported.skippedDuplicates()));
    }
}
