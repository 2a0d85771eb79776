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

import com.linagora.icstoolkit.storage.CalendarDAO;
import com.linagora.icstoolkit.storage.exception.CalendarNotFoundException;
import com.linagora.icstoolkit.storage.exception.CalendarPreconditionException;
import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Merge, deduplication and conflict operations on stored calendars. Preconditions are checked before any
 * lookup, and nothing is saved unless the whole computation succeeded.
 */
public class CalendarMergeService {
    private static final Logger LOGGER = LoggerFactory.getLogger(CalendarMergeService.class);

    public static final int MIN_MERGED_CALENDARS = 2;

    private final CalendarDAO calendarDAO;
    private final MergeEngine mergeEngine;
    private final DuplicateResolver duplicateResolver;
    private final ConflictDetector conflictDetector;

    @Inject
    @Singleton
    public CalendarMergeService(CalendarDAO calendarDAO, MergeEngine mergeEngine,
                                DuplicateResolver duplicateResolver, ConflictDetector conflictDetector) {
        this.calendarDAO = calendarDAO;
        this.mergeEngine = mergeEngine;
        this.duplicateResolver = duplicateResolver;
        this.conflictDetector = conflictDetector;
    }

    public Mono<MergeResult> merge(List<CalendarId> calendarIds, String name, boolean removeDuplicates) {
        if (calendarIds.stream().distinct().count() < MIN_MERGED_CALENDARS) {
            return Mono.error(new CalendarPreconditionException(
                "At least %d distinct calendars are required to merge".formatted(MIN_MERGED_CALENDARS)));
        }
        if (StringUtils.isBlank(name)) {
            return Mono.error(new CalendarPreconditionException("The merged calendar name must not be blank"));
        }

        return fetch(calendarIds)
            .map(calendars -> mergeEngine.merge(calendars, name.trim(), removeDuplicates))
            .flatMap(result -> calendarDAO.save(result.calendar()).thenReturn(result))
            .doOnNext(result -> LOGGER.info("Merged calendars {} into {}: {} events, {} duplicates removed",
                calendarIds, result.calendar().id().value(), result.mergedEvents(), result.removedDuplicates()));
    }

    /**
     * Computes what a deduplicating merge of these calendars would drop, without storing anything.
     */
    public Mono<DuplicateResolution> previewDuplicates(List<CalendarId> calendarIds) {
        if (calendarIds.isEmpty()) {
            return Mono.error(new CalendarPreconditionException("At least one calendar is required"));
        }
        return fetch(calendarIds)
            .map(calendars -> duplicateResolver.resolveAll(calendars, DuplicatePolicy.KEEP_ALL));
    }

    public Mono<CleanResult> cleanDuplicates(CalendarId calendarId) {
        return fetch(calendarId)
            .flatMap(calendar -> {
                DuplicateResolution resolution = duplicateResolver.resolve(calendar.events(), DuplicatePolicy.REMOVE_DUPLICATES);
                if (!resolution.hasDuplicates()) {
                    return Mono.just(new CleanResult(calendar, 0));
                }
                CalendarRecord cleaned = calendar.withEvents(resolution.retained());
                return calendarDAO.save(cleaned)
                    .thenReturn(new CleanResult(cleaned, resolution.removedDuplicates()))
                    .doOnNext(result -> LOGGER.info("Removed {} duplicates from calendar {}",
                        result.removedDuplicates(), calendarId.value()));
            });
    }

    public Mono<List<EventConflict>> findConflicts(CalendarId calendarId) {
        return fetch(calendarId)
            .map(calendar -> conflictDetector.findConflicts(calendar.events()));
    }

    public Mono<List<EventConflict>> findBusyConflicts(CalendarId calendarId) {
        return fetch(calendarId)
            .map(calendar -> conflictDetector.findBusyConflicts(calendar.events()));
    }

    // a calendar listed twice is only read, and merged, once
    private Mono<List<CalendarRecord>> fetch(List<CalendarId> calendarIds) {
        return Flux.fromIterable(calendarIds)
            .distinct()
            .concatMap(this::fetch)
            .collectList();
    }

    private Mono<CalendarRecord> fetch(CalendarId calendarId) {
        return calendarDAO.find(calendarId)
            .switchIfEmpty(Mono.error(() -> new CalendarNotFoundException(calendarId)));
    }
}
