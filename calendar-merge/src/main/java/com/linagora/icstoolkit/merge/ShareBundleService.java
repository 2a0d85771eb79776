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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.icstoolkit.storage.CalendarDAO;
import com.linagora.icstoolkit.storage.exception.CalendarNotFoundException;
import com.linagora.icstoolkit.storage.exception.CalendarPreconditionException;
import com.linagora.icstoolkit.storage.model.CalendarId;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class ShareBundleService {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShareBundleService.class);

    private final CalendarDAO calendarDAO;
    private final BundleSerializer bundleSerializer;
    private final CalendarToolkitConfiguration configuration;

    @Inject
    @Singleton
    public ShareBundleService(CalendarDAO calendarDAO, BundleSerializer bundleSerializer,
                              CalendarToolkitConfiguration configuration) {
        this.calendarDAO = calendarDAO;
        this.bundleSerializer = bundleSerializer;
        this.configuration = configuration;
    }

    public Mono<String> generate(List<CalendarId> calendarIds, boolean removeDuplicates) {
        if (calendarIds.isEmpty()) {
            return Mono.error(new CalendarPreconditionException("A bundle needs at least one calendar"));
        }
        if (calendarIds.size() > configuration.bundleMaxCalendars()) {
            return Mono.error(new CalendarPreconditionException("A bundle holds at most %d calendars, got %d"
                .formatted(configuration.bundleMaxCalendars(), calendarIds.size())));
        }

        return Flux.fromIterable(calendarIds)
            .distinct()
            .concatMap(calendarId -> calendarDAO.find(calendarId)
                .switchIfEmpty(Mono.error(() -> new CalendarNotFoundException(calendarId))))
            .collectList()
            .map(calendars -> bundleSerializer.serialize(calendars, removeDuplicates))
            .doOnNext(bundle -> LOGGER.info("Generated share bundle for calendars {}", calendarIds));
    }
}
