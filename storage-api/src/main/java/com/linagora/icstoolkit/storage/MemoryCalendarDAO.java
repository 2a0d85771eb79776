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

package com.linagora.icstoolkit.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.linagora.icstoolkit.storage.model.CalendarId;
import com.linagora.icstoolkit.storage.model.CalendarRecord;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryCalendarDAO implements CalendarDAO {

    @Inject
    @Singleton
    public MemoryCalendarDAO() {
    }

    private final Map<CalendarId, CalendarRecord> store = new ConcurrentHashMap<>();

    @Override
    public Mono<CalendarRecord> find(CalendarId calendarId) {
        return Mono.fromCallable(() -> store.get(calendarId));
    }

    @Override
    public Mono<Void> save(CalendarRecord calendar) {
        return Mono.fromRunnable(() -> store.put(calendar.id(), calendar));
    }

    @Override
    public Mono<Void> delete(CalendarId calendarId) {
        return Mono.fromRunnable(() -> store.remove(calendarId));
    }

    @Override
    public Flux<CalendarRecord> list() {
        return Flux.defer(() -> Flux.fromIterable(store.values()));
    }
}
