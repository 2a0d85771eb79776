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

package com.linagora.icstoolkit.ics;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.linagora.icstoolkit.storage.exception.IcsParseException;
import com.linagora.icstoolkit.storage.model.Event;

import net.fortuna.ical4j.data.CalendarParserFactory;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.data.UnfoldingReader;
import net.fortuna.ical4j.util.CompatibilityHints;

/**
 * Reads an ICS document into events.
 * <p>
 * Tokenizing, unfolding and component nesting are handled by ical4j; every value is then interpreted by
 * {@link TemporalCodec} and the model constructors, so that a single bad property or event never aborts the
 * whole document.
 */
public class IcsCalendarReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsCalendarReader.class);

    public static final String CALENDAR_FIELD = "VCALENDAR";
    private static final int EXCERPT_LENGTH = 64;

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_VALIDATION, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);
    }

    public IcsImportResult read(String icsContent) {
        Preconditions.checkNotNull(icsContent, "icsContent must not be null");

        IcsComponent calendar = parse(icsContent);
        List<String> warnings = new ArrayList<>();
        VEventReader eventReader = new VEventReader(warnings);
        List<Event> events = new ArrayList<>();
        int skipped = 0;
        for (IcsComponent vEvent : calendar.components("VEVENT")) {
            Optional<Event> event = eventReader.read(vEvent);
            if (event.isPresent()) {
                events.add(event.get());
            } else {
                skipped++;
            }
        }

        LOGGER.debug("Read {} events, skipped {}, {} warnings", events.size(), skipped, warnings.size());
        return new IcsImportResult(events, skipped, warnings);
    }

    private IcsComponent parse(String icsContent) {
        IcsComponentCollector collector = new IcsComponentCollector();
        try {
            CalendarParserFactory.getInstance().get()
                .parse(new UnfoldingReader(new StringReader(icsContent)), collector);
        } catch (IOException | ParserException e) {
            throw new IcsParseException(CALENDAR_FIELD, excerpt(icsContent), "unparseable document", e);
        }
        return collector.calendar()
            .orElseThrow(() -> new IcsParseException(CALENDAR_FIELD, excerpt(icsContent), "no VCALENDAR found"));
    }

    private String excerpt(String icsContent) {
        return StringUtils.abbreviate(icsContent, EXCERPT_LENGTH);
    }
}
