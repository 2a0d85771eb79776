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

import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linagora.icstoolkit.storage.exception.EventValidationException;
import com.linagora.icstoolkit.storage.exception.IcsParseException;
import com.linagora.icstoolkit.storage.model.Alarm;
import com.linagora.icstoolkit.storage.model.AlarmTrigger;
import com.linagora.icstoolkit.storage.model.Attendee;
import com.linagora.icstoolkit.storage.model.DurationUnit;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.EventClass;
import com.linagora.icstoolkit.storage.model.EventStatus;
import com.linagora.icstoolkit.storage.model.IcsDuration;
import com.linagora.icstoolkit.storage.model.IcsInstant;
import com.linagora.icstoolkit.storage.model.Organizer;
import com.linagora.icstoolkit.storage.model.RecurrenceDate;
import com.linagora.icstoolkit.storage.model.Transparency;

import net.fortuna.ical4j.model.property.RRule;
import net.fortuna.ical4j.util.Strings;

/**
 * Maps one VEVENT onto an {@link Event}. Broken optional properties are dropped with a warning; broken
 * timing makes the whole event unusable.
 */
class VEventReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(VEventReader.class);

    static final String UNTITLED_EVENT = "Untitled Event";
    private static final String MAILTO = "mailto:";
    // one list item: escaped characters or anything but a backslash or a comma
    private static final Pattern LIST_ITEM = Pattern.compile("(?:\\\\.|[^\\\\,])+");

    private final List<String> warnings;

    VEventReader(List<String> warnings) {
        this.warnings = warnings;
    }

    Optional<Event> read(IcsComponent vEvent) {
        String label = vEvent.property("UID").map(IcsProperty::value).orElse("<no uid>");
        try {
            return Optional.of(buildEvent(vEvent));
        } catch (IcsParseException | EventValidationException e) {
            LOGGER.warn("Skipping event {}: {}", label, e.getMessage());
            warnings.add("Skipped event " + label + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    private Event buildEvent(IcsComponent vEvent) {
        IcsInstant start = vEvent.property("DTSTART")
            .map(property -> TemporalCodec.parseInstant("DTSTART", property.value()))
            .orElseThrow(() -> new EventValidationException("Event has no DTSTART"));

        Event.Builder builder = Event.builder()
            .title(vEvent.property("SUMMARY")
                .map(IcsProperty::text)
                .filter(StringUtils::isNotBlank)
                .orElse(UNTITLED_EVENT))
            .start(start)
            .end(readEnd(vEvent, start));

        vEvent.property("UID")
            .map(IcsProperty::value)
            .filter(StringUtils::isNotBlank)
            .ifPresent(builder::uid);
        vEvent.property("DESCRIPTION").map(IcsProperty::text).ifPresent(builder::description);
        vEvent.property("LOCATION").map(IcsProperty::text).ifPresent(builder::location);

        optional(vEvent, "STATUS", value -> EventStatus.parse(value)
            .orElseThrow(() -> new IcsParseException("STATUS", value, "unknown status")))
            .ifPresent(builder::status);
        optional(vEvent, "CLASS", value -> EventClass.parse(value)
            .orElseThrow(() -> new IcsParseException("CLASS", value, "unknown classification")))
            .ifPresent(builder::classification);
        optional(vEvent, "TRANSP", value -> Transparency.parse(value)
            .orElseThrow(() -> new IcsParseException("TRANSP", value, "unknown transparency")))
            .ifPresent(builder::transparency);
        optional(vEvent, "PRIORITY", value -> parseInteger("PRIORITY", value, Event.MIN_PRIORITY, Event.MAX_PRIORITY))
            .ifPresent(builder::priority);
        optional(vEvent, "SEQUENCE", value -> parseInteger("SEQUENCE", value, 0, Integer.MAX_VALUE))
            .ifPresent(builder::sequence);
        optional(vEvent, "RRULE", VEventReader::parseRecurrenceRule)
            .ifPresent(builder::rrule);
        optional(vEvent, "RECURRENCE-ID", value -> TemporalCodec.parseInstant("RECURRENCE-ID", value))
            .ifPresent(builder::recurrenceId);

        vEvent.property("ORGANIZER")
            .flatMap(property -> readOrganizer(property))
            .ifPresent(builder::organizer);
        vEvent.properties("ATTENDEE").stream()
            .map(this::readAttendee)
            .flatMap(Optional::stream)
            .forEach(builder::attendee);

        List<String> categories = new ArrayList<>();
        vEvent.properties("CATEGORIES").forEach(property -> categories.addAll(readList(property)));
        builder.categories(categories);
        List<String> resources = new ArrayList<>();
        vEvent.properties("RESOURCES").forEach(property -> resources.addAll(readList(property)));
        builder.resources(resources);

        vEvent.properties("RDATE").forEach(property -> readDateList(property)
            .forEach(date -> builder.recurrenceDate(RecurrenceDate.rdate(date))));
        vEvent.properties("EXDATE").forEach(property -> readDateList(property)
            .forEach(date -> builder.recurrenceDate(RecurrenceDate.exdate(date))));

        vEvent.components("VALARM").stream()
            .map(this::readAlarm)
            .flatMap(Optional::stream)
            .forEach(builder::alarm);

        return builder.build();
    }

    private IcsInstant readEnd(IcsComponent vEvent, IcsInstant start) {
        Optional<IcsProperty> dtEnd = vEvent.property("DTEND");
        if (dtEnd.isPresent()) {
            return TemporalCodec.parseInstant("DTEND", dtEnd.get().value());
        }
        Optional<IcsProperty> duration = vEvent.property("DURATION");
        if (duration.isPresent()) {
            return start.plus(TemporalCodec.parseDuration("DURATION", duration.get().value()));
        }
        if (start.isDateOnly()) {
            return start.plus(IcsDuration.of(1, DurationUnit.DAYS));
        }
        return start;
    }

    private <T> Optional<T> optional(IcsComponent vEvent, String propertyName, Function<String, T> parser) {
        return vEvent.property(propertyName)
            .flatMap(property -> {
                try {
                    return Optional.of(parser.apply(property.value().trim()));
                } catch (IcsParseException e) {
                    dropped(propertyName, e.getMessage());
                    return Optional.empty();
                }
            });
    }

    private List<IcsInstant> readDateList(IcsProperty property) {
        if (property.parameter("VALUE").filter("PERIOD"::equalsIgnoreCase).isPresent()) {
            dropped(property.name(), "PERIOD values are not supported");
            return List.of();
        }
        try {
            return TemporalCodec.parseDateList(property.name(), property.value());
        } catch (IcsParseException e) {
            dropped(property.name(), e.getMessage());
            return List.of();
        }
    }

    private Optional<Organizer> readOrganizer(IcsProperty property) {
        return readEmail(property)
            .map(email -> new Organizer(property.parameter("CN"), email));
    }

    private Optional<Attendee> readAttendee(IcsProperty property) {
        return readEmail(property)
            .map(email -> new Attendee(property.parameter("CN"),
                email,
                property.parameter("ROLE"),
                property.parameter("PARTSTAT"),
                property.parameter("RSVP").filter("TRUE"::equalsIgnoreCase).isPresent()));
    }

    private Optional<String> readEmail(IcsProperty property) {
        String value = property.value().trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(MAILTO)) {
            value = value.substring(MAILTO.length());
        }
        if (StringUtils.isBlank(value)) {
            dropped(property.name(), "missing address");
            return Optional.empty();
        }
        return Optional.of(value);
    }

    private Optional<Alarm> readAlarm(IcsComponent vAlarm) {
        try {
            AlarmTrigger trigger = vAlarm.property("TRIGGER")
                .map(property -> TemporalCodec.parseTrigger("TRIGGER", property.value()))
                .orElseThrow(() -> new IcsParseException("TRIGGER", null, "missing value"));
            String action = vAlarm.property("ACTION")
                .map(IcsProperty::value)
                .filter(StringUtils::isNotBlank)
                .orElse(Alarm.DISPLAY);
            Optional<IcsDuration> repeatInterval = vAlarm.property("DURATION")
                .map(property -> TemporalCodec.parseDuration("DURATION", property.value()));
            Optional<Integer> repeat = vAlarm.property("REPEAT")
                .map(property -> parseInteger("REPEAT", property.value().trim(), 0, Integer.MAX_VALUE));
            return Optional.of(new Alarm(trigger, action,
                vAlarm.property("SUMMARY").map(IcsProperty::text),
                vAlarm.property("DESCRIPTION").map(IcsProperty::text),
                repeatInterval, repeat));
        } catch (IcsParseException e) {
            dropped("VALARM", e.getMessage());
            return Optional.empty();
        }
    }

    private static List<String> readList(IcsProperty property) {
        List<String> values = new ArrayList<>();
        Matcher matcher = LIST_ITEM.matcher(property.value());
        while (matcher.find()) {
            String value = Strings.unescape(matcher.group());
            if (StringUtils.isNotBlank(value)) {
                values.add(value);
            }
        }
        return values;
    }

    /**
     * Validates the rule with ical4j and returns it in ical4j's canonical part order.
     */
    private static String parseRecurrenceRule(String value) {
        try {
            return new RRule(value).getValue();
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new IcsParseException("RRULE", value, "invalid recurrence rule", e);
        }
    }

    private static int parseInteger(String field, String value, int min, int max) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < min || parsed > max) {
                throw new IcsParseException(field, value, String.format("outside [%d, %d]", min, max));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IcsParseException(field, value, "not an integer", e);
        }
    }

    private void dropped(String propertyName, String reason) {
        LOGGER.debug("Dropping {}: {}", propertyName, reason);
        warnings.add("Dropped " + propertyName + ": " + reason);
    }
}
