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
import java.io.UncheckedIOException;
import java.io.Writer;
import java.net.URI;
import java.util.List;

import com.linagora.icstoolkit.storage.model.Alarm;
import com.linagora.icstoolkit.storage.model.Attendee;
import com.linagora.icstoolkit.storage.model.Event;
import com.linagora.icstoolkit.storage.model.IcsInstant;
import com.linagora.icstoolkit.storage.model.Organizer;

import net.fortuna.ical4j.data.FoldingWriter;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.ParameterList;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.TextList;
import net.fortuna.ical4j.model.component.VAlarm;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.parameter.Cn;
import net.fortuna.ical4j.model.parameter.PartStat;
import net.fortuna.ical4j.model.parameter.Role;
import net.fortuna.ical4j.model.parameter.Rsvp;
import net.fortuna.ical4j.model.parameter.Value;
import net.fortuna.ical4j.model.property.Action;
import net.fortuna.ical4j.model.property.CalScale;
import net.fortuna.ical4j.model.property.Categories;
import net.fortuna.ical4j.model.property.Clazz;
import net.fortuna.ical4j.model.property.Description;
import net.fortuna.ical4j.model.property.Location;
import net.fortuna.ical4j.model.property.Method;
import net.fortuna.ical4j.model.property.Priority;
import net.fortuna.ical4j.model.property.ProdId;
import net.fortuna.ical4j.model.property.RRule;
import net.fortuna.ical4j.model.property.Repeat;
import net.fortuna.ical4j.model.property.Resources;
import net.fortuna.ical4j.model.property.Sequence;
import net.fortuna.ical4j.model.property.Status;
import net.fortuna.ical4j.model.property.Summary;
import net.fortuna.ical4j.model.property.Transp;
import net.fortuna.ical4j.model.property.Uid;
import net.fortuna.ical4j.model.property.Version;
import net.fortuna.ical4j.model.property.XProperty;

/**
 * Renders events as ical4j components and writes them out folded at 75 characters, with CRLF line
 * endings. Date, date-time, duration and trigger values are carried exactly as {@link TemporalCodec}
 * formats them; TEXT escaping and parameter encoding are left to ical4j.
 */
public class IcsCalendarWriter {
    public static final int FOLD_LENGTH = 75;
    public static final String CALENDAR_NAME = "X-WR-CALNAME";
    public static final String PUBLISH = "PUBLISH";
    public static final String GREGORIAN = "GREGORIAN";

    private static final String MAILTO = "mailto:";

    private final FoldingWriter out;

    public IcsCalendarWriter(Writer writer) {
        this.out = new FoldingWriter(writer, FOLD_LENGTH);
    }

    /**
     * Writes a PUBLISH calendar holding the given events, all stamped with {@code dtStamp}.
     */
    public void publish(String prodId, String calendarName, List<Event> events, IcsInstant dtStamp) {
        Calendar calendar = new Calendar();
        calendar.add(new Version(new ParameterList(List.of()), Version.VALUE_2_0));
        calendar.add(new ProdId(prodId));
        calendar.add(new CalScale(GREGORIAN));
        calendar.add(new Method(PUBLISH));
        calendar.add(new XProperty(CALENDAR_NAME, calendarName));
        events.forEach(event -> calendar.add(vEvent(event, dtStamp)));
        write(calendar);
    }

    public void write(Calendar calendar) {
        char[] chars = calendar.toString().toCharArray();
        try {
            out.write(chars, 0, chars.length);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Error while writing calendar", e);
        }
    }

    /**
     * Maps an event onto a VEVENT. Optional properties are only added when present.
     */
    public static VEvent vEvent(Event event, IcsInstant dtStamp) {
        VEvent vEvent = new VEvent(false);
        vEvent.add(new Uid(event.uid().value()));
        vEvent.add(temporal("DTSTAMP", dtStamp));
        vEvent.add(temporal("DTSTART", event.start()));
        vEvent.add(temporal("DTEND", event.end()));
        vEvent.add(new Summary(event.title()));
        vEvent.add(new Sequence(event.sequence()));
        event.description().ifPresent(description -> vEvent.add(new Description(description)));
        event.location().ifPresent(location -> vEvent.add(new Location(location)));
        event.status().ifPresent(status -> vEvent.add(new Status(status.name())));
        event.classification().ifPresent(classification -> vEvent.add(new Clazz(classification.name())));
        event.transparency().ifPresent(transparency -> vEvent.add(new Transp(transparency.name())));
        event.priority().ifPresent(priority -> vEvent.add(new Priority(priority)));
        event.organizer().ifPresent(organizer -> vEvent.add(organizer(organizer)));
        event.attendees().forEach(attendee -> vEvent.add(attendee(attendee)));
        if (!event.categories().isEmpty()) {
            vEvent.add(new Categories(new TextList(event.categories().toArray(new String[0]))));
        }
        if (!event.resources().isEmpty()) {
            vEvent.add(new Resources(event.resources()));
        }
        event.rrule().ifPresent(rrule -> vEvent.add(new RRule(rrule)));
        event.rdates().forEach(date -> vEvent.add(temporal("RDATE", date)));
        event.exdates().forEach(date -> vEvent.add(temporal("EXDATE", date)));
        event.recurrenceId().ifPresent(recurrenceId -> vEvent.add(temporal("RECURRENCE-ID", recurrenceId)));
        event.alarms().forEach(alarm -> vEvent.add(vAlarm(alarm)));
        return vEvent;
    }

    private static Property temporal(String name, IcsInstant instant) {
        if (instant.isDateOnly()) {
            return new XProperty(name, new ParameterList(List.of(Value.DATE)), TemporalCodec.formatInstant(instant));
        }
        return new XProperty(name, TemporalCodec.formatInstant(instant));
    }

    private static net.fortuna.ical4j.model.property.Organizer organizer(Organizer organizer) {
        net.fortuna.ical4j.model.property.Organizer property =
            new net.fortuna.ical4j.model.property.Organizer(URI.create(MAILTO + organizer.email()));
        organizer.name().ifPresent(name -> property.add(new Cn(name)));
        return property;
    }

    private static net.fortuna.ical4j.model.property.Attendee attendee(Attendee attendee) {
        net.fortuna.ical4j.model.property.Attendee property =
            new net.fortuna.ical4j.model.property.Attendee(URI.create(MAILTO + attendee.email()));
        attendee.name().ifPresent(name -> property.add(new Cn(name)));
        attendee.role().ifPresent(role -> property.add(new Role(role)));
        attendee.participationStatus().ifPresent(status -> property.add(new PartStat(status)));
        if (attendee.rsvp()) {
            property.add(Rsvp.TRUE);
        }
        return property;
    }

    private static VAlarm vAlarm(Alarm alarm) {
        VAlarm vAlarm = new VAlarm();
        if (alarm.trigger().isRelative()) {
            vAlarm.add(new XProperty("TRIGGER", TemporalCodec.formatTrigger(alarm.trigger())));
        } else {
            vAlarm.add(new XProperty("TRIGGER", new ParameterList(List.of(Value.DATE_TIME)),
                TemporalCodec.formatTrigger(alarm.trigger())));
        }
        vAlarm.add(new Action(alarm.action()));
        alarm.summary().ifPresent(summary -> vAlarm.add(new Summary(summary)));
        alarm.description().ifPresent(description -> vAlarm.add(new Description(description)));
        alarm.repeatInterval().ifPresent(interval ->
            vAlarm.add(new XProperty("DURATION", TemporalCodec.formatDuration(interval))));
        alarm.repeat().ifPresent(repeat -> vAlarm.add(new Repeat(repeat)));
        return vAlarm;
    }
}
