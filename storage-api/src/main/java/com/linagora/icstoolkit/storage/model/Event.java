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

package com.linagora.icstoolkit.storage.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.linagora.icstoolkit.storage.exception.EventValidationException;

/**
 * A VEVENT. Immutable: edits go through {@link #revise(UnaryOperator)}, which bumps the SEQUENCE, while
 * import, merge and deduplication only ever copy or drop events.
 */
public record Event(EventUid uid,
                    String title,
                    IcsInstant start,
                    IcsInstant end,
                    Optional<String> description,
                    Optional<String> location,
                    Optional<EventStatus> status,
                    Optional<EventClass> classification,
                    Optional<Transparency> transparency,
                    Optional<Integer> priority,
                    Optional<Organizer> organizer,
                    List<Attendee> attendees,
                    List<Alarm> alarms,
                    List<String> categories,
                    List<String> resources,
                    Optional<String> rrule,
                    Set<RecurrenceDate> recurrenceDates,
                    Optional<IcsInstant> recurrenceId,
                    int sequence) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 9;

    public static class Builder {
        private EventUid uid;
        private String title;
        private IcsInstant start;
        private IcsInstant end;
        private Optional<String> description = Optional.empty();
        private Optional<String> location = Optional.empty();
        private Optional<EventStatus> status = Optional.empty();
        private Optional<EventClass> classification = Optional.empty();
        private Optional<Transparency> transparency = Optional.empty();
        private Optional<Integer> priority = Optional.empty();
        private Optional<Organizer> organizer = Optional.empty();
        private final List<Attendee> attendees = new ArrayList<>();
        private final List<Alarm> alarms = new ArrayList<>();
        private final List<String> categories = new ArrayList<>();
        private final List<String> resources = new ArrayList<>();
        private Optional<String> rrule = Optional.empty();
        private final Set<RecurrenceDate> recurrenceDates = new LinkedHashSet<>();
        private Optional<IcsInstant> recurrenceId = Optional.empty();
        private int sequence = 0;

        private Builder() {
        }

        public Builder uid(EventUid uid) {
            this.uid = uid;
            return this;
        }

        public Builder uid(String uid) {
            return uid(new EventUid(uid));
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder start(IcsInstant start) {
            this.start = start;
            return this;
        }

        public Builder end(IcsInstant end) {
            this.end = end;
            return this;
        }

        public Builder description(String description) {
            this.description = Optional.ofNullable(description);
            return this;
        }

        public Builder location(String location) {
            this.location = Optional.ofNullable(location);
            return this;
        }

        public Builder status(EventStatus status) {
            this.status = Optional.ofNullable(status);
            return this;
        }

        public Builder classification(EventClass classification) {
            this.classification = Optional.ofNullable(classification);
            return this;
        }

        public Builder transparency(Transparency transparency) {
            this.transparency = Optional.ofNullable(transparency);
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = Optional.ofNullable(priority);
            return this;
        }

        public Builder organizer(Organizer organizer) {
            this.organizer = Optional.ofNullable(organizer);
            return this;
        }

        public Builder attendee(Attendee attendee) {
            this.attendees.add(attendee);
            return this;
        }

        public Builder attendees(Collection<Attendee> attendees) {
            this.attendees.clear();
            this.attendees.addAll(attendees);
            return this;
        }

        public Builder alarm(Alarm alarm) {
            this.alarms.add(alarm);
            return this;
        }

        public Builder alarms(Collection<Alarm> alarms) {
            this.alarms.clear();
            this.alarms.addAll(alarms);
            return this;
        }

        public Builder categories(Collection<String> categories) {
            this.categories.clear();
            this.categories.addAll(categories);
            return this;
        }

        public Builder resources(Collection<String> resources) {
            this.resources.clear();
            this.resources.addAll(resources);
            return this;
        }

        public Builder rrule(String rrule) {
            this.rrule = Optional.ofNullable(rrule);
            return this;
        }

        public Builder recurrenceDate(RecurrenceDate recurrenceDate) {
            this.recurrenceDates.add(recurrenceDate);
            return this;
        }

        public Builder recurrenceDates(Collection<RecurrenceDate> recurrenceDates) {
            this.recurrenceDates.clear();
            this.recurrenceDates.addAll(recurrenceDates);
            return this;
        }

        public Builder recurrenceId(IcsInstant recurrenceId) {
            this.recurrenceId = Optional.ofNullable(recurrenceId);
            return this;
        }

        public Builder sequence(int sequence) {
            this.sequence = sequence;
            return this;
        }

        public Event build() {
            return new Event(Optional.ofNullable(uid).orElseGet(EventUid::generate),
                title, start, end,
                description, location, status, classification, transparency, priority, organizer,
                attendees, alarms, categories, resources,
                rrule, recurrenceDates, recurrenceId, sequence);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Event {
        Preconditions.checkNotNull(uid, "uid must not be null");
        if (StringUtils.isBlank(title)) {
            throw new EventValidationException("Event title must not be blank");
        }
        if (start == null) {
            throw new EventValidationException("Event '" + title + "' has no start");
        }
        if (end == null) {
            throw new EventValidationException("Event '" + title + "' has no end");
        }
        if (!start.isComparableWith(end)) {
            throw new EventValidationException(String.format("Event '%s' mixes a %s start with a %s end",
                title, start.kind(), end.kind()));
        }
        if (end.isBefore(start)) {
            throw new EventValidationException("Event '" + title + "' ends before it starts");
        }
        if (priority.filter(value -> value < MIN_PRIORITY || value > MAX_PRIORITY).isPresent()) {
            throw new EventValidationException(String.format("Event '%s' priority %d is outside [%d, %d]",
                title, priority.get(), MIN_PRIORITY, MAX_PRIORITY));
        }
        if (sequence < 0) {
            throw new EventValidationException("Event '" + title + "' has a negative sequence");
        }

        title = LineBreaks.normalize(title);
        description = LineBreaks.normalize(description);
        location = LineBreaks.normalize(location);
        attendees = ImmutableList.copyOf(attendees);
        alarms = ImmutableList.copyOf(alarms);
        categories = ImmutableList.copyOf(categories);
        resources = ImmutableList.copyOf(resources);
        recurrenceDates = ImmutableSet.copyOf(recurrenceDates);
    }

    public Builder toBuilder() {
        return builder()
            .uid(uid)
            .title(title)
            .start(start)
            .end(end)
            .description(description.orElse(null))
            .location(location.orElse(null))
            .status(status.orElse(null))
            .classification(classification.orElse(null))
            .transparency(transparency.orElse(null))
            .priority(priority.orElse(null))
            .organizer(organizer.orElse(null))
            .attendees(attendees)
            .alarms(alarms)
            .categories(categories)
            .resources(resources)
            .rrule(rrule.orElse(null))
            .recurrenceDates(recurrenceDates)
            .recurrenceId(recurrenceId.orElse(null))
            .sequence(sequence);
    }

    /**
     * Applies a user edit. The revision counter always moves forward by one, whatever the edit sets.
     */
    public Event revise(UnaryOperator<Builder> edit) {
        return edit.apply(toBuilder())
            .uid(uid)
            .sequence(sequence + 1)
            .build();
    }

    public boolean isAllDay() {
        return start.isDateOnly();
    }

    public List<IcsInstant> rdates() {
        return recurrenceDates.stream()
            .filter(recurrenceDate -> recurrenceDate.type() == RecurrenceType.RDATE)
            .map(RecurrenceDate::date)
            .collect(ImmutableList.toImmutableList());
    }

    public List<IcsInstant> exdates() {
        return recurrenceDates.stream()
            .filter(recurrenceDate -> recurrenceDate.type() == RecurrenceType.EXDATE)
            .map(RecurrenceDate::date)
            .collect(ImmutableList.toImmutableList());
    }

    public String toShortString() {
        return MoreObjects.toStringHelper(this)
            .add("uid", uid.value())
            .add("title", title)
            .add("start", start)
            .add("end", end)
            .toString();
    }
}
