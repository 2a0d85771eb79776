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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.linagora.icstoolkit.storage.exception.IcsParseException;
import com.linagora.icstoolkit.storage.model.AlarmTrigger;
import com.linagora.icstoolkit.storage.model.DurationUnit;
import com.linagora.icstoolkit.storage.model.IcsDuration;
import com.linagora.icstoolkit.storage.model.IcsInstant;
import com.linagora.icstoolkit.storage.model.InstantKind;

/**
 * RFC 5545 DATE, DATE-TIME and DURATION values.
 * <p>
 * Parsing is strict: every field is range checked and nothing is clamped or rolled over. Formatting is the
 * exact inverse of parsing for valid input.
 */
public final class TemporalCodec {
    private static final int DATE_LENGTH = 8;
    private static final int FLOATING_LENGTH = 15;
    private static final int UTC_LENGTH = 16;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("uuuuMMdd'T'HHmmss");

    private static final Pattern DURATION_PATTERN = Pattern.compile(
        "([+-]?)P(?:(\\d+)W)?(?:(\\d+)D)?(?:T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?");

    private TemporalCodec() {
    }

    public static IcsInstant parseInstant(String field, String text) {
        if (text == null) {
            throw new IcsParseException(field, null, "missing value");
        }
        switch (text.length()) {
            case DATE_LENGTH:
                requireDigits(field, text, 0, DATE_LENGTH);
                return IcsInstant.date(parseDate(field, text));
            case FLOATING_LENGTH:
                return IcsInstant.floating(parseDateTime(field, text));
            case UTC_LENGTH:
                if (text.charAt(UTC_LENGTH - 1) != 'Z') {
                    throw new IcsParseException(field, text, "expected a trailing 'Z'");
                }
                return IcsInstant.utc(parseDateTime(field, text));
            default:
                throw new IcsParseException(field, text, "expected YYYYMMDD, YYYYMMDDTHHMMSS or YYYYMMDDTHHMMSSZ");
        }
    }

    public static String formatInstant(IcsInstant instant) {
        switch (instant.kind()) {
            case DATE_ONLY:
                return DATE_FORMAT.format(instant.toLocalDate());
            case UTC:
                return DATE_TIME_FORMAT.format(instant.dateTime()) + "Z";
            case FLOATING:
            default:
                return DATE_TIME_FORMAT.format(instant.dateTime());
        }
    }

    /**
     * Parses a comma separated RDATE / EXDATE value list.
     */
    public static List<IcsInstant> parseDateList(String field, String text) {
        if (StringUtils.isBlank(text)) {
            throw new IcsParseException(field, text, "empty date list");
        }
        return Arrays.stream(text.split(",", -1))
            .map(String::trim)
            .map(value -> parseInstant(field, value))
            .collect(ImmutableList.toImmutableList());
    }

    /**
     * Multi-component durations are normalized to their finest populated unit, so that {@code P1DT2H}
     * becomes 26 hours. Weeks become days.
     */
    public static IcsDuration parseDuration(String field, String text) {
        if (text == null) {
            throw new IcsParseException(field, null, "missing value");
        }
        Matcher matcher = DURATION_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IcsParseException(field, text, "not an RFC 5545 duration");
        }
        if (text.endsWith("T")) {
            throw new IcsParseException(field, text, "time designator without any time component");
        }
        boolean negative = "-".equals(matcher.group(1));
        String weeks = matcher.group(2);
        String days = matcher.group(3);
        String hours = matcher.group(4);
        String minutes = matcher.group(5);
        String seconds = matcher.group(6);
        if (weeks == null && days == null && hours == null && minutes == null && seconds == null) {
            throw new IcsParseException(field, text, "no duration component");
        }

        DurationUnit unit = finestUnit(days != null || weeks != null, hours != null, minutes != null, seconds != null);
        try {
            long total = 0;
            total = Math.addExact(total, toUnit(component(weeks), 7 * DurationUnit.DAYS.seconds(), unit));
            total = Math.addExact(total, toUnit(component(days), DurationUnit.DAYS.seconds(), unit));
            total = Math.addExact(total, toUnit(component(hours), DurationUnit.HOURS.seconds(), unit));
            total = Math.addExact(total, toUnit(component(minutes), DurationUnit.MINUTES.seconds(), unit));
            total = Math.addExact(total, toUnit(component(seconds), DurationUnit.SECONDS.seconds(), unit));
            return new IcsDuration(total, unit, negative);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IcsParseException(field, text, "duration out of range", e);
        }
    }

    public static String formatDuration(IcsDuration duration) {
        return (duration.negative() ? "-" : "") + formatDuration(duration.value(), duration.unit());
    }

    public static String formatDuration(long value, DurationUnit unit) {
        if (unit == DurationUnit.DAYS) {
            return "P" + value + unit.designator();
        }
        return "PT" + value + unit.designator();
    }

    /**
     * A TRIGGER value is either a signed duration relative to the event start, or an absolute UTC date-time.
     */
    public static AlarmTrigger parseTrigger(String field, String text) {
        if (StringUtils.isEmpty(text)) {
            throw new IcsParseException(field, text, "missing value");
        }
        if (Character.isDigit(text.charAt(0))) {
            IcsInstant instant = parseInstant(field, text);
            if (instant.kind() != InstantKind.UTC) {
                throw new IcsParseException(field, text, "absolute triggers must be UTC date-times");
            }
            return AlarmTrigger.absolute(instant);
        }
        return AlarmTrigger.relative(parseDuration(field, text));
    }

    public static String formatTrigger(AlarmTrigger trigger) {
        return trigger.relative()
            .map(TemporalCodec::formatDuration)
            .orElseGet(() -> formatInstant(trigger.absolute().get()));
    }

    private static LocalDate parseDate(String field, String text) {
        int year = Integer.parseInt(text.substring(0, 4));
        int month = Integer.parseInt(text.substring(4, 6));
        int day = Integer.parseInt(text.substring(6, 8));
        checkRange(field, text, "month", month, 1, 12);
        checkRange(field, text, "day", day, 1, 31);
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new IcsParseException(field, text, "no such date", e);
        }
    }

    private static LocalDateTime parseDateTime(String field, String text) {
        requireDigits(field, text, 0, DATE_LENGTH);
        if (text.charAt(DATE_LENGTH) != 'T') {
            throw new IcsParseException(field, text, "expected a 'T' time separator");
        }
        requireDigits(field, text, DATE_LENGTH + 1, FLOATING_LENGTH);
        LocalDate date = parseDate(field, text);
        int hour = Integer.parseInt(text.substring(9, 11));
        int minute = Integer.parseInt(text.substring(11, 13));
        int second = Integer.parseInt(text.substring(13, 15));
        checkRange(field, text, "hour", hour, 0, 23);
        checkRange(field, text, "minute", minute, 0, 59);
        checkRange(field, text, "second", second, 0, 59);
        return date.atTime(hour, minute, second);
    }

    private static void requireDigits(String field, String text, int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new IcsParseException(field, text, "unexpected character '" + c + "' at position " + i);
            }
        }
    }

    private static void checkRange(String field, String text, String component, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IcsParseException(field, text,
                String.format("%s %d is outside [%d, %d]", component, value, min, max));
        }
    }

    private static DurationUnit finestUnit(boolean hasDays, boolean hasHours, boolean hasMinutes, boolean hasSeconds) {
        if (hasSeconds) {
            return DurationUnit.SECONDS;
        }
        if (hasMinutes) {
            return DurationUnit.MINUTES;
        }
        if (hasHours) {
            return DurationUnit.HOURS;
        }
        return DurationUnit.DAYS;
    }

    private static long component(String digits) {
        if (digits == null) {
            return 0;
        }
        return Long.parseLong(digits);
    }

    private static long toUnit(long value, long secondsPerComponent, DurationUnit unit) {
        return Math.multiplyExact(value, secondsPerComponent / unit.seconds());
    }
}
