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

import java.time.Duration;

import com.google.common.base.Preconditions;

/**
 * A duration expressed in a single unit, as written by the producer of the ICS data.
 * <p>
 * The unit is kept so that {@code PT60M} serializes back as {@code PT60M} rather than {@code PT1H}.
 * Use {@link #isEquivalentTo(IcsDuration)} or {@link #compareTo(IcsDuration)} for semantic comparison:
 * the record equality is textual.
 */
public record IcsDuration(long value, DurationUnit unit, boolean negative) implements Comparable<IcsDuration> {
    public static final boolean NEGATIVE = true;
    public static final boolean POSITIVE = false;

    public static IcsDuration of(long value, DurationUnit unit) {
        return new IcsDuration(value, unit, POSITIVE);
    }

    public static IcsDuration negative(long value, DurationUnit unit) {
        return new IcsDuration(value, unit, NEGATIVE);
    }

    public IcsDuration {
        Preconditions.checkArgument(value >= 0, "duration magnitude must not be negative, sign is carried separately");
        Preconditions.checkNotNull(unit, "unit must not be null");
    }

    public long toSeconds() {
        long magnitude = Math.multiplyExact(value, unit.seconds());
        return negative ? -magnitude : magnitude;
    }

    public Duration toDuration() {
        return Duration.ofSeconds(toSeconds());
    }

    public boolean isEquivalentTo(IcsDuration other) {
        return toSeconds() == other.toSeconds();
    }

    public IcsDuration abs() {
        return new IcsDuration(value, unit, POSITIVE);
    }

    @Override
    public int compareTo(IcsDuration other) {
        return Long.compare(toSeconds(), other.toSeconds());
    }
}
