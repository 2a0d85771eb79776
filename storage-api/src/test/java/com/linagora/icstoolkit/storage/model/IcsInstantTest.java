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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

class IcsInstantTest {

    @Test
    void dateShouldBeTruncatedToMidnight() {
        IcsInstant instant = new IcsInstant(InstantKind.DATE_ONLY, LocalDateTime.of(2024, 1, 15, 14, 30));

        assertThat(instant.dateTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 0, 0));
    }

    @Test
    void dateTimeShouldBeTruncatedToSeconds() {
        IcsInstant instant = IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 14, 30, 5, 999_000_000));

        assertThat(instant.dateTime()).isEqualTo(LocalDateTime.of(2024, 1, 15, 14, 30, 5));
    }

    @Test
    void utcAndFloatingShouldNotBeComparable() {
        IcsInstant utc = IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 14, 0));
        IcsInstant floating = IcsInstant.floating(LocalDateTime.of(2024, 1, 15, 14, 0));

        assertThat(utc.isComparableWith(floating)).isFalse();
        assertThatThrownBy(() -> utc.compareTo(floating))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dateShouldBeComparableWithAnyKind() {
        IcsInstant date = IcsInstant.date(LocalDate.of(2024, 1, 15));

        assertThat(date.isBefore(IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 0, 1)))).isTrue();
        assertThat(date.isAfter(IcsInstant.floating(LocalDateTime.of(2024, 1, 14, 23, 59)))).isTrue();
    }

    @Test
    void plusDaysShouldKeepDate() {
        IcsInstant date = IcsInstant.date(LocalDate.of(2024, 1, 31));

        assertThat(date.plus(IcsDuration.of(1, DurationUnit.DAYS)))
            .isEqualTo(IcsInstant.date(LocalDate.of(2024, 2, 1)));
    }

    @Test
    void plusHoursShouldTurnDateIntoFloating() {
        IcsInstant date = IcsInstant.date(LocalDate.of(2024, 1, 15));

        assertThat(date.plus(IcsDuration.of(2, DurationUnit.HOURS)))
            .isEqualTo(IcsInstant.floating(LocalDateTime.of(2024, 1, 15, 2, 0)));
    }

    @Test
    void plusShouldHonourNegativeDurations() {
        IcsInstant utc = IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 14, 0));

        assertThat(utc.plus(IcsDuration.negative(15, DurationUnit.MINUTES)))
            .isEqualTo(IcsInstant.utc(LocalDateTime.of(2024, 1, 15, 13, 45)));
    }
}
