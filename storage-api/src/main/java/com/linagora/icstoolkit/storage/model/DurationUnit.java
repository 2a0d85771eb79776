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

public enum DurationUnit {
    SECONDS(1, 'S'),
    MINUTES(60, 'M'),
    HOURS(3600, 'H'),
    DAYS(86400, 'D');

    private final long seconds;
    private final char designator;

    DurationUnit(long seconds, char designator) {
        this.seconds = seconds;
        this.designator = designator;
    }

    public long seconds() {
        return seconds;
    }

    public char designator() {
        return designator;
    }
}
