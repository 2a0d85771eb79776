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

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import net.fortuna.ical4j.util.Strings;

/**
 * A content line as read from the wire: upper-cased name, unquoted parameters, raw (still escaped) value.
 */
public record IcsProperty(String name, Map<String, String> parameters, String value) {

    public IcsProperty {
        name = name.toUpperCase(Locale.ROOT);
        parameters = ImmutableMap.copyOf(parameters);
        value = value == null ? "" : value;
    }

    public Optional<String> parameter(String parameterName) {
        return Optional.ofNullable(parameters.get(parameterName.toUpperCase(Locale.ROOT)));
    }

    public String text() {
        return Strings.unescape(value);
    }
}
