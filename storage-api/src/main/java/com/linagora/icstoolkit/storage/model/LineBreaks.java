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

import java.util.Optional;

import org.apache.commons.lang3.StringUtils;

/**
 * iCalendar TEXT only knows one kind of line break, so CRLF and lone CR are stored as LF.
 */
final class LineBreaks {
    private static final String[] BREAKS = {"\r\n", "\r"};
    private static final String[] LINE_FEEDS = {"\n", "\n"};

    private LineBreaks() {
    }

    static String normalize(String text) {
        return StringUtils.replaceEach(text, BREAKS, LINE_FEEDS);
    }

    static Optional<String> normalize(Optional<String> text) {
        return text.map(LineBreaks::normalize);
    }
}
