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

package com.linagora.icstoolkit.storage.exception;

/**
 * Malformed ICS value. Scoped to a single property: callers drop the property, or the event owning it,
 * and keep going.
 */
public class IcsParseException extends RuntimeException {
    private final String fieldName;
    private final String rawText;

    public IcsParseException(String fieldName, String rawText, String reason) {
        super(String.format("Invalid %s value '%s': %s", fieldName, rawText, reason));
        this.fieldName = fieldName;
        this.rawText = rawText;
    }

    public IcsParseException(String fieldName, String rawText, String reason, Throwable cause) {
        super(String.format("Invalid %s value '%s': %s", fieldName, rawText, reason), cause);
        this.fieldName = fieldName;
        this.rawText = rawText;
    }

    public String fieldName() {
        return fieldName;
    }

    public String rawText() {
        return rawText;
    }
}
