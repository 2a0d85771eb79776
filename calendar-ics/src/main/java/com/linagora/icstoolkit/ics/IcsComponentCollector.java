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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.codec.DecoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.fortuna.ical4j.data.ContentHandler;
import net.fortuna.ical4j.model.ParameterCodec;
import net.fortuna.ical4j.util.Strings;

/**
 * Collects the raw component tree of a document from the ical4j parser, leaving value interpretation
 * to {@link TemporalCodec}.
 */
class IcsComponentCollector implements ContentHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(IcsComponentCollector.class);

    private static class Builder {
        private final String name;
        private final List<IcsProperty> properties = new ArrayList<>();
        private final List<IcsComponent> components = new ArrayList<>();

        Builder(String name) {
            this.name = name;
        }

        IcsComponent build() {
            return new IcsComponent(name, properties, components);
        }
    }

    private final Deque<Builder> stack = new ArrayDeque<>();
    private IcsComponent calendar;
    private String propertyName;
    private Map<String, String> parameters;
    private String propertyValue;

    @Override
    public void startCalendar() {
        stack.push(new Builder("VCALENDAR"));
    }

    @Override
    public void endCalendar() {
        calendar = stack.pop().build();
    }

    @Override
    public void startComponent(String name) {
        stack.push(new Builder(name));
    }

    @Override
    public void endComponent(String name) {
        IcsComponent component = stack.pop().build();
        stack.peek().components.add(component);
    }

    @Override
    public void startProperty(String name) {
        propertyName = name;
        parameters = new LinkedHashMap<>();
        propertyValue = null;
    }

    @Override
    public void propertyValue(String value) {
        propertyValue = value;
    }

    @Override
    public void endProperty(String name) {
        stack.peek().properties.add(new IcsProperty(propertyName, parameters, propertyValue));
    }

    @Override
    public void parameter(String name, String value) {
        parameters.put(name.toUpperCase(Locale.ROOT), decodeParameter(value));
    }

    private static String decodeParameter(String value) {
        String unquoted = Strings.unquote(value);
        try {
            return ParameterCodec.INSTANCE.decode(unquoted);
        } catch (DecoderException e) {
            LOGGER.warn("Keeping undecoded parameter value '{}'", unquoted, e);
            return unquoted;
        }
    }

    Optional<IcsComponent> calendar() {
        return Optional.ofNullable(calendar);
    }
}
