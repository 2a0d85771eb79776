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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.google.common.collect.ImmutableList;

public record IcsComponent(String name, List<IcsProperty> properties, List<IcsComponent> components) {

    public IcsComponent {
        name = name.toUpperCase(Locale.ROOT);
        properties = ImmutableList.copyOf(properties);
        components = ImmutableList.copyOf(components);
    }

    public Optional<IcsProperty> property(String propertyName) {
        return properties.stream()
            .filter(property -> property.name().equalsIgnoreCase(propertyName))
            .findFirst();
    }

    public List<IcsProperty> properties(String propertyName) {
        return properties.stream()
            .filter(property -> property.name().equalsIgnoreCase(propertyName))
            .collect(ImmutableList.toImmutableList());
    }

    public List<IcsComponent> components(String componentName) {
        return components.stream()
            .filter(component -> component.name().equalsIgnoreCase(componentName))
            .collect(ImmutableList.toImmutableList());
    }
}
