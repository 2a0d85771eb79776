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

package com.linagora.icstoolkit.app;

import java.io.FileNotFoundException;
import java.net.URL;
import java.util.Optional;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;

/**
 * Loads {@code <name>.properties} files from the classpath.
 */
public class ClasspathPropertiesProvider {
    private static final String EXTENSION = ".properties";

    private final ClassLoader classLoader;

    public ClasspathPropertiesProvider() {
        this(ClasspathPropertiesProvider.class.getClassLoader());
    }

    public ClasspathPropertiesProvider(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public Configuration getConfiguration(String name) throws FileNotFoundException, ConfigurationException {
        URL resource = Optional.ofNullable(classLoader.getResource(name + EXTENSION))
            .orElseThrow(() -> new FileNotFoundException(name + EXTENSION + " not found on the classpath"));

        PropertiesConfiguration configuration = new PropertiesConfiguration();
        new FileHandler(configuration).load(resource);
        return configuration;
    }
}
