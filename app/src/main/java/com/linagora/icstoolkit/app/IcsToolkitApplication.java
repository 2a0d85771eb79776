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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.linagora.icstoolkit.app.modules.IcsToolkitModule;
import com.linagora.icstoolkit.storage.MemoryStorageModule;

public class IcsToolkitApplication {
    public static final List<Module> MODULES = ImmutableList.of(
        new MemoryStorageModule(),
        new IcsToolkitModule());

    public static Injector createInjector(Module... overrides) {
        return Guice.createInjector(Modules.override(MODULES).with(overrides));
    }

    private IcsToolkitApplication() {
    }
}
