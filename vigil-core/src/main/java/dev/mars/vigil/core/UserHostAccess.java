package dev.mars.vigil.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


import java.util.Objects;

/**
 * The hosts a user is limited to, either as an allow list or a deny list.
 *
 * @since 1.0
 */
public final class UserHostAccess {

    private final String hosts;
    private final boolean allow;

    public UserHostAccess(String hosts, boolean allow) {
        this.hosts = Objects.requireNonNull(hosts, "hosts");
        this.allow = allow;
    }

    public static UserHostAccess allow(String hosts) {
        return new UserHostAccess(hosts, true);
    }

    public static UserHostAccess deny(String hosts) {
        return new UserHostAccess(hosts, false);
    }

    public String getHosts() {
        return hosts;
    }

    public boolean isAllow() {
        return allow;
    }
}
