package dev.mars.vigil.credential;

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


import java.util.Locale;

/**
 * Storage kind of a credential. Vault-backed kinds keep their secret in an external
 * credential vault and present themselves to the scanner as their base type.
 *
 * @since 1.0
 */
public enum CredentialKind {
    UP("up", false),
    USK("usk", false),
    SNMP("snmp", false),
    KRB5("krb5", false),
    CS_UP("cs_up", true),
    CS_USK("cs_usk", true);

    private final String code;
    private final boolean vaultBacked;

    CredentialKind(String code, boolean vaultBacked) {
        this.code = code;
        this.vaultBacked = vaultBacked;
    }

    public String getCode() {
        return code;
    }

    public boolean isVaultBacked() {
        return vaultBacked;
    }

    /**
     * The type the scanner sees: {@code cs_up} is sent as {@code up}, {@code cs_usk} as
     * {@code usk}.
     */
    public CredentialKind getBaseType() {
        switch (this) {
            case CS_UP:
                return UP;
            case CS_USK:
                return USK;
            default:
                return this;
        }
    }

    public static CredentialKind fromCode(String code) {
        for (CredentialKind kind : values()) {
            if (kind.code.equals(code.toLowerCase(Locale.ROOT))) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown credential type: " + code);
    }
}
