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


import dev.mars.vigil.core.exceptions.CredentialException;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Credentials kept in an external credential vault and fetched over HTTP.
 *
 * <p>Issues {@code GET <base-url>/api/Accounts?AppID=<app>&Safe=<vault-id>&Object=<host-id>}
 * and reads {@code UserName} and {@code Content} from the JSON answer. {@code Content} is
 * the password for {@code cs_up} credentials and the private key for {@code cs_usk}.</p>
 *
 * <p>{@link #fetch} blocks the calling thread and must not be called on an event loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class VaultCredentialStore implements CredentialSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VaultCredentialStore.class);

    private final WebClient webClient;
    private final String baseUrl;
    private final String appId;
    private final long timeoutMs;

    public VaultCredentialStore(Vertx vertx, String baseUrl, String appId, long timeoutMs) {
        Objects.requireNonNull(vertx, "vertx");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.appId = appId == null ? "" : appId;
        this.timeoutMs = timeoutMs;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
                .setConnectTimeout((int) Math.min(timeoutMs, Integer.MAX_VALUE)));
    }

    @Override
    public Set<CredentialKind> getSupportedKinds() {
        return EnumSet.of(CredentialKind.CS_UP, CredentialKind.CS_USK);
    }

    @Override
    public AuthData fetch(ScanCredential credential) throws CredentialException {
        if (credential.getVaultId() == null || credential.getHostIdentifier() == null) {
            throw new CredentialException(credential.getId(), "Vault id or host identifier is missing");
        }

        Future<HttpResponse<Buffer>> request = webClient.getAbs(baseUrl + "/api/Accounts")
                .addQueryParam("AppID", appId)
                .addQueryParam("Safe", credential.getVaultId())
                .addQueryParam("Object", credential.getHostIdentifier())
                .putHeader("Accept", "application/json")
                .timeout(timeoutMs)
                .send();

        HttpResponse<Buffer> response;
        try {
            response = request.toCompletionStage().toCompletableFuture()
                    .get(timeoutMs + 1000, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CredentialException(credential.getId(), "Interrupted while querying the vault", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new CredentialException(credential.getId(),
                    "Vault request failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new CredentialException(credential.getId(), "Vault did not answer within " + timeoutMs + "ms", e);
        }

        if (response.statusCode() != 200) {
            throw new CredentialException(credential.getId(),
                    "Vault answered HTTP " + response.statusCode());
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException e) {
            throw new CredentialException(credential.getId(), "Vault answer is not valid JSON", e);
        }
        if (body == null || body.getString("UserName") == null || body.getString("Content") == null) {
            throw new CredentialException(credential.getId(), "Vault answer lacks UserName or Content");
        }
        logger.debug("Fetched credential {} from vault {}", credential.getId(), credential.getVaultId());

        AuthData.Builder data = AuthData.builder().field(AuthData.USERNAME, body.getString("UserName"));
        if (credential.getKind() == CredentialKind.CS_USK) {
            data.field(AuthData.PRIVATE_KEY, body.getString("Content"));
        } else {
            data.field(AuthData.PASSWORD, body.getString("Content"));
        }
        return data.build();
    }

    @Override
    public void close() {
        webClient.close();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
