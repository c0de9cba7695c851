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
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for VaultCredentialStore against a real HTTP server (no mocking).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@ExtendWith(VertxExtension.class)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class VaultCredentialStoreTest {

    private HttpServer testServer;
    private int serverPort;
    private AtomicInteger responseStatus;
    private AtomicReference<String> lastQuery;
    private VaultCredentialStore store;

    @BeforeAll
    void setUp(Vertx vertx, VertxTestContext testContext) {
        responseStatus = new AtomicInteger(200);
        lastQuery = new AtomicReference<>();

        Router router = Router.router(vertx);
        router.get("/vault/api/Accounts").handler(ctx -> {
            lastQuery.set(ctx.request().query());
            int status = responseStatus.get();
            if (status != 200) {
                ctx.response().setStatusCode(status).end();
                return;
            }
            ctx.response()
                .putHeader("content-type", "application/json")
                .end(new JsonObject()
                    .put("UserName", "svc-" + ctx.request().getParam("Object"))
                    .put("Content", "vault-secret")
                    .encode());
        });

        vertx.createHttpServer()
            .requestHandler(router)
            .listen(0)
            .onSuccess(server -> {
                testServer = server;
                serverPort = server.actualPort();
                store = new VaultCredentialStore(vertx, "http://localhost:" + serverPort + "/vault/", "vigil", 5000);
                testContext.completeNow();
            })
            .onFailure(testContext::failNow);
    }

    @BeforeEach
    void reset() {
        responseStatus.set(200);
        lastQuery.set(null);
    }

    @AfterAll
    void tearDown(VertxTestContext testContext) {
        if (store != null) {
            store.close();
        }
        if (testServer != null) {
            testServer.close().onComplete(ar -> testContext.completeNow());
        } else {
            testContext.completeNow();
        }
    }

    @Test
    @DisplayName("Should fetch username and password for a vault password credential")
    void testFetchPassword() throws Exception {
        ScanCredential credential = ScanCredential.builder("cs1", CredentialKind.CS_UP)
                .vault("LinuxSafe", "web-01").build();

        AuthData data = store.fetch(credential);

        assertEquals("svc-web-01", data.getOrEmpty(AuthData.USERNAME));
        assertEquals("vault-secret", data.getOrEmpty(AuthData.PASSWORD));
        assertTrue(lastQuery.get().contains("Safe=LinuxSafe"), lastQuery.get());
        assertTrue(lastQuery.get().contains("AppID=vigil"), lastQuery.get());
    }

    @Test
    @DisplayName("Vault key credential should carry the content as private key")
    void testFetchPrivateKey() throws Exception {
        ScanCredential credential = ScanCredential.builder("cs2", CredentialKind.CS_USK)
                .vault("LinuxSafe", "db-01").build();

        AuthData data = store.fetch(credential);

        assertEquals("vault-secret", data.getOrEmpty(AuthData.PRIVATE_KEY));
        assertTrue(data.get(AuthData.PASSWORD).isEmpty());
    }

    @Test
    @DisplayName("HTTP error should become a credential error")
    void testHttpError() {
        responseStatus.set(404);
        ScanCredential credential = ScanCredential.builder("cs3", CredentialKind.CS_UP)
                .vault("LinuxSafe", "missing").build();

        CredentialException error = assertThrows(CredentialException.class, () -> store.fetch(credential));
        assertTrue(error.getMessage().contains("404"), error.getMessage());
    }

    @Test
    @DisplayName("Registry should route vault kinds to the registered vault store")
    void testRegistryRouting() throws Exception {
        CredentialSourceRegistry registry = new CredentialSourceRegistry();
        registry.register(store);

        ScanCredential credential = ScanCredential.builder("cs4", CredentialKind.CS_UP)
                .vault("WinSafe", "dc-01").build();

        assertSame(store, registry.sourceFor(credential));
        assertEquals("svc-dc-01", registry.fetch(credential).getOrEmpty(AuthData.USERNAME));
    }
}
