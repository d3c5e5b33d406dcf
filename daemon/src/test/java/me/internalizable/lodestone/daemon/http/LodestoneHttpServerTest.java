package me.internalizable.lodestone.daemon.http;

import com.fasterxml.jackson.databind.JsonNode;
import me.internalizable.lodestone.api.LodestoneAPI;
import me.internalizable.lodestone.api.error.ErrorKind;
import me.internalizable.lodestone.api.error.LodestoneException;
import me.internalizable.lodestone.api.instance.GameType;
import me.internalizable.lodestone.api.instance.InstanceInfo;
import me.internalizable.lodestone.api.instance.InstanceState;
import me.internalizable.lodestone.api.instance.InstanceUuid;
import me.internalizable.lodestone.daemon.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link LodestoneHttpServer} over a real socket.
 */
@ExtendWith(MockitoExtension.class)
class LodestoneHttpServerTest {

    private static final String TOKEN = "secret";

    @Mock
    private LodestoneAPI api;

    private LodestoneHttpServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new LodestoneHttpServer(api, "127.0.0.1", 0);
        server.start();
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body != null
                ? HttpRequest.BodyPublishers.ofString(body)
                : HttpRequest.BodyPublishers.noBody();
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .header("Authorization", "Bearer " + TOKEN)
                .method(method, publisher)
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws IOException {
        return Jsons.mapper().readTree(response.body());
    }

    @Test
    @DisplayName("lists instances as JSON")
    void listsInstances() throws Exception {
        InstanceUuid uuid = InstanceUuid.of("0c9a77c2-5d4e-4d1b-9a3f-2f5e1c0b7a11");
        InstanceInfo info = new InstanceInfo(uuid, "survival", GameType.MINECRAFT_JAVA_VANILLA, "vanilla", null,
                25565, InstanceState.STOPPED, 1_000L, "/srv/instances/survival-0c9a77c2");
        when(api.listInstances(TOKEN)).thenReturn(List.of(info));

        HttpResponse<String> response = send("GET", "/instance/list", null);

        assertEquals(200, response.statusCode());
        JsonNode first = json(response).get(0);
        assertEquals("minecraft_java_vanilla", first.get("game_type").asText());
        assertEquals("0c9a77c2-5d4e-4d1b-9a3f-2f5e1c0b7a11", first.get("uuid").asText());
        assertEquals("STOPPED", first.get("state").asText());
        assertEquals(1_000L, first.get("creation_time").asLong());
    }

    @Test
    @DisplayName("maps API errors to status codes")
    void mapsErrors() throws Exception {
        when(api.listInstances(TOKEN)).thenThrow(new LodestoneException(ErrorKind.UNAUTHORIZED, "Token error"));

        HttpResponse<String> response = send("GET", "/instance/list", null);

        assertEquals(401, response.statusCode());
        assertEquals("UNAUTHORIZED", json(response).get("kind").asText());
        assertEquals("Token error", json(response).get("detail").asText());
    }

    @Test
    @DisplayName("creates an instance from a JSON manifest")
    @SuppressWarnings("unchecked")
    void createsInstance() throws Exception {
        InstanceUuid uuid = InstanceUuid.generate();
        when(api.createInstance(eq(TOKEN), eq(GameType.MINECRAFT_PAPER), any())).thenReturn(uuid);

        HttpResponse<String> response = send("POST", "/instance/create/minecraft_paper",
                "{\"name\":\"survival\",\"port\":25565}");

        assertEquals(200, response.statusCode());
        assertEquals(uuid.value(), json(response).asText());
        ArgumentCaptor<Map<String, Object>> manifest = ArgumentCaptor.forClass(Map.class);
        verify(api).createInstance(eq(TOKEN), eq(GameType.MINECRAFT_PAPER), manifest.capture());
        assertEquals("survival", manifest.getValue().get("name"));
        assertEquals(25565, manifest.getValue().get("port"));
    }

    @Test
    @DisplayName("malformed manifests and unknown game types are bad requests")
    void rejectsBadCreateRequests() throws Exception {
        assertEquals(400, send("POST", "/instance/create/minecraft_paper", "{not json").statusCode());
        assertEquals(400, send("POST", "/instance/create/terraria", "{}").statusCode());
    }

    @Test
    @DisplayName("rejects an unknown token before parsing the request")
    void authenticatesBeforeParsing() throws Exception {
        doThrow(new LodestoneException(ErrorKind.UNAUTHORIZED, "Token error")).when(api).authenticate(anyString());

        HttpResponse<String> malformed = send("POST", "/instance/create/minecraft_paper", "{not json");
        assertEquals(401, malformed.statusCode());
        assertEquals("UNAUTHORIZED", json(malformed).get("kind").asText());
        assertEquals(401, send("POST", "/instance/create/terraria", "{}").statusCode());
        assertEquals(401, send("GET", "/instance/not-a-uuid/info", null).statusCode());

        verify(api, never()).createInstance(anyString(), any(), any());
    }

    @Test
    @DisplayName("reads files as plain text")
    void readsFiles() throws Exception {
        InstanceUuid uuid = InstanceUuid.generate();
        when(api.readInstanceFile(TOKEN, uuid, "config/server.properties")).thenReturn("motd=hi\n");

        HttpResponse<String> response = send("GET",
                "/instance/" + uuid.value() + "/fs/read/config/server.properties", null);

        assertEquals(200, response.statusCode());
        assertEquals("motd=hi\n", response.body());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
    }

    @Test
    @DisplayName("writes the raw request body")
    void writesFiles() throws Exception {
        InstanceUuid uuid = InstanceUuid.generate();

        HttpResponse<String> response = send("PUT", "/instance/" + uuid.value() + "/fs/write/notes.txt", "hello");

        assertEquals(200, response.statusCode());
        assertTrue(json(response).isNull());
        verify(api).writeInstanceFile(TOKEN, uuid, "notes.txt", "hello".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("listing without a path lists the root")
    void listsRoot() throws Exception {
        InstanceUuid uuid = InstanceUuid.generate();
        when(api.listInstanceFiles(TOKEN, uuid, "")).thenReturn(List.of());

        HttpResponse<String> response = send("GET", "/instance/" + uuid.value() + "/fs/ls", null);

        assertEquals(200, response.statusCode());
        assertTrue(json(response).isArray());
        assertEquals(0, json(response).size());
    }

    @Test
    @DisplayName("protected files and malformed paths keep their kinds")
    void protectedAndMalformed() throws Exception {
        InstanceUuid uuid = InstanceUuid.generate();
        doThrow(new LodestoneException(ErrorKind.PROTECTED_RESOURCE, "Cannot modify protected file"))
                .when(api).removeInstanceFile(TOKEN, uuid, "server.jar");
        doThrow(new LodestoneException(ErrorKind.MALFORMED_PATH, "Path segment contains ':'"))
                .when(api).makeInstanceDirectory(anyString(), any(), eq("bad:name"));

        HttpResponse<String> protectedResponse = send("DELETE",
                "/instance/" + uuid.value() + "/fs/rm/server.jar", null);
        assertEquals(403, protectedResponse.statusCode());
        assertEquals("PROTECTED_RESOURCE", json(protectedResponse).get("kind").asText());

        HttpResponse<String> malformed = send("PUT", "/instance/" + uuid.value() + "/fs/mkdir/bad:name", null);
        assertEquals(400, malformed.statusCode());
        assertEquals("MALFORMED_PATH", json(malformed).get("kind").asText());
    }

    @Test
    @DisplayName("unknown routes and wrong methods are rejected")
    void rejectsUnknownRoutes() throws Exception {
        assertEquals(404, send("GET", "/nothing/here", null).statusCode());
        assertEquals(405, send("POST", "/instance/list", null).statusCode());
    }

    @Test
    @DisplayName("unexpected failures become internal errors")
    void internalErrors() throws Exception {
        when(api.listInstances(TOKEN)).thenThrow(new IllegalStateException("boom"));

        HttpResponse<String> response = send("GET", "/instance/list", null);

        assertEquals(500, response.statusCode());
        assertFalse(response.body().contains("boom"));
    }

    @Test
    @DisplayName("status mapping covers every kind")
    void statusMapping() {
        assertEquals(403, LodestoneHttpServer.statusOf(ErrorKind.FORBIDDEN));
        assertEquals(404, LodestoneHttpServer.statusOf(ErrorKind.NOT_FOUND));
        assertEquals(500, LodestoneHttpServer.statusOf(ErrorKind.IO_FAILURE));
    }
}
