package org.apirepository.tests.base;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.apirepository.model.ApiEndpointConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static com.github.tomakehurst.wiremock.client.WireMock.*;

/**
 * Base class for tests against a WireMock server returning static JSON files.
 *
 * Tests verify:
 * 1. The repository forms the expected HTTP requests (using WireMock.verify())
 * 2. Pages are parsed and traversed in order
 * 3. Faults surface the way each operation promises
 */
public abstract class BaseTest {

    protected static WireMockServer wireMockServer;

    /**
     * Returns the test resource directory name (e.g., "RestApiRepositoryTest")
     */
    protected abstract String getTestResourceDirectory();

    @BeforeEach
    public void setupWireMock() {
        if (wireMockServer == null) {
            wireMockServer = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
            wireMockServer.start();
        }
        configureFor("localhost", wireMockServer.port());
        wireMockServer.resetAll();
    }

    @AfterAll
    public static void tearDownWiremock() {
        if (wireMockServer != null) {
            wireMockServer.stop();
            wireMockServer = null;
        }
    }

    protected String baseUrl() {
        return "http://localhost:" + wireMockServer.port();
    }

    /**
     * Endpoint paging /users by offset and limit, records under $.data.
     */
    protected ApiEndpointConfig usersEndpoint(int pageSize, int maxPageSize) {
        ApiEndpointConfig config = new ApiEndpointConfig();
        config.setAddresses(baseUrl());
        config.setUrlTemplate("/users?offset=${offset}&limit=${limit}");
        config.setItemsPath("$.data");
        config.setPageSize(pageSize);
        config.setMaxPageSize(maxPageSize);
        return config;
    }

    /**
     * Stubs GET /users?offset=..&limit=.. with a static JSON file.
     */
    protected void stubPage(int offset, int limit, String responseFile) throws IOException {
        stubGet("/users?offset=" + offset + "&limit=" + limit, responseFile);
    }

    protected void stubPageStatus(int offset, int limit, int status) {
        wireMockServer.stubFor(get(urlEqualTo("/users?offset=" + offset + "&limit=" + limit))
                .willReturn(aResponse().withStatus(status)));
    }

    /**
     * Stubs GET of an exact URL (path and query) with a static JSON file.
     */
    protected void stubGet(String url, String responseFile) throws IOException {
        wireMockServer.stubFor(get(urlEqualTo(url))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(loadStaticResponse(responseFile))));
    }

    protected int countPageRequests() {
        return wireMockServer.findAll(getRequestedFor(urlPathEqualTo("/users"))).size();
    }

    /**
     * Load static response file from test resources
     */
    protected String loadStaticResponse(String responseFile) throws IOException {
        Path responsePath = Paths.get("src", "test", "resources", "rest",
                getTestResourceDirectory(), "responses", responseFile);

        if (!Files.exists(responsePath)) {
            throw new IOException("Static response file not found: " + responsePath.toAbsolutePath());
        }

        return Files.readString(responsePath);
    }
}
