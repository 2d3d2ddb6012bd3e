package com.mimecast.wren.lists;

import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidatorException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for UriListSource.
 * <p>HTTP sources are served by MockWebServer, file sources from a temporary directory.
 */
class UriListSourceTest {

    private MockWebServer mockWebServer;
    private UriListSource source;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        mockWebServer = new MockWebServer();
        mockWebServer.start();
        source = new UriListSource();
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    void fetchHttp() throws Exception {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("[\"mailinator.com\", \"guerrillamail.com\"]"));

        List<String> domains = source.fetch(mockWebServer.url("/domains.json").toString());

        assertEquals(List.of("mailinator.com", "guerrillamail.com"), domains);
        RecordedRequest request = mockWebServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/domains.json", request.getPath());
    }

    @Test
    void fetchHttpNotFound() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(404));

        ValidatorException e = assertThrows(ValidatorException.class,
                () -> source.fetch(mockWebServer.url("/missing.json").toString()));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
        assertTrue(e.getMessage().contains("404"));
    }

    @Test
    void fetchHttpMalformed() {
        mockWebServer.enqueue(new MockResponse()
                .setResponseCode(200)
                .setBody("{\"domains\": [\"a.com\"]}"));

        ValidatorException e = assertThrows(ValidatorException.class,
                () -> source.fetch(mockWebServer.url("/domains.json").toString()));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
        assertTrue(e.getMessage().startsWith("Malformed JSON list"));
    }

    @Test
    void fetchHttpEmptyBody() {
        mockWebServer.enqueue(new MockResponse().setResponseCode(200).setBody(""));

        ValidatorException e = assertThrows(ValidatorException.class,
                () -> source.fetch(mockWebServer.url("/domains.json").toString()));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
    }

    @Test
    void fetchFile() throws Exception {
        Path file = tempDir.resolve("free.json");
        Files.writeString(file, "[\"gmail.com\", \"yahoo.com\", \"proton.me\"]");

        List<String> domains = source.fetch("file://" + file.toAbsolutePath());

        assertEquals(List.of("gmail.com", "yahoo.com", "proton.me"), domains);
    }

    @Test
    void fetchFileMissing() {
        Path file = tempDir.resolve("missing.json");

        ValidatorException e = assertThrows(ValidatorException.class,
                () -> source.fetch("file://" + file.toAbsolutePath()));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
    }

    @Test
    void fetchUnsupportedScheme() {
        ValidatorException e = assertThrows(ValidatorException.class,
                () -> source.fetch("ftp://lists.example.org/domains.json"));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
        assertTrue(e.getMessage().contains("ftp"));
    }

    @Test
    void fetchNoScheme() {
        ValidatorException e = assertThrows(ValidatorException.class, () -> source.fetch("domains.json"));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
    }

    @Test
    void fetchBlank() {
        ValidatorException e = assertThrows(ValidatorException.class, () -> source.fetch(" "));
        assertEquals(ErrorKind.LIST_LOAD_FAILURE, e.getKind());
    }
}
