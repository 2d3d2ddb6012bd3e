package com.mimecast.wren.lists;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.mimecast.wren.error.ErrorKind;
import com.mimecast.wren.error.ValidatorException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * URI list source.
 * <p>Reads a JSON array of domain strings from a {@code file://} path or an {@code http(s)://} URL.
 * <p>For files everything after {@code file://} is taken as the path, so relative paths work.
 * <p>HTTP bodies are decoded as a stream. Non 2xx responses are failures.
 *
 * <p>Example list:
 * <pre>
 * ["mailinator.com", "yopmail.com", "temp-mail.org"]
 * </pre>
 */
public class UriListSource implements ListSource {
    private static final Logger log = LogManager.getLogger(UriListSource.class);
    private static final Type LIST_TYPE = new TypeToken<List<String>>() {}.getType();
    private static final int DEFAULT_TIMEOUT = 30;

    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Constructs a new UriListSource instance with default HTTP timeouts.
     */
    public UriListSource() {
        this(new OkHttpClient.Builder()
                .connectTimeout(DEFAULT_TIMEOUT, TimeUnit.SECONDS)
                .readTimeout(DEFAULT_TIMEOUT, TimeUnit.SECONDS)
                .build());
    }

    /**
     * Constructs a new UriListSource instance with given HTTP client.
     *
     * @param httpClient OkHttpClient instance.
     */
    public UriListSource(OkHttpClient httpClient) {
        this.httpClient = httpClient;
        this.gson = new Gson();
    }

    @Override
    public List<String> fetch(String uri) throws ValidatorException {
        if (StringUtils.isBlank(uri)) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "List URI is required");
        }

        String scheme;
        try {
            scheme = new URI(uri).getScheme();
        } catch (URISyntaxException e) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Invalid list URI: " + uri, e);
        }

        if (scheme == null) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "List URI has no scheme: " + uri);
        }

        List<String> domains;
        switch (scheme.toLowerCase(Locale.ROOT)) {
            case "file":
                domains = fetchFile(uri);
                break;
            case "http":
            case "https":
                domains = fetchHttp(uri);
                break;
            default:
                throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Unsupported list URI scheme: " + scheme);
        }

        log.debug("Fetched {} domains from {}", domains.size(), uri);
        return domains;
    }

    /**
     * Reads list from local file.
     *
     * @param uri File URI string.
     * @return List of domains.
     * @throws ValidatorException Unable to read or decode.
     */
    private List<String> fetchFile(String uri) throws ValidatorException {
        String path = uri.startsWith("file://") ? uri.substring("file://".length()) : uri.substring("file:".length());
        try (Reader reader = Files.newBufferedReader(Paths.get(path), StandardCharsets.UTF_8)) {
            return decode(reader, uri);
        } catch (IOException | InvalidPathException e) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Unable to read list file: " + path, e);
        }
    }

    /**
     * Fetches list over HTTP.
     *
     * @param uri URL string.
     * @return List of domains.
     * @throws ValidatorException Unable to fetch or decode.
     */
    private List<String> fetchHttp(String uri) throws ValidatorException {
        Request request;
        try {
            request = new Request.Builder().url(uri).get().build();
        } catch (IllegalArgumentException e) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Invalid list URL: " + uri, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE,
                        "List source returned HTTP " + response.code() + ": " + uri);
            }

            ResponseBody body = response.body();
            if (body == null) {
                throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "List source returned no body: " + uri);
            }

            return decode(body.charStream(), uri);
        } catch (IOException e) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Unable to fetch list: " + uri, e);
        }
    }

    /**
     * Decodes a JSON array of strings.
     *
     * @param in  Reader instance.
     * @param uri Source URI for messages.
     * @return List of domains.
     * @throws ValidatorException Malformed or empty JSON.
     */
    private List<String> decode(Reader in, String uri) throws ValidatorException {
        List<String> domains;
        try {
            domains = gson.fromJson(new JsonReader(in), LIST_TYPE);
        } catch (JsonParseException e) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Malformed JSON list: " + uri, e);
        }

        if (domains == null) {
            throw new ValidatorException(ErrorKind.LIST_LOAD_FAILURE, "Empty list source: " + uri);
        }

        return domains;
    }
}
