package at.sv.energy.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URL;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Slf4j
public class HttpResourceProviderImpl implements HttpResourceProvider {

    public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final RequestBody EMPTY_BODY = RequestBody.create(new byte[0]);

    private final OkHttpClient httpClient;
    private final boolean ownsHttpClient;
    private final ObjectMapper mapper;

    /**
     * Creates a provider with its own http client, which is shut down on {@link #close()}. The client has no connect,
     * read or write timeouts of its own, each call is only bounded by the timeout passed in.
     */
    public HttpResourceProviderImpl() {
        this(new OkHttpClient.Builder()
                     .connectTimeout(Duration.ZERO)
                     .readTimeout(Duration.ZERO)
                     .writeTimeout(Duration.ZERO)
                     .build(), true);
    }

    /**
     * Creates a provider using an externally owned client. The client is never closed by this provider.
     */
    public HttpResourceProviderImpl(OkHttpClient httpClient) {
        this(httpClient, false);
    }

    private HttpResourceProviderImpl(OkHttpClient httpClient, boolean ownsHttpClient) {
        this.httpClient = httpClient;
        this.ownsHttpClient = ownsHttpClient;
        mapper = new ObjectMapper();
    }

    @Override
    public RawResult getResource(URL url, Duration timeout) {
        log.debug("Get: {}", url);
        return performCall(getRequest(url), timeout);
    }

    @Override
    public RawResult putResource(URL url, String body, Duration timeout) {
        log.debug("Put: {}", url);
        log.trace("Put body: {}", getTruncatedBody(body));
        return performCall(putRequest(url, body), timeout);
    }

    @Override
    public RawResult deleteResource(URL url, String body, Duration timeout) {
        log.debug("Delete: {}", url);
        log.trace("Delete body: {}", getTruncatedBody(body));
        return performCall(deleteRequest(url, body), timeout);
    }

    @Override
    public void close() {
        if (!ownsHttpClient) {
            return;
        }
        log.debug("Closing http client");
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    OkHttpClient getHttpClient() {
        return httpClient;
    }

    private static String getTruncatedBody(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 150 ? body.substring(0, 150) + "..." : body;
    }

    private static Request getRequest(URL url) {
        return new Request.Builder()
                .url(url)
                .build();
    }

    private static Request putRequest(URL url, String json) {
        return new Request.Builder()
                .url(url)
                .put(createBody(json))
                .build();
    }

    private static Request deleteRequest(URL url, String json) {
        return new Request.Builder()
                .url(url)
                .delete(createBody(json))
                .build();
    }

    private static RequestBody createBody(String json) {
        if (json == null) {
            return EMPTY_BODY;
        }
        return RequestBody.create(json, JSON);
    }

    private RawResult performCall(Request request, Duration timeout) {
        Call call = httpClient.newCall(request);
        call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try (Response response = call.execute()) {
            String body = getBody(response);
            log.trace("{} {}: {}", response.code(), request.url(), getTruncatedBody(body));
            assertSuccessful(response, body);
            return decode(response, body);
        } catch (InterruptedIOException e) {
            call.cancel();
            log.debug("Timeout after {} ms for '{} {}'", timeout.toMillis(), request.method(), request.url());
            throw new DeviceTimeoutFailure("Timeout occurred while connecting to the device: '" + request.method() +
                                           " " + request.url() + "'", e);
        } catch (IOException e) {
            log.debug("Failed '{} {}': {}", request.method(), request.url(), e.toString());
            throw new DeviceConnectionFailure("Error occurred while communicating with the device: '" +
                                              request.method() + " " + request.url() + "'", e);
        }
    }

    private static void assertSuccessful(Response response, String body) {
        if (response.code() == 403) {
            throw new ApiDisabledFailure();
        }
        if (response.code() != 200) {
            throw new UnexpectedStatusFailure(response.code(), getTruncatedBody(body));
        }
    }

    private RawResult decode(Response response, String body) throws JsonProcessingException {
        if (isJson(response)) {
            return RawResult.json(mapper.readTree(body));
        }
        return RawResult.text(body);
    }

    private static boolean isJson(Response response) {
        String contentType = response.header("Content-Type", "");
        return contentType.toLowerCase(Locale.ROOT).contains("application/json");
    }

    private static String getBody(Response response) throws IOException {
        return response.body().string();
    }
}
