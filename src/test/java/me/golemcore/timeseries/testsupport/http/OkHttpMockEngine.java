package me.golemcore.timeseries.testsupport.http;

import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory upstream for fetcher tests.
 * <p>
 * Installed as an application interceptor it never touches the network.
 * Tests enqueue responses or transport failures in order, and every request is
 * captured for assertions.
 */
public final class OkHttpMockEngine implements Interceptor {

    private static final String DEFAULT_CONTENT_TYPE = "application/json";

    private final ConcurrentLinkedQueue<PlannedResult> plannedResults = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<CapturedRequest> capturedRequests = new ConcurrentLinkedQueue<>();
    private final AtomicInteger requestCount = new AtomicInteger();

    public OkHttpClient client() {
        return new OkHttpClient.Builder()
                .addInterceptor(this)
                .build();
    }

    public void enqueueJson(int code, String body) {
        plannedResults.add(PlannedResult.response(code, body != null ? body : ""));
    }

    public void enqueueFailure(IOException failure) {
        plannedResults.add(PlannedResult.failure(failure));
    }

    public CapturedRequest takeRequest() {
        return capturedRequests.poll();
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        capturedRequests.add(new CapturedRequest(request));
        requestCount.incrementAndGet();

        PlannedResult plannedResult = plannedResults.poll();
        if (plannedResult == null) {
            throw new IOException("No planned response for request: " + request.method() + " " + request.url());
        }
        if (plannedResult.failure() != null) {
            throw plannedResult.failure();
        }

        ResponseBody responseBody = ResponseBody.create(
                plannedResult.body().getBytes(StandardCharsets.UTF_8),
                MediaType.parse(DEFAULT_CONTENT_TYPE));

        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(plannedResult.code())
                .message("mock")
                .headers(Headers.of())
                .body(responseBody)
                .build();
    }

    private record PlannedResult(int code, String body, IOException failure) {
        static PlannedResult response(int code, String body) {
            return new PlannedResult(code, body, null);
        }

        static PlannedResult failure(IOException failure) {
            return new PlannedResult(0, "", failure);
        }
    }

    public static final class CapturedRequest {
        private final Request request;

        private CapturedRequest(Request request) {
            this.request = request;
        }

        public String method() {
            return request.method();
        }

        public HttpUrl url() {
            return request.url();
        }

        public String queryParameter(String name) {
            return request.url().queryParameter(name);
        }

        public Headers headers() {
            return request.headers();
        }
    }
}
