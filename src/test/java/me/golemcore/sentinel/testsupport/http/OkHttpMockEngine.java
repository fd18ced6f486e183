package me.golemcore.sentinel.testsupport.http;

import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * OkHttp interceptor that answers from a queue instead of the network and
 * keeps every request it sees.
 */
public final class OkHttpMockEngine implements Interceptor {

    private final ConcurrentLinkedQueue<Planned> planned = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Captured> captured = new ConcurrentLinkedQueue<>();

    public void enqueueJson(int code, String body) {
        planned.add(new Planned(code, body, "application/json", null));
    }

    public void enqueueText(int code, String body) {
        planned.add(new Planned(code, body, "text/plain", null));
    }

    public void enqueueFailure(IOException failure) {
        planned.add(new Planned(0, null, null, failure));
    }

    public Captured takeRequest() {
        return captured.poll();
    }

    public int requestCount() {
        return captured.size();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        captured.add(new Captured(request.method(), request.url().toString(), readBody(request.body()),
                request.body() != null ? request.body().contentType() : null));

        Planned next = planned.poll();
        if (next == null) {
            throw new IOException("No planned response for " + request.method() + " " + request.url());
        }
        if (next.failure() != null) {
            throw next.failure();
        }

        byte[] body = next.body() != null ? next.body().getBytes(StandardCharsets.UTF_8) : new byte[0];
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(next.code())
                .message("mock")
                .body(ResponseBody.create(body, MediaType.parse(next.contentType())))
                .build();
    }

    private String readBody(RequestBody body) throws IOException {
        if (body == null) {
            return "";
        }
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        return buffer.readString(StandardCharsets.UTF_8);
    }

    private record Planned(int code, String body, String contentType, IOException failure) {
    }

    public record Captured(String method, String url, String body, MediaType contentType) {
    }
}
