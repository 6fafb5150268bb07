package io.murt;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

import java.io.IOException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

public class ClientUtils {

    public static final OkHttpClient client = new OkHttpClient.Builder()
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .readTimeout(20, TimeUnit.SECONDS)
        .build();

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    public static Request.Builder request() {
        return new Request.Builder();
    }

    public static Request.Builder request(URI uri) {
        return request().url(uri.toString());
    }

    public static Request.Builder postJson(URI uri, String json) {
        return request(uri).post(RequestBody.create(json, JSON));
    }

    public static Response call(Request.Builder request) {
        Request req = request.build();
        try {
            return client.newCall(req).execute();
        } catch (IOException e) {
            throw new RuntimeException("Error while calling " + req, e);
        }
    }
}
