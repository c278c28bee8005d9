package org.rapidrelief.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.POST;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Posts committed-plan events to the platform API. Delivery is best effort: failures are logged.
 */
public final class ApiNotificationSink implements NotificationSink {

    private static final Logger LOG = Logger.getLogger(ApiNotificationSink.class.getName());

    private final NotificationApiService api;

    public ApiNotificationSink(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(mapper))
                .client(client)
                .build();

        this.api = retrofit.create(NotificationApiService.class);
    }

    @Override
    public void planCommitted(PlanCommittedEvent event) {
        String description = "POST /v1/notifications/plans";
        try {
            Response<Void> response = api.publish(event).execute();
            if (!response.isSuccessful()) {
                LOG.warning(() -> String.format("[API] %s failed for run %s: %d %s",
                        description, event.getRunId(), response.code(), response.message()));
                return;
            }
            LOG.fine(() -> "Published committed plan " + event.getRunId());
        } catch (Exception e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
        }
    }

    /**
     * Retrofit service interface for plan notifications.
     */
    interface NotificationApiService {
        @POST("v1/notifications/plans")
        Call<Void> publish(@Body PlanCommittedEvent event);
    }
}
