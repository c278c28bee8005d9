package org.rapidrelief.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.rapidrelief.engine.api.dto.AllocationCommitDto;
import org.rapidrelief.engine.api.dto.ResourceCandidateDto;
import org.rapidrelief.engine.api.dto.ResourceListDto;
import org.rapidrelief.engine.domain.exception.ResourceCatalogException;
import org.rapidrelief.engine.domain.model.Area;
import org.rapidrelief.engine.domain.model.GeoPoint;
import org.rapidrelief.engine.domain.model.ResourceCandidate;
import org.rapidrelief.engine.domain.model.ResourceStatus;
import retrofit2.Call;
import retrofit2.Response;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;
import retrofit2.http.Body;
import retrofit2.http.GET;
import retrofit2.http.POST;
import retrofit2.http.Query;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Retrofit-based implementation of ResourceCatalog.
 */
public final class ApiResourceCatalog implements ResourceCatalog {

    private static final Logger LOG = Logger.getLogger(ApiResourceCatalog.class.getName());

    private final ResourceApiService api;

    public ApiResourceCatalog(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");

        String normalizedUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(normalizedUrl)
                .addConverterFactory(JacksonConverterFactory.create(new ObjectMapper()))
                .client(client)
                .build();

        this.api = retrofit.create(ResourceApiService.class);
    }

    @Override
    public List<ResourceCandidate> query(Set<String> capabilities, Area area, int maxResults) {
        Objects.requireNonNull(capabilities, "capabilities must not be null");
        Objects.requireNonNull(area, "area must not be null");
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be at least 1");
        }
        ResourceListDto response = execute(api.findCandidates(
                String.join(",", capabilities),
                area.getCenter().getLatitude(),
                area.getCenter().getLongitude(),
                area.getRadiusKm(),
                maxResults), "GET /v1/resources/candidates");
        if (response.isTruncated()) {
            LOG.warning(() -> "Catalog truncated the candidate list at max_results=" + maxResults);
        }
        List<ResourceCandidate> candidates = toDomain(response);
        LOG.info(() -> String.format("Catalog returned %d candidates for %d capabilities within %.1f km",
                candidates.size(), capabilities.size(), area.getRadiusKm()));
        return candidates;
    }

    @Override
    public List<ResourceCandidate> findByIds(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids must not be null");
        if (ids.isEmpty()) {
            return List.of();
        }
        ResourceListDto response = execute(api.findByIds(String.join(",", new LinkedHashSet<>(ids))),
                "GET /v1/resources");
        return toDomain(response);
    }

    @Override
    public void markCommitted(String runId, String solutionId, List<String> resourceIds) {
        AllocationCommitDto request = new AllocationCommitDto(runId, solutionId, resourceIds);
        executeVoid(api.commitAllocation(request), "POST /v1/allocations");
        LOG.info(() -> String.format("Marked %d resources as committed for run %s", resourceIds.size(), runId));
    }

    private static List<ResourceCandidate> toDomain(ResourceListDto response) {
        List<ResourceCandidate> candidates = new ArrayList<>();
        if (response.getResources() == null) {
            return candidates;
        }
        for (ResourceCandidateDto dto : response.getResources()) {
            try {
                candidates.add(toDomain(dto));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new ResourceCatalogException("Malformed resource " + dto.getId() + ": " + e.getMessage(), e);
            }
        }
        return candidates;
    }

    /**
     * ETA and hazard feed hard rules directly, so an entry without them is malformed
     * rather than read as zero.
     */
    static ResourceCandidate toDomain(ResourceCandidateDto dto) {
        if (dto.getEtaMinutes() == null) {
            throw new IllegalArgumentException("eta_minutes is missing");
        }
        if (dto.getHazardLevel() == null) {
            throw new IllegalArgumentException("hazard_level is missing");
        }
        GeoPoint location = dto.getLocation() != null
                ? new GeoPoint(dto.getLocation().getLatitude(), dto.getLocation().getLongitude())
                : null;
        return new ResourceCandidate.Builder()
                .id(dto.getId())
                .name(dto.getName())
                .resourceType(dto.getResourceType())
                .capabilities(dto.getCapabilities() != null ? new LinkedHashSet<>(dto.getCapabilities()) : Set.of())
                .availablePersonnel(dto.getAvailablePersonnel())
                .rescueCapacity(dto.getRescueCapacity())
                .location(location)
                .status(ResourceStatus.fromCode(dto.getStatus()))
                .etaMinutes(dto.getEtaMinutes())
                .deploymentCost(dto.getDeploymentCost())
                .hazardLevel(dto.getHazardLevel())
                .build();
    }

    /**
     * Execute a Retrofit call and return the body; any failure becomes a ResourceCatalogException.
     */
    private <T> T execute(Call<T> call, String description) {
        Response<T> response;
        try {
            response = call.execute();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            throw new ResourceCatalogException(description + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            throw new ResourceCatalogException(String.format("%s failed: %d %s",
                    description, response.code(), response.message()));
        }
        T body = response.body();
        if (body == null) {
            throw new ResourceCatalogException(description + " returned an empty body");
        }
        return body;
    }

    private void executeVoid(Call<Void> call, String description) {
        Response<Void> response;
        try {
            response = call.execute();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "[API] " + description + " error", e);
            throw new ResourceCatalogException(description + " failed: " + e.getMessage(), e);
        }
        if (!response.isSuccessful()) {
            LOG.warning(() -> String.format("[API] %s failed: %d %s",
                    description, response.code(), response.message()));
            throw new ResourceCatalogException(String.format("%s failed: %d %s",
                    description, response.code(), response.message()));
        }
    }

    /**
     * Retrofit service interface for the resource API.
     */
    interface ResourceApiService {
        @GET("v1/resources/candidates")
        Call<ResourceListDto> findCandidates(@Query("capabilities") String capabilities,
                                             @Query("lat") double latitude,
                                             @Query("lon") double longitude,
                                             @Query("radius_km") double radiusKm,
                                             @Query("max_results") int maxResults);

        @GET("v1/resources")
        Call<ResourceListDto> findByIds(@Query("ids") String ids);

        @POST("v1/allocations")
        Call<Void> commitAllocation(@Body AllocationCommitDto request);
    }
}
