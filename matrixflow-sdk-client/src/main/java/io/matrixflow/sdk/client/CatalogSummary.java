package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the catalog listing, with object counts and audit fields.
 */
public record CatalogSummary(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("database_count") int databaseCount,
        @JsonProperty("table_count") int tableCount,
        @JsonProperty("volume_count") int volumeCount,
        @JsonProperty("file_count") int fileCount,
        @JsonProperty("reserved") boolean reserved,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("created_by") String createdBy,
        @JsonProperty("updated_at") String updatedAt,
        @JsonProperty("updated_by") String updatedBy
) {}
