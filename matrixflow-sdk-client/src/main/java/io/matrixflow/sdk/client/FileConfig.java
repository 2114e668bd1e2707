package io.matrixflow.sdk.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Files used for retrieval; {@code type} is {@code all}, {@code none} or {@code specified}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileConfig(
        @JsonProperty("type") String type,
        @JsonProperty("target_volume_name") String targetVolumeName,
        @JsonProperty("target_volume_id") String targetVolumeId,
        @JsonProperty("file_id_list") List<String> fileIdList
) {}
