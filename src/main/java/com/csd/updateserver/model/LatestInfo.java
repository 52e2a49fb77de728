package com.csd.updateserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Response body of {@code latest-info}: the newest file on each track.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
public class LatestInfo {
    private Track stable;
    private Track prerelease;

    @Data
    @Builder
    public static class Track {
        private String version;
        private String file;
        private Instant lastModified;

        public static Track of(UpdateFileRecord record) {
            if (record == null) return null;
            return Track.builder()
                    .version(record.getVersion() == null ? null : record.getVersion().toString())
                    .file(record.getFileName())
                    .lastModified(record.getLastModified())
                    .build();
        }
    }
}
