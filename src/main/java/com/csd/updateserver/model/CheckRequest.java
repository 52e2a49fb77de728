package com.csd.updateserver.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckRequest {
    private String version;
    private OffsetDateTime modified;
    private String checksum;
}
