package com.csd.updateserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where one file of an upgrade goes on the device and how it is installed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileDirective {
    private String path;
    private String target; // null means the app's root folder
    private String permissions;
    private boolean required;
    private boolean executable;
    private boolean explode;
    private boolean backup;
    private int runOrder;
    private long size;
    private String checksum;
}
