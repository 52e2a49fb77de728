package com.csd.updateserver.model;

import lombok.Value;

import java.util.Optional;

@Value
public class AppUpdateInfo {
    UpdateFileRecord latestStable;
    UpdateFileRecord latestPreRelease;

    public Optional<UpdateFileRecord> stable() {
        return Optional.ofNullable(latestStable);
    }

    public Optional<UpdateFileRecord> preRelease() {
        return Optional.ofNullable(latestPreRelease);
    }
}
