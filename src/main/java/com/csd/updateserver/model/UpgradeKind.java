package com.csd.updateserver.model;

public enum UpgradeKind {
    STANDARD,     // files copied from the manifest's storage location
    APP_UPDATE,   // the app's own update archive, exploded on the device
    SELF_UPDATE   // a new build of the on-device updater
}
