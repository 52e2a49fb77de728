package com.csd.updateserver.controller;

import com.csd.updateserver.UpdateServerApplication;
import com.csd.updateserver.model.*;
import com.csd.updateserver.service.LegacyClientDetector;
import com.csd.updateserver.service.LegacyPackageService;
import com.csd.updateserver.service.UpdateDistributionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/update")
public class UpdateController {

    static final MediaType GZIP = MediaType.parseMediaType("application/gzip");
    static final MediaType PORTABLE_EXECUTABLE = MediaType.parseMediaType("application/vnd.microsoft.portable-executable");

    private final UpdateDistributionService distributionService;
    private final LegacyClientDetector legacyClientDetector;

    public UpdateController(UpdateDistributionService distributionService,
                            LegacyClientDetector legacyClientDetector) {
        this.distributionService = distributionService;
        this.legacyClientDetector = legacyClientDetector;
    }

    @GetMapping
    public String serverVersion() {
        return "server version: " + UpdateServerApplication.version();
    }

    @PostMapping("/{app}/check")
    public boolean check(@PathVariable String app,
                         @RequestBody(required = false) CheckRequest check,
                         @RequestParam(defaultValue = "true") boolean includePrerelease,
                         @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
                         @RequestHeader(value = LegacyClientDetector.UPDATER_VERSION_HEADER, required = false) String updaterVersion) {
        boolean legacy = legacyClientDetector.isLegacy(userAgent, updaterVersion);
        String version = check != null ? check.getVersion() : null;
        Instant modified = check != null && check.getModified() != null ? check.getModified().toInstant() : null;
        String checksum = check != null ? check.getChecksum() : null;
        return distributionService.checkVersion(app, version, modified, checksum, includePrerelease, legacy);
    }

    @PostMapping("/{app}/check-upgrades")
    public ResponseEntity<?> checkUpgrades(@PathVariable String app,
                                           @RequestBody(required = false) CheckRequest request,
                                           @RequestParam(defaultValue = "false") boolean includePrerelease,
                                           @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
                                           @RequestHeader(value = LegacyClientDetector.UPDATER_VERSION_HEADER, required = false) String updaterVersion) {
        if (request == null || request.getVersion() == null || request.getVersion().isBlank()) {
            return ResponseEntity.badRequest().body("Version is required");
        }

        String installerVersion = legacyClientDetector.reportedUpdaterVersion(userAgent, updaterVersion);
        Optional<ApplicableUpgradesResult> result =
                distributionService.listApplicableUpgrades(app, request.getVersion(), includePrerelease, installerVersion);
        if (result.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        if (result.get().isUpToDate()) {
            return ResponseEntity.noContent().build();
        }

        ApplicableUpgradesResult upgrades = result.get();
        return ResponseEntity.ok(UpgradeInfoWrapper.builder()
                .currentVersion(request.getVersion())
                .targetVersion(upgrades.getTargetVersion())
                .upgrades(upgrades.getUpgrades().stream().map(UpgradeSummary::of).collect(Collectors.toList()))
                .packageSize(upgrades.getEstimatedSize())
                .requiresDownload(true)
                .build());
    }

    @GetMapping("/{app}/download-upgrade")
    public ResponseEntity<?> downloadUpgrade(@PathVariable String app,
                                             @RequestParam(required = false) String fromVersion,
                                             @RequestParam(defaultValue = "false") boolean includePrerelease,
                                             @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
                                             @RequestHeader(value = LegacyClientDetector.UPDATER_VERSION_HEADER, required = false) String updaterVersion) throws IOException {
        if (fromVersion == null || fromVersion.isBlank()) {
            return ResponseEntity.badRequest().body("fromVersion is required");
        }

        String installerVersion = legacyClientDetector.reportedUpdaterVersion(userAgent, updaterVersion);
        Optional<Path> packagePath = distributionService.fetchUpgradePackage(app, fromVersion, includePrerelease, installerVersion);
        if (packagePath.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return servePackage(packagePath.get());
    }

    @GetMapping("/{app}/download")
    public ResponseEntity<Resource> download(@PathVariable String app,
                                             @RequestParam(defaultValue = "true") boolean includePrerelease,
                                             @RequestHeader(value = HttpHeaders.USER_AGENT, required = false) String userAgent,
                                             @RequestHeader(value = LegacyClientDetector.UPDATER_VERSION_HEADER, required = false) String updaterVersion) throws IOException {
        boolean legacy = legacyClientDetector.isLegacy(userAgent, updaterVersion);
        Path file = distributionService.fetchPlainUpdate(app, includePrerelease, legacy);
        if (legacy && LegacyPackageService.isCombinedPackage(file)) {
            return servePackage(file);
        }
        return serveFile(file);
    }

    @GetMapping("/{app}/latest-info")
    public LatestInfo latestInfo(@PathVariable String app,
                                 @RequestParam(defaultValue = "false") boolean includePreRelease) {
        return distributionService.latestInfo(app, includePreRelease);
    }

    private ResponseEntity<Resource> serveFile(Path file) throws IOException {
        boolean executable = UpdateDistributionService.isExecutable(file);
        String fileName = file.getFileName().toString();
        boolean useOriginalName = fileName.split("-", -1).length == 2;
        String downloadName = useOriginalName ? fileName : "update" + (executable ? ".exe" : ".tar.gz");
        return fileResponse(file, executable ? PORTABLE_EXECUTABLE : GZIP, downloadName);
    }

    private ResponseEntity<Resource> servePackage(Path packagePath) throws IOException {
        log.info("Serving combined package: {} ({} bytes)", packagePath.getFileName(), Files.size(packagePath));
        return fileResponse(packagePath, GZIP, packagePath.getFileName().toString());
    }

    private static ResponseEntity<Resource> fileResponse(Path file, MediaType contentType, String downloadName) throws IOException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment().filename(downloadName).build());
        headers.setLastModified(Files.getLastModifiedTime(file).toMillis());
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(contentType)
                .contentLength(Files.size(file))
                .body(new FileSystemResource(file));
    }
}
