package de.bsommerfeld.fnpack.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import de.bsommerfeld.fnpack.core.domain.IgnorePatternSet;
import de.bsommerfeld.fnpack.core.domain.TargetRuntime;
import de.bsommerfeld.fnpack.core.util.StorageUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of a packaging run, stored as {@code config.json} in the app data
 * directory. Every field has a usable default, so an empty file is valid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "target-runtime", "platform-tag", "registry-url", "python-executable", "site-packages",
        "wheel-cache-dir", "private-cache-dir", "bundled-store-manifest", "ignore-patterns",
        "reproducible-archives" })
public class PackagerConfig {

    public static final String DEFAULT_REGISTRY_URL = "https://pypi.org/pypi";

    @JsonProperty("target-runtime")
    private String targetRuntime = TargetRuntime.PYTHON36.id();

    /** Overrides the runtime's wheel platform tag when set. */
    @JsonProperty("platform-tag")
    private String platformTag;

    @JsonProperty("registry-url")
    private String registryUrl = DEFAULT_REGISTRY_URL;

    @JsonProperty("python-executable")
    private String pythonExecutable = "python3";

    /** Search path for installed distributions; empty asks the interpreter. */
    @JsonProperty("site-packages")
    private List<String> sitePackages = new ArrayList<>();

    @JsonProperty("wheel-cache-dir")
    private String wheelCacheDir = StorageUtils.getPipCacheDir().toString();

    @JsonProperty("private-cache-dir")
    private String privateCacheDir = StorageUtils.getPrivateCacheDir().toString();

    /** JSON manifest of the bundled precompiled artifacts; unset means none. */
    @JsonProperty("bundled-store-manifest")
    private String bundledStoreManifest;

    @JsonProperty("ignore-patterns")
    private List<String> ignorePatterns = new ArrayList<>(IgnorePatternSet.DEFAULT_GLOBS);

    @JsonProperty("reproducible-archives")
    private boolean reproducibleArchives = true;

    public String getTargetRuntime() {
        return targetRuntime;
    }

    public void setTargetRuntime(String targetRuntime) {
        this.targetRuntime = targetRuntime;
    }

    @JsonIgnore
    public TargetRuntime runtime() {
        return TargetRuntime.of(targetRuntime);
    }

    public String getPlatformTag() {
        return platformTag;
    }

    public void setPlatformTag(String platformTag) {
        this.platformTag = platformTag;
    }

    /** The configured override, or the runtime's own tag. */
    @JsonIgnore
    public String effectivePlatformTag() {
        return platformTag == null || platformTag.isBlank() ? runtime().platformTag() : platformTag;
    }

    public String getRegistryUrl() {
        return registryUrl;
    }

    public void setRegistryUrl(String registryUrl) {
        this.registryUrl = registryUrl;
    }

    public String getPythonExecutable() {
        return pythonExecutable;
    }

    public void setPythonExecutable(String pythonExecutable) {
        this.pythonExecutable = pythonExecutable;
    }

    public List<String> getSitePackages() {
        return sitePackages;
    }

    public void setSitePackages(List<String> sitePackages) {
        this.sitePackages = sitePackages == null ? new ArrayList<>() : sitePackages;
    }

    public String getWheelCacheDir() {
        return wheelCacheDir;
    }

    public void setWheelCacheDir(String wheelCacheDir) {
        this.wheelCacheDir = wheelCacheDir;
    }

    public String getPrivateCacheDir() {
        return privateCacheDir;
    }

    public void setPrivateCacheDir(String privateCacheDir) {
        this.privateCacheDir = privateCacheDir;
    }

    public String getBundledStoreManifest() {
        return bundledStoreManifest;
    }

    public void setBundledStoreManifest(String bundledStoreManifest) {
        this.bundledStoreManifest = bundledStoreManifest;
    }

    public List<String> getIgnorePatterns() {
        return ignorePatterns;
    }

    public void setIgnorePatterns(List<String> ignorePatterns) {
        this.ignorePatterns = ignorePatterns == null ? new ArrayList<>() : ignorePatterns;
    }

    @JsonIgnore
    public IgnorePatternSet ignorePatternSet() {
        return IgnorePatternSet.of(ignorePatterns);
    }

    public boolean isReproducibleArchives() {
        return reproducibleArchives;
    }

    public void setReproducibleArchives(boolean reproducibleArchives) {
        this.reproducibleArchives = reproducibleArchives;
    }

    @JsonIgnore
    public Path wheelCachePath() {
        return Path.of(wheelCacheDir);
    }

    @JsonIgnore
    public Path privateCachePath() {
        return Path.of(privateCacheDir);
    }
}
