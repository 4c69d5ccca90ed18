package de.bsommerfeld.fnpack.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific directories following each platform's native
 * conventions. Paths are absolute but <strong>not</strong> created; the
 * caller is responsible for ensuring the directory exists.
 *
 * <p>
 * Resolution per platform:
 * <ul>
 * <li><strong>macOS</strong>: app data in
 * {@code ~/Library/Application Support/{appName}}, pip cache in
 * {@code ~/Library/Caches/pip}</li>
 * <li><strong>Windows</strong>: app data in {@code %APPDATA%\{appName}},
 * pip cache in {@code %LOCALAPPDATA%\pip\Cache}</li>
 * <li><strong>Linux</strong>: app data in {@code $XDG_DATA_HOME/{appName}}
 * (fallback {@code ~/.local/share}), pip cache in
 * {@code $XDG_CACHE_HOME/pip} (fallback {@code ~/.cache/pip})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "fnpack";

    private StorageUtils() {
    }

    /**
     * Returns the platform-specific application data directory for the given
     * app name.
     */
    public static Path getAppDataDir(String appName) {
        String os = osName();
        String home = System.getProperty("user.home");

        if (isMac(os)) {
            return Paths.get(home, "Library", "Application Support", appName);
        }
        if (isWindows(os)) {
            String appData = System.getenv("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(home, "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(home, ".local", "share", appName);
    }

    /** Location of {@code config.json} in the app data directory. */
    public static Path getConfigFile() {
        return getAppDataDir(APP_NAME).resolve("config.json");
    }

    /**
     * Returns pip's HTTP and wheel cache directory. Wheels pip built or
     * downloaded earlier are picked up from here.
     */
    public static Path getPipCacheDir() {
        String os = osName();
        String home = System.getProperty("user.home");

        if (isMac(os)) {
            return Paths.get(home, "Library", "Caches", "pip");
        }
        if (isWindows(os)) {
            String localAppData = System.getenv("LOCALAPPDATA");
            return localAppData != null
                    ? Paths.get(localAppData, "pip", "Cache")
                    : Paths.get(home, "AppData", "Local", "pip", "Cache");
        }
        String xdgCache = System.getenv("XDG_CACHE_HOME");
        if (xdgCache != null && !xdgCache.isEmpty()) {
            return Paths.get(xdgCache, "pip");
        }
        return Paths.get(home, ".cache", "pip");
    }

    /**
     * Returns the private download cache for wheels fetched from the
     * registry. It lives in the system temp directory and is shared by every
     * run on the machine.
     */
    public static Path getPrivateCacheDir() {
        return Paths.get(System.getProperty("java.io.tmpdir"), APP_NAME + "_cache");
    }

    private static String osName() {
        return System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
    }

    private static boolean isMac(String os) {
        return os.contains("mac") || os.contains("darwin");
    }

    private static boolean isWindows(String os) {
        return os.contains("win");
    }
}
