package de.bsommerfeld.fnpack.index;

import de.bsommerfeld.fnpack.core.domain.TargetRuntime;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Values of the environment marker variables a requirement can be guarded
 * by, as seen from the runtime the archive is built for.
 *
 * <p>
 * Function runtimes are CPython on x86_64 Linux, so only the language
 * version varies per {@link TargetRuntime}. The exact patch release is not
 * known and {@code python_full_version} stays unset; comparisons against
 * unset variables hold.
 *
 * <p>
 * {@code extra} is always the empty string: the packaged project is
 * installed without optional extras, so every {@code extra == ...} guard is
 * false.
 */
public final class MarkerEnvironment {

    private final Map<String, String> values;

    private MarkerEnvironment(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static MarkerEnvironment forRuntime(TargetRuntime runtime) {
        Map<String, String> values = new HashMap<>();
        values.put("python_version", runtime.pythonVersion());
        values.put("sys_platform", "linux");
        values.put("platform_system", "Linux");
        values.put("os_name", "posix");
        values.put("platform_machine", "x86_64");
        values.put("implementation_name", "cpython");
        values.put("platform_python_implementation", "CPython");
        values.put("extra", "");
        return new MarkerEnvironment(values);
    }

    /** Value of a marker variable, or {@code null} if it is unknown. */
    String value(String variable) {
        // legacy dotted spellings: os.name, sys.platform, platform.machine
        return values.get(variable.replace('.', '_'));
    }
}
