package org.corvid.compiler.diagnostics;

import org.corvid.compiler.api.SourceLocation;

/**
 * Picks the most accurate file and line for a diagnostic.
 */
public final class LocationResolver {

    private LocationResolver() {}

    /**
     * Resolves the location a diagnostic should be reported at.
     * An explicit origin in the metadata wins; otherwise the fallback file is paired with the
     * metadata's line, or with line {@code 0} if there is no metadata at all.
     *
     * @param meta The node metadata, may be {@code null}.
     * @param fallbackFile The file currently being compiled.
     * @return The resolved location.
     */
    public static SourceLocation resolve(LocationMeta meta, String fallbackFile) {
        if (meta == null) {
            return SourceLocation.ofFile(fallbackFile);
        }
        return meta.origin().orElseGet(() -> new SourceLocation(fallbackFile, meta.line()));
    }
}
