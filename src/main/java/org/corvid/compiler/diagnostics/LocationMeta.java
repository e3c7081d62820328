package org.corvid.compiler.diagnostics;

import org.corvid.compiler.api.SourceLocation;

import java.util.Optional;

/**
 * Location metadata attached to a syntax node.
 * <p>
 * Nodes always know their own line ({@code 0} if unknown). Nodes that were generated from
 * another file, e.g. by an include or macro expansion, additionally carry the origin they
 * should be reported at.
 *
 * @param line The line of the node in the file being compiled.
 * @param origin An explicit location override, if any.
 */
public record LocationMeta(int line, Optional<SourceLocation> origin) {

    public LocationMeta {
        if (line < 0) {
            throw new IllegalArgumentException("Line number must not be negative: " + line);
        }
        origin = origin == null ? Optional.empty() : origin;
    }

    /**
     * @param line The line of the node.
     * @return Metadata with only a line.
     */
    public static LocationMeta ofLine(int line) {
        return new LocationMeta(line, Optional.empty());
    }

    /**
     * @param line The line of the node in the file being compiled.
     * @param originFile The file the node originates from.
     * @param originLine The line in the originating file.
     * @return Metadata carrying an explicit origin.
     */
    public static LocationMeta withOrigin(int line, String originFile, int originLine) {
        return new LocationMeta(line, Optional.of(new SourceLocation(originFile, originLine)));
    }
}
