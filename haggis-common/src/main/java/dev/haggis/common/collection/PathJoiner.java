package dev.haggis.common.collection;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

public final class PathJoiner implements KeyJoiner<String, String> {

    private static final PathJoiner PLATFORM = new PathJoiner(File.separator);

    private final String separator;
    private final Joiner joiner;
    private final CharMatcher trailing;

    PathJoiner(final String separator) {
        Preconditions.checkArgument(!separator.isEmpty(), "separator is empty");
        this.separator = separator;
        this.joiner = Joiner.on(separator);
        this.trailing = CharMatcher.anyOf(separator + "/");
    }

    public static PathJoiner platform() {
        return PLATFORM;
    }

    @Override
    public String join(final List<String> hierarchy) {
        Preconditions.checkArgument(!hierarchy.isEmpty(), "hierarchy must contain the root key");
        if (hierarchy.size() == 1) {
            return this.separator;
        }
        // The root placeholder at index 0 is never part of the path
        final var first = hierarchy.get(1);
        final var rest = hierarchy.subList(2, hierarchy.size());
        if (this.isAbsolute(first)) {
            if (rest.isEmpty()) {
                return first;
            }
            return this.trailing.trimTrailingFrom(first) + this.separator + this.joiner.join(rest);
        }
        return this.joiner.join(hierarchy.subList(1, hierarchy.size()));
    }

    private boolean isAbsolute(final String segment) {
        if (segment.startsWith(this.separator)) {
            return true;
        }
        try {
            return Path.of(segment).isAbsolute();
        } catch (final InvalidPathException ignored) {
            return false;
        }
    }
}
