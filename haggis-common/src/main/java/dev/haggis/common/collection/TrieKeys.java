package dev.haggis.common.collection;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class TrieKeys {

    private TrieKeys() {}

    public static List<String> codePoints(final CharSequence chars) {
        Preconditions.checkNotNull(chars, "chars");
        final List<String> keys = new ArrayList<>(chars.length());
        chars.codePoints().forEach(cp -> keys.add(new String(Character.toChars(cp))));
        return keys;
    }

    public static List<String> segments(final Path path) {
        Preconditions.checkNotNull(path, "path");
        final List<String> keys = new ArrayList<>(path.getNameCount() + 1);
        final var root = path.getRoot();
        if (root != null) {
            keys.add(root.toString());
        }
        for (final var name : path) {
            final var segment = name.toString();
            if (!segment.isEmpty()) {
                keys.add(segment);
            }
        }
        return keys;
    }
}
