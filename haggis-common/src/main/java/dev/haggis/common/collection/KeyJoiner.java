package dev.haggis.common.collection;

import com.google.common.base.Joiner;
import java.util.List;

@FunctionalInterface
public interface KeyJoiner<K, T> {

    static <K> KeyJoiner<K, List<K>> tuple() {
        return keys -> keys;
    }

    static <K extends CharSequence> KeyJoiner<K, String> concat() {
        return Joiner.on("")::join;
    }

    // The hierarchy starts with the root key
    T join(final List<K> hierarchy);
}
