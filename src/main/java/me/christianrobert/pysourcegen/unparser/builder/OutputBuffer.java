package me.christianrobert.pysourcegen.unparser.builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered text fragments of one render call.
 */
final class OutputBuffer {

    private final List<String> fragments = new ArrayList<>();

    void append(String fragment) {
        fragments.add(fragment);
    }

    /**
     * True until the first fragment (even an empty one) has been appended.
     */
    boolean isEmpty() {
        return fragments.isEmpty();
    }

    int fragmentCount() {
        return fragments.size();
    }

    String join() {
        return String.join("", fragments);
    }
}
