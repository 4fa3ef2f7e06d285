package com.deepansh.kernel.memory;

import java.util.List;
import java.util.Optional;

/**
 * Key/value namespace shared by all agents. Access is gated per key by
 * MemoryRead / MemoryWrite capabilities at the call site, not here.
 */
public interface SharedMemory {

    Optional<String> get(String key);

    void put(String key, String value);

    /** Keys starting with {@code prefix}, sorted. */
    List<String> keys(String prefix);
}
