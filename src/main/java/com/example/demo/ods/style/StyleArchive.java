package com.example.demo.ods.style;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical style hash to style name, one per document.
 */
@Slf4j
public class StyleArchive {

    private final Map<String, String> namesByHash = new LinkedHashMap<>();

    public Optional<String> nameFor(String hash) {
        return Optional.ofNullable(namesByHash.get(hash));
    }

    /**
     * Archives {@code name} under {@code hash} unless the hash is already known.
     *
     * @return true when the entry was added
     */
    public boolean putIfAbsent(String hash, String name) {
        return namesByHash.putIfAbsent(hash, name) == null;
    }

    /**
     * Reverse lookup removal of the first entry pointing at {@code name}.
     */
    public boolean removeByName(String name) {
        Iterator<Map.Entry<String, String>> it = namesByHash.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, String> entry = it.next();
            if (entry.getValue().equals(name)) {
                it.remove();
                log.debug("Removed style {} from archive", name);
                return true;
            }
        }
        return false;
    }

    public int size() {
        return namesByHash.size();
    }
}
