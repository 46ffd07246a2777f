package io.schemaxtract.core.model;

import java.util.List;

/**
 * A layout node whose content may occur more than once.
 *
 * @param id            layout node id, or null
 * @param path          slash-separated layout path ending in the node's name
 * @param childBindings binding-path entry ids of the immediate child controls
 */
public record Repeater(String id, String path, List<String> childBindings) {

    public Repeater {
        childBindings = childBindings != null ? List.copyOf(childBindings) : List.of();
    }
}
