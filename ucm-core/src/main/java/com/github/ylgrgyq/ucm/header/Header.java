package com.github.ylgrgyq.ucm.header;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The header of a ucm frame: an ordered map from item name to {@link HeaderItem}.
 * <p>
 * Items are kept, and written, in the order they were first added. Replacing an item keeps
 * its position. Names like "Detector.Name" look hierarchical but the store is flat, the full
 * dotted name is the key and no directory item is required to exist for it.
 * <p>
 * This class is not thread safe.
 */
public final class Header {
    private final Map<String, HeaderItem> items;

    public Header() {
        this.items = new LinkedHashMap<>();
    }

    /**
     * Create a copy of {@code header}. Items are immutable so they are shared.
     *
     * @param header the header to copy
     */
    public Header(Header header) {
        requireNonNull(header, "header");
        this.items = new LinkedHashMap<>(header.items);
    }

    @Nullable
    public HeaderItem get(String name) {
        requireNonNull(name, "name");
        return items.get(name);
    }

    public boolean contains(String name) {
        requireNonNull(name, "name");
        return items.containsKey(name);
    }

    /**
     * Add {@code item} to this header. If an item with the same name exists it is replaced
     * and the new item takes its position, otherwise the new item is appended.
     *
     * @param item the item to add
     * @return the replaced item or null if there was none
     */
    @Nullable
    public HeaderItem set(HeaderItem item) {
        requireNonNull(item, "item");
        return items.put(item.getName(), item);
    }

    @Nullable
    public HeaderItem set(String name, String comment, HeaderValue value) {
        return set(new HeaderItem(name, comment, value));
    }

    /**
     * Remove the item named {@code name}.
     *
     * @param name name of the item to remove
     * @return the removed item or null if there was none
     */
    @Nullable
    public HeaderItem delete(String name) {
        requireNonNull(name, "name");
        return items.remove(name);
    }

    /**
     * Returns a read-only view on the items of this header in write order. Every iteration
     * starts from the first item and reflects the current content of the header.
     *
     * @return the items of this header
     */
    public Collection<HeaderItem> items() {
        return Collections.unmodifiableCollection(items.values());
    }

    public List<String> names() {
        return new ArrayList<>(items.keySet());
    }

    public int count() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "Header{" +
                "items=" + items.values() +
                '}';
    }
}
