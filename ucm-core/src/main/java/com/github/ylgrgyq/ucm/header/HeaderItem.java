package com.github.ylgrgyq.ucm.header;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A named, commented and typed entry in the header of a ucm frame.
 * <p>
 * The name may use '.' to place the item under a directory item, like "Site.Observatory",
 * but this is only a naming convention. The type of the item is the type of its value.
 */
public final class HeaderItem {
    private final String name;
    private final String comment;
    private final HeaderValue value;

    public HeaderItem(String name, String comment, HeaderValue value) {
        this.name = requireNonNull(name, "name");
        this.comment = requireNonNull(comment, "comment");
        this.value = requireNonNull(value, "value");
    }

    public String getName() {
        return name;
    }

    public String getComment() {
        return comment;
    }

    public HeaderValue getValue() {
        return value;
    }

    public HeaderType getType() {
        return value.type();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final HeaderItem that = (HeaderItem) o;
        return name.equals(that.name) &&
                comment.equals(that.comment) &&
                value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, comment, value);
    }

    @Override
    public String toString() {
        return "HeaderItem{" +
                "name='" + name + '\'' +
                ", type=" + value.type() +
                ", value=" + value +
                ", comment='" + comment + '\'' +
                '}';
    }
}
