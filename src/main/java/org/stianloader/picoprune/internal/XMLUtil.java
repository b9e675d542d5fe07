package org.stianloader.picoprune.internal;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

public class XMLUtil {

    public static class ChildElementIterable implements Iterable<@NotNull Element> {

        @NotNull
        private final Element parent;

        public ChildElementIterable(@NotNull Element parent) {
            this.parent = Objects.requireNonNull(parent, "parent may not be null");
        }

        @Override
        public Iterator<@NotNull Element> iterator() {
            return new ElementNodeListIterator(this.parent.getChildNodes());
        }
    }

    public static class ElementNodeListIterator implements Iterator<@NotNull Element> {
        private int i = 0;
        private final NodeList nodeList;

        public ElementNodeListIterator(NodeList list) {
            this.nodeList = list;
        }

        @Override
        public boolean hasNext() {
            while (this.i < this.nodeList.getLength()) {
                if (this.nodeList.item(this.i) instanceof Element) {
                    return true;
                }
                this.i++;
            }
            return false;
        }

        @Override
        @NotNull
        public Element next() {
            if (!this.hasNext()) {
                throw new NoSuchElementException("Iterator exausted: i = " + this.i + ", len = " + this.nodeList.getLength());
            }
            return (Element) this.nodeList.item(this.i++);
        }
    }

    @NotNull
    public static List<@NotNull Element> getChildElements(@NotNull Element parent) {
        List<@NotNull Element> collected = new ArrayList<>();
        for (Element child : new ChildElementIterable(parent)) {
            collected.add(child);
        }
        return collected;
    }
}
