package org.eregs.regml.change;

import org.w3c.dom.Element;

/**
 * One directive of a notice's changeset. Each operation is its own subclass carrying
 * only the fields that operation uses.
 */
public abstract class Change {

    public enum Operation {
        ADDED("added"),
        MOVED("moved"),
        DELETED("deleted"),
        MODIFIED("modified"),
        CHANGE_TARGET("changeTarget"),
        CHANGE_LABEL("changeLabel");

        public final String xmlName;

        Operation(String xmlName) {
            this.xmlName = xmlName;
        }

        public static Operation fromXml(String name) {
            for (Operation op : values()) {
                if (op.xmlName.equals(name)) return op;
            }
            return null;
        }
    }

    private Change() {}

    public abstract Operation operation();

    /** Label the directive addresses; the old target for retargeting. */
    public abstract String label();

    @Override
    public String toString() {
        return operation().xmlName + " " + label();
    }

    // ---------------- Operations ----------------

    public static final class Added extends Change {
        public final String label;
        public final String parent;
        public final String before;
        public final String after;
        public final Element payload;

        public Added(String label, String parent, String before, String after, Element payload) {
            this.label = label; this.parent = parent; this.before = before; this.after = after;
            this.payload = payload;
        }

        @Override public Operation operation() { return Operation.ADDED; }
        @Override public String label() { return label; }
    }

    public static final class Moved extends Change {
        public final String label;
        public final String subpath;
        public final String parent;
        public final String before;
        public final String after;

        public Moved(String label, String subpath, String parent, String before, String after) {
            this.label = label; this.subpath = subpath; this.parent = parent;
            this.before = before; this.after = after;
        }

        @Override public Operation operation() { return Operation.MOVED; }
        @Override public String label() { return label; }
    }

    public static final class Deleted extends Change {
        public final String label;
        public final String subpath;

        public Deleted(String label, String subpath) {
            this.label = label; this.subpath = subpath;
        }

        @Override public Operation operation() { return Operation.DELETED; }
        @Override public String label() { return label; }
    }

    public static final class Modified extends Change {
        public final String label;
        public final String subpath;
        public final Element payload;

        public Modified(String label, String subpath, Element payload) {
            this.label = label; this.subpath = subpath; this.payload = payload;
        }

        @Override public Operation operation() { return Operation.MODIFIED; }
        @Override public String label() { return label; }
    }

    public static final class ChangeTarget extends Change {
        public final String oldTarget;
        public final String newTarget;
        /** Visible reference text to match case-insensitively; null matches every reference. */
        public final String text;

        public ChangeTarget(String oldTarget, String newTarget, String text) {
            this.oldTarget = oldTarget; this.newTarget = newTarget; this.text = text;
        }

        @Override public Operation operation() { return Operation.CHANGE_TARGET; }
        @Override public String label() { return oldTarget; }

        @Override
        public String toString() {
            return operation().xmlName + " " + oldTarget + " -> " + newTarget
                    + (text == null ? "" : " (\"" + text + "\")");
        }
    }

    public static final class ChangeLabel extends Change {
        public final String label;
        public final String newLabel;

        public ChangeLabel(String label, String newLabel) {
            this.label = label; this.newLabel = newLabel;
        }

        @Override public Operation operation() { return Operation.CHANGE_LABEL; }
        @Override public String label() { return label; }

        @Override
        public String toString() {
            return operation().xmlName + " " + label + " -> " + newLabel;
        }
    }
}
