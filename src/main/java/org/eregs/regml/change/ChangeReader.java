package org.eregs.regml.change;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/** Reads {@code change} elements into {@link Change} directives, rejecting incomplete ones. */
public final class ChangeReader {

    private ChangeReader() {}

    public static List<Change> readAll(Element changeset) {
        List<Change> out = new ArrayList<>();
        if (changeset == null) return out;
        for (Element c : Elements.children(changeset, RegmlNames.CHANGE)) out.add(read(c));
        return out;
    }

    public static Change read(Element change) {
        String opName = Elements.attr(change, RegmlNames.ATTR_OPERATION);
        String label = Elements.attr(change, RegmlNames.ATTR_LABEL);
        Change.Operation op = Change.Operation.fromXml(opName);
        if (op == null) {
            throw new ChangeApplicationException(label, String.valueOf(opName), "unknown operation");
        }

        if (op == Change.Operation.CHANGE_TARGET) {
            String oldTarget = Elements.attr(change, RegmlNames.ATTR_OLD_TARGET);
            String newTarget = Elements.attr(change, RegmlNames.ATTR_NEW_TARGET);
            if (isBlank(oldTarget) || isBlank(newTarget)) {
                throw new MissingRetargetInfoException(oldTarget, opName, "oldTarget and newTarget are both required");
            }
            String text = Elements.text(change);
            return new Change.ChangeTarget(oldTarget, newTarget, text.isEmpty() ? null : text);
        }

        if (isBlank(label)) {
            throw new MissingLabelException(label, opName, "change has no label");
        }
        String subpath = Elements.attr(change, RegmlNames.ATTR_SUBPATH);
        String parent = Elements.attr(change, RegmlNames.ATTR_PARENT);
        String before = Elements.attr(change, RegmlNames.ATTR_BEFORE);
        String after = Elements.attr(change, RegmlNames.ATTR_AFTER);

        switch (op) {
            case ADDED:
                return new Change.Added(label, parent, before, after, payload(change, label, opName));
            case MOVED:
                return new Change.Moved(label, subpath, parent, before, after);
            case DELETED:
                return new Change.Deleted(label, subpath);
            case MODIFIED:
                return new Change.Modified(label, subpath, payload(change, label, opName));
            case CHANGE_LABEL:
                String newLabel = Elements.attr(change, RegmlNames.ATTR_NEW_LABEL);
                if (isBlank(newLabel)) {
                    throw new MissingRetargetInfoException(label, opName, "newLabel is required");
                }
                return new Change.ChangeLabel(label, newLabel);
            default:
                throw new ChangeApplicationException(label, opName, "unsupported operation");
        }
    }

    private static Element payload(Element change, String label, String opName) {
        List<Element> kids = Elements.children(change);
        if (kids.size() != 1) {
            throw new MissingPayloadException(label, opName,
                    "expected exactly one replacement element, found " + kids.size());
        }
        return kids.get(0);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
