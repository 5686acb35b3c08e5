package org.eregs.regml.toc;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Every {@code tableOfContents} container of a document, with lookup and maintenance
 * of entries keyed by their {@code target} label. A label may be listed in several
 * containers (a part TOC and a subpart TOC, say); an absent entry is not an error.
 */
public final class TocIndex {

    private static final Logger log = LoggerFactory.getLogger(TocIndex.class);

    private final List<Element> containers;

    private TocIndex(List<Element> containers) {
        this.containers = containers;
    }

    /** Snapshot of the containers currently in {@code doc}. */
    public static TocIndex of(Document doc) {
        Element root = doc.getDocumentElement();
        List<Element> found = root == null
                ? new ArrayList<>()
                : Elements.descendants(root, RegmlNames.TABLE_OF_CONTENTS);
        return new TocIndex(found);
    }

    public List<Element> containers() {
        return containers;
    }

    // ---------------- Lookup ----------------

    public static Element findEntry(Element container, String target) {
        for (Element e : Elements.children(container)) {
            if (target.equals(Elements.attr(e, RegmlNames.ATTR_TARGET))) return e;
        }
        return null;
    }

    public List<Element> findAll(String target) {
        return findAll(containers, target);
    }

    public static List<Element> findAll(List<Element> containers, String target) {
        List<Element> out = new ArrayList<>();
        for (Element c : containers) {
            Element e = findEntry(c, target);
            if (e != null) out.add(e);
        }
        return out;
    }

    // ---------------- Maintenance ----------------

    /**
     * Adds an entry for {@code target} right after {@code after}, or at the end of the
     * container when {@code after} is null. An existing entry for the target is updated
     * instead.
     */
    public static Element createEntry(Element container, String target, String designator,
                                      String subject, Element after, TocEntryKind kind) {
        Element existing = findEntry(container, target);
        if (existing != null) {
            updateEntry(existing, designator, subject, kind);
            return existing;
        }
        Element entry = newEntry(container, target, designator, subject, kind);
        if (after != null && after.getParentNode() == container) Elements.insertAfter(after, entry);
        else container.appendChild(entry);
        return entry;
    }

    /** As {@link #createEntry}, but placed right before {@code before}. */
    public static Element createEntryBefore(Element container, String target, String designator,
                                            String subject, Element before, TocEntryKind kind) {
        Element existing = findEntry(container, target);
        if (existing != null) {
            updateEntry(existing, designator, subject, kind);
            return existing;
        }
        Element entry = newEntry(container, target, designator, subject, kind);
        if (before != null && before.getParentNode() == container) container.insertBefore(entry, before);
        else container.appendChild(entry);
        return entry;
    }

    /**
     * Brings the designator and subject of {@code entry} in line with the given values,
     * creating either field if the entry lacks it. Null values leave the field alone.
     *
     * @return whether anything changed
     */
    public static boolean updateEntry(Element entry, String designator, String subject, TocEntryKind kind) {
        Document doc = entry.getOwnerDocument();
        boolean changed = false;

        if (kind.designatorTag != null && designator != null) {
            Element num = Elements.child(entry, kind.designatorTag);
            if (num == null) {
                log.warn("TOC entry {} has no <{}>; adding one", entry.getAttribute(RegmlNames.ATTR_TARGET), kind.designatorTag);
                num = Elements.create(doc, entry, kind.designatorTag);
                entry.insertBefore(num, entry.getFirstChild());
            }
            String old = Elements.text(num);
            if (!Objects.equals(old, designator.trim())) {
                log.debug("Updating TOC {}: {} -> {}", kind.designatorTag, old, designator);
                num.setTextContent(designator);
                changed = true;
            }
        }

        if (subject != null) {
            Element subj = Elements.child(entry, kind.subjectTag);
            if (subj == null) {
                log.warn("TOC entry {} has no <{}>; adding one", entry.getAttribute(RegmlNames.ATTR_TARGET), kind.subjectTag);
                subj = Elements.create(doc, entry, kind.subjectTag);
                entry.appendChild(subj);
            }
            String old = Elements.text(subj);
            if (!Objects.equals(old, subject.trim())) {
                log.debug("Updating TOC {}: '{}' -> '{}'", kind.subjectTag, old, subject);
                subj.setTextContent(subject);
                changed = true;
            }
        }

        return changed;
    }

    /** Removes the entry from its container; false if it was already detached. */
    public static boolean deleteEntry(Element entry) {
        return Elements.detach(entry);
    }

    /** Removes every entry targeting {@code target}; returns how many went. */
    public int deleteAll(String target) {
        int n = 0;
        for (Element e : findAll(target)) {
            if (deleteEntry(e)) n++;
        }
        return n;
    }

    /** Points every entry for {@code oldTarget} at {@code newTarget}; returns how many moved. */
    public int retarget(String oldTarget, String newTarget) {
        List<Element> entries = findAll(oldTarget);
        for (Element e : entries) e.setAttribute(RegmlNames.ATTR_TARGET, newTarget);
        return entries.size();
    }

    private static Element newEntry(Element container, String target, String designator,
                                    String subject, TocEntryKind kind) {
        Document doc = container.getOwnerDocument();
        Element entry = Elements.create(doc, container, kind.entryTag);
        entry.setAttribute(RegmlNames.ATTR_TARGET, target);
        if (kind.designatorTag != null) {
            Element num = Elements.create(doc, container, kind.designatorTag);
            num.setTextContent(designator == null ? "" : designator);
            entry.appendChild(num);
        }
        Element subj = Elements.create(doc, container, kind.subjectTag);
        subj.setTextContent(subject == null ? "" : subject);
        entry.appendChild(subj);
        return entry;
    }
}
