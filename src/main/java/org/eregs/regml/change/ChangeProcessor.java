package org.eregs.regml.change;

import org.eregs.regml.label.LabelAlgebra;
import org.eregs.regml.toc.TocEntryKind;
import org.eregs.regml.toc.TocIndex;
import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlDocuments;
import org.eregs.regml.xml.RegmlNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies the changeset of a notice to a regulation tree.
 *
 * <p>The base tree is never touched: the engine copies it and edits the copy. Directives
 * run in a fixed order, additions, moves, deletions, modifications, then retargets and
 * relabels. Additions go shallowest first so later ones can anchor on earlier ones;
 * deletions and modifications go deepest first. The first directive that cannot be
 * applied aborts the whole notice with a {@link ChangeApplicationException}.
 */
public final class ChangeProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChangeProcessor.class);

    private ChangeProcessor() {}

    public static Document applyChanges(Document base, Document notice) {
        return applyChanges(base, Notice.from(notice), false);
    }

    public static Document applyChanges(Document base, Document notice, boolean dry) {
        return applyChanges(base, Notice.from(notice), dry);
    }

    /**
     * @param dry when true, every directive is checked against a scratch copy and an
     *            unmodified copy of {@code base} is returned
     * @return the amended tree, a new document
     */
    public static Document applyChanges(Document base, Notice notice, boolean dry) {
        Document work = RegmlDocuments.copy(base);
        new Application(work).run(notice);
        return dry ? RegmlDocuments.copy(base) : work;
    }

    // ---------------- One application ----------------

    private static final class Application {
        private final Document doc;
        private final LabelIndex labels;

        Application(Document doc) {
            this.doc = doc;
            this.labels = new LabelIndex(doc.getDocumentElement());
        }

        void run(Notice notice) {
            replaceMetadata(notice.document.getDocumentElement(), RegmlNames.FDSYS, 0);
            replaceMetadata(notice.document.getDocumentElement(), RegmlNames.PREAMBLE, 1);

            Map<Change.Operation, List<Change>> buckets = new EnumMap<>(Change.Operation.class);
            for (Change.Operation op : Change.Operation.values()) buckets.put(op, new ArrayList<>());
            for (Change c : notice.changes) buckets.get(c.operation()).add(c);

            List<Change> additions = buckets.get(Change.Operation.ADDED);
            List<Change> moves = buckets.get(Change.Operation.MOVED);
            List<Change> deletions = buckets.get(Change.Operation.DELETED);
            List<Change> modifications = buckets.get(Change.Operation.MODIFIED);
            List<Change> relabels = buckets.get(Change.Operation.CHANGE_LABEL);
            List<Change.ChangeTarget> retargets = new ArrayList<>();
            for (Change c : buckets.get(Change.Operation.CHANGE_TARGET)) retargets.add((Change.ChangeTarget) c);

            additions.sort(ChangeOrdering.BY_LABEL);
            moves.sort(ChangeOrdering.BY_LABEL);
            deletions.sort(ChangeOrdering.BY_LABEL.reversed());
            modifications.sort(ChangeOrdering.BY_LABEL.reversed());
            retargets.sort(ChangeOrdering.RETARGETS);
            relabels.sort(ChangeOrdering.BY_LABEL);

            log.debug("Applying {} additions, {} moves, {} deletions, {} modifications, {} retargets, {} relabels",
                    additions.size(), moves.size(), deletions.size(), modifications.size(),
                    retargets.size(), relabels.size());

            for (Change c : additions) add((Change.Added) c);
            for (Change c : moves) move((Change.Moved) c);
            for (Change c : deletions) delete((Change.Deleted) c);
            for (Change c : modifications) modify((Change.Modified) c);
            for (Change.ChangeTarget c : retargets) retarget(c);
            for (Change c : relabels) relabel((Change.ChangeLabel) c);
        }

        // ---------------- Metadata ----------------

        /** The notice is authoritative for publication metadata. */
        private void replaceMetadata(Element noticeRoot, String name, int position) {
            Element fromNotice = Elements.child(noticeRoot, name);
            if (fromNotice == null) return;
            Element root = doc.getDocumentElement();
            Node imported = doc.importNode(fromNotice, true);
            Element existing = Elements.child(root, name);
            if (existing != null) root.replaceChild(imported, existing);
            else Elements.insertAt(root, imported, position);
        }

        // ---------------- Operations ----------------

        private void add(Change.Added c) {
            log.info("Applying operation '{}' to {}", c.operation().xmlName, c.label);
            if (labels.contains(c.label)) {
                throw new DuplicateLabelException(c.label, c.operation().xmlName,
                        "label already exists; was it added by another change?");
            }
            String parentLabel = c.parent != null ? c.parent : LabelAlgebra.parentLabel(c.label);
            if (parentLabel == null) {
                throw new MissingParentException(c.label, c.operation().xmlName, "a root label cannot be added");
            }
            Element parent = labels.get(parentLabel);
            if (parent == null) {
                throw new MissingParentException(c.label, c.operation().xmlName, "parent " + parentLabel + " not found");
            }

            checkPayloadLabel(c.payload, c.label, c);
            checkNewLabels(c.payload, Collections.<String>emptySet(), c);

            Element node = (Element) doc.importNode(c.payload, true);
            Element container = contentOf(parent);
            if (c.before != null || c.after != null) {
                place(node, container, c.before, c.after, c);
            } else if (c.parent != null) {
                container.appendChild(node);
            } else {
                Element sibling = labels.get(LabelAlgebra.siblingLabel(c.label));
                if (sibling != null && sibling.getParentNode() != null) Elements.insertAfter(sibling, node);
                else container.appendChild(node);
            }
            labels.index(node);
            addTocEntries(c.label, node);
        }

        private void move(Change.Moved c) {
            log.info("Applying operation '{}' to {}", c.operation().xmlName, c.label);
            Element node = resolve(c.label, c.subpath, c);
            if (c.parent == null) {
                throw new MissingParentException(c.label, c.operation().xmlName, "a move needs an explicit parent");
            }
            Element parent = labels.get(c.parent);
            if (parent == null) {
                throw new MissingParentException(c.label, c.operation().xmlName, "parent " + c.parent + " not found");
            }
            if (isSelfOrAncestor(node, parent)) {
                throw new MissingParentException(c.label, c.operation().xmlName,
                        "parent " + c.parent + " lies inside the node being moved");
            }
            String anchorLabel = c.before != null ? c.before : c.after;
            Element anchor = labels.get(anchorLabel);
            if (anchor != null && isSelfOrAncestor(node, anchor)) {
                throw new MissingParentException(c.label, c.operation().xmlName,
                        "anchor " + anchorLabel + " lies inside the node being moved");
            }

            Element container = contentOf(parent);
            Elements.detach(node);
            if (c.before != null || c.after != null) place(node, container, c.before, c.after, c);
            else container.appendChild(node);

            if (c.subpath == null) moveTocEntries(node);
        }

        private void delete(Change.Deleted c) {
            log.info("Applying operation '{}' to {}", c.operation().xmlName, labelWithSubpath(c.label, c.subpath));
            Element node = resolve(c.label, c.subpath, c);
            List<String> gone = c.subpath == null ? LabelIndex.labelsIn(node) : Collections.<String>emptyList();
            labels.unindex(node);
            Elements.detach(node);

            if (!gone.isEmpty()) {
                TocIndex toc = TocIndex.of(doc);
                int removed = 0;
                for (String label : gone) removed += toc.deleteAll(label);
                log.debug("Removed {} TOC entries for {}", removed, c.label);
            }
        }

        private void modify(Change.Modified c) {
            log.info("Applying operation '{}' to {}", c.operation().xmlName, labelWithSubpath(c.label, c.subpath));
            Element old = resolve(c.label, c.subpath, c);
            if (c.subpath == null) checkPayloadLabel(c.payload, c.label, c);
            checkNewLabels(c.payload, new HashSet<>(LabelIndex.labelsIn(old)), c);
            Element replacement = (Element) doc.importNode(c.payload, true);
            labels.unindex(old);
            old.getParentNode().replaceChild(replacement, old);
            labels.index(replacement);

            Element labeled = labels.get(c.label);
            TocEntryKind kind = labeled == null ? null : TocEntryKind.forNode(labeled);
            if (kind == null) return;
            List<Element> entries = TocIndex.of(doc).findAll(c.label);
            int changed = 0;
            for (Element entry : entries) {
                if (TocIndex.updateEntry(entry, kind.designatorOf(labeled), kind.subjectOf(labeled), kind)) changed++;
            }
            log.debug("Found {} TOC entries for {}, updated {}", entries.size(), c.label, changed);
        }

        private void retarget(Change.ChangeTarget c) {
            log.info("Applying operation '{}' to {} -> {}", c.operation().xmlName, c.oldTarget, c.newTarget);
            int n = 0;
            for (Element ref : Elements.descendants(doc.getDocumentElement(), RegmlNames.REF)) {
                if (!c.oldTarget.equals(Elements.attr(ref, RegmlNames.ATTR_TARGET))) continue;
                if (c.text != null && !c.text.equalsIgnoreCase(Elements.text(ref))) continue;
                ref.setAttribute(RegmlNames.ATTR_TARGET, c.newTarget);
                n++;
            }
            if (n == 0) log.warn("No references to {} matched{}", c.oldTarget, c.text == null ? "" : " '" + c.text + "'");
            else log.debug("Retargeted {} references from {} to {}", n, c.oldTarget, c.newTarget);
        }

        private void relabel(Change.ChangeLabel c) {
            log.info("Applying operation '{}' to {} -> {}", c.operation().xmlName, c.label, c.newLabel);
            Element node = labels.get(c.label);
            if (node == null) {
                throw new MissingLabelException(c.label, c.operation().xmlName, "label not found");
            }
            if (labels.contains(c.newLabel)) {
                throw new DuplicateLabelException(c.label, c.operation().xmlName, "new label " + c.newLabel + " already exists");
            }
            node.setAttribute(RegmlNames.ATTR_LABEL, c.newLabel);
            labels.relabel(c.label, c.newLabel);
            int moved = TocIndex.of(doc).retarget(c.label, c.newLabel);
            if (moved > 0) log.debug("Retargeted {} TOC entries to {}", moved, c.newLabel);
        }

        // ---------------- Positioning ----------------

        /** Parts and subparts keep their children in a nested {@code content} element. */
        private Element contentOf(Element parent) {
            Element content = Elements.child(parent, RegmlNames.CONTENT);
            return content == null ? parent : content;
        }

        /** Inserts before {@code before} if given, else right after {@code after}. */
        private void place(Element node, Element container, String before, String after, Change c) {
            String anchorLabel = before != null ? before : after;
            Element anchor = labels.get(anchorLabel);
            if (anchor == null || anchor.getParentNode() == null) {
                throw new MissingLabelException(c.label(), c.operation().xmlName,
                        (before != null ? "before" : "after") + " anchor " + anchorLabel + " not found");
            }
            if (anchor.getParentNode() != container) {
                log.debug("Anchor {} is not a direct child of the resolved parent; placing next to it", anchorLabel);
            }
            if (before != null) anchor.getParentNode().insertBefore(node, anchor);
            else Elements.insertAfter(anchor, node);
        }

        /** A TOC entry for the new node next to the entries of its nearest labeled neighbour. */
        private void addTocEntries(String label, Element node) {
            TocEntryKind kind = TocEntryKind.forNode(node);
            if (kind == null) return;
            TocIndex toc = TocIndex.of(doc);
            String designator = kind.designatorOf(node);
            String subject = kind.subjectOf(node);
            int created = 0;

            Element prev = labeledNeighbour(node, true);
            if (prev != null) {
                for (Element entry : toc.findAll(prev.getAttribute(RegmlNames.ATTR_LABEL))) {
                    TocIndex.createEntry((Element) entry.getParentNode(), label, designator, subject, entry, kind);
                    created++;
                }
            } else {
                Element next = labeledNeighbour(node, false);
                if (next == null) return;
                for (Element entry : toc.findAll(next.getAttribute(RegmlNames.ATTR_LABEL))) {
                    TocIndex.createEntryBefore((Element) entry.getParentNode(), label, designator, subject, entry, kind);
                    created++;
                }
            }
            log.debug("Created {} TOC entries for {}", created, label);
        }

        /**
         * After a move, entries for the moved subtree survive only in containers that still
         * enclose it (or travelled with it); the node is then listed next to its new
         * neighbour.
         */
        private void moveTocEntries(Element node) {
            TocIndex toc = TocIndex.of(doc);
            int removed = 0;
            for (String label : LabelIndex.labelsIn(node)) {
                for (Element entry : toc.findAll(label)) {
                    Element container = (Element) entry.getParentNode();
                    Node owner = container.getParentNode();
                    if (isSelfOrAncestor(node, container) || isSelfOrAncestor(owner, node)) continue;
                    if (TocIndex.deleteEntry(entry)) removed++;
                }
            }
            if (removed > 0) log.debug("Removed {} TOC entries left behind by the move", removed);
            addTocEntries(node.getAttribute(RegmlNames.ATTR_LABEL), node);
        }

        private Element labeledNeighbour(Element node, boolean preceding) {
            Node n = preceding ? node.getPreviousSibling() : node.getNextSibling();
            while (n != null) {
                if (n.getNodeType() == Node.ELEMENT_NODE && ((Element) n).hasAttribute(RegmlNames.ATTR_LABEL)) {
                    return (Element) n;
                }
                n = preceding ? n.getPreviousSibling() : n.getNextSibling();
            }
            return null;
        }

        // ---------------- Checks ----------------

        /** Whether {@code other} is {@code node} or one of its descendants. */
        private static boolean isSelfOrAncestor(Node node, Node other) {
            if (node == null || other == null) return false;
            return node == other
                    || (node.compareDocumentPosition(other) & Node.DOCUMENT_POSITION_CONTAINED_BY) != 0;
        }

        /** A payload that names itself must name the directive's label. */
        private static void checkPayloadLabel(Element payload, String label, Change c) {
            String own = Elements.attr(payload, RegmlNames.ATTR_LABEL);
            if (own != null && !own.equals(label)) {
                throw new ChangeApplicationException(label, c.operation().xmlName,
                        "payload is labeled " + own);
            }
        }

        /**
         * Rejects payload labels that repeat within the payload or already exist in the tree,
         * other than those in {@code replaced}, the subtree the payload takes the place of.
         */
        private void checkNewLabels(Element payload, Set<String> replaced, Change c) {
            Set<String> seen = new HashSet<>();
            for (String l : LabelIndex.labelsIn(payload)) {
                if (!seen.add(l) || (labels.contains(l) && !replaced.contains(l))) {
                    throw new DuplicateLabelException(c.label(), c.operation().xmlName,
                            "payload label " + l + " already exists");
                }
            }
        }

        // ---------------- Lookup ----------------

        /**
         * The labeled node, or the element {@code subpath} names beneath it. A subpath is
         * a slash-separated list of element names, each optionally followed by a 1-based
         * {@code [n]} index.
         */
        private Element resolve(String label, String subpath, Change c) {
            Element node = labels.get(label);
            if (node == null) {
                throw new MissingLabelException(label, c.operation().xmlName, "label not found");
            }
            if (subpath == null || subpath.trim().isEmpty()) return node;

            Element cur = node;
            for (String step : subpath.trim().split("/")) {
                if (step.isEmpty()) continue;
                String name = step;
                int index = 1;
                int bracket = step.indexOf('[');
                if (bracket > 0 && step.endsWith("]")) {
                    name = step.substring(0, bracket);
                    try {
                        index = Integer.parseInt(step.substring(bracket + 1, step.length() - 1));
                    } catch (NumberFormatException e) {
                        throw new MissingLabelException(label, c.operation().xmlName, "malformed subpath step " + step);
                    }
                }
                List<Element> matches = Elements.children(cur, name);
                if (index < 1 || index > matches.size()) {
                    throw new MissingLabelException(label, c.operation().xmlName, "subpath " + subpath + " not found");
                }
                cur = matches.get(index - 1);
            }
            return cur;
        }

        private static String labelWithSubpath(String label, String subpath) {
            return subpath == null ? label : label + " [" + subpath + "]";
        }
    }
}
