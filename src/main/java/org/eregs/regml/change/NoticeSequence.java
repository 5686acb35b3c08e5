package org.eregs.regml.change;

import org.eregs.regml.RegmlSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolls a regulation forward through a series of notices. Each notice is applied to the
 * tree the previous one produced, so application is strictly sequential.
 */
public final class NoticeSequence {

    private static final Logger log = LoggerFactory.getLogger(NoticeSequence.class);

    private final RegmlSettings settings;

    public NoticeSequence(RegmlSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Parses every notice up front so a malformed directive is reported before anything
     * is applied.
     */
    public static List<Notice> load(List<Document> documents) {
        List<Notice> out = new ArrayList<>(documents.size());
        for (Document d : documents) out.add(Notice.from(d));
        return out;
    }

    /**
     * Application order for the notices of {@code part}: the configured custom order if
     * there is one (unlisted notices follow), otherwise effective date then document number.
     */
    public List<Notice> order(String part, List<Notice> notices) {
        List<String> custom = settings.noticeOrderFor(part);
        Comparator<Notice> byDate = Comparator
                .comparing((Notice n) -> n.effectiveDate, Comparator.nullsLast(Comparator.<String>naturalOrder()))
                .thenComparing(n -> n.documentNumber, Comparator.nullsLast(Comparator.<String>naturalOrder()));
        Comparator<Notice> cmp = byDate;
        if (!custom.isEmpty()) {
            cmp = Comparator.comparingInt((Notice n) -> {
                int i = custom.indexOf(n.documentNumber);
                return i < 0 ? Integer.MAX_VALUE : i;
            }).thenComparing(byDate);
        }
        List<Notice> sorted = new ArrayList<>(notices);
        sorted.sort(cmp);
        return sorted;
    }

    /** Every version produced, keyed by document number, in application order. */
    public Map<String, Document> applyAll(Document base, List<Notice> ordered) {
        return applyThrough(base, ordered, null);
    }

    /**
     * Applies {@code ordered} up to and including the notice numbered {@code through}
     * (all of them when null).
     *
     * @throws NoticeSequenceException naming the first notice that failed
     */
    public Map<String, Document> applyThrough(Document base, List<Notice> ordered, String through) {
        int last = ordered.size() - 1;
        if (through != null) {
            last = -1;
            for (int i = 0; i < ordered.size(); i++) {
                if (through.equals(ordered.get(i).documentNumber)) last = i;
            }
            if (last < 0) throw new IllegalArgumentException("notice " + through + " is not in the sequence");
        }

        Map<String, Document> versions = new LinkedHashMap<>();
        Document prev = base;
        String prevNumber = null;
        for (int i = 0; i <= last; i++) {
            Notice notice = ordered.get(i);
            log.info("[{}] Applying notice {} to version {}", i + 1, notice.documentNumber,
                    prevNumber == null ? notice.appliesTo : prevNumber);
            if (prevNumber != null && notice.appliesTo != null && !notice.appliesTo.equals(prevNumber)) {
                log.warn("Notice {} says it amends {}, but follows {}", notice.documentNumber, notice.appliesTo, prevNumber);
            }
            try {
                prev = ChangeProcessor.applyChanges(prev, notice, false);
            } catch (ChangeApplicationException e) {
                throw new NoticeSequenceException(notice.documentNumber, e);
            }
            versions.put(notice.documentNumber, prev);
            prevNumber = notice.documentNumber;
        }
        return versions;
    }
}
