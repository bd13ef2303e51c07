package com.bastion.whitelist;

import com.bastion.domain.IndicatorType;
import com.bastion.domain.WhitelistEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable predicate over one snapshot of the whitelist.
 *
 * Matching rules:
 * - ip: exact value, or the candidate (address or CIDR block) lies wholly
 *   inside an ip entry's range; a bare address entry is a single-host range
 * - domain: exact value, or the candidate is a subdomain of an entry on a
 *   dot boundary ({@code a.b.example.com} matches {@code example.com},
 *   {@code badexample.com} does not)
 * - hash, url, soar-url: exact value; url and soar-url entries cover each other
 *
 * Where several entries match, exact matches win, then the most specific
 * domain suffix, then range entries in id order.
 */
public final class WhitelistMatcher {

    private static final Logger log = LoggerFactory.getLogger(WhitelistMatcher.class);

    private final Map<String, WhitelistEntry> exact = new HashMap<>();
    private final List<RangeEntry> ranges = new ArrayList<>();
    private final int size;

    public WhitelistMatcher(List<WhitelistEntry> entries) {
        for (WhitelistEntry entry : entries) {
            if (entry.getType() == null || entry.getValue() == null) {
                continue;
            }
            exact.putIfAbsent(key(entry.getType(), entry.getValue()), entry);
            // Bare addresses join the ranges as /32 or /128 so they also cover single-host blocks
            if (entry.getType() == IndicatorType.IP) {
                try {
                    ranges.add(new RangeEntry(CidrRange.parse(entry.getValue()), entry));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping unparseable whitelist range id={} value={}: {}",
                        entry.getId(), entry.getValue(), e.getMessage());
                }
            }
        }
        this.size = entries.size();
    }

    public static WhitelistMatcher empty() {
        return new WhitelistMatcher(List.of());
    }

    public Optional<WhitelistEntry> match(String value, IndicatorType type) {
        if (value == null || type == null) {
            return Optional.empty();
        }

        WhitelistEntry direct = exact.get(key(type, value));
        if (direct != null) {
            return Optional.of(direct);
        }

        switch (type) {
            case IP:
                return matchRange(value);
            case DOMAIN:
                return matchParentDomain(value);
            default:
                return Optional.empty();
        }
    }

    public int size() {
        return size;
    }

    private Optional<WhitelistEntry> matchRange(String value) {
        if (ranges.isEmpty()) {
            return Optional.empty();
        }
        CidrRange candidate;
        try {
            candidate = CidrRange.parse(value);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        for (RangeEntry range : ranges) {
            if (range.range.contains(candidate)) {
                return Optional.of(range.entry);
            }
        }
        return Optional.empty();
    }

    private Optional<WhitelistEntry> matchParentDomain(String value) {
        int dot = value.indexOf('.');
        while (dot >= 0 && dot < value.length() - 1) {
            String parent = value.substring(dot + 1);
            WhitelistEntry entry = exact.get(key(IndicatorType.DOMAIN, parent));
            if (entry != null) {
                return Optional.of(entry);
            }
            dot = value.indexOf('.', dot + 1);
        }
        return Optional.empty();
    }

    private static String key(IndicatorType type, String value) {
        IndicatorType family = type.isUrlFamily() ? IndicatorType.URL : type;
        return family.getValue() + "|" + value;
    }

    private static final class RangeEntry {
        private final CidrRange range;
        private final WhitelistEntry entry;

        private RangeEntry(CidrRange range, WhitelistEntry entry) {
            this.range = range;
            this.entry = entry;
        }
    }
}
