package org.covidwatch.catalog;

import org.covidwatch.exceptions.UnknownRegionException;
import org.covidwatch.interfaces.RegionCatalog;
import org.covidwatch.model.Region;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * In-memory region catalog backed by normalized alias tables.
 * <p>
 * Lookup keys are lower-cased, accent-stripped and whitespace-collapsed, with a trailing
 * {@code *} and {@code . ' "} removed, so {@code "TAIWAN"}, {@code "Taiwan*"} and
 * {@code "taiwan"} share a key. Resolution order:
 * <ol>
 *   <li>country name or alias</li>
 *   <li>{@code "Province, Country"}</li>
 *   <li>bare province name or alias, if exactly one country has it</li>
 * </ol>
 * Immutable after {@link Builder#build()}; safe to share between threads.
 */
public final class AliasRegionCatalog implements RegionCatalog {

    private static final Pattern MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern SPACES = Pattern.compile("\\s+");
    private static final int MAX_TYPO_DISTANCE = 2;

    private final Map<String, Region> countryIndex;
    private final Map<Region, Map<String, Region>> provinceIndex;
    private final Map<String, List<Region>> bareProvinceIndex;
    private final Map<Region, List<Region>> provincesByCountry;
    /** normalized name or alias -> region, used for suggestions */
    private final Map<String, Region> allKeys;

    private AliasRegionCatalog(Builder b) {
        this.countryIndex = Map.copyOf(b.countryIndex);
        Map<Region, Map<String, Region>> pi = new HashMap<>();
        b.provinceIndex.forEach((c, m) -> pi.put(c, Map.copyOf(m)));
        this.provinceIndex = Collections.unmodifiableMap(pi);
        Map<String, List<Region>> bare = new HashMap<>();
        b.bareProvinceIndex.forEach((k, v) -> bare.put(k, List.copyOf(v)));
        this.bareProvinceIndex = Collections.unmodifiableMap(bare);
        Map<Region, List<Region>> byCountry = new LinkedHashMap<>();
        b.provincesByCountry.forEach((c, v) -> byCountry.put(c, List.copyOf(v)));
        this.provincesByCountry = Collections.unmodifiableMap(byCountry);
        this.allKeys = Collections.unmodifiableMap(new LinkedHashMap<>(b.allKeys));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Region resolve(String rawName) throws UnknownRegionException {
        String key = normalize(rawName);
        if (key.isEmpty()) {
            throw new UnknownRegionException(String.valueOf(rawName), List.of());
        }

        Region country = countryIndex.get(key);
        if (country != null) {
            return country;
        }

        int comma = rawName.lastIndexOf(',');
        if (comma > 0) {
            Region qualifiedCountry = countryIndex.get(normalize(rawName.substring(comma + 1)));
            if (qualifiedCountry != null) {
                Region p = provinceIndex.getOrDefault(qualifiedCountry, Map.of())
                        .get(normalize(rawName.substring(0, comma)));
                if (p != null) {
                    return p;
                }
            }
        }

        List<Region> provinces = bareProvinceIndex.get(key);
        if (provinces != null && provinces.size() == 1) {
            return provinces.get(0);
        }
        if (provinces != null) {
            // same province name under several countries: caller has to qualify it
            throw new UnknownRegionException(rawName, provinces);
        }
        throw new UnknownRegionException(rawName, suggest(rawName, 5));
    }

    @Override
    public Region resolveProvince(Region country, String rawProvince) throws UnknownRegionException {
        Region c = country.countryRegion();
        Region p = provinceIndex.getOrDefault(c, Map.of()).get(normalize(rawProvince));
        if (p == null) {
            throw new UnknownRegionException(rawProvince + ", " + c.country(), List.of());
        }
        return p;
    }

    @Override
    public List<Region> list(Region country) {
        Region c = country.countryRegion();
        if (!countryIndex.containsValue(c)) {
            return List.of();
        }
        List<Region> out = new ArrayList<>();
        out.add(c);
        out.addAll(provincesByCountry.getOrDefault(c, List.of()));
        return Collections.unmodifiableList(out);
    }

    @Override
    public List<Region> countries() {
        return List.copyOf(new TreeSet<>(countryIndex.values()));
    }

    /**
     * Prefix matches first, then substring matches, then names within a small edit distance.
     */
    @Override
    public List<Region> suggest(String rawName, int max) {
        String key = normalize(rawName);
        if (key.isEmpty() || max <= 0) {
            return List.of();
        }
        Set<Region> prefix = new TreeSet<>();
        Set<Region> contains = new TreeSet<>();
        Set<Region> close = new TreeSet<>();
        for (Map.Entry<String, Region> e : allKeys.entrySet()) {
            String candidate = e.getKey();
            if (candidate.startsWith(key)) {
                prefix.add(e.getValue());
            } else if (candidate.contains(key) || (key.contains(candidate) && candidate.length() > 3)) {
                contains.add(e.getValue());
            } else if (levenshtein(candidate, key) <= MAX_TYPO_DISTANCE) {
                close.add(e.getValue());
            }
        }
        Set<Region> ordered = new LinkedHashSet<>();
        ordered.addAll(prefix);
        ordered.addAll(contains);
        ordered.addAll(close);
        List<Region> out = new ArrayList<>(ordered);
        return List.copyOf(out.subList(0, Math.min(max, out.size())));
    }

    /* -------------------- helpers -------------------- */

    static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String s = Normalizer.normalize(raw, Normalizer.Form.NFD);
        s = MARKS.matcher(s).replaceAll("");
        s = s.toLowerCase(Locale.ROOT).trim();
        while (s.endsWith("*")) {
            s = s.substring(0, s.length() - 1);
        }
        s = s.replace(".", "").replace("'", "").replace("\"", "").replace('_', ' ');
        return SPACES.matcher(s).replaceAll(" ").trim();
    }

    private static int levenshtein(String a, String b) {
        if (Math.abs(a.length() - b.length()) > MAX_TYPO_DISTANCE) {
            return MAX_TYPO_DISTANCE + 1;
        }
        int[] prev = new int[b.length() + 1];
        int[] cur = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;
        for (int i = 1; i <= a.length(); i++) {
            cur[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                cur[j] = Math.min(Math.min(cur[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] t = prev; prev = cur; cur = t;
        }
        return prev[b.length()];
    }

    /**
     * Collects countries, provinces and aliases. Duplicate canonical names and aliases that
     * point at two different countries are rejected.
     */
    public static final class Builder {
        private final Map<String, Region> countryIndex = new HashMap<>();
        private final Map<Region, Map<String, Region>> provinceIndex = new HashMap<>();
        private final Map<String, List<Region>> bareProvinceIndex = new HashMap<>();
        private final Map<Region, List<Region>> provincesByCountry = new LinkedHashMap<>();
        private final Map<String, Region> allKeys = new LinkedHashMap<>();

        private Builder() {}

        public Builder country(String name, List<String> aliases) {
            Region c = Region.country(name);
            putCountryKey(normalize(name), c);
            for (String alias : aliases) {
                putCountryKey(normalize(alias), c);
            }
            provincesByCountry.putIfAbsent(c, new ArrayList<>());
            provinceIndex.putIfAbsent(c, new HashMap<>());
            return this;
        }

        public Builder country(String name) {
            return country(name, List.of());
        }

        /** The country must already be registered. */
        public Builder province(String country, String name, List<String> aliases) {
            Region c = Region.country(country);
            Map<String, Region> index = provinceIndex.get(c);
            if (index == null) {
                throw new IllegalArgumentException("province " + name + " registered before country " + country);
            }
            Region p = Region.province(country, name);
            if (index.containsKey(normalize(name))) {
                throw new IllegalArgumentException("duplicate province " + p.displayName());
            }
            provincesByCountry.get(c).add(p);
            putProvinceKey(index, normalize(name), p);
            for (String alias : aliases) {
                putProvinceKey(index, normalize(alias), p);
            }
            return this;
        }

        public Builder province(String country, String name) {
            return province(country, name, List.of());
        }

        public AliasRegionCatalog build() {
            return new AliasRegionCatalog(this);
        }

        private void putCountryKey(String key, Region c) {
            if (key.isEmpty()) {
                throw new IllegalArgumentException("blank name or alias for " + c.country());
            }
            Region existing = countryIndex.putIfAbsent(key, c);
            if (existing != null && !existing.equals(c)) {
                throw new IllegalArgumentException("alias '" + key + "' maps to both "
                        + existing.country() + " and " + c.country());
            }
            allKeys.putIfAbsent(key, c);
        }

        private void putProvinceKey(Map<String, Region> index, String key, Region p) {
            if (key.isEmpty()) {
                throw new IllegalArgumentException("blank name or alias for " + p.displayName());
            }
            index.putIfAbsent(key, p);
            List<Region> bare = bareProvinceIndex.computeIfAbsent(key, k -> new ArrayList<>());
            if (!bare.contains(p)) {
                bare.add(p);
            }
            allKeys.putIfAbsent(key + ", " + normalize(p.country()), p);
            allKeys.putIfAbsent(key, p);
        }
    }
}
