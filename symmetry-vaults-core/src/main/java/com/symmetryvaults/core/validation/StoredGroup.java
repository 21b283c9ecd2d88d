package com.symmetryvaults.core.validation;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.model.SymmetrySection.AutomorphismEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The group stored in a level document, keyed by element id.
 *
 * <p>Only entries with an id, a unique valid mapping of the expected degree
 * and a unique id are kept; the symmetry check reports the rest. Products
 * are looked up by mapping, so a product outside the stored set yields null.
 */
public final class StoredGroup {

    private final List<String> ids;
    private final Map<String, Permutation> byId;
    private final Map<Permutation, String> byPermutation;

    private StoredGroup(List<String> ids, Map<String, Permutation> byId, Map<Permutation, String> byPermutation) {
        this.ids = List.copyOf(ids);
        this.byId = byId;
        this.byPermutation = byPermutation;
    }

    /**
     * Collects the usable entries of an automorphism list.
     *
     * @param entries stored automorphisms
     * @param degree expected mapping length
     * @return the stored group, possibly incomplete
     */
    public static StoredGroup from(List<AutomorphismEntry> entries, int degree) {
        List<String> ids = new ArrayList<>();
        Map<String, Permutation> byId = new HashMap<>();
        Map<Permutation, String> byPermutation = new HashMap<>();
        for (AutomorphismEntry entry : entries) {
            if (entry == null || entry.id() == null || entry.mapping() == null
                || entry.mapping().size() != degree || !Permutation.isBijection(entry.mapping())) {
                continue;
            }
            Permutation p = Permutation.of(entry.mapping());
            if (byId.containsKey(entry.id()) || byPermutation.containsKey(p)) {
                continue;
            }
            ids.add(entry.id());
            byId.put(entry.id(), p);
            byPermutation.put(p, entry.id());
        }
        return new StoredGroup(ids, byId, byPermutation);
    }

    public List<String> ids() {
        return ids;
    }

    public int order() {
        return ids.size();
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public Permutation permutation(String id) {
        return byId.get(id);
    }

    public List<Permutation> permutations() {
        return ids.stream().map(byId::get).toList();
    }

    /**
     * Id of a permutation.
     *
     * @param permutation element to look up
     * @return its id, or null if it is not stored
     */
    public String idOf(Permutation permutation) {
        return byPermutation.get(permutation);
    }

    /**
     * Product {@code a.compose(b)} by id.
     *
     * @return id of the product, or null if an operand is unknown or the product is not stored
     */
    public String multiply(String a, String b) {
        Permutation pa = byId.get(a);
        Permutation pb = byId.get(b);
        if (pa == null || pb == null) {
            return null;
        }
        return byPermutation.get(pa.compose(pb));
    }

    public String inverse(String a) {
        Permutation pa = byId.get(a);
        return pa == null ? null : byPermutation.get(pa.inverse());
    }

    public String identityId() {
        for (String id : ids) {
            if (byId.get(id).isIdentity()) {
                return id;
            }
        }
        return null;
    }

    /**
     * Whether every product of two stored elements is stored.
     *
     * @return true for a closed set
     */
    public boolean isClosed() {
        for (Permutation a : byPermutation.keySet()) {
            for (Permutation b : byPermutation.keySet()) {
                if (!byPermutation.containsKey(a.compose(b))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Ids of the elements generated by the given ids, computed on permutations.
     *
     * @param generators known generator ids
     * @return generated set, including elements not stored (reported by their cycle notation)
     */
    public Set<String> generatedBy(Collection<String> generators) {
        List<Permutation> seeds = generators.stream().map(byId::get).toList();
        Set<Permutation> generated = new LinkedHashSet<>();
        Deque<Permutation> queue = new ArrayDeque<>();
        Permutation identity = Permutation.identity(byId.values().iterator().next().size());
        generated.add(identity);
        queue.add(identity);
        while (!queue.isEmpty()) {
            Permutation x = queue.poll();
            for (Permutation g : seeds) {
                Permutation product = x.compose(g);
                if (generated.add(product)) {
                    queue.add(product);
                }
            }
        }
        Set<String> result = new LinkedHashSet<>();
        for (Permutation p : generated) {
            String id = byPermutation.get(p);
            result.add(id != null ? id : p.toCycleNotation());
        }
        return result;
    }

    /**
     * Whether the given ids form a subgroup: identity present and closed under products.
     *
     * @param elements known element ids
     * @return true for subgroups
     */
    public boolean isSubgroup(Collection<String> elements) {
        Set<String> set = new LinkedHashSet<>(elements);
        String identity = identityId();
        if (identity == null || !set.contains(identity)) {
            return false;
        }
        for (String a : set) {
            for (String b : set) {
                if (!set.contains(multiply(a, b))) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Normality of a subgroup given by ids, by conjugation {@code g h g^-1}.
     *
     * @param elements ids of a subgroup
     * @return true if every conjugate stays inside
     */
    public boolean isNormal(Collection<String> elements) {
        Set<String> set = new LinkedHashSet<>(elements);
        for (String g : ids) {
            String gInv = inverse(g);
            for (String h : set) {
                if (!set.contains(multiply(multiply(g, h), gInv))) {
                    return false;
                }
            }
        }
        return true;
    }
}
