package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.subgroup.Subgroup;
import com.symmetryvaults.core.validation.StoredGroup;
import com.symmetryvaults.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Element-list checks shared by the layer checks.
 */
final class ElementSets {

    private ElementSets() {
    }

    /**
     * Reports unknown and repeated ids in a stored element list.
     *
     * @return true if every id is a known, unique element
     */
    static boolean checkKnown(ValidationContext context, String section, int index, List<String> elements) {
        StoredGroup group = context.group();
        if (elements == null || elements.isEmpty()) {
            context.error(section, index, "elements", "non-empty element list", elements);
            return false;
        }
        boolean ok = true;
        Set<String> seen = new HashSet<>();
        for (String id : elements) {
            if (group == null || !group.contains(id)) {
                context.error(section, index, "element_exists", "known element id", id);
                ok = false;
            } else if (!seen.add(id)) {
                context.error(section, index, "unique_elements", "each element once", id);
                ok = false;
            }
        }
        return ok;
    }

    /**
     * Reports identity, Lagrange and closure failures of a known element list.
     *
     * @return true if the list is a subgroup of the stored group
     */
    static boolean checkSubgroup(ValidationContext context, String section, int index, List<String> elements) {
        StoredGroup group = context.group();
        if (group.identityId() == null) {
            return false;
        }
        boolean ok = true;
        if (group.order() % elements.size() != 0) {
            context.error(section, index, "lagrange", "order dividing " + group.order(), elements.size());
            ok = false;
        }
        if (!elements.contains(group.identityId())) {
            context.error(section, index, "identity", group.identityId(), "absent");
            return false;
        }
        if (context.groupValid() && !group.isSubgroup(elements)) {
            context.error(section, index, "closure", "closed under composition", "not closed");
            ok = false;
        }
        return ok;
    }

    /**
     * Converts an id list into a subgroup of the recomputed table.
     *
     * @return the subgroup, or null if any id cannot be placed
     */
    static Subgroup toSubgroup(ValidationContext context, List<String> elements) {
        List<Integer> indices = new ArrayList<>(elements.size());
        for (String id : elements) {
            int index = context.indexOf(id);
            if (index < 0) {
                return null;
            }
            indices.add(index);
        }
        indices.sort(null);
        if (indices.get(0) != 0) {
            return null;
        }
        return new Subgroup(indices, List.of());
    }
}
