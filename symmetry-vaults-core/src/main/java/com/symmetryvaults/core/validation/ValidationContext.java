package com.symmetryvaults.core.validation;

import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.symmetry.CayleyTable;
import com.symmetryvaults.core.symmetry.SearchLimits;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * State shared by the checks of one document: the document, the collected
 * issues, and the graph and group rebuilt from it once they have been verified.
 */
public final class ValidationContext {

    private final LevelDocument document;
    private final SearchLimits limits;
    private final List<ValidationIssue> issues = new ArrayList<>();
    private Graph graph;
    private StoredGroup group;
    private boolean groupValid;
    private CayleyTable table;

    public ValidationContext(LevelDocument document, SearchLimits limits) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.limits = Objects.requireNonNull(limits, "limits must not be null");
    }

    public LevelDocument document() {
        return document;
    }

    public String levelId() {
        return document.levelId();
    }

    public SearchLimits limits() {
        return limits;
    }

    /**
     * Graph rebuilt from the document, or null if its structure is broken.
     */
    public Graph graph() {
        return graph;
    }

    public void graph(Graph graph) {
        this.graph = graph;
    }

    /**
     * Group rebuilt from the document, or null if no usable element exists.
     */
    public StoredGroup group() {
        return group;
    }

    /**
     * Whether the stored group passed identity, uniqueness and closure checks.
     * Layer checks that recompute algebra only run on a valid group.
     */
    public boolean groupValid() {
        return groupValid;
    }

    public void group(StoredGroup group, boolean valid) {
        this.group = group;
        this.groupValid = valid;
    }

    /**
     * Cayley table recomputed from the stored group, or null unless the group is valid.
     */
    public CayleyTable table() {
        return table;
    }

    public void table(CayleyTable table) {
        this.table = table;
    }

    /**
     * Index of a stored element id in {@link #table()}, matched by mapping.
     *
     * @param id stored element id
     * @return the index, or -1 if the id is unknown or no table exists
     */
    public int indexOf(String id) {
        if (table == null || group == null || !group.contains(id)) {
            return -1;
        }
        return table.group().indexOf(group.permutation(id));
    }

    public void error(String section, Integer index, String check, Object expected, Object actual) {
        issues.add(ValidationIssue.error(levelId(), section, index, check,
            String.valueOf(expected), String.valueOf(actual)));
    }

    public void warning(String section, Integer index, String check, Object expected, Object actual) {
        issues.add(ValidationIssue.warning(levelId(), section, index, check,
            String.valueOf(expected), String.valueOf(actual)));
    }

    public List<ValidationIssue> issues() {
        return List.copyOf(issues);
    }
}
