package com.symmetryvaults.core.group;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.InvalidSizeException;

import java.util.List;

/**
 * A named family of abstract permutation groups such as {@code Z_n} or {@code D_n}.
 *
 * <p>Families are discovered via Java Service Provider Interface (SPI) and are
 * addressed by symbol plus parameter, e.g. {@code Z5}, {@code D4}, {@code V4}.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.symmetryvaults.core.group.GroupFamily}
 *
 * @see GroupCatalog
 */
public interface GroupFamily {

    /**
     * Returns the group symbol used in names (e.g., "Z", "D", "S", "A", "V").
     *
     * @return uppercase symbol
     */
    String getSymbol();

    /**
     * Returns a human-readable family name for listings.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Parameters advertised by {@code list groups}.
     *
     * @return listed parameters in ascending order
     */
    List<Integer> getListedParameters();

    /**
     * Number of elements of the group with the given parameter.
     *
     * @param parameter family parameter
     * @return group order
     * @throws InvalidSizeException if the parameter is not accepted
     */
    long order(int parameter);

    /**
     * Number of points the group acts on.
     *
     * @param parameter family parameter
     * @return permutation degree
     */
    int degree(int parameter);

    /**
     * All elements of the group as permutations.
     *
     * @param parameter family parameter
     * @return elements, identity first
     * @throws InvalidSizeException if the parameter is not accepted
     */
    List<Permutation> elements(int parameter);
}
