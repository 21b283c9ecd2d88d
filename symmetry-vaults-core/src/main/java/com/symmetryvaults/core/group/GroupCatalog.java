package com.symmetryvaults.core.group;

import com.symmetryvaults.core.algebra.Permutation;
import com.symmetryvaults.core.exception.GroupTooLargeException;
import com.symmetryvaults.core.exception.UnknownGroupFamilyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Registry of {@link GroupFamily} implementations discovered via {@link ServiceLoader}.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GroupCatalog catalog = GroupCatalog.load();
 * NamedGroup d4 = catalog.resolve("D4");
 * List<Permutation> elements = catalog.generate("D4", 48);
 * }</pre>
 */
public final class GroupCatalog {

    private static final Logger log = LoggerFactory.getLogger(GroupCatalog.class);
    private static final Pattern GROUP_NAME = Pattern.compile("([A-Za-z]+)(\\d+)");

    private final Map<String, GroupFamily> families;

    public GroupCatalog(List<GroupFamily> families) {
        Map<String, GroupFamily> bySymbol = new LinkedHashMap<>();
        for (GroupFamily family : families) {
            if (bySymbol.putIfAbsent(family.getSymbol(), family) != null) {
                throw new IllegalArgumentException("Duplicate group symbol: " + family.getSymbol());
            }
        }
        this.families = Collections.unmodifiableMap(bySymbol);
    }

    /**
     * Discovers all group families registered in {@code META-INF/services}.
     *
     * @return catalog of discovered families
     */
    public static GroupCatalog load() {
        log.debug("Discovering group families via ServiceLoader");
        ServiceLoader<GroupFamily> loader = ServiceLoader.load(GroupFamily.class);
        List<GroupFamily> discovered = new ArrayList<>();
        loader.forEach(discovered::add);
        log.debug("Discovered {} group families", discovered.size());
        return new GroupCatalog(discovered);
    }

    public List<GroupFamily> families() {
        return List.copyOf(families.values());
    }

    /**
     * Resolves a group name such as {@code Z5} or {@code V4}.
     *
     * @param groupName symbol followed by the family parameter
     * @return the resolved group
     * @throws UnknownGroupFamilyException if the name is malformed or the symbol is unknown
     */
    public NamedGroup resolve(String groupName) {
        if (groupName == null) {
            throw new UnknownGroupFamilyException("null");
        }
        Matcher matcher = GROUP_NAME.matcher(groupName.trim());
        if (!matcher.matches()) {
            throw new UnknownGroupFamilyException(groupName);
        }
        String symbol = matcher.group(1).toUpperCase(Locale.ROOT);
        GroupFamily family = families.get(symbol);
        if (family == null) {
            throw new UnknownGroupFamilyException(groupName);
        }
        int parameter;
        try {
            parameter = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            throw new UnknownGroupFamilyException(groupName);
        }
        return new NamedGroup(symbol + parameter, family, parameter);
    }

    /**
     * Generates all elements of a named group, refusing groups above the order ceiling.
     *
     * @param groupName group name
     * @param maxGroupOrder largest order accepted
     * @return elements, identity first
     * @throws GroupTooLargeException if the group has more than {@code maxGroupOrder} elements
     */
    public List<Permutation> generate(String groupName, int maxGroupOrder) {
        NamedGroup group = resolve(groupName);
        long order = group.order();
        if (order > maxGroupOrder) {
            throw new GroupTooLargeException(group.name(), maxGroupOrder);
        }
        log.debug("Generating {} ({} elements on {} points)", group.name(), order, group.degree());
        return group.elements();
    }

    /**
     * A group family bound to a parameter.
     *
     * @param name canonical name, e.g. {@code D4}
     * @param family the family
     * @param parameter family parameter
     */
    public record NamedGroup(String name, GroupFamily family, int parameter) {

        public long order() {
            return family.order(parameter);
        }

        public int degree() {
            return family.degree(parameter);
        }

        public List<Permutation> elements() {
            return family.elements(parameter);
        }
    }
}
