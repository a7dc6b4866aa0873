package edu.virginia.lib.dataone.resourcemap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import edu.virginia.lib.dataone.RdfConstants;
import edu.virginia.lib.dataone.helper.HttpHelper;

/**
 * The relationship graph for one package: the resource map identifier, the identifiers
 * it aggregates and the statements relating them.  Built by {@link ResourceMapBuilder}
 * and handed to a {@link ResourceMapSerializer}.
 */
public class ResourceMap {

    public static final String RESOURCE_MAP_PREFIX = "resource_map_";

    final private String identifier;

    final private String resolveBase;

    final private Set<Statement> statements;

    final private List<String> aggregatedIdentifiers;

    ResourceMap(String identifier, String resolveBase, Set<Statement> statements, List<String> aggregatedIdentifiers) {
        this.identifier = identifier;
        this.resolveBase = resolveBase;
        this.statements = Collections.unmodifiableSet(new LinkedHashSet<Statement>(statements));
        this.aggregatedIdentifiers = Collections.unmodifiableList(new ArrayList<String>(aggregatedIdentifiers));
    }

    /**
     * Derives the resource map identifier for a package from its metadata identifier.
     * An identifier that already names a resource map is returned unchanged.
     */
    public static String identifierFor(String metadataPid) {
        if (metadataPid == null || metadataPid.length() == 0) {
            throw new IllegalArgumentException("A metadata identifier is required!");
        }
        if (metadataPid.startsWith(RESOURCE_MAP_PREFIX)) {
            return metadataPid;
        }
        return RESOURCE_MAP_PREFIX + metadataPid;
    }

    /**
     * The name the resource map is given in its system metadata.
     */
    public static String fileNameFor(String resourceMapPid) {
        return resourceMapPid.replace(':', '_') + ".xml";
    }

    /**
     * @return the dereferenceable URI of the given identifier under the resolve base
     */
    public static String resolve(String resolveBase, String identifier) {
        return resolveBase + "/" + HttpHelper.percentEncode(identifier);
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getResolveBase() {
        return resolveBase;
    }

    public String getUri() {
        return resolve(resolveBase, identifier);
    }

    public String getAggregationUri() {
        return getUri() + RdfConstants.AGGREGATION_FRAGMENT;
    }

    public Set<Statement> getStatements() {
        return statements;
    }

    public List<String> getAggregatedIdentifiers() {
        return aggregatedIdentifiers;
    }
}
