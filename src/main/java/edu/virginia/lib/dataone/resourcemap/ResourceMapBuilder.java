package edu.virginia.lib.dataone.resourcemap;

import static edu.virginia.lib.dataone.RdfConstants.CITO_DOCUMENTS;
import static edu.virginia.lib.dataone.RdfConstants.CITO_IS_DOCUMENTED_BY;
import static edu.virginia.lib.dataone.RdfConstants.ORE_AGGREGATES;
import static edu.virginia.lib.dataone.RdfConstants.ORE_IS_AGGREGATED_BY;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.RdfConstants;

/**
 * Builds the statements of a package's resource map: which objects the metadata
 * documents and which child resource maps the package aggregates.
 */
public class ResourceMapBuilder {

    final private static Logger LOGGER = LoggerFactory.getLogger(ResourceMapBuilder.class);

    public ResourceMap generate(String metadataPid, Collection<String> dataPids, Collection<String> childPids) {
        return generate(metadataPid, dataPids, childPids, null, RdfConstants.DEFAULT_RESOLVE_BASE, null);
    }

    /**
     * Builds the resource map for a package.
     *
     * @param metadataPid the identifier of the package's metadata object
     * @param dataPids identifiers of the data objects, may be null or contain repeats
     * @param childPids resource map identifiers of child packages, may be null or contain repeats
     * @param extraStatements statements to add verbatim, may be null; a statement missing its
     *        subject, predicate or object is logged and skipped
     * @param resolveBase the resolve service that bare identifiers are appended to
     * @param resourceMapPid the resource map identifier, or null to derive it from the
     *        metadata identifier
     */
    public ResourceMap generate(String metadataPid, Collection<String> dataPids, Collection<String> childPids,
                                Collection<Statement> extraStatements, String resolveBase, String resourceMapPid) {
        if (metadataPid == null || metadataPid.length() == 0) {
            throw new IllegalArgumentException("A metadata identifier is required!");
        }
        if (resolveBase == null || resolveBase.length() == 0) {
            resolveBase = RdfConstants.DEFAULT_RESOLVE_BASE;
        } else if (resolveBase.endsWith("/")) {
            resolveBase = resolveBase.substring(0, resolveBase.length() - 1);
        }
        if (resourceMapPid == null) {
            LOGGER.debug("Deriving the resource map identifier from metadata identifier " + metadataPid + ".");
            resourceMapPid = ResourceMap.identifierFor(metadataPid);
        } else if (resourceMapPid.length() == 0) {
            throw new IllegalArgumentException("The resource map identifier may not be empty!");
        }

        final Set<String> data = unique(dataPids, "data");
        final Set<String> children = unique(childPids, "child");

        final String metadataUri = ResourceMap.resolve(resolveBase, metadataPid);
        final String aggregationUri = ResourceMap.resolve(resolveBase, resourceMapPid) + RdfConstants.AGGREGATION_FRAGMENT;

        final Set<Statement> statements = new LinkedHashSet<Statement>();

        // the metadata documents itself so that metadata-only packages are still indexed
        statements.add(new Statement(metadataUri, CITO_DOCUMENTS, metadataUri));
        statements.add(new Statement(metadataUri, CITO_IS_DOCUMENTED_BY, metadataUri));

        for (String dataPid : data) {
            final String dataUri = ResourceMap.resolve(resolveBase, dataPid);
            statements.add(new Statement(metadataUri, CITO_DOCUMENTS, dataUri));
            statements.add(new Statement(dataUri, CITO_IS_DOCUMENTED_BY, metadataUri));
        }

        for (String childPid : children) {
            final String childUri = ResourceMap.resolve(resolveBase, childPid);
            statements.add(new Statement(aggregationUri, ORE_AGGREGATES, childUri));
            statements.add(new Statement(childUri, ORE_IS_AGGREGATED_BY, aggregationUri));
            statements.add(new Statement(metadataUri, CITO_DOCUMENTS, childUri));
            statements.add(new Statement(childUri, CITO_IS_DOCUMENTED_BY, metadataUri));
        }

        if (extraStatements != null && !extraStatements.isEmpty()) {
            int added = 0;
            for (Statement s : extraStatements) {
                if (s == null || !s.isComplete()) {
                    LOGGER.warn("Skipping incomplete statement " + s + " while building resource map " + resourceMapPid + ".");
                    continue;
                }
                statements.add(s);
                added ++;
            }
            LOGGER.debug("Added " + added + " custom statement(s) to resource map " + resourceMapPid + ".");
        }

        final List<String> aggregated = new ArrayList<String>();
        aggregated.add(metadataPid);
        for (String id : data) {
            if (!aggregated.contains(id)) {
                aggregated.add(id);
            }
        }
        for (String id : children) {
            if (!aggregated.contains(id)) {
                aggregated.add(id);
            }
        }

        return new ResourceMap(resourceMapPid, resolveBase, statements, aggregated);
    }

    private static Set<String> unique(Collection<String> pids, String kind) {
        if (pids == null) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<String>();
        for (String pid : pids) {
            if (pid == null || pid.length() == 0) {
                throw new IllegalArgumentException("Empty " + kind + " identifier passed to the resource map builder!");
            }
            result.add(pid);
        }
        return result;
    }
}
