package edu.virginia.lib.dataone.resourcemap;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import edu.virginia.lib.dataone.RdfConstants;

/**
 * Separates the custom statements of an existing resource map from the statements
 * that {@link ResourceMapBuilder} and the serializer regenerate for every version.
 */
public class PackagingStatements {

    /**
     * Returns the statements that are not packaging statements: everything except
     * cito:documents, cito:isDocumentedBy, dcterms:identifier and the foaf:name of the
     * client that wrote the map.  A null input yields an empty set.
     */
    public static Set<Statement> filter(Collection<Statement> statements) {
        Set<Statement> result = new LinkedHashSet<Statement>();
        if (statements == null) {
            return result;
        }
        for (Statement s : statements) {
            if (s != null && !isPackagingStatement(s)) {
                result.add(s);
            }
        }
        return result;
    }

    public static boolean isPackagingStatement(Statement s) {
        final String p = s.getPredicate();
        if (RdfConstants.CITO_DOCUMENTS.equals(p) || RdfConstants.CITO_IS_DOCUMENTED_BY.equals(p)
                || RdfConstants.DCTERMS_IDENTIFIER.equals(p)) {
            return true;
        }
        if (RdfConstants.FOAF_NAME.equals(p)) {
            return isClientName(s.getObject()) || isClientName(s.getSubject());
        }
        return false;
    }

    private static boolean isClientName(String value) {
        return RdfConstants.R_CLIENT_NAME.equals(value) || RdfConstants.CLIENT_NAME.equals(value);
    }
}
