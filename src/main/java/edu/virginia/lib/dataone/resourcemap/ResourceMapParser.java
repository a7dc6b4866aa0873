package edu.virginia.lib.dataone.resourcemap;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.Set;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.StmtIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.RdfConstants;

/**
 * Reads an existing RDF/XML resource map back into {@link Statement}s, typically so
 * that custom statements can be carried over into a new version of the map.
 */
public class ResourceMapParser {

    final private static Logger LOGGER = LoggerFactory.getLogger(ResourceMapParser.class);

    public static Set<Statement> parse(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        try {
            return parse(in);
        } finally {
            in.close();
        }
    }

    public static Set<Statement> parse(InputStream in) {
        Model model = ModelFactory.createDefaultModel();
        model.read(in, null, JenaResourceMapSerializer.RDF_XML);
        Set<Statement> statements = new LinkedHashSet<Statement>();
        StmtIterator it = model.listStatements();
        try {
            while (it.hasNext()) {
                statements.add(toStatement(it.next()));
            }
        } finally {
            it.close();
        }
        LOGGER.debug("Parsed " + statements.size() + " statements.");
        return statements;
    }

    private static Statement toStatement(org.apache.jena.rdf.model.Statement s) {
        final Resource subject = s.getSubject();
        final String subjectValue = subject.isAnon() ? subject.getId().getLabelString() : subject.getURI();
        final String subjectType = subject.isAnon() ? Statement.BLANK : Statement.URI;
        final String predicate = s.getPredicate().getURI();
        final RDFNode object = s.getObject();
        if (object.isLiteral()) {
            String dataType = object.asLiteral().getDatatypeURI();
            // plain literals come back typed as xsd:string
            if (RdfConstants.XSD_STRING.equals(dataType) || object.asLiteral().getLanguage().length() > 0) {
                dataType = null;
            }
            return new Statement(subjectValue, predicate, object.asLiteral().getLexicalForm(), subjectType,
                    Statement.LITERAL, dataType);
        } else if (object.isAnon()) {
            return new Statement(subjectValue, predicate, object.asResource().getId().getLabelString(), subjectType,
                    Statement.BLANK, null);
        } else {
            return new Statement(subjectValue, predicate, object.asResource().getURI(), subjectType, Statement.URI, null);
        }
    }
}
