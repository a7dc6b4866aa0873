package edu.virginia.lib.dataone.resourcemap;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;
import java.util.HashMap;
import java.util.Map;

import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.rdf.model.Literal;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.virginia.lib.dataone.RdfConstants;

/**
 * Writes an OAI-ORE resource map as RDF/XML.  Besides the relationship statements of
 * the {@link ResourceMap} the document carries the ORE scaffolding DataONE expects:
 * the resource map and aggregation nodes, the describes/aggregates links, a
 * dcterms:identifier for every aggregated object and a creator agent.
 */
public class JenaResourceMapSerializer implements ResourceMapSerializer, RdfConstants {

    final private static Logger LOGGER = LoggerFactory.getLogger(JenaResourceMapSerializer.class);

    public static final String RDF_XML = "RDF/XML";

    private String creatorName;

    public JenaResourceMapSerializer() {
        this(CLIENT_NAME);
    }

    public JenaResourceMapSerializer(String creatorName) {
        this.creatorName = creatorName;
    }

    @Override
    public byte[] serialize(ResourceMap resourceMap) throws IOException {
        final Model model = toModel(resourceMap);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        model.write(baos, RDF_XML);
        LOGGER.debug("Serialized resource map " + resourceMap.getIdentifier() + " (" + model.size() + " triples).");
        return baos.toByteArray();
    }

    Model toModel(ResourceMap resourceMap) {
        final Model model = ModelFactory.createDefaultModel();
        model.setNsPrefix("cito", CITO_NAMESPACE);
        model.setNsPrefix("ore", ORE_NAMESPACE);
        model.setNsPrefix("dcterms", DCTERMS_NAMESPACE);
        model.setNsPrefix("foaf", FOAF_NAMESPACE);

        final Resource map = model.createResource(resourceMap.getUri());
        final Resource aggregation = model.createResource(resourceMap.getAggregationUri());

        map.addProperty(model.createProperty(RDF_TYPE), model.createResource(ORE_RESOURCE_MAP));
        map.addProperty(model.createProperty(DCTERMS_IDENTIFIER), literal(model, resourceMap.getIdentifier(), XSD_STRING));
        map.addProperty(model.createProperty(DCTERMS_MODIFIED), model.createTypedLiteral(Calendar.getInstance()));
        map.addProperty(model.createProperty(ORE_DESCRIBES), aggregation);

        final Resource agent = model.createResource();
        agent.addProperty(model.createProperty(RDF_TYPE), model.createResource(DCTERMS_AGENT));
        agent.addProperty(model.createProperty(FOAF_NAME), literal(model, creatorName, XSD_STRING));
        map.addProperty(model.createProperty(DCTERMS_CREATOR), agent);

        aggregation.addProperty(model.createProperty(RDF_TYPE), model.createResource(ORE_AGGREGATION));
        aggregation.addProperty(model.createProperty(ORE_IS_DESCRIBED_BY), map);

        for (String id : resourceMap.getAggregatedIdentifiers()) {
            final Resource r = model.createResource(ResourceMap.resolve(resourceMap.getResolveBase(), id));
            r.addProperty(model.createProperty(DCTERMS_IDENTIFIER), literal(model, id, XSD_STRING));
            r.addProperty(model.createProperty(ORE_IS_AGGREGATED_BY), aggregation);
            aggregation.addProperty(model.createProperty(ORE_AGGREGATES), r);
        }

        final Map<String, Resource> blankNodes = new HashMap<String, Resource>();
        for (Statement s : resourceMap.getStatements()) {
            final Resource subject = resource(model, s.getSubject(), s.getSubjectType(), blankNodes);
            final RDFNode object;
            if (Statement.LITERAL.equals(s.getObjectType())) {
                object = literal(model, s.getObject(), s.getDataTypeURI());
            } else {
                object = resource(model, s.getObject(), s.getObjectType(), blankNodes);
            }
            model.add(subject, model.createProperty(s.getPredicate()), object);
        }
        return model;
    }

    private static Resource resource(Model model, String value, String type, Map<String, Resource> blankNodes) {
        if (Statement.BLANK.equals(type)) {
            Resource r = blankNodes.get(value);
            if (r == null) {
                r = model.createResource();
                blankNodes.put(value, r);
            }
            return r;
        }
        return model.createResource(value);
    }

    private static Literal literal(Model model, String value, String dataTypeURI) {
        if (dataTypeURI == null) {
            return model.createLiteral(value);
        }
        return model.createTypedLiteral(value, TypeMapper.getInstance().getSafeTypeByName(dataTypeURI));
    }
}
