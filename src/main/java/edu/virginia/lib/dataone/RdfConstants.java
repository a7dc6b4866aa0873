package edu.virginia.lib.dataone;

/**
 * Vocabulary used when building and filtering resource maps.
 */
public interface RdfConstants {

    String CITO_NAMESPACE = "http://purl.org/spar/cito/";
    String ORE_NAMESPACE = "http://www.openarchives.org/ore/terms/";
    String DCTERMS_NAMESPACE = "http://purl.org/dc/terms/";
    String FOAF_NAMESPACE = "http://xmlns.com/foaf/0.1/";

    /**
     * The metadata object documents the target (data object, child resource map or itself).
     */
    String CITO_DOCUMENTS = CITO_NAMESPACE + "documents";

    /**
     * Inverse of cito:documents.
     */
    String CITO_IS_DOCUMENTED_BY = CITO_NAMESPACE + "isDocumentedBy";

    String ORE_AGGREGATES = ORE_NAMESPACE + "aggregates";
    String ORE_IS_AGGREGATED_BY = ORE_NAMESPACE + "isAggregatedBy";
    String ORE_DESCRIBES = ORE_NAMESPACE + "describes";
    String ORE_IS_DESCRIBED_BY = ORE_NAMESPACE + "isDescribedBy";
    String ORE_RESOURCE_MAP = ORE_NAMESPACE + "ResourceMap";
    String ORE_AGGREGATION = ORE_NAMESPACE + "Aggregation";

    String DCTERMS_IDENTIFIER = DCTERMS_NAMESPACE + "identifier";
    String DCTERMS_CREATOR = DCTERMS_NAMESPACE + "creator";
    String DCTERMS_MODIFIED = DCTERMS_NAMESPACE + "modified";
    String DCTERMS_AGENT = DCTERMS_NAMESPACE + "Agent";

    String FOAF_NAME = FOAF_NAMESPACE + "name";

    String RDF_TYPE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#type";

    String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";
    String XSD_DATE_TIME = "http://www.w3.org/2001/XMLSchema#dateTime";

    /**
     * The DataONE format identifier for ORE resource maps.
     */
    String RESOURCE_MAP_FORMAT_ID = "http://www.openarchives.org/ore/terms";

    /**
     * Suffix appended to a resource map URI to name the aggregation it describes.
     */
    String AGGREGATION_FRAGMENT = "#aggregation";

    /**
     * The foaf:name given to the creator agent of resource maps written by this tool.
     */
    String CLIENT_NAME = "DataONE Java Package Loader";

    /**
     * The foaf:name that the R client wrote into resource maps it created.
     */
    String R_CLIENT_NAME = "DataONE R Client";

    String DEFAULT_RESOLVE_BASE = "https://cn.dataone.org/cn/v2/resolve";
}
