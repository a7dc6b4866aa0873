package edu.virginia.lib.dataone.resourcemap;

/**
 * A single RDF triple along with the node types of its subject and object.  Two
 * statements are equal when every field is equal.
 */
public class Statement {

    public static final String URI = "uri";
    public static final String LITERAL = "literal";
    public static final String BLANK = "blank";

    final private String subject;

    final private String predicate;

    final private String object;

    final private String subjectType;

    final private String objectType;

    final private String dataTypeURI;

    /**
     * Creates a statement between two URIs.
     */
    public Statement(String subject, String predicate, String object) {
        this(subject, predicate, object, URI, URI, null);
    }

    /**
     * Creates a statement; a null subject or object type means "uri".
     */
    public Statement(String subject, String predicate, String object, String subjectType, String objectType,
                     String dataTypeURI) {
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
        this.subjectType = subjectType == null ? URI : subjectType;
        this.objectType = objectType == null ? URI : objectType;
        this.dataTypeURI = dataTypeURI;
    }

    public static Statement literal(String subject, String predicate, String value, String dataTypeURI) {
        return new Statement(subject, predicate, value, URI, LITERAL, dataTypeURI);
    }

    /**
     * True if the subject, predicate and object are all present.
     */
    public boolean isComplete() {
        return notEmpty(subject) && notEmpty(predicate) && notEmpty(object);
    }

    private static boolean notEmpty(String s) {
        return s != null && s.length() > 0;
    }

    public String getSubject() {
        return subject;
    }

    public String getPredicate() {
        return predicate;
    }

    public String getObject() {
        return object;
    }

    public String getSubjectType() {
        return subjectType;
    }

    public String getObjectType() {
        return objectType;
    }

    /**
     * @return the datatype of a literal object, or null
     */
    public String getDataTypeURI() {
        return dataTypeURI;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Statement)) {
            return false;
        }
        Statement other = (Statement) o;
        return equal(subject, other.subject)
                && equal(predicate, other.predicate)
                && equal(object, other.object)
                && equal(subjectType, other.subjectType)
                && equal(objectType, other.objectType)
                && equal(dataTypeURI, other.dataTypeURI);
    }

    private static boolean equal(String a, String b) {
        return a == null ? b == null : a.equals(b);
    }

    @Override
    public int hashCode() {
        int h = 17;
        h = h * 31 + (subject == null ? 0 : subject.hashCode());
        h = h * 31 + (predicate == null ? 0 : predicate.hashCode());
        h = h * 31 + (object == null ? 0 : object.hashCode());
        h = h * 31 + subjectType.hashCode();
        h = h * 31 + objectType.hashCode();
        h = h * 31 + (dataTypeURI == null ? 0 : dataTypeURI.hashCode());
        return h;
    }

    @Override
    public String toString() {
        return "<" + subject + "> <" + predicate + "> "
                + (LITERAL.equals(objectType) ? "\"" + object + "\"" + (dataTypeURI == null ? "" : "^^<" + dataTypeURI + ">") : "<" + object + ">");
    }
}
