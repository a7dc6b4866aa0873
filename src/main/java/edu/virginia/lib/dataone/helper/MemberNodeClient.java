package edu.virginia.lib.dataone.helper;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;

import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.mime.MultipartEntityBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

/**
 * A {@link RepositoryClient} for the DataONE Member Node v2 REST API.
 */
public class MemberNodeClient implements RepositoryClient, Closeable {

    final private static Logger LOGGER = LoggerFactory.getLogger(MemberNodeClient.class);

    private String baseUrl;

    private String authToken;

    private CloseableHttpClient client;

    public MemberNodeClient(final String baseUrl, final String authToken) {
        this(baseUrl, authToken, HttpHelper.createClient(authToken));
    }

    public MemberNodeClient(final String baseUrl, final String authToken, final CloseableHttpClient client) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authToken = authToken;
        this.client = client;
    }

    public MemberNodeClient(final Environment env) {
        this(env.getMemberNodeBaseUrl(), env.getAuthToken());
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public boolean isTokenExpired() {
        return TokenHelper.isExpired(authToken, System.currentTimeMillis());
    }

    @Override
    public RemoteResult<Boolean> objectExists(final String identifier) {
        HttpHead head = new HttpHead(objectUrl(identifier));
        try {
            HttpResponse r = client.execute(head);
            final int status = r.getStatusLine().getStatusCode();
            if (HttpHelper.success(r)) {
                return RemoteResult.success(Boolean.TRUE);
            } else if (status == 404) {
                return RemoteResult.success(Boolean.FALSE);
            } else {
                return RemoteResult.failure(RemoteResult.FailureKind.forStatusCode(status),
                        r.getStatusLine() + " from HEAD " + head.getURI());
            }
        } catch (IOException ex) {
            LOGGER.warn("Error checking for existence of " + identifier, ex);
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, ex.getMessage());
        } finally {
            head.releaseConnection();
        }
    }

    @Override
    public RemoteResult<String> createObject(final String identifier, final SystemMetadata sysmeta, final File content) {
        HttpPost post = new HttpPost(baseUrl + "/object");
        try {
            post.setEntity(MultipartEntityBuilder.create()
                    .addTextBody("pid", identifier, ContentType.TEXT_PLAIN.withCharset("UTF-8"))
                    .addBinaryBody("object", content, ContentType.APPLICATION_OCTET_STREAM, content.getName())
                    .addBinaryBody("sysmeta", new ByteArrayInputStream(SystemMetadataXml.toXml(sysmeta)),
                            ContentType.APPLICATION_XML, "sysmeta.xml")
                    .build());
            return executeForIdentifier(post);
        } catch (IOException ex) {
            LOGGER.warn("Error creating " + identifier, ex);
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, ex.getMessage());
        } finally {
            post.releaseConnection();
        }
    }

    @Override
    public RemoteResult<String> updateObject(final String oldIdentifier, final String newIdentifier,
                                             final SystemMetadata sysmeta, final File content) {
        HttpPut put = new HttpPut(objectUrl(oldIdentifier));
        try {
            put.setEntity(MultipartEntityBuilder.create()
                    .addTextBody("newPid", newIdentifier, ContentType.TEXT_PLAIN.withCharset("UTF-8"))
                    .addBinaryBody("object", content, ContentType.APPLICATION_OCTET_STREAM, content.getName())
                    .addBinaryBody("sysmeta", new ByteArrayInputStream(SystemMetadataXml.toXml(sysmeta)),
                            ContentType.APPLICATION_XML, "sysmeta.xml")
                    .build());
            return executeForIdentifier(put);
        } catch (IOException ex) {
            LOGGER.warn("Error updating " + oldIdentifier + " with " + newIdentifier, ex);
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, ex.getMessage());
        } finally {
            put.releaseConnection();
        }
    }

    @Override
    public RemoteResult<String> mintIdentifier(final String scheme) {
        HttpPost post = new HttpPost(baseUrl + "/generate");
        try {
            post.setEntity(MultipartEntityBuilder.create()
                    .addTextBody("scheme", scheme, ContentType.TEXT_PLAIN.withCharset("UTF-8"))
                    .build());
            return executeForIdentifier(post);
        } catch (IOException ex) {
            LOGGER.warn("Error generating an identifier with scheme " + scheme, ex);
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, ex.getMessage());
        } finally {
            post.releaseConnection();
        }
    }

    /**
     * Executes a request whose successful response is a DataONE identifier document.
     */
    private RemoteResult<String> executeForIdentifier(HttpRequestBase request) throws IOException {
        HttpResponse r = client.execute(request);
        final HttpEntity entity = r.getEntity();
        if (!HttpHelper.success(r)) {
            final String body = entity == null ? "" : EntityUtils.toString(entity, "UTF-8");
            LOGGER.debug(body);
            return RemoteResult.failure(RemoteResult.FailureKind.forStatusCode(r.getStatusLine().getStatusCode()),
                    r.getStatusLine() + " from " + request.getMethod() + " " + request.getURI());
        }
        if (entity == null) {
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, "Empty response from " + request.getURI());
        }
        final byte[] body = IOUtils.toByteArray(entity.getContent());
        Document doc = HttpHelper.parseXml(new ByteArrayInputStream(body));
        final String identifier = doc.getDocumentElement().getTextContent().trim();
        if (identifier.length() == 0) {
            return RemoteResult.failure(RemoteResult.FailureKind.TRANSIENT, "No identifier in response from " + request.getURI());
        }
        return RemoteResult.success(identifier);
    }

    private String objectUrl(final String identifier) {
        return baseUrl + "/object/" + HttpHelper.percentEncode(identifier);
    }
}
