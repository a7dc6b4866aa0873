package edu.virginia.lib.dataone.helper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.net.URLEncoder;
import java.util.ArrayList;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.http.Header;
import org.apache.http.HttpResponse;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.message.BasicHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

public class HttpHelper {

    final private static Logger LOGGER = LoggerFactory.getLogger(HttpHelper.class);

    final private static int CONNECT_TIMEOUT_MS = 30000;

    final private static int SOCKET_TIMEOUT_MS = 30 * 60000;

    /**
     * Creates a client that sends the given DataONE token as a bearer token with every
     * request.  A null token yields an anonymous client.
     */
    public static CloseableHttpClient createClient(final String authToken) {
        List<Header> headers = new ArrayList<Header>();
        if (authToken != null && authToken.length() > 0) {
            headers.add(new BasicHeader("Authorization", "Bearer " + authToken));
        } else {
            LOGGER.debug("Creating an anonymous http client.");
        }
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(CONNECT_TIMEOUT_MS)
                .setSocketTimeout(SOCKET_TIMEOUT_MS)
                .build();
        return HttpClients.custom()
                .setDefaultHeaders(headers)
                .setDefaultRequestConfig(config)
                .build();
    }

    /**
     * Percent-encodes every character of the value except the RFC 3986 unreserved
     * characters (letters, digits, '-', '.', '_' and '~'), so identifiers such as
     * "urn:uuid:..." or "doi:10.5065/..." become a single path segment.
     */
    public static String percentEncode(final String value) {
        try {
            return URLEncoder.encode(value, "UTF-8")
                    .replace("+", "%20")
                    .replace("*", "%2A")
                    .replace("%7E", "~");
        } catch (UnsupportedEncodingException e) {
            throw new RuntimeException(e);
        }
    }

    public static boolean success(HttpResponse response) {
        return response.getStatusLine().getStatusCode() >= 200 && response.getStatusLine().getStatusCode() < 300;
    }

    /**
     * Parses a DataONE XML response body such as an &lt;identifier&gt; or an exception
     * document.
     */
    public static Document parseXml(InputStream is) throws IOException {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            return f.newDocumentBuilder().parse(is);
        } catch (ParserConfigurationException e) {
            throw new IOException(e);
        } catch (SAXException e) {
            throw new IOException("Unparseable XML response", e);
        }
    }
}
