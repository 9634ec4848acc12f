package io.jenkins.infra.repository_rulesets_updater.helper;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.net.URLStreamHandlerFactory;
import java.nio.charset.StandardCharsets;

/**
 * This class manage the handling of fake url for URL creation
 */
public sealed interface URLHelper permits URLHelper.URLHelperImpl {

    /**
     * @return singleton instance of the {@link URLHelper}
     */
    static URLHelper instance() {
        return URLHelperImpl.getInstance();
    }

    /**
     * @return singleton instance of the {@link HttpUrlStreamHandler}
     */
    HttpUrlStreamHandler getURLStreamHandler();

    /**
     * Creates a connection mock answering with the given status, body and {@code link} header.
     * Request bodies are collected in a {@link ByteArrayOutputStream} returned by {@code getOutputStream()}.
     */
    static HttpURLConnection connection(int status, String reason, String body, String link) throws IOException {
        HttpURLConnection conn = mock(HttpURLConnection.class);
        when(conn.getResponseCode()).thenReturn(status);
        when(conn.getResponseMessage()).thenReturn(reason);
        when(conn.getInputStream()).thenReturn(new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
        when(conn.getOutputStream()).thenReturn(new ByteArrayOutputStream());
        when(conn.getHeaderField("link")).thenReturn(link);
        return conn;
    }

    final class URLHelperImpl implements URLHelper {
        private final HttpUrlStreamHandler httpUrlStreamHandler;

        private static URLHelper INSTANCE;

        private URLHelperImpl() {
            URLStreamHandlerFactory urlStreamHandlerFactory = mock(URLStreamHandlerFactory.class);
            httpUrlStreamHandler = new HttpUrlStreamHandler();
            when(urlStreamHandlerFactory.createURLStreamHandler("http")).thenReturn(httpUrlStreamHandler);
            when(urlStreamHandlerFactory.createURLStreamHandler("https")).thenReturn(httpUrlStreamHandler);
            URL.setURLStreamHandlerFactory(urlStreamHandlerFactory);
        }

        @Override
        public HttpUrlStreamHandler getURLStreamHandler() {
            return this.httpUrlStreamHandler;
        }

        static synchronized URLHelper getInstance() {
            if (INSTANCE == null) {
                INSTANCE = new URLHelperImpl();
            }
            return INSTANCE;
        }
    }
}
